package com.zenith.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.zenith.market.Candle;
import com.zenith.market.MarketMetrics;
import com.zenith.market.MarketSnapshot;

class MarketSnapshotFactoryTest {

	@Test
	void risingWindowProducesPositiveMomentumAndLongSignal() {
		MarketSnapshot snapshot = MarketSnapshotFactory.fromCandles("BTCUSDT", "1m", rising(60));
		MarketMetrics metrics = snapshot.metrics();

		assertThat(snapshot.lastPrice()).isEqualTo(159.0);
		assertThat(metrics.change1mPct()).isCloseTo(1.0 / 158.0 * 100.0, within(1e-9));
		assertThat(metrics.change5mPct()).isCloseTo(5.0 / 154.0 * 100.0, within(1e-9));
		assertThat(metrics.ema21()).isGreaterThan(metrics.ema55());
		assertThat(metrics.rsi14()).isEqualTo(100.0);
		assertThat(metrics.support()).isEqualTo(128.5);
		assertThat(metrics.resistance()).isEqualTo(159.5);
		assertThat(snapshot.localSignal()).isNotNull();
		assertThat(snapshot.localSignal().bias()).isEqualTo(Bias.LONG);
		assertThat(snapshot.enrichment()).isNotNull();
	}

	@Test
	void emptyWindowIsRejected() {
		assertThatThrownBy(() -> MarketSnapshotFactory.fromCandles("BTCUSDT", "1m", List.of()))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("BTCUSDT");
	}

	private static List<Candle> rising(int count) {
		List<Candle> candles = new ArrayList<>();
		for (int i = 0; i < count; i++) {
			double close = 100.0 + i;
			long open = i * 60_000L;
			candles.add(new Candle(open, close - 1, close + 0.5, close - 1.5, close, 100 + i, open + 59_999, 60));
		}
		return candles;
	}
}
