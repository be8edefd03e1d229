package com.zenith.strategy.indicators;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.zenith.market.Candle;

class CandleIndicatorsTest {

	@Test
	void atrOfConstantRangesIsTheRange() {
		assertThat(CandleIndicators.atr(series(30, 0.0), 14)).isCloseTo(1.0, within(1e-9));
		assertEquals(0.0, CandleIndicators.atr(List.of(), 14));
	}

	@Test
	void moneyFlowIsOneSidedOnSteadyRise() {
		assertEquals(100.0, CandleIndicators.moneyFlowIndex(series(20, 1.0), 14));
		assertEquals(0.0, CandleIndicators.moneyFlowIndex(series(20, -1.0), 14));
		assertEquals(50.0, CandleIndicators.moneyFlowIndex(series(10, 1.0), 14));
	}

	@Test
	void onBalanceVolumeSlopeFollowsDirection() {
		assertThat(CandleIndicators.onBalanceVolumeSlope(series(20, 1.0), 10)).isCloseTo(900.0 / 1900.0,
				within(1e-9));
		assertThat(CandleIndicators.onBalanceVolumeSlope(series(20, -1.0), 10)).isNegative();
		assertEquals(0.0, CandleIndicators.onBalanceVolumeSlope(series(1, 1.0), 10));
	}

	private static List<Candle> series(int count, double step) {
		List<Candle> candles = new ArrayList<>();
		double price = 100.0;
		for (int i = 0; i < count; i++) {
			long open = i * 60_000L;
			candles.add(new Candle(open, price, price + 0.5, price - 0.5, price, 100, open + 59_999, 50));
			price += step;
		}
		return candles;
	}
}
