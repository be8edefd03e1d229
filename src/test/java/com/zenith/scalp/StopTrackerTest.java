package com.zenith.scalp;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import com.zenith.market.Candle;
import com.zenith.strategy.TradeSide;

class StopTrackerTest {

	private final StopTracker tracker = new StopTracker();

	@Test
	void stopStaysPutBeforeTp1() {
		tracker.track(plan(TradeSide.LONG, 100, 98, 104.0));

		StopTracker.Update update = tracker.update("BTCUSDT", bar(100.5, 103.0, 99.0, 102.5), 0.5).orElseThrow();

		assertThat(update.breached()).isFalse();
		assertThat(update.state().tp1Hit()).isFalse();
		assertThat(update.state().stop()).isEqualTo(98.0);
	}

	@Test
	void tp1MovesLongStopToBreakevenThenTrails() {
		tracker.track(plan(TradeSide.LONG, 100, 98, 104.0));

		StopTracker.Update first = tracker.update("BTCUSDT", bar(102, 104.5, 101.5, 101.0), 0.5).orElseThrow();
		assertThat(first.state().tp1Hit()).isTrue();
		assertThat(first.state().stop()).isEqualTo(100.0);

		StopTracker.Update second = tracker.update("BTCUSDT", bar(104, 106.5, 103.5, 106.0), 0.5).orElseThrow();
		assertThat(second.state().stop()).isEqualTo(104.5);

		StopTracker.Update pullback = tracker.update("BTCUSDT", bar(106, 106.2, 104.8, 105.0), 0.5).orElseThrow();
		assertThat(pullback.state().stop()).isEqualTo(104.5);
	}

	@Test
	void shortStopMirrors() {
		tracker.track(plan(TradeSide.SHORT, 100, 102, 96.0));

		StopTracker.Update update = tracker.update("BTCUSDT", bar(98, 98.5, 95.5, 94.0), 0.5).orElseThrow();

		assertThat(update.state().tp1Hit()).isTrue();
		assertThat(update.state().stop()).isEqualTo(95.5);
	}

	@Test
	void breachIsReportedWithoutMovingTheStop() {
		tracker.track(plan(TradeSide.LONG, 100, 98, 104.0));

		StopTracker.Update update = tracker.update("BTCUSDT", bar(99, 104.5, 97.9, 98.5), 0.5).orElseThrow();

		assertThat(update.breached()).isTrue();
		assertThat(update.state().stop()).isEqualTo(98.0);
		assertThat(update.state().tp1Hit()).isFalse();
	}

	@Test
	void entryCandleRangeBeforeTheFillIsIgnored() {
		Candle entryBar = bar(104, 106.1, 103.9, 106.0);
		tracker.track(plan(TradeSide.LONG, 106.0, 105.31, 107.4, entryBar.openTime()));

		StopTracker.Update update = tracker.update("BTCUSDT", entryBar, 0.5).orElseThrow();

		assertThat(update.breached()).isFalse();
		assertThat(update.state().stop()).isEqualTo(105.31);
	}

	@Test
	void entryCandleLowDoesNotMarkShortTp1() {
		Candle entryBar = bar(100.5, 100.6, 97.5, 100.0);
		tracker.track(plan(TradeSide.SHORT, 100.0, 101.0, 98.0, entryBar.openTime()));

		StopTracker.Update first = tracker.update("BTCUSDT", entryBar, 0.5).orElseThrow();
		assertThat(first.state().tp1Hit()).isFalse();
		assertThat(first.state().stop()).isEqualTo(101.0);

		Candle next = ScalpFixtures.candle(2, 100.0, 100.2, 97.8, 98.5, 100);
		StopTracker.Update second = tracker.update("BTCUSDT", next, 0.5).orElseThrow();
		assertThat(second.state().tp1Hit()).isTrue();
		assertThat(second.state().stop()).isEqualTo(100.0);
	}

	@Test
	void untrackedSymbolHasNoUpdate() {
		assertThat(tracker.update("ETHUSDT", bar(1, 1, 1, 1), 0.1)).isEmpty();
	}

	@Test
	void trailNeverLoosens() {
		assertThat(StopTracker.nextStop(TradeSide.LONG, 100, 103, 101, 1, 3, true)).isEqualTo(103.0);
		assertThat(StopTracker.nextStop(TradeSide.SHORT, 100, 97, 99, 1, 3, true)).isEqualTo(97.0);
		assertThat(StopTracker.nextStop(TradeSide.LONG, 100, 98, 120, 1, 3, false)).isEqualTo(98.0);
	}

	private static ExitPlan plan(TradeSide side, double entry, double stop, Double tp1) {
		return plan(side, entry, stop, tp1, ScalpFixtures.START);
	}

	private static ExitPlan plan(TradeSide side, double entry, double stop, Double tp1, long entryCandleOpenTime) {
		return new ExitPlan("BTCUSDT", CandidateModel.BREAKOUT, side, entry, stop, tp1, null, 3.0, 150, 3,
				Instant.parse("2024-05-01T12:00:00Z"), entryCandleOpenTime);
	}

	private static Candle bar(double open, double high, double low, double close) {
		return ScalpFixtures.candle(1, open, high, low, close, 100);
	}
}
