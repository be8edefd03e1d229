package com.zenith.scalp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.zenith.market.Candle;
import com.zenith.strategy.TradeSide;

class ExitPlannerTest {

	private static final Instant NOW = Instant.parse("2024-05-01T12:40:00Z");

	private final ExitPlanner planner = new ExitPlanner(ScalpProperties.defaults());

	@Test
	void atrDistanceWinsOverASmallerHint() {
		List<Candle> candles = ScalpFixtures.trend(40, 100, 0.1);
		ScalpFeatures features = ScalpFixtures.features(candles, 1.0, 0.1, NOW);

		ExitPlan plan = planner.plan(features, ScalpFixtures.candidate(CandidateSignal.LONG,
				CandidateModel.BREAKOUT, 0.8), TradeSide.LONG, 104.0, NOW);

		assertThat(plan.stop()).isEqualTo(103.4, within(1e-9));
		assertThat(plan.tp1()).isEqualTo(105.2, within(1e-9));
		assertThat(plan.tp2()).isNull();
		assertThat(plan.maxBars()).isEqualTo(3);
		assertThat(plan.entryCandleOpenTime()).isEqualTo(candles.get(39).openTime());
	}

	@Test
	void shortPlanSitsAboveEntry() {
		ScalpFeatures features = ScalpFixtures.features(ScalpFixtures.trend(40, 100, -0.1), 0.1, 0.1, NOW);

		ExitPlan plan = planner.plan(features, ScalpFixtures.candidate(CandidateSignal.SHORT, CandidateModel.MEAN,
				0.8), TradeSide.SHORT, 96.0, NOW);

		assertThat(plan.stop()).isEqualTo(96.4, within(1e-9));
		assertThat(plan.tp1()).isEqualTo(95.2, within(1e-9));
	}

	@Test
	void forceFlatAfterMaxHoldOrBars() {
		ExitPlan plan = new ExitPlan("BTCUSDT", CandidateModel.EMA50, TradeSide.LONG, 100, 99, 102.0, null, 3.0, 150,
				3, NOW, ScalpFixtures.START);

		assertThat(ExitPlanner.shouldForceFlat(plan, NOW.plusSeconds(149), 2)).isFalse();
		assertThat(ExitPlanner.shouldForceFlat(plan, NOW.plusSeconds(150), 0)).isTrue();
		assertThat(ExitPlanner.shouldForceFlat(plan, NOW.plusSeconds(10), 3)).isTrue();
	}
}
