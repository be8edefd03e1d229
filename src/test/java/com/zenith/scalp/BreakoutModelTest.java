package com.zenith.scalp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.zenith.market.Candle;

class BreakoutModelTest {

	private static final Instant LONDON = Instant.parse("2024-05-01T12:30:00Z");
	private static final VolumeProfile PROFILE = new VolumeProfile(100.0, 100.6, 99.4, List.of());
	private static final OrderFlow BUYERS = new OrderFlow(300, 100, true);

	private final ScalpProperties properties = ScalpProperties.defaults();
	private final BreakoutModel model = new BreakoutModel(new ModelSupport(properties,
			new QualityScorer(properties), new MicrostructureGate(properties)));

	@Test
	void wideBodyThroughValueAreaHighGoesLong() {
		ScalpFeatures f = features(base(ScalpFixtures.candle(29, 100.0, 101.1, 99.9, 101.0, 100)), 100.5, 100.2,
				100.0, 1.0, BUYERS);

		List<Candidate> out = model.evaluate(f, RiskGrade.NONE);

		assertEquals(1, out.size());
		Candidate candidate = out.get(0);
		assertEquals(CandidateSignal.LONG, candidate.signal());
		assertEquals(CandidateModel.BREAKOUT, candidate.model());
		assertThat(candidate.quality()).isEqualTo(0.7995, within(1e-9));
		assertThat(candidate.reasons()).contains("patterns=Marubozu", "retrace=true", "distanceATR=0.40");
		assertEquals(2.0, candidate.tpPlan().tp1RR());
	}

	@Test
	void bodyBelowOneAndHalfAverageIsIgnored() {
		ScalpFeatures f = features(base(ScalpFixtures.candle(29, 100.6, 101.0, 100.58, 101.0, 100)), 100.5, 100.2,
				100.0, 1.0, BUYERS);

		assertThat(model.evaluate(f, RiskGrade.NONE)).isEmpty();
	}

	@Test
	void breakoutWithoutRetraceIsIgnored() {
		ScalpFeatures f = features(base(ScalpFixtures.candle(29, 100.7, 101.55, 100.65, 101.5, 100)), 100.58,
				100.55, 100.52, 1.0, BUYERS);

		assertThat(model.evaluate(f, RiskGrade.NONE)).isEmpty();
	}

	@Test
	void breakoutNeedsAConfirmingPattern() {
		ScalpFeatures f = features(base(ScalpFixtures.candle(29, 100.0, 101.5, 99.9, 101.0, 100)), 100.5, 100.2,
				100.0, 1.0, BUYERS);

		assertThat(model.evaluate(f, RiskGrade.NONE)).isEmpty();
	}

	@Test
	void closeMoreThanOneAtrPastTheLevelIsLate() {
		ScalpFeatures f = features(base(ScalpFixtures.candle(29, 100.0, 101.1, 99.9, 101.0, 100)), 100.5, 100.2,
				100.0, 0.3, BUYERS);

		assertThat(model.evaluate(f, RiskGrade.NONE)).isEmpty();
	}

	@Test
	void breakoutNeedsALargePrint() {
		ScalpFeatures f = features(base(ScalpFixtures.candle(29, 100.0, 101.1, 99.9, 101.0, 100)), 100.5, 100.2,
				100.0, 1.0, new OrderFlow(300, 100, false));

		assertThat(model.evaluate(f, RiskGrade.NONE)).isEmpty();
	}

	/** Twenty-nine small bullish candles inside the value area, then the candle under test. */
	private static List<Candle> base(Candle last) {
		List<Candle> candles = new ArrayList<>();
		for (int i = 0; i < 29; i++) {
			candles.add(ScalpFixtures.candle(i, 99.8, 100.5, 99.5, 100.2, 100));
		}
		candles.add(last);
		return candles;
	}

	private static ScalpFeatures features(List<Candle> candles, double ema25, double ema50, double ema100,
			double atr, OrderFlow flow) {
		double close = candles.get(candles.size() - 1).close();
		return new ScalpFeatures("BTCUSDT", candles, close, ema25, ema50, ema100, 60.0, atr, 0.01, PROFILE,
				List.of(), 0.0, flow, ScalpFixtures.tightBook(close), TradingSession.at(LONDON),
				MarketRegime.BULLISH, 1.0, LONDON);
	}
}
