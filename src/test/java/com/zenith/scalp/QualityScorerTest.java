package com.zenith.scalp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.Random;

import org.junit.jupiter.api.Test;

class QualityScorerTest {

	private final QualityScorer scorer = new QualityScorer(ScalpProperties.defaults());

	@Test
	void fullConfluenceInLondonScoresOne() {
		QualityScorer.Inputs inputs = new QualityScorer.Inputs(true, 3.5, 3, true, true, true);

		assertThat(scorer.score(inputs, TradingSession.LONDON, RiskGrade.NONE)).isEqualTo(1.0, within(1e-9));
	}

	@Test
	void weightsAndSessionScaleCombine() {
		QualityScorer.Inputs inputs = new QualityScorer.Inputs(true, 2.2, 1, false, false, true);
		double base = 0.30 + 0.25 * 0.8 + 0.15 * 0.33 + 0.10;

		assertThat(scorer.score(inputs, TradingSession.LONDON, RiskGrade.NONE)).isEqualTo(base, within(1e-9));
		assertThat(scorer.score(inputs, TradingSession.ASIA, RiskGrade.NONE)).isEqualTo(base * 0.8, within(1e-9));
		assertThat(scorer.score(inputs, TradingSession.LONDON, RiskGrade.HIGH)).isEqualTo(base * 0.8, within(1e-9));
		assertThat(scorer.score(inputs, TradingSession.ASIA, RiskGrade.CRITICAL))
				.isEqualTo(base * 0.8 * 0.7, within(1e-9));
	}

	@Test
	void nyAndBridgeUnderCriticalShockAlwaysScoreZero() {
		Random random = new Random(11);
		for (int i = 0; i < 200; i++) {
			QualityScorer.Inputs inputs = new QualityScorer.Inputs(random.nextBoolean(), random.nextDouble() * 5,
					random.nextInt(4), random.nextBoolean(), random.nextBoolean(), random.nextBoolean());

			assertThat(scorer.score(inputs, TradingSession.NY, RiskGrade.CRITICAL)).isZero();
			assertThat(scorer.score(inputs, TradingSession.BRIDGE, RiskGrade.CRITICAL)).isZero();
		}
	}

	@Test
	void nyWeightIsClampedToOne() {
		QualityScorer.Inputs inputs = new QualityScorer.Inputs(true, 3.0, 3, true, true, true);

		assertThat(scorer.score(inputs, TradingSession.NY, RiskGrade.NONE)).isEqualTo(1.0);
	}

	@Test
	void orderFlowAndPatternSteps() {
		assertThat(QualityScorer.orderFlowScore(1.2)).isZero();
		assertThat(QualityScorer.orderFlowScore(1.5)).isEqualTo(0.5);
		assertThat(QualityScorer.orderFlowScore(2.0)).isEqualTo(0.8);
		assertThat(QualityScorer.patternScore(0)).isZero();
		assertThat(QualityScorer.patternScore(2)).isEqualTo(0.66);
		assertThat(QualityScorer.patternScore(5)).isEqualTo(1.0);
	}
}
