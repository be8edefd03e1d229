package com.zenith.scalp;

/**
 * Weighted candidate quality in [0,1], scaled by session and shock-risk grade.
 */
public class QualityScorer {

	private final ScalpProperties properties;

	public QualityScorer(ScalpProperties properties) {
		this.properties = properties;
	}

	public record Inputs(
			boolean regimeOk,
			double orderFlowRatio,
			int patternCount,
			boolean rsiOk,
			boolean fairValueGapOk,
			boolean volumeProfileNear) {
	}

	public double score(Inputs inputs, TradingSession session, RiskGrade grade) {
		if (session.isRestrictedUnderShock() && grade.isElevated()) {
			return 0.0;
		}
		double base = 0.30 * flag(inputs.regimeOk())
				+ 0.25 * orderFlowScore(inputs.orderFlowRatio())
				+ 0.15 * patternScore(inputs.patternCount())
				+ 0.10 * flag(inputs.rsiOk())
				+ 0.10 * flag(inputs.fairValueGapOk())
				+ 0.10 * flag(inputs.volumeProfileNear());
		base *= properties.sessionWeight(session);
		if (grade == RiskGrade.HIGH) {
			base *= 0.8;
		} else if (grade == RiskGrade.CRITICAL) {
			base *= 0.7;
		}
		return Math.max(0.0, Math.min(1.0, base));
	}

	static double orderFlowScore(double ratio) {
		if (ratio >= 3.0) {
			return 1.0;
		}
		if (ratio >= 2.0) {
			return 0.8;
		}
		if (ratio >= 1.5) {
			return 0.5;
		}
		return 0.0;
	}

	static double patternScore(int count) {
		if (count >= 3) {
			return 1.0;
		}
		if (count == 2) {
			return 0.66;
		}
		return count == 1 ? 0.33 : 0.0;
	}

	private static double flag(boolean value) {
		return value ? 1.0 : 0.0;
	}
}
