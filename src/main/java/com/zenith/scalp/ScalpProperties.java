package com.zenith.scalp;

import java.util.EnumMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.zenith.strategy.TradeSide;

@Validated
@ConfigurationProperties(prefix = "scalp")
public record ScalpProperties(
		Map<CandidateModel, Double> qualityThresholds,
		double defaultQualityThreshold,
		Map<TradingSession, Double> sessionWeights,
		Map<CandidateModel, Double> rrTargets,
		double spreadCapBp,
		double slippageCapBp,
		long latencyCapMs,
		long quoteAgeCapMs,
		double depthBiasMin,
		Map<TradeSide, Double> depthBias,
		double highGradeSpreadCapBp,
		double highGradeSlippageCapBp,
		double orderFlowRatioMin,
		double fvgMinMultiple,
		double trailAtrMultiple,
		long maxHoldSec,
		int maxBars,
		double signalStaleSec,
		long cooldownWindowMs,
		long cooldownMs,
		int policyCandidates,
		double slippageFactor) {

	private static final Map<CandidateModel, Double> DEFAULT_THRESHOLDS = new EnumMap<>(Map.of(
			CandidateModel.BREAKOUT, 0.75,
			CandidateModel.MEAN, 0.70,
			CandidateModel.EMA50, 0.72));

	private static final Map<TradingSession, Double> DEFAULT_SESSION_WEIGHTS = new EnumMap<>(Map.of(
			TradingSession.ASIA, 0.8,
			TradingSession.LONDON, 1.0,
			TradingSession.NY, 1.2,
			TradingSession.BRIDGE, 0.9));

	private static final Map<CandidateModel, Double> DEFAULT_RR = new EnumMap<>(Map.of(
			CandidateModel.BREAKOUT, 2.0,
			CandidateModel.MEAN, 1.0,
			CandidateModel.EMA50, 2.0));

	/** All zero/null, so every resolver falls back to its built-in default. */
	public static ScalpProperties defaults() {
		return new ScalpProperties(null, 0, null, null, 0, 0, 0, 0, 0, null, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
	}

	public double qualityThreshold(CandidateModel model) {
		Double configured = qualityThresholds == null ? null : qualityThresholds.get(model);
		if (configured != null) {
			return configured;
		}
		Double builtIn = DEFAULT_THRESHOLDS.get(model);
		return builtIn != null ? builtIn : resolvedDefaultQualityThreshold();
	}

	public double resolvedDefaultQualityThreshold() {
		return positiveOr(defaultQualityThreshold, 0.70);
	}

	public double sessionWeight(TradingSession session) {
		Double configured = sessionWeights == null ? null : sessionWeights.get(session);
		if (configured != null) {
			return configured;
		}
		return DEFAULT_SESSION_WEIGHTS.getOrDefault(session, 1.0);
	}

	public double rrTarget(CandidateModel model) {
		Double configured = rrTargets == null ? null : rrTargets.get(model);
		if (configured != null && configured > 0) {
			return configured;
		}
		return DEFAULT_RR.getOrDefault(model, 1.0);
	}

	public double resolvedSpreadCapBp() {
		return positiveOr(spreadCapBp, 2.5);
	}

	public double resolvedSlippageCapBp() {
		return positiveOr(slippageCapBp, 3.0);
	}

	public long resolvedLatencyCapMs() {
		return latencyCapMs > 0 ? latencyCapMs : 150L;
	}

	public long resolvedQuoteAgeCapMs() {
		return quoteAgeCapMs > 0 ? quoteAgeCapMs : 200L;
	}

	public double resolvedDepthBiasMin() {
		return positiveOr(depthBiasMin, 0.8);
	}

	/**
	 * Book depth bias a side needs: bid/ask for longs, ask/bid for shorts. Sides without their own value use
	 * the shared minimum.
	 */
	public double depthBiasFor(TradeSide side) {
		Double configured = depthBias == null ? null : depthBias.get(side);
		return configured != null && configured > 0 ? configured : resolvedDepthBiasMin();
	}

	public double resolvedHighGradeSpreadCapBp() {
		return positiveOr(highGradeSpreadCapBp, 2.0);
	}

	public double resolvedHighGradeSlippageCapBp() {
		return positiveOr(highGradeSlippageCapBp, 2.5);
	}

	public double resolvedOrderFlowRatioMin() {
		return positiveOr(orderFlowRatioMin, 2.0);
	}

	public double resolvedFvgMinMultiple() {
		return positiveOr(fvgMinMultiple, 1.2);
	}

	public double resolvedTrailAtrMultiple() {
		return positiveOr(trailAtrMultiple, 3.0);
	}

	public long resolvedMaxHoldSec() {
		return maxHoldSec > 0 ? maxHoldSec : 150L;
	}

	public int resolvedMaxBars() {
		return maxBars > 0 ? maxBars : 3;
	}

	public double resolvedSignalStaleSec() {
		return positiveOr(signalStaleSec, 10.0);
	}

	public long resolvedCooldownWindowMs() {
		return cooldownWindowMs > 0 ? cooldownWindowMs : 120_000L;
	}

	public long resolvedCooldownMs() {
		return cooldownMs > 0 ? cooldownMs : 60_000L;
	}

	public int resolvedPolicyCandidates() {
		return policyCandidates > 0 ? policyCandidates : 5;
	}

	/** Expected slippage as a fraction of the quoted spread. */
	public double resolvedSlippageFactor() {
		return positiveOr(slippageFactor, 0.6);
	}

	private static double positiveOr(double value, double fallback) {
		return value > 0 ? value : fallback;
	}
}
