package com.zenith.strategy;

import com.zenith.market.MarketMetrics;
import com.zenith.market.MarketSnapshot;

/**
 * The metrics a cached decision was made on, compared against the next tick to detect a material shift.
 */
public record ContextSnapshot(
		double change5mPct,
		double change15mPct,
		double rsi14,
		double volumeRatio,
		double edgeScore,
		double atrPct,
		Bias localBias,
		double localConfidence) {

	public static ContextSnapshot of(MarketSnapshot snapshot) {
		MarketMetrics metrics = snapshot.metrics();
		LocalSignal local = snapshot.localSignal() == null ? LocalSignal.neutral() : snapshot.localSignal();
		return new ContextSnapshot(metrics.change5mPct(), metrics.change15mPct(), metrics.rsi14(),
				metrics.volumeRatio(), local.edgeScore(), metrics.atrPct(), local.bias(), local.confidence());
	}

	/**
	 * Largest scale-normalized change across the tracked metrics and the local confidence; infinite when the
	 * local bias flipped.
	 */
	public double shiftTo(ContextSnapshot next) {
		if (localBias != null && next.localBias != null && localBias != next.localBias) {
			return Double.POSITIVE_INFINITY;
		}
		double shift = 0.0;
		shift = Math.max(shift, scaled(change5mPct, next.change5mPct, 6.0));
		shift = Math.max(shift, scaled(change15mPct, next.change15mPct, 10.0));
		shift = Math.max(shift, scaled(rsi14, next.rsi14, 100.0));
		shift = Math.max(shift, scaled(volumeRatio, next.volumeRatio, 5.0));
		shift = Math.max(shift, scaled(edgeScore, next.edgeScore, 1.0));
		shift = Math.max(shift, scaled(atrPct, next.atrPct, 5.0));
		shift = Math.max(shift, scaled(localConfidence, next.localConfidence, 1.0));
		return shift;
	}

	private static double scaled(double previous, double next, double scale) {
		if (!Double.isFinite(previous) || !Double.isFinite(next)) {
			return 0.0;
		}
		return Math.abs(next - previous) / scale;
	}
}
