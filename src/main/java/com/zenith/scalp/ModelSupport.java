package com.zenith.scalp;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.zenith.market.Candle;
import com.zenith.strategy.TradeSide;

/**
 * Checks shared by the strategy models plus the final admission step that turns a setup into a candidate.
 */
public class ModelSupport {

	private final ScalpProperties properties;
	private final QualityScorer scorer;
	private final MicrostructureGate gate;

	public ModelSupport(ScalpProperties properties, QualityScorer scorer, MicrostructureGate gate) {
		this.properties = properties;
		this.scorer = scorer;
		this.gate = gate;
	}

	public ScalpProperties properties() {
		return properties;
	}

	public QualityScorer scorer() {
		return scorer;
	}

	boolean regimeOk(ScalpFeatures f, TradeSide side) {
		if (side == TradeSide.LONG) {
			return f.ema25() > f.ema50() && f.ema50() > f.ema100() && f.close() > f.ema25();
		}
		return f.ema25() < f.ema50() && f.ema50() < f.ema100() && f.close() < f.ema25();
	}

	boolean rsiOk(ScalpFeatures f, TradeSide side) {
		return side == TradeSide.LONG ? f.rsi14() > 50 : f.rsi14() < 50;
	}

	boolean orderFlowOk(ScalpFeatures f, TradeSide side) {
		return f.orderFlow().ratioFor(side) >= properties.resolvedOrderFlowRatioMin() || f.orderFlow().bubble();
	}

	/**
	 * The side's latest gap, present only when it is large compared with the recent average.
	 */
	Optional<FairValueGap> qualifiedGap(ScalpFeatures f, TradeSide side) {
		return f.gapFor(side)
				.filter(gap -> gap.size() >= f.fairValueGapAvgSize() * properties.resolvedFvgMinMultiple());
	}

	boolean nearValueArea(ScalpFeatures f, double price) {
		VolumeProfile vp = f.volumeProfile();
		double tolerance = f.atr22() * 0.5;
		return Math.abs(price - vp.vah()) <= tolerance
				|| Math.abs(price - vp.val()) <= tolerance
				|| Math.abs(price - vp.poc()) <= tolerance;
	}

	/** True when one of the last {@code bars} candles traded through the level. */
	static boolean touchedWithin(ScalpFeatures f, double level, int bars) {
		List<Candle> candles = f.candles();
		for (int i = Math.max(0, candles.size() - bars); i < candles.size(); i++) {
			Candle candle = candles.get(i);
			if (candle.low() <= level && candle.high() >= level) {
				return true;
			}
		}
		return false;
	}

	static double averageBody(List<Candle> candles, int period) {
		List<Candle> window = candles.subList(Math.max(0, candles.size() - period), candles.size());
		return window.stream().mapToDouble(Candle::body).average().orElse(0.0);
	}

	static int stopTicks(ScalpFeatures f) {
		return Math.max(2, (int) Math.max(1, Math.round(f.atr22() * 0.6 / f.tickSize())));
	}

	/**
	 * Attaches micro metrics and keeps the directional signal only when the gate admits it, the signal is fresh
	 * and the quality clears the model threshold.
	 */
	Candidate admit(ScalpFeatures f, RiskGrade grade, CandidateModel model, TradeSide side, double quality,
			EntryLevel entry, TakeProfitPlan tpPlan, List<String> reasons) {
		MicroSnapshot micro = f.microFor(side);
		boolean microOk = !MicrostructureGate.sessionBlocked(f.session(), grade)
				&& gate.admits(micro, gate.expectedSlippageBp(micro), grade, side);
		boolean fresh = f.signalAgeSec() <= properties.resolvedSignalStaleSec();
		boolean accepted = microOk && fresh && quality >= properties.qualityThreshold(model);
		List<String> all = new ArrayList<>(reasons);
		all.add(String.format(Locale.ROOT, "signalFresh=%.1fs", f.signalAgeSec()));
		all.add("microOk=" + microOk);
		return new Candidate(accepted ? CandidateSignal.of(side) : CandidateSignal.NONE, model, quality, entry,
				StopHint.swing(stopTicks(f)), tpPlan, micro, all);
	}

	static String patternsReason(List<String> patterns) {
		return "patterns=" + (patterns.isEmpty() ? "none" : String.join(",", patterns));
	}

	static String flowReason(ScalpFeatures f, TradeSide side) {
		return String.format(Locale.ROOT, "ofRatio=%.2f bubble=%s", f.orderFlow().ratioFor(side),
				f.orderFlow().bubble());
	}

	static String gapReason(Optional<FairValueGap> gap) {
		return gap.map(value -> String.format(Locale.ROOT, "fvgSize=%.4f ok", value.size())).orElse("fvg weak");
	}
}
