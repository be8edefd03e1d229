package com.zenith.scalp;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.zenith.market.Candle;
import com.zenith.strategy.TradeSide;

/**
 * Close through the value-area edge on a wide body, confirmed by aggressive flow, a retrace into a nearby
 * level and at least one candle pattern.
 */
public class BreakoutModel implements StrategyModel {

	private final ModelSupport support;

	public BreakoutModel(ModelSupport support) {
		this.support = support;
	}

	@Override
	public CandidateModel model() {
		return CandidateModel.BREAKOUT;
	}

	@Override
	public List<Candidate> evaluate(ScalpFeatures f, RiskGrade grade) {
		List<Candidate> out = new ArrayList<>();
		for (TradeSide side : TradeSide.values()) {
			evaluateSide(f, grade, side).ifPresent(out::add);
		}
		return out;
	}

	private Optional<Candidate> evaluateSide(ScalpFeatures f, RiskGrade grade, TradeSide side) {
		Candle last = f.lastCandle();
		double level = side == TradeSide.LONG ? f.volumeProfile().vah() : f.volumeProfile().val();
		double avgBody = ModelSupport.averageBody(f.candles(), 20);
		boolean beyond = side == TradeSide.LONG ? last.close() > level : last.close() < level;
		boolean strongBreak = beyond && last.body() >= avgBody * 1.5;
		boolean regimeOk = support.regimeOk(f, side);
		boolean rsiOk = support.rsiOk(f, side);
		boolean flowOk = support.orderFlowOk(f, side);
		boolean largePrint = f.orderFlow().bubble();
		Optional<FairValueGap> gap = support.qualifiedGap(f, side);
		boolean retraced = ModelSupport.touchedWithin(f, level, 2)
				|| ModelSupport.touchedWithin(f, f.ema25(), 2)
				|| ModelSupport.touchedWithin(f, f.ema50(), 3)
				|| gap.map(value -> ModelSupport.touchedWithin(f, value.mid(), 3)).orElse(false);
		List<String> patterns = CandlePatterns.confirming(f.candles(), f.candles().size() - 1, side);
		double distanceAtr = f.atr22() > 0 ? Math.abs(f.close() - level) / f.atr22() : Double.POSITIVE_INFINITY;

		if (!(regimeOk && rsiOk && strongBreak && flowOk && largePrint && retraced && !patterns.isEmpty()
				&& distanceAtr <= 1.0)) {
			return Optional.empty();
		}
		double quality = support.scorer().score(new QualityScorer.Inputs(true, f.orderFlow().ratioFor(side),
				patterns.size(), true, gap.isPresent(), support.nearValueArea(f, f.close())), f.session(), grade);
		List<String> reasons = List.of(
				"regime=true",
				String.format(Locale.ROOT, "RSI=%.1f", f.rsi14()),
				ModelSupport.flowReason(f, side),
				ModelSupport.gapReason(gap),
				ModelSupport.patternsReason(patterns),
				"retrace=true",
				String.format(Locale.ROOT, "distanceATR=%.2f", distanceAtr));
		TakeProfitPlan plan = new TakeProfitPlan(support.properties().rrTarget(model()), null, TargetLabel.NEXT_VA);
		return Optional.of(support.admit(f, grade, model(), side, Math.min(1.0, quality),
				nearestEntryLevel(f, gap), plan, reasons));
	}

	static EntryLevel nearestEntryLevel(ScalpFeatures f, Optional<FairValueGap> gap) {
		EntryLevel best = null;
		double bestDistance = Double.POSITIVE_INFINITY;
		List<Double> lvn = f.volumeProfile().lowVolumeNodes();
		double[] levels = {
				lvn.isEmpty() ? Double.NaN : lvn.get(0),
				f.volumeProfile().vah(),
				f.volumeProfile().val(),
				f.ema25(),
				f.ema50(),
				gap.map(FairValueGap::mid).orElse(Double.NaN) };
		EntryLevel[] labels = { EntryLevel.LVN, EntryLevel.VAH, EntryLevel.VAL, EntryLevel.EMA25, EntryLevel.EMA50,
				EntryLevel.FVG_EDGE };
		for (int i = 0; i < levels.length; i++) {
			if (Double.isNaN(levels[i])) {
				continue;
			}
			double distance = Math.abs(f.close() - levels[i]);
			if (distance < bestDistance) {
				bestDistance = distance;
				best = labels[i];
			}
		}
		return best == null ? EntryLevel.EMA50 : best;
	}
}
