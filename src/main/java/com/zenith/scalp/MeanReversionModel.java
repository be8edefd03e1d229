package com.zenith.scalp;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.zenith.market.Candle;
import com.zenith.strategy.TradeSide;

/**
 * Fakeout back into the value area: the previous candle probed outside and the current close is back inside
 * with RSI near the midline. A probe above fades short, a probe below fades long.
 */
public class MeanReversionModel implements StrategyModel {

	private static final double GAP_BONUS = 0.05;

	private final ModelSupport support;

	public MeanReversionModel(ModelSupport support) {
		this.support = support;
	}

	@Override
	public CandidateModel model() {
		return CandidateModel.MEAN;
	}

	@Override
	public List<Candidate> evaluate(ScalpFeatures f, RiskGrade grade) {
		Optional<Candle> previous = f.previousCandle();
		VolumeProfile vp = f.volumeProfile();
		boolean backInside = vp.contains(f.lastCandle().close());
		boolean probedUp = previous.isPresent() && previous.get().high() > vp.vah() && backInside;
		boolean probedDown = previous.isPresent() && previous.get().low() < vp.val() && backInside;
		boolean rsiMid = f.rsi14() >= 45 && f.rsi14() <= 55;
		if (!rsiMid || !(probedUp || probedDown)) {
			return List.of();
		}
		TradeSide side = probedUp ? TradeSide.SHORT : TradeSide.LONG;
		List<String> patterns = CandlePatterns.confirming(f.candles(), f.candles().size() - 1, side);
		Optional<FairValueGap> gap = support.qualifiedGap(f, side);
		double quality = support.scorer().score(new QualityScorer.Inputs(true, f.orderFlow().ratioFor(side),
				patterns.size(), true, gap.isPresent(), support.nearValueArea(f, vp.poc())), f.session(), grade);
		if (gap.isPresent()) {
			quality = Math.min(1.0, quality + GAP_BONUS);
		}
		List<String> reasons = List.of(
				"fakeout=" + (probedUp ? "upper->in" : "lower->in"),
				String.format(Locale.ROOT, "RSI=%.1f", f.rsi14()),
				ModelSupport.flowReason(f, side),
				ModelSupport.gapReason(gap),
				ModelSupport.patternsReason(patterns));
		TakeProfitPlan plan = new TakeProfitPlan(support.properties().rrTarget(model()), null, TargetLabel.POC);
		return List.of(support.admit(f, grade, model(), side, quality, probedUp ? EntryLevel.VAH : EntryLevel.VAL,
				plan, reasons));
	}
}
