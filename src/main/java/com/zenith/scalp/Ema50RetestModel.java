package com.zenith.scalp;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.zenith.market.Candle;
import com.zenith.strategy.TradeSide;

public class Ema50RetestModel implements StrategyModel {

	private static final int SWING_LOOKBACK = 10;

	private final ModelSupport support;

	public Ema50RetestModel(ModelSupport support) {
		this.support = support;
	}

	@Override
	public CandidateModel model() {
		return CandidateModel.EMA50;
	}

	@Override
	public List<Candidate> evaluate(ScalpFeatures f, RiskGrade grade) {
		Candle last = f.lastCandle();
		double ema50 = f.ema50();
		boolean wideBody = last.body() >= ModelSupport.averageBody(f.candles(), 20);
		boolean crossedUp = last.close() > ema50 && last.open() < ema50 && wideBody;
		boolean crossedDown = last.close() < ema50 && last.open() > ema50 && wideBody;
		boolean retraced = ModelSupport.touchedWithin(f, ema50, 3);
		if (!(crossedUp || crossedDown) || !retraced) {
			return List.of();
		}
		TradeSide side = crossedUp ? TradeSide.LONG : TradeSide.SHORT;
		boolean rsiOk = support.rsiOk(f, side);
		double swing = swingLevel(f.candles(), side);
		boolean swingBreak = side == TradeSide.LONG ? f.close() > swing : f.close() < swing;
		if (!rsiOk || !swingBreak) {
			return List.of();
		}
		List<String> patterns = CandlePatterns.confirming(f.candles(), f.candles().size() - 1, side);
		Optional<FairValueGap> gap = support.qualifiedGap(f, side);
		double quality = support.scorer().score(new QualityScorer.Inputs(true, f.orderFlow().ratioFor(side),
				patterns.size(), true, gap.isPresent(), support.nearValueArea(f, f.close())), f.session(), grade);
		List<String> reasons = List.of(
				"cross50=" + (crossedUp ? "up" : "down"),
				"retrace=true",
				ModelSupport.flowReason(f, side),
				String.format(Locale.ROOT, "RSI=%.1f", f.rsi14()),
				ModelSupport.gapReason(gap),
				"swingBreak=true");
		TakeProfitPlan plan = new TakeProfitPlan(support.properties().rrTarget(model()), null, TargetLabel.NEXT_VA);
		return List.of(support.admit(f, grade, model(), side, Math.min(1.0, quality), EntryLevel.EMA50, plan,
				reasons));
	}

	/**
	 * Extreme of the ten candles before the current one that a move in {@code side} has to clear: the high for
	 * longs, the low for shorts.
	 */
	static double swingLevel(List<Candle> candles, TradeSide side) {
		int end = candles.size() - 1;
		List<Candle> window = candles.subList(Math.max(0, end - SWING_LOOKBACK), end);
		return side == TradeSide.LONG
				? window.stream().mapToDouble(Candle::high).max().orElse(Double.NaN)
				: window.stream().mapToDouble(Candle::low).min().orElse(Double.NaN);
	}
}
