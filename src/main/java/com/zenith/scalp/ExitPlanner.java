package com.zenith.scalp;

import java.time.Duration;
import java.time.Instant;

import com.zenith.strategy.TradeSide;

/**
 * Initial stop and targets for a new scalp entry.
 */
public class ExitPlanner {

	private final ScalpProperties properties;

	public ExitPlanner(ScalpProperties properties) {
		this.properties = properties;
	}

	/**
	 * Stop distance is the larger of the candidate's hint and {@code max(2, round(0.6 * ATR / tick))} ticks. TP1
	 * sits at the candidate's R-multiple of that distance.
	 */
	public ExitPlan plan(ScalpFeatures features, Candidate candidate, TradeSide side, double entry, Instant now) {
		double tick = features.tickSize();
		int atrTicks = ModelSupport.stopTicks(features);
		int ticks = Math.max(candidate.stopHint().distanceTicks(), atrTicks);
		double distance = ticks * tick;
		double stop = entry - side.direction() * distance;
		double risk = Math.abs(entry - stop);
		TakeProfitPlan tp = candidate.tpPlan();
		double rr1 = tp.tp1RR() > 0 ? tp.tp1RR() : properties.rrTarget(candidate.model());
		Double tp1 = risk > 0 ? entry + side.direction() * risk * rr1 : null;
		Double tp2 = risk > 0 && tp.tp2RR() != null ? entry + side.direction() * risk * tp.tp2RR() : null;
		return new ExitPlan(features.symbol(), candidate.model(), side, entry, stop, tp1, tp2,
				properties.resolvedTrailAtrMultiple(), properties.resolvedMaxHoldSec(), properties.resolvedMaxBars(),
				now, features.lastCandle().openTime());
	}

	public static boolean shouldForceFlat(ExitPlan plan, Instant now, int barsHeld) {
		long heldSec = Duration.between(plan.openedAt(), now).getSeconds();
		return heldSec >= plan.maxHoldSec() || barsHeld >= plan.maxBars();
	}
}
