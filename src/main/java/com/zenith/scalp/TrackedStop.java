package com.zenith.scalp;

public record TrackedStop(ExitPlan plan, double stop, boolean tp1Hit) {

	public static TrackedStop initial(ExitPlan plan) {
		return new TrackedStop(plan, plan.stop(), false);
	}
}
