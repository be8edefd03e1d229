package com.zenith.scalp;

public record TakeProfitPlan(double tp1RR, Double tp2RR, TargetLabel target) {

	public TakeProfitPlan withTp1RR(double value) {
		return new TakeProfitPlan(value, tp2RR, target);
	}
}
