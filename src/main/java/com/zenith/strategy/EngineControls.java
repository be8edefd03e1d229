package com.zenith.strategy;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operator-adjustable sizing knobs. Values are clamped on write so readers never see out-of-range settings.
 */
public class EngineControls {

	private static final Logger LOGGER = LoggerFactory.getLogger(EngineControls.class);
	static final double MIN_ALLOCATION_PCT = 1.0;
	static final double MAX_ALLOCATION_PCT = 100.0;
	static final double DEFAULT_ALLOCATION_PCT = 10.0;

	private final int minLeverage;
	private final int maxLeverage;
	private final AtomicInteger leverage;
	private final AtomicLong allocationPctBits;

	public EngineControls(int defaultLeverage, int minLeverage, int maxLeverage, double allocationPct) {
		this.minLeverage = Math.max(1, minLeverage);
		this.maxLeverage = Math.max(this.minLeverage, Math.min(125, maxLeverage));
		this.leverage = new AtomicInteger(clampLeverage(defaultLeverage));
		this.allocationPctBits = new AtomicLong(Double.doubleToLongBits(
				clampAllocation(allocationPct > 0 ? allocationPct : DEFAULT_ALLOCATION_PCT)));
	}

	public int leverage() {
		return leverage.get();
	}

	public double allocationPct() {
		return Double.longBitsToDouble(allocationPctBits.get());
	}

	public int setLeverage(int requested) {
		int clamped = clampLeverage(requested);
		int previous = leverage.getAndSet(clamped);
		if (previous != clamped) {
			LOGGER.info("EVENT=LEVERAGE_CHANGED previous={} current={}", previous, clamped);
		}
		return clamped;
	}

	public double setAllocationPct(double requested) {
		if (!Double.isFinite(requested)) {
			throw new IllegalArgumentException("Allocation percent must be numeric");
		}
		double clamped = clampAllocation(requested);
		double previous = Double.longBitsToDouble(allocationPctBits.getAndSet(Double.doubleToLongBits(clamped)));
		if (previous != clamped) {
			LOGGER.info("EVENT=ALLOCATION_CHANGED previous={} current={}", previous, clamped);
		}
		return clamped;
	}

	private int clampLeverage(int requested) {
		return Math.max(minLeverage, Math.min(maxLeverage, requested));
	}

	private static double clampAllocation(double requested) {
		return Math.max(MIN_ALLOCATION_PCT, Math.min(MAX_ALLOCATION_PCT, requested));
	}
}
