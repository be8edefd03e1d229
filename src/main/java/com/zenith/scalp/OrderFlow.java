package com.zenith.scalp;

import com.zenith.strategy.TradeSide;

/**
 * Aggressor volume over the recent window. A bubble is a single print far above the average volume.
 */
public record OrderFlow(double buyVolume, double sellVolume, boolean bubble) {

	private static final double EPSILON = 1e-9;

	public double ratioFor(TradeSide side) {
		return side == TradeSide.LONG
				? buyVolume / Math.max(EPSILON, sellVolume)
				: sellVolume / Math.max(EPSILON, buyVolume);
	}
}
