package com.zenith.market;

/**
 * Top of book plus summed top-10 depth, with the age of the quote and the round trip it took to read it.
 */
public record BookSnapshot(
		double bestBid,
		double bestAsk,
		double bidDepth,
		double askDepth,
		long quoteAgeMs,
		long latencyMs) {

	public double mid() {
		return (bestBid + bestAsk) / 2.0;
	}

	public double spreadBp() {
		double mid = mid();
		if (!(mid > 0) || bestAsk < bestBid) {
			return Double.POSITIVE_INFINITY;
		}
		return (bestAsk - bestBid) / mid * 10_000.0;
	}
}
