package com.zenith.scalp;

public record FairValueGap(boolean bullish, double from, double to, long openTime) {

	public double size() {
		return Math.abs(to - from);
	}

	public double mid() {
		return (from + to) / 2.0;
	}
}
