package com.zenith.market;

public record Candle(
		long openTime,
		double open,
		double high,
		double low,
		double close,
		double volume,
		long closeTime,
		double takerBuyVolume) {

	public double body() {
		return Math.abs(close - open);
	}

	public double range() {
		return high - low;
	}

	public boolean isBullish() {
		return close > open;
	}

	public boolean isBearish() {
		return close < open;
	}

	public double takerSellVolume() {
		return Math.max(0.0, volume - takerBuyVolume);
	}
}
