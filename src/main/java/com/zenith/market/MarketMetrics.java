package com.zenith.market;

import java.time.Instant;

public record MarketMetrics(
		double lastPrice,
		double change1mPct,
		double change5mPct,
		double change15mPct,
		double sma5,
		double sma15,
		double ema21,
		double ema55,
		double rsi14,
		double volatilityPct,
		double atrPct,
		double volumeRatio,
		double volumeChangePct,
		double volumeAccelerationPct,
		double mfi14,
		double obvSlope,
		double support,
		double resistance,
		Instant lastUpdated) {

	public MarketMetrics withLastPrice(double price) {
		return new MarketMetrics(price, change1mPct, change5mPct, change15mPct, sma5, sma15, ema21, ema55, rsi14,
				volatilityPct, atrPct, volumeRatio, volumeChangePct, volumeAccelerationPct, mfi14, obvSlope, support,
				resistance, lastUpdated);
	}
}
