package com.zenith.scalp;

public enum MarketRegime {
	BULLISH,
	BEARISH,
	RANGE;

	static MarketRegime fromEmaStack(double close, double ema25, double ema50, double ema100) {
		if (ema25 > ema50 && ema50 > ema100 && close > ema25) {
			return BULLISH;
		}
		if (ema25 < ema50 && ema50 < ema100 && close < ema25) {
			return BEARISH;
		}
		return RANGE;
	}
}
