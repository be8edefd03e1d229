package com.zenith.strategy.indicators;

import java.util.List;

import com.zenith.market.Candle;

public final class CandleIndicators {

	private CandleIndicators() {
	}

	/**
	 * EMA of true ranges over the most recent {@code max(period, 2)} candles.
	 */
	public static double atr(List<Candle> candles, int period) {
		if (candles.isEmpty()) {
			return 0.0;
		}
		double[] ranges = new double[candles.size()];
		for (int i = 0; i < candles.size(); i++) {
			Candle current = candles.get(i);
			double highLow = current.high() - current.low();
			if (i == 0) {
				ranges[i] = highLow;
				continue;
			}
			double previousClose = candles.get(i - 1).close();
			ranges[i] = Math.max(highLow, Math.max(Math.abs(current.high() - previousClose),
					Math.abs(current.low() - previousClose)));
		}
		int window = Math.min(ranges.length, Math.max(period, 2));
		double[] recent = new double[window];
		System.arraycopy(ranges, ranges.length - window, recent, 0, window);
		return EmaIndicator.of(recent, Math.min(period, recent.length));
	}

	public static double moneyFlowIndex(List<Candle> candles, int period) {
		if (candles.size() < period + 1) {
			return 50.0;
		}
		double positive = 0.0;
		double negative = 0.0;
		for (int i = candles.size() - period; i < candles.size(); i++) {
			double typical = typicalPrice(candles.get(i));
			double previousTypical = typicalPrice(candles.get(i - 1));
			double flow = typical * candles.get(i).volume();
			if (typical > previousTypical) {
				positive += flow;
			} else if (typical < previousTypical) {
				negative += flow;
			}
		}
		if (negative == 0.0) {
			return 100.0;
		}
		if (positive == 0.0) {
			return 0.0;
		}
		return 100.0 - 100.0 / (1.0 + positive / negative);
	}

	/**
	 * Change of on-balance volume across the lookback, normalized by the larger endpoint magnitude.
	 */
	public static double onBalanceVolumeSlope(List<Candle> candles, int lookback) {
		if (candles.size() < 2) {
			return 0.0;
		}
		double[] obv = new double[candles.size()];
		for (int i = 1; i < candles.size(); i++) {
			Candle current = candles.get(i);
			Candle previous = candles.get(i - 1);
			double delta = 0.0;
			if (current.close() > previous.close()) {
				delta = current.volume();
			} else if (current.close() < previous.close()) {
				delta = -current.volume();
			}
			obv[i] = obv[i - 1] + delta;
		}
		int window = Math.min(obv.length, Math.max(lookback, 2));
		double first = obv[obv.length - window];
		double last = obv[obv.length - 1];
		double range = Math.max(Math.max(Math.abs(first), Math.abs(last)), 1.0);
		return (last - first) / range;
	}

	private static double typicalPrice(Candle candle) {
		return (candle.high() + candle.low() + candle.close()) / 3.0;
	}
}
