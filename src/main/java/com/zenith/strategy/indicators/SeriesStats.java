package com.zenith.strategy.indicators;

import java.util.Arrays;

public final class SeriesStats {

	private SeriesStats() {
	}

	public static double percentChange(double base, double current) {
		if (!Double.isFinite(base) || base == 0.0) {
			return 0.0;
		}
		return (current - base) / base * 100.0;
	}

	/**
	 * Simple average of the last {@code period} values, or the last value when the series is shorter.
	 */
	public static double sma(double[] values, int period) {
		if (values.length == 0) {
			return 0.0;
		}
		if (values.length < period) {
			return values[values.length - 1];
		}
		double sum = 0.0;
		for (int i = values.length - period; i < values.length; i++) {
			sum += values[i];
		}
		return sum / period;
	}

	/** Sample standard deviation. */
	public static double stddev(double[] values) {
		if (values.length == 0) {
			return 0.0;
		}
		double mean = Arrays.stream(values).average().orElse(0.0);
		double squares = 0.0;
		for (double value : values) {
			squares += (value - mean) * (value - mean);
		}
		return Math.sqrt(Math.max(squares / Math.max(1, values.length - 1), 0.0));
	}

	/**
	 * Cutler-style RSI: plain average gain and loss over the last {@code period} moves.
	 */
	public static double rsi(double[] closes, int period) {
		if (closes.length <= period) {
			return 50.0;
		}
		double gains = 0.0;
		double losses = 0.0;
		for (int i = closes.length - period; i < closes.length; i++) {
			double diff = closes[i] - closes[i - 1];
			if (diff >= 0) {
				gains += diff;
			} else {
				losses -= diff;
			}
		}
		if (losses == 0.0) {
			return 100.0;
		}
		if (gains == 0.0) {
			return 0.0;
		}
		double rs = (gains / period) / (losses / period);
		return 100.0 - 100.0 / (1.0 + rs);
	}

	/** Late-half versus early-half average of the last six volumes, in percent. */
	public static double volumeAcceleration(double[] volumes) {
		if (volumes.length < 6) {
			return 0.0;
		}
		double early = (volumes[volumes.length - 6] + volumes[volumes.length - 5] + volumes[volumes.length - 4]) / 3.0;
		double late = (volumes[volumes.length - 3] + volumes[volumes.length - 2] + volumes[volumes.length - 1]) / 3.0;
		if (early == 0.0) {
			return 0.0;
		}
		return (late - early) / early * 100.0;
	}

	public static double round(double value, int digits) {
		if (!Double.isFinite(value)) {
			return 0.0;
		}
		double factor = Math.pow(10, digits);
		return Math.round(value * factor) / factor;
	}

	public static double clamp(double value, double min, double max) {
		return Math.max(min, Math.min(max, value));
	}
}
