package com.zenith.strategy.indicators;

/**
 * Exponential moving average seeded with the first observed value.
 */
public class EmaIndicator {

	private final int period;
	private final double alpha;
	private double value = Double.NaN;
	private int count;

	public EmaIndicator(int period) {
		if (period < 1) {
			throw new IllegalArgumentException("period must be >= 1");
		}
		this.period = period;
		this.alpha = 2.0 / (period + 1.0);
	}

	public static double of(double[] values, int period) {
		if (values.length == 0) {
			return 0.0;
		}
		EmaIndicator ema = new EmaIndicator(period);
		for (double value : values) {
			ema.update(value);
		}
		return ema.value();
	}

	public double update(double price) {
		if (Double.isNaN(price)) {
			return value;
		}
		value = Double.isNaN(value) ? price : price * alpha + value * (1.0 - alpha);
		count++;
		return value;
	}

	public boolean isReady() {
		return count >= period;
	}

	public double value() {
		return value;
	}
}
