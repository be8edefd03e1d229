package com.zenith.scalp;

import java.util.ArrayList;
import java.util.List;

import com.zenith.market.Candle;

/**
 * Histogram of candle volume by price. Each candle's volume is spread evenly over the bins its range covers.
 */
public final class VolumeProfileCalculator {

	static final int DEFAULT_BINS = 48;
	static final double VALUE_AREA_SHARE = 0.70;
	private static final double LOW_VOLUME_SHARE = 0.3;

	private VolumeProfileCalculator() {
	}

	public static VolumeProfile compute(List<Candle> candles, int bins) {
		if (candles.isEmpty()) {
			throw new IllegalArgumentException("Volume profile needs at least one candle");
		}
		double low = Double.POSITIVE_INFINITY;
		double high = Double.NEGATIVE_INFINITY;
		for (Candle candle : candles) {
			low = Math.min(low, candle.low());
			high = Math.max(high, candle.high());
		}
		if (!(high > low)) {
			return new VolumeProfile(low, high, low, List.of());
		}
		int binCount = Math.max(1, bins);
		double width = (high - low) / binCount;
		double[] volume = new double[binCount];
		double total = 0.0;
		for (Candle candle : candles) {
			int from = binOf(candle.low(), low, width, binCount);
			int to = binOf(candle.high(), low, width, binCount);
			double share = candle.volume() / (to - from + 1);
			for (int i = from; i <= to; i++) {
				volume[i] += share;
			}
			total += candle.volume();
		}

		int poc = 0;
		for (int i = 1; i < binCount; i++) {
			if (volume[i] > volume[poc]) {
				poc = i;
			}
		}
		int lower = poc;
		int upper = poc;
		double covered = volume[poc];
		while (covered < total * VALUE_AREA_SHARE && (lower > 0 || upper < binCount - 1)) {
			double below = lower > 0 ? volume[lower - 1] : -1.0;
			double above = upper < binCount - 1 ? volume[upper + 1] : -1.0;
			if (above >= below) {
				covered += volume[++upper];
			} else {
				covered += volume[--lower];
			}
		}

		double mean = total / binCount;
		List<Double> lowVolumeNodes = new ArrayList<>();
		for (int i = lower; i <= upper; i++) {
			if (volume[i] < mean * LOW_VOLUME_SHARE) {
				lowVolumeNodes.add(center(i, low, width));
			}
		}
		return new VolumeProfile(center(poc, low, width), low + width * (upper + 1), low + width * lower,
				lowVolumeNodes);
	}

	private static int binOf(double price, double low, double width, int binCount) {
		int index = (int) Math.floor((price - low) / width);
		return Math.max(0, Math.min(binCount - 1, index));
	}

	private static double center(int bin, double low, double width) {
		return low + width * (bin + 0.5);
	}
}
