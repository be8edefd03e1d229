package com.zenith.strategy;

import static com.zenith.strategy.indicators.SeriesStats.clamp;
import static com.zenith.strategy.indicators.SeriesStats.round;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.zenith.market.MarketMetrics;

/**
 * Turns derived market metrics into a weighted long/short vote. Each driver contributes a capped weight;
 * bias follows the score difference and confidence follows the edge.
 */
public final class SignalGenerator {

	static final double BIAS_THRESHOLD = 0.08;
	private static final double MIN_CONFIDENCE = 0.32;
	private static final double MAX_CONFIDENCE = 0.94;
	private static final double PENALTY_FLOOR = 0.35;

	private SignalGenerator() {
	}

	public static LocalSignal derive(MarketMetrics metrics) {
		List<Driver> longDrivers = new ArrayList<>();
		List<Driver> shortDrivers = new ArrayList<>();

		double trendSlope = metrics.ema21() - metrics.ema55();
		double trendWeight = Math.min(Math.abs(trendSlope) / Math.max(metrics.ema55(), 1.0), 0.6);
		if (trendSlope > 0) {
			longDrivers.add(new Driver(trendWeight, "EMA trend up"));
		} else if (trendSlope < 0) {
			shortDrivers.add(new Driver(trendWeight, "EMA trend down"));
		}

		double change5m = metrics.change5mPct();
		if (change5m > 0.2) {
			longDrivers.add(new Driver(Math.min(change5m / 2.0, 0.7), "Δ5m +" + fmt(change5m) + "%"));
		} else if (change5m < -0.2) {
			shortDrivers.add(new Driver(Math.min(-change5m / 2.0, 0.7), "Δ5m " + fmt(change5m) + "%"));
		}

		double change15m = metrics.change15mPct();
		if (change15m > 0.25) {
			longDrivers.add(new Driver(Math.min(change15m / 2.5, 0.6), "Δ15m +" + fmt(change15m) + "%"));
		} else if (change15m < -0.25) {
			shortDrivers.add(new Driver(Math.min(-change15m / 2.5, 0.6), "Δ15m " + fmt(change15m) + "%"));
		}

		double rsi = metrics.rsi14();
		if (rsi > 60) {
			longDrivers.add(new Driver(Math.min((rsi - 60) / 30.0, 0.45), "RSI " + round(rsi, 1)));
		} else if (rsi < 40) {
			shortDrivers.add(new Driver(Math.min((40 - rsi) / 30.0, 0.45), "RSI " + round(rsi, 1)));
		}

		double volumeRatio = metrics.volumeRatio();
		if (volumeRatio > 1.15) {
			longDrivers.add(new Driver(Math.min((volumeRatio - 1) / 1.6, 0.4), "Volume ratio " + fmt(volumeRatio)));
		} else if (volumeRatio < 0.85) {
			shortDrivers.add(new Driver(Math.min((1 - volumeRatio) / 1.6, 0.4), "Volume ratio " + fmt(volumeRatio)));
		}

		double volumeChange = metrics.volumeChangePct();
		if (volumeChange > 35) {
			longDrivers.add(new Driver(Math.min(volumeChange / 150.0, 0.3), "Volume surge " + round(volumeChange, 1) + "%"));
		} else if (volumeChange < -30) {
			shortDrivers.add(new Driver(Math.min(-volumeChange / 150.0, 0.3), "Volume drop " + round(volumeChange, 1) + "%"));
		}

		double acceleration = metrics.volumeAccelerationPct();
		if (acceleration > 40) {
			longDrivers.add(new Driver(Math.min(acceleration / 200.0, 0.22),
					"Volume acceleration " + round(acceleration, 1) + "%"));
		} else if (acceleration < -35) {
			shortDrivers.add(new Driver(Math.min(-acceleration / 200.0, 0.22),
					"Volume decel " + round(acceleration, 1) + "%"));
		}

		double mfi = metrics.mfi14();
		if (mfi > 65) {
			longDrivers.add(new Driver(Math.min((mfi - 65) / 70.0, 0.35), "MFI " + round(mfi, 1)));
		} else if (mfi < 35) {
			shortDrivers.add(new Driver(Math.min((35 - mfi) / 70.0, 0.35), "MFI " + round(mfi, 1)));
		}

		double obvSlope = metrics.obvSlope();
		if (obvSlope > 0.12) {
			longDrivers.add(new Driver(Math.min(obvSlope, 0.25), "OBV slope " + round(obvSlope * 100, 1) + "%"));
		} else if (obvSlope < -0.12) {
			shortDrivers.add(new Driver(Math.min(-obvSlope, 0.25), "OBV slope " + round(obvSlope * 100, 1) + "%"));
		}

		if (metrics.change1mPct() > 0.1 && metrics.atrPct() < 1.5) {
			longDrivers.add(new Driver(0.15, "Momentum breakout"));
		} else if (metrics.change1mPct() < -0.1 && metrics.atrPct() < 1.5) {
			shortDrivers.add(new Driver(0.15, "Momentum breakdown"));
		}

		double price = metrics.lastPrice();
		if (price >= metrics.resistance()) {
			shortDrivers.add(new Driver(0.2, "Testing resistance"));
		}
		if (price <= metrics.support()) {
			longDrivers.add(new Driver(0.2, "Testing support"));
		}

		double longScore = sum(longDrivers);
		double shortScore = sum(shortDrivers);
		double diff = longScore - shortScore;
		double edge = Math.min(1.0, Math.abs(diff) / (longScore + shortScore + 0.0001));

		Bias bias = Bias.FLAT;
		if (diff > BIAS_THRESHOLD) {
			bias = Bias.LONG;
		} else if (diff < -BIAS_THRESHOLD) {
			bias = Bias.SHORT;
		}

		double confidence = 0.4 + edge * 0.45;
		confidence += Math.min(Math.abs(change15m) / 120.0, 0.1);
		confidence += Math.min(Math.abs(change5m) / 120.0, 0.08);
		if (metrics.volatilityPct() > 1.8) {
			confidence = Math.max(PENALTY_FLOOR, confidence - 0.1);
		}
		if (bias == Bias.LONG && price >= metrics.resistance() * 0.999) {
			confidence = Math.max(PENALTY_FLOOR, confidence - 0.12);
		}
		if (bias == Bias.SHORT && price <= metrics.support() * 1.001) {
			confidence = Math.max(PENALTY_FLOOR, confidence - 0.12);
		}

		Stream<Driver> reported = switch (bias) {
			case LONG -> longDrivers.stream();
			case SHORT -> shortDrivers.stream();
			case FLAT -> Stream.concat(longDrivers.stream(), shortDrivers.stream());
		};
		String reasoning = reported
				.sorted(Comparator.comparingDouble(Driver::weight).reversed())
				.limit(3)
				.map(Driver::reason)
				.collect(Collectors.joining(" · "));
		if (reasoning.isEmpty()) {
			reasoning = "Signals mixed across indicators";
		}

		return new LocalSignal(
				bias,
				round(clamp(confidence, MIN_CONFIDENCE, MAX_CONFIDENCE), 2),
				round(edge, 2),
				reasoning,
				round(longScore, 2),
				round(shortScore, 2));
	}

	private static double sum(List<Driver> drivers) {
		return drivers.stream().mapToDouble(Driver::weight).sum();
	}

	private static String fmt(double value) {
		return Double.toString(round(value, 2));
	}

	private record Driver(double weight, String reason) {
	}
}
