package com.zenith.scalp;

import java.util.ArrayList;
import java.util.List;

import com.zenith.market.Candle;
import com.zenith.strategy.TradeSide;

/**
 * Single and two-candle confirmation patterns, evaluated at an index of the series.
 */
public final class CandlePatterns {

	private CandlePatterns() {
	}

	public static List<String> confirming(List<Candle> candles, int index, TradeSide side) {
		List<String> names = new ArrayList<>();
		if (isEngulfing(candles, index, side)) {
			names.add(side == TradeSide.LONG ? "LongEngulfing" : "ShortEngulfing");
		}
		if (side == TradeSide.LONG && isHammer(candles, index)) {
			names.add("Hammer");
		}
		if (side == TradeSide.SHORT && isShootingStar(candles, index)) {
			names.add("ShootingStar");
		}
		if (isDoji(candles, index)) {
			names.add("Doji");
		}
		String tweezer = tweezer(candles, index);
		if (tweezer != null) {
			names.add("Tweezer-" + tweezer);
		}
		if (isMarubozu(candles, index, side)) {
			names.add("Marubozu");
		}
		return names;
	}

	static boolean isEngulfing(List<Candle> candles, int index, TradeSide side) {
		Candle current = at(candles, index);
		Candle previous = at(candles, index - 1);
		if (current == null || previous == null) {
			return false;
		}
		if (side == TradeSide.LONG) {
			return bullish(current) && previous.isBearish() && current.open() <= previous.close()
					&& current.close() >= previous.open() && current.body() >= previous.body();
		}
		return current.isBearish() && bullish(previous) && current.open() >= previous.close()
				&& current.close() <= previous.open() && current.body() >= previous.body();
	}

	static boolean isHammer(List<Candle> candles, int index) {
		Candle candle = at(candles, index);
		if (candle == null || candle.range() == 0) {
			return false;
		}
		double body = candle.body();
		return lowerShadow(candle) >= body * 2 && upperShadow(candle) <= body && body / candle.range() <= 0.5;
	}

	static boolean isShootingStar(List<Candle> candles, int index) {
		Candle candle = at(candles, index);
		if (candle == null || candle.range() == 0) {
			return false;
		}
		double body = candle.body();
		return upperShadow(candle) >= body * 2 && lowerShadow(candle) <= body && body / candle.range() <= 0.5;
	}

	static boolean isDoji(List<Candle> candles, int index) {
		Candle candle = at(candles, index);
		return candle != null && candle.range() > 0 && candle.body() <= candle.range() * 0.1;
	}

	/** "top", "bottom" or null. */
	static String tweezer(List<Candle> candles, int index) {
		Candle current = at(candles, index);
		Candle previous = at(candles, index - 1);
		if (current == null || previous == null) {
			return null;
		}
		double tolerance = (current.range() + previous.range()) / 2.0 * 0.1;
		if (Math.abs(current.high() - previous.high()) <= tolerance && current.isBearish() && bullish(previous)) {
			return "top";
		}
		if (Math.abs(current.low() - previous.low()) <= tolerance && bullish(current) && previous.isBearish()) {
			return "bottom";
		}
		return null;
	}

	static boolean isMarubozu(List<Candle> candles, int index, TradeSide side) {
		Candle candle = at(candles, index);
		if (candle == null || candle.range() == 0 || candle.body() / candle.range() < 0.8) {
			return false;
		}
		return side == TradeSide.LONG ? bullish(candle) : candle.isBearish();
	}

	// an unchanged close counts as bullish here
	private static boolean bullish(Candle candle) {
		return candle.close() >= candle.open();
	}

	private static double upperShadow(Candle candle) {
		return candle.high() - Math.max(candle.open(), candle.close());
	}

	private static double lowerShadow(Candle candle) {
		return Math.min(candle.open(), candle.close()) - candle.low();
	}

	private static Candle at(List<Candle> candles, int index) {
		return index >= 0 && index < candles.size() ? candles.get(index) : null;
	}
}
