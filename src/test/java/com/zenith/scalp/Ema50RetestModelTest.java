package com.zenith.scalp;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.zenith.market.Candle;
import com.zenith.strategy.TradeSide;

class Ema50RetestModelTest {

	@Test
	void swingLevelIgnoresCurrentCandle() {
		List<Candle> candles = new ArrayList<>(ScalpFixtures.trend(12, 100, 0.0));
		candles.add(ScalpFixtures.candle(12, 100, 110, 90, 105, 100));

		assertEquals(100.5, Ema50RetestModel.swingLevel(candles, TradeSide.LONG), 1e-9);
		assertEquals(99.5, Ema50RetestModel.swingLevel(candles, TradeSide.SHORT), 1e-9);
	}

	@Test
	void swingLevelLooksBackTenCandles() {
		List<Candle> candles = new ArrayList<>();
		candles.add(ScalpFixtures.candle(0, 100, 130, 70, 100, 100));
		candles.addAll(ScalpFixtures.trend(11, 100, 0.0).subList(1, 11));
		candles.add(ScalpFixtures.candle(11, 100, 101, 99, 100, 100));

		assertEquals(100.5, Ema50RetestModel.swingLevel(candles, TradeSide.LONG), 1e-9);
	}
}
