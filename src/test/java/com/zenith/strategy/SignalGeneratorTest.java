package com.zenith.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class SignalGeneratorTest {

	@Test
	void quietMarketIsFlat() {
		LocalSignal signal = SignalGenerator.derive(StrategyFixtures.metrics(100.0));

		assertEquals(Bias.FLAT, signal.bias());
		assertEquals(0.0, signal.edgeScore());
		assertEquals(0.4, signal.confidence());
		assertEquals("Signals mixed across indicators", signal.reasoning());
	}

	@Test
	void alignedMomentumVotesLong() {
		LocalSignal signal = SignalGenerator.derive(StrategyFixtures.metrics(100.0, 0.8, 1.5, 66.0));

		assertEquals(Bias.LONG, signal.bias());
		assertEquals(1.0, signal.edgeScore());
		assertEquals(0.87, signal.confidence());
		assertEquals(1.2, signal.longScore());
		assertEquals(0.0, signal.shortScore());
		assertEquals("Δ15m +1.5% · Δ5m +0.8% · RSI 66.0", signal.reasoning());
	}

	@Test
	void sellingPressureVotesShort() {
		LocalSignal signal = SignalGenerator.derive(StrategyFixtures.metrics(100.0, -0.8, -1.5, 30.0));

		assertEquals(Bias.SHORT, signal.bias());
		assertThat(signal.confidence()).isGreaterThan(0.8);
		assertThat(signal.reasoning()).startsWith("Δ15m -1.5%");
	}
}
