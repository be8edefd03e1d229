package com.zenith.strategy;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ConvictionGateTest {

	@Test
	void passesWithConfidenceEdgeAndLocalSupport() {
		assertTrue(ConvictionGate.passes(decision(0.62, 0.4, 0.55)));
	}

	@Test
	void lowConfidenceFails() {
		assertFalse(ConvictionGate.passes(decision(0.61, 0.9, 0.9)));
	}

	@Test
	void missingOrWeakEdgeFails() {
		assertFalse(ConvictionGate.passes(decision(0.9, null, 0.9)));
		assertFalse(ConvictionGate.passes(decision(0.9, 0.39, 0.9)));
	}

	@Test
	void weakLocalConfidenceFailsButMissingPasses() {
		assertFalse(ConvictionGate.passes(decision(0.9, 0.5, 0.5)));
		assertTrue(ConvictionGate.passes(decision(0.9, 0.5, null)));
	}

	private static Decision decision(double confidence, Double edge, Double localConfidence) {
		return new Decision("ETHUSDT", Bias.LONG, DecisionAction.ENTRY, confidence, 3000.0, null, "test",
				DecisionSource.ORACLE, edge, localConfidence, Bias.LONG, StrategyFixtures.NOW);
	}
}
