package com.zenith.strategy;

public final class ConvictionGate {

	static final double MIN_CONFIDENCE = 0.62;
	static final double MIN_LOCAL_EDGE = 0.4;
	static final double MIN_LOCAL_CONFIDENCE = 0.55;

	private ConvictionGate() {
	}

	public static boolean passes(Decision decision) {
		if (decision.confidence() < MIN_CONFIDENCE) {
			return false;
		}
		if (decision.localEdge() == null || decision.localEdge() < MIN_LOCAL_EDGE) {
			return false;
		}
		return decision.localConfidence() == null || decision.localConfidence() >= MIN_LOCAL_CONFIDENCE;
	}
}
