package com.zenith.strategy;

import java.time.Instant;

public record Decision(
		String symbol,
		Bias bias,
		DecisionAction action,
		double confidence,
		Double entryPrice,
		Double exitPrice,
		String reasoning,
		DecisionSource source,
		Double localEdge,
		Double localConfidence,
		Bias localBias,
		Instant timestamp) {

	public boolean isExit() {
		return bias == Bias.FLAT || action == DecisionAction.EXIT;
	}

	public Decision withAction(DecisionAction value, String reasoningText) {
		return new Decision(symbol, bias, value, confidence, entryPrice, exitPrice, reasoningText, source, localEdge,
				localConfidence, localBias, timestamp);
	}

	public Decision withReasoning(String value) {
		return new Decision(symbol, bias, action, confidence, entryPrice, exitPrice, value, source, localEdge,
				localConfidence, localBias, timestamp);
	}

	public Decision withEntry(Double price, double confidenceValue, Instant at) {
		return new Decision(symbol, bias, action, confidenceValue, price, exitPrice, reasoning, source, localEdge,
				localConfidence, localBias, at);
	}

	public Decision withLocalEcho(LocalSignal signal) {
		return new Decision(symbol, bias, action, confidence, entryPrice, exitPrice, reasoning, source,
				signal.edgeScore(), signal.confidence(), signal.bias(), timestamp);
	}
}
