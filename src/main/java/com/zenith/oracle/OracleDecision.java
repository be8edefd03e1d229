package com.zenith.oracle;

import com.zenith.strategy.Bias;
import com.zenith.strategy.DecisionAction;

/**
 * Parsed strategy-oracle answer. {@code action} and the prices are optional.
 */
public record OracleDecision(
		String symbol,
		Bias bias,
		double confidence,
		String reasoning,
		DecisionAction action,
		Double entryPrice,
		Double exitPrice) {
}
