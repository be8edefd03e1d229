package com.zenith.strategy;

import java.time.Instant;

public record DecisionCacheEntry(
		Decision decision,
		double referencePrice,
		Instant timestamp,
		ContextSnapshot context,
		DecisionSource source) {
}
