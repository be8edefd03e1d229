package com.zenith.execution;

import java.time.Instant;

/**
 * What opened a position: the scalp model or decision source, the price move at entry, and when.
 */
public record StrategyMetadata(
		String origin,
		Double entryMovePct,
		Instant entryTime) {
}
