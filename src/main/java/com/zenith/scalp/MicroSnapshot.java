package com.zenith.scalp;

public record MicroSnapshot(
		double spreadBp,
		long latencyMs,
		long quoteAgeMs,
		double depthBias) {
}
