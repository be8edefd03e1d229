package com.zenith.scalp;

import java.util.List;

/**
 * Event timestamps (epoch millis) inside the rolling window and the block deadline, 0 when not blocked.
 */
public record CooldownState(List<Long> stopEvents, List<Long> slippageEvents, long blockedUntil) {

	public CooldownState {
		stopEvents = List.copyOf(stopEvents);
		slippageEvents = List.copyOf(slippageEvents);
	}

	static CooldownState empty() {
		return new CooldownState(List.of(), List.of(), 0L);
	}
}
