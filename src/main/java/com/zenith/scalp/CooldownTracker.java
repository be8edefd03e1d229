package com.zenith.scalp;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocks new entries on a symbol after repeated stop-outs or slippage. Two events of one kind inside the rolling
 * window start the cooldown. State is replaced, never mutated in place.
 */
public class CooldownTracker {

	private static final Logger LOGGER = LoggerFactory.getLogger(CooldownTracker.class);
	static final int EVENTS_TO_BLOCK = 2;

	private final long windowMs;
	private final long cooldownMs;
	private final Clock clock;
	private final Map<String, CooldownState> states = new ConcurrentHashMap<>();

	public CooldownTracker(long windowMs, long cooldownMs, Clock clock) {
		this.windowMs = windowMs;
		this.cooldownMs = cooldownMs;
		this.clock = clock;
	}

	public void register(String symbol, CooldownEvent event) {
		long now = clock.millis();
		CooldownState next = states.compute(symbol, (key, existing) -> {
			CooldownState state = existing == null ? CooldownState.empty() : existing;
			List<Long> stops = prune(state.stopEvents(), now);
			List<Long> slips = prune(state.slippageEvents(), now);
			List<Long> target = event == CooldownEvent.STOP ? stops : slips;
			target.add(now);
			long blockedUntil = target.size() >= EVENTS_TO_BLOCK ? now + cooldownMs : state.blockedUntil();
			return new CooldownState(stops, slips, blockedUntil);
		});
		LOGGER.info("EVENT=COOLDOWN_EVENT symbol={} type={} stops={} slips={}", symbol, event,
				next.stopEvents().size(), next.slippageEvents().size());
		if (next.blockedUntil() > now) {
			LOGGER.warn("EVENT=COOLDOWN_BLOCK symbol={} untilMs={}", symbol, next.blockedUntil());
		}
	}

	/**
	 * An expired block is cleared as a side effect.
	 */
	public boolean isBlocked(String symbol) {
		CooldownState state = states.get(symbol);
		if (state == null || state.blockedUntil() == 0L) {
			return false;
		}
		long now = clock.millis();
		if (now >= state.blockedUntil()) {
			states.computeIfPresent(symbol, (key, current) -> current.blockedUntil() <= now
					? new CooldownState(prune(current.stopEvents(), now), prune(current.slippageEvents(), now), 0L)
					: current);
			return false;
		}
		return true;
	}

	public void clear(String symbol) {
		states.remove(symbol);
	}

	public CooldownState state(String symbol) {
		CooldownState state = states.get(symbol);
		return state == null ? CooldownState.empty() : state;
	}

	private List<Long> prune(List<Long> events, long now) {
		List<Long> kept = new ArrayList<>();
		for (Long timestamp : events) {
			if (now - timestamp <= windowMs) {
				kept.add(timestamp);
			}
		}
		return kept;
	}
}
