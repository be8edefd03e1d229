package com.zenith.strategy;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last resolved decision per symbol and the rule for reusing it without asking the oracle again.
 */
public class DecisionCache {

	static final double CONTEXT_SHIFT_THRESHOLD = 0.12;
	static final double FRESH_PRICE_DRIFT = 0.0012;
	static final double COOLDOWN_PRICE_DRIFT = 0.0025;

	private final Duration revalidateAfter;
	private final Duration cooldown;
	private final Map<String, DecisionCacheEntry> entries = new ConcurrentHashMap<>();

	public DecisionCache(Duration revalidateAfter, Duration cooldown) {
		this.revalidateAfter = revalidateAfter;
		this.cooldown = cooldown;
	}

	public Optional<DecisionCacheEntry> get(String symbol) {
		return Optional.ofNullable(entries.get(symbol));
	}

	public void put(String symbol, DecisionCacheEntry entry) {
		entries.put(symbol, entry);
	}

	public void evict(String symbol) {
		entries.remove(symbol);
	}

	public void clear() {
		entries.clear();
	}

	/**
	 * Names the reuse path that applies, or empty when the oracle must be asked. Only oracle-sourced entries
	 * qualify, and only while the context is stable and the local bias is unchanged.
	 */
	public Optional<String> reuseReason(DecisionCacheEntry entry, ContextSnapshot next, double price, Instant now) {
		if (entry == null || entry.source() != DecisionSource.ORACLE) {
			return Optional.empty();
		}
		if (entry.context() != null && entry.context().shiftTo(next) >= CONTEXT_SHIFT_THRESHOLD) {
			return Optional.empty();
		}
		double drift = priceDrift(entry.referencePrice(), price);
		Duration age = Duration.between(entry.timestamp(), now);
		if (drift < FRESH_PRICE_DRIFT && age.compareTo(revalidateAfter) < 0) {
			return Optional.of("Maintaining stance");
		}
		if (age.compareTo(cooldown) < 0 && drift < COOLDOWN_PRICE_DRIFT) {
			return Optional.of("Cooldown reuse");
		}
		return Optional.empty();
	}

	static double priceDrift(double cachedPrice, double price) {
		if (!(cachedPrice > 0) || !Double.isFinite(price)) {
			return Double.POSITIVE_INFINITY;
		}
		return Math.abs(price - cachedPrice) / cachedPrice;
	}
}
