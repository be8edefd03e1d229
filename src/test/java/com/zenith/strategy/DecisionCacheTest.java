package com.zenith.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.Test;

class DecisionCacheTest {

	private static final Instant T0 = StrategyFixtures.NOW;
	private static final ContextSnapshot CONTEXT = new ContextSnapshot(0.2, 0.5, 55.0, 1.1, 0.5, 0.4, Bias.LONG,
			0.7);

	private final DecisionCache cache = new DecisionCache(Duration.ofMinutes(4), Duration.ofSeconds(45));

	@Test
	void freshStableEntryMaintainsStance() {
		DecisionCacheEntry entry = entry(DecisionSource.ORACLE, CONTEXT);

		assertThat(cache.reuseReason(entry, CONTEXT, 100.05, T0.plusSeconds(120))).contains("Maintaining stance");
	}

	@Test
	void widerDriftInsideCooldownIsCooldownReuse() {
		DecisionCacheEntry entry = entry(DecisionSource.ORACLE, CONTEXT);

		assertThat(cache.reuseReason(entry, CONTEXT, 100.2, T0.plusSeconds(10))).contains("Cooldown reuse");
		assertThat(cache.reuseReason(entry, CONTEXT, 100.2, T0.plusSeconds(60))).isEmpty();
		assertThat(cache.reuseReason(entry, CONTEXT, 100.3, T0.plusSeconds(10))).isEmpty();
	}

	@Test
	void staleEntryIsRevalidated() {
		DecisionCacheEntry entry = entry(DecisionSource.ORACLE, CONTEXT);

		assertThat(cache.reuseReason(entry, CONTEXT, 100.0, T0.plus(Duration.ofMinutes(5)))).isEmpty();
	}

	@Test
	void fallbackEntriesAreNeverReused() {
		DecisionCacheEntry entry = entry(DecisionSource.FALLBACK, CONTEXT);

		assertThat(cache.reuseReason(entry, CONTEXT, 100.0, T0.plusSeconds(1))).isEmpty();
		assertThat(cache.reuseReason(null, CONTEXT, 100.0, T0.plusSeconds(1))).isEmpty();
	}

	@Test
	void contextShiftOrBiasFlipForcesRevalidation() {
		DecisionCacheEntry entry = entry(DecisionSource.ORACLE, CONTEXT);
		ContextSnapshot hotterRsi = new ContextSnapshot(0.2, 0.5, 70.0, 1.1, 0.5, 0.4, Bias.LONG, 0.7);
		ContextSnapshot flipped = new ContextSnapshot(0.2, 0.5, 55.0, 1.1, 0.5, 0.4, Bias.SHORT, 0.7);

		assertThat(CONTEXT.shiftTo(hotterRsi)).isEqualTo(0.15, within(1e-9));
		assertThat(cache.reuseReason(entry, hotterRsi, 100.0, T0.plusSeconds(1))).isEmpty();
		assertThat(CONTEXT.shiftTo(flipped)).isInfinite();
		assertThat(cache.reuseReason(entry, flipped, 100.0, T0.plusSeconds(1))).isEmpty();
	}

	@Test
	void driftAgainstMissingPriceIsInfinite() {
		assertThat(DecisionCache.priceDrift(0.0, 100.0)).isInfinite();
		assertThat(DecisionCache.priceDrift(100.0, Double.NaN)).isInfinite();
		assertThat(DecisionCache.priceDrift(100.0, 101.0)).isEqualTo(0.01);
	}

	@Test
	void putGetEvict() {
		DecisionCacheEntry entry = entry(DecisionSource.ORACLE, CONTEXT);
		cache.put("BTCUSDT", entry);

		assertThat(cache.get("BTCUSDT")).contains(entry);
		cache.evict("BTCUSDT");
		assertThat(cache.get("BTCUSDT")).isEmpty();
	}

	private static DecisionCacheEntry entry(DecisionSource source, ContextSnapshot context) {
		Decision decision = new Decision("BTCUSDT", Bias.LONG, DecisionAction.ENTRY, 0.7, 100.0, null, "trend",
				source, 0.5, 0.7, Bias.LONG, T0);
		return new DecisionCacheEntry(decision, 100.0, T0, context, source);
	}
}
