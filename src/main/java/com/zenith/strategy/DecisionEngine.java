package com.zenith.strategy;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zenith.execution.Position;
import com.zenith.market.MarketMetrics;
import com.zenith.market.MarketSnapshot;
import com.zenith.oracle.OracleDecision;
import com.zenith.oracle.StrategyContext;
import com.zenith.oracle.StrategyOracle;

import reactor.core.publisher.Mono;

/**
 * Oracle-mode decision resolution: reuse a cached oracle answer while the market context holds, otherwise ask
 * the oracle and blend in the local signal. Oracle failures turn into a conservative fallback.
 */
public class DecisionEngine {

	private static final Logger LOGGER = LoggerFactory.getLogger(DecisionEngine.class);
	static final double FALLBACK_EXIT_CONFIDENCE = 0.8;
	static final double FALLBACK_HOLD_CONFIDENCE = 0.2;
	private static final int LOCAL_SNIPPET_WORDS = 12;

	private final StrategyOracle oracle;
	private final DecisionCache cache;
	private final Clock clock;

	public DecisionEngine(StrategyOracle oracle, DecisionCache cache, Clock clock) {
		this.oracle = oracle;
		this.cache = cache;
		this.clock = clock;
	}

	public Mono<Decision> resolve(MarketSnapshot snapshot, Optional<Position> position) {
		String symbol = snapshot.symbol();
		double price = snapshot.lastPrice();
		LocalSignal local = snapshot.localSignal() == null ? LocalSignal.neutral() : snapshot.localSignal();
		ContextSnapshot context = ContextSnapshot.of(snapshot);
		Instant now = clock.instant();

		Optional<DecisionCacheEntry> cached = cache.get(symbol);
		if (cached.isPresent()) {
			Optional<String> reuse = cache.reuseReason(cached.get(), context, price, now);
			if (reuse.isPresent()) {
				return Mono.just(reuse(cached.get(), reuse.get(), local, context, price, position, now));
			}
		}

		return oracle.request(strategyContext(snapshot, local, position, price))
				.map(answer -> {
					Decision decision = applyPositionContext(fromOracle(symbol, answer, snapshot.metrics(), local,
							price, now), position, price);
					cache.put(symbol, new DecisionCacheEntry(decision, price, now, context, DecisionSource.ORACLE));
					return decision;
				})
				.onErrorResume(error -> {
					LOGGER.warn("EVENT=ORACLE_FALLBACK symbol={} position={} reason={}", symbol,
							position.map(value -> value.side().label()).orElse("flat"), error.getMessage());
					Decision decision = applyPositionContext(fallback(symbol, local, position, price, now), position,
							price);
					cache.put(symbol, new DecisionCacheEntry(decision, price, now, context, DecisionSource.FALLBACK));
					return Mono.just(decision);
				});
	}

	private Decision reuse(DecisionCacheEntry entry, String reason, LocalSignal local, ContextSnapshot context,
			double price, Optional<Position> position, Instant now) {
		double drift = DecisionCache.priceDrift(entry.referencePrice(), price) * 100.0;
		Decision base = entry.decision()
				.withReasoning(String.format(Locale.ROOT, "%s · %s (price drift %.3f%%)",
						stripReuseNote(entry.decision().reasoning()), reason, drift))
				.withEntry(price, entry.decision().confidence(), now)
				.withLocalEcho(local);
		Decision reused = applyPositionContext(base, position, price);
		cache.put(entry.decision().symbol(), new DecisionCacheEntry(reused, price, now, context,
				DecisionSource.ORACLE));
		LOGGER.debug("EVENT=DECISION_REUSED symbol={} reason={} driftPct={}", reused.symbol(), reason, drift);
		return reused;
	}

	static Decision fromOracle(String symbol, OracleDecision answer, MarketMetrics metrics, LocalSignal local,
			double price, Instant now) {
		Bias bias = answer.bias() != null ? answer.bias() : local.bias();
		double confidence = clamp(answer.confidence());
		// never below what the local signal already supports
		confidence = Math.max(confidence, clamp(local.confidence()));
		String reasoning = String.format(Locale.ROOT, "%s · Δ5m %.2f%%, RSI %.1f · Vol %.2f · MFI %.1f",
				answer.reasoning(), metrics.change5mPct(), metrics.rsi14(), metrics.volumeRatio(), metrics.mfi14());
		if (isStrongLocal(local)) {
			reasoning = String.format(Locale.ROOT, "%s · Local confirms: %s · edge %d%% · confidence %d%%",
					reasoning, trimWords(local.reasoning(), LOCAL_SNIPPET_WORDS),
					Math.round(local.edgeScore() * 100), Math.round(local.confidence() * 100));
			confidence = Math.max(confidence, clamp(local.confidence()));
		}
		DecisionAction action = answer.action() != null ? answer.action() : DecisionAction.ENTRY;
		return new Decision(symbol, bias, action, confidence, price, answer.exitPrice(), reasoning,
				DecisionSource.ORACLE, local.edgeScore(), local.confidence(), local.bias(), now);
	}

	static Decision fallback(String symbol, LocalSignal local, Optional<Position> position, double price,
			Instant now) {
		if (position.isPresent()) {
			BigDecimal entry = position.get().entryPrice();
			return new Decision(symbol, Bias.FLAT, DecisionAction.EXIT,
					clamp(Math.max(local.confidence(), FALLBACK_EXIT_CONFIDENCE)),
					entry == null ? null : entry.doubleValue(), price,
					"Strategy oracle unavailable, flattening via limit exit", DecisionSource.FALLBACK,
					local.edgeScore(), local.confidence(), local.bias(), now);
		}
		double confidence = local.confidence() > 0 ? clamp(local.confidence()) : FALLBACK_HOLD_CONFIDENCE;
		return new Decision(symbol, Bias.FLAT, DecisionAction.HOLD, confidence, null, null,
				"Strategy oracle unavailable, standing aside", DecisionSource.FALLBACK, local.edgeScore(),
				local.confidence(), local.bias(), now);
	}

	/**
	 * Rewrites the action against the live book: flat book enters, open exposure with a flat or exit call
	 * closes, the same side holds and the opposite side flips.
	 */
	static Decision applyPositionContext(Decision decision, Optional<Position> position, double price) {
		if (position.isEmpty()) {
			if (decision.action() == DecisionAction.HOLD && decision.bias().isDirectional()) {
				return decision.withAction(DecisionAction.ENTRY, decision.reasoning());
			}
			return decision;
		}
		Position live = position.get();
		String side = live.side().label();
		String reasoning = decision.reasoning() == null ? "" : decision.reasoning();
		Double unrealizedPct = unrealizedPct(live, price);
		String pnl = unrealizedPct == null ? "" : String.format(Locale.ROOT, " (uPnL %.2f%%)", unrealizedPct);
		if (decision.isExit()) {
			return decision.withAction(DecisionAction.EXIT, annotate(reasoning, "Closing",
					"Closing " + side + " exposure" + pnl));
		}
		if (decision.bias().toSide() == live.side()) {
			return decision.withAction(DecisionAction.HOLD, annotate(reasoning, "Maintaining",
					"Maintaining " + side + " position" + pnl));
		}
		return decision.withAction(DecisionAction.FLIP, annotate(reasoning, "Flip",
				"Flip " + side + "→" + decision.bias().wireValue() + pnl));
	}

	/**
	 * Price-based unrealized move of the position in percent, positive when in profit.
	 */
	static Double unrealizedPct(Position position, double price) {
		BigDecimal entry = position.entryPrice();
		if (entry == null || entry.signum() <= 0 || !Double.isFinite(price) || !(price > 0)) {
			return null;
		}
		double entryPrice = entry.doubleValue();
		double delta = (price - entryPrice) * position.side().direction();
		return delta / entryPrice * 100.0;
	}

	static boolean isStrongLocal(LocalSignal local) {
		if (!local.bias().isDirectional()) {
			return false;
		}
		double confidence = local.confidence();
		double edge = local.edgeScore();
		return (confidence >= 0.68 && edge >= 0.48) || confidence >= 0.82 || edge >= 0.62;
	}

	private StrategyContext strategyContext(MarketSnapshot snapshot, LocalSignal local, Optional<Position> position,
			double price) {
		return new StrategyContext(snapshot.symbol(), snapshot.interval(), snapshot.metrics(), snapshot.enrichment(),
				local, position.map(value -> value.side().label()).orElse("flat"),
				position.map(value -> unrealizedPct(value, price)).orElse(null));
	}

	private static String annotate(String reasoning, String marker, String note) {
		if (reasoning.toLowerCase(Locale.ROOT).contains(marker.toLowerCase(Locale.ROOT))) {
			return reasoning;
		}
		return reasoning.isBlank() ? note : reasoning + " · " + note;
	}

	private static String stripReuseNote(String reasoning) {
		if (reasoning == null) {
			return "";
		}
		int index = reasoning.indexOf(" · Maintaining stance (");
		if (index < 0) {
			index = reasoning.indexOf(" · Cooldown reuse (");
		}
		return index < 0 ? reasoning : reasoning.substring(0, index);
	}

	static String trimWords(String text, int maxWords) {
		if (text == null || text.isBlank()) {
			return "";
		}
		String[] words = text.trim().split("\\s+");
		return words.length <= maxWords ? String.join(" ", words)
				: String.join(" ", Arrays.copyOf(words, maxWords)) + "...";
	}

	private static double clamp(double value) {
		if (!Double.isFinite(value)) {
			return 0.0;
		}
		return Math.max(0.0, Math.min(1.0, value));
	}
}
