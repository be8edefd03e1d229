package com.zenith.execution;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zenith.exchange.ExchangeAdapter;
import com.zenith.exchange.dto.AccountBalance;
import com.zenith.exchange.dto.PositionRisk;
import com.zenith.strategy.TradeSide;

import reactor.core.publisher.Mono;

/**
 * Short-lived view of live exchange positions and free margin. Both are cached for a few seconds and
 * dropped whenever an order may have changed them.
 */
public class PositionLedger {

	private static final Logger LOGGER = LoggerFactory.getLogger(PositionLedger.class);
	static final BigDecimal QUANTITY_EPSILON = new BigDecimal("1e-8");

	private final ExchangeAdapter exchange;
	private final Clock clock;
	private final long positionTtlMs;
	private final long balanceTtlMs;
	private final String quoteAsset;
	private final AtomicReference<Cached<Map<String, Position>>> positions = new AtomicReference<>();
	private final AtomicReference<Cached<BigDecimal>> availableMargin = new AtomicReference<>();
	private final Map<String, StrategyMetadata> metadata = new ConcurrentHashMap<>();

	public PositionLedger(ExchangeAdapter exchange, long positionTtlMs, long balanceTtlMs, String quoteAsset,
			Clock clock) {
		this.exchange = exchange;
		this.positionTtlMs = positionTtlMs;
		this.balanceTtlMs = balanceTtlMs;
		this.quoteAsset = quoteAsset;
		this.clock = clock;
	}

	public Mono<Map<String, Position>> positions(boolean forceRefresh) {
		Cached<Map<String, Position>> cached = positions.get();
		if (!forceRefresh && cached != null && cached.isFresh(clock.millis(), positionTtlMs)) {
			return Mono.just(cached.value());
		}
		return exchange.fetchPositions()
				.map(this::project)
				.doOnNext(projected -> {
					positions.set(new Cached<>(projected, clock.millis()));
					metadata.keySet().retainAll(projected.keySet());
				});
	}

	public Mono<Optional<Position>> position(String symbol, boolean forceRefresh) {
		return positions(forceRefresh)
				.map(all -> Optional.ofNullable(all.get(symbol)));
	}

	/**
	 * Free margin in the quote asset. Lookup failures read as zero so no new exposure is opened.
	 */
	public Mono<BigDecimal> availableMargin(boolean forceRefresh) {
		Cached<BigDecimal> cached = availableMargin.get();
		if (!forceRefresh && cached != null && cached.isFresh(clock.millis(), balanceTtlMs)) {
			return Mono.just(cached.value());
		}
		return exchange.fetchAccountBalance()
				.map(this::quoteAvailable)
				.doOnNext(value -> availableMargin.set(new Cached<>(value, clock.millis())))
				.onErrorResume(error -> {
					LOGGER.warn("EVENT=BALANCE_FETCH_FAIL asset={} reason={}", quoteAsset, error.getMessage());
					return Mono.just(BigDecimal.ZERO);
				});
	}

	public void invalidate() {
		positions.set(null);
		availableMargin.set(null);
	}

	public void attachMetadata(String symbol, StrategyMetadata value) {
		if (value == null) {
			metadata.remove(symbol);
		} else {
			metadata.put(symbol, value);
		}
	}

	public Optional<StrategyMetadata> metadata(String symbol) {
		return Optional.ofNullable(metadata.get(symbol));
	}

	/** Last observed positions, without touching the exchange. */
	public Collection<Position> snapshot() {
		Cached<Map<String, Position>> cached = positions.get();
		return cached == null ? List.of() : cached.value().values();
	}

	Map<String, Position> project(List<PositionRisk> risks) {
		Map<String, Position> projected = new LinkedHashMap<>();
		if (risks == null) {
			return projected;
		}
		for (PositionRisk risk : risks) {
			if (risk == null || risk.symbol() == null || risk.positionAmt() == null) {
				continue;
			}
			BigDecimal amount = risk.positionAmt();
			if (amount.abs().compareTo(QUANTITY_EPSILON) <= 0) {
				continue;
			}
			TradeSide side = amount.signum() > 0 ? TradeSide.LONG : TradeSide.SHORT;
			projected.put(risk.symbol(), new Position(
					risk.symbol(),
					side,
					amount.abs(),
					risk.entryPrice(),
					risk.markPrice(),
					risk.unRealizedProfit(),
					metadata.get(risk.symbol())));
		}
		return Map.copyOf(projected);
	}

	private BigDecimal quoteAvailable(List<AccountBalance> balances) {
		if (balances == null) {
			return BigDecimal.ZERO;
		}
		return balances.stream()
				.filter(balance -> quoteAsset.equalsIgnoreCase(balance.asset()))
				.map(AccountBalance::availableBalance)
				.filter(value -> value != null)
				.findFirst()
				.orElse(BigDecimal.ZERO);
	}

	private record Cached<T>(T value, long fetchedAtMs) {

		boolean isFresh(long nowMs, long ttlMs) {
			return nowMs - fetchedAtMs < ttlMs;
		}
	}
}
