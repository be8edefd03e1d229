package com.zenith.execution;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zenith.exchange.ExchangeAdapter;
import com.zenith.exchange.TradingFilters;
import com.zenith.exchange.dto.ExchangeInfoResponse;

import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Caches trading filters for the tracked symbols. A refresh swaps in a complete new table so readers never
 * see a half-updated mix.
 */
public class SymbolFilterService {

	private static final Logger LOGGER = LoggerFactory.getLogger(SymbolFilterService.class);
	private static final Duration RETRY_MIN_BACKOFF = Duration.ofSeconds(2);
	private static final Duration RETRY_MAX_BACKOFF = Duration.ofSeconds(30);
	private static final long DEFAULT_TTL_MS = 3_600_000L;

	private final ExchangeAdapter exchange;
	private final Clock clock;
	private final long refreshTtlMs;
	private final AtomicReference<Map<String, TradingFilters>> table = new AtomicReference<>(Map.of());
	private final AtomicReference<Set<String>> trackedSymbols = new AtomicReference<>(Set.of());
	private final AtomicReference<Mono<Map<String, TradingFilters>>> pendingRefresh = new AtomicReference<>();
	private final AtomicLong lastRefreshMs = new AtomicLong(0L);

	public SymbolFilterService(ExchangeAdapter exchange, long refreshTtlMs, Clock clock) {
		this.exchange = exchange;
		this.refreshTtlMs = refreshTtlMs > 0 ? refreshTtlMs : DEFAULT_TTL_MS;
		this.clock = clock;
	}

	public void track(Collection<String> symbols) {
		trackedSymbols.set(symbols.stream()
				.map(SymbolFilterService::normalizeSymbol)
				.filter(Objects::nonNull)
				.collect(Collectors.toUnmodifiableSet()));
	}

	public Map<String, TradingFilters> snapshot() {
		return table.get();
	}

	public Mono<TradingFilters> filtersFor(String symbol) {
		String key = normalizeSymbol(symbol);
		TradingFilters cached = table.get().get(key);
		if (cached != null && !isStale()) {
			return Mono.just(cached);
		}
		if (!trackedSymbols.get().contains(key)) {
			Set<String> extended = new HashSet<>(trackedSymbols.get());
			extended.add(key);
			trackedSymbols.set(Set.copyOf(extended));
		}
		return refresh()
				.flatMap(refreshed -> Mono.justOrEmpty(refreshed.get(key)))
				.switchIfEmpty(Mono.defer(() -> cached != null
						? Mono.just(cached)
						: Mono.error(new IllegalStateException("No trading filters for " + key))))
				.onErrorResume(error -> {
					if (cached == null) {
						return Mono.error(error);
					}
					LOGGER.warn("EVENT=FILTERS_STALE_SERVED symbol={} reason={}", key, error.getMessage());
					return Mono.just(cached);
				});
	}

	public Mono<NormalizedQuantity> normalize(String symbol, BigDecimal desiredQty, BigDecimal referencePrice) {
		return filtersFor(symbol)
				.map(filters -> QuantityNormalizer.normalize(filters, desiredQty, referencePrice));
	}

	public Mono<Map<String, TradingFilters>> refresh() {
		Mono<Map<String, TradingFilters>> pending = pendingRefresh.get();
		if (pending != null) {
			return pending;
		}
		Mono<Map<String, TradingFilters>> refresh = exchange.fetchExchangeInfo()
				.map(response -> parseExchangeInfo(response, trackedSymbols.get()))
				.retryWhen(Retry.backoff(4, RETRY_MIN_BACKOFF)
						.maxBackoff(RETRY_MAX_BACKOFF)
						.jitter(0.2)
						.onRetryExhaustedThrow((spec, signal) -> signal.failure()))
				.doOnNext(parsed -> {
					table.set(parsed);
					lastRefreshMs.set(clock.millis());
					parsed.forEach((symbol, filters) -> LOGGER.debug(
							"EVENT=FILTERS_READY_FOR_SYMBOL symbol={} stepSize={} minQty={} maxQty={} minNotional={}",
							symbol, filters.stepSize(), filters.minQty(), filters.maxQty(), filters.minNotional()));
					LOGGER.info("EVENT=FILTERS_GLOBAL_OK symbolsReady={}", parsed.size());
				})
				.doOnError(error -> LOGGER.warn("EVENT=FILTERS_GLOBAL_FAIL reason={}", error.getMessage()))
				.doFinally(signal -> pendingRefresh.set(null))
				.cache();
		if (pendingRefresh.compareAndSet(null, refresh)) {
			return refresh;
		}
		Mono<Map<String, TradingFilters>> winner = pendingRefresh.get();
		return winner == null ? refresh : winner;
	}

	static Map<String, TradingFilters> parseExchangeInfo(ExchangeInfoResponse response, Collection<String> symbols) {
		if (response == null || response.symbols() == null || symbols == null || symbols.isEmpty()) {
			return Map.of();
		}
		Set<String> targets = symbols.stream()
				.map(SymbolFilterService::normalizeSymbol)
				.filter(Objects::nonNull)
				.collect(Collectors.toSet());
		return response.symbols().stream()
				.filter(Objects::nonNull)
				.filter(info -> info.symbol() != null && targets.contains(normalizeSymbol(info.symbol())))
				.map(TradingFilters::fromSymbolInfo)
				.collect(Collectors.toUnmodifiableMap(TradingFilters::symbol, filters -> filters,
						(first, second) -> first));
	}

	private boolean isStale() {
		long lastRefresh = lastRefreshMs.get();
		return lastRefresh == 0L || clock.millis() - lastRefresh >= refreshTtlMs;
	}

	private static String normalizeSymbol(String symbol) {
		if (symbol == null || symbol.isBlank()) {
			return null;
		}
		return symbol.trim().toUpperCase(Locale.ROOT);
	}
}
