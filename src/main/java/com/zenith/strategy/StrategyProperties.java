package com.zenith.strategy;

import java.util.List;
import java.util.Locale;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

@Validated
@ConfigurationProperties(prefix = "strategy")
public record StrategyProperties(
		@NotNull StrategyMode mode,
		@NotEmpty List<String> symbols,
		@Positive long loopIntervalMs,
		String klineInterval,
		int klineLimit,
		@Positive int defaultLeverage,
		int minLeverage,
		int maxLeverage,
		double allocationPct,
		double initialBalance,
		boolean enableOrders,
		String quoteAsset,
		long positionCacheTtlMs,
		long balanceCacheTtlMs,
		long filterRefreshTtlMs,
		long symbolTimeoutMs,
		int concurrency,
		long decisionRevalidationMs,
		long decisionCooldownMs) {

	static final int MIN_KLINE_LIMIT = 90;
	static final int MAX_KLINE_LIMIT = 500;
	static final int DEFAULT_KLINE_LIMIT = 150;

	public List<String> resolvedSymbols() {
		return symbols.stream()
				.filter(symbol -> symbol != null && !symbol.isBlank())
				.map(symbol -> symbol.trim().toUpperCase(Locale.ROOT))
				.distinct()
				.toList();
	}

	public String resolvedKlineInterval() {
		return klineInterval == null || klineInterval.isBlank() ? "1m" : klineInterval;
	}

	public int resolvedKlineLimit() {
		int requested = klineLimit > 0 ? klineLimit : DEFAULT_KLINE_LIMIT;
		return Math.max(MIN_KLINE_LIMIT, Math.min(requested, MAX_KLINE_LIMIT));
	}

	public String resolvedQuoteAsset() {
		return quoteAsset == null || quoteAsset.isBlank() ? "USDT" : quoteAsset.toUpperCase(Locale.ROOT);
	}

	public int resolvedMinLeverage() {
		return Math.max(1, minLeverage);
	}

	public int resolvedMaxLeverage() {
		return maxLeverage > 0 ? Math.min(maxLeverage, 125) : 125;
	}

	public long resolvedPositionCacheTtlMs() {
		return positionCacheTtlMs > 0 ? positionCacheTtlMs : 3_000L;
	}

	public long resolvedBalanceCacheTtlMs() {
		return balanceCacheTtlMs > 0 ? balanceCacheTtlMs : 3_000L;
	}

	public long resolvedSymbolTimeoutMs() {
		return symbolTimeoutMs > 0 ? symbolTimeoutMs : 20_000L;
	}

	public int resolvedConcurrency() {
		return Math.max(1, concurrency);
	}

	public long resolvedDecisionRevalidationMs() {
		return decisionRevalidationMs > 0 ? decisionRevalidationMs : 240_000L;
	}

	public long resolvedDecisionCooldownMs() {
		return decisionCooldownMs > 0 ? decisionCooldownMs : 45_000L;
	}
}
