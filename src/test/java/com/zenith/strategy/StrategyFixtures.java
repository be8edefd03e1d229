package com.zenith.strategy;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import com.zenith.execution.Position;
import com.zenith.market.Candle;
import com.zenith.market.MarketEnrichment;
import com.zenith.market.MarketMetrics;
import com.zenith.market.MarketSnapshot;

final class StrategyFixtures {

	static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

	private StrategyFixtures() {
	}

	/** Quiet market: no trend, mid RSI, price well inside the range. */
	static MarketMetrics metrics(double price) {
		return new MarketMetrics(price, 0.0, 0.0, 0.0, price, price, price, price, 50.0, 0.5, 0.5, 1.0, 0.0, 0.0,
				50.0, 0.0, price * 0.98, price * 1.02, NOW);
	}

	static MarketMetrics metrics(double price, double change5m, double change15m, double rsi) {
		return new MarketMetrics(price, 0.0, change5m, change15m, price, price, price, price, rsi, 0.5, 0.5, 1.0, 0.0,
				0.0, 50.0, 0.0, price * 0.98, price * 1.02, NOW);
	}

	static MarketSnapshot snapshot(String symbol, double price, LocalSignal local) {
		return snapshot(symbol, metrics(price), local);
	}

	static MarketSnapshot snapshot(String symbol, MarketMetrics metrics, LocalSignal local) {
		long open = NOW.toEpochMilli() - 60_000;
		Candle candle = new Candle(open, metrics.lastPrice(), metrics.lastPrice(), metrics.lastPrice(),
				metrics.lastPrice(), 10, NOW.toEpochMilli() - 1, 5);
		return new MarketSnapshot(symbol, "1m", List.of(candle), metrics, MarketEnrichment.empty(), local);
	}

	static LocalSignal local(Bias bias, double confidence, double edge) {
		return new LocalSignal(bias, confidence, edge, "EMA trend up · RSI 61.0", 0.6, 0.1);
	}

	static Position position(String symbol, TradeSide side, String entryPrice) {
		return new Position(symbol, side, new BigDecimal("1.000"), new BigDecimal(entryPrice), null, BigDecimal.ZERO,
				null);
	}
}
