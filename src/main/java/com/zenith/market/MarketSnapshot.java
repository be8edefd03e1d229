package com.zenith.market;

import java.util.List;

import com.zenith.strategy.LocalSignal;

public record MarketSnapshot(
		String symbol,
		String interval,
		List<Candle> candles,
		MarketMetrics metrics,
		MarketEnrichment enrichment,
		LocalSignal localSignal) {

	public MarketSnapshot {
		candles = List.copyOf(candles);
		if (enrichment == null) {
			enrichment = MarketEnrichment.empty();
		}
	}

	public double lastPrice() {
		return metrics.lastPrice();
	}

	public Candle lastCandle() {
		return candles.get(candles.size() - 1);
	}

	public MarketSnapshot withEnrichment(MarketEnrichment value, Double lastPriceOverride) {
		MarketMetrics updated = lastPriceOverride == null || !(lastPriceOverride > 0)
				? metrics
				: metrics.withLastPrice(lastPriceOverride);
		return new MarketSnapshot(symbol, interval, candles, updated, value, localSignal);
	}
}
