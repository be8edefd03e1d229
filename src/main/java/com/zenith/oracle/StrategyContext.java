package com.zenith.oracle;

import com.zenith.market.MarketEnrichment;
import com.zenith.market.MarketMetrics;
import com.zenith.strategy.LocalSignal;

/**
 * Market and position context sent with a strategy request.
 */
public record StrategyContext(
		String symbol,
		String interval,
		MarketMetrics metrics,
		MarketEnrichment enrichment,
		LocalSignal localSignal,
		String positionSide,
		Double positionUnrealizedPct) {
}
