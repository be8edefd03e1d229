package com.zenith.market;

import java.time.Instant;

/**
 * Optional exchange-wide context attached to a snapshot. Every field may be null when the
 * corresponding endpoint was unavailable.
 */
public record MarketEnrichment(
		Double change24hPct,
		Double high24h,
		Double low24h,
		Double quoteVolume24h,
		Double markPrice,
		Double indexPrice,
		Double fundingRate,
		Instant nextFundingTime,
		Double openInterest,
		Double takerLongShortRatio,
		String takerFlowBias) {

	public static MarketEnrichment empty() {
		return new MarketEnrichment(null, null, null, null, null, null, null, null, null, null, null);
	}
}
