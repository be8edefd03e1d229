package com.zenith.market.dto;

import java.math.BigDecimal;

public record Ticker24hResponse(
		String symbol,
		BigDecimal priceChangePercent,
		BigDecimal lastPrice,
		BigDecimal highPrice,
		BigDecimal lowPrice,
		BigDecimal quoteVolume) {
}
