package com.zenith.market.dto;

import java.math.BigDecimal;

public record PremiumIndexResponse(
		String symbol,
		BigDecimal markPrice,
		BigDecimal indexPrice,
		BigDecimal lastFundingRate,
		Long nextFundingTime) {
}
