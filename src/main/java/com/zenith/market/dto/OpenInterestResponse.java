package com.zenith.market.dto;

import java.math.BigDecimal;

public record OpenInterestResponse(
		String symbol,
		BigDecimal openInterest,
		Long time) {
}
