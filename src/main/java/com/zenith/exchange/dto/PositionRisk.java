package com.zenith.exchange.dto;

import java.math.BigDecimal;

public record PositionRisk(
		String symbol,
		BigDecimal positionAmt,
		BigDecimal entryPrice,
		BigDecimal markPrice,
		BigDecimal unRealizedProfit,
		String positionSide) {
}
