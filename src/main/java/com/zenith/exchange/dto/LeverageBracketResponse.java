package com.zenith.exchange.dto;

import java.math.BigDecimal;
import java.util.List;

public record LeverageBracketResponse(
		String symbol,
		List<Bracket> brackets) {

	public record Bracket(
			int bracket,
			int initialLeverage,
			BigDecimal notionalCap,
			BigDecimal notionalFloor) {
	}
}
