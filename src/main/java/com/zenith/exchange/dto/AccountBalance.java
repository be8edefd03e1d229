package com.zenith.exchange.dto;

import java.math.BigDecimal;

public record AccountBalance(
		String asset,
		BigDecimal walletBalance,
		BigDecimal availableBalance) {
}
