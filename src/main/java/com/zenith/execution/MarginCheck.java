package com.zenith.execution;

import java.math.BigDecimal;

public record MarginCheck(
		boolean allowed,
		NormalizedQuantity order,
		BigDecimal notionalCap,
		CapSource capSource) {

	public enum CapSource {
		NONE,
		MARGIN,
		LEVERAGE_BRACKET
	}

	static MarginCheck allow(NormalizedQuantity order, BigDecimal cap, CapSource source) {
		return new MarginCheck(true, order, cap, source);
	}

	static MarginCheck reject(NormalizedQuantity order, BigDecimal cap, CapSource source) {
		return new MarginCheck(false, order, cap, source);
	}
}
