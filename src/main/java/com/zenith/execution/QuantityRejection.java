package com.zenith.execution;

public enum QuantityRejection {
	NON_POSITIVE_INPUT,
	MIN_NOTIONAL_UNREACHABLE,
	ZERO_AFTER_ROUNDING,
	BELOW_MIN_QTY,
	BELOW_MIN_NOTIONAL,
	ABOVE_MAX_NOTIONAL
}
