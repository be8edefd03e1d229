package com.zenith.execution;

public enum QuantityAdjustment {
	STEP_FLOOR,
	DECIMAL_ROUND,
	MIN_QTY_RAISE,
	MAX_QTY_CLAMP,
	MIN_NOTIONAL_BUMP,
	PRECISION_TRUNCATE
}
