package com.zenith.execution;

public enum ExecutionOutcome {
	FILLED,
	CLOSED,
	EXIT_UNFILLED,
	HOLD,
	NO_POSITION,
	SKIPPED_CONVICTION,
	SKIPPED_QUANTITY,
	SKIPPED_MARGIN,
	SKIPPED_COOLDOWN,
	NO_SIGNAL,
	ORDERS_DISABLED,
	REJECTED_INSUFFICIENT_MARGIN,
	ABORTED_AFTER_RETRIES
}
