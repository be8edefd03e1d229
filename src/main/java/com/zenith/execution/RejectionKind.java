package com.zenith.execution;

public enum RejectionKind {
	PERCENT_PRICE(true),
	LEVERAGE_BRACKET(true),
	INSUFFICIENT_MARGIN(false),
	OTHER(false);

	private final boolean retryable;

	RejectionKind(boolean retryable) {
		this.retryable = retryable;
	}

	public boolean retryable() {
		return retryable;
	}
}
