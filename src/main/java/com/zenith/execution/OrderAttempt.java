package com.zenith.execution;

import com.zenith.exchange.dto.OrderResponse;

/**
 * One order placement outcome: either a fill or a classified rejection.
 */
public record OrderAttempt(
		OrderResponse fill,
		RejectionKind rejection,
		Throwable error) {

	static OrderAttempt filled(OrderResponse response) {
		return new OrderAttempt(response, null, null);
	}

	static OrderAttempt rejected(Throwable error) {
		return new OrderAttempt(null, RejectionClassifier.classify(error), error);
	}

	public boolean isFilled() {
		return fill != null;
	}
}
