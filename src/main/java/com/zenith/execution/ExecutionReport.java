package com.zenith.execution;

import java.math.BigDecimal;

import com.zenith.exchange.OrderSide;
import com.zenith.exchange.dto.OrderResponse;

public record ExecutionReport(
		String symbol,
		ExecutionOutcome outcome,
		OrderSide side,
		Long orderId,
		String status,
		BigDecimal executedQty,
		BigDecimal avgPrice,
		int attempts,
		String detail) {

	public static ExecutionReport of(String symbol, ExecutionOutcome outcome, String detail) {
		return new ExecutionReport(symbol, outcome, null, null, null, BigDecimal.ZERO, null, 0, detail);
	}

	static ExecutionReport fromOrder(String symbol, ExecutionOutcome outcome, OrderSide side, OrderResponse response,
			int attempts) {
		return new ExecutionReport(symbol, outcome, side, response.orderId(), response.status(),
				response.filledQuantity(), response.fillPrice(), attempts, null);
	}

	public boolean placedOrder() {
		return outcome == ExecutionOutcome.FILLED || outcome == ExecutionOutcome.CLOSED;
	}
}
