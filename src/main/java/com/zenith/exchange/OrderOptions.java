package com.zenith.exchange;

public record OrderOptions(
		boolean reduceOnly,
		TimeInForce timeInForce,
		String clientOrderId) {

	public static OrderOptions open() {
		return new OrderOptions(false, null, null);
	}

	public static OrderOptions reduceOnly(TimeInForce timeInForce) {
		return new OrderOptions(true, timeInForce, null);
	}
}
