package com.zenith.exchange;

public enum OrderSide {
	BUY,
	SELL;

	public OrderSide opposite() {
		return this == BUY ? SELL : BUY;
	}
}
