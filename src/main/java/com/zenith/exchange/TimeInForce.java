package com.zenith.exchange;

public enum TimeInForce {
	GTC,
	IOC
}
