package com.zenith.scalp;

public enum CooldownEvent {
	STOP,
	SLIPPAGE
}
