package com.zenith.strategy;

public enum StrategyMode {
	ORACLE,
	SCALP
}
