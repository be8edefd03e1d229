package com.zenith.strategy;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DecisionSource {
	ORACLE,
	FALLBACK,
	STRATEGY;

	@JsonValue
	public String wireValue() {
		return name().toLowerCase(Locale.ROOT);
	}
}
