package com.zenith.strategy;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DecisionAction {
	ENTRY,
	HOLD,
	FLIP,
	EXIT;

	@JsonValue
	public String wireValue() {
		return name().toLowerCase(Locale.ROOT);
	}

	public static DecisionAction fromText(String text) {
		if (text == null || text.isBlank()) {
			return null;
		}
		for (DecisionAction action : values()) {
			if (action.wireValue().equalsIgnoreCase(text.trim())) {
				return action;
			}
		}
		return null;
	}
}
