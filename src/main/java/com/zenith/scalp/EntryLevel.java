package com.zenith.scalp;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Price level a candidate expects to be filled at.
 */
public enum EntryLevel {
	LVN,
	VAH,
	VAL,
	EMA25,
	EMA50,
	FVG_EDGE,
	POC,
	NEXT_VA,
	NA;

	@JsonValue
	public String wireValue() {
		return name().toLowerCase(Locale.ROOT);
	}

	@JsonCreator
	public static EntryLevel fromText(String text) {
		if (text == null || text.isBlank()) {
			return null;
		}
		for (EntryLevel level : values()) {
			if (level.wireValue().equalsIgnoreCase(text.trim())) {
				return level;
			}
		}
		return null;
	}
}
