package com.zenith.scalp;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TargetLabel {
	POC,
	NEXT_VA,
	NA;

	@JsonValue
	public String wireValue() {
		return name().toLowerCase(Locale.ROOT);
	}
}
