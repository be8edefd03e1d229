package com.zenith.scalp;

public enum StopType {
	SWING,
	CHANDELIER
}
