package com.zenith.scalp;

public record StopHint(StopType type, int distanceTicks) {

	public static StopHint swing(int distanceTicks) {
		return new StopHint(StopType.SWING, Math.max(0, distanceTicks));
	}
}
