package com.zenith.market.dto;

import java.math.BigDecimal;

public record TakerVolumeEntry(
		BigDecimal buySellRatio,
		BigDecimal buyVol,
		BigDecimal sellVol,
		Long timestamp) {
}
