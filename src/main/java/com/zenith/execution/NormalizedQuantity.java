package com.zenith.execution;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import com.zenith.exchange.TradingFilters;

/**
 * Outcome of quantity normalization. A zero quantity means "do not trade" and carries the rejection reason.
 */
public record NormalizedQuantity(
		BigDecimal quantity,
		String quantityText,
		TradingFilters filters,
		Set<QuantityAdjustment> adjustments,
		QuantityRejection rejection) {

	public NormalizedQuantity {
		adjustments = adjustments.isEmpty()
				? Set.of()
				: Collections.unmodifiableSet(EnumSet.copyOf(adjustments));
	}

	static NormalizedQuantity rejected(TradingFilters filters, Set<QuantityAdjustment> adjustments,
			QuantityRejection rejection) {
		return new NormalizedQuantity(BigDecimal.ZERO, "0", filters, adjustments, rejection);
	}

	public boolean isTradable() {
		return rejection == null && quantity.signum() > 0;
	}

	public boolean adjusted(QuantityAdjustment adjustment) {
		return adjustments.contains(adjustment);
	}
}
