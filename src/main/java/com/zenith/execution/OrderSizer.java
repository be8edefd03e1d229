package com.zenith.execution;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

public final class OrderSizer {

	static final BigDecimal BASE_ORDER_NOTIONAL = BigDecimal.valueOf(40);
	private static final BigDecimal PRICELESS_DIVISOR = BigDecimal.valueOf(1000);
	private static final int QUANTITY_SCALE = 6;

	private OrderSizer() {
	}

	/**
	 * {@code max(capital x allocation, 40) x leverage x max(confidence, 0.1)}, where capital falls back to the
	 * configured initial balance when no free margin is reported.
	 */
	public static BigDecimal targetNotional(BigDecimal availableMargin, double allocationPct, int leverage,
			double confidence, double initialBalance) {
		BigDecimal capital = availableMargin != null && availableMargin.signum() > 0
				? availableMargin
				: BigDecimal.valueOf(initialBalance);
		double fraction = Math.max(0.01, Math.min(1.0, allocationPct / 100.0));
		BigDecimal base = capital.multiply(BigDecimal.valueOf(fraction)).max(BASE_ORDER_NOTIONAL);
		double safeConfidence = Double.isFinite(confidence) ? Math.max(confidence, 0.1) : 0.1;
		return base.multiply(BigDecimal.valueOf(Math.max(leverage, 1)))
				.multiply(BigDecimal.valueOf(safeConfidence));
	}

	public static BigDecimal quantityFor(BigDecimal targetNotional, BigDecimal referencePrice) {
		if (referencePrice == null || referencePrice.signum() <= 0) {
			return targetNotional.divide(PRICELESS_DIVISOR, QUANTITY_SCALE, RoundingMode.HALF_UP);
		}
		return targetNotional.divide(referencePrice, MathContext.DECIMAL64)
				.setScale(QUANTITY_SCALE, RoundingMode.HALF_UP);
	}
}
