package com.zenith.execution;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.EnumSet;
import java.util.Set;

import com.zenith.exchange.TradingFilters;

/**
 * Fits a desired order quantity to a symbol's lot, notional and precision rules.
 * Either the result satisfies every rule or it is zero.
 */
public final class QuantityNormalizer {

	private static final int NO_STEP_SCALE = 6;
	private static final int MAX_DISPLAY_SCALE = 8;
	private static final BigDecimal FLOOR_EPSILON = new BigDecimal("1e-12");
	private static final MathContext DIVISION = MathContext.DECIMAL64;

	private QuantityNormalizer() {
	}

	public static NormalizedQuantity normalize(TradingFilters filters, BigDecimal desiredQty, BigDecimal referencePrice) {
		Set<QuantityAdjustment> adjustments = EnumSet.noneOf(QuantityAdjustment.class);
		if (desiredQty == null || desiredQty.signum() <= 0) {
			return NormalizedQuantity.rejected(filters, adjustments, QuantityRejection.NON_POSITIVE_INPUT);
		}
		BigDecimal price = referencePrice != null && referencePrice.signum() > 0 ? referencePrice : null;

		BigDecimal quantity = quantize(desiredQty, filters, adjustments);

		if (filters.minQty().signum() > 0 && quantity.compareTo(filters.minQty()) < 0) {
			quantity = raiseToMinQty(filters);
			adjustments.add(QuantityAdjustment.MIN_QTY_RAISE);
		}

		quantity = clampToMax(quantity, filters, adjustments);

		if (price != null && filters.minNotional().signum() > 0
				&& quantity.multiply(price).compareTo(filters.minNotional()) < 0) {
			adjustments.add(QuantityAdjustment.MIN_NOTIONAL_BUMP);
			BigDecimal required = filters.minNotional().divide(price, DIVISION);
			quantity = quantize(required, filters, adjustments);
			if (filters.maxQty() != null && quantity.compareTo(filters.maxQty()) > 0) {
				return NormalizedQuantity.rejected(filters, adjustments, QuantityRejection.MIN_NOTIONAL_UNREACHABLE);
			}
		}

		quantity = clampToMax(quantity, filters, adjustments);

		Integer precisionCap = precisionCap(filters);
		if (precisionCap != null) {
			BigDecimal truncated = quantity.add(FLOOR_EPSILON).setScale(precisionCap, RoundingMode.DOWN);
			truncated = quantize(truncated, filters, EnumSet.noneOf(QuantityAdjustment.class));
			if (truncated.compareTo(quantity) != 0) {
				adjustments.add(QuantityAdjustment.PRECISION_TRUNCATE);
			}
			quantity = truncated;
		}

		if (quantity.signum() <= 0) {
			return NormalizedQuantity.rejected(filters, adjustments, QuantityRejection.ZERO_AFTER_ROUNDING);
		}
		if (quantity.compareTo(filters.minQty()) < 0) {
			return NormalizedQuantity.rejected(filters, adjustments, QuantityRejection.BELOW_MIN_QTY);
		}
		if (price != null) {
			BigDecimal notional = quantity.multiply(price);
			if (filters.minNotional().signum() > 0 && notional.compareTo(filters.minNotional()) < 0) {
				return NormalizedQuantity.rejected(filters, adjustments, QuantityRejection.BELOW_MIN_NOTIONAL);
			}
			if (filters.maxNotional() != null && notional.compareTo(filters.maxNotional()) > 0) {
				return NormalizedQuantity.rejected(filters, adjustments, QuantityRejection.ABOVE_MAX_NOTIONAL);
			}
		}

		String text = quantity.setScale(displayScale(filters), RoundingMode.HALF_UP).toPlainString();
		return new NormalizedQuantity(new BigDecimal(text), text, filters, adjustments, null);
	}

	/**
	 * Floors to a step multiple, or rounds to six decimals when the symbol has no step.
	 */
	static BigDecimal quantize(BigDecimal value, TradingFilters filters, Set<QuantityAdjustment> adjustments) {
		if (value.signum() <= 0) {
			return BigDecimal.ZERO;
		}
		if (!filters.hasStep()) {
			BigDecimal rounded = value.setScale(NO_STEP_SCALE, RoundingMode.HALF_UP);
			if (rounded.compareTo(value) != 0) {
				adjustments.add(QuantityAdjustment.DECIMAL_ROUND);
			}
			return rounded;
		}
		BigDecimal step = filters.stepSize();
		BigDecimal steps = value.divide(step, 0, RoundingMode.DOWN);
		BigDecimal quantized = steps.multiply(step).setScale(stepScale(filters), RoundingMode.DOWN);
		if (quantized.compareTo(value) != 0) {
			adjustments.add(QuantityAdjustment.STEP_FLOOR);
		}
		return quantized;
	}

	static Integer precisionCap(TradingFilters filters) {
		Integer quantityPrecision = filters.quantityPrecision();
		Integer stepPrecision = filters.stepSizePrecision();
		if (quantityPrecision == null) {
			return stepPrecision;
		}
		return stepPrecision == null ? quantityPrecision : Math.min(quantityPrecision, stepPrecision);
	}

	static int displayScale(TradingFilters filters) {
		int scale;
		if (filters.quantityPrecision() != null) {
			scale = filters.quantityPrecision();
		} else if (filters.stepSizePrecision() != null) {
			scale = filters.stepSizePrecision();
		} else if (filters.hasStep()) {
			scale = stepScale(filters);
		} else {
			scale = NO_STEP_SCALE;
		}
		return Math.max(0, Math.min(scale, MAX_DISPLAY_SCALE));
	}

	private static BigDecimal raiseToMinQty(TradingFilters filters) {
		if (!filters.hasStep()) {
			return filters.minQty();
		}
		BigDecimal steps = filters.minQty().divide(filters.stepSize(), 0, RoundingMode.CEILING);
		return steps.multiply(filters.stepSize()).setScale(stepScale(filters), RoundingMode.DOWN);
	}

	private static BigDecimal clampToMax(BigDecimal quantity, TradingFilters filters,
			Set<QuantityAdjustment> adjustments) {
		if (filters.maxQty() != null && quantity.compareTo(filters.maxQty()) > 0) {
			adjustments.add(QuantityAdjustment.MAX_QTY_CLAMP);
			return filters.maxQty();
		}
		return quantity;
	}

	private static int stepScale(TradingFilters filters) {
		return Math.min(MAX_DISPLAY_SCALE, Math.max(0, filters.stepSize().stripTrailingZeros().scale()));
	}
}
