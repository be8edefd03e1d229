package com.zenith.exchange;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.zenith.exchange.dto.ExchangeInfoResponse.ExchangeFilter;
import com.zenith.exchange.dto.ExchangeInfoResponse.SymbolInfo;

class TradingFiltersTest {

	@Test
	void marketLotFallsBackToLotStepAndTakesTighterBounds() {
		SymbolInfo info = new SymbolInfo("btcusdt", "TRADING", "PERPETUAL", "USDT", 3, 1, List.of(
				new ExchangeFilter("PRICE_FILTER", null, null, null, null, null, null, new BigDecimal("0.10")),
				new ExchangeFilter("LOT_SIZE", new BigDecimal("0.001"), new BigDecimal("1000"),
						new BigDecimal("0.001"), null, null, null, null),
				new ExchangeFilter("MARKET_LOT_SIZE", new BigDecimal("0.002"), new BigDecimal("120"),
						BigDecimal.ZERO, null, null, null, null),
				new ExchangeFilter("MIN_NOTIONAL", null, null, null, null, new BigDecimal("5"), null, null)));

		TradingFilters filters = TradingFilters.fromSymbolInfo(info);

		assertThat(filters.symbol()).isEqualTo("BTCUSDT");
		assertThat(filters.stepSize()).isEqualByComparingTo("0.001");
		assertThat(filters.minQty()).isEqualByComparingTo("0.002");
		assertThat(filters.maxQty()).isEqualByComparingTo("120");
		assertThat(filters.minNotional()).isEqualByComparingTo("5");
		assertThat(filters.maxNotional()).isNull();
		assertThat(filters.tickSize()).isEqualByComparingTo("0.10");
		assertThat(filters.stepSizePrecision()).isEqualTo(3);
		assertThat(filters.quantityPrecision()).isEqualTo(3);
	}

	@Test
	void missingFiltersYieldPermissiveDefaults() {
		TradingFilters filters = TradingFilters.fromSymbolInfo(
				new SymbolInfo("XUSDT", "TRADING", "PERPETUAL", "USDT", null, null, null));

		assertThat(filters.hasStep()).isFalse();
		assertThat(filters.minQty()).isEqualByComparingTo("0");
		assertThat(filters.maxQty()).isNull();
		assertThat(filters.tickSize()).isNull();
	}

	@Test
	void precisionIgnoresTrailingZeros() {
		assertThat(TradingFilters.precisionOf(new BigDecimal("0.00100000"))).isEqualTo(3);
		assertThat(TradingFilters.precisionOf(new BigDecimal("10"))).isZero();
		assertThat(TradingFilters.precisionOf(null)).isNull();
	}
}
