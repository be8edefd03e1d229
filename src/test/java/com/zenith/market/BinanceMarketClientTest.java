package com.zenith.market;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

class BinanceMarketClientTest {

	private final ObjectMapper objectMapper = new ObjectMapper();

	@Test
	void parsesKlineRowsWithTakerVolume() throws Exception {
		List<Candle> candles = BinanceMarketClient.parseKlines(objectMapper.readTree("""
				[[1714564800000,"63000.1","63050.0","62990.5","63040.2","12.5",1714564859999,"787000.0",310,"8.0","504000.0","0"],
				 [1714564860000,"63040.2","63060.0","63000.0","63010.0","4.0",1714564919999]]
				"""));

		assertThat(candles).hasSize(2);
		Candle first = candles.get(0);
		assertThat(first.openTime()).isEqualTo(1714564800000L);
		assertThat(first.close()).isEqualTo(63040.2);
		assertThat(first.takerBuyVolume()).isEqualTo(8.0);
		assertThat(first.takerSellVolume()).isEqualTo(4.5);
		assertThat(candles.get(1).takerBuyVolume()).isEqualTo(2.0);
	}

	@Test
	void skipsShortRowsAndNonArrays() throws Exception {
		assertThat(BinanceMarketClient.parseKlines(objectMapper.readTree("[[1,2,3],{\"a\":1}]"))).isEmpty();
		assertThat(BinanceMarketClient.parseKlines(objectMapper.readTree("{\"code\":-1121}"))).isEmpty();
		assertThat(BinanceMarketClient.parseKlines(null)).isEmpty();
	}
}
