package com.zenith.strategy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zenith.exchange.ExchangeAdapter;
import com.zenith.exchange.dto.ExchangeInfoResponse;
import com.zenith.exchange.dto.ExchangeInfoResponse.SymbolInfo;

import reactor.core.publisher.Mono;

/**
 * Configured symbols checked against exchange info. Symbols that are not live perpetuals on the configured
 * quote asset are blocked and never evaluated.
 */
public class SymbolUniverse {

	private static final Logger LOGGER = LoggerFactory.getLogger(SymbolUniverse.class);
	static final String TRADING_STATUS = "TRADING";
	static final String PERPETUAL = "PERPETUAL";

	private final ExchangeAdapter exchange;
	private final List<String> configured;
	private final String quoteAsset;
	private final AtomicReference<List<String>> active = new AtomicReference<>(List.of());
	private final Set<String> blocked = ConcurrentHashMap.newKeySet();

	public SymbolUniverse(ExchangeAdapter exchange, Collection<String> configured, String quoteAsset) {
		this.exchange = exchange;
		this.configured = List.copyOf(configured);
		this.quoteAsset = quoteAsset.toUpperCase(Locale.ROOT);
	}

	/**
	 * Loads exchange info and keeps the tradable subset. Errors when nothing tradable remains.
	 */
	public Mono<List<String>> validate() {
		return exchange.fetchExchangeInfo()
				.map(info -> {
					Map<String, String> rejections = rejections(info, configured, quoteAsset);
					List<String> tradable = new ArrayList<>();
					for (String symbol : configured) {
						String reason = rejections.get(symbol);
						if (reason == null) {
							tradable.add(symbol);
						} else {
							blocked.add(symbol);
							LOGGER.warn("EVENT=SYMBOL_BLOCKED symbol={} reason={}", symbol, reason);
						}
					}
					if (tradable.isEmpty()) {
						throw new IllegalStateException("No tradable symbols among " + configured);
					}
					active.set(List.copyOf(tradable));
					LOGGER.info("EVENT=SYMBOLS_ACTIVE count={} symbols={}", tradable.size(), tradable);
					return active.get();
				});
	}

	public List<String> active() {
		return active.get();
	}

	public boolean isBlocked(String symbol) {
		return blocked.contains(symbol);
	}

	/**
	 * Reason each configured symbol cannot be traded; tradable symbols are absent from the result.
	 */
	static Map<String, String> rejections(ExchangeInfoResponse info, List<String> symbols, String quoteAsset) {
		Map<String, SymbolInfo> bySymbol = new LinkedHashMap<>();
		if (info != null && info.symbols() != null) {
			for (SymbolInfo symbolInfo : info.symbols()) {
				if (symbolInfo != null && symbolInfo.symbol() != null) {
					bySymbol.put(symbolInfo.symbol().toUpperCase(Locale.ROOT), symbolInfo);
				}
			}
		}
		Map<String, String> rejections = new LinkedHashMap<>();
		for (String symbol : symbols) {
			SymbolInfo symbolInfo = bySymbol.get(symbol);
			if (symbolInfo == null) {
				rejections.put(symbol, "unknown symbol");
			} else if (!TRADING_STATUS.equalsIgnoreCase(symbolInfo.status())) {
				rejections.put(symbol, "status " + symbolInfo.status());
			} else if (!PERPETUAL.equalsIgnoreCase(symbolInfo.contractType())) {
				rejections.put(symbol, "contract " + symbolInfo.contractType());
			} else if (!quoteAsset.equalsIgnoreCase(symbolInfo.quoteAsset())) {
				rejections.put(symbol, "quote " + symbolInfo.quoteAsset());
			}
		}
		return rejections;
	}
}
