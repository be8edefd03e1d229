package com.zenith.exchange;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import com.zenith.config.BinanceProperties;
import com.zenith.exchange.dto.AccountBalance;
import com.zenith.exchange.dto.ExchangeInfoResponse;
import com.zenith.exchange.dto.LeverageBracketResponse;
import com.zenith.exchange.dto.OrderResponse;
import com.zenith.exchange.dto.PositionRisk;

import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

@Component
public class BinanceFuturesClient implements ExchangeAdapter {

	private static final Logger LOGGER = LoggerFactory.getLogger(BinanceFuturesClient.class);
	private static final Duration READ_RETRY_MIN_BACKOFF = Duration.ofMillis(500);
	private static final Duration READ_RETRY_MAX_BACKOFF = Duration.ofSeconds(5);
	private static final int READ_RETRY_ATTEMPTS = 3;
	private static final ParameterizedTypeReference<List<PositionRisk>> POSITION_LIST =
			new ParameterizedTypeReference<>() { };
	private static final ParameterizedTypeReference<List<LeverageBracketResponse>> BRACKET_LIST =
			new ParameterizedTypeReference<>() { };

	private final WebClient binanceWebClient;
	private final BinanceProperties properties;
	private final RequestSigner requestSigner;
	private final TimeSyncService timeSyncService;

	public BinanceFuturesClient(@Qualifier("binanceWebClient") WebClient binanceWebClient,
			BinanceProperties properties, RequestSigner requestSigner, TimeSyncService timeSyncService) {
		this.binanceWebClient = binanceWebClient;
		this.properties = properties;
		this.requestSigner = requestSigner;
		this.timeSyncService = timeSyncService;
	}

	@Override
	public Mono<List<AccountBalance>> fetchAccountBalance() {
		return signedRequest(HttpMethod.GET, "/fapi/v2/account", Map.of(), "Binance account fetch failed",
				AccountResponse.class)
				.map(account -> account.assets() == null ? List.<AccountBalance>of() : account.assets())
				.retryWhen(readRetry());
	}

	@Override
	public Mono<List<PositionRisk>> fetchPositions() {
		return signedRequest(HttpMethod.GET, "/fapi/v2/positionRisk", Map.of(), "Binance position fetch failed",
				POSITION_LIST)
				.retryWhen(readRetry());
	}

	@Override
	public Mono<ExchangeInfoResponse> fetchExchangeInfo() {
		return binanceWebClient
				.get()
				.uri("/fapi/v1/exchangeInfo")
				.retrieve()
				.onStatus(status -> status.isError(), response -> response
						.bodyToMono(String.class)
						.defaultIfEmpty("<empty>")
						.flatMap(body -> Mono.error(BinanceApiException.fromResponse("Binance exchange info failed",
								response.statusCode().value(), body))))
				.bodyToMono(ExchangeInfoResponse.class)
				.retryWhen(readRetry());
	}

	@Override
	public Mono<TradingFilters> fetchTradingFilters(String symbol) {
		return fetchExchangeInfo()
				.flatMap(response -> response.symbols().stream()
						.filter(info -> symbol.equalsIgnoreCase(info.symbol()))
						.findFirst()
						.map(info -> Mono.just(TradingFilters.fromSymbolInfo(info)))
						.orElseGet(() -> Mono.error(new IllegalArgumentException("Symbol not found: " + symbol))));
	}

	@Override
	public Mono<OrderResponse> placeMarketOrder(String symbol, OrderSide side, String quantity, OrderOptions options) {
		Map<String, String> params = orderParams(symbol, side, "MARKET", quantity, options);
		return signedRequest(HttpMethod.POST, "/fapi/v1/order", params, "Binance order failed", OrderResponse.class)
				.doOnNext(response -> LOGGER.info(
						"EVENT=ORDER_PLACED symbol={} side={} type=MARKET qty={} reduceOnly={} orderId={} status={}",
						symbol, side, quantity, options.reduceOnly(), response.orderId(), response.status()));
	}

	@Override
	public Mono<OrderResponse> placeLimitOrder(String symbol, OrderSide side, String quantity, BigDecimal price,
			OrderOptions options) {
		Map<String, String> params = orderParams(symbol, side, "LIMIT", quantity, options);
		params.put("price", price.stripTrailingZeros().toPlainString());
		params.put("timeInForce", (options.timeInForce() == null ? TimeInForce.GTC : options.timeInForce()).name());
		return signedRequest(HttpMethod.POST, "/fapi/v1/order", params, "Binance order failed", OrderResponse.class)
				.doOnNext(response -> LOGGER.info(
						"EVENT=ORDER_PLACED symbol={} side={} type=LIMIT qty={} price={} reduceOnly={} orderId={} status={}",
						symbol, side, quantity, price, options.reduceOnly(), response.orderId(), response.status()));
	}

	@Override
	public Mono<Void> setLeverage(String symbol, int leverage) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("symbol", symbol);
		params.put("leverage", Integer.toString(leverage));
		return signedRequest(HttpMethod.POST, "/fapi/v1/leverage", params, "Binance leverage update failed",
				LeverageResponse.class)
				.doOnNext(response -> LOGGER.debug("EVENT=LEVERAGE_SET symbol={} leverage={}", symbol,
						response.leverage()))
				.then();
	}

	@Override
	public Mono<BigDecimal> getMaxNotionalForLeverage(String symbol, int leverage) {
		return signedRequest(HttpMethod.GET, "/fapi/v1/leverageBracket", Map.of("symbol", symbol),
				"Binance leverage bracket fetch failed", BRACKET_LIST)
				.retryWhen(readRetry())
				.flatMap(brackets -> Mono.justOrEmpty(maxNotionalFor(brackets, symbol, leverage)));
	}

	static BigDecimal maxNotionalFor(List<LeverageBracketResponse> responses, String symbol, int leverage) {
		if (responses == null) {
			return null;
		}
		return responses.stream()
				.filter(response -> symbol.equalsIgnoreCase(response.symbol()))
				.filter(response -> response.brackets() != null)
				.flatMap(response -> response.brackets().stream())
				.filter(bracket -> bracket.initialLeverage() >= leverage && bracket.notionalCap() != null)
				.map(LeverageBracketResponse.Bracket::notionalCap)
				.max(Comparator.naturalOrder())
				.orElse(null);
	}

	private Map<String, String> orderParams(String symbol, OrderSide side, String type, String quantity,
			OrderOptions options) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("symbol", symbol);
		params.put("side", side.name());
		params.put("type", type);
		params.put("quantity", quantity);
		if (options.reduceOnly()) {
			params.put("reduceOnly", "true");
		}
		String clientOrderId = options.clientOrderId();
		params.put("newClientOrderId", clientOrderId == null || clientOrderId.isBlank()
				? UUID.randomUUID().toString()
				: clientOrderId);
		params.put("newOrderRespType", "RESULT");
		return params;
	}

	private <T> Mono<T> signedRequest(HttpMethod method, String path, Map<String, String> params, String failure,
			Class<T> responseType) {
		return signedRequest(method, path, params, failure, ParameterizedTypeReference.forType(responseType));
	}

	private <T> Mono<T> signedRequest(HttpMethod method, String path, Map<String, String> params, String failure,
			ParameterizedTypeReference<T> responseType) {
		if (!properties.hasCredentials()) {
			return Mono.error(new IllegalStateException(
					"Binance API key/secret is not configured. Set BINANCE_API_KEY and BINANCE_SECRET_KEY."));
		}
		return withTimestampRetry(() -> {
			String query = requestSigner.signQuery(buildQuery(params));
			return binanceWebClient
					.method(method)
					.uri(uriBuilder -> uriBuilder
							.path(path)
							.query(query)
							.build())
					.header(HttpHeaders.CONTENT_TYPE, "application/x-www-form-urlencoded")
					.header("X-MBX-APIKEY", properties.apiKey())
					.retrieve()
					.onStatus(status -> status.isError(), response -> response
							.bodyToMono(String.class)
							.defaultIfEmpty("<empty>")
							.flatMap(body -> Mono.error(BinanceApiException.fromResponse(failure,
									response.statusCode().value(), body))))
					.bodyToMono(responseType);
		});
	}

	private String buildQuery(Map<String, String> params) {
		String base = params.entrySet().stream()
				.map(entry -> entry.getKey() + "=" + entry.getValue())
				.collect(Collectors.joining("&"));
		String signedPart = "recvWindow=" + properties.effectiveRecvWindowMillis()
				+ "&timestamp=" + timeSyncService.timestampMillis();
		return base.isEmpty() ? signedPart : base + "&" + signedPart;
	}

	private <T> Mono<T> withTimestampRetry(Supplier<Mono<T>> requestSupplier) {
		return Mono.defer(requestSupplier)
				.onErrorResume(error -> {
					if (!(error instanceof BinanceApiException exception) || !exception.isTimestampError()) {
						return Mono.error(error);
					}
					LOGGER.warn("EVENT=TIMESTAMP_DRIFT resyncing offsetMs={}", timeSyncService.offsetMillis());
					return timeSyncService.resync().then(Mono.defer(requestSupplier));
				});
	}

	private static Retry readRetry() {
		return Retry.backoff(READ_RETRY_ATTEMPTS, READ_RETRY_MIN_BACKOFF)
				.maxBackoff(READ_RETRY_MAX_BACKOFF)
				.jitter(0.2)
				.filter(BinanceFuturesClient::isTransient)
				.onRetryExhaustedThrow((spec, signal) -> signal.failure());
	}

	static boolean isTransient(Throwable error) {
		if (error instanceof WebClientRequestException || error instanceof TimeoutException) {
			return true;
		}
		return error instanceof BinanceApiException exception && exception.httpStatus() >= 500;
	}

	private record AccountResponse(List<AccountBalance> assets) {
	}

	private record LeverageResponse(String symbol, Integer leverage) {
	}
}
