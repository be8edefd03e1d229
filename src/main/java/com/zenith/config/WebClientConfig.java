package com.zenith.config;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.netty.channel.ChannelOption;
import reactor.netty.http.Http11SslContextSpec;
import reactor.netty.http.client.HttpClient;

@Configuration
public class WebClientConfig {

	private static final int DEFAULT_CONNECT_TIMEOUT_MS = 5000;
	private static final long DEFAULT_RESPONSE_TIMEOUT_MS = 10_000L;
	private static final long DEFAULT_HANDSHAKE_TIMEOUT_MS = 10_000L;

	@Bean
	public WebClient.Builder webClientBuilder() {
		return WebClient.builder();
	}

	@Bean
	public WebClient binanceWebClient(BinanceProperties properties, WebClient.Builder builder, DataSize maxInMemorySize) {
		HttpClient httpClient = configureHttpClient(properties.connectTimeoutMs(), properties.responseTimeoutMs(),
				properties.handshakeTimeoutMs());
		return builder.clone()
				.baseUrl(properties.resolvedBaseUrl())
				.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
				.clientConnector(new ReactorClientHttpConnector(httpClient))
				.exchangeStrategies(exchangeStrategies(maxInMemorySize))
				.build();
	}

	@Bean
	public WebClient oracleWebClient(OracleProperties properties, WebClient.Builder builder, DataSize maxInMemorySize) {
		HttpClient httpClient = HttpClient.create()
				.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, DEFAULT_CONNECT_TIMEOUT_MS)
				.responseTimeout(Duration.ofMillis(properties.timeoutMs()));
		WebClient.Builder oracleBuilder = builder.clone()
				.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
				.clientConnector(new ReactorClientHttpConnector(httpClient))
				.exchangeStrategies(exchangeStrategies(maxInMemorySize));
		if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
			oracleBuilder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiKey());
		}
		return oracleBuilder.build();
	}

	ExchangeStrategies exchangeStrategies(DataSize maxInMemorySize) {
		return ExchangeStrategies.builder()
				.codecs(configurer -> configurer.defaultCodecs()
						.maxInMemorySize((int) maxInMemorySize.toBytes()))
				.build();
	}

	@Bean
	public DataSize maxInMemorySize(@Value("${spring.codec.max-in-memory-size:5MB}") DataSize maxInMemorySize) {
		return maxInMemorySize;
	}

	@Bean
	public ObjectMapper objectMapper() {
		return new ObjectMapper().findAndRegisterModules()
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
	}

	static HttpClient configureHttpClient(int connectTimeoutMs, long responseTimeoutMs, long handshakeTimeoutMs) {
		int connectTimeout = connectTimeoutMs > 0 ? connectTimeoutMs : DEFAULT_CONNECT_TIMEOUT_MS;
		long responseTimeout = responseTimeoutMs > 0 ? responseTimeoutMs : DEFAULT_RESPONSE_TIMEOUT_MS;
		long handshakeTimeout = handshakeTimeoutMs > 0 ? handshakeTimeoutMs : DEFAULT_HANDSHAKE_TIMEOUT_MS;
		return HttpClient.create()
				.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeout)
				.responseTimeout(Duration.ofMillis(responseTimeout))
				.secure(ssl -> ssl.sslContext(Http11SslContextSpec.forClient()).handshakeTimeout(Duration.ofMillis(handshakeTimeout)));
	}
}
