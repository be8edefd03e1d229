package com.zenith.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;

@Validated
@ConfigurationProperties(prefix = "binance")
public record BinanceProperties(
		@NotBlank String baseUrl,
		@NotBlank String testnetBaseUrl,
		boolean useTestnet,
		String apiKey,
		String secretKey,
		long recvWindowMillis,
		int connectTimeoutMs,
		long responseTimeoutMs,
		long handshakeTimeoutMs) {

	public String resolvedBaseUrl() {
		return useTestnet ? testnetBaseUrl : baseUrl;
	}

	public boolean hasCredentials() {
		return apiKey != null && !apiKey.isBlank() && secretKey != null && !secretKey.isBlank();
	}

	public long effectiveRecvWindowMillis() {
		return recvWindowMillis > 0 ? recvWindowMillis : 10_000L;
	}
}
