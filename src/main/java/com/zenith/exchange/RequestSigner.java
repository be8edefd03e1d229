package com.zenith.exchange;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.stereotype.Component;

import com.zenith.config.BinanceProperties;

@Component
public class RequestSigner {

	private static final String ALGORITHM = "HmacSHA256";

	private final BinanceProperties properties;

	public RequestSigner(BinanceProperties properties) {
		this.properties = properties;
	}

	public String signQuery(String query) {
		return query + "&signature=" + hmacHex(query, properties.secretKey());
	}

	static String hmacHex(String payload, String secretKey) {
		try {
			Mac mac = Mac.getInstance(ALGORITHM);
			mac.init(new SecretKeySpec(secretKey.getBytes(StandardCharsets.UTF_8), ALGORITHM));
			return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
		} catch (GeneralSecurityException ex) {
			throw new IllegalStateException("Unable to sign request", ex);
		}
	}
}
