package com.zenith.exchange;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class BinanceApiException extends RuntimeException {

	private static final Pattern BINANCE_CODE_PATTERN = Pattern.compile("\"code\"\\s*:\\s*(-?\\d+)");
	private static final Pattern BINANCE_MSG_PATTERN = Pattern.compile("\"msg\"\\s*:\\s*\"([^\"]*)\"");

	private final Integer code;
	private final int httpStatus;
	private final String exchangeMessage;

	public BinanceApiException(Integer code, String message) {
		this(code, 0, null, message);
	}

	public BinanceApiException(Integer code, int httpStatus, String exchangeMessage, String message) {
		super(message);
		this.code = code;
		this.httpStatus = httpStatus;
		this.exchangeMessage = exchangeMessage;
	}

	public static BinanceApiException fromResponse(String prefix, int status, String body) {
		return new BinanceApiException(extractCode(body), status, extractMessage(body),
				prefix + " with status=" + status + ", body=" + body);
	}

	public Integer code() {
		return code;
	}

	public int httpStatus() {
		return httpStatus;
	}

	public String exchangeMessage() {
		return exchangeMessage;
	}

	public boolean isTimestampError() {
		return code != null && code == -1021;
	}

	static Integer extractCode(String body) {
		if (body == null) {
			return null;
		}
		Matcher matcher = BINANCE_CODE_PATTERN.matcher(body);
		if (!matcher.find()) {
			return null;
		}
		try {
			return Integer.parseInt(matcher.group(1));
		} catch (NumberFormatException ex) {
			return null;
		}
	}

	static String extractMessage(String body) {
		if (body == null) {
			return null;
		}
		Matcher matcher = BINANCE_MSG_PATTERN.matcher(body);
		return matcher.find() ? matcher.group(1) : null;
	}
}
