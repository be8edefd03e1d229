package com.zenith.execution;

import java.util.regex.Pattern;

import com.zenith.exchange.BinanceApiException;

public final class RejectionClassifier {

	private static final Pattern PERCENT_PRICE = Pattern.compile("percent_price", Pattern.CASE_INSENSITIVE);
	private static final Pattern MAX_POSITION = Pattern.compile("maximum allowable position",
			Pattern.CASE_INSENSITIVE);
	private static final Pattern INSUFFICIENT_MARGIN = Pattern.compile("margin is insufficient",
			Pattern.CASE_INSENSITIVE);

	private static final int CODE_PERCENT_PRICE = -4131;
	private static final int CODE_MAX_POSITION = -2027;
	private static final int CODE_INSUFFICIENT_MARGIN = -2019;

	private RejectionClassifier() {
	}

	public static RejectionKind classify(Throwable error) {
		if (error == null) {
			return RejectionKind.OTHER;
		}
		if (error instanceof BinanceApiException exception && exception.code() != null) {
			switch (exception.code()) {
				case CODE_PERCENT_PRICE:
					return RejectionKind.PERCENT_PRICE;
				case CODE_MAX_POSITION:
					return RejectionKind.LEVERAGE_BRACKET;
				case CODE_INSUFFICIENT_MARGIN:
					return RejectionKind.INSUFFICIENT_MARGIN;
				default:
					break;
			}
		}
		String message = error.getMessage();
		if (message == null) {
			return RejectionKind.OTHER;
		}
		if (PERCENT_PRICE.matcher(message).find()) {
			return RejectionKind.PERCENT_PRICE;
		}
		if (MAX_POSITION.matcher(message).find()) {
			return RejectionKind.LEVERAGE_BRACKET;
		}
		if (INSUFFICIENT_MARGIN.matcher(message).find()) {
			return RejectionKind.INSUFFICIENT_MARGIN;
		}
		return RejectionKind.OTHER;
	}
}
