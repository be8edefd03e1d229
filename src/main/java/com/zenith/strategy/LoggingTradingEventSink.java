package com.zenith.strategy;

import java.util.Collection;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zenith.execution.ExecutionReport;
import com.zenith.execution.Position;

public class LoggingTradingEventSink implements TradingEventSink {

	private static final Logger LOGGER = LoggerFactory.getLogger(LoggingTradingEventSink.class);

	@Override
	public void decision(Decision decision) {
		LOGGER.info("EVENT=SIGNAL symbol={} bias={} action={} confidence={} source={} localBias={} localEdge={} "
						+ "localConfidence={} entry={} reasoning=\"{}\"",
				decision.symbol(), decision.bias().wireValue(), decision.action().wireValue(),
				String.format(Locale.ROOT, "%.3f", decision.confidence()), decision.source().wireValue(), decision.localBias(),
				decision.localEdge(), decision.localConfidence(), decision.entryPrice(), decision.reasoning());
	}

	@Override
	public void execution(ExecutionReport report) {
		if (report.placedOrder()) {
			LOGGER.info("EVENT=FILL symbol={} outcome={} side={} orderId={} status={} executedQty={} avgPrice={}",
					report.symbol(), report.outcome(), report.side(), report.orderId(), report.status(),
					report.executedQty(), report.avgPrice());
			return;
		}
		LOGGER.info("EVENT=EXECUTION symbol={} outcome={} attempts={} detail={}", report.symbol(), report.outcome(),
				report.attempts(), report.detail());
	}

	@Override
	public void positions(Collection<Position> positions) {
		for (Position position : positions) {
			LOGGER.info("EVENT=POSITION symbol={} side={} qty={} entry={} mark={} unrealizedPct={}",
					position.symbol(), position.side().label(), position.quantity(), position.entryPrice(),
					position.markPrice(), position.unrealizedPct());
		}
	}
}
