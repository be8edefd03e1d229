package com.zenith.strategy;

import java.util.Collection;

import com.zenith.execution.ExecutionReport;
import com.zenith.execution.Position;

/**
 * Receives what the engine decided and did on every tick.
 */
public interface TradingEventSink {

	void decision(Decision decision);

	void execution(ExecutionReport report);

	void positions(Collection<Position> positions);
}
