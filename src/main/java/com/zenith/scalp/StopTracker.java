package com.zenith.scalp;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zenith.market.Candle;
import com.zenith.strategy.TradeSide;

/**
 * Per-symbol protective stops. Once TP1 trades the stop goes to breakeven and then trails the close by an ATR
 * multiple. A stop only ever moves toward the trade.
 */
public class StopTracker {

	private static final Logger LOGGER = LoggerFactory.getLogger(StopTracker.class);

	private final Map<String, TrackedStop> stops = new ConcurrentHashMap<>();

	public record Update(TrackedStop state, boolean breached) {
	}

	public void track(ExitPlan plan) {
		stops.put(plan.symbol(), TrackedStop.initial(plan));
		LOGGER.info("EVENT=STOP_TRACK symbol={} side={} entry={} stop={} tp1={}", plan.symbol(),
				plan.side().label(), plan.entry(), plan.stop(), plan.tp1());
	}

	public Optional<TrackedStop> get(String symbol) {
		return Optional.ofNullable(stops.get(symbol));
	}

	public void remove(String symbol) {
		stops.remove(symbol);
	}

	public Map<String, TrackedStop> snapshot() {
		return Map.copyOf(stops);
	}

	/**
	 * Checks the stop against the candle, then advances it. Returns empty when the symbol is not tracked.
	 * While the candle is still the one the entry filled on, only its latest price counts: its range holds
	 * trades from before the fill.
	 */
	public Optional<Update> update(String symbol, Candle candle, double atr) {
		TrackedStop current = stops.get(symbol);
		if (current == null) {
			return Optional.empty();
		}
		ExitPlan plan = current.plan();
		TradeSide side = plan.side();
		boolean entryCandle = candle.openTime() <= plan.entryCandleOpenTime();
		double low = entryCandle ? candle.close() : candle.low();
		double high = entryCandle ? candle.close() : candle.high();
		boolean breached = side == TradeSide.LONG ? low <= current.stop() : high >= current.stop();
		if (breached) {
			LOGGER.info("EVENT=STOP_BREACHED symbol={} side={} stop={} low={} high={}", symbol, side.label(),
					current.stop(), low, high);
			return Optional.of(new Update(current, true));
		}
		boolean tp1Hit = current.tp1Hit() || touched(plan, low, high);
		double next = nextStop(side, plan.entry(), current.stop(), candle.close(), atr, plan.trailAtrMultiple(),
				tp1Hit);
		TrackedStop updated = new TrackedStop(plan, next, tp1Hit);
		stops.put(symbol, updated);
		if (next != current.stop()) {
			LOGGER.info("EVENT=STOP_MOVED symbol={} side={} from={} to={} tp1Hit={}", symbol, side.label(),
					current.stop(), next, tp1Hit);
		}
		return Optional.of(new Update(updated, false));
	}

	static double nextStop(TradeSide side, double entry, double currentStop, double lastClose, double atr,
			double atrMultiple, boolean tp1Hit) {
		if (!tp1Hit) {
			return currentStop;
		}
		double trail = lastClose - side.direction() * atr * atrMultiple;
		if (side == TradeSide.LONG) {
			return Math.max(Math.max(currentStop, entry), trail);
		}
		return Math.min(Math.min(currentStop, entry), trail);
	}

	private static boolean touched(ExitPlan plan, double low, double high) {
		if (plan.tp1() == null) {
			return false;
		}
		return plan.side() == TradeSide.LONG ? high >= plan.tp1() : low <= plan.tp1();
	}
}
