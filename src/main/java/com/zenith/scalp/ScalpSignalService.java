package com.zenith.scalp;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zenith.exchange.TimeInForce;
import com.zenith.exchange.TradingFilters;
import com.zenith.execution.ExecutionOutcome;
import com.zenith.execution.ExecutionReport;
import com.zenith.execution.OrderExecutor;
import com.zenith.execution.Position;
import com.zenith.execution.PositionLedger;
import com.zenith.execution.StrategyMetadata;
import com.zenith.execution.SymbolFilterService;
import com.zenith.market.BookSnapshot;
import com.zenith.market.Candle;
import com.zenith.market.MarketDataProvider;
import com.zenith.market.MarketSnapshot;
import com.zenith.oracle.ShockRiskOracle;
import com.zenith.strategy.Decision;
import com.zenith.strategy.DecisionAction;
import com.zenith.strategy.DecisionSource;
import com.zenith.strategy.TradeSide;
import com.zenith.strategy.TradingEventSink;

import reactor.core.publisher.Mono;
import reactor.util.function.Tuple5;

/**
 * One scalp tick for one symbol: manage an open tracked position, otherwise look for a new entry.
 */
public class ScalpSignalService {

	private static final Logger LOGGER = LoggerFactory.getLogger(ScalpSignalService.class);

	private final MarketDataProvider marketData;
	private final SymbolFilterService filterService;
	private final ShockRiskOracle shockRiskOracle;
	private final ScalpFeatureBuilder featureBuilder;
	private final ScalpCandidateEngine candidateEngine;
	private final PolicyMerger policyMerger;
	private final ExitPlanner exitPlanner;
	private final StopTracker stopTracker;
	private final CooldownTracker cooldownTracker;
	private final PositionLedger ledger;
	private final OrderExecutor executor;
	private final TradingEventSink eventSink;
	private final ScalpProperties properties;
	private final String interval;
	private final int limit;
	private final Clock clock;

	public ScalpSignalService(MarketDataProvider marketData, SymbolFilterService filterService,
			ShockRiskOracle shockRiskOracle, ScalpFeatureBuilder featureBuilder, ScalpCandidateEngine candidateEngine,
			PolicyMerger policyMerger, ExitPlanner exitPlanner, StopTracker stopTracker,
			CooldownTracker cooldownTracker, PositionLedger ledger, OrderExecutor executor, TradingEventSink eventSink,
			ScalpProperties properties, String interval, int limit, Clock clock) {
		this.marketData = marketData;
		this.filterService = filterService;
		this.shockRiskOracle = shockRiskOracle;
		this.featureBuilder = featureBuilder;
		this.candidateEngine = candidateEngine;
		this.policyMerger = policyMerger;
		this.exitPlanner = exitPlanner;
		this.stopTracker = stopTracker;
		this.cooldownTracker = cooldownTracker;
		this.ledger = ledger;
		this.executor = executor;
		this.eventSink = eventSink;
		this.properties = properties;
		this.interval = interval;
		this.limit = limit;
		this.clock = clock;
	}

	public Mono<ExecutionReport> run(String symbol) {
		return Mono.zip(
						marketData.snapshot(symbol, interval, limit),
						marketData.book(symbol),
						filterService.filtersFor(symbol),
						shockRiskOracle.gradeFor(symbol),
						ledger.position(symbol, false))
				.flatMap(inputs -> tick(symbol, inputs))
				.doOnNext(eventSink::execution);
	}

	private Mono<ExecutionReport> tick(String symbol,
			Tuple5<MarketSnapshot, BookSnapshot, TradingFilters, RiskGrade, Optional<Position>> inputs) {
		MarketSnapshot snapshot = inputs.getT1();
		TradingFilters filters = inputs.getT3();
		RiskGrade grade = inputs.getT4();
		Optional<Position> position = inputs.getT5();
		double tick = filters.tickSize() == null ? 0.0 : filters.tickSize().doubleValue();
		Instant now = clock.instant();
		ScalpFeatures features = featureBuilder.build(symbol, snapshot.candles(), inputs.getT2(), tick, now);

		if (position.isPresent()) {
			return manage(features, position.get(), now);
		}
		if (stopTracker.get(symbol).isPresent()) {
			LOGGER.info("EVENT=STOP_UNTRACK symbol={} reason=position_gone", symbol);
			stopTracker.remove(symbol);
		}
		if (cooldownTracker.isBlocked(symbol)) {
			LOGGER.info("EVENT=COOLDOWN_SKIP symbol={} untilMs={}", symbol,
					cooldownTracker.state(symbol).blockedUntil());
			return Mono.just(ExecutionReport.of(symbol, ExecutionOutcome.SKIPPED_COOLDOWN, "cooldown active"));
		}
		List<Candidate> candidates = candidateEngine.build(features, grade);
		return policyMerger.merge(features, grade, candidates)
				.flatMap(merged -> {
					Optional<Candidate> best = policyMerger.select(merged);
					if (best.isEmpty()) {
						LOGGER.debug("EVENT=SCALP_NO_SIGNAL symbol={} reasons={}", symbol, merged.get(0).reasons());
						return Mono.just(ExecutionReport.of(symbol, ExecutionOutcome.NO_SIGNAL,
								String.join("; ", merged.get(0).reasons())));
					}
					return enter(features, best.get(), now);
				});
	}

	private Mono<ExecutionReport> enter(ScalpFeatures features, Candidate candidate, Instant now) {
		TradeSide side = candidate.signal().toSide();
		Decision decision = toDecision(features, candidate, now);
		eventSink.decision(decision);
		BigDecimal price = BigDecimal.valueOf(features.close());
		return executor.execute(decision, Optional.empty(), price)
				.doOnNext(report -> {
					if (report.outcome() != ExecutionOutcome.FILLED) {
						return;
					}
					double fill = report.avgPrice() != null && report.avgPrice().signum() > 0
							? report.avgPrice().doubleValue()
							: features.close();
					double slippageBp = Math.abs(fill - features.close()) / features.close() * 10_000.0;
					if (slippageBp > properties.resolvedSlippageCapBp()) {
						cooldownTracker.register(features.symbol(), CooldownEvent.SLIPPAGE);
					}
					ExitPlan plan = exitPlanner.plan(features, candidate, side, fill, now);
					stopTracker.track(plan);
					ledger.attachMetadata(features.symbol(), new StrategyMetadata(candidate.model().name(),
							(fill - features.close()) / features.close() * 100.0, now));
				});
	}

	private Mono<ExecutionReport> manage(ScalpFeatures features, Position position, Instant now) {
		String symbol = features.symbol();
		Optional<TrackedStop> tracked = stopTracker.get(symbol);
		if (tracked.isEmpty()) {
			return Mono.just(ExecutionReport.of(symbol, ExecutionOutcome.HOLD, "untracked position"));
		}
		Candle last = features.lastCandle();
		Optional<StopTracker.Update> update = stopTracker.update(symbol, last, features.atr22());
		if (update.isPresent() && update.get().breached()) {
			return flatten(symbol, last.close(), "stop " + update.get().state().stop())
					.doOnNext(report -> {
						if (report.outcome() == ExecutionOutcome.CLOSED) {
							cooldownTracker.register(symbol, CooldownEvent.STOP);
						}
					});
		}
		ExitPlan plan = tracked.get().plan();
		int barsHeld = (int) features.candles().stream()
				.filter(candle -> candle.openTime() > plan.entryCandleOpenTime())
				.count();
		if (ExitPlanner.shouldForceFlat(plan, now, barsHeld)) {
			LOGGER.info("EVENT=FORCE_FLAT symbol={} side={} barsHeld={} openedAt={}", symbol,
					position.side().label(), barsHeld, plan.openedAt());
			return flatten(symbol, last.close(), "max hold reached");
		}
		return Mono.just(ExecutionReport.of(symbol, ExecutionOutcome.HOLD, "tracking"));
	}

	/**
	 * The tracked stop survives an exit that left the position open, so the next tick tries again.
	 */
	private Mono<ExecutionReport> flatten(String symbol, double price, String reason) {
		return executor.closePosition(symbol, BigDecimal.valueOf(price), TimeInForce.IOC, reason)
				.doOnNext(report -> {
					if (report.outcome() == ExecutionOutcome.CLOSED
							|| report.outcome() == ExecutionOutcome.NO_POSITION) {
						stopTracker.remove(symbol);
					}
				});
	}

	static Decision toDecision(ScalpFeatures features, Candidate candidate, Instant now) {
		String reasoning = candidate.model() + ": " + String.join(", ", candidate.reasons());
		return new Decision(features.symbol(), candidate.signal().toSide().toBias(), DecisionAction.ENTRY,
				candidate.quality(), features.close(), null, reasoning, DecisionSource.STRATEGY, candidate.quality(),
				null, candidate.signal().toSide().toBias(), now);
	}
}
