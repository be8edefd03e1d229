package com.zenith.strategy;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zenith.execution.ExecutionReport;
import com.zenith.execution.OrderExecutor;
import com.zenith.execution.PositionLedger;
import com.zenith.execution.SymbolFilterService;
import com.zenith.market.MarketDataProvider;
import com.zenith.scalp.ScalpSignalService;

import jakarta.annotation.PreDestroy;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * The per-process scheduler loop. Each tick evaluates every active symbol with bounded concurrency; the next
 * tick is scheduled only after the current one finished, and a failing symbol never stops the loop.
 */
public class TradingEngine {

	private static final Logger LOGGER = LoggerFactory.getLogger(TradingEngine.class);

	private final StrategyProperties properties;
	private final SymbolUniverse universe;
	private final SymbolFilterService filterService;
	private final MarketDataProvider marketData;
	private final DecisionEngine decisionEngine;
	private final ScalpSignalService scalpSignalService;
	private final PositionLedger ledger;
	private final OrderExecutor executor;
	private final TradingEventSink eventSink;
	private final Scheduler scheduler;
	private final AtomicBoolean running = new AtomicBoolean(false);
	private final AtomicBoolean loopInFlight = new AtomicBoolean(false);
	private final AtomicReference<Disposable> pendingTick = new AtomicReference<>();

	public TradingEngine(StrategyProperties properties, SymbolUniverse universe, SymbolFilterService filterService,
			MarketDataProvider marketData, DecisionEngine decisionEngine, ScalpSignalService scalpSignalService,
			PositionLedger ledger, OrderExecutor executor, TradingEventSink eventSink) {
		this.properties = properties;
		this.universe = universe;
		this.filterService = filterService;
		this.marketData = marketData;
		this.decisionEngine = decisionEngine;
		this.scalpSignalService = scalpSignalService;
		this.ledger = ledger;
		this.executor = executor;
		this.eventSink = eventSink;
		this.scheduler = Schedulers.newBoundedElastic(Math.max(2, properties.resolvedConcurrency()), 1000,
				"trading-engine");
	}

	/**
	 * Validates the symbol universe, warms the filter table and schedules the first tick. Errors when no
	 * configured symbol is tradable.
	 */
	public Mono<Void> start() {
		if (running.get()) {
			return Mono.empty();
		}
		return universe.validate()
				.flatMap(symbols -> {
					filterService.track(symbols);
					return filterService.refresh()
							.doOnError(error -> LOGGER.warn("EVENT=FILTERS_WARMUP_FAIL reason={}",
									error.getMessage()))
							.onErrorResume(error -> Mono.empty())
							.thenReturn(symbols);
				})
				.doOnNext(symbols -> {
					if (running.compareAndSet(false, true)) {
						LOGGER.info("EVENT=ENGINE_START mode={} symbols={} loopIntervalMs={}", properties.mode(),
								symbols, properties.loopIntervalMs());
						scheduleNext(Duration.ZERO);
					}
				})
				.then();
	}

	/**
	 * Stops scheduling further ticks. A tick already running is left to finish.
	 */
	public void stop() {
		if (running.compareAndSet(true, false)) {
			LOGGER.info("EVENT=ENGINE_STOP");
		}
		Disposable pending = pendingTick.getAndSet(null);
		if (pending != null && !loopInFlight.get()) {
			pending.dispose();
		}
	}

	public boolean isRunning() {
		return running.get();
	}

	@PreDestroy
	public void shutdown() {
		stop();
		scheduler.dispose();
	}

	/**
	 * One pass over the active symbols. Returns immediately when a previous pass is still in flight.
	 */
	public Mono<Void> runOnce() {
		return Mono.defer(() -> {
			if (!loopInFlight.compareAndSet(false, true)) {
				LOGGER.warn("EVENT=LOOP_OVERLAP_SKIPPED");
				return Mono.empty();
			}
			List<String> symbols = universe.active();
			long started = System.nanoTime();
			return Flux.fromIterable(symbols)
					.flatMap(this::evaluateSafely, properties.resolvedConcurrency())
					.then(publishPositions())
					.doFinally(signal -> {
						loopInFlight.set(false);
						LOGGER.debug("EVENT=LOOP_DONE symbols={} elapsedMs={}", symbols.size(),
								Duration.ofNanos(System.nanoTime() - started).toMillis());
					});
		});
	}

	Mono<ExecutionReport> evaluate(String symbol) {
		if (properties.mode() == StrategyMode.SCALP) {
			return scalpSignalService.run(symbol);
		}
		return Mono.zip(
						marketData.snapshot(symbol, properties.resolvedKlineInterval(), properties.resolvedKlineLimit()),
						ledger.position(symbol, false))
				.flatMap(inputs -> decisionEngine.resolve(inputs.getT1(), inputs.getT2())
						.doOnNext(eventSink::decision)
						.flatMap(decision -> executor.execute(decision, inputs.getT2(),
								BigDecimal.valueOf(inputs.getT1().lastPrice()))))
				.doOnNext(eventSink::execution);
	}

	private Mono<ExecutionReport> evaluateSafely(String symbol) {
		return Mono.defer(() -> evaluate(symbol))
				.timeout(Duration.ofMillis(properties.resolvedSymbolTimeoutMs()))
				.onErrorResume(error -> {
					LOGGER.error("EVENT=LOOP_SYMBOL_FAIL symbol={} reason={}", symbol, error.toString());
					return Mono.empty();
				});
	}

	private Mono<Void> publishPositions() {
		return ledger.positions(false)
				.doOnNext(positions -> eventSink.positions(positions.values()))
				.onErrorResume(error -> {
					LOGGER.warn("EVENT=POSITIONS_PUBLISH_FAIL reason={}", error.getMessage());
					return Mono.empty();
				})
				.then();
	}

	private void scheduleNext(Duration delay) {
		if (!running.get()) {
			return;
		}
		Disposable tick = Mono.delay(delay, scheduler)
				.then(runOnce())
				.subscribe(
						ignored -> { },
						error -> {
							LOGGER.error("EVENT=LOOP_FAIL reason={}", error.getMessage(), error);
							scheduleNext(Duration.ofMillis(properties.loopIntervalMs()));
						},
						() -> scheduleNext(Duration.ofMillis(properties.loopIntervalMs())));
		pendingTick.set(tick);
	}
}
