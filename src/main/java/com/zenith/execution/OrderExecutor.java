package com.zenith.execution;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zenith.exchange.ExchangeAdapter;
import com.zenith.exchange.OrderOptions;
import com.zenith.exchange.OrderSide;
import com.zenith.exchange.TimeInForce;
import com.zenith.exchange.TradingFilters;
import com.zenith.exchange.dto.OrderResponse;
import com.zenith.strategy.ConvictionGate;
import com.zenith.strategy.Decision;
import com.zenith.strategy.EngineControls;
import com.zenith.strategy.TradeSide;

import reactor.core.publisher.Mono;

/**
 * Moves a symbol between FLAT and OPEN(side) according to a {@link Decision}. Entries are sized, normalized,
 * margin-capped and placed with a halving backoff on price-band and bracket rejections.
 */
public class OrderExecutor {

	private static final Logger LOGGER = LoggerFactory.getLogger(OrderExecutor.class);
	static final int MAX_ATTEMPTS = 3;
	private static final BigDecimal TWO = BigDecimal.valueOf(2);
	private static final BigDecimal MIN_QUANTITY_DELTA = new BigDecimal("1e-8");
	private static final BigDecimal RELATIVE_QUANTITY_DELTA = new BigDecimal("1e-4");
	private static final Set<String> TERMINAL_STATUSES = Set.of("EXPIRED", "EXPIRED_IN_MATCH", "CANCELED",
			"REJECTED");

	private final ExchangeAdapter exchange;
	private final SymbolFilterService filterService;
	private final MarginGuard marginGuard;
	private final PositionLedger ledger;
	private final EngineControls controls;
	private final boolean ordersEnabled;
	private final double initialBalance;

	public OrderExecutor(ExchangeAdapter exchange, SymbolFilterService filterService, MarginGuard marginGuard,
			PositionLedger ledger, EngineControls controls, boolean ordersEnabled, double initialBalance) {
		this.exchange = exchange;
		this.filterService = filterService;
		this.marginGuard = marginGuard;
		this.ledger = ledger;
		this.controls = controls;
		this.ordersEnabled = ordersEnabled;
		this.initialBalance = initialBalance;
	}

	public Mono<ExecutionReport> execute(Decision decision, Optional<Position> position, BigDecimal referencePrice) {
		String symbol = decision.symbol();
		if (!ordersEnabled) {
			LOGGER.info("EVENT=ORDERS_DISABLED symbol={} bias={} action={}", symbol, decision.bias(),
					decision.action());
			return Mono.just(ExecutionReport.of(symbol, ExecutionOutcome.ORDERS_DISABLED, "orders disabled"));
		}
		if (decision.isExit()) {
			if (position.isEmpty()) {
				return Mono.just(ExecutionReport.of(symbol, ExecutionOutcome.NO_POSITION, "nothing to close"));
			}
			return closePosition(symbol, exitPrice(decision, position.get(), referencePrice), TimeInForce.GTC,
					decision.reasoning());
		}
		TradeSide side = decision.bias().toSide();
		if (position.isPresent() && position.get().side() == side) {
			LOGGER.info("EVENT=POSITION_HOLD symbol={} side={}", symbol, side.label());
			return Mono.just(ExecutionReport.of(symbol, ExecutionOutcome.HOLD, "aligned with " + side.label()));
		}
		if (position.isPresent()) {
			LOGGER.info("EVENT=POSITION_FLIP symbol={} from={} to={}", symbol, position.get().side().label(),
					side.label());
			return closePosition(symbol, exitPrice(decision, position.get(), referencePrice), TimeInForce.GTC,
					"flip to " + side.label())
					.flatMap(exit -> exit.outcome() == ExecutionOutcome.CLOSED
							|| exit.outcome() == ExecutionOutcome.NO_POSITION
							? openIfConvinced(decision, side, referencePrice)
							: Mono.just(exit));
		}
		return openIfConvinced(decision, side, referencePrice);
	}

	private Mono<ExecutionReport> openIfConvinced(Decision decision, TradeSide side, BigDecimal referencePrice) {
		if (!ConvictionGate.passes(decision)) {
			LOGGER.info("EVENT=CONVICTION_SKIP symbol={} confidence={} localEdge={} localConfidence={}",
					decision.symbol(), decision.confidence(), decision.localEdge(), decision.localConfidence());
			return Mono.just(ExecutionReport.of(decision.symbol(), ExecutionOutcome.SKIPPED_CONVICTION,
					"insufficient conviction"));
		}
		return open(decision.symbol(), side, decision.confidence(), referencePrice);
	}

	/**
	 * Sizes and places a new entry. Classified rejections never surface as errors.
	 */
	public Mono<ExecutionReport> open(String symbol, TradeSide side, double confidence, BigDecimal referencePrice) {
		int leverage = controls.leverage();
		return ledger.availableMargin(false)
				.flatMap(available -> {
					BigDecimal notional = OrderSizer.targetNotional(available, controls.allocationPct(), leverage,
							confidence, initialBalance);
					BigDecimal rawQty = OrderSizer.quantityFor(notional, referencePrice);
					return filterService.normalize(symbol, rawQty, referencePrice)
							.flatMap(normalized -> {
								if (!normalized.isTradable()) {
									LOGGER.warn("EVENT=QUANTITY_SKIP symbol={} rawQty={} price={} reason={}",
											symbol, rawQty, referencePrice, normalized.rejection());
									return Mono.just(ExecutionReport.of(symbol, ExecutionOutcome.SKIPPED_QUANTITY,
											String.valueOf(normalized.rejection())));
								}
								return marginGuard.enforce(symbol, leverage, referencePrice, normalized, available)
										.flatMap(check -> check.allowed()
												? placeEntry(symbol, side, leverage,
														check.order() == normalized ? rawQty : check.order().quantity(),
														check.order(), referencePrice)
												: Mono.just(ExecutionReport.of(symbol,
														ExecutionOutcome.SKIPPED_MARGIN,
														"notional cap " + check.notionalCap())));
							});
				});
	}

	private Mono<ExecutionReport> placeEntry(String symbol, TradeSide side, int leverage, BigDecimal rawQty,
			NormalizedQuantity order, BigDecimal referencePrice) {
		return exchange.setLeverage(symbol, leverage)
				.then(Mono.defer(() -> placeWithBackoff(symbol, side.entryOrderSide(), rawQty, order,
						referencePrice, 1)))
				.doOnNext(report -> {
					if (report.placedOrder()) {
						ledger.invalidate();
						LOGGER.info("EVENT=ENTRY_FILLED symbol={} side={} qty={} avgPrice={} orderId={} attempts={}",
								symbol, side.label(), report.executedQty(), report.avgPrice(), report.orderId(),
								report.attempts());
					}
				});
	}

	Mono<ExecutionReport> placeWithBackoff(String symbol, OrderSide side, BigDecimal rawQty, NormalizedQuantity order,
			BigDecimal referencePrice, int attempt) {
		return exchange.placeMarketOrder(symbol, side, order.quantityText(), OrderOptions.open())
				.map(OrderAttempt::filled)
				.onErrorResume(error -> Mono.just(OrderAttempt.rejected(error)))
				.flatMap(result -> {
					if (result.isFilled()) {
						return Mono.just(ExecutionReport.fromOrder(symbol, ExecutionOutcome.FILLED, side,
								result.fill(), attempt));
					}
					RejectionKind kind = result.rejection();
					if (kind == RejectionKind.INSUFFICIENT_MARGIN) {
						LOGGER.warn("EVENT=ORDER_INSUFFICIENT_MARGIN symbol={} qty={} reason={}", symbol,
								order.quantityText(), result.error().getMessage());
						ledger.invalidate();
						return Mono.just(reportFor(symbol, side, ExecutionOutcome.REJECTED_INSUFFICIENT_MARGIN,
								attempt, result.error().getMessage()));
					}
					if (!kind.retryable()) {
						return Mono.error(result.error());
					}
					if (attempt >= MAX_ATTEMPTS) {
						LOGGER.warn("EVENT=ORDER_RETRY_EXHAUSTED symbol={} kind={} attempts={}", symbol, kind,
								attempt);
						return Mono.just(reportFor(symbol, side, ExecutionOutcome.ABORTED_AFTER_RETRIES, attempt,
								kind.name()));
					}
					BigDecimal halved = rawQty.divide(TWO);
					NormalizedQuantity next = QuantityNormalizer.normalize(order.filters(), halved, referencePrice);
					if (!next.isTradable() || !differsMaterially(order.quantity(), next.quantity())) {
						LOGGER.warn("EVENT=ORDER_RETRY_ABORT symbol={} kind={} lastQty={} nextQty={}", symbol, kind,
								order.quantityText(), next.quantityText());
						return Mono.just(reportFor(symbol, side, ExecutionOutcome.ABORTED_AFTER_RETRIES, attempt,
								kind.name()));
					}
					LOGGER.warn("EVENT=ORDER_RETRY symbol={} kind={} attempt={} qty={} nextQty={}", symbol, kind,
							attempt, order.quantityText(), next.quantityText());
					return placeWithBackoff(symbol, side, halved, next, referencePrice, attempt + 1);
				});
	}

	/**
	 * Closes whatever the exchange currently reports for the symbol with a reduce-only limit order.
	 */
	public Mono<ExecutionReport> closePosition(String symbol, BigDecimal price, TimeInForce timeInForce,
			String reason) {
		return ledger.position(symbol, true)
				.flatMap(live -> {
					if (live.isEmpty()) {
						LOGGER.info("EVENT=EXIT_NO_POSITION symbol={}", symbol);
						return Mono.just(ExecutionReport.of(symbol, ExecutionOutcome.NO_POSITION, reason));
					}
					Position position = live.get();
					BigDecimal limitPrice = price != null && price.signum() > 0 ? price : position.entryPrice();
					return filterService.filtersFor(symbol)
							.flatMap(filters -> {
								NormalizedQuantity quantity = QuantityNormalizer.normalize(filters,
										position.quantity(), null);
								if (!quantity.isTradable()) {
									LOGGER.warn("EVENT=EXIT_QUANTITY_SKIP symbol={} qty={} reason={}", symbol,
											position.quantity(), quantity.rejection());
									return Mono.just(ExecutionReport.of(symbol, ExecutionOutcome.SKIPPED_QUANTITY,
											String.valueOf(quantity.rejection())));
								}
								OrderSide side = position.side().exitOrderSide();
								BigDecimal roundedPrice = roundToTick(limitPrice, filters, side);
								return exchange.placeLimitOrder(symbol, side, quantity.quantityText(), roundedPrice,
										OrderOptions.reduceOnly(timeInForce))
										.map(response -> exitReport(symbol, side, response, quantity.quantity()))
										.doOnNext(report -> {
											ledger.invalidate();
											if (report.outcome() == ExecutionOutcome.EXIT_UNFILLED) {
												LOGGER.warn("EVENT=EXIT_UNFILLED symbol={} side={} qty={} executedQty={} status={} "
														+ "tif={} reason={}", symbol, position.side().label(), quantity.quantityText(),
														report.executedQty(), report.status(), timeInForce, reason);
												return;
											}
											ledger.attachMetadata(symbol, null);
											LOGGER.info("EVENT=EXIT_PLACED symbol={} side={} qty={} price={} tif={} reason={}",
													symbol, position.side().label(), quantity.quantityText(),
													roundedPrice, timeInForce, reason);
										});
							});
				});
	}

	/**
	 * An exit the exchange already finished (expired, canceled or rejected) without filling the whole quantity
	 * leaves the position open, so it is not reported as closed.
	 */
	static ExecutionReport exitReport(String symbol, OrderSide side, OrderResponse response, BigDecimal requested) {
		BigDecimal executed = response.executedQty() == null ? BigDecimal.ZERO : response.executedQty();
		if (response.status() != null && TERMINAL_STATUSES.contains(response.status())
				&& executed.compareTo(requested) < 0) {
			return new ExecutionReport(symbol, ExecutionOutcome.EXIT_UNFILLED, side, response.orderId(),
					response.status(), executed, response.avgPrice(), 1,
					"unfilled " + requested.subtract(executed).stripTrailingZeros().toPlainString());
		}
		return ExecutionReport.fromOrder(symbol, ExecutionOutcome.CLOSED, side, response, 1);
	}

	static boolean differsMaterially(BigDecimal previous, BigDecimal next) {
		BigDecimal tolerance = previous.abs().multiply(RELATIVE_QUANTITY_DELTA).max(MIN_QUANTITY_DELTA);
		return previous.subtract(next).abs().compareTo(tolerance) > 0;
	}

	/**
	 * Sells round down and buys round up so a closing limit stays marketable.
	 */
	static BigDecimal roundToTick(BigDecimal price, TradingFilters filters, OrderSide side) {
		BigDecimal tick = filters.tickSize();
		if (tick == null || tick.signum() <= 0) {
			return price;
		}
		RoundingMode mode = side == OrderSide.SELL ? RoundingMode.FLOOR : RoundingMode.CEILING;
		return price.divide(tick, 0, mode).multiply(tick).stripTrailingZeros();
	}

	private static BigDecimal exitPrice(Decision decision, Position position, BigDecimal referencePrice) {
		if (decision.exitPrice() != null && decision.exitPrice() > 0) {
			return BigDecimal.valueOf(decision.exitPrice());
		}
		if (referencePrice != null && referencePrice.signum() > 0) {
			return referencePrice;
		}
		return position.entryPrice();
	}

	private static ExecutionReport reportFor(String symbol, OrderSide side, ExecutionOutcome outcome, int attempts,
			String detail) {
		return new ExecutionReport(symbol, outcome, side, null, null, BigDecimal.ZERO, null, attempts, detail);
	}
}
