package com.zenith.scalp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import com.zenith.exchange.TimeInForce;
import com.zenith.exchange.TradingFilters;
import com.zenith.execution.ExecutionOutcome;
import com.zenith.execution.ExecutionReport;
import com.zenith.execution.OrderExecutor;
import com.zenith.execution.Position;
import com.zenith.execution.PositionLedger;
import com.zenith.execution.StrategyMetadata;
import com.zenith.execution.SymbolFilterService;
import com.zenith.market.Candle;
import com.zenith.market.MarketDataProvider;
import com.zenith.market.MarketSnapshot;
import com.zenith.oracle.ShockRiskOracle;
import com.zenith.strategy.Decision;
import com.zenith.strategy.TradeSide;
import com.zenith.strategy.TradingEventSink;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class ScalpSignalServiceTest {

	private static final String SYMBOL = "BTCUSDT";
	private static final Instant NOW = Instant.parse("2024-05-01T12:40:02Z");

	private final List<Candle> candles = ScalpFixtures.trend(40, 100, 0.1);
	private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
	private final MarketDataProvider marketData = Mockito.mock(MarketDataProvider.class);
	private final SymbolFilterService filterService = Mockito.mock(SymbolFilterService.class);
	private final ShockRiskOracle shockRiskOracle = Mockito.mock(ShockRiskOracle.class);
	private final ScalpCandidateEngine candidateEngine = Mockito.mock(ScalpCandidateEngine.class);
	private final PolicyMerger policyMerger = Mockito.mock(PolicyMerger.class);
	private final PositionLedger ledger = Mockito.mock(PositionLedger.class);
	private final OrderExecutor executor = Mockito.mock(OrderExecutor.class);
	private final TradingEventSink eventSink = Mockito.mock(TradingEventSink.class);
	private final StopTracker stopTracker = new StopTracker();
	private final CooldownTracker cooldownTracker = new CooldownTracker(900_000, 1_800_000, clock);
	private final ScalpProperties properties = ScalpProperties.defaults();

	private ScalpSignalService service;

	@BeforeEach
	void setUp() {
		service = new ScalpSignalService(marketData, filterService, shockRiskOracle, new ScalpFeatureBuilder(),
				candidateEngine, policyMerger, new ExitPlanner(properties), stopTracker, cooldownTracker, ledger,
				executor, eventSink, properties, "1m", 120, clock);
		when(marketData.snapshot(eq(SYMBOL), anyString(), anyInt()))
				.thenReturn(Mono.just(new MarketSnapshot(SYMBOL, "1m", candles, null, null, null)));
		when(marketData.book(SYMBOL)).thenReturn(Mono.just(ScalpFixtures.tightBook(104.0)));
		when(filterService.filtersFor(SYMBOL)).thenReturn(Mono.just(TradingFilters.of(SYMBOL,
				new BigDecimal("0.001"), new BigDecimal("0.001"), null, new BigDecimal("5"))));
		when(shockRiskOracle.gradeFor(SYMBOL)).thenReturn(Mono.just(RiskGrade.NONE));
		when(ledger.position(eq(SYMBOL), anyBoolean())).thenReturn(Mono.just(Optional.empty()));
	}

	@Test
	void cooldownSkipsCandidateSearch() {
		cooldownTracker.register(SYMBOL, CooldownEvent.STOP);
		cooldownTracker.register(SYMBOL, CooldownEvent.STOP);

		StepVerifier.create(service.run(SYMBOL))
				.assertNext(report -> assertThat(report.outcome()).isEqualTo(ExecutionOutcome.SKIPPED_COOLDOWN))
				.verifyComplete();

		verifyNoInteractions(candidateEngine, policyMerger, executor);
		verify(eventSink).execution(any(ExecutionReport.class));
	}

	@Test
	void noSelectedCandidateReportsNoSignal() {
		Candidate none = Candidate.none(new MicroSnapshot(1.0, 50, 40, 1.0), "no candidate");
		when(candidateEngine.build(any(), eq(RiskGrade.NONE))).thenReturn(List.of(none));
		when(policyMerger.merge(any(), eq(RiskGrade.NONE), anyList())).thenReturn(Mono.just(List.of(none)));
		when(policyMerger.select(anyList())).thenReturn(Optional.empty());

		StepVerifier.create(service.run(SYMBOL))
				.assertNext(report -> {
					assertThat(report.outcome()).isEqualTo(ExecutionOutcome.NO_SIGNAL);
					assertThat(report.detail()).contains("no candidate");
				})
				.verifyComplete();

		verifyNoInteractions(executor);
	}

	@Test
	void filledEntryIsTrackedAndTagged() {
		Candidate candidate = ScalpFixtures.candidate(CandidateSignal.LONG, CandidateModel.BREAKOUT, 0.82);
		when(candidateEngine.build(any(), eq(RiskGrade.NONE))).thenReturn(List.of(candidate));
		when(policyMerger.merge(any(), eq(RiskGrade.NONE), anyList())).thenReturn(Mono.just(List.of(candidate)));
		when(policyMerger.select(anyList())).thenReturn(Optional.of(candidate));
		when(executor.execute(any(Decision.class), eq(Optional.empty()), any(BigDecimal.class)))
				.thenReturn(Mono.just(new ExecutionReport(SYMBOL, ExecutionOutcome.FILLED, null, 7L, "FILLED",
						new BigDecimal("0.010"), new BigDecimal("104.0"), 1, null)));

		StepVerifier.create(service.run(SYMBOL))
				.assertNext(report -> assertThat(report.outcome()).isEqualTo(ExecutionOutcome.FILLED))
				.verifyComplete();

		TrackedStop tracked = stopTracker.get(SYMBOL).orElseThrow();
		assertThat(tracked.plan().side()).isEqualTo(TradeSide.LONG);
		assertThat(tracked.stop()).isLessThan(104.0);
		verify(eventSink).decision(any(Decision.class));
		verify(ledger).attachMetadata(eq(SYMBOL), any(StrategyMetadata.class));
		assertThat(cooldownTracker.state(SYMBOL).slippageEvents()).isEmpty();
	}

	@Test
	void breachedStopFlattensWithIocAndCountsTowardCooldown() {
		givenOpenLong();
		stopTracker.track(new ExitPlan(SYMBOL, CandidateModel.BREAKOUT, TradeSide.LONG, 104.2, 103.5, 105.0, null,
				3.0, 900, 15, NOW.minusSeconds(120), candles.get(37).openTime()));
		when(executor.closePosition(eq(SYMBOL), any(BigDecimal.class), eq(TimeInForce.IOC), anyString()))
				.thenReturn(Mono.just(ExecutionReport.of(SYMBOL, ExecutionOutcome.CLOSED, "closed")));

		StepVerifier.create(service.run(SYMBOL))
				.assertNext(report -> assertThat(report.outcome()).isEqualTo(ExecutionOutcome.CLOSED))
				.verifyComplete();

		assertThat(stopTracker.get(SYMBOL)).isEmpty();
		assertThat(cooldownTracker.state(SYMBOL).stopEvents()).hasSize(1);
		verify(executor, never()).execute(any(), any(), any());
	}

	@Test
	void freshEntryIsNotStoppedByItsOwnCandle() {
		givenOpenLong();
		stopTracker.track(new ExitPlan(SYMBOL, CandidateModel.BREAKOUT, TradeSide.LONG, 104.0, 103.5, 105.0, null,
				3.0, 900, 15, NOW.minusSeconds(10), candles.get(39).openTime()));

		StepVerifier.create(service.run(SYMBOL))
				.assertNext(report -> {
					assertThat(report.outcome()).isEqualTo(ExecutionOutcome.HOLD);
					assertThat(report.detail()).isEqualTo("tracking");
				})
				.verifyComplete();

		assertThat(stopTracker.get(SYMBOL)).isPresent();
		assertThat(cooldownTracker.state(SYMBOL).stopEvents()).isEmpty();
		verify(executor, never()).closePosition(anyString(), any(), any(), anyString());
	}

	@Test
	void unfilledStopExitKeepsTheStopForTheNextTick() {
		givenOpenLong();
		stopTracker.track(new ExitPlan(SYMBOL, CandidateModel.BREAKOUT, TradeSide.LONG, 104.2, 103.5, 105.0, null,
				3.0, 900, 15, NOW.minusSeconds(120), candles.get(37).openTime()));
		when(executor.closePosition(eq(SYMBOL), any(BigDecimal.class), eq(TimeInForce.IOC), anyString()))
				.thenReturn(Mono.just(ExecutionReport.of(SYMBOL, ExecutionOutcome.EXIT_UNFILLED, "unfilled 0.01")));

		StepVerifier.create(service.run(SYMBOL))
				.assertNext(report -> assertThat(report.outcome()).isEqualTo(ExecutionOutcome.EXIT_UNFILLED))
				.verifyComplete();

		assertThat(stopTracker.get(SYMBOL)).isPresent();
		assertThat(cooldownTracker.state(SYMBOL).stopEvents()).isEmpty();
	}

	@Test
	void untrackedPositionIsLeftAlone() {
		givenOpenLong();

		StepVerifier.create(service.run(SYMBOL))
				.assertNext(report -> {
					assertThat(report.outcome()).isEqualTo(ExecutionOutcome.HOLD);
					assertThat(report.detail()).isEqualTo("untracked position");
				})
				.verifyComplete();

		verifyNoInteractions(executor, candidateEngine);
	}

	private void givenOpenLong() {
		Position position = new Position(SYMBOL, TradeSide.LONG, new BigDecimal("0.010"), new BigDecimal("104.2"),
				new BigDecimal("104.0"), new BigDecimal("-0.002"), null);
		when(ledger.position(eq(SYMBOL), anyBoolean())).thenReturn(Mono.just(Optional.of(position)));
	}
}
