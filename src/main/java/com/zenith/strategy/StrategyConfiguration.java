package com.zenith.strategy;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zenith.config.OracleProperties;
import com.zenith.exchange.ExchangeAdapter;
import com.zenith.execution.MarginGuard;
import com.zenith.execution.OrderExecutor;
import com.zenith.execution.PositionLedger;
import com.zenith.execution.SymbolFilterService;
import com.zenith.market.BinanceMarketClient;
import com.zenith.market.BinanceMarketDataProvider;
import com.zenith.market.MarketDataProvider;
import com.zenith.oracle.HttpPolicyOracle;
import com.zenith.oracle.HttpShockRiskOracle;
import com.zenith.oracle.HttpStrategyOracle;
import com.zenith.oracle.OracleResponseParser;
import com.zenith.oracle.PolicyOracle;
import com.zenith.oracle.ShockRiskOracle;
import com.zenith.oracle.StrategyOracle;
import com.zenith.scalp.BreakoutModel;
import com.zenith.scalp.CooldownTracker;
import com.zenith.scalp.Ema50RetestModel;
import com.zenith.scalp.ExitPlanner;
import com.zenith.scalp.MeanReversionModel;
import com.zenith.scalp.MicrostructureGate;
import com.zenith.scalp.ModelSupport;
import com.zenith.scalp.PolicyMerger;
import com.zenith.scalp.QualityScorer;
import com.zenith.scalp.ScalpCandidateEngine;
import com.zenith.scalp.ScalpFeatureBuilder;
import com.zenith.scalp.ScalpProperties;
import com.zenith.scalp.ScalpSignalService;
import com.zenith.scalp.StopTracker;

@Configuration
public class StrategyConfiguration {

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	public EngineControls engineControls(StrategyProperties properties) {
		return new EngineControls(properties.defaultLeverage(), properties.resolvedMinLeverage(),
				properties.resolvedMaxLeverage(), properties.allocationPct());
	}

	@Bean
	public SymbolFilterService symbolFilterService(ExchangeAdapter exchange, StrategyProperties properties,
			Clock clock) {
		return new SymbolFilterService(exchange, properties.filterRefreshTtlMs(), clock);
	}

	@Bean
	public PositionLedger positionLedger(ExchangeAdapter exchange, StrategyProperties properties, Clock clock) {
		return new PositionLedger(exchange, properties.resolvedPositionCacheTtlMs(),
				properties.resolvedBalanceCacheTtlMs(), properties.resolvedQuoteAsset(), clock);
	}

	@Bean
	public MarginGuard marginGuard(ExchangeAdapter exchange) {
		return new MarginGuard(exchange);
	}

	@Bean
	public OrderExecutor orderExecutor(ExchangeAdapter exchange, SymbolFilterService filterService,
			MarginGuard marginGuard, PositionLedger ledger, EngineControls controls, StrategyProperties properties) {
		return new OrderExecutor(exchange, filterService, marginGuard, ledger, controls, properties.enableOrders(),
				properties.initialBalance());
	}

	@Bean
	public MarketDataProvider marketDataProvider(BinanceMarketClient marketClient, Clock clock) {
		return new BinanceMarketDataProvider(marketClient, clock);
	}

	@Bean
	public OracleResponseParser oracleResponseParser(ObjectMapper objectMapper) {
		return new OracleResponseParser(objectMapper);
	}

	@Bean
	public StrategyOracle strategyOracle(@Qualifier("oracleWebClient") WebClient oracleWebClient,
			OracleProperties properties, OracleResponseParser parser) {
		return new HttpStrategyOracle(oracleWebClient, properties, parser);
	}

	@Bean
	public PolicyOracle policyOracle(@Qualifier("oracleWebClient") WebClient oracleWebClient,
			OracleProperties properties, OracleResponseParser parser) {
		return new HttpPolicyOracle(oracleWebClient, properties, parser);
	}

	@Bean
	public ShockRiskOracle shockRiskOracle(@Qualifier("oracleWebClient") WebClient oracleWebClient,
			OracleProperties properties) {
		return new HttpShockRiskOracle(oracleWebClient, properties);
	}

	@Bean
	public DecisionCache decisionCache(StrategyProperties properties) {
		return new DecisionCache(Duration.ofMillis(properties.resolvedDecisionRevalidationMs()),
				Duration.ofMillis(properties.resolvedDecisionCooldownMs()));
	}

	@Bean
	public DecisionEngine decisionEngine(StrategyOracle strategyOracle, DecisionCache decisionCache, Clock clock) {
		return new DecisionEngine(strategyOracle, decisionCache, clock);
	}

	@Bean
	public ScalpCandidateEngine scalpCandidateEngine(ScalpProperties scalpProperties) {
		ModelSupport support = new ModelSupport(scalpProperties, new QualityScorer(scalpProperties),
				new MicrostructureGate(scalpProperties));
		return new ScalpCandidateEngine(List.of(new BreakoutModel(support), new MeanReversionModel(support),
				new Ema50RetestModel(support)));
	}

	@Bean
	public PolicyMerger policyMerger(PolicyOracle policyOracle, ScalpProperties scalpProperties) {
		return new PolicyMerger(policyOracle, scalpProperties);
	}

	@Bean
	public StopTracker stopTracker() {
		return new StopTracker();
	}

	@Bean
	public CooldownTracker cooldownTracker(ScalpProperties scalpProperties, Clock clock) {
		return new CooldownTracker(scalpProperties.resolvedCooldownWindowMs(), scalpProperties.resolvedCooldownMs(),
				clock);
	}

	@Bean
	public TradingEventSink tradingEventSink() {
		return new LoggingTradingEventSink();
	}

	@Bean
	public ScalpSignalService scalpSignalService(MarketDataProvider marketData, SymbolFilterService filterService,
			ShockRiskOracle shockRiskOracle, ScalpCandidateEngine candidateEngine, PolicyMerger policyMerger,
			StopTracker stopTracker, CooldownTracker cooldownTracker, PositionLedger ledger, OrderExecutor executor,
			TradingEventSink eventSink, ScalpProperties scalpProperties, StrategyProperties properties, Clock clock) {
		return new ScalpSignalService(marketData, filterService, shockRiskOracle, new ScalpFeatureBuilder(),
				candidateEngine, policyMerger, new ExitPlanner(scalpProperties), stopTracker, cooldownTracker, ledger,
				executor, eventSink, scalpProperties, properties.resolvedKlineInterval(),
				properties.resolvedKlineLimit(), clock);
	}

	@Bean
	public SymbolUniverse symbolUniverse(ExchangeAdapter exchange, StrategyProperties properties) {
		return new SymbolUniverse(exchange, properties.resolvedSymbols(), properties.resolvedQuoteAsset());
	}

	@Bean
	public TradingEngine tradingEngine(StrategyProperties properties, SymbolUniverse universe,
			SymbolFilterService filterService, MarketDataProvider marketData, DecisionEngine decisionEngine,
			ScalpSignalService scalpSignalService, PositionLedger ledger, OrderExecutor executor,
			TradingEventSink eventSink) {
		return new TradingEngine(properties, universe, filterService, marketData, decisionEngine,
				scalpSignalService, ledger, executor, eventSink);
	}

	@Bean
	public TradingEngineStarter tradingEngineStarter(TradingEngine tradingEngine) {
		return new TradingEngineStarter(tradingEngine);
	}
}
