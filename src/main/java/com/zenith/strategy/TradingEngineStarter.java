package com.zenith.strategy;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;

import jakarta.annotation.PreDestroy;

/**
 * Starts the loop once the context is ready. A start failure is rethrown so the application does not come up
 * without tradable symbols.
 */
public class TradingEngineStarter implements ApplicationListener<ApplicationReadyEvent> {

	private static final Logger LOGGER = LoggerFactory.getLogger(TradingEngineStarter.class);
	private static final Duration START_TIMEOUT = Duration.ofSeconds(60);

	private final TradingEngine engine;

	public TradingEngineStarter(TradingEngine engine) {
		this.engine = engine;
	}

	@Override
	public void onApplicationEvent(ApplicationReadyEvent event) {
		try {
			engine.start().block(START_TIMEOUT);
		} catch (RuntimeException ex) {
			LOGGER.error("EVENT=ENGINE_START_FAILED message={}", ex.getMessage(), ex);
			throw ex;
		}
	}

	@PreDestroy
	public void shutdown() {
		engine.stop();
	}
}
