package com.zenith.exchange;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import reactor.core.publisher.Mono;

/**
 * Keeps the local clock offset against exchange server time so signed requests stay inside recvWindow.
 */
@Component
public class TimeSyncService {

	private static final Logger LOGGER = LoggerFactory.getLogger(TimeSyncService.class);
	private static final long RESYNC_INTERVAL_MS = 300_000L;

	private final WebClient binanceWebClient;
	private final Clock clock;
	private final AtomicLong offsetMs = new AtomicLong();
	private final AtomicReference<Mono<Long>> pendingSync = new AtomicReference<>();

	public TimeSyncService(@Qualifier("binanceWebClient") WebClient binanceWebClient) {
		this(binanceWebClient, Clock.systemUTC());
	}

	TimeSyncService(WebClient binanceWebClient, Clock clock) {
		this.binanceWebClient = binanceWebClient;
		this.clock = clock;
	}

	public long timestampMillis() {
		return clock.millis() + offsetMs.get();
	}

	public long offsetMillis() {
		return offsetMs.get();
	}

	public Mono<Long> resync() {
		Mono<Long> pending = pendingSync.get();
		if (pending != null) {
			return pending;
		}
		long previousOffset = offsetMs.get();
		Mono<Long> sync = binanceWebClient
				.get()
				.uri("/fapi/v1/time")
				.retrieve()
				.bodyToMono(ServerTime.class)
				.map(serverTime -> {
					long offset = serverTime.serverTime() - clock.millis();
					offsetMs.set(offset);
					LOGGER.debug("EVENT=TIME_SYNC offsetMs={}", offset);
					return offset;
				})
				.doOnError(error -> LOGGER.warn("EVENT=TIME_SYNC_FAIL reason={}", error.getMessage()))
				.onErrorReturn(previousOffset)
				.doFinally(signal -> pendingSync.set(null))
				.cache();
		if (pendingSync.compareAndSet(null, sync)) {
			return sync;
		}
		Mono<Long> winner = pendingSync.get();
		return winner == null ? sync : winner;
	}

	@Scheduled(initialDelay = 0L, fixedDelay = RESYNC_INTERVAL_MS)
	void scheduledResync() {
		resync().subscribe(offset -> { }, error -> LOGGER.warn("EVENT=TIME_SYNC_SCHEDULE_FAIL reason={}",
				error.getMessage()));
	}

	private record ServerTime(long serverTime) {
	}
}
