package com.mempooltracker.events.sources;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import com.mempooltracker.components.containers.TaskQueue;
import com.mempooltracker.config.MempoolTrackerProperties;
import com.mempooltracker.config.SchedulerConfig;
import com.mempooltracker.events.Task;
import com.mempooltracker.exceptions.QueueClosedException;

import lombok.extern.slf4j.Slf4j;

/**
 * Tickers for the reconciliation tasks: prune checks every few seconds, mempool snapshots every minute. The first
 * tick of each is immediate.
 */
@Slf4j
@Component
public class PeriodicTaskProducer {

	private final TaskScheduler tickerScheduler;
	private final TaskQueue taskQueue;
	private final MempoolTrackerProperties properties;
	private final List<ScheduledFuture<?>> tickers = new ArrayList<>();

	public PeriodicTaskProducer(@Qualifier(SchedulerConfig.TICKER_SCHEDULER) TaskScheduler tickerScheduler,
			TaskQueue taskQueue, MempoolTrackerProperties properties) {
		this.tickerScheduler = tickerScheduler;
		this.taskQueue = taskQueue;
		this.properties = properties;
	}

	public synchronized void start() {
		if (!tickers.isEmpty())
			throw new IllegalStateException("Tickers already started");
		tickers.add(tickerScheduler.scheduleWithFixedDelay(() -> emit(Task.pruneCheck()),
				Duration.ofMillis(properties.getPruneCheckIntervalMs())));
		tickers.add(tickerScheduler.scheduleWithFixedDelay(() -> emit(Task.mempoolState()),
				Duration.ofMillis(properties.getMempoolStateIntervalMs())));
		log.info("Tickers started: prune check every {} ms, mempool state every {} ms.",
				properties.getPruneCheckIntervalMs(), properties.getMempoolStateIntervalMs());
	}

	public synchronized void stop() {
		tickers.forEach(ticker -> ticker.cancel(true));
		tickers.clear();
	}

	void emit(Task task) {
		try {
			taskQueue.send(task);
		} catch (QueueClosedException e) {
			log.debug(e.getMessage());
		} catch (InterruptedException e) {
			log.debug("Ticker interrupted while sending {}", task);
			Thread.currentThread().interrupt();
		}
	}
}
