package com.mempooltracker.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Ticker pool (2 threads): one for prune checks, one for mempool snapshots. A ticker may block on a full task
 * queue, so each needs its own thread.
 */
@Configuration
public class SchedulerConfig {

	public static final String TICKER_SCHEDULER = "ticker-scheduler";

	@Bean(name = TICKER_SCHEDULER)
	public ThreadPoolTaskScheduler tickerScheduler() {
		ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
		s.setPoolSize(2);
		s.setThreadNamePrefix("ticker-");
		s.initialize();
		return s;
	}

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}
}
