package com.mempooltracker;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.kafka.config.KafkaListenerEndpointRegistry;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.stereotype.Component;

import com.mempooltracker.config.MempoolTrackerProperties;
import com.mempooltracker.events.sinks.RawTxEventsListener;
import com.mempooltracker.events.sources.MempoolBackfill;
import com.mempooltracker.events.sources.PeriodicTaskProducer;
import com.mempooltracker.threads.WorkerPool;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

/**
 * Startup order matters: the backfill fills the store before any worker consumes, then the producers start.
 */
@Slf4j
@Component
public class MempoolTracker implements ApplicationRunner {

	private final MempoolBackfill mempoolBackfill;
	private final WorkerPool workerPool;
	private final PeriodicTaskProducer periodicTaskProducer;
	private final KafkaListenerEndpointRegistry kafkaListenerEndpointRegistry;
	private final MempoolTrackerProperties properties;

	public MempoolTracker(MempoolBackfill mempoolBackfill, WorkerPool workerPool,
			PeriodicTaskProducer periodicTaskProducer, KafkaListenerEndpointRegistry kafkaListenerEndpointRegistry,
			MempoolTrackerProperties properties) {
		this.mempoolBackfill = mempoolBackfill;
		this.workerPool = workerPool;
		this.periodicTaskProducer = periodicTaskProducer;
		this.kafkaListenerEndpointRegistry = kafkaListenerEndpointRegistry;
		this.properties = properties;
	}

	@Override
	public void run(ApplicationArguments args) {
		log.info("===== Starting mempool tracker =====");
		mempoolBackfill.run();
		workerPool.start();
		periodicTaskProducer.start();
		rawTxListenerContainer().start();
	}

	@PreDestroy
	public void shutdown() {
		log.info("===== Stopping mempool tracker =====");
		MessageListenerContainer container = kafkaListenerEndpointRegistry
				.getListenerContainer(RawTxEventsListener.LISTENER_ID);
		if (container != null) {
			container.stop();
		}
		periodicTaskProducer.stop();
		workerPool.shutdown(properties.getShutdownTimeoutMs());
	}

	private MessageListenerContainer rawTxListenerContainer() {
		MessageListenerContainer container = kafkaListenerEndpointRegistry
				.getListenerContainer(RawTxEventsListener.LISTENER_ID);
		if (container == null) {
			throw new IllegalStateException("No Kafka listener container with id: " + RawTxEventsListener.LISTENER_ID);
		}
		return container;
	}
}
