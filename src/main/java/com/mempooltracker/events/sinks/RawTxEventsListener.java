package com.mempooltracker.events.sinks;

import org.springframework.context.event.EventListener;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.event.ConsumerStoppedEvent;
import org.springframework.stereotype.Component;

import com.mempooltracker.MempoolTrackerApplication;
import com.mempooltracker.components.alarms.AlarmLogger;
import com.mempooltracker.components.containers.TaskQueue;
import com.mempooltracker.events.Task;
import com.mempooltracker.exceptions.QueueClosedException;

import lombok.extern.slf4j.Slf4j;

/**
 * Live source of raw transactions. Each message is the serialized transaction of one node mempool event; it is
 * queued as is, blocking the consumer while the task queue is full.
 */
@Slf4j
@Component
public class RawTxEventsListener {

	public static final String LISTENER_ID = "rawTxListener";

	private final TaskQueue taskQueue;
	private final AlarmLogger alarmLogger;

	public RawTxEventsListener(TaskQueue taskQueue, AlarmLogger alarmLogger) {
		this.taskQueue = taskQueue;
		this.alarmLogger = alarmLogger;
	}

	@KafkaListener(id = LISTENER_ID, topics = "${mempool-tracker.raw-tx-topic}", autoStartup = "false")
	public void onRawTx(byte[] payload) {
		if (payload == null || payload.length == 0) {
			log.warn("Ignoring empty rawTx message");
			return;
		}
		try {
			taskQueue.send(Task.rawTx(payload));
		} catch (QueueClosedException e) {
			log.debug(e.getMessage());
		} catch (InterruptedException e) {
			log.info("rawTx listener interrupted for shutdown.");
			Thread.currentThread().interrupt();
		}
	}

	// The stream is the primary source: without it there is nothing left to track.
	@EventListener
	public void onConsumerStopped(ConsumerStoppedEvent event) {
		if (event.getReason() == ConsumerStoppedEvent.Reason.NORMAL) {
			log.info("rawTx consumer stopped.");
			return;
		}
		log.error("rawTx consumer stopped abnormally, reason: {}", event.getReason());
		alarmLogger.addAlarm("rawTx consumer stopped, reason: " + event.getReason() + ". Stopping mempoolTracker.");
		MempoolTrackerApplication.exit();
	}
}
