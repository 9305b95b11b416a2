package com.mempooltracker.threads;

import java.util.Optional;
import java.util.function.Consumer;

import org.apache.commons.lang3.exception.ExceptionUtils;
import org.springframework.dao.DataAccessException;

import com.mempooltracker.components.alarms.AlarmLogger;
import com.mempooltracker.components.containers.TaskQueue;
import com.mempooltracker.events.Task;
import com.mempooltracker.exceptions.NodeRpcException;
import com.mempooltracker.exceptions.TransactionNotFoundException;
import com.mempooltracker.exceptions.TxDecodeException;

import lombok.extern.slf4j.Slf4j;

/**
 * Drains the task queue until it is closed. A failing task is logged and skipped; only a storage failure stops
 * the worker.
 */
@Slf4j
public class TaskWorker implements Runnable {

	private final String name;
	private final TaskQueue taskQueue;
	private final TaskProcessor taskProcessor;
	private final AlarmLogger alarmLogger;
	private final Consumer<TaskWorker> onTermination;

	private Thread thread = null;

	public TaskWorker(String name, TaskQueue taskQueue, TaskProcessor taskProcessor, AlarmLogger alarmLogger,
			Consumer<TaskWorker> onTermination) {
		this.name = name;
		this.taskQueue = taskQueue;
		this.taskProcessor = taskProcessor;
		this.alarmLogger = alarmLogger;
		this.onTermination = onTermination;
	}

	public String getName() {
		return name;
	}

	public synchronized void start() {
		if (thread != null)
			throw new IllegalStateException("This worker accepts only one start");
		thread = new Thread(this, name);
		thread.start();
	}

	public boolean join(long millis) throws InterruptedException {
		if (thread == null) {
			return true;
		}
		thread.join(millis);
		return !thread.isAlive();
	}

	public void interrupt() {
		if (thread != null) {
			thread.interrupt();
		}
	}

	@Override
	public void run() {
		try {
			Optional<Task> opTask = taskQueue.receive();
			while (opTask.isPresent()) {
				dispatch(opTask.get());
				opTask = taskQueue.receive();
			}
			log.info("{} shutting down, task queue closed and drained.", name);
		} catch (DataAccessException e) {
			log.error("{} stopped by a storage failure", name, e);
			alarmLogger.addAlarm("Storage failure stopped " + name + ": " + ExceptionUtils.getStackTrace(e));
		} catch (InterruptedException e) {
			log.info("{} interrupted for shutdown.", name);
			Thread.currentThread().interrupt();
		} finally {
			onTermination.accept(this);
		}
	}

	void dispatch(Task task) {
		try {
			taskProcessor.process(task);
		} catch (TxDecodeException e) {
			log.error("Discarding {}: {}", task, e.getMessage());
		} catch (NodeRpcException e) {
			log.error("bitcoind call failed while processing {}: {}", task, e.getMessage());
		} catch (TransactionNotFoundException e) {
			// Usually a mined/rbf observation that raced ahead of the insert of its base transaction.
			log.error("Ordering anomaly while processing {}: {}", task, e.getMessage());
			alarmLogger.addAlarm("Ordering anomaly: " + e.getMessage());
		} catch (DataAccessException e) {
			throw e;
		} catch (RuntimeException e) {
			log.error("Unexpected error processing {}", task, e);
		}
	}

}
