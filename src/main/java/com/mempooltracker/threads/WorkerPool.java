package com.mempooltracker.threads;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.stereotype.Component;

import com.mempooltracker.MempoolTrackerApplication;
import com.mempooltracker.components.BitcoindClientFactory;
import com.mempooltracker.components.LifecycleLock;
import com.mempooltracker.components.TransactionStore;
import com.mempooltracker.components.alarms.AlarmLogger;
import com.mempooltracker.components.containers.MempoolStatsContainer;
import com.mempooltracker.components.containers.TaskQueue;
import com.mempooltracker.config.MempoolTrackerProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Fixed set of task workers. Each worker owns a bitcoind client; all of them share the store, the task queue and
 * the pool's {@link LifecycleLock}.
 */
@Slf4j
@Component
public class WorkerPool {

	private final TaskQueue taskQueue;
	private final TransactionStore store;
	private final BitcoindClientFactory bitcoindClientFactory;
	private final MempoolStatsContainer mempoolStatsContainer;
	private final AlarmLogger alarmLogger;
	private final int numWorkers;

	private final LifecycleLock lifecycleLock = new LifecycleLock();
	private final List<TaskWorker> workers = new ArrayList<>();
	private final AtomicInteger liveWorkers = new AtomicInteger();
	private volatile boolean shuttingDown = false;

	public WorkerPool(TaskQueue taskQueue, TransactionStore store, BitcoindClientFactory bitcoindClientFactory,
			MempoolStatsContainer mempoolStatsContainer, AlarmLogger alarmLogger,
			MempoolTrackerProperties properties) {
		this.taskQueue = taskQueue;
		this.store = store;
		this.bitcoindClientFactory = bitcoindClientFactory;
		this.mempoolStatsContainer = mempoolStatsContainer;
		this.alarmLogger = alarmLogger;
		this.numWorkers = Math.max(1, properties.getWorkers());
	}

	public synchronized void start() {
		if (!workers.isEmpty())
			throw new IllegalStateException("Worker pool already started");
		for (int i = 0; i < numWorkers; i++) {
			String name = "task-worker-" + i;
			TaskProcessor processor = new TaskProcessor(bitcoindClientFactory.create(name), store, lifecycleLock,
					mempoolStatsContainer);
			workers.add(new TaskWorker(name, taskQueue, processor, alarmLogger, this::onWorkerTerminated));
		}
		liveWorkers.set(workers.size());
		workers.forEach(TaskWorker::start);
		log.info("{} task workers started.", workers.size());
	}

	/**
	 * Closes the task queue and waits for the workers to drain it. Workers still busy after the timeout are
	 * interrupted.
	 */
	public synchronized void shutdown(long timeoutMs) {
		shuttingDown = true;
		taskQueue.close();
		long deadline = System.currentTimeMillis() + timeoutMs;
		try {
			for (TaskWorker worker : workers) {
				long remaining = Math.max(1L, deadline - System.currentTimeMillis());
				if (!worker.join(remaining)) {
					log.warn("{} did not finish in time, {} tasks left in queue", worker.getName(), taskQueue.size());
					worker.interrupt();
				}
			}
		} catch (InterruptedException e) {
			log.info("Interrupted while waiting for task workers.");
			workers.forEach(TaskWorker::interrupt);
			Thread.currentThread().interrupt();
		}
	}

	public int getLiveWorkers() {
		return liveWorkers.get();
	}

	public LifecycleLock getLifecycleLock() {
		return lifecycleLock;
	}

	private void onWorkerTerminated(TaskWorker worker) {
		int remaining = liveWorkers.decrementAndGet();
		if (shuttingDown) {
			return;
		}
		alarmLogger.addAlarm(worker.getName() + " terminated, " + remaining + " task workers left.");
		if (remaining == 0) {
			log.error("No task workers left, stopping mempoolTracker.");
			MempoolTrackerApplication.exit();
		}
	}
}
