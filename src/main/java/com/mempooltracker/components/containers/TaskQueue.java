package com.mempooltracker.components.containers;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.apache.commons.lang3.Validate;

import com.mempooltracker.events.Task;
import com.mempooltracker.exceptions.QueueClosedException;

/**
 * Bounded FIFO of tasks shared by every producer and worker.
 * <p>
 * {@link #send(Task)} waits while the queue is full, so a slow worker pool throttles ingestion instead of losing
 * tasks. After {@link #close()} no task is accepted and receivers get the remaining ones, then an empty result.
 */
public class TaskQueue {

	private static final long POLL_MILLIS = 200L;

	private final BlockingQueue<Task> queue;
	private final int capacity;
	private volatile boolean closed = false;

	public TaskQueue(int capacity) {
		Validate.isTrue(capacity > 0, "queue capacity must be positive, was: %d", capacity);
		this.capacity = capacity;
		this.queue = new LinkedBlockingQueue<>(capacity);
	}

	public void send(Task task) throws InterruptedException {
		Validate.notNull(task, "task can't be null");
		while (!closed) {
			if (queue.offer(task, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
				return;
			}
		}
		throw new QueueClosedException("Task queue is closed, dropping " + task.getTaskType() + " task");
	}

	/**
	 * Next task in arrival order, waiting while there is none. Empty once the queue is closed and drained.
	 */
	public Optional<Task> receive() throws InterruptedException {
		while (true) {
			Task task = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
			if (task != null) {
				return Optional.of(task);
			}
			if (closed) {
				// A send may have completed just before close.
				return Optional.ofNullable(queue.poll());
			}
		}
	}

	public void close() {
		closed = true;
	}

	public boolean isClosed() {
		return closed;
	}

	public int size() {
		return queue.size();
	}

	public int getCapacity() {
		return capacity;
	}
}
