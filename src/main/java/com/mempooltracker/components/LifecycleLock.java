package com.mempooltracker.components;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Serializes the "look up a record, decide, mutate it" sequences of concurrent workers.
 * <p>
 * Classifying an observed transaction (new, mined or replaced) takes the exclusive side. The prune sweep reads
 * the outstanding records and marks some of them, so it takes the shared side: sweeps may overlap each other
 * but never a classification.
 */
public class LifecycleLock {

	private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

	@FunctionalInterface
	public interface LockedAction<T, E extends Exception> {
		T run() throws E;
	}

	public <T, E extends Exception> T exclusive(LockedAction<T, E> action) throws E {
		return runLocked(lock.writeLock(), action);
	}

	public <T, E extends Exception> T shared(LockedAction<T, E> action) throws E {
		return runLocked(lock.readLock(), action);
	}

	public boolean isExclusivelyHeld() {
		return lock.isWriteLocked();
	}

	private static <T, E extends Exception> T runLocked(Lock held, LockedAction<T, E> action) throws E {
		held.lock();
		try {
			return action.run();
		} finally {
			held.unlock();
		}
	}
}
