package com.mempooltracker.exceptions;

/**
 * Thrown to producers sending on a task queue that has been closed for shutdown.
 */
public class QueueClosedException extends RuntimeException {

	private static final long serialVersionUID = -1480237617020357306L;

	public QueueClosedException(String message) {
		super(message);
	}
}
