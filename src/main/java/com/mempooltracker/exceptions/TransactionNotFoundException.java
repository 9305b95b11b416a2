package com.mempooltracker.exceptions;

public class TransactionNotFoundException extends Exception {

	private static final long serialVersionUID = -3190858423071655387L;

	public TransactionNotFoundException() {
		super();
	}

	public TransactionNotFoundException(String message) {
		super(message);
	}

	public TransactionNotFoundException(String message, Throwable cause) {
		super(message, cause);
	}
}
