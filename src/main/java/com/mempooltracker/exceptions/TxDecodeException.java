package com.mempooltracker.exceptions;

public class TxDecodeException extends Exception {

	private static final long serialVersionUID = 4127733285136570194L;

	public TxDecodeException() {
		super();
	}

	public TxDecodeException(String message) {
		super(message);
	}

	public TxDecodeException(String message, Throwable cause) {
		super(message, cause);
	}
}
