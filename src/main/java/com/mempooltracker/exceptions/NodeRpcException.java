package com.mempooltracker.exceptions;

/**
 * Thrown when a bitcoind RPC call fails (transport, HTTP or JSON-RPC error).
 */
public class NodeRpcException extends RuntimeException {

	private static final long serialVersionUID = 6604581733140112985L;

	public NodeRpcException(String message) {
		super(message);
	}

	public NodeRpcException(String message, Throwable cause) {
		super(message, cause);
	}
}
