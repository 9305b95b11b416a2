package com.mempooltracker.components;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

import com.mempooltracker.exceptions.NodeRpcException;
import com.mempooltracker.feigninterfaces.BitcoindRpc;
import com.mempooltracker.feigninterfaces.entities.MempoolEntry;
import com.mempooltracker.feigninterfaces.entities.MempoolInfo;
import com.mempooltracker.feigninterfaces.entities.RawTransactionInfo;
import com.mempooltracker.feigninterfaces.entities.RpcRequest;
import com.mempooltracker.feigninterfaces.entities.RpcResponse;

import feign.FeignException;

/**
 * Node RPC handle owned by a single worker or producer. Request ids are prefixed with the owner's name so calls
 * can be told apart in bitcoind's debug log.
 */
public class BitcoindClient {

	private final BitcoindRpc rpc;
	private final String owner;
	private final AtomicLong requestCounter = new AtomicLong();

	public BitcoindClient(BitcoindRpc rpc, String owner) {
		this.rpc = rpc;
		this.owner = owner;
	}

	public String getOwner() {
		return owner;
	}

	public Set<String> getRawMempool() {
		List<String> txIds = call("getrawmempool", rpc::getRawMempool, false);
		return new LinkedHashSet<>(txIds);
	}

	public Map<String, MempoolEntry> getRawMempoolVerbose() {
		return call("getrawmempool", rpc::getRawMempoolVerbose, true);
	}

	public MempoolInfo getMempoolInfo() {
		return call("getmempoolinfo", rpc::getMempoolInfo);
	}

	public RawTransactionInfo getRawTransactionInfo(String txId) {
		return call("getrawtransaction", rpc::getRawTransaction, txId, true);
	}

	/**
	 * Base fee of a mempool transaction, in satoshis.
	 */
	public long getMempoolFee(String txId) {
		MempoolEntry entry = call("getmempoolentry", rpc::getMempoolEntry, txId);
		if (entry.getFees() == null || entry.getFees().getBase() == null) {
			throw new NodeRpcException("getmempoolentry returned no base fee for txId: " + txId);
		}
		try {
			return entry.getFees().getBase().movePointRight(8).longValueExact();
		} catch (ArithmeticException e) {
			throw new NodeRpcException("Fee of txId: " + txId + " is not a whole amount of satoshis", e);
		}
	}

	public long getBlockCount() {
		return call("getblockcount", rpc::getBlockCount);
	}

	public String getBlockHash(long height) {
		return call("getblockhash", rpc::getBlockHash, height);
	}

	private <T> T call(String method, Function<RpcRequest, RpcResponse<T>> invocation, Object... params) {
		RpcRequest request = RpcRequest.of(owner + "-" + requestCounter.incrementAndGet(), method, params);
		RpcResponse<T> response;
		try {
			response = invocation.apply(request);
		} catch (FeignException e) {
			throw new NodeRpcException(method + " failed (HTTP " + e.status() + "): " + e.contentUTF8(), e);
		}
		if (response == null) {
			throw new NodeRpcException(method + " returned an empty response");
		}
		if (response.getError() != null) {
			throw new NodeRpcException(method + " failed with code " + response.getError().getCode() + ": "
					+ response.getError().getMessage());
		}
		if (response.getResult() == null) {
			throw new NodeRpcException(method + " returned a null result");
		}
		return response.getResult();
	}
}
