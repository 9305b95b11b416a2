package com.mempooltracker.feigninterfaces;

import java.util.List;
import java.util.Map;

import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

import com.mempooltracker.config.BitcoindFeignConfiguration;
import com.mempooltracker.feigninterfaces.entities.MempoolEntry;
import com.mempooltracker.feigninterfaces.entities.MempoolInfo;
import com.mempooltracker.feigninterfaces.entities.RawTransactionInfo;
import com.mempooltracker.feigninterfaces.entities.RpcRequest;
import com.mempooltracker.feigninterfaces.entities.RpcResponse;

/**
 * bitcoind JSON-RPC. Every call goes to the same endpoint; the declared return type selects how the result is
 * read.
 */
@FeignClient(name = "bitcoind", url = "${mempool-tracker.bitcoind.url}", configuration = BitcoindFeignConfiguration.class)
public interface BitcoindRpc {

	@PostMapping(value = "/", consumes = "application/json")
	RpcResponse<List<String>> getRawMempool(@RequestBody RpcRequest request);

	@PostMapping(value = "/", consumes = "application/json")
	RpcResponse<Map<String, MempoolEntry>> getRawMempoolVerbose(@RequestBody RpcRequest request);

	@PostMapping(value = "/", consumes = "application/json")
	RpcResponse<MempoolInfo> getMempoolInfo(@RequestBody RpcRequest request);

	@PostMapping(value = "/", consumes = "application/json")
	RpcResponse<MempoolEntry> getMempoolEntry(@RequestBody RpcRequest request);

	@PostMapping(value = "/", consumes = "application/json")
	RpcResponse<RawTransactionInfo> getRawTransaction(@RequestBody RpcRequest request);

	@PostMapping(value = "/", consumes = "application/json")
	RpcResponse<Long> getBlockCount(@RequestBody RpcRequest request);

	@PostMapping(value = "/", consumes = "application/json")
	RpcResponse<String> getBlockHash(@RequestBody RpcRequest request);

}
