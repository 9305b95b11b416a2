package com.mempooltracker.components;

import org.springframework.stereotype.Component;

import com.mempooltracker.feigninterfaces.BitcoindRpc;

@Component
public class BitcoindClientFactory {

	private final BitcoindRpc bitcoindRpc;

	public BitcoindClientFactory(BitcoindRpc bitcoindRpc) {
		this.bitcoindRpc = bitcoindRpc;
	}

	public BitcoindClient create(String owner) {
		return new BitcoindClient(bitcoindRpc, owner);
	}
}
