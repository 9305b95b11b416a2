package com.mempooltracker.config;

import org.springframework.context.annotation.Bean;

import feign.auth.BasicAuthRequestInterceptor;

// Not a @Configuration: only applied to the bitcoind client.
public class BitcoindFeignConfiguration {

	@Bean
	public BasicAuthRequestInterceptor bitcoindBasicAuth(MempoolTrackerProperties properties) {
		MempoolTrackerProperties.BitcoindConfig bitcoind = properties.getBitcoind();
		return new BasicAuthRequestInterceptor(bitcoind.getUser(), bitcoind.getPassword());
	}
}
