package com.mempooltracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.mempooltracker.bitcoin.WitnessPolicy;

import lombok.Data;

@Data
@ConfigurationProperties(prefix = "mempool-tracker")
public class MempoolTrackerProperties {

	private BitcoindConfig bitcoind = new BitcoindConfig();
	private QueueConfig queue = new QueueConfig();
	private StoreConfig store = new StoreConfig();

	/**
	 * Kafka topic carrying raw transaction bytes, one message per mempool event.
	 */
	private String rawTxTopic = "rawTxEvents";

	/**
	 * Number of task workers, each with its own bitcoind handle.
	 */
	private int workers = 2;

	private long pruneCheckIntervalMs = 5_000;

	private long mempoolStateIntervalMs = 60_000;

	/**
	 * Maximum time to wait for workers to drain the queue on shutdown.
	 */
	private long shutdownTimeoutMs = 30_000;

	@Data
	public static class BitcoindConfig {
		private String url = "http://localhost:8332";
		private String user = "";
		private String password = "";
	}

	@Data
	public static class QueueConfig {
		private int capacity = 10_000;
	}

	@Data
	public static class StoreConfig {
		/**
		 * Whether witness data is removed from stored transaction bytes.
		 */
		private WitnessPolicy witnessPolicy = WitnessPolicy.STRIP;

		/**
		 * Issue an fsync on the admin database on every flush. Needs clusterAdmin rights.
		 */
		private boolean fsyncOnFlush = false;
	}
}
