package com.mempooltracker.entities.database;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import lombok.Getter;
import lombok.Setter;

/**
 * Lifecycle of one logical transaction. The key survives fee bumps; txid and rawBytes follow the latest
 * replacement. Timestamps are seconds since epoch, {@link #UNSET} when not reached.
 */
@Setter
@Getter
@Document(collection = "transactions")
public class TransactionRecord {

	public static final long UNSET = 0L;

	/** Inputs hash, or the txid for a coinbase. */
	@Id
	private String inputsHash;

	@Indexed
	@Field("txid")
	private String txid;

	@Field("raw_bytes")
	private byte[] rawBytes;

	@Field("found_at")
	private long foundAt = UNSET;

	@Field("mined_at")
	private long minedAt = UNSET;

	@Field("pruned_at")
	private long prunedAt = UNSET;

	@Field("mempool_size")
	private long mempoolSize;

	@Field("mempool_tx_count")
	private long mempoolTxCount;

	// Txid of the latest observed transaction spending one of this transaction's outputs.
	@Field("parent_txid")
	private String parentTxid;

	public boolean isMined() {
		return minedAt != UNSET;
	}

	public boolean isPruned() {
		return prunedAt != UNSET;
	}

	public boolean isOutstanding() {
		return !isMined() && !isPruned();
	}
}
