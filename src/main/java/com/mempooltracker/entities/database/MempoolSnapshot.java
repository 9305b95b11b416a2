package com.mempooltracker.entities.database;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import lombok.Getter;
import lombok.Setter;

@Setter
@Getter
@Document(collection = "mempool_snapshots")
public class MempoolSnapshot {

	@Id
	private String id;

	@Indexed
	@Field("recorded_at")
	private long recordedAt;

	@Field("mempool_size")
	private long mempoolSize;

	@Field("mempool_tx_count")
	private long mempoolTxCount;

	@Field("block_height")
	private long blockHeight;

	@Field("block_hash")
	private String blockHash;
}
