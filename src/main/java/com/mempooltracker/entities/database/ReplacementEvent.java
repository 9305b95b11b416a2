package com.mempooltracker.entities.database;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One observed fee bump of the transaction keyed by inputsHash. Append only.
 */
@Setter
@Getter
@NoArgsConstructor
@Document(collection = "replacements")
@CompoundIndex(name = "inputs_hash_created_at", def = "{'inputs_hash': 1, 'created_at': 1}")
public class ReplacementEvent {

	@Id
	private String id;

	@Field("inputs_hash")
	private String inputsHash;

	@Field("created_at")
	private long createdAt;

	/** Base fee of the replacing transaction, in satoshis. */
	@Field("fee_total")
	private long feeTotal;

	public ReplacementEvent(String inputsHash, long createdAt, long feeTotal) {
		this.inputsHash = inputsHash;
		this.createdAt = createdAt;
		this.feeTotal = feeTotal;
	}
}
