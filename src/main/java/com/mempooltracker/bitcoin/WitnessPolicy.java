package com.mempooltracker.bitcoin;

/**
 * How witness data is treated when a transaction is serialized for storage.
 */
public enum WitnessPolicy {
	/** Witnesses are cleared; the stored bytes are the legacy (non-segwit) serialization. */
	STRIP,
	/** Bytes are stored as received. */
	KEEP
}
