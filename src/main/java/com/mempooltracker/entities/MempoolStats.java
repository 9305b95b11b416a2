package com.mempooltracker.entities;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Aggregate mempool size at a point in time.
 */
@Getter
@ToString
@AllArgsConstructor
public class MempoolStats {

	private final long sizeBytes;
	private final long txCount;

	public static MempoolStats empty() {
		return new MempoolStats(0L, 0L);
	}
}
