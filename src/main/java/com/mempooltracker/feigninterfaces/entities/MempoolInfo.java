package com.mempooltracker.feigninterfaces.entities;

import lombok.Getter;
import lombok.Setter;

/**
 * Result of getmempoolinfo. size is the transaction count, bytes the sum of virtual sizes.
 */
@Getter
@Setter
public class MempoolInfo {
	private boolean loaded;
	private long size;
	private long bytes;
	private long usage;
}
