package com.mempooltracker.feigninterfaces.entities;

import lombok.Getter;
import lombok.Setter;

/**
 * Entry of getrawmempool (verbose) and result of getmempoolentry.
 */
@Getter
@Setter
public class MempoolEntry {
	private long vsize;
	private long weight;
	/** Pool entrance time, seconds since epoch. */
	private long time;
	private long height;
	private MempoolFees fees;
}
