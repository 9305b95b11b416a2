package com.mempooltracker.components.containers;

import com.mempooltracker.entities.MempoolStats;

public interface MempoolStatsContainer {

	MempoolStats getMempoolStats();

	void setMempoolStats(MempoolStats stats);

}
