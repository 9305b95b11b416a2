package com.mempooltracker.components.containers;

import java.util.concurrent.atomic.AtomicReference;

import org.springframework.stereotype.Component;

import com.mempooltracker.entities.MempoolStats;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
public class MempoolStatsContainerImpl implements MempoolStatsContainer {

	private AtomicReference<MempoolStats> atomicMempoolStats = new AtomicReference<>(MempoolStats.empty());

	@Override
	public MempoolStats getMempoolStats() {
		return atomicMempoolStats.get();
	}

	@Override
	public void setMempoolStats(MempoolStats stats) {
		atomicMempoolStats.set(stats);
		log.debug("mempool stats: {} txs, {} bytes", stats.getTxCount(), stats.getSizeBytes());
	}

}
