package com.mempooltracker.events.sources;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import org.bitcoinj.core.Transaction;
import org.springframework.stereotype.Component;

import com.mempooltracker.bitcoin.TxCodec;
import com.mempooltracker.components.BitcoindClient;
import com.mempooltracker.components.BitcoindClientFactory;
import com.mempooltracker.components.TransactionStore;
import com.mempooltracker.components.containers.MempoolStatsContainer;
import com.mempooltracker.entities.MempoolStats;
import com.mempooltracker.exceptions.NodeRpcException;
import com.mempooltracker.exceptions.TxDecodeException;
import com.mempooltracker.feigninterfaces.entities.MempoolEntry;
import com.mempooltracker.feigninterfaces.entities.MempoolInfo;
import com.mempooltracker.utils.PercentLog;

import lombok.extern.slf4j.Slf4j;

/**
 * Loads the node's current mempool into the store, with each transaction's real pool entrance time, before any
 * worker runs. Live events for transactions already in the pool are then recognized as known.
 */
@Slf4j
@Component
public class MempoolBackfill {

	private final BitcoindClientFactory bitcoindClientFactory;
	private final TransactionStore store;
	private final MempoolStatsContainer mempoolStatsContainer;

	public MempoolBackfill(BitcoindClientFactory bitcoindClientFactory, TransactionStore store,
			MempoolStatsContainer mempoolStatsContainer) {
		this.bitcoindClientFactory = bitcoindClientFactory;
		this.store = store;
		this.mempoolStatsContainer = mempoolStatsContainer;
	}

	/**
	 * Fails if the mempool can't be listed. Transactions leaving the pool while the backfill runs are skipped.
	 *
	 * @return number of transactions stored
	 */
	public int run() {
		BitcoindClient bitcoind = bitcoindClientFactory.create("backfill");
		Map<String, MempoolEntry> mempool = bitcoind.getRawMempoolVerbose();
		log.info("Found {} transactions in mempool", mempool.size());
		MempoolInfo mempoolInfo = bitcoind.getMempoolInfo();
		MempoolStats stats = new MempoolStats(mempoolInfo.getBytes(), mempoolInfo.getSize());
		mempoolStatsContainer.setMempoolStats(stats);

		PercentLog pl = new PercentLog(mempool.size());
		int index = 0;
		int stored = 0;
		int skipped = 0;
		for (Map.Entry<String, MempoolEntry> entry : mempool.entrySet()) {
			String txId = entry.getKey();
			try {
				Transaction tx = TxCodec.decodeHex(bitcoind.getRawTransactionInfo(txId).getHex());
				Instant foundAt = Instant.ofEpochSecond(entry.getValue().getTime());
				store.insertOrUpdate(tx, Optional.of(foundAt), stats);
				stored++;
			} catch (NodeRpcException | TxDecodeException e) {
				log.warn("Skipping txId: {} in backfill: {}", txId, e.getMessage());
				skipped++;
			}
			pl.update(index++, percent -> log.info("Backfilling mempool... {}", percent));
		}
		store.flush();
		log.info("Backfill done: {} transactions stored, {} skipped.", stored, skipped);
		return stored;
	}
}
