package com.mempooltracker.threads;

import java.util.Optional;
import java.util.Set;

import org.bitcoinj.core.Transaction;

import com.mempooltracker.bitcoin.ContentAddresser;
import com.mempooltracker.bitcoin.TxCodec;
import com.mempooltracker.components.BitcoindClient;
import com.mempooltracker.components.LifecycleLock;
import com.mempooltracker.components.TransactionStore;
import com.mempooltracker.components.containers.MempoolStatsContainer;
import com.mempooltracker.entities.MempoolStats;
import com.mempooltracker.entities.database.TransactionRecord;
import com.mempooltracker.events.Task;
import com.mempooltracker.exceptions.NodeRpcException;
import com.mempooltracker.exceptions.TransactionNotFoundException;
import com.mempooltracker.exceptions.TxDecodeException;
import com.mempooltracker.feigninterfaces.entities.MempoolInfo;

import lombok.extern.slf4j.Slf4j;

/**
 * Applies one task to the transaction store, querying the node through the worker's own client.
 */
@Slf4j
public class TaskProcessor {

	public enum TxObservation {
		COINBASE, INSERTED, MINED, REPLACED, DUPLICATE
	}

	private final BitcoindClient bitcoind;
	private final TransactionStore store;
	private final LifecycleLock lifecycleLock;
	private final MempoolStatsContainer mempoolStatsContainer;

	public TaskProcessor(BitcoindClient bitcoind, TransactionStore store, LifecycleLock lifecycleLock,
			MempoolStatsContainer mempoolStatsContainer) {
		this.bitcoind = bitcoind;
		this.store = store;
		this.lifecycleLock = lifecycleLock;
		this.mempoolStatsContainer = mempoolStatsContainer;
	}

	public void process(Task task) throws TxDecodeException, TransactionNotFoundException {
		switch (task.getTaskType()) {
		case RAW_TX:
			onRawTx(task.getRawTx());
			break;
		case PRUNE_CHECK:
			onPruneCheck();
			break;
		case MEMPOOL_STATE:
			onMempoolState();
			break;
		default:
			throw new IllegalStateException("Unknown task type: " + task.getTaskType());
		}
	}

	TxObservation onRawTx(byte[] rawTx) throws TxDecodeException, TransactionNotFoundException {
		Transaction tx = TxCodec.decode(rawTx);
		if (ContentAddresser.isCoinbase(tx)) {
			store.recordCoinbase(tx, currentMempoolStats());
			store.flush();
			return TxObservation.COINBASE;
		}

		String txId = ContentAddresser.txid(tx);
		boolean mined = bitcoind.getRawTransactionInfo(txId).isConfirmed();
		return lifecycleLock.exclusive(() -> classifyAndApply(tx, txId, mined));
	}

	// Caller holds the exclusive lifecycle lock.
	private TxObservation classifyAndApply(Transaction tx, String txId, boolean mined)
			throws TransactionNotFoundException {
		Optional<TransactionRecord> opRecord = store.find(tx);
		if (opRecord.isEmpty()) {
			// Live events carry no observation time: foundAt stays unset.
			store.insertOrUpdate(tx, Optional.empty(), currentMempoolStats());
			store.flush();
			log.info("Transaction inserted, txId: {}", txId);
			return TxObservation.INSERTED;
		}
		if (mined) {
			store.recordMined(tx);
			store.flush();
			log.info("Transaction was mined, txId: {}", txId);
			return TxObservation.MINED;
		}
		if (txId.equals(opRecord.get().getTxid())) {
			log.debug("txId: {} seen again while unconfirmed", txId);
			return TxObservation.DUPLICATE;
		}
		long fee = bitcoind.getMempoolFee(txId);
		store.recordRbf(tx, fee);
		store.flush();
		log.info("Transaction was RBF'd, txId: {} replaces txId: {}", txId, opRecord.get().getTxid());
		return TxObservation.REPLACED;
	}

	// The mempool snapshot is taken inside the lock: a record inserted or replaced after it would look pruned.
	long onPruneCheck() {
		long pruned = lifecycleLock.shared(() -> {
			Set<String> mempoolTxIds = bitcoind.getRawMempool();
			log.debug("Prune check: {} txs in mempool", mempoolTxIds.size());
			return store.recordPrunedBatch(store.txidsNotIn(mempoolTxIds));
		});
		store.flush();
		log.info("Prune check: {} pruned.", pruned);
		return pruned;
	}

	void onMempoolState() {
		MempoolInfo mempoolInfo = bitcoind.getMempoolInfo();
		long blockHeight = bitcoind.getBlockCount();
		String blockHash = bitcoind.getBlockHash(blockHeight);
		MempoolStats stats = new MempoolStats(mempoolInfo.getBytes(), mempoolInfo.getSize());
		store.recordMempoolState(stats, blockHeight, blockHash);
		store.flush();
		mempoolStatsContainer.setMempoolStats(stats);
		log.info("Mempool state: {} txs, {} bytes at height: {}", stats.getTxCount(), stats.getSizeBytes(),
				blockHeight);
	}

	// Falls back to the last sampled stats when the node can't be asked.
	private MempoolStats currentMempoolStats() {
		try {
			MempoolInfo mempoolInfo = bitcoind.getMempoolInfo();
			MempoolStats stats = new MempoolStats(mempoolInfo.getBytes(), mempoolInfo.getSize());
			mempoolStatsContainer.setMempoolStats(stats);
			return stats;
		} catch (NodeRpcException e) {
			log.debug("Using last sampled mempool stats: {}", e.getMessage());
			return mempoolStatsContainer.getMempoolStats();
		}
	}
}
