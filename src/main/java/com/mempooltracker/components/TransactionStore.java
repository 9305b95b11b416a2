package com.mempooltracker.components;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.bitcoinj.core.Transaction;

import com.mempooltracker.entities.MempoolStats;
import com.mempooltracker.entities.database.ReplacementEvent;
import com.mempooltracker.entities.database.TransactionRecord;
import com.mempooltracker.exceptions.TransactionNotFoundException;

/**
 * Durable lifecycle history of mempool transactions. Records are keyed by inputs hash (see
 * {@link com.mempooltracker.bitcoin.ContentAddresser}) except coinbases, which are keyed by txid.
 * <p>
 * Each method is atomic on its own. Sequences that check a record and then mutate it must run inside the
 * {@link LifecycleLock} of the worker pool.
 */
public interface TransactionStore {

	/**
	 * Records a coinbase as found and mined now. Does nothing for any other transaction.
	 */
	void recordCoinbase(Transaction tx, MempoolStats stats);

	/**
	 * Inserts a record for a never seen inputs hash, with {@code foundAt} or the unset sentinel. An existing record
	 * is kept and only its representation advances. Links the records of the spent transactions to this one.
	 */
	void insertOrUpdate(Transaction tx, Optional<Instant> foundAt, MempoolStats stats);

	boolean exists(Transaction tx);

	Optional<TransactionRecord> find(Transaction tx);

	Optional<TransactionRecord> findByTxid(String txid);

	List<ReplacementEvent> replacementsOf(String inputsHash);

	void recordMined(Transaction tx) throws TransactionNotFoundException;

	void recordRbf(Transaction tx, long feeTotal) throws TransactionNotFoundException;

	/**
	 * Txids of records neither mined nor pruned that are missing from {@code mempoolTxids}.
	 */
	Set<String> txidsNotIn(Set<String> mempoolTxids);

	/**
	 * Marks as pruned the still outstanding records among {@code txids}.
	 *
	 * @return number of records marked
	 */
	long recordPrunedBatch(Collection<String> txids);

	void recordMempoolState(MempoolStats stats, long blockHeight, String blockHash);

	/**
	 * Returns once every write issued before the call is on stable storage.
	 */
	void flush();

}
