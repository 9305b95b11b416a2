package com.mempooltracker.components;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.bitcoinj.core.Transaction;
import org.bson.Document;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import com.mempooltracker.bitcoin.ContentAddresser;
import com.mempooltracker.bitcoin.TxCodec;
import com.mempooltracker.bitcoin.WitnessPolicy;
import com.mempooltracker.config.MempoolTrackerProperties;
import com.mempooltracker.entities.MempoolStats;
import com.mempooltracker.entities.database.MempoolSnapshot;
import com.mempooltracker.entities.database.ReplacementEvent;
import com.mempooltracker.entities.database.TransactionRecord;
import com.mempooltracker.exceptions.TransactionNotFoundException;
import com.mempooltracker.repositories.MempoolSnapshotRepository;
import com.mempooltracker.repositories.ReplacementEventRepository;
import com.mempooltracker.repositories.TransactionRecordRepository;
import com.mongodb.client.result.UpdateResult;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
public class TransactionStoreImpl implements TransactionStore {

	static final int PRUNE_CHUNK_SIZE = 1000;

	private final TransactionRecordRepository txRepository;
	private final ReplacementEventRepository replacementRepository;
	private final MempoolSnapshotRepository snapshotRepository;
	private final MongoTemplate mongoTemplate;
	private final Clock clock;
	private final WitnessPolicy witnessPolicy;
	private final boolean fsyncOnFlush;

	@Autowired
	public TransactionStoreImpl(TransactionRecordRepository txRepository,
			ReplacementEventRepository replacementRepository, MempoolSnapshotRepository snapshotRepository,
			MongoTemplate mongoTemplate, Clock clock, MempoolTrackerProperties properties) {
		this(txRepository, replacementRepository, snapshotRepository, mongoTemplate, clock,
				properties.getStore().getWitnessPolicy(), properties.getStore().isFsyncOnFlush());
	}

	public TransactionStoreImpl(TransactionRecordRepository txRepository,
			ReplacementEventRepository replacementRepository, MempoolSnapshotRepository snapshotRepository,
			MongoTemplate mongoTemplate, Clock clock, WitnessPolicy witnessPolicy, boolean fsyncOnFlush) {
		this.txRepository = txRepository;
		this.replacementRepository = replacementRepository;
		this.snapshotRepository = snapshotRepository;
		this.mongoTemplate = mongoTemplate;
		this.clock = clock;
		this.witnessPolicy = witnessPolicy;
		this.fsyncOnFlush = fsyncOnFlush;
	}

	@Override
	public void recordCoinbase(Transaction tx, MempoolStats stats) {
		if (!ContentAddresser.isCoinbase(tx)) {
			return;
		}
		String txId = ContentAddresser.txid(tx);
		long now = now();
		TransactionRecord record = new TransactionRecord();
		record.setInputsHash(txId);
		record.setTxid(txId);
		record.setRawBytes(TxCodec.encode(tx, witnessPolicy));
		record.setFoundAt(now);
		record.setMinedAt(now);
		record.setPrunedAt(TransactionRecord.UNSET);
		record.setMempoolSize(stats.getSizeBytes());
		record.setMempoolTxCount(stats.getTxCount());
		txRepository.save(record);
		log.info("Coinbase recorded, txId: {}", txId);
	}

	@Override
	public void insertOrUpdate(Transaction tx, Optional<Instant> foundAt, MempoolStats stats) {
		String inputsHash = ContentAddresser.inputsHash(tx);
		String txId = ContentAddresser.txid(tx);
		long foundAtSecs = foundAt.map(Instant::getEpochSecond).orElse(TransactionRecord.UNSET);

		Optional<TransactionRecord> opRecord = txRepository.findById(inputsHash);
		TransactionRecord record;
		if (opRecord.isEmpty()) {
			record = new TransactionRecord();
			record.setInputsHash(inputsHash);
			record.setFoundAt(foundAtSecs);
			record.setMempoolSize(stats.getSizeBytes());
			record.setMempoolTxCount(stats.getTxCount());
		} else {
			record = opRecord.get();
			if (record.getFoundAt() == TransactionRecord.UNSET) {
				record.setFoundAt(foundAtSecs);
			}
			log.debug("inputsHash: {} already stored as txId: {}, now txId: {}", inputsHash, record.getTxid(), txId);
		}
		record.setTxid(txId);
		record.setRawBytes(TxCodec.encode(tx, witnessPolicy));
		txRepository.save(record);

		linkSpentTransactions(tx, txId);
	}

	// Last writer wins when several observed transactions spend outputs of the same parent.
	private void linkSpentTransactions(Transaction tx, String txId) {
		Set<String> spentTxIds = ContentAddresser.spentTxids(tx);
		if (spentTxIds.isEmpty()) {
			return;
		}
		Query query = Query.query(Criteria.where("txid").in(spentTxIds));
		UpdateResult result = mongoTemplate.updateMulti(query, Update.update("parentTxid", txId),
				TransactionRecord.class);
		if (result != null && result.getModifiedCount() > 0) {
			log.debug("txId: {} linked as spender of {} stored transactions", txId, result.getModifiedCount());
		}
	}

	@Override
	public boolean exists(Transaction tx) {
		return txRepository.existsById(ContentAddresser.inputsHash(tx));
	}

	@Override
	public Optional<TransactionRecord> find(Transaction tx) {
		return txRepository.findById(ContentAddresser.inputsHash(tx));
	}

	@Override
	public Optional<TransactionRecord> findByTxid(String txid) {
		return txRepository.findFirstByTxid(txid);
	}

	@Override
	public List<ReplacementEvent> replacementsOf(String inputsHash) {
		return replacementRepository.findByInputsHashOrderByCreatedAtAsc(inputsHash);
	}

	@Override
	public void recordMined(Transaction tx) throws TransactionNotFoundException {
		TransactionRecord record = getRecord(tx);
		if (record.isOutstanding()) {
			record.setMinedAt(now());
		} else {
			log.info("txId: {} already {}, keeping its state", record.getTxid(),
					record.isMined() ? "mined" : "pruned");
		}
		record.setTxid(ContentAddresser.txid(tx));
		record.setRawBytes(TxCodec.encode(tx, witnessPolicy));
		txRepository.save(record);
	}

	@Override
	public void recordRbf(Transaction tx, long feeTotal) throws TransactionNotFoundException {
		TransactionRecord record = getRecord(tx);
		String txId = ContentAddresser.txid(tx);
		replacementRepository.save(new ReplacementEvent(record.getInputsHash(), now(), feeTotal));
		log.info("txId: {} replaced by txId: {}, fee: {} sat", record.getTxid(), txId, feeTotal);
		record.setTxid(txId);
		record.setRawBytes(TxCodec.encode(tx, witnessPolicy));
		txRepository.save(record);
	}

	private TransactionRecord getRecord(Transaction tx) throws TransactionNotFoundException {
		String inputsHash = ContentAddresser.inputsHash(tx);
		Optional<TransactionRecord> opRecord = txRepository.findById(inputsHash);
		if (opRecord.isEmpty()) {
			throw new TransactionNotFoundException("No transaction stored for inputsHash: " + inputsHash
					+ " (txId: " + ContentAddresser.txid(tx) + ")");
		}
		return opRecord.get();
	}

	@Override
	public Set<String> txidsNotIn(Set<String> mempoolTxids) {
		Query query = Query.query(outstanding());
		query.fields().include("txid");
		return mongoTemplate.find(query, TransactionRecord.class).stream().map(TransactionRecord::getTxid)
				.filter(txId -> txId != null && !mempoolTxids.contains(txId))
				.collect(Collectors.toCollection(LinkedHashSet::new));
	}

	@Override
	public long recordPrunedBatch(Collection<String> txids) {
		if (txids.isEmpty()) {
			return 0L;
		}
		long now = now();
		List<String> txIdList = new ArrayList<>(txids);
		long marked = 0L;
		for (int from = 0; from < txIdList.size(); from += PRUNE_CHUNK_SIZE) {
			List<String> chunk = txIdList.subList(from, Math.min(from + PRUNE_CHUNK_SIZE, txIdList.size()));
			Query query = Query.query(outstanding().and("txid").in(chunk));
			UpdateResult result = mongoTemplate.updateMulti(query, Update.update("prunedAt", now),
					TransactionRecord.class);
			marked += result.getModifiedCount();
		}
		return marked;
	}

	private static Criteria outstanding() {
		return Criteria.where("minedAt").is(TransactionRecord.UNSET).and("prunedAt").is(TransactionRecord.UNSET);
	}

	@Override
	public void recordMempoolState(MempoolStats stats, long blockHeight, String blockHash) {
		MempoolSnapshot snapshot = new MempoolSnapshot();
		snapshot.setRecordedAt(now());
		snapshot.setMempoolSize(stats.getSizeBytes());
		snapshot.setMempoolTxCount(stats.getTxCount());
		snapshot.setBlockHeight(blockHeight);
		snapshot.setBlockHash(blockHash);
		snapshotRepository.save(snapshot);
	}

	@Override
	public void flush() {
		// Writes are already journaled (see MongoConfig); fsync also forces the data files.
		if (fsyncOnFlush) {
			mongoTemplate.getMongoDatabaseFactory().getMongoDatabase("admin").runCommand(new Document("fsync", 1));
		}
	}

	private long now() {
		return clock.instant().getEpochSecond();
	}
}
