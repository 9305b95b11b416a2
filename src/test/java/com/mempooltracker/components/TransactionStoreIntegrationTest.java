package com.mempooltracker.components;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.Set;

import org.bitcoinj.core.Transaction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.repository.support.MongoRepositoryFactory;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import com.mempooltracker.bitcoin.ContentAddresser;
import com.mempooltracker.bitcoin.TestTransactions;
import com.mempooltracker.bitcoin.WitnessPolicy;
import com.mempooltracker.entities.MempoolStats;
import com.mempooltracker.entities.database.ReplacementEvent;
import com.mempooltracker.entities.database.TransactionRecord;
import com.mempooltracker.exceptions.TransactionNotFoundException;
import com.mempooltracker.repositories.MempoolSnapshotRepository;
import com.mempooltracker.repositories.ReplacementEventRepository;
import com.mempooltracker.repositories.TransactionRecordRepository;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;

@Testcontainers(disabledWithoutDocker = true)
class TransactionStoreIntegrationTest {

	@Container
	static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

	private static final Instant NOW = Instant.parse("2026-01-15T12:00:00Z");
	private static final MempoolStats STATS = new MempoolStats(2_000_000L, 5_000L);

	private MongoClient mongoClient;
	private MongoTemplate mongoTemplate;
	private TransactionStoreImpl store;

	@BeforeEach
	void setUp() {
		mongoClient = MongoClients.create(mongo.getReplicaSetUrl());
		mongoTemplate = new MongoTemplate(mongoClient, "mempoolTrackerTest");
		mongoTemplate.getDb().drop();
		MongoRepositoryFactory factory = new MongoRepositoryFactory(mongoTemplate);
		store = new TransactionStoreImpl(factory.getRepository(TransactionRecordRepository.class),
				factory.getRepository(ReplacementEventRepository.class),
				factory.getRepository(MempoolSnapshotRepository.class), mongoTemplate,
				Clock.fixed(NOW, ZoneOffset.UTC), WitnessPolicy.STRIP, false);
	}

	@AfterEach
	void tearDown() {
		mongoClient.close();
	}

	@Test
	@DisplayName("backfilled transactions that leave the mempool are pruned once")
	void backfillThenPrune() {
		Transaction staying = TestTransactions.spending("a", 0, 1_000L);
		Transaction leaving = TestTransactions.spending("b", 0, 1_000L);
		store.insertOrUpdate(staying, Optional.of(Instant.ofEpochSecond(1_700_000_000L)), STATS);
		store.insertOrUpdate(leaving, Optional.of(Instant.ofEpochSecond(1_700_000_100L)), STATS);

		Set<String> gone = store.txidsNotIn(Set.of(ContentAddresser.txid(staying)));
		assertThat(gone).containsExactly(ContentAddresser.txid(leaving));
		assertThat(store.recordPrunedBatch(gone)).isEqualTo(1L);

		TransactionRecord pruned = store.find(leaving).orElseThrow();
		assertThat(pruned.getPrunedAt()).isEqualTo(NOW.getEpochSecond());
		assertThat(pruned.getFoundAt()).isEqualTo(1_700_000_100L);
		assertThat(store.find(staying).orElseThrow().isOutstanding()).isTrue();

		assertThat(store.txidsNotIn(Set.of(ContentAddresser.txid(staying)))).isEmpty();
		assertThat(store.recordPrunedBatch(gone)).isZero();
	}

	@Test
	@DisplayName("a mined transaction is never pruned")
	void minedIsNotPruned() throws TransactionNotFoundException {
		Transaction tx = TestTransactions.spending("a", 0, 1_000L);
		store.insertOrUpdate(tx, Optional.empty(), STATS);
		store.recordMined(tx);

		assertThat(store.txidsNotIn(Set.of())).isEmpty();
		assertThat(store.recordPrunedBatch(Set.of(ContentAddresser.txid(tx)))).isZero();
		TransactionRecord record = store.find(tx).orElseThrow();
		assertThat(record.getMinedAt()).isEqualTo(NOW.getEpochSecond());
		assertThat(record.getPrunedAt()).isEqualTo(TransactionRecord.UNSET);
	}

	@Test
	@DisplayName("replacements keep one record per inputs hash and append events")
	void replacementsShareOneRecord() throws TransactionNotFoundException {
		Transaction original = TestTransactions.spending("a", 0, 10_000L);
		Transaction bump1 = TestTransactions.spending("a", 0, 9_000L);
		Transaction bump2 = TestTransactions.spending("a", 0, 8_000L);
		store.insertOrUpdate(original, Optional.empty(), STATS);
		store.recordRbf(bump1, 1_000L);
		store.recordRbf(bump2, 2_000L);

		String inputsHash = ContentAddresser.inputsHash(original);
		assertThat(mongoTemplate.count(new Query(),
				TransactionRecord.class)).isEqualTo(1L);
		assertThat(store.findByTxid(ContentAddresser.txid(bump2)).orElseThrow().getInputsHash())
				.isEqualTo(inputsHash);
		assertThat(store.findByTxid(ContentAddresser.txid(original))).isEmpty();
		assertThat(store.replacementsOf(inputsHash)).extracting(ReplacementEvent::getFeeTotal).containsExactly(1_000L,
				2_000L);
	}

	@Test
	@DisplayName("a spending transaction links the record of the transaction it spends")
	void childLinksParent() {
		Transaction parent = TestTransactions.spending("a", 0, 10_000L);
		store.insertOrUpdate(parent, Optional.empty(), STATS);
		Transaction child = TestTransactions.spending(parent.getTxId(), 0, 9_000L);

		store.insertOrUpdate(child, Optional.empty(), STATS);

		assertThat(store.find(parent).orElseThrow().getParentTxid()).isEqualTo(ContentAddresser.txid(child));
		assertThat(store.find(child).orElseThrow().getParentTxid()).isNull();
	}

	@Test
	void coinbaseIsStoredByTxid() {
		Transaction coinbase = TestTransactions.coinbase(840_001);

		store.recordCoinbase(coinbase, STATS);

		TransactionRecord record = store.findByTxid(ContentAddresser.txid(coinbase)).orElseThrow();
		assertThat(record.getInputsHash()).isEqualTo(ContentAddresser.txid(coinbase));
		assertThat(record.isMined()).isTrue();
		assertThat(record.getMempoolTxCount()).isEqualTo(5_000L);
	}

	@Test
	@DisplayName("a late mined observation keeps a pruned record pruned")
	void minedAfterPruneKeepsPruned() throws TransactionNotFoundException {
		Transaction tx = TestTransactions.spending("a", 0, 1_000L);
		store.insertOrUpdate(tx, Optional.empty(), STATS);
		store.recordPrunedBatch(Set.of(ContentAddresser.txid(tx)));

		store.recordMined(tx);

		TransactionRecord record = store.find(tx).orElseThrow();
		assertThat(record.isPruned()).isTrue();
		assertThat(record.isMined()).isFalse();
	}

	@Test
	void mempoolStateIsRecorded() {
		store.recordMempoolState(STATS, 840_000L, "00000000000000000002a7c4");
		store.flush();

		assertThat(mongoTemplate.getCollection("mempool_snapshots").countDocuments()).isEqualTo(1L);
	}
}
