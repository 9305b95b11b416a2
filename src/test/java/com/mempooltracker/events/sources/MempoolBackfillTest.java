package com.mempooltracker.events.sources;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.Utils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.mempooltracker.bitcoin.ContentAddresser;
import com.mempooltracker.bitcoin.TestTransactions;
import com.mempooltracker.components.BitcoindClient;
import com.mempooltracker.components.BitcoindClientFactory;
import com.mempooltracker.components.TransactionStore;
import com.mempooltracker.components.containers.MempoolStatsContainer;
import com.mempooltracker.entities.MempoolStats;
import com.mempooltracker.exceptions.NodeRpcException;
import com.mempooltracker.feigninterfaces.entities.MempoolEntry;
import com.mempooltracker.feigninterfaces.entities.MempoolInfo;
import com.mempooltracker.feigninterfaces.entities.RawTransactionInfo;

@ExtendWith(MockitoExtension.class)
class MempoolBackfillTest {

	@Mock
	private BitcoindClientFactory bitcoindClientFactory;
	@Mock
	private BitcoindClient bitcoind;
	@Mock
	private TransactionStore store;
	@Mock
	private MempoolStatsContainer mempoolStatsContainer;

	private MempoolBackfill backfill;

	@BeforeEach
	void setUp() {
		when(bitcoindClientFactory.create("backfill")).thenReturn(bitcoind);
		backfill = new MempoolBackfill(bitcoindClientFactory, store, mempoolStatsContainer);
	}

	@Test
	@DisplayName("each mempool transaction is stored with its pool entrance time, vanished ones are skipped")
	void storesMempoolWithEntranceTimes() {
		Transaction present = TestTransactions.spending("a", 0, 1_000L);
		String presentTxId = ContentAddresser.txid(present);
		Map<String, MempoolEntry> mempool = new LinkedHashMap<>();
		mempool.put(presentTxId, entry(1_700_000_000L));
		mempool.put("vanished", entry(1_700_000_050L));
		when(bitcoind.getRawMempoolVerbose()).thenReturn(mempool);
		when(bitcoind.getMempoolInfo()).thenReturn(mempoolInfo(4_000L, 2L));
		when(bitcoind.getRawTransactionInfo(presentTxId)).thenReturn(rawTxInfo(present));
		when(bitcoind.getRawTransactionInfo("vanished")).thenThrow(new NodeRpcException("No such mempool tx"));

		int stored = backfill.run();

		assertThat(stored).isEqualTo(1);
		ArgumentCaptor<Transaction> tx = ArgumentCaptor.forClass(Transaction.class);
		ArgumentCaptor<MempoolStats> stats = ArgumentCaptor.forClass(MempoolStats.class);
		verify(store).insertOrUpdate(tx.capture(), eq(Optional.of(Instant.ofEpochSecond(1_700_000_000L))),
				stats.capture());
		assertThat(tx.getValue().getTxId()).isEqualTo(present.getTxId());
		assertThat(stats.getValue().getTxCount()).isEqualTo(2L);
		assertThat(stats.getValue().getSizeBytes()).isEqualTo(4_000L);
		verify(store).flush();
		verify(mempoolStatsContainer).setMempoolStats(any(MempoolStats.class));
	}

	@Test
	void undecodableTransactionIsSkipped() {
		Map<String, MempoolEntry> mempool = Map.of("broken", entry(1L));
		RawTransactionInfo broken = new RawTransactionInfo();
		broken.setHex("not-hex");
		when(bitcoind.getRawMempoolVerbose()).thenReturn(mempool);
		when(bitcoind.getMempoolInfo()).thenReturn(mempoolInfo(0L, 1L));
		when(bitcoind.getRawTransactionInfo("broken")).thenReturn(broken);

		assertThat(backfill.run()).isZero();
		verify(store).flush();
	}

	@Test
	void failsWhenMempoolCantBeListed() {
		when(bitcoind.getRawMempoolVerbose()).thenThrow(new NodeRpcException("connection refused"));

		assertThatThrownBy(backfill::run).isInstanceOf(NodeRpcException.class);
		verify(store, never()).flush();
	}

	private static MempoolEntry entry(long time) {
		MempoolEntry entry = new MempoolEntry();
		entry.setTime(time);
		return entry;
	}

	private static MempoolInfo mempoolInfo(long bytes, long size) {
		MempoolInfo info = new MempoolInfo();
		info.setBytes(bytes);
		info.setSize(size);
		return info;
	}

	private static RawTransactionInfo rawTxInfo(Transaction tx) {
		RawTransactionInfo info = new RawTransactionInfo();
		info.setTxid(tx.getTxId().toString());
		info.setHex(Utils.HEX.encode(tx.bitcoinSerialize()));
		return info;
	}
}
