package com.mempooltracker.bitcoin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.Utils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.mempooltracker.exceptions.TxDecodeException;

class TxCodecTest {

	@Test
	void decodesSerializedTransaction() throws TxDecodeException {
		Transaction tx = TestTransactions.spending("parent", 0, 12_345L);

		Transaction decoded = TxCodec.decode(tx.bitcoinSerialize());

		assertThat(decoded.getTxId()).isEqualTo(tx.getTxId());
	}

	@Test
	void decodesHex() throws TxDecodeException {
		Transaction tx = TestTransactions.spending("parent", 0, 12_345L);

		Transaction decoded = TxCodec.decodeHex(Utils.HEX.encode(tx.bitcoinSerialize()).toUpperCase());

		assertThat(decoded.getTxId()).isEqualTo(tx.getTxId());
	}

	@Test
	void rejectsEmptyPayload() {
		assertThatThrownBy(() -> TxCodec.decode(new byte[0])).isInstanceOf(TxDecodeException.class);
		assertThatThrownBy(() -> TxCodec.decode(null)).isInstanceOf(TxDecodeException.class);
	}

	@Test
	void rejectsTruncatedPayload() {
		assertThatThrownBy(() -> TxCodec.decode(new byte[] { 0x01, 0x02, 0x03 }))
				.isInstanceOf(TxDecodeException.class);
	}

	@Test
	void rejectsInvalidHex() {
		assertThatThrownBy(() -> TxCodec.decodeHex("zz01")).isInstanceOf(TxDecodeException.class);
		assertThatThrownBy(() -> TxCodec.decodeHex(null)).isInstanceOf(TxDecodeException.class);
	}

	@Test
	@DisplayName("STRIP stores the legacy serialization and leaves the given transaction untouched")
	void stripRemovesWitness() throws TxDecodeException {
		Transaction segwit = TestTransactions.withWitness(TestTransactions.spending("parent", 0, 1_000L));
		byte[] original = segwit.bitcoinSerialize();

		byte[] stored = TxCodec.encode(segwit, WitnessPolicy.STRIP);

		Transaction decoded = TxCodec.decode(stored);
		assertThat(decoded.hasWitnesses()).isFalse();
		assertThat(decoded.getTxId()).isEqualTo(segwit.getTxId());
		assertThat(stored.length).isLessThan(original.length);
		assertThat(segwit.hasWitnesses()).isTrue();
		assertThat(segwit.bitcoinSerialize()).isEqualTo(original);
	}

	@Test
	void keepStoresBytesAsReceived() {
		Transaction segwit = TestTransactions.withWitness(TestTransactions.spending("parent", 0, 1_000L));

		assertThat(TxCodec.encode(segwit, WitnessPolicy.KEEP)).isEqualTo(segwit.bitcoinSerialize());
	}
}
