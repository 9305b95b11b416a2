package com.mempooltracker.bitcoin;

import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.TransactionInput;
import org.bitcoinj.core.TransactionWitness;
import org.bitcoinj.core.Utils;
import org.bitcoinj.params.MainNetParams;

import com.mempooltracker.exceptions.TxDecodeException;

/**
 * Wire format of transactions. Network parameters only matter for address rendering, which is never done here,
 * so mainnet parameters serve every chain.
 */
public final class TxCodec {

	private static final NetworkParameters PARAMS = MainNetParams.get();

	private TxCodec() {
	}

	public static NetworkParameters params() {
		return PARAMS;
	}

	public static Transaction decode(byte[] raw) throws TxDecodeException {
		if (raw == null || raw.length == 0) {
			throw new TxDecodeException("Empty transaction payload");
		}
		try {
			return new Transaction(PARAMS, raw);
		} catch (RuntimeException e) {
			throw new TxDecodeException("Can't decode transaction of " + raw.length + " bytes: " + e.getMessage(), e);
		}
	}

	public static Transaction decodeHex(String hex) throws TxDecodeException {
		if (hex == null) {
			throw new TxDecodeException("Missing transaction hex");
		}
		byte[] raw;
		try {
			raw = Utils.HEX.decode(hex.toLowerCase());
		} catch (IllegalArgumentException e) {
			throw new TxDecodeException("Invalid transaction hex: " + e.getMessage(), e);
		}
		return decode(raw);
	}

	/**
	 * Serializes {@code tx} for storage. The given transaction is never modified.
	 */
	public static byte[] encode(Transaction tx, WitnessPolicy policy) {
		if (policy == WitnessPolicy.KEEP || !tx.hasWitnesses()) {
			return tx.bitcoinSerialize();
		}
		Transaction stripped = new Transaction(PARAMS, tx.bitcoinSerialize());
		for (TransactionInput input : stripped.getInputs()) {
			input.setWitness(TransactionWitness.EMPTY);
		}
		return stripped.bitcoinSerialize();
	}
}
