package com.mempooltracker.bitcoin;

import java.security.MessageDigest;
import java.util.LinkedHashSet;
import java.util.Set;

import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.TransactionInput;
import org.bitcoinj.core.Utils;

/**
 * Identities of a transaction.
 * <p>
 * The inputs hash is the SHA-256 of the consensus serialization of every input (outpoint, script and sequence,
 * never the witness), concatenated in order. A fee bump that spends the same inputs keeps the same inputs hash
 * while its txid changes, which is what makes a replacement recognizable.
 */
public final class ContentAddresser {

	private ContentAddresser() {
	}

	/**
	 * Lowercase hex SHA-256 over the ordered inputs of {@code tx}.
	 */
	public static String inputsHash(Transaction tx) {
		MessageDigest digest = Sha256Hash.newDigest();
		for (TransactionInput input : tx.getInputs()) {
			digest.update(input.bitcoinSerialize());
		}
		return Utils.HEX.encode(digest.digest());
	}

	/**
	 * Display (big-endian) hex txid, as reported by bitcoind RPC.
	 */
	public static String txid(Transaction tx) {
		return tx.getTxId().toString();
	}

	public static boolean isCoinbase(Transaction tx) {
		return tx.isCoinBase();
	}

	/**
	 * Txids of the outputs spent by {@code tx}, in input order. Empty for a coinbase.
	 */
	public static Set<String> spentTxids(Transaction tx) {
		Set<String> spent = new LinkedHashSet<>();
		if (tx.isCoinBase()) {
			return spent;
		}
		for (TransactionInput input : tx.getInputs()) {
			spent.add(input.getOutpoint().getHash().toString());
		}
		return spent;
	}
}
