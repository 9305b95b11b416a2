package com.mempooltracker.feigninterfaces.entities;

import lombok.Getter;
import lombok.Setter;

/**
 * Result of verbose getrawtransaction. confirmations is absent while the transaction is unconfirmed.
 */
@Getter
@Setter
public class RawTransactionInfo {
	private String txid;
	private String hash;
	private String hex;
	private Integer confirmations;
	private String blockhash;

	public boolean isConfirmed() {
		return confirmations != null && confirmations > 0;
	}
}
