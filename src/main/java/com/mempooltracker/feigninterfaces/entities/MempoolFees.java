package com.mempooltracker.feigninterfaces.entities;

import java.math.BigDecimal;

import lombok.Getter;
import lombok.Setter;

// Amounts in BTC.
@Getter
@Setter
public class MempoolFees {
	private BigDecimal base;
	private BigDecimal modified;
	private BigDecimal ancestor;
	private BigDecimal descendant;
}
