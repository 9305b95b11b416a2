package com.mempooltracker.feigninterfaces.entities;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class RpcError {
	private int code;
	private String message;
}
