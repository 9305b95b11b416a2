package com.mempooltracker.feigninterfaces.entities;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class RpcResponse<T> {
	private T result;
	private RpcError error;
	private String id;
}
