package com.mempooltracker.feigninterfaces.entities;

import java.util.Arrays;
import java.util.List;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class RpcRequest {

	private String jsonrpc = "1.0";
	private String id;
	private String method;
	private List<Object> params;

	public static RpcRequest of(String id, String method, Object... params) {
		RpcRequest request = new RpcRequest();
		request.id = id;
		request.method = method;
		request.params = Arrays.asList(params);
		return request;
	}
}
