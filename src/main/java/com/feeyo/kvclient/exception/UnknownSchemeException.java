package com.feeyo.kvclient.exception;

public class UnknownSchemeException extends ClientException {

	private static final long serialVersionUID = 7393127000526241851L;

	private final String scheme;

	public UnknownSchemeException(String scheme) {
		super("Unknown connection scheme: " + scheme);
		this.scheme = scheme;
	}

	public String getScheme() {
		return scheme;
	}
}
