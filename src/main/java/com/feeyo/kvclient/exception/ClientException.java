package com.feeyo.kvclient.exception;

public class ClientException extends RuntimeException {

	private static final long serialVersionUID = -4411832791523008214L;

	public ClientException(String message) {
		super(message);
	}

	public ClientException(Throwable cause) {
		super(cause);
	}

	public ClientException(String message, Throwable cause) {
		super(message, cause);
	}
}
