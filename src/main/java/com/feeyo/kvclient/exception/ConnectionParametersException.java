package com.feeyo.kvclient.exception;

/**
 * Raised when a raw parameter representation cannot be normalized.
 */
public class ConnectionParametersException extends ClientException {

	private static final long serialVersionUID = 8051329440719357625L;

	public ConnectionParametersException(String message) {
		super(message);
	}

	public ConnectionParametersException(Throwable cause) {
		super(cause);
	}

	public ConnectionParametersException(String message, Throwable cause) {
		super(message, cause);
	}
}
