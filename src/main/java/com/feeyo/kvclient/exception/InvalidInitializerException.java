package com.feeyo.kvclient.exception;

/**
 * Raised by {@code define} when the supplied initializer can not produce single connections.
 */
public class InvalidInitializerException extends ClientException {

	private static final long serialVersionUID = -1903541260117362290L;

	public InvalidInitializerException(String message) {
		super(message);
	}

	public InvalidInitializerException(Throwable cause) {
		super(cause);
	}

	public InvalidInitializerException(String message, Throwable cause) {
		super(message, cause);
	}
}
