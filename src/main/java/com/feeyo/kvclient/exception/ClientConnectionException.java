package com.feeyo.kvclient.exception;

/**
 * Socket or HTTP transport failure of a single connection.
 */
public class ClientConnectionException extends ClientException {

	private static final long serialVersionUID = 3278137410876614583L;

	public ClientConnectionException(String message) {
		super(message);
	}

	public ClientConnectionException(Throwable cause) {
		super(cause);
	}

	public ClientConnectionException(String message, Throwable cause) {
		super(message, cause);
	}
}
