package com.feeyo.kvclient.exception;

/**
 * Error reply (`-ERR ...`) returned by the server.
 */
public class ServerErrorException extends ClientException {

	private static final long serialVersionUID = -6502774615436275321L;

	public ServerErrorException(String message) {
		super(message);
	}

	public ServerErrorException(Throwable cause) {
		super(cause);
	}

	public ServerErrorException(String message, Throwable cause) {
		super(message, cause);
	}
}
