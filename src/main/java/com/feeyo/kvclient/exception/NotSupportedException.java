package com.feeyo.kvclient.exception;

public class NotSupportedException extends ClientException {

	private static final long serialVersionUID = 2283956390455713019L;

	public NotSupportedException(String message) {
		super(message);
	}

	public NotSupportedException(Throwable cause) {
		super(cause);
	}

	public NotSupportedException(String message, Throwable cause) {
		super(message, cause);
	}
}
