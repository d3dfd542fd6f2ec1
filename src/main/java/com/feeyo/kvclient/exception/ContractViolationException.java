package com.feeyo.kvclient.exception;

/**
 * An initializer returned something that is not a single connection.
 */
public class ContractViolationException extends ClientException {

	private static final long serialVersionUID = 5720935917342215116L;

	public ContractViolationException(String message) {
		super(message);
	}

	public ContractViolationException(Throwable cause) {
		super(cause);
	}

	public ContractViolationException(String message, Throwable cause) {
		super(message, cause);
	}
}
