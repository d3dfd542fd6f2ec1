package com.feeyo.kvclient.connection;

/**
 * Type constructor of a single connection, e.g. {@code StreamConnection::new}.
 */
@FunctionalInterface
public interface ConnectionConstructor {

	public SingleConnection newConnection(ConnectionParameters parameters);

}
