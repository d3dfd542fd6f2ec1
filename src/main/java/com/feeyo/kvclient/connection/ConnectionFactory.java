package com.feeyo.kvclient.connection;

import com.feeyo.kvclient.exception.ContractViolationException;
import com.feeyo.kvclient.exception.InvalidInitializerException;
import com.feeyo.kvclient.exception.UnknownSchemeException;

public interface ConnectionFactory {

	/**
	 * Registers the initializer for a scheme, replacing any previous one.
	 *
	 * @throws InvalidInitializerException when the scheme or the initializer is unusable
	 */
	public void define(String scheme, ConnectionInitializer initializer);

	public void undefine(String scheme);

	/**
	 * Creates a single connection from a {@link ConnectionParameters}, a URI string or a map.
	 *
	 * @throws UnknownSchemeException when no initializer is registered for the scheme
	 * @throws ContractViolationException when the initializer does not return a single connection
	 */
	public SingleConnection create(Object parameters);

	/**
	 * Adds every entry to the aggregate, in order, creating connections for entries
	 * that are not single connections yet. Entries added before a failure stay added.
	 */
	public void aggregate(AggregateConnection connection, Iterable<?> parameters);

}
