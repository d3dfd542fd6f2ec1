package com.feeyo.kvclient.connection;

import com.feeyo.kvclient.command.RawCommand;

/**
 * A composite that owns several single connections, e.g. shards or replicas.
 */
public interface AggregateConnection extends Connection {

	public void add(SingleConnection connection);

	public boolean remove(SingleConnection connection);

	/**
	 * Picks the single connection that must serve the given command.
	 */
	public SingleConnection getConnection(RawCommand command);

	public SingleConnection getConnectionById(String id);

}
