package com.feeyo.kvclient.connection;

import java.util.List;

import com.feeyo.kvclient.command.RawCommand;

/**
 * A connection to exactly one endpoint.
 *
 * <p>Instances connect lazily. Commands added with {@link #addConnectCommand(RawCommand)}
 * are executed in insertion order right after the transport is established and before
 * any other command.
 */
public interface SingleConnection extends Connection {

	public ConnectionParameters getParameters();

	public void addConnectCommand(RawCommand command);

	/**
	 * @return read-only view of the connect-command queue, in execution order
	 */
	public List<RawCommand> getConnectCommands();

}
