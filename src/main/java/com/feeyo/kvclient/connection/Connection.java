package com.feeyo.kvclient.connection;

import com.feeyo.kvclient.command.RawCommand;

/**
 * Base capability shared by single and aggregate connections.
 */
public interface Connection {

	public void connect();

	public void disconnect();

	public boolean isConnected();

	/**
	 * Writes a request without waiting for the reply.
	 */
	public void writeRequest(RawCommand command);

	public Object readResponse(RawCommand command);

	public Object executeCommand(RawCommand command);

}
