package com.feeyo.kvclient.connection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.feeyo.kvclient.command.RawCommand;

/**
 * Base class of single connections: owns the parameters and the connect-command queue.
 *
 * <p>The queue is kept after it has been executed, a reconnect replays it.
 */
public abstract class AbstractConnection implements SingleConnection {

	private static Logger LOGGER = LoggerFactory.getLogger( AbstractConnection.class );

	protected final ConnectionParameters parameters;

	private final List<RawCommand> connectCommands = new ArrayList<RawCommand>();

	protected AbstractConnection(ConnectionParameters parameters) {
		this.parameters = checkParameters(parameters);
	}

	/**
	 * Validates the parameters before they are stored, subclasses check the scheme here.
	 */
	protected ConnectionParameters checkParameters(ConnectionParameters parameters) {
		if (parameters == null) {
			throw new IllegalArgumentException("Connection parameters must not be null");
		}
		return parameters;
	}

	/**
	 * Opens the underlying transport.
	 */
	protected abstract void openResource();

	protected abstract void closeResource();

	@Override
	public void connect() {
		if (isConnected()) {
			return;
		}

		openResource();
		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug("connected to {}, {} connect commands pending", parameters, connectCommands.size());
		}

		try {
			for (RawCommand command : connectCommands) {
				executeCommand(command);
			}
		} catch (RuntimeException e) {
			LOGGER.warn("connect command failed on {}, closing connection", parameters);
			closeResource();
			throw e;
		}
	}

	@Override
	public void disconnect() {
		if (isConnected()) {
			closeResource();
			if (LOGGER.isDebugEnabled()) {
				LOGGER.debug("disconnected from {}", parameters);
			}
		}
	}

	@Override
	public Object executeCommand(RawCommand command) {
		writeRequest(command);
		return readResponse(command);
	}

	@Override
	public ConnectionParameters getParameters() {
		return parameters;
	}

	@Override
	public void addConnectCommand(RawCommand command) {
		if (command == null) {
			throw new IllegalArgumentException("Connect command must not be null");
		}
		connectCommands.add(command);
	}

	@Override
	public List<RawCommand> getConnectCommands() {
		return Collections.unmodifiableList(connectCommands);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "(" + parameters + ")";
	}
}
