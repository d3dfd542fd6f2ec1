package com.feeyo.kvclient.connection;

/**
 * Builds a connection on demand. The factory is passed in so that an initializer can
 * create the sub-connections it is composed of.
 *
 * <p>Connections returned here are not prepared by the factory: implicit AUTH / SELECT
 * commands are the initializer's own responsibility.
 */
@FunctionalInterface
public interface LazyConnectionInitializer {

	public SingleConnection create(ConnectionParameters parameters, ConnectionFactory factory);

}
