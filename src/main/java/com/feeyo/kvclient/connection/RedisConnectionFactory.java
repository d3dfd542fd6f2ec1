package com.feeyo.kvclient.connection;

import java.util.HashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.feeyo.kvclient.command.RawCommand;
import com.feeyo.kvclient.exception.ContractViolationException;
import com.feeyo.kvclient.exception.InvalidInitializerException;
import com.feeyo.kvclient.exception.UnknownSchemeException;

/**
 * Standard connection factory: maps schemes to initializers and builds single connections
 * from connection parameters.
 *
 * <p>Connections built by a type initializer are prepared (AUTH, then SELECT queued as connect
 * commands). Connections built by a lazy initializer are returned as the initializer made them.
 *
 * <p>The scheme map is not synchronized, define schemes before sharing the factory.
 */
public class RedisConnectionFactory implements ConnectionFactory {

	private static Logger LOGGER = LoggerFactory.getLogger( RedisConnectionFactory.class );

	private final Map<String, ConnectionInitializer> schemes = new HashMap<String, ConnectionInitializer>();

	public RedisConnectionFactory() {
		ConnectionInitializer stream = ConnectionInitializer.ofType(StreamConnection::new);
		schemes.put("tcp", stream);
		schemes.put("unix", stream);
		schemes.put("http", ConnectionInitializer.ofType(WebdisConnection::new));
	}

	@Override
	public void define(String scheme, ConnectionInitializer initializer) {
		if (scheme == null || scheme.trim().isEmpty()) {
			throw new InvalidInitializerException("A connection scheme must not be empty");
		}
		if (initializer == null) {
			throw new InvalidInitializerException("A connection initializer must not be null");
		}

		ConnectionInitializer previous = schemes.put(scheme, initializer);
		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug("scheme {} defined as {}, previous={}", new Object[] { scheme, initializer, previous });
		}
	}

	public void define(String scheme, ConnectionConstructor constructor) {
		define(scheme, ConnectionInitializer.ofType(constructor));
	}

	public void define(String scheme, LazyConnectionInitializer function) {
		define(scheme, ConnectionInitializer.lazy(function));
	}

	public void define(String scheme, Class<?> type) {
		define(scheme, ConnectionInitializer.ofClass(type));
	}

	public void define(String scheme, String className) {
		define(scheme, ConnectionInitializer.ofClassName(className));
	}

	@Override
	public void undefine(String scheme) {
		if (schemes.remove(scheme) != null && LOGGER.isDebugEnabled()) {
			LOGGER.debug("scheme {} undefined", scheme);
		}
	}

	public boolean isDefined(String scheme) {
		return schemes.containsKey(scheme);
	}

	public SortedSet<String> getSchemes() {
		return new TreeSet<String>(schemes.keySet());
	}

	@Override
	public SingleConnection create(Object parameters) {
		ConnectionParameters params = ConnectionParameters.create(parameters);

		String scheme = params.getScheme();
		ConnectionInitializer initializer = schemes.get(scheme);
		if (initializer == null) {
			throw new UnknownSchemeException(scheme);
		}

		Object connection = initializer.initialize(params, this);
		if (!(connection instanceof SingleConnection)) {
			throw new ContractViolationException(
					"Initializer " + initializer + " for scheme " + scheme + " returned " + connection
							+ " instead of a SingleConnection");
		}

		SingleConnection single = (SingleConnection) connection;
		if (!initializer.isLazy()) {
			prepareConnection(single);
		}
		return single;
	}

	@Override
	public void aggregate(AggregateConnection connection, Iterable<?> parameters) {
		for (Object node : parameters) {
			connection.add(node instanceof SingleConnection ? (SingleConnection) node : create(node));
		}
	}

	/**
	 * Queues the implicit session setup of a freshly built connection. Authentication has to
	 * come first, the server refuses SELECT from an unauthenticated client.
	 */
	protected void prepareConnection(SingleConnection connection) {
		ConnectionParameters parameters = connection.getParameters();

		if (parameters.getPassword() != null) {
			connection.addConnectCommand(new RawCommand("AUTH", parameters.getPassword()));
		}

		if (parameters.getDatabase() != null) {
			connection.addConnectCommand(RawCommand.create("SELECT", parameters.getDatabase()));
		}
	}
}
