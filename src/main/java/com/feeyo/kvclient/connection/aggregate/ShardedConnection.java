package com.feeyo.kvclient.connection.aggregate;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.feeyo.kvclient.command.RawCommand;
import com.feeyo.kvclient.connection.AggregateConnection;
import com.feeyo.kvclient.connection.ConnectionParameters;
import com.feeyo.kvclient.connection.SingleConnection;
import com.feeyo.kvclient.exception.NotSupportedException;
import com.google.common.collect.ImmutableSet;

/**
 * Client-side sharding over a consistent hash ring.
 *
 * <p>A node is identified by its {@code alias}, or {@code host:port} when it has none.
 * Keys containing a {@code {tag}} are distributed by the tag only.
 */
public class ShardedConnection implements AggregateConnection, Iterable<SingleConnection> {

	private static Logger LOGGER = LoggerFactory.getLogger( ShardedConnection.class );

	// every argument is a key
	private static final Set<String> MULTI_KEY_COMMANDS = ImmutableSet.of(
			"DEL", "UNLINK", "EXISTS", "TOUCH", "MGET", "SINTER", "SINTERSTORE", "SUNION",
			"SUNIONSTORE", "SDIFF", "SDIFFSTORE", "RENAME", "RENAMENX", "RPOPLPUSH", "SMOVE");

	// key value key value ...
	private static final Set<String> INTERLEAVED_KEY_COMMANDS = ImmutableSet.of("MSET", "MSETNX");

	private static final Set<String> KEYLESS_COMMANDS = ImmutableSet.of(
			"PING", "ECHO", "AUTH", "SELECT", "QUIT", "INFO", "DBSIZE", "FLUSHDB", "FLUSHALL",
			"KEYS", "SCAN", "RANDOMKEY", "SAVE", "BGSAVE", "LASTSAVE", "TIME", "CONFIG", "CLIENT",
			"SLAVEOF", "REPLICAOF", "MULTI", "EXEC", "DISCARD", "WATCH", "UNWATCH", "SHUTDOWN",
			"MONITOR", "SUBSCRIBE", "PSUBSCRIBE", "PUBLISH", "SCRIPT", "EVAL", "EVALSHA");

	private final Map<String, SingleConnection> pool = new LinkedHashMap<String, SingleConnection>();
	private final HashRing<SingleConnection> ring = new HashRing<SingleConnection>();

	@Override
	public void add(SingleConnection connection) {
		String id = getConnectionId(connection);
		SingleConnection previous = pool.put(id, connection);
		if (previous != null) {
			ring.remove(previous);
			LOGGER.warn("shard {} replaced by {}", id, connection);
		}
		int weight = connection.getParameters().getInt(ConnectionParameters.WEIGHT, HashRing.DEFAULT_WEIGHT);
		ring.add(connection, id, weight);
	}

	@Override
	public boolean remove(SingleConnection connection) {
		String id = getConnectionId(connection);
		if (pool.get(id) == connection) {
			pool.remove(id);
			ring.remove(connection);
			return true;
		}
		return false;
	}

	public boolean removeById(String id) {
		SingleConnection connection = pool.get(id);
		return connection != null && remove(connection);
	}

	static String getConnectionId(SingleConnection connection) {
		ConnectionParameters parameters = connection.getParameters();
		if (parameters.getAlias() != null) {
			return parameters.getAlias();
		}
		if ("unix".equals(parameters.getScheme())) {
			return parameters.getPath();
		}
		return parameters.getHost() + ":" + parameters.getPort();
	}

	@Override
	public SingleConnection getConnection(RawCommand command) {
		List<String> keys = extractKeys(command);
		if (keys.isEmpty()) {
			throw new NotSupportedException("Cannot use '" + command.getId() + "' over sharded connections");
		}

		SingleConnection connection = getConnectionByKey(keys.get(0));
		for (int i = 1; i < keys.size(); i++) {
			if (getConnectionByKey(keys.get(i)) != connection) {
				throw new NotSupportedException(
						"Cannot send '" + command.getId() + "' with keys on different shards");
			}
		}
		return connection;
	}

	public SingleConnection getConnectionByKey(String key) {
		if (ring.size() == 0) {
			throw new NotSupportedException("No shard available");
		}
		return ring.get(extractKeyTag(key));
	}

	@Override
	public SingleConnection getConnectionById(String id) {
		return pool.get(id);
	}

	/**
	 * The content of the first {...} pair, or the whole key.
	 */
	static String extractKeyTag(String key) {
		int start = key.indexOf('{');
		if (start != -1) {
			int end = key.indexOf('}', start);
			if (end != -1) {
				return key.substring(start + 1, end);
			}
		}
		return key;
	}

	private static List<String> extractKeys(RawCommand command) {
		String id = command.getId();
		List<String> arguments = command.getArguments();
		List<String> keys = new ArrayList<String>();
		if (arguments.isEmpty() || KEYLESS_COMMANDS.contains(id)) {
			return keys;
		}

		if (MULTI_KEY_COMMANDS.contains(id)) {
			keys.addAll(arguments);
		} else if (INTERLEAVED_KEY_COMMANDS.contains(id)) {
			for (int i = 0; i < arguments.size(); i += 2) {
				keys.add(arguments.get(i));
			}
		} else {
			keys.add(arguments.get(0));
		}
		return keys;
	}

	@Override
	public void connect() {
		for (SingleConnection connection : pool.values()) {
			connection.connect();
		}
	}

	@Override
	public void disconnect() {
		for (SingleConnection connection : pool.values()) {
			connection.disconnect();
		}
	}

	@Override
	public boolean isConnected() {
		for (SingleConnection connection : pool.values()) {
			if (connection.isConnected()) {
				return true;
			}
		}
		return false;
	}

	@Override
	public void writeRequest(RawCommand command) {
		getConnection(command).writeRequest(command);
	}

	@Override
	public Object readResponse(RawCommand command) {
		return getConnection(command).readResponse(command);
	}

	@Override
	public Object executeCommand(RawCommand command) {
		return getConnection(command).executeCommand(command);
	}

	public int size() {
		return pool.size();
	}

	@Override
	public Iterator<SingleConnection> iterator() {
		return pool.values().iterator();
	}
}
