package com.feeyo.kvclient.connection.aggregate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.feeyo.kvclient.command.RawCommand;
import com.feeyo.kvclient.connection.AggregateConnection;
import com.feeyo.kvclient.connection.SingleConnection;
import com.feeyo.kvclient.exception.ClientException;
import com.google.common.collect.ImmutableSet;

/**
 * Master / slave replication. The node aliased {@code master} takes writes, every other node is a slave.
 *
 * <p>Reads go to a random slave until the first write, from then on the master serves everything.
 */
public class ReplicationConnection implements AggregateConnection {

	private static Logger LOGGER = LoggerFactory.getLogger( ReplicationConnection.class );

	public static final String MASTER_ALIAS = "master";

	private static final Set<String> READ_ONLY_COMMANDS = ImmutableSet.of(
			"EXISTS", "TYPE", "KEYS", "SCAN", "RANDOMKEY", "TTL", "PTTL", "GET", "MGET", "GETRANGE",
			"SUBSTR", "STRLEN", "GETBIT", "BITCOUNT", "LRANGE", "LLEN", "LINDEX", "SCARD", "SISMEMBER",
			"SINTER", "SUNION", "SDIFF", "SMEMBERS", "SSCAN", "SRANDMEMBER", "ZRANGE", "ZREVRANGE",
			"ZRANGEBYSCORE", "ZREVRANGEBYSCORE", "ZCARD", "ZSCORE", "ZCOUNT", "ZRANK", "ZREVRANK",
			"ZSCAN", "ZLEXCOUNT", "ZRANGEBYLEX", "HGET", "HMGET", "HEXISTS", "HLEN", "HKEYS",
			"HVALS", "HGETALL", "HSCAN", "HSTRLEN", "PING", "ECHO", "TIME", "DBSIZE", "INFO",
			"PFCOUNT", "DUMP");

	private SingleConnection master;
	private final Map<String, SingleConnection> slaves = new LinkedHashMap<String, SingleConnection>();
	private SingleConnection current;

	@Override
	public void add(SingleConnection connection) {
		String alias = connection.getParameters().getAlias();
		if (MASTER_ALIAS.equals(alias)) {
			master = connection;
		} else {
			slaves.put(ShardedConnection.getConnectionId(connection), connection);
		}
		reset();
	}

	@Override
	public boolean remove(SingleConnection connection) {
		boolean removed = false;
		if (connection == master) {
			master = null;
			removed = true;
		} else {
			removed = slaves.values().remove(connection);
		}
		if (removed) {
			reset();
		}
		return removed;
	}

	/**
	 * Forgets the currently selected node, the next command selects again.
	 */
	public void reset() {
		current = null;
	}

	@Override
	public SingleConnection getConnection(RawCommand command) {
		if (current == null) {
			check();
			current = isReadOperation(command) ? pickSlave() : master;
			return current;
		}

		if (current == master) {
			return current;
		}

		if (!isReadOperation(command)) {
			if (LOGGER.isDebugEnabled()) {
				LOGGER.debug("{} is a write, switching to master {}", command.getId(), master);
			}
			current = master;
		}
		return current;
	}

	@Override
	public SingleConnection getConnectionById(String id) {
		if (MASTER_ALIAS.equals(id)) {
			return master;
		}
		return slaves.get(id);
	}

	public void switchTo(String id) {
		check();
		SingleConnection connection = getConnectionById(id);
		if (connection == null) {
			throw new IllegalArgumentException("Invalid connection id: " + id);
		}
		if (current != null && current != connection) {
			current.disconnect();
		}
		current = connection;
	}

	public boolean isReadOperation(RawCommand command) {
		return READ_ONLY_COMMANDS.contains(command.getId());
	}

	private void check() {
		if (master == null || slaves.isEmpty()) {
			throw new ClientException("Replication needs a master and at least one slave");
		}
	}

	private SingleConnection pickSlave() {
		List<SingleConnection> candidates = new ArrayList<SingleConnection>(slaves.values());
		return candidates.get(ThreadLocalRandom.current().nextInt(candidates.size()));
	}

	public SingleConnection getCurrent() {
		return current;
	}

	public SingleConnection getMaster() {
		return master;
	}

	public List<SingleConnection> getSlaves() {
		return Collections.unmodifiableList(new ArrayList<SingleConnection>(slaves.values()));
	}

	@Override
	public void connect() {
		if (current == null) {
			check();
			current = pickSlave();
		}
		current.connect();
	}

	@Override
	public void disconnect() {
		if (master != null) {
			master.disconnect();
		}
		for (SingleConnection slave : slaves.values()) {
			slave.disconnect();
		}
	}

	@Override
	public boolean isConnected() {
		return current != null && current.isConnected();
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
}
