package com.feeyo.kvclient.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.feeyo.kvclient.command.RawCommand;
import com.feeyo.kvclient.connection.ConnectionParameters;
import com.feeyo.kvclient.connection.FakeConnection;
import com.feeyo.kvclient.connection.RedisConnectionFactory;
import com.feeyo.kvclient.connection.StreamConnection;
import com.feeyo.kvclient.connection.aggregate.ShardedConnection;
import com.feeyo.kvclient.exception.InvalidInitializerException;

class ConnectionConfigLoaderTest {

	private static String resource(String name) {
		return ConnectionConfigLoaderTest.class.getResource(name).toString();
	}

	@Test
	void testLoadSchemeMap() throws Exception {
		Map<String, String> schemes = ConnectionConfigLoader.loadSchemeMap(resource("/connections.xml"));

		assertEquals(Collections.singletonMap("fake", FakeConnection.class.getName()), schemes);
	}

	@Test
	void testLoadNodeList() throws Exception {
		List<ConnectionParameters> nodes = ConnectionConfigLoader.loadNodeList(resource("/connections.xml"));

		assertEquals(2, nodes.size());

		ConnectionParameters first = nodes.get(0);
		assertEquals("10.0.0.1", first.getHost());
		assertEquals("first", first.getAlias());
		assertEquals("200", first.get(ConnectionParameters.WEIGHT));
		assertNull(first.getPassword());

		ConnectionParameters second = nodes.get(1);
		assertEquals("fake", second.getScheme());
		assertEquals(6380, second.getPort());
		assertEquals("secret", second.getPassword());
		assertEquals(Integer.valueOf(4), second.getDatabase());
	}

	@Test
	void testLoadFactoryAndAggregate() throws Exception {
		RedisConnectionFactory factory = ConnectionConfigLoader.loadFactory(resource("/connections.xml"));
		ShardedConnection sharded = new ShardedConnection();

		factory.aggregate(sharded, ConnectionConfigLoader.loadNodeList(resource("/connections.xml")));

		assertEquals(2, sharded.size());
		assertTrue(sharded.getConnectionById("first") instanceof StreamConnection);
		assertTrue(sharded.getConnectionById("second") instanceof FakeConnection);
		assertEquals(Arrays.asList(new RawCommand("AUTH", "secret"), new RawCommand("SELECT", "4")),
				sharded.getConnectionById("second").getConnectCommands());
		assertTrue(factory.isDefined("tcp"));
	}

	@Test
	void testInvalidSchemeClass() {
		assertThrows(InvalidInitializerException.class,
				() -> ConnectionConfigLoader.loadFactory(resource("/invalid-scheme.xml")));
	}

	@Test
	void testDoctypeIsRejected() {
		assertThrows(Exception.class, () -> ConnectionConfigLoader.loadNodeList(resource("/doctype.xml")));
	}

	@Test
	void testMissingFile() {
		assertThrows(Exception.class, () -> ConnectionConfigLoader.loadSchemeMap("file:/does/not/exist.xml"));
	}
}
