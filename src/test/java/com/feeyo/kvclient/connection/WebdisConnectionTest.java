package com.feeyo.kvclient.connection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.feeyo.kvclient.command.RawCommand;
import com.feeyo.kvclient.exception.ClientConnectionException;
import com.feeyo.kvclient.exception.NotSupportedException;
import com.sun.net.httpserver.HttpServer;

class WebdisConnectionTest {

	private HttpServer server;
	private final BlockingQueue<String> bodies = new LinkedBlockingQueue<String>();
	private final BlockingQueue<String> authorizations = new LinkedBlockingQueue<String>();
	private volatile int status = 200;

	private final RedisConnectionFactory factory = new RedisConnectionFactory();

	@BeforeEach
	void setUp() throws IOException {
		server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		server.createContext("/", exchange -> {
			bodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
			authorizations.add(String.valueOf(exchange.getRequestHeaders().getFirst("Authorization")));

			byte[] reply = "$3\r\nbar\r\n".getBytes(StandardCharsets.UTF_8);
			exchange.sendResponseHeaders(status, reply.length);
			try (OutputStream os = exchange.getResponseBody()) {
				os.write(reply);
			}
		});
		server.start();
	}

	@AfterEach
	void tearDown() {
		server.stop(0);
	}

	private String uri(String userInfo, String query) {
		return "http://" + userInfo + "127.0.0.1:" + server.getAddress().getPort() + query;
	}

	private static String basic(String token) {
		return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
	}

	@Test
	void testCommandIsPostedAsRawPath() {
		SingleConnection connection = factory.create(uri("", ""));

		assertEquals("bar", connection.executeCommand(new RawCommand("GET", "foo bar/baz")));

		assertEquals("GET/foo%20bar%2Fbaz.raw", bodies.poll());
		assertEquals("null", authorizations.poll());
		assertTrue(connection.isConnected());
	}

	@Test
	void testAuthAndSelectBecomeCredentialsAndPrefix() {
		SingleConnection connection = factory.create(uri("", "?password=secret&database=2"));

		connection.executeCommand(new RawCommand("GET", "foo"));

		// AUTH and SELECT are not forwarded
		assertEquals(1, bodies.size());
		assertEquals("2/GET/foo.raw", bodies.poll());
		assertEquals(basic(":secret"), authorizations.poll());
	}

	@Test
	void testUserFromUri() {
		SingleConnection connection = factory.create(uri("alice:secret@", ""));

		connection.executeCommand(new RawCommand("GET", "foo"));

		assertEquals(basic("alice:secret"), authorizations.poll());
	}

	@Test
	void testHttpErrorStatus() {
		status = 403;
		SingleConnection connection = factory.create(uri("", ""));

		assertThrows(ClientConnectionException.class, () -> connection.executeCommand(new RawCommand("GET", "foo")));
	}

	@Test
	void testStreamingMethodsNotSupported() {
		SingleConnection connection = factory.create(uri("", ""));

		assertThrows(NotSupportedException.class, () -> connection.writeRequest(new RawCommand("PING")));
		assertThrows(NotSupportedException.class, () -> connection.readResponse(new RawCommand("PING")));
	}
}
