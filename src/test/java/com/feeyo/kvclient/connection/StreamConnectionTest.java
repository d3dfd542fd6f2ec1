package com.feeyo.kvclient.connection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.feeyo.kvclient.command.RawCommand;
import com.feeyo.kvclient.exception.ClientConnectionException;
import com.feeyo.kvclient.exception.ConnectionParametersException;
import com.feeyo.kvclient.exception.ServerErrorException;
import com.feeyo.kvclient.protocol.RedisInputStream;
import com.feeyo.kvclient.protocol.RedisProtocol;

/**
 * Runs the connection against a loopback server speaking just enough RESP.
 */
class StreamConnectionTest {

	private ServerSocket server;
	private ExecutorService executor;
	private final BlockingQueue<List<Object>> received = new LinkedBlockingQueue<List<Object>>();

	private final RedisConnectionFactory factory = new RedisConnectionFactory();

	@BeforeEach
	void setUp() throws IOException {
		server = new ServerSocket(0, 50, InetAddress.getByName("127.0.0.1"));
		executor = Executors.newSingleThreadExecutor();
		executor.submit(() -> {
			serve();
			return null;
		});
	}

	@AfterEach
	void tearDown() throws IOException {
		server.close();
		executor.shutdownNow();
	}

	@SuppressWarnings("unchecked")
	private void serve() throws IOException {
		try (Socket socket = server.accept()) {
			RedisInputStream in = new RedisInputStream(socket.getInputStream());
			OutputStream out = socket.getOutputStream();
			while (true) {
				List<Object> request = (List<Object>) RedisProtocol.read(in);
				received.add(request);

				String id = ((String) request.get(0)).toUpperCase();
				String reply;
				if ("GET".equals(id)) {
					reply = "$3\r\nbar\r\n";
				} else if ("INCR".equals(id)) {
					reply = ":42\r\n";
				} else if ("MALFORMED".equals(id)) {
					reply = "$-2\r\n";
				} else if ("BOGUS".equals(id)) {
					reply = "-ERR unknown command 'BOGUS'\r\n";
				} else {
					reply = "+OK\r\n";
				}
				out.write(reply.getBytes(StandardCharsets.UTF_8));
				out.flush();
			}
		} catch (ClientConnectionException e) {
			// client went away
		}
	}

	private String uri(String query) {
		return "tcp://127.0.0.1:" + server.getLocalPort() + query;
	}

	@Test
	void testConnectSendsAuthAndSelectBeforeCommands() throws InterruptedException {
		SingleConnection connection = factory.create(uri("?password=secret&database=3"));

		Object reply = connection.executeCommand(new RawCommand("GET", "foo"));

		assertEquals("bar", reply);
		assertTrue(connection.isConnected());
		assertEquals(Arrays.<Object>asList("AUTH", "secret"), received.poll(5, TimeUnit.SECONDS));
		assertEquals(Arrays.<Object>asList("SELECT", "3"), received.poll(5, TimeUnit.SECONDS));
		assertEquals(Arrays.<Object>asList("GET", "foo"), received.poll(5, TimeUnit.SECONDS));
		connection.disconnect();
		assertFalse(connection.isConnected());
	}

	@Test
	void testReplies() {
		SingleConnection connection = factory.create(uri(""));

		assertEquals("OK", connection.executeCommand(new RawCommand("SET", "foo", "bar")));
		assertEquals(42L, connection.executeCommand(new RawCommand("INCR", "counter")));

		ServerErrorException e = assertThrows(ServerErrorException.class,
				() -> connection.executeCommand(new RawCommand("BOGUS")));
		assertEquals("ERR unknown command 'BOGUS'", e.getMessage());
		assertTrue(connection.isConnected());
		connection.disconnect();
	}

	@Test
	void testMalformedReplyClosesConnection() {
		SingleConnection connection = factory.create(uri(""));

		assertThrows(ClientConnectionException.class, () -> connection.executeCommand(new RawCommand("MALFORMED")));
		assertFalse(connection.isConnected());
	}

	@Test
	void testConnectFailure() throws IOException {
		ServerSocket closed = new ServerSocket(0, 50, InetAddress.getByName("127.0.0.1"));
		int port = closed.getLocalPort();
		closed.close();

		SingleConnection connection = factory.create("tcp://127.0.0.1:" + port + "?timeout=1000");

		assertThrows(ClientConnectionException.class, () -> connection.connect());
		assertFalse(connection.isConnected());
	}

	@Test
	void testReadWithoutConnection() {
		SingleConnection connection = factory.create(uri(""));

		assertThrows(ClientConnectionException.class, () -> connection.readResponse(new RawCommand("PING")));
	}

	@Test
	void testRejectsForeignScheme() {
		assertThrows(ConnectionParametersException.class,
				() -> new StreamConnection(ConnectionParameters.parse("http://127.0.0.1:7379")));
	}

	@Test
	void testUnixWithoutPath() {
		StreamConnection connection = new StreamConnection(
				ConnectionParameters.fromMap(Collections.singletonMap("scheme", "unix")));

		assertThrows(ConnectionParametersException.class, () -> connection.connect());
	}
}
