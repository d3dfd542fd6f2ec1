package com.feeyo.kvclient.connection;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.feeyo.kvclient.command.RawCommand;
import com.feeyo.kvclient.exception.ClientConnectionException;
import com.feeyo.kvclient.exception.ConnectionParametersException;
import com.feeyo.kvclient.exception.ServerErrorException;
import com.feeyo.kvclient.protocol.RedisInputStream;
import com.feeyo.kvclient.protocol.RedisProtocol;

/**
 * Blocking RESP connection over TCP ({@code tcp}) or a unix domain socket ({@code unix}).
 */
public class StreamConnection extends AbstractConnection {

	private static Logger LOGGER = LoggerFactory.getLogger( StreamConnection.class );

	private Socket socket;
	private SocketChannel channel;

	private OutputStream outputStream;
	private RedisInputStream inputStream;

	public StreamConnection(ConnectionParameters parameters) {
		super(parameters);
	}

	@Override
	protected ConnectionParameters checkParameters(ConnectionParameters parameters) {
		super.checkParameters(parameters);

		String scheme = parameters.getScheme();
		if (!"tcp".equals(scheme) && !"unix".equals(scheme)) {
			throw new ConnectionParametersException("Invalid scheme: " + scheme);
		}
		return parameters;
	}

	@Override
	protected void openResource() {
		if ("unix".equals(parameters.getScheme())) {
			openUnixChannel();
		} else {
			openTcpSocket();
		}
	}

	private void openTcpSocket() {
		String host = parameters.getHost();
		int port = parameters.getPort();
		try {
			socket = new Socket();
			socket.setReuseAddress(true);
			socket.setKeepAlive(true);
			socket.setTcpNoDelay(true);
			socket.setSoLinger(true, 0);

			socket.connect(new InetSocketAddress(host, port), parameters.getTimeout());
			if (parameters.getReadWriteTimeout() > 0)
				socket.setSoTimeout(parameters.getReadWriteTimeout());

			outputStream = new BufferedOutputStream(socket.getOutputStream());
			inputStream = new RedisInputStream(socket.getInputStream());

		} catch (IOException ex) {
			closeResource();
			throw new ClientConnectionException("Failed connecting to host " + host + ":" + port, ex);
		} catch (RuntimeException ex) {
			closeResource();
			throw new ConnectionParametersException("Invalid address " + host + ":" + port, ex);
		}
	}

	private void openUnixChannel() {
		String path = parameters.getPath();
		if (path == null || path.isEmpty()) {
			throw new ConnectionParametersException("Missing unix socket path");
		}
		try {
			channel = SocketChannel.open(StandardProtocolFamily.UNIX);
			channel.connect(UnixDomainSocketAddress.of(path));

			outputStream = new BufferedOutputStream(Channels.newOutputStream(channel));
			inputStream = new RedisInputStream(Channels.newInputStream(channel));

		} catch (IOException ex) {
			closeResource();
			throw new ClientConnectionException("Failed connecting to unix socket " + path, ex);
		}
	}

	@Override
	protected void closeResource() {
		try {
			if (socket != null) {
				socket.close();
			}
			if (channel != null) {
				channel.close();
			}
		} catch (IOException ex) {
			LOGGER.warn("close {} err", parameters, ex);
		} finally {
			socket = null;
			channel = null;
			inputStream = null;
			outputStream = null;
		}
	}

	@Override
	public boolean isConnected() {
		if (channel != null) {
			return channel.isOpen() && channel.isConnected();
		}
		return socket != null && socket.isBound() && !socket.isClosed() && socket.isConnected()
				&& !socket.isInputShutdown() && !socket.isOutputShutdown();
	}

	@Override
	public void writeRequest(RawCommand command) {
		connect();
		try {
			RedisProtocol.write(outputStream, command);
			outputStream.flush();
		} catch (IOException ex) {
			closeResource();
			throw new ClientConnectionException("Failed writing " + command.getId() + " to " + parameters, ex);
		}
	}

	@Override
	public Object readResponse(RawCommand command) {
		if (!isConnected()) {
			throw new ClientConnectionException("Not connected to " + parameters);
		}
		try {
			return RedisProtocol.read(inputStream);
		} catch (ServerErrorException ex) {
			throw ex;
		} catch (RuntimeException ex) {
			// the stream is out of sync with the server
			closeResource();
			throw ex;
		}
	}
}
