package com.feeyo.kvclient.connection;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.feeyo.kvclient.command.RawCommand;
import com.feeyo.kvclient.exception.ClientConnectionException;
import com.feeyo.kvclient.exception.ConnectionParametersException;
import com.feeyo.kvclient.exception.NotSupportedException;
import com.feeyo.kvclient.protocol.RedisInputStream;
import com.feeyo.kvclient.protocol.RedisProtocol;

/**
 * Connection bridged over HTTP through a webdis server ({@code http} scheme).
 *
 * <p>Every command is a stateless POST, so AUTH and SELECT never reach the server as commands:
 * the credential becomes basic auth and the database becomes a path prefix of later requests.
 */
public class WebdisConnection extends AbstractConnection {

	private static Logger LOGGER = LoggerFactory.getLogger( WebdisConnection.class );

	private static final String OK = "OK";

	private boolean connected = false;

	private String credential;
	private Integer database;

	public WebdisConnection(ConnectionParameters parameters) {
		super(parameters);
	}

	@Override
	protected ConnectionParameters checkParameters(ConnectionParameters parameters) {
		super.checkParameters(parameters);

		if (!"http".equals(parameters.getScheme())) {
			throw new ConnectionParametersException("Invalid scheme: " + parameters.getScheme());
		}
		return parameters;
	}

	@Override
	protected void openResource() {
		connected = true;
	}

	@Override
	protected void closeResource() {
		connected = false;
		credential = null;
		database = null;
	}

	@Override
	public boolean isConnected() {
		return connected;
	}

	@Override
	public void writeRequest(RawCommand command) {
		throw new NotSupportedException("The method writeRequest() is not supported by webdis connections");
	}

	@Override
	public Object readResponse(RawCommand command) {
		throw new NotSupportedException("The method readResponse() is not supported by webdis connections");
	}

	@Override
	public Object executeCommand(RawCommand command) {
		connect();

		String id = command.getId();
		if ("AUTH".equals(id)) {
			credential = command.getArgument(command.getNumArgs() - 1);
			return OK;
		}
		if ("SELECT".equals(id)) {
			try {
				database = Integer.valueOf(command.getArgument(0));
			} catch (NumberFormatException e) {
				throw new ConnectionParametersException("Invalid database index: " + command.getArgument(0), e);
			}
			return OK;
		}

		byte[] body = post(getCommandPath(command));
		return RedisProtocol.read(new RedisInputStream(new ByteArrayInputStream(body)));
	}

	/**
	 * [db/]ID/arg1/arg2.raw
	 */
	String getCommandPath(RawCommand command) {
		StringBuffer sb = new StringBuffer();
		if (database != null) {
			sb.append(database).append('/');
		}
		sb.append(command.getId());
		for (String argument : command.getArguments()) {
			sb.append('/').append(URLEncoder.encode(argument, StandardCharsets.UTF_8).replace("+", "%20"));
		}
		sb.append(".raw");
		return sb.toString();
	}

	private byte[] post(String commandPath) {
		HttpURLConnection conn = null;
		try {
			URL url = new URL("http", parameters.getHost(), parameters.getPort(), "/");
			conn = (HttpURLConnection) url.openConnection();
			conn.setRequestMethod("POST");
			conn.setDoOutput(true);
			conn.setConnectTimeout(parameters.getTimeout());
			conn.setReadTimeout(parameters.getReadWriteTimeout());
			conn.setRequestProperty("Content-Type", "text/plain; charset=utf-8");

			String user = parameters.getUser();
			if (credential != null) {
				String token = (user != null ? user : "") + ":" + credential;
				conn.setRequestProperty("Authorization",
						"Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8)));
			}

			try (OutputStream out = conn.getOutputStream()) {
				out.write(commandPath.getBytes(StandardCharsets.UTF_8));
			}

			int status = conn.getResponseCode();
			if (status != HttpURLConnection.HTTP_OK) {
				throw new ClientConnectionException("webdis " + parameters + " replied HTTP " + status);
			}
			try (InputStream in = conn.getInputStream()) {
				return in.readAllBytes();
			}

		} catch (IOException e) {
			LOGGER.warn("webdis request to {} failed", parameters, e);
			throw new ClientConnectionException("Failed request to webdis " + parameters, e);
		} finally {
			if (conn != null) {
				conn.disconnect();
			}
		}
	}
}
