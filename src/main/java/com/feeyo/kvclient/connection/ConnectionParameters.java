package com.feeyo.kvclient.connection;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import com.feeyo.kvclient.exception.ConnectionParametersException;
import com.google.common.base.CharMatcher;

/**
 * Normalized description of a single endpoint.
 *
 * <p>Well known keys have typed getters, every other key is an extra option that is
 * kept verbatim and handed over to the connection.
 */
public class ConnectionParameters {

	public static final String SCHEME = "scheme";
	public static final String HOST = "host";
	public static final String PORT = "port";
	public static final String PATH = "path";
	public static final String USER = "user";
	public static final String PASSWORD = "password";
	public static final String DATABASE = "database";
	public static final String TIMEOUT = "timeout";
	public static final String READ_WRITE_TIMEOUT = "read_write_timeout";
	public static final String ALIAS = "alias";
	public static final String WEIGHT = "weight";

	public static final String DEFAULT_SCHEME = "tcp";
	public static final String DEFAULT_HOST = "127.0.0.1";
	public static final int DEFAULT_PORT = 6379;
	public static final int DEFAULT_TIMEOUT = 5000;

	private final Map<String, String> values;

	private ConnectionParameters(Map<String, String> values) {
		this.values = Collections.unmodifiableMap(values);
	}

	/**
	 * Normalizes a URI string, a map of options or an existing instance.
	 */
	public static ConnectionParameters create(Object parameters) {
		if (parameters instanceof ConnectionParameters) {
			return (ConnectionParameters) parameters;
		}
		if (parameters instanceof String) {
			return parse((String) parameters);
		}
		if (parameters instanceof Map) {
			return fromMap((Map<?, ?>) parameters);
		}
		throw new ConnectionParametersException("Unsupported connection parameters: " + parameters);
	}

	public static ConnectionParameters fromMap(Map<?, ?> map) {
		Map<String, String> values = new LinkedHashMap<String, String>();
		for (Map.Entry<?, ?> entry : map.entrySet()) {
			if (entry.getKey() == null || entry.getValue() == null) {
				continue;
			}
			values.put(entry.getKey().toString(), entry.getValue().toString());
		}
		return normalize(values);
	}

	/**
	 * scheme://[user:password@]host[:port][?key=value&...], unix:/path/to/socket
	 */
	public static ConnectionParameters parse(String uri) {
		if (uri == null || uri.trim().isEmpty()) {
			throw new ConnectionParametersException("Invalid parameters URI: " + uri);
		}

		URI parsed;
		try {
			parsed = new URI(uri.trim());
		} catch (URISyntaxException e) {
			throw new ConnectionParametersException("Invalid parameters URI: " + uri, e);
		}

		if (parsed.getScheme() == null || parsed.isOpaque()) {
			throw new ConnectionParametersException("Invalid parameters URI: " + uri);
		}

		Map<String, String> values = new LinkedHashMap<String, String>();
		values.put(SCHEME, parsed.getScheme());

		String userInfo = parsed.getRawUserInfo();
		if ("unix".equalsIgnoreCase(parsed.getScheme())) {
			values.put(PATH, parsed.getPath());
		} else if (parsed.getHost() != null) {
			values.put(HOST, parsed.getHost());
			if (parsed.getPort() != -1) {
				values.put(PORT, Integer.toString(parsed.getPort()));
			}
		} else {
			// registry based authority, e.g. a host name with '_'
			userInfo = parseAuthority(parsed.getRawAuthority(), uri, values);
		}

		if (userInfo != null) {
			int idx = userInfo.indexOf(':');
			if (idx == -1) {
				values.put(PASSWORD, decode(userInfo));
			} else {
				if (idx > 0) {
					values.put(USER, decode(userInfo.substring(0, idx)));
				}
				values.put(PASSWORD, decode(userInfo.substring(idx + 1)));
			}
		}

		String query = parsed.getRawQuery();
		if (query != null) {
			for (String pair : query.split("&")) {
				if (pair.isEmpty()) {
					continue;
				}
				int idx = pair.indexOf('=');
				if (idx == -1) {
					values.put(decode(pair), "");
				} else {
					values.put(decode(pair.substring(0, idx)), decode(pair.substring(idx + 1)));
				}
			}
		}

		return normalize(values);
	}

	/**
	 * Splits [userinfo@]host[:port] into host and port, returns the raw userinfo or null.
	 */
	private static String parseAuthority(String authority, String uri, Map<String, String> values) {
		if (authority == null || authority.isEmpty()) {
			throw new ConnectionParametersException("Invalid parameters URI: " + uri);
		}

		String userInfo = null;
		String hostPort = authority;
		int at = authority.lastIndexOf('@');
		if (at != -1) {
			userInfo = authority.substring(0, at);
			hostPort = authority.substring(at + 1);
		}

		String host = hostPort;
		int colon = hostPort.lastIndexOf(':');
		if (colon != -1 && hostPort.indexOf(']') < colon) {
			host = hostPort.substring(0, colon);
			String port = hostPort.substring(colon + 1);
			if (!port.isEmpty()) {
				values.put(PORT, port);
			}
		}

		if (host.isEmpty() || !CharMatcher.anyOf("@/?#[]").matchesNoneOf(host)) {
			throw new ConnectionParametersException("Invalid parameters URI: " + uri);
		}
		values.put(HOST, host);
		return userInfo;
	}

	private static String decode(String value) {
		try {
			return URLDecoder.decode(value, StandardCharsets.UTF_8);
		} catch (IllegalArgumentException e) {
			throw new ConnectionParametersException("Invalid URI component: " + value, e);
		}
	}

	private static ConnectionParameters normalize(Map<String, String> values) {
		// empty credentials and databases are treated as absent
		for (String key : new String[] { PASSWORD, DATABASE }) {
			String value = values.get(key);
			if (value != null && value.trim().isEmpty()) {
				values.remove(key);
			}
		}

		String scheme = values.get(SCHEME);
		if (scheme == null || scheme.trim().isEmpty()) {
			values.put(SCHEME, DEFAULT_SCHEME);
		} else {
			values.put(SCHEME, scheme.trim().toLowerCase(Locale.ROOT));
		}

		if (!"unix".equals(values.get(SCHEME)) && !values.containsKey(HOST)) {
			values.put(HOST, DEFAULT_HOST);
		}

		checkInteger(values, PORT, 0, 65535);
		checkInteger(values, DATABASE, 0, Integer.MAX_VALUE);
		checkInteger(values, TIMEOUT, 0, Integer.MAX_VALUE);
		checkInteger(values, READ_WRITE_TIMEOUT, 0, Integer.MAX_VALUE);
		checkInteger(values, WEIGHT, 0, Integer.MAX_VALUE);

		return new ConnectionParameters(values);
	}

	private static void checkInteger(Map<String, String> values, String key, int min, int max) {
		String value = values.get(key);
		if (value == null) {
			return;
		}
		try {
			int i = Integer.parseInt(value.trim());
			if (i < min || i > max) {
				throw new ConnectionParametersException(
						"Parameter '" + key + "' must be in [" + min + ", " + max + "]: " + value);
			}
			values.put(key, Integer.toString(i));
		} catch (NumberFormatException e) {
			throw new ConnectionParametersException("Parameter '" + key + "' is not an integer: " + value, e);
		}
	}

	public String getScheme() {
		return values.get(SCHEME);
	}

	public String getHost() {
		return values.get(HOST);
	}

	public int getPort() {
		return getInt(PORT, DEFAULT_PORT);
	}

	public String getPath() {
		return values.get(PATH);
	}

	public String getUser() {
		return values.get(USER);
	}

	public String getPassword() {
		return values.get(PASSWORD);
	}

	public Integer getDatabase() {
		String database = values.get(DATABASE);
		return database == null ? null : Integer.valueOf(database);
	}

	public int getTimeout() {
		return getInt(TIMEOUT, DEFAULT_TIMEOUT);
	}

	public int getReadWriteTimeout() {
		return getInt(READ_WRITE_TIMEOUT, 0);
	}

	public String getAlias() {
		return values.get(ALIAS);
	}

	public String get(String key) {
		return values.get(key);
	}

	public boolean isSet(String key) {
		return values.containsKey(key);
	}

	public int getInt(String key, int defaultVal) {
		String value = values.get(key);
		return value == null ? defaultVal : Integer.parseInt(value);
	}

	public Map<String, String> toMap() {
		return values;
	}

	@Override
	public int hashCode() {
		return values.hashCode();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return values.equals( ((ConnectionParameters) o).values );
	}

	@Override
	public String toString() {
		StringBuffer sb = new StringBuffer();
		sb.append(getScheme()).append("://");
		if ("unix".equals(getScheme())) {
			sb.append(getPath());
		} else {
			sb.append(getHost()).append(":").append(getPort());
		}
		return sb.toString();
	}
}
