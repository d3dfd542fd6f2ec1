package com.feeyo.kvclient.protocol;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.feeyo.kvclient.command.RawCommand;
import com.feeyo.kvclient.exception.ClientConnectionException;
import com.feeyo.kvclient.exception.ServerErrorException;

/**
 * RESP request writer and reply reader shared by the built-in connections.
 */
public final class RedisProtocol {

	// redis command header
	public static final byte DOLLAR_BYTE = '$';
	public static final byte ASTERISK_BYTE = '*';
	public static final byte PLUS_BYTE = '+';
	public static final byte MINUS_BYTE = '-';
	public static final byte COLON_BYTE = ':';

	public static final Charset CHARSET = StandardCharsets.UTF_8;

	private static final byte[] CRLF = { '\r', '\n' };

	private RedisProtocol() {}

	// write
	// -------------------------------------------------------------------
	public static void write(final OutputStream os, final RawCommand command) throws IOException {
		List<String> tokens = command.getTokens();
		os.write(ASTERISK_BYTE);
		writeIntCrLf(os, tokens.size());
		for (String token : tokens) {
			byte[] arg = token.getBytes(CHARSET);
			os.write(DOLLAR_BYTE);
			writeIntCrLf(os, arg.length);
			os.write(arg);
			os.write(CRLF);
		}
	}

	public static byte[] encode(final RawCommand command) {
		ByteArrayOutputStream bout = new ByteArrayOutputStream();
		try {
			write(bout, command);
		} catch (IOException e) {
			// not thrown by an in-memory stream
			throw new IllegalStateException(e);
		}
		return bout.toByteArray();
	}

	private static void writeIntCrLf(final OutputStream os, final int value) throws IOException {
		os.write(Integer.toString(value).getBytes(CHARSET));
		os.write(CRLF);
	}

	// read reply and parse
	// -------------------------------------------------------------------
	public static Object read(final RedisInputStream is) {
		final byte b = is.readByte();
		if (b == PLUS_BYTE) {
			return is.readLine();
		} else if (b == DOLLAR_BYTE) {
			return processBulkReply(is);
		} else if (b == ASTERISK_BYTE) {
			return processMultiBulkReply(is);
		} else if (b == COLON_BYTE) {
			return is.readLongCrLf();
		} else if (b == MINUS_BYTE) {
			throw new ServerErrorException(is.readLine());
		} else {
			throw new ClientConnectionException("Unknown reply: " + (char) b);
		}
	}

	private static String processBulkReply(final RedisInputStream is) {
		final int len = is.readIntCrLf();
		if (len == -1) {
			return null;
		}
		if (len < -1) {
			throw new ClientConnectionException("Invalid bulk length: " + len);
		}

		final byte[] read = new byte[len];
		int offset = 0;
		while (offset < len) {
			int n = is.read(read, offset, (len - offset));
			if (n == -1) {
				throw new ClientConnectionException("Unexpected end of stream.");
			}
			offset += n;
		}

		// read 2 more bytes for the command delimiter
		is.readByte();
		is.readByte();

		return new String(read, CHARSET);
	}

	private static List<Object> processMultiBulkReply(final RedisInputStream is) {
		final int num = is.readIntCrLf();
		if (num == -1) {
			return null;
		}
		if (num < -1) {
			throw new ClientConnectionException("Invalid multi-bulk length: " + num);
		}
		final List<Object> ret = new ArrayList<Object>(Math.min(num, 1024));
		for (int i = 0; i < num; i++) {
			try {
				ret.add(read(is));
			} catch (ServerErrorException e) {
				ret.add(e);
			}
		}
		return ret;
	}
}
