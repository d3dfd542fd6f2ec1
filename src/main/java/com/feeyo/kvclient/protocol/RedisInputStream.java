package com.feeyo.kvclient.protocol;

import java.io.ByteArrayOutputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

import com.feeyo.kvclient.exception.ClientConnectionException;

/**
 * Buffered reader for RESP replies. IO failures surface as {@link ClientConnectionException}.
 */
public class RedisInputStream extends FilterInputStream {

	private final byte[] buf;
	private int count;
	private int limit;

	public RedisInputStream(InputStream in) {
		this(in, 8192);
	}

	public RedisInputStream(InputStream in, int size) {
		super(in);
		if (size <= 0) {
			throw new IllegalArgumentException("Buffer size <= 0");
		}
		this.buf = new byte[size];
	}

	public byte readByte() {
		ensureFill();
		return buf[count++];
	}

	public String readLine() {
		return new String(readLineBytes(), RedisProtocol.CHARSET);
	}

	public byte[] readLineBytes() {
		ByteArrayOutputStream bout = new ByteArrayOutputStream(64);
		while (true) {
			ensureFill();
			byte b = buf[count++];
			if (b == '\r') {
				ensureFill();
				byte c = buf[count++];
				if (c == '\n') {
					break;
				}
				bout.write(b);
				bout.write(c);
			} else {
				bout.write(b);
			}
		}
		return bout.toByteArray();
	}

	public int readIntCrLf() {
		long value = readLongCrLf();
		if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
			throw new ClientConnectionException("Invalid length: " + value);
		}
		return (int) value;
	}

	public long readLongCrLf() {
		String line = readLine();
		try {
			return Long.parseLong(line);
		} catch (NumberFormatException e) {
			throw new ClientConnectionException("Invalid length line: " + line, e);
		}
	}

	/**
	 * Returns -1 at end of stream, like any InputStream. The RESP readers above treat it as a broken connection.
	 */
	@Override
	public int read() {
		if (!fill()) {
			return -1;
		}
		return buf[count++] & 0xff;
	}

	@Override
	public int read(byte[] b, int off, int len) {
		if (len == 0) {
			return 0;
		}
		if (!fill()) {
			return -1;
		}
		int length = Math.min(limit - count, len);
		System.arraycopy(buf, count, b, off, length);
		count += length;
		return length;
	}

	private void ensureFill() {
		if (!fill()) {
			throw new ClientConnectionException("Unexpected end of stream.");
		}
	}

	/**
	 * Fills the buffer when it is drained, false at end of stream.
	 */
	private boolean fill() {
		if (count < limit) {
			return true;
		}
		try {
			int n = in.read(buf);
			count = 0;
			limit = Math.max(n, 0);
			return n != -1;
		} catch (IOException e) {
			throw new ClientConnectionException(e);
		}
	}
}
