/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.xenei.streamblocks.stream;

import java.io.IOException;
import java.util.Arrays;

/**
 * A block stream held entirely in memory. The length is limited to
 * {@link Integer#MAX_VALUE} bytes.
 *
 */
public class MemoryBlockStream implements BlockStream {

	private static final int INITIAL_CAPACITY = 4 * 1024;

	private byte[] data;
	private int length;
	private long position;
	private boolean closed;

	/**
	 * Create an empty stream.
	 */
	public MemoryBlockStream() {
		data = new byte[INITIAL_CAPACITY];
		length = 0;
		position = 0;
	}

	/**
	 * Create a stream that initially contains a copy of the bytes.
	 * 
	 * @param initial the initial content.
	 */
	public MemoryBlockStream(byte[] initial) {
		data = Arrays.copyOf(initial, Integer.max(initial.length, INITIAL_CAPACITY));
		length = initial.length;
		position = 0;
	}

	private void checkOpen() throws IOException {
		if (closed) {
			throw new IOException("Stream is closed");
		}
	}

	/**
	 * Make sure the backing array can hold {@code required} bytes.
	 */
	private void ensureCapacity(long required) throws IOException {
		if (required > Integer.MAX_VALUE) {
			throw new IOException(String.format("Length %s exceeds memory stream limit", required));
		}
		if (required > data.length) {
			long newCapacity = Long.max(required, 2L * data.length);
			data = Arrays.copyOf(data, (int) Long.min(newCapacity, Integer.MAX_VALUE));
		}
	}

	@Override
	public long position() throws IOException {
		checkOpen();
		return position;
	}

	@Override
	public void position(long position) throws IOException {
		checkOpen();
		if (position < 0) {
			throw new IllegalArgumentException(String.format("position %s may not be negative", position));
		}
		this.position = position;
	}

	@Override
	public int read(byte[] buff, int off, int len) throws IOException {
		checkOpen();
		if (len == 0) {
			return 0;
		}
		if (position >= length) {
			return -1;
		}
		int read = (int) Long.min(len, length - position);
		System.arraycopy(data, (int) position, buff, off, read);
		position += read;
		return read;
	}

	@Override
	public void write(byte[] buff, int off, int len) throws IOException {
		checkOpen();
		long end = position + len;
		ensureCapacity(end);
		System.arraycopy(buff, off, data, (int) position, len);
		position = end;
		if (end > length) {
			length = (int) end;
		}
	}

	@Override
	public void flush() throws IOException {
		checkOpen();
	}

	@Override
	public long length() throws IOException {
		checkOpen();
		return length;
	}

	@Override
	public void setLength(long newLength) throws IOException {
		checkOpen();
		if (newLength < 0) {
			throw new IllegalArgumentException(String.format("length %s may not be negative", newLength));
		}
		if (newLength > length) {
			ensureCapacity(newLength);
		} else {
			// clear the tail so a later extension reads back as zeros
			Arrays.fill(data, (int) newLength, length, (byte) 0);
		}
		length = (int) newLength;
		if (position > length) {
			position = length;
		}
	}

	/**
	 * Get a copy of the current content.
	 * 
	 * @return the bytes of the stream.
	 */
	public byte[] toByteArray() {
		return Arrays.copyOf(data, length);
	}

	@Override
	public void close() {
		closed = true;
	}

	@Override
	public String toString() {
		return String.format("MemoryBlockStream[ p:%s l:%s c:%s]", position, length, data.length);
	}
}
