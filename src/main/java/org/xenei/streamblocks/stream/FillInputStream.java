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

import java.io.InputStream;
import java.util.Arrays;

/**
 * An input stream that returns a specified number of null bytes (0)
 *
 */
class FillInputStream extends InputStream {

	private long remaining;

	/**
	 * Constructor
	 * 
	 * @param length the number of bytes in the stream.
	 */
	public FillInputStream(long length) {
		if (length < 0) {
			throw new IllegalArgumentException(String.format("length %s may not be negative", length));
		}
		this.remaining = length;
	}

	@Override
	public int read() {
		if (remaining <= 0) {
			return -1;
		}
		remaining--;
		return 0;
	}

	@Override
	public int read(byte[] buff, int off, int len) {
		if (len == 0) {
			return 0;
		}
		if (remaining <= 0) {
			return -1;
		}
		int read = (int) Long.min(remaining, len);
		Arrays.fill(buff, off, off + read, (byte) 0);
		remaining -= read;
		return read;
	}

	@Override
	public long skip(long n) {
		long skipped = Long.max(0, Long.min(n, remaining));
		remaining -= skipped;
		return skipped;
	}

	@Override
	public int available() {
		return (int) Long.min(remaining, Integer.MAX_VALUE);
	}
}
