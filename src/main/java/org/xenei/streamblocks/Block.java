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
package org.xenei.streamblocks;

import java.io.Closeable;
import java.io.IOException;

/**
 * A fixed size block in a block storage.
 * 
 * A block has a header region of 8 byte fields followed by a data region.
 * Changes to the header and to the first sector of the data are held in
 * memory until the block is released. Data beyond the first sector is written
 * to the storage immediately.
 * 
 * A block must be released when the caller is done with it, preferably with
 * try-with-resources:
 * 
 * <pre>
 * try (Block block = storage.createNew()) {
 * 	block.setHeader(0, 42);
 * }
 * </pre>
 * 
 * Once released every operation other than {@link #release()} throws an
 * {@link IllegalStateException}.
 *
 */
public interface Block extends Closeable {

	/**
	 * Get the block id. The block occupies stream bytes
	 * {@code [id * blockSize, (id + 1) * blockSize)}.
	 * @return the block id.
	 */
	public long id();

	/**
	 * Get the value of a header field.
	 * @param field the field number, {@code 0 <= field < headerSize / 8}.
	 * @return the value of the field.
	 * @throws IndexOutOfBoundsException if the field does not exist.
	 */
	public long getHeader(int field);

	/**
	 * Set the value of a header field. The value is not written to the storage
	 * until the block is released.
	 * @param field the field number, {@code 0 <= field < headerSize / 8}.
	 * @param value the value to set.
	 * @throws IndexOutOfBoundsException if the field does not exist.
	 */
	public void setHeader(int field, long value);

	/**
	 * Read bytes from the data region into a buffer.
	 * @param dst the buffer to read into.
	 * @param dstOffset the position in {@code dst} to start at.
	 * @param srcOffset the position in the data region to start reading from.
	 * @param count the number of bytes to read.
	 * @throws IOException on error.
	 * @throws TruncatedStreamException if the storage ends before all bytes are read.
	 * @throws IndexOutOfBoundsException if either range is out of bounds.
	 */
	public void read(byte[] dst, int dstOffset, int srcOffset, int count) throws IOException;

	/**
	 * Write bytes from a buffer into the data region.
	 * @param src the buffer to write from.
	 * @param srcOffset the position in {@code src} to start at.
	 * @param dstOffset the position in the data region to start writing to.
	 * @param count the number of bytes to write.
	 * @throws IOException on error.
	 * @throws IndexOutOfBoundsException if either range is out of bounds.
	 */
	public void write(byte[] src, int srcOffset, int dstOffset, int count) throws IOException;

	/**
	 * Check if the block has been released.
	 * @return true if the block has been released.
	 */
	public boolean isReleased();

	/**
	 * Write any pending changes to the storage and retire the block. Calling
	 * release on a released block does nothing.
	 * @throws IOException on error.
	 */
	public void release() throws IOException;

	/**
	 * Same as {@link #release()}.
	 */
	@Override
	public default void close() throws IOException {
		release();
	}
}
