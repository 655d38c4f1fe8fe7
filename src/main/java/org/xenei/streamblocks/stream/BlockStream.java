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

import java.io.Closeable;
import java.io.IOException;

/**
 * A seekable byte source and sink that block storage is layered over.
 * 
 * The stream has a single shared cursor. Callers must position the stream
 * immediately before each read or write that depends on the position.
 *
 */
public interface BlockStream extends Closeable {

	/**
	 * Get the current position of the cursor.
	 * @return the current position.
	 * @throws IOException on error.
	 */
	public long position() throws IOException;

	/**
	 * Move the cursor.
	 * @param position the new position, may be past the end of the stream.
	 * @throws IOException on error.
	 */
	public void position(long position) throws IOException;

	/**
	 * Read up to {@code len} bytes at the current position and advance the cursor.
	 * @param buff the buffer to read into.
	 * @param off the offset in the buffer to start writing at.
	 * @param len the maximum number of bytes to read.
	 * @return the number of bytes read, or -1 if the end of the data was reached.
	 * @throws IOException on error.
	 */
	public int read(byte[] buff, int off, int len) throws IOException;

	/**
	 * Write {@code len} bytes at the current position and advance the cursor.
	 * Writing past the end of the stream extends it.
	 * @param buff the buffer to write from.
	 * @param off the offset in the buffer to start reading at.
	 * @param len the number of bytes to write.
	 * @throws IOException on error.
	 */
	public void write(byte[] buff, int off, int len) throws IOException;

	/**
	 * Force any buffered writes to durable storage.
	 * @throws IOException on error.
	 */
	public void flush() throws IOException;

	/**
	 * Get the total length of the stream.
	 * @return the length in bytes.
	 * @throws IOException on error.
	 */
	public long length() throws IOException;

	/**
	 * Set the total length of the stream. When the stream grows the new
	 * region is filled with zero bytes.
	 * @param length the new length.
	 * @throws IOException on error.
	 */
	public void setLength(long length) throws IOException;

}
