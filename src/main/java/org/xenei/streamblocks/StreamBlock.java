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

import java.io.IOException;
import java.nio.ByteBuffer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xenei.streamblocks.stream.BlockStream;

/**
 * A block backed by a region of a {@link BlockStream}.
 * 
 * The first sector of the block (the header and the leading data bytes) is
 * held in memory and only written back when the block is released. Bytes
 * beyond the first sector are read from and written to the stream directly.
 *
 */
class StreamBlock implements Block {

	/**
	 * The maximum number of bytes written to the stream before it is flushed.
	 */
	static final int WRITE_CHUNK_SIZE = 4 * 1024;

	private static final Logger LOG = LoggerFactory.getLogger(StreamBlock.class);

	private final StreamBlockStorage storage;
	private final BlockStream stream;
	private final BlockGeometry geometry;
	private final long id;
	private final byte[] sector;
	private final BlockHeader header;

	private boolean dirty;
	private boolean released;

	/**
	 * Constructor.
	 * 
	 * @param storage the storage that owns the block.
	 * @param stream the stream the block is stored in.
	 * @param id the block id.
	 * @param sector the first sector of the block, exactly sectorSize bytes.
	 */
	StreamBlock(StreamBlockStorage storage, BlockStream stream, long id, byte[] sector) {
		this.geometry = storage.geometry();
		if (sector.length != geometry.sectorSize()) {
			throw new IllegalArgumentException(String.format("sector length %s must be equal to sector size %s",
					sector.length, geometry.sectorSize()));
		}
		this.storage = storage;
		this.stream = stream;
		this.id = id;
		this.sector = sector;
		this.header = new BlockHeader(ByteBuffer.wrap(sector), geometry.headerFields());
	}

	/**
	 * Read exactly {@code len} bytes from the current stream position.
	 * 
	 * @param stream the stream to read.
	 * @param buff the buffer to read into.
	 * @param off the offset in the buffer.
	 * @param len the number of bytes to read.
	 * @param chunkSize the maximum number of bytes per read.
	 * @throws IOException on error.
	 * @throws TruncatedStreamException if the stream ends first.
	 */
	static void readFully(BlockStream stream, byte[] buff, int off, int len, int chunkSize) throws IOException {
		int read = 0;
		while (read < len) {
			int thisRead = stream.read(buff, off + read, Integer.min(chunkSize, len - read));
			if (thisRead <= 0) {
				throw new TruncatedStreamException(stream.position(), len - read);
			}
			read += thisRead;
		}
	}

	private void checkReleased() {
		if (released) {
			throw new IllegalStateException(String.format("Block %s has been released", id));
		}
	}

	private long blockStart() {
		return geometry.offsetOf(id);
	}

	@Override
	public long id() {
		return id;
	}

	@Override
	public long getHeader(int field) {
		checkReleased();
		return header.get(field);
	}

	@Override
	public void setHeader(int field, long value) {
		checkReleased();
		header.set(field, value);
		dirty = true;
	}

	@Override
	public void read(byte[] dst, int dstOffset, int srcOffset, int count) throws IOException {
		checkReleased();
		if (count < 0 || srcOffset < 0 || ((long) srcOffset + count) > geometry.dataSize()) {
			throw new IndexOutOfBoundsException(String.format("Requested %s bytes at %s is outside of data bounds [0,%s)",
					count, srcOffset, geometry.dataSize()));
		}
		if (dstOffset < 0 || ((long) dstOffset + count) > dst.length) {
			throw new IndexOutOfBoundsException(String.format(
					"Requested %s bytes at %s is outside of destination bounds [0,%s)", count, dstOffset, dst.length));
		}

		int sectorSize = geometry.sectorSize();
		int start = geometry.headerSize() + srcOffset;
		int copied = 0;
		if (start < sectorSize) {
			copied = Integer.min(sectorSize - start, count);
			System.arraycopy(sector, start, dst, dstOffset, copied);
		}

		if (copied < count) {
			stream.position(blockStart() + Integer.max(sectorSize, start));
			readFully(stream, dst, dstOffset + copied, count - copied, sectorSize);
		}
	}

	@Override
	public void write(byte[] src, int srcOffset, int dstOffset, int count) throws IOException {
		checkReleased();
		if (count < 0 || dstOffset < 0 || ((long) dstOffset + count) > geometry.dataSize()) {
			throw new IndexOutOfBoundsException(String.format("Writing %s bytes at %s is outside of data bounds [0,%s)",
					count, dstOffset, geometry.dataSize()));
		}
		if (srcOffset < 0 || ((long) srcOffset + count) > src.length) {
			throw new IndexOutOfBoundsException(String.format(
					"Writing %s bytes from %s is outside of source bounds [0,%s)", count, srcOffset, src.length));
		}

		int sectorSize = geometry.sectorSize();
		int start = geometry.headerSize() + dstOffset;

		// bytes in the first sector are written when the block is released
		int cached = 0;
		if (start < sectorSize) {
			cached = Integer.min(count, sectorSize - start);
			if (cached > 0) {
				System.arraycopy(src, srcOffset, sector, start, cached);
				dirty = true;
			}
		}

		if (start + count > sectorSize && count > cached) {
			stream.position(blockStart() + Integer.max(sectorSize, start));
			int offset = srcOffset + cached;
			int remaining = count - cached;
			int written = 0;
			while (written < remaining) {
				int bytesToWrite = Integer.min(WRITE_CHUNK_SIZE, remaining - written);
				stream.write(src, offset + written, bytesToWrite);
				stream.flush();
				written += bytesToWrite;
			}
			if (LOG.isDebugEnabled()) {
				LOG.debug("{} wrote {} bytes past the first sector", this, remaining);
			}
		}
	}

	/**
	 * Check if the first sector has changes that have not been written.
	 * 
	 * @return true if the block is dirty.
	 */
	boolean isDirty() {
		return dirty;
	}

	@Override
	public boolean isReleased() {
		return released;
	}

	@Override
	public void release() throws IOException {
		if (released) {
			return;
		}
		released = true;
		try {
			if (dirty) {
				stream.position(blockStart());
				stream.write(sector, 0, sector.length);
				stream.flush();
				dirty = false;
				LOG.debug("{} flushed {}", this, header);
			}
		} finally {
			storage.release(this);
		}
	}

	@Override
	public String toString() {
		return String.format("B[ id:%s d:%s r:%s]", id, dirty, released);
	}
}
