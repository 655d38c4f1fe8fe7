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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xenei.streamblocks.stream.BlockStream;

/**
 * A block storage over a {@link BlockStream}.
 * 
 * The storage tracks every open block by id so that a block is never open
 * twice. A block is dropped from tracking when it is released.
 * 
 * This class is not thread safe. Blocks share the stream cursor so all calls
 * on the storage and its blocks must be serialized by the caller.
 *
 */
public class StreamBlockStorage implements BlockStorage {

	private static final Logger LOG = LoggerFactory.getLogger(StreamBlockStorage.class);

	private final BlockStream stream;
	private final BlockGeometry geometry;
	private final Map<Long, StreamBlock> blocks = new HashMap<Long, StreamBlock>();
	private final Stats stats;
	private boolean closed;

	/**
	 * Constructor using the default geometry.
	 * 
	 * @param stream the stream to store blocks in.
	 */
	public StreamBlockStorage(BlockStream stream) {
		this(stream, BlockGeometry.defaults());
	}

	/**
	 * Constructor.
	 * 
	 * @param stream the stream to store blocks in.
	 * @param blockSize the total number of bytes in a block.
	 * @param headerSize the number of header bytes at the start of each block.
	 */
	public StreamBlockStorage(BlockStream stream, int blockSize, int headerSize) {
		this(stream, BlockGeometry.of(blockSize, headerSize));
	}

	/**
	 * Constructor.
	 * 
	 * @param stream the stream to store blocks in.
	 * @param geometry the block geometry.
	 */
	public StreamBlockStorage(BlockStream stream, BlockGeometry geometry) {
		if (stream == null) {
			throw new IllegalArgumentException("stream may not be null");
		}
		if (geometry == null) {
			throw new IllegalArgumentException("geometry may not be null");
		}
		this.stream = stream;
		this.geometry = geometry;
		this.stats = new StatsImpl();
		LOG.debug("Created storage {} over {}", geometry, stream);
	}

	private void checkClosed() {
		if (closed) {
			throw new IllegalStateException("Storage is closed");
		}
	}

	@Override
	public BlockGeometry geometry() {
		return geometry;
	}

	@Override
	public Stats stats() {
		return stats;
	}

	@Override
	public Block createNew() throws IOException {
		checkClosed();
		long length = stream.length();
		if (length % geometry.blockSize() != 0) {
			throw new MisalignedStreamException(length, geometry.blockSize());
		}

		long id = length / geometry.blockSize();
		stream.setLength(length + geometry.blockSize());
		stream.flush();

		StreamBlock block = new StreamBlock(this, stream, id, new byte[geometry.sectorSize()]);
		blocks.put(id, block);
		LOG.debug("Created {}", block);
		return block;
	}

	@Override
	public Block find(long id) throws IOException {
		checkClosed();
		if (id < 0) {
			throw new IllegalArgumentException(String.format("block id %s may not be negative", id));
		}
		StreamBlock block = blocks.get(id);
		if (block != null) {
			return block;
		}

		if (id > (Long.MAX_VALUE - geometry.blockSize()) / geometry.blockSize()) {
			return null;
		}
		long offset = geometry.offsetOf(id);
		if (offset + geometry.blockSize() > stream.length()) {
			LOG.debug("Block {} not found", id);
			return null;
		}

		byte[] sector = new byte[geometry.sectorSize()];
		stream.position(offset);
		StreamBlock.readFully(stream, sector, 0, sector.length, sector.length);

		block = new StreamBlock(this, stream, id, sector);
		blocks.put(id, block);
		LOG.debug("Read {}", block);
		return block;
	}

	/**
	 * Stop tracking a released block. Only the tracked instance for the id is
	 * removed.
	 * 
	 * @param block the released block.
	 */
	void release(StreamBlock block) {
		if (blocks.remove(block.id(), block)) {
			LOG.debug("Released {}", block);
		}
	}

	@Override
	public void close() throws IOException {
		if (closed) {
			return;
		}
		IOException error = null;
		try {
			List<StreamBlock> open = new ArrayList<StreamBlock>(blocks.values());
			for (StreamBlock block : open) {
				LOG.warn("{} was not released before the storage was closed", block);
				try {
					block.release();
				} catch (IOException e) {
					if (error == null) {
						error = e;
					} else {
						error.addSuppressed(e);
					}
				}
			}
		} finally {
			closed = true;
			blocks.clear();
			stream.close();
		}
		if (error != null) {
			throw error;
		}
	}

	/**
	 * Stats implementation for StreamBlockStorage.
	 */
	public class StatsImpl implements Stats {

		@Override
		public long dataLength() {
			if (closed) {
				return -1;
			}
			try {
				return stream.length();
			} catch (IOException e) {
				return -1;
			}
		}

		@Override
		public long blockCount() {
			long length = dataLength();
			return (length < 0) ? -1 : length / geometry.blockSize();
		}

		@Override
		public long openBlocks() {
			return closed ? -1 : blocks.size();
		}

		@Override
		public String toString() {
			return String.format("l:%s b:%s o:%s", dataLength(), blockCount(), openBlocks());
		}
	}
}
