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

import java.util.HashMap;
import java.util.Map;

/**
 * The immutable block layout used by a block storage.
 * 
 * A block is {@code blockSize} bytes: {@code headerSize} bytes of header
 * fields followed by {@code dataSize} bytes of data. The first
 * {@code sectorSize} bytes of each open block are held in memory.
 *
 */
public final class BlockGeometry {

	public static final String BLOCK_SIZE = "block-size";
	public static final String HEADER_SIZE = "header-size";

	/**
	 * The default block size.
	 */
	public static final int DEFAULT_BLOCK_SIZE = 4 * 1024;

	/**
	 * The default header size: room for 6 header fields.
	 */
	public static final int DEFAULT_HEADER_SIZE = 6 * Long.BYTES;

	/**
	 * The smallest block size accepted.
	 */
	public static final int MIN_BLOCK_SIZE = 128;

	/**
	 * The sector size used for blocks of at least {@link #LARGE_SECTOR_SIZE}
	 * bytes. Matches the transfer unit of most file systems.
	 */
	public static final int LARGE_SECTOR_SIZE = 4 * 1024;

	/**
	 * The sector size used for blocks smaller than {@link #LARGE_SECTOR_SIZE}.
	 */
	public static final int SMALL_SECTOR_SIZE = 128;

	/**
	 * The number of header fields that are cached in decoded form.
	 */
	public static final int HEADER_CACHE_SIZE = 5;

	private final int blockSize;
	private final int headerSize;
	private final int sectorSize;

	private BlockGeometry(int blockSize, int headerSize) {
		if (blockSize < MIN_BLOCK_SIZE) {
			throw new IllegalArgumentException(
					String.format("block size %s must be at least %s", blockSize, MIN_BLOCK_SIZE));
		}
		if (headerSize < 0) {
			throw new IllegalArgumentException(String.format("header size %s may not be negative", headerSize));
		}
		if (headerSize >= blockSize) {
			throw new IllegalArgumentException(
					String.format("header size %s must be less than block size %s", headerSize, blockSize));
		}
		this.blockSize = blockSize;
		this.headerSize = headerSize;
		this.sectorSize = (blockSize >= LARGE_SECTOR_SIZE) ? LARGE_SECTOR_SIZE : SMALL_SECTOR_SIZE;
		if (headerSize > sectorSize) {
			throw new IllegalArgumentException(
					String.format("header size %s does not fit in the %s byte sector", headerSize, sectorSize));
		}
	}

	/**
	 * The geometry with {@link #DEFAULT_BLOCK_SIZE} and {@link #DEFAULT_HEADER_SIZE}.
	 * @return the default geometry.
	 */
	public static BlockGeometry defaults() {
		return new BlockGeometry(DEFAULT_BLOCK_SIZE, DEFAULT_HEADER_SIZE);
	}

	/**
	 * Create a geometry.
	 * @param blockSize the total number of bytes in a block.
	 * @param headerSize the number of header bytes at the start of each block.
	 * @return the geometry.
	 * @throws IllegalArgumentException if the sizes are not valid.
	 */
	public static BlockGeometry of(int blockSize, int headerSize) {
		return new BlockGeometry(blockSize, headerSize);
	}

	/**
	 * Create a geometry from a configuration map. Missing keys take the default
	 * values.
	 * @param map the map containing {@link #BLOCK_SIZE} and/or {@link #HEADER_SIZE}.
	 * @return the geometry.
	 * @throws IllegalArgumentException if a value is not an integer or the sizes are not valid.
	 */
	public static BlockGeometry fromMap(Map<String, ?> map) {
		return new BlockGeometry(intValue(map, BLOCK_SIZE, DEFAULT_BLOCK_SIZE),
				intValue(map, HEADER_SIZE, DEFAULT_HEADER_SIZE));
	}

	private static int intValue(Map<String, ?> map, String key, int defaultValue) {
		Object value = map.get(key);
		if (value == null) {
			return defaultValue;
		}
		if (value instanceof Number) {
			return ((Number) value).intValue();
		}
		try {
			return Integer.parseInt(value.toString().trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(String.format("%s is not an integer: %s", key, value), e);
		}
	}

	/**
	 * Get the configuration map for this geometry.
	 * @return a map that {@link #fromMap(Map)} accepts.
	 */
	public Map<String, Integer> asMap() {
		Map<String, Integer> map = new HashMap<String, Integer>();
		map.put(BLOCK_SIZE, blockSize);
		map.put(HEADER_SIZE, headerSize);
		return map;
	}

	public int blockSize() {
		return blockSize;
	}

	public int headerSize() {
		return headerSize;
	}

	public int dataSize() {
		return blockSize - headerSize;
	}

	public int sectorSize() {
		return sectorSize;
	}

	/**
	 * The number of 8 byte header fields.
	 * @return the field count.
	 */
	public int headerFields() {
		return headerSize / Long.BYTES;
	}

	/**
	 * The stream offset of the first byte of a block.
	 * @param id the block id.
	 * @return the offset.
	 */
	public long offsetOf(long id) {
		return id * blockSize;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof BlockGeometry) {
			BlockGeometry other = (BlockGeometry) o;
			return blockSize == other.blockSize && headerSize == other.headerSize;
		}
		return false;
	}

	@Override
	public int hashCode() {
		return 31 * blockSize + headerSize;
	}

	@Override
	public String toString() {
		return String.format("G[ b:%s h:%s d:%s s:%s]", blockSize, headerSize, dataSize(), sectorSize);
	}
}
