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
 * The BlockStorage interface.
 * 
 * Block storage divides a stream into consecutive blocks of equal size.
 * Blocks are allocated by extending the stream and are addressed by a block
 * number (id). At most one {@link Block} instance is open for an id at a time.
 *
 */
public interface BlockStorage extends Closeable {

	/**
	 * Get the geometry.
	 * @return the block geometry of this storage.
	 */
	public BlockGeometry geometry();

	/**
	 * The total number of bytes in a block.
	 * @return the block size.
	 */
	public default int blockSize() {
		return geometry().blockSize();
	}

	/**
	 * The number of header bytes at the start of a block.
	 * @return the header size.
	 */
	public default int headerSize() {
		return geometry().headerSize();
	}

	/**
	 * The number of data bytes in a block.
	 * @return the data size.
	 */
	public default int dataSize() {
		return geometry().dataSize();
	}

	/**
	 * The number of leading bytes of each block held in memory.
	 * @return the sector size.
	 */
	public default int sectorSize() {
		return geometry().sectorSize();
	}

	/**
	 * Get the stats.
	 * @return the stats for this storage.
	 */
	public Stats stats();

	/**
	 * Allocate a new block at the end of the storage. The caller must release
	 * the block.
	 * @return the new block.
	 * @throws IOException on error.
	 * @throws MisalignedStreamException if the storage is not a whole number of blocks.
	 */
	public Block createNew() throws IOException;

	/**
	 * Find a block. If the block is open the open instance is returned.
	 * Otherwise a new instance is read from the storage and the caller must
	 * release it.
	 * @param id the block id.
	 * @return the block or null if the storage does not contain the block.
	 * @throws IOException on error.
	 */
	public Block find(long id) throws IOException;

	/**
	 * Close the storage. Any block that is still open is released first.
	 * Attempting any operation on a closed storage throws an
	 * {@link IllegalStateException}.
	 * @throws IOException on error.
	 */
	@Override
	public void close() throws IOException;

}
