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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.nio.ByteBuffer;

import org.junit.Test;
import org.xenei.streamblocks.stream.BlockStream;
import org.xenei.streamblocks.stream.MemoryBlockStream;

public class MemoryBlockStorageTest extends AbstractBlockStorageTest {

	private MemoryBlockStream memory;

	@Override
	BlockStream createStream() {
		memory = new MemoryBlockStream();
		return memory;
	}

	@Test
	public void testCloseFlushesOpenBlocks() throws IOException {
		createStorage(4096, 48);
		Block block = storage.createNew();
		block.setHeader(1, 1234);
		block.write(new byte[] { 9, 8, 7 }, 0, 0, 3);
		storage.close();
		assertTrue(block.isReleased());

		ByteBuffer bytes = ByteBuffer.wrap(memory.toByteArray());
		assertEquals(4096, bytes.capacity());
		assertEquals(1234, bytes.getLong(8));
		assertEquals(9, bytes.get(48));
		assertEquals(8, bytes.get(49));
		assertEquals(7, bytes.get(50));
	}

	@Test
	public void testPersistedLayout() throws IOException {
		createStorage(256, 16);
		storage.createNew().release();
		try (Block block = storage.createNew()) {
			block.setHeader(0, 0x0102030405060708L);
			block.write(new byte[] { 42 }, 0, 239, 1);
		}
		ByteBuffer bytes = ByteBuffer.wrap(memory.toByteArray());
		assertEquals(512, bytes.capacity());
		assertEquals(0x0102030405060708L, bytes.getLong(256));
		assertEquals(0x01, bytes.get(256));
		assertEquals(42, bytes.get(511));
	}
}
