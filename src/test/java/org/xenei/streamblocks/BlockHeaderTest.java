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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.nio.ByteBuffer;

import org.junit.Test;

public class BlockHeaderTest {

	private final ByteBuffer buffer = ByteBuffer.allocate(128);
	private final BlockHeader header = new BlockHeader(buffer, 8);

	@Test
	public void testCachedFieldIsLoadedOnce() {
		buffer.putLong(0, 17);
		assertFalse(header.isCached(0));
		assertEquals(17, header.get(0));
		assertTrue(header.isCached(0));

		// the decoded value is kept
		buffer.putLong(0, 18);
		assertEquals(17, header.get(0));
	}

	@Test
	public void testUncachedFieldIsDecodedEachTime() {
		int field = BlockGeometry.HEADER_CACHE_SIZE;
		buffer.putLong(field * Long.BYTES, 17);
		assertEquals(17, header.get(field));
		assertFalse(header.isCached(field));
		buffer.putLong(field * Long.BYTES, 18);
		assertEquals(18, header.get(field));
	}

	@Test
	public void testSetWritesBuffer() {
		for (int i = 0; i < 8; i++) {
			header.set(i, -i);
		}
		for (int i = 0; i < 8; i++) {
			assertEquals(-i, buffer.getLong(i * Long.BYTES));
			assertEquals(-i, header.get(i));
		}
		assertTrue(header.isCached(0));
		assertEquals(0, buffer.getLong(64));
	}

	@Test(expected = IndexOutOfBoundsException.class)
	public void testFieldPastHeader() {
		header.get(8);
	}

	@Test(expected = IndexOutOfBoundsException.class)
	public void testNegativeField() {
		header.set(-1, 0);
	}
}
