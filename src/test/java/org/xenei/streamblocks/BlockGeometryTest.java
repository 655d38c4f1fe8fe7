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

import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

public class BlockGeometryTest {

	@Test
	public void testDefaults() {
		BlockGeometry geometry = BlockGeometry.defaults();
		assertEquals(4096, geometry.blockSize());
		assertEquals(48, geometry.headerSize());
		assertEquals(4048, geometry.dataSize());
		assertEquals(4096, geometry.sectorSize());
		assertEquals(6, geometry.headerFields());
	}

	@Test
	public void testSectorSize() {
		assertEquals(128, BlockGeometry.of(128, 16).sectorSize());
		assertEquals(128, BlockGeometry.of(4095, 16).sectorSize());
		assertEquals(4096, BlockGeometry.of(4096, 16).sectorSize());
		assertEquals(4096, BlockGeometry.of(64 * 1024, 16).sectorSize());
	}

	@Test
	public void testOffset() {
		assertEquals(0, BlockGeometry.of(128, 16).offsetOf(0));
		assertEquals(3L * 8192, BlockGeometry.of(8192, 48).offsetOf(3));
		assertEquals(8192L * Integer.MAX_VALUE, BlockGeometry.of(8192, 48).offsetOf(Integer.MAX_VALUE));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testBlockTooSmall() {
		BlockGeometry.of(127, 16);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testHeaderTooLarge() {
		BlockGeometry.of(128, 128);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNegativeHeader() {
		BlockGeometry.of(128, -8);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testHeaderOutsideSector() {
		BlockGeometry.of(256, 200);
	}

	@Test
	public void testFromMap() {
		Map<String, Object> map = new HashMap<String, Object>();
		assertEquals(BlockGeometry.defaults(), BlockGeometry.fromMap(map));

		map.put(BlockGeometry.BLOCK_SIZE, 8192);
		map.put(BlockGeometry.HEADER_SIZE, "64");
		BlockGeometry geometry = BlockGeometry.fromMap(map);
		assertEquals(8192, geometry.blockSize());
		assertEquals(64, geometry.headerSize());
		assertEquals(geometry, BlockGeometry.fromMap(geometry.asMap()));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testFromMapNotANumber() {
		Map<String, Object> map = new HashMap<String, Object>();
		map.put(BlockGeometry.BLOCK_SIZE, "big");
		BlockGeometry.fromMap(map);
	}
}
