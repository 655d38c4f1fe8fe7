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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

import org.apache.commons.io.IOUtils;
import org.junit.Test;

public class FillInputStreamTest {

	@Test
	public void testLength() throws IOException {
		ByteArrayOutputStream baos = new ByteArrayOutputStream();
		try (FillInputStream in = new FillInputStream(10000)) {
			assertEquals(10000, IOUtils.copyLarge(in, baos));
		}
		assertArrayEquals(new byte[10000], baos.toByteArray());
	}

	@Test
	public void testReadClearsBuffer() {
		FillInputStream in = new FillInputStream(3);
		byte[] buff = { 1, 1, 1, 1, 1 };
		assertEquals(3, in.read(buff, 1, 4));
		assertArrayEquals(new byte[] { 1, 0, 0, 0, 1 }, buff);
		assertEquals(-1, in.read(buff, 0, 1));
		assertEquals(-1, in.read());
	}

	@Test
	public void testEmpty() {
		FillInputStream in = new FillInputStream(0);
		assertEquals(0, in.available());
		assertEquals(-1, in.read());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNegative() {
		new FillInputStream(-1);
	}
}
