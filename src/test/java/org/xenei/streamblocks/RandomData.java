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

import java.util.Random;

/**
 * Test data helpers.
 */
public class RandomData {

	private static final Random RANDOM = new Random();

	private RandomData() {
	}

	/**
	 * Create an array of random bytes.
	 * @param length the number of bytes.
	 * @return the bytes.
	 */
	public static byte[] randomBytes(int length) {
		byte[] data = new byte[length];
		RANDOM.nextBytes(data);
		return data;
	}
}
