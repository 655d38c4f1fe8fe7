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

import java.nio.ByteBuffer;

/**
 * The header fields of a block.
 * 
 * The header is the first set of data in a block: consecutive 8 byte fields,
 * field {@code f} at byte offset {@code f * 8}. The fields are read from and
 * written to the sector buffer of the block. The first
 * {@link BlockGeometry#HEADER_CACHE_SIZE} fields are also kept in decoded form.
 * 
 */
class BlockHeader {

	private final ByteBuffer buffer;
	private final int fieldCount;
	private final long[] values;
	private final boolean[] present;

	/**
	 * Create a block header over the sector buffer.
	 * 
	 * @param buffer the sector buffer.
	 * @param fieldCount the number of fields in the header.
	 */
	BlockHeader(ByteBuffer buffer, int fieldCount) {
		this.buffer = buffer;
		this.fieldCount = fieldCount;
		this.values = new long[BlockGeometry.HEADER_CACHE_SIZE];
		this.present = new boolean[BlockGeometry.HEADER_CACHE_SIZE];
	}

	private void checkField(int field) {
		if (field < 0 || field >= fieldCount) {
			throw new IndexOutOfBoundsException(
					String.format("header field %s is not in the range [0,%s)", field, fieldCount));
		}
	}

	/**
	 * Get the value of a field.
	 * 
	 * @param field the field number.
	 * @return the value.
	 */
	long get(int field) {
		checkField(field);
		if (field < values.length) {
			if (!present[field]) {
				values[field] = buffer.getLong(field * Long.BYTES);
				present[field] = true;
			}
			return values[field];
		}
		return buffer.getLong(field * Long.BYTES);
	}

	/**
	 * Set the value of a field.
	 * 
	 * @param field the field number.
	 * @param value the value.
	 */
	void set(int field, long value) {
		checkField(field);
		if (field < values.length) {
			values[field] = value;
			present[field] = true;
		}
		buffer.putLong(field * Long.BYTES, value);
	}

	/**
	 * Check if a field value is held in decoded form.
	 * 
	 * @param field the field number.
	 * @return true if the field is cached.
	 */
	boolean isCached(int field) {
		return field >= 0 && field < present.length && present[field];
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("H[");
		for (int i = 0; i < fieldCount; i++) {
			sb.append(' ').append(buffer.getLong(i * Long.BYTES));
		}
		return sb.append(']').toString();
	}
}
