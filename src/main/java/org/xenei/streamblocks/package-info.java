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
/**
 * Fixed size block storage over a seekable stream.
 * 
 * A {@link org.xenei.streamblocks.BlockStorage} divides a
 * {@link org.xenei.streamblocks.stream.BlockStream} into blocks of equal size.
 * Each {@link org.xenei.streamblocks.Block} has a header of 8 byte fields
 * followed by a data region:
 * 
 * <pre>
 * | block 0                  | block 1                  | ...
 * | header | data            | header | data            |
 * </pre>
 * 
 * The first sector of an open block is cached in memory and written back when
 * the block is released.
 */
package org.xenei.streamblocks;
