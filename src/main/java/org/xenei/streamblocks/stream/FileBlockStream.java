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

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.RandomAccessFile;

import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A block stream that reads/writes a file directly.
 *
 */
public class FileBlockStream implements BlockStream {

	private static final Logger LOG = LoggerFactory.getLogger(FileBlockStream.class);

	private final RandomAccessFile file;

	/**
	 * An output stream that always writes at the current file location.
	 */
	private final OutputStream fileStream;

	/**
	 * Constructor. The file is created if it does not exist.
	 * 
	 * @param fileName The name of the file to process
	 * @throws IOException on error
	 */
	public FileBlockStream(String fileName) throws IOException {
		this(new File(fileName));
	}

	/**
	 * Constructor. The file is created if it does not exist.
	 * 
	 * @param f The file to process
	 * @throws IOException on error
	 */
	public FileBlockStream(File f) throws IOException {
		if (!f.exists()) {
			LOG.debug("Creating {}", f);
			f.createNewFile();
		}
		file = new RandomAccessFile(f, "rw");
		fileStream = new OutputStream() {

			@Override
			public void write(int b) throws IOException {
				file.write(b);
			}

			@Override
			public void write(byte[] b) throws IOException {
				file.write(b);
			}

			@Override
			public void write(byte[] b, int off, int len) throws IOException {
				file.write(b, off, len);
			}
		};
	}

	@Override
	public long position() throws IOException {
		return file.getFilePointer();
	}

	@Override
	public void position(long position) throws IOException {
		file.seek(position);
	}

	@Override
	public int read(byte[] buff, int off, int len) throws IOException {
		return file.read(buff, off, len);
	}

	@Override
	public void write(byte[] buff, int off, int len) throws IOException {
		file.write(buff, off, len);
	}

	@Override
	public void flush() throws IOException {
		file.getChannel().force(false);
	}

	@Override
	public long length() throws IOException {
		return file.length();
	}

	/**
	 * Set the length of the file. {@link RandomAccessFile#setLength(long)} leaves
	 * the content of an extension undefined so the new region is explicitly
	 * written with zeros.
	 */
	@Override
	public void setLength(long length) throws IOException {
		long oldLength = file.length();
		long pos = file.getFilePointer();
		file.setLength(length);
		if (length > oldLength) {
			LOG.debug("Zero filling {} bytes at {}", length - oldLength, oldLength);
			file.seek(oldLength);
			try (InputStream in = new FillInputStream(length - oldLength)) {
				IOUtils.copyLarge(in, fileStream);
			}
		}
		file.seek(Long.min(pos, length));
	}

	@Override
	public void close() throws IOException {
		file.close();
	}

	@Override
	public String toString() {
		try {
			return String.format("FileBlockStream[ p:%s l:%s]", file.getFilePointer(), file.length());
		} catch (IOException e) {
			return "FileBlockStream[ closed]";
		}
	}
}
