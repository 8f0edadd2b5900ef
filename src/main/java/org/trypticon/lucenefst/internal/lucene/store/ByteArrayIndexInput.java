/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.trypticon.lucenefst.internal.lucene.store;

import java.io.EOFException;
import java.io.IOException;

/**
 * {@link IndexInput} over a byte array. Slices share the array and are
 * random access.
 */
public final class ByteArrayIndexInput extends IndexInput implements RandomAccessInput {

  private final byte[] bytes;
  private final int offset;
  private final int length;
  private int pos;

  public ByteArrayIndexInput(String description, byte[] bytes) {
    this(description, bytes, 0, bytes.length);
  }

  public ByteArrayIndexInput(String description, byte[] bytes, int offset, int length) {
    super(description);
    this.bytes = bytes;
    this.offset = offset;
    this.length = length;
  }

  @Override
  public void close() {
  }

  @Override
  public long getFilePointer() {
    return pos;
  }

  @Override
  public void seek(long pos) throws EOFException {
    if (pos < 0 || pos > length) {
      throw new EOFException("seek past EOF: pos=" + pos + " vs length=" + length + ": " + this);
    }
    this.pos = (int) pos;
  }

  @Override
  public long length() {
    return length;
  }

  @Override
  public byte readByte() throws IOException {
    if (pos >= length) {
      throw new EOFException("read past EOF: " + this);
    }
    return bytes[offset + pos++];
  }

  @Override
  public void readBytes(byte[] b, int off, int len) throws IOException {
    if (len > length - pos) {
      throw new EOFException("read past EOF: pos=" + pos + " len=" + len + " length=" + length + ": " + this);
    }
    System.arraycopy(bytes, offset + pos, b, off, len);
    pos += len;
  }

  @Override
  public byte readByte(long pos) throws IOException {
    checkRange(pos, 1);
    return bytes[offset + (int) pos];
  }

  @Override
  public void readBytes(long pos, byte[] b, int off, int len) throws IOException {
    checkRange(pos, len);
    System.arraycopy(bytes, offset + (int) pos, b, off, len);
  }

  @Override
  public short readShort(long pos) throws IOException {
    checkRange(pos, 2);
    int i = offset + (int) pos;
    return (short) (((bytes[i] & 0xFF) << 8) | (bytes[i + 1] & 0xFF));
  }

  @Override
  public int readInt(long pos) throws IOException {
    checkRange(pos, 4);
    int i = offset + (int) pos;
    return ((bytes[i] & 0xFF) << 24) | ((bytes[i + 1] & 0xFF) << 16)
        | ((bytes[i + 2] & 0xFF) << 8) | (bytes[i + 3] & 0xFF);
  }

  @Override
  public long readLong(long pos) throws IOException {
    return (((long) readInt(pos)) << 32) | (readInt(pos + 4) & 0xFFFFFFFFL);
  }

  private void checkRange(long pos, int len) throws EOFException {
    if (pos < 0 || pos + len > length) {
      throw new EOFException("read past EOF: pos=" + pos + " len=" + len + " length=" + length + ": " + this);
    }
  }

  @Override
  public ByteArrayIndexInput slice(String sliceDescription, long offset, long length) throws IOException {
    if (offset < 0 || length < 0 || offset + length > this.length) {
      throw new IllegalArgumentException("slice() " + sliceDescription + " out of bounds: offset=" + offset
          + ",length=" + length + ",fileLength=" + this.length + ": " + this);
    }
    return new ByteArrayIndexInput(getFullSliceDescription(sliceDescription), bytes,
        this.offset + (int) offset, (int) length);
  }

  @Override
  public ByteArrayIndexInput clone() {
    return (ByteArrayIndexInput) super.clone();
  }
}
