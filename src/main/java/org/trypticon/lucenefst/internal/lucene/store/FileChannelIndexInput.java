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
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Buffered {@link IndexInput} reading a file through positional
 * {@link FileChannel} reads. Clones and slices share the channel; only the
 * instance returned by {@link #open(Path)} closes it.
 */
public final class FileChannelIndexInput extends IndexInput {

  static final int BUFFER_SIZE = 1024;
  private static final int CHUNK_SIZE = 16384;

  private final FileChannel channel;
  private final long off;
  private final long end;
  private boolean isClone;

  private byte[] buffer;
  private long bufferStart;
  private int bufferLength;
  private int bufferPosition;

  private FileChannelIndexInput(String resourceDesc, FileChannel channel, long off, long length, boolean isClone) {
    super(resourceDesc);
    this.channel = channel;
    this.off = off;
    this.end = off + length;
    this.isClone = isClone;
  }

  public static FileChannelIndexInput open(Path path) throws IOException {
    FileChannel fc = FileChannel.open(path, StandardOpenOption.READ);
    boolean success = false;
    try {
      FileChannelIndexInput input = new FileChannelIndexInput("FileChannelIndexInput(path=\"" + path + "\")", fc, 0L, fc.size(), false);
      success = true;
      return input;
    } finally {
      if (!success) {
        fc.close();
      }
    }
  }

  @Override
  public void close() throws IOException {
    if (!isClone) {
      channel.close();
    }
  }

  @Override
  public FileChannelIndexInput clone() {
    FileChannelIndexInput clone = (FileChannelIndexInput) super.clone();
    clone.isClone = true;
    // clones get their own buffer but start at the same position
    clone.buffer = null;
    clone.bufferStart = getFilePointer();
    clone.bufferLength = 0;
    clone.bufferPosition = 0;
    return clone;
  }

  @Override
  public IndexInput slice(String sliceDescription, long offset, long length) throws IOException {
    if (offset < 0 || length < 0 || offset + length > this.length()) {
      throw new IllegalArgumentException("slice() " + sliceDescription + " out of bounds: offset=" + offset + ",length=" + length + ",fileLength=" + this.length() + ": " + this);
    }
    return new FileChannelIndexInput(getFullSliceDescription(sliceDescription), channel, off + offset, length, true);
  }

  @Override
  public long length() {
    return end - off;
  }

  @Override
  public long getFilePointer() {
    return bufferStart + bufferPosition;
  }

  @Override
  public void seek(long pos) throws IOException {
    if (pos < 0 || pos > length()) {
      throw new EOFException("seek past EOF: pos=" + pos + " vs length=" + length() + ": " + this);
    }
    if (pos >= bufferStart && pos < bufferStart + bufferLength) {
      bufferPosition = (int) (pos - bufferStart);
    } else {
      bufferStart = pos;
      bufferLength = 0;
      bufferPosition = 0;
    }
  }

  @Override
  public byte readByte() throws IOException {
    if (bufferPosition >= bufferLength) {
      refill();
    }
    return buffer[bufferPosition++];
  }

  @Override
  public void readBytes(byte[] b, int offset, int len) throws IOException {
    int available = bufferLength - bufferPosition;
    if (len <= available) {
      if (len > 0) {
        System.arraycopy(buffer, bufferPosition, b, offset, len);
      }
      bufferPosition += len;
      return;
    }
    if (available > 0) {
      System.arraycopy(buffer, bufferPosition, b, offset, available);
      offset += available;
      len -= available;
      bufferPosition += available;
    }
    long pos = getFilePointer();
    readInternal(ByteBuffer.wrap(b, offset, len), pos);
    bufferStart = pos + len;
    bufferLength = 0;
    bufferPosition = 0;
  }

  private void refill() throws IOException {
    long start = bufferStart + bufferPosition;
    long remaining = length() - start;
    if (remaining <= 0) {
      throw new EOFException("read past EOF: " + this);
    }
    if (buffer == null) {
      buffer = new byte[BUFFER_SIZE];
    }
    int newLength = (int) Math.min(BUFFER_SIZE, remaining);
    readInternal(ByteBuffer.wrap(buffer, 0, newLength), start);
    bufferStart = start;
    bufferLength = newLength;
    bufferPosition = 0;
  }

  private void readInternal(ByteBuffer bb, long filePointer) throws IOException {
    long pos = filePointer + off;
    int len = bb.remaining();
    if (pos + len > end) {
      throw new EOFException("read past EOF: " + this);
    }
    try {
      int readLength = len;
      while (readLength > 0) {
        final int toRead = Math.min(CHUNK_SIZE, readLength);
        bb.limit(bb.position() + toRead);
        final int i = channel.read(bb, pos);
        if (i < 0) {
          throw new EOFException("read past EOF: " + this + " len: " + len + " pos: " + pos + " chunkLen: " + toRead + " end: " + end);
        }
        pos += i;
        readLength -= i;
      }
    } catch (EOFException e) {
      throw e;
    } catch (IOException ioe) {
      throw new IOException(ioe.getMessage() + ": " + this, ioe);
    }
  }
}
