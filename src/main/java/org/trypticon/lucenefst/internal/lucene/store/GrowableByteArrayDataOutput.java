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

import org.trypticon.lucenefst.internal.lucene.util.ArrayUtil;

/**
 * DataOutput writing to a byte array which grows as needed.
 */
public final class GrowableByteArrayDataOutput extends DataOutput {

  private byte[] bytes;

  private int length;

  public GrowableByteArrayDataOutput(int initialCapacity) {
    this.bytes = new byte[ArrayUtil.oversize(initialCapacity, 1)];
    this.length = 0;
  }

  @Override
  public void writeByte(byte b) {
    if (length >= bytes.length) {
      bytes = ArrayUtil.grow(bytes);
    }
    bytes[length++] = b;
  }

  @Override
  public void writeBytes(byte[] b, int off, int len) {
    final int newLength = length + len;
    if (newLength > bytes.length) {
      bytes = ArrayUtil.grow(bytes, newLength);
    }
    System.arraycopy(b, off, bytes, length, len);
    length = newLength;
  }

  public byte[] getBytes() {
    return bytes;
  }

  public int getPosition() {
    return length;
  }

  public void reset() {
    length = 0;
  }

  /**
   * Copies the written bytes into a new array of exactly the written length.
   */
  public byte[] toByteArray() {
    return ArrayUtil.copyOfSubArray(bytes, 0, length);
  }
}
