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
package org.trypticon.lucenefst.internal.lucene.util.fst;

import java.io.IOException;

/**
 * Bit operations on the presence table of a direct addressing node. Every
 * method reads from the reader's current position, which must be the first
 * byte of the table. Bit {@code i} lives in byte {@code i / 8}, bit
 * {@code i % 8}, with bytes in little-endian order.
 */
class BitTableUtil {

  /** Returns whether bit {@code bitIndex} is set. */
  static boolean isBitSet(int bitIndex, FST.BytesReader reader) throws IOException {
    assert bitIndex >= 0 : "bitIndex=" + bitIndex;
    reader.skipBytes(bitIndex >> 3);
    return (readByte(reader) & (1L << (bitIndex & (Byte.SIZE - 1)))) != 0;
  }

  /** Counts all bits set in a table of {@code bitTableBytes} bytes. */
  static int countBits(int bitTableBytes, FST.BytesReader reader) throws IOException {
    assert bitTableBytes >= 0 : "bitTableBytes=" + bitTableBytes;
    int bitCount = 0;
    for (int i = bitTableBytes >> 3; i > 0; i--) {
      bitCount += Long.bitCount(readLittleEndian(Long.BYTES, reader));
    }
    int numRemainingBytes = bitTableBytes & (Long.BYTES - 1);
    if (numRemainingBytes != 0) {
      bitCount += Long.bitCount(readLittleEndian(numRemainingBytes, reader));
    }
    return bitCount;
  }

  /** Counts the bits set strictly before {@code bitIndex}. */
  static int countBitsUpTo(int bitIndex, FST.BytesReader reader) throws IOException {
    assert bitIndex >= 0 : "bitIndex=" + bitIndex;
    int bitCount = 0;
    for (int i = bitIndex >> 6; i > 0; i--) {
      bitCount += Long.bitCount(readLittleEndian(Long.BYTES, reader));
    }
    int remainingBits = bitIndex & (Long.SIZE - 1);
    if (remainingBits != 0) {
      int numRemainingBytes = (remainingBits + (Byte.SIZE - 1)) >> 3;
      // Shifts are mod 64 so this keeps only the bits below bitIndex in the last long.
      long mask = (1L << bitIndex) - 1L;
      bitCount += Long.bitCount(readLittleEndian(numRemainingBytes, reader) & mask);
    }
    return bitCount;
  }

  /**
   * Returns the index of the first bit set after {@code bitIndex}, or -1 if
   * there is none. Pass -1 to find the first bit set in the table.
   */
  static int nextBitSet(int bitIndex, int bitTableBytes, FST.BytesReader reader) throws IOException {
    assert bitIndex >= -1 && bitIndex < bitTableBytes * Byte.SIZE : "bitIndex=" + bitIndex + " bitTableBytes=" + bitTableBytes;
    int byteIndex = bitIndex / Byte.SIZE;
    int mask = -1 << ((bitIndex + 1) & (Byte.SIZE - 1));
    int i;
    if (mask == -1 && bitIndex != -1) {
      // bitIndex is the last bit of its byte, start from the next byte.
      reader.skipBytes(byteIndex + 1);
      i = 0;
    } else {
      reader.skipBytes(byteIndex);
      i = (reader.readByte() & 0xFF) & mask;
    }
    while (i == 0) {
      if (++byteIndex == bitTableBytes) {
        return -1;
      }
      i = reader.readByte() & 0xFF;
    }
    return Integer.numberOfTrailingZeros(i) + (byteIndex << 3);
  }

  /**
   * Returns the index of the last bit set before {@code bitIndex}, or -1 if
   * there is none. Requires a reader that accepts negative skips.
   */
  static int previousBitSet(int bitIndex, FST.BytesReader reader) throws IOException {
    assert bitIndex >= 0 : "bitIndex=" + bitIndex;
    int byteIndex = bitIndex >> 3;
    reader.skipBytes(byteIndex);
    int mask = (1 << (bitIndex & (Byte.SIZE - 1))) - 1;
    int i = (reader.readByte() & 0xFF) & mask;
    while (i == 0) {
      if (byteIndex-- == 0) {
        return -1;
      }
      // Step back over the byte just read and the one before it.
      reader.skipBytes(-2);
      i = reader.readByte() & 0xFF;
    }
    return (Integer.SIZE - 1) - Integer.numberOfLeadingZeros(i) + (byteIndex << 3);
  }

  private static long readByte(FST.BytesReader reader) throws IOException {
    return reader.readByte() & 0xFFL;
  }

  private static long readLittleEndian(int numBytes, FST.BytesReader reader) throws IOException {
    assert numBytes > 0 && numBytes <= Long.BYTES : "numBytes=" + numBytes;
    long l = 0;
    for (int shift = 0; shift < numBytes * Byte.SIZE; shift += Byte.SIZE) {
      l |= readByte(reader) << shift;
    }
    return l;
  }
}
