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
package org.trypticon.lucenefst.internal.lucene.util;


import java.util.Arrays;

/**
 * Array growth helpers.
 */
public final class ArrayUtil {

  public static final int MAX_ARRAY_LENGTH = Integer.MAX_VALUE - 8;

  private ArrayUtil() {} // no instance

  /**
   * Returns an array size &gt;= {@code minTargetSize}, generally over-allocating
   * by about 1/8th so that repeated appends are amortized.
   */
  public static int oversize(int minTargetSize, int bytesPerElement) {

    if (minTargetSize < 0) {
      // catch usage that accidentally overflows int
      throw new IllegalArgumentException("invalid array size " + minTargetSize);
    }

    if (minTargetSize == 0) {
      // wait until at least one element is requested
      return 0;
    }

    if (minTargetSize > MAX_ARRAY_LENGTH) {
      throw new IllegalArgumentException("requested array size " + minTargetSize + " exceeds maximum array in java (" + MAX_ARRAY_LENGTH + ")");
    }

    int extra = minTargetSize >> 3;
    if (extra < 3) {
      extra = 3;
    }

    int newSize = minTargetSize + extra;

    if (newSize+7 < 0 || newSize+7 > MAX_ARRAY_LENGTH) {
      return MAX_ARRAY_LENGTH;
    }

    // round up to an 8-byte boundary on 64-bit JREs
    switch(bytesPerElement) {
      case 4:
        return (newSize + 1) & 0x7ffffffe;
      case 2:
        return (newSize + 3) & 0x7ffffffc;
      case 1:
        return (newSize + 7) & 0x7ffffff8;
      case 8:
      default:
        return newSize;
    }
  }

  public static byte[] grow(byte[] array, int minSize) {
    assert minSize >= 0: "size must be positive (got " + minSize + "): likely integer overflow?";
    if (array.length < minSize) {
      return Arrays.copyOf(array, oversize(minSize, Byte.BYTES));
    } else {
      return array;
    }
  }

  public static byte[] grow(byte[] array) {
    return grow(array, 1 + array.length);
  }

  public static int[] grow(int[] array, int minSize) {
    assert minSize >= 0: "size must be positive (got " + minSize + "): likely integer overflow?";
    if (array.length < minSize) {
      return Arrays.copyOf(array, oversize(minSize, Integer.BYTES));
    } else {
      return array;
    }
  }

  public static long[] grow(long[] array, int minSize) {
    assert minSize >= 0: "size must be positive (got " + minSize + "): likely integer overflow?";
    if (array.length < minSize) {
      return Arrays.copyOf(array, oversize(minSize, Long.BYTES));
    } else {
      return array;
    }
  }

  public static <T> T[] grow(T[] array, int minSize) {
    assert minSize >= 0: "size must be positive (got " + minSize + "): likely integer overflow?";
    if (array.length < minSize) {
      return Arrays.copyOf(array, oversize(minSize, Integer.BYTES));
    } else {
      return array;
    }
  }

  public static byte[] copyOfSubArray(byte[] array, int from, int to) {
    return Arrays.copyOfRange(array, from, to);
  }

  public static int[] copyOfSubArray(int[] array, int from, int to) {
    return Arrays.copyOfRange(array, from, to);
  }
}
