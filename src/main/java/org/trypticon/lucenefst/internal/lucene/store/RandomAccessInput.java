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

import java.io.IOException;

/**
 * Random access reads at absolute positions, used by readers which never
 * load the bytes onto the heap.
 */
public interface RandomAccessInput {

  byte readByte(long pos) throws IOException;

  /**
   * Reads {@code len} bytes starting at {@code pos} into {@code b}.
   */
  default void readBytes(long pos, byte[] b, int offset, int len) throws IOException {
    for (int i = 0; i < len; i++) {
      b[offset + i] = readByte(pos + i);
    }
  }

  short readShort(long pos) throws IOException;

  int readInt(long pos) throws IOException;

  long readLong(long pos) throws IOException;

  long length();
}
