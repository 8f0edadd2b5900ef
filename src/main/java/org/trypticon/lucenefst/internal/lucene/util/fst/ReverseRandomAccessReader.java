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

import org.trypticon.lucenefst.internal.lucene.store.RandomAccessInput;

/** Implements reverse read from a RandomAccessInput. */
final class ReverseRandomAccessReader extends FST.BytesReader {
  private final RandomAccessInput in;
  private long pos;

  public ReverseRandomAccessReader(RandomAccessInput in) {
    this.in = in;
  }

  @Override
  public byte readByte() throws IOException {
    return in.readByte(pos--);
  }

  @Override
  public void readBytes(byte[] b, int offset, int len) throws IOException {
    if (len == 0) {
      return;
    }
    in.readBytes(pos - len + 1, b, offset, len);
    for (int i = offset, j = offset + len - 1; i < j; i++, j--) {
      byte tmp = b[i];
      b[i] = b[j];
      b[j] = tmp;
    }
    pos -= len;
  }

  @Override
  public void skipBytes(long count) {
    pos -= count;
  }

  @Override
  public long getPosition() {
    return pos;
  }

  @Override
  public void setPosition(long pos) {
    this.pos = pos;
  }

  @Override
  public boolean reversed() {
    return true;
  }
}
