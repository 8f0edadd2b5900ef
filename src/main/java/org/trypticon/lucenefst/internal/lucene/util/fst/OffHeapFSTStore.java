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
import java.io.UncheckedIOException;

import org.trypticon.lucenefst.internal.lucene.store.DataInput;
import org.trypticon.lucenefst.internal.lucene.store.DataOutput;
import org.trypticon.lucenefst.internal.lucene.store.IndexInput;

/**
 * Leaves the node bytes in an {@link IndexInput} and reads them on demand.
 * The input must stay open for as long as the FST is used.
 */
public final class OffHeapFSTStore implements FSTStore {

  private IndexInput in;
  private long offset;
  private long numBytes;

  @Override
  public void init(DataInput in, long numBytes) throws IOException {
    if (!(in instanceof IndexInput)) {
      throw new IllegalArgumentException("parameter:in should be an instance of IndexInput for using OffHeapFSTStore, not a "
          + in.getClass().getName());
    }
    this.in = (IndexInput) in;
    this.numBytes = numBytes;
    this.offset = this.in.getFilePointer();
    this.in.skipBytes(numBytes);
  }

  @Override
  public long size() {
    return numBytes;
  }

  @Override
  public FST.BytesReader getReverseBytesReader() {
    try {
      return new ReverseRandomAccessReader(in.randomAccessSlice(offset, numBytes));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public void writeTo(DataOutput out) throws IOException {
    IndexInput slice = in.slice("fst bytes", offset, numBytes);
    out.copyBytes(slice, numBytes);
  }
}
