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

import org.trypticon.lucenefst.internal.lucene.store.DataInput;
import org.trypticon.lucenefst.internal.lucene.store.DataOutput;

/** Holds the node bytes of a loaded FST. */
public interface FSTStore {

  /** Takes ownership of the next {@code numBytes} bytes of {@code in}. */
  void init(DataInput in, long numBytes) throws IOException;

  /** Number of node bytes held. */
  long size();

  FST.BytesReader getReverseBytesReader();

  /** Writes the raw node bytes, without any length prefix. */
  void writeTo(DataOutput out) throws IOException;
}
