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

import org.trypticon.lucenefst.internal.lucene.store.DataInput;
import org.trypticon.lucenefst.internal.lucene.store.DataOutput;

import java.io.IOException;

/**
 * Copies the node bytes onto the heap. Small FSTs get one flat array, larger
 * ones are paged into blocks of {@code 1 << maxBlockBits} bytes.
 */
public final class OnHeapFSTStore implements FSTStore {

    private BytesStore bytes;

    private byte[] bytesArray;

    private final int maxBlockBits;

    public OnHeapFSTStore(int maxBlockBits) {
        if (maxBlockBits < 1 || maxBlockBits > 30) {
            throw new IllegalArgumentException("maxBlockBits should be 1 .. 30; got " + maxBlockBits);
        }

        this.maxBlockBits = maxBlockBits;
    }

    @Override
    public void init(DataInput in, long numBytes) throws IOException {
        if (numBytes > 1 << this.maxBlockBits) {
            bytes = new BytesStore(in, numBytes, 1 << this.maxBlockBits);
        } else {
            bytesArray = new byte[(int) numBytes];
            in.readBytes(bytesArray, 0, bytesArray.length);
        }
    }

    @Override
    public long size() {
        if (bytesArray != null) {
            return bytesArray.length;
        } else {
            return bytes.getPosition();
        }
    }

    /** Whether the bytes were split over more than one block. */
    boolean isPaged() {
        return bytes != null;
    }

    @Override
    public FST.BytesReader getReverseBytesReader() {
        if (bytesArray != null) {
            return new ReverseBytesReader(bytesArray);
        } else {
            return bytes.getReverseReader();
        }
    }

    @Override
    public void writeTo(DataOutput out) throws IOException {
        if (bytes != null) {
            bytes.writeTo(out);
        } else {
            out.writeBytes(bytesArray, 0, bytesArray.length);
        }
    }
}
