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

import java.util.Random;

import org.junit.Test;
import org.trypticon.lucenefst.internal.lucene.store.ByteArrayDataInput;
import org.trypticon.lucenefst.internal.lucene.store.GrowableByteArrayDataOutput;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertArrayEquals;

/**
 * Tests {@link BytesStore} against a plain byte array, with blocks small enough that
 * every operation crosses block boundaries.
 */
public class TestBytesStore {
  private static final int BLOCK_BITS = 3;

  @Test
  public void testWritesAcrossBlocks() throws Exception {
    Random random = new Random(11);
    byte[] expected = new byte[61];
    random.nextBytes(expected);

    BytesStore store = new BytesStore(BLOCK_BITS);
    int pos = 0;
    while (pos < expected.length) {
      if (random.nextBoolean()) {
        store.writeByte(expected[pos++]);
      } else {
        int len = Math.min(expected.length - pos, random.nextInt(20));
        store.writeBytes(expected, pos, len);
        pos += len;
      }
    }
    assertThat(store.getPosition(), is((long) expected.length));
    assertThat(store.toString(), is("BytesStore(numBlocks=8)"));
    assertContents(store, expected);
  }

  @Test
  public void testAbsoluteWrites() throws Exception {
    byte[] expected = new byte[40];
    BytesStore store = new BytesStore(BLOCK_BITS);
    store.skipBytes(expected.length);
    assertThat(store.getPosition(), is(40L));

    store.writeInt(6, 0x01020304);
    expected[6] = 1;
    expected[7] = 2;
    expected[8] = 3;
    expected[9] = 4;

    store.writeByte(30, (byte) 99);
    expected[30] = 99;

    byte[] chunk = {10, 11, 12, 13, 14, 15, 16, 17, 18, 19, 20};
    store.writeBytes(13, chunk, 0, chunk.length);
    System.arraycopy(chunk, 0, expected, 13, chunk.length);

    assertContents(store, expected);
  }

  @Test
  public void testCopyBytesOverlapping() throws Exception {
    byte[] expected = new byte[45];
    for (int i = 0; i < expected.length; i++) {
      expected[i] = (byte) i;
    }
    BytesStore store = new BytesStore(BLOCK_BITS);
    store.writeBytes(expected, 0, expected.length);

    store.copyBytes(3, 10, 25);
    System.arraycopy(expected, 3, expected, 10, 25);
    assertContents(store, expected);
  }

  @Test
  public void testReverse() throws Exception {
    byte[] expected = new byte[33];
    for (int i = 0; i < expected.length; i++) {
      expected[i] = (byte) i;
    }
    BytesStore store = new BytesStore(BLOCK_BITS);
    store.writeBytes(expected, 0, expected.length);

    store.reverse(5, 27);
    for (int i = 5, j = 27; i < j; i++, j--) {
      byte b = expected[i];
      expected[i] = expected[j];
      expected[j] = b;
    }
    assertContents(store, expected);
  }

  @Test
  public void testTruncate() throws Exception {
    byte[] bytes = new byte[30];
    new Random(5).nextBytes(bytes);
    BytesStore store = new BytesStore(BLOCK_BITS);
    store.writeBytes(bytes, 0, bytes.length);

    store.truncate(16);
    assertThat(store.getPosition(), is(16L));
    store.writeByte((byte) 42);

    byte[] expected = new byte[17];
    System.arraycopy(bytes, 0, expected, 0, 16);
    expected[16] = 42;
    assertContents(store, expected);
  }

  @Test
  public void testReadFromInput() throws Exception {
    byte[] expected = new byte[50];
    new Random(9).nextBytes(expected);
    BytesStore store = new BytesStore(new ByteArrayDataInput(expected), expected.length, 16);
    assertThat(store.getPosition(), is(50L));
    assertContents(store, expected);
  }

  private static void assertContents(BytesStore store, byte[] expected) throws Exception {
    byte[] copy = new byte[expected.length];
    store.copyBytes(0, copy, 0, copy.length);
    assertArrayEquals(expected, copy);

    FST.BytesReader forward = store.getForwardReader();
    assertThat(forward.reversed(), is(false));
    for (byte b : expected) {
      assertThat(forward.readByte(), is(b));
    }
    forward.setPosition(expected.length / 2);
    byte[] tail = new byte[expected.length - expected.length / 2];
    forward.readBytes(tail, 0, tail.length);
    for (int i = 0; i < tail.length; i++) {
      assertThat(tail[i], is(expected[expected.length / 2 + i]));
    }

    FST.BytesReader reverse = store.getReverseReader(false);
    assertThat(reverse.reversed(), is(true));
    reverse.setPosition(expected.length - 1);
    for (int i = expected.length - 1; i >= 0; i--) {
      assertThat(reverse.getPosition(), is((long) i));
      assertThat(reverse.readByte(), is(expected[i]));
    }
    reverse.setPosition(expected.length - 1);
    reverse.skipBytes(10);
    assertThat(reverse.readByte(), is(expected[expected.length - 11]));

    GrowableByteArrayDataOutput out = new GrowableByteArrayDataOutput(expected.length);
    store.finish();
    store.writeTo(out);
    assertArrayEquals(expected, out.toByteArray());
  }
}
