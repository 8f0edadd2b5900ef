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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

import org.junit.Test;
import org.trypticon.lucenefst.UnknownFormatException;
import org.trypticon.lucenefst.internal.lucene.index.CorruptIndexException;
import org.trypticon.lucenefst.internal.lucene.store.ByteArrayDataInput;
import org.trypticon.lucenefst.internal.lucene.store.ByteArrayIndexInput;
import org.trypticon.lucenefst.internal.lucene.store.GrowableByteArrayDataOutput;
import org.trypticon.lucenefst.internal.lucene.util.BytesRef;
import org.trypticon.lucenefst.internal.lucene.util.IntsRefBuilder;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.fail;

public class TestFSTs {

  static final String[] GOLDEN_KEYS = {"mop", "moth", "pop", "star", "stop", "top"};
  static final long[] GOLDEN_VALUES = {100, 91, 72, 83, 54, 55};

  private static final byte[] GOLDEN_DATA = {
      0, 'h', 15, 't', 6, 9, 'p', 25, 'o', 6, 'p', 15, 'o', 6, 'r', 15,
      11, 'o', 2, 15, 29, 'a', 16, 't', 6, 13, 55, 't', 18, 24, 54, 's',
      16, 13, 72, 'p', 16, 9, 91, 'm', 16,
  };

  static final String[] SEQUENTIAL_KEYS = {"m1", "m2", "m3", "m4", "m5", "m6", "m7", "m8", "m9", "ma", "mb", "mc"};
  static final long[] SEQUENTIAL_VALUES = {100, 91, 72, 83, 54, 55, 55, 67, 59, 12, 13, 14};

  static FST<Long> build(FSTCompiler<Long> compiler, String[] keys, long[] values) throws IOException {
    IntsRefBuilder scratch = new IntsRefBuilder();
    for (int i = 0; i < keys.length; i++) {
      compiler.add(Util.toIntsRef(new BytesRef(keys[i]), scratch), values[i]);
    }
    return compiler.compile();
  }

  static <T> FST<T> build(FSTCompiler<T> compiler, Map<String, T> entries) throws IOException {
    IntsRefBuilder scratch = new IntsRefBuilder();
    for (Map.Entry<String, T> entry : entries.entrySet()) {
      compiler.add(Util.toIntsRef(new BytesRef(entry.getKey()), scratch), entry.getValue());
    }
    return compiler.compile();
  }

  static FSTCompiler<Long> newCompiler() {
    return new FSTCompiler<>(FST.INPUT_TYPE.BYTE1, PositiveIntOutputs.getSingleton());
  }

  /** Random lower case keys; iteration order is also UTF-8 byte order. */
  static TreeMap<String, Long> randomEntries(long seed, int count) {
    Random random = new Random(seed);
    TreeMap<String, Long> entries = new TreeMap<>();
    while (entries.size() < count) {
      int length = 1 + random.nextInt(8);
      StringBuilder key = new StringBuilder(length);
      for (int i = 0; i < length; i++) {
        key.append((char) ('a' + random.nextInt(26)));
      }
      entries.put(key.toString(), (long) random.nextInt(100000));
    }
    return entries;
  }

  static byte[] saveToBytes(FST<?> fst) throws IOException {
    GrowableByteArrayDataOutput out = new GrowableByteArrayDataOutput(1024);
    fst.save(out, out);
    return out.toByteArray();
  }

  @Test
  public void testGoldenBytes() throws Exception {
    FST<Long> fst = build(newCompiler(), GOLDEN_KEYS, GOLDEN_VALUES);

    GrowableByteArrayDataOutput meta = new GrowableByteArrayDataOutput(16);
    GrowableByteArrayDataOutput data = new GrowableByteArrayDataOutput(64);
    fst.save(meta, data);

    assertArrayEquals(GOLDEN_DATA, data.toByteArray());
    byte[] metaBytes = meta.toByteArray();
    assertThat(metaBytes.length, is(16));
    // After the 12 byte header: no empty output, BYTE1, start node, byte count.
    assertThat(metaBytes[12], is((byte) 0));
    assertThat(metaBytes[13], is((byte) 0));
    assertThat(metaBytes[14], is((byte) 40));
    assertThat(metaBytes[15], is((byte) 41));
  }

  @Test
  public void testGoldenLookups() throws Exception {
    FST<Long> fst = build(newCompiler(), GOLDEN_KEYS, GOLDEN_VALUES);
    for (int i = 0; i < GOLDEN_KEYS.length; i++) {
      assertThat(Util.get(fst, new BytesRef(GOLDEN_KEYS[i])), is(GOLDEN_VALUES[i]));
    }
    assertThat(Util.get(fst, new BytesRef("mo")), is(nullValue()));
    assertThat(Util.get(fst, new BytesRef("moth1")), is(nullValue()));
    assertThat(Util.get(fst, new BytesRef("toz")), is(nullValue()));
    assertThat(Util.get(fst, new BytesRef("")), is(nullValue()));
  }

  @Test
  public void testSharesSuffixes() throws Exception {
    FST<Long> fst = build(newCompiler(), GOLDEN_KEYS, GOLDEN_VALUES);
    int naiveTrieBytes = 0;
    for (String key : GOLDEN_KEYS) {
      // flags, label and output per character
      naiveTrieBytes += 3 * key.length();
    }
    assertThat(fst.numBytes(), is(lessThan((long) naiveTrieBytes)));
  }

  @Test
  public void testDeterministic() throws Exception {
    TreeMap<String, Long> entries = randomEntries(42, 2000);
    byte[] first = saveToBytes(build(newCompiler(), entries));
    byte[] second = saveToBytes(build(newCompiler(), entries));
    assertArrayEquals(first, second);
  }

  @Test
  public void testRoundTripRandom() throws Exception {
    TreeMap<String, Long> entries = randomEntries(1234, 5000);
    FST<Long> fst = build(newCompiler(), entries);
    assertAllPresent(fst, entries);

    byte[] saved = saveToBytes(fst);
    FST<Long> loaded = new FST<>(new ByteArrayDataInput(saved), new ByteArrayDataInput(saved),
        PositiveIntOutputs.getSingleton());
    assertAllPresent(loaded, entries);
    assertThat(Util.get(loaded, new BytesRef("0")), is(nullValue()));
    assertThat(Util.get(loaded, new BytesRef("aaaaaaaaaa")), is(nullValue()));
  }

  @Test
  public void testSmallPagesGiveSameBytes() throws Exception {
    TreeMap<String, Long> entries = randomEntries(99, 3000);
    byte[] expected = saveToBytes(build(newCompiler(), entries));
    FSTCompiler<Long> paged = new FSTCompiler.Builder<>(FST.INPUT_TYPE.BYTE1, PositiveIntOutputs.getSingleton())
        .bytesPageBits(4)
        .build();
    assertArrayEquals(expected, saveToBytes(build(paged, entries)));
  }

  @Test
  public void testPagedOnHeapStore() throws Exception {
    TreeMap<String, Long> entries = randomEntries(7, 3000);
    byte[] saved = saveToBytes(build(newCompiler(), entries));
    ByteArrayDataInput in = new ByteArrayDataInput(saved);
    OnHeapFSTStore store = new OnHeapFSTStore(6);
    FST<Long> loaded = new FST<>(in, in, PositiveIntOutputs.getSingleton(), store);
    assertThat(store.isPaged(), is(true));
    assertAllPresent(loaded, entries);
    assertArrayEquals(saved, saveToBytes(loaded));
  }

  @Test
  public void testOffHeapStore() throws Exception {
    TreeMap<String, Long> entries = randomEntries(8, 3000);
    byte[] saved = saveToBytes(build(newCompiler(), entries));
    ByteArrayIndexInput in = new ByteArrayIndexInput("test", saved);
    FST<Long> loaded = new FST<>(in, in, PositiveIntOutputs.getSingleton(), new OffHeapFSTStore());
    assertAllPresent(loaded, entries);
    assertArrayEquals(saved, saveToBytes(loaded));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testOffHeapStoreNeedsIndexInput() throws Exception {
    byte[] saved = saveToBytes(build(newCompiler(), GOLDEN_KEYS, GOLDEN_VALUES));
    ByteArrayDataInput in = new ByteArrayDataInput(saved);
    new FST<>(in, in, PositiveIntOutputs.getSingleton(), new OffHeapFSTStore());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testOnHeapStoreRejectsBadBlockBits() {
    new OnHeapFSTStore(31);
  }

  @Test
  public void testSequentialKeysDirectAddressing() throws Exception {
    FSTCompiler<Long> compiler = newCompiler();
    FST<Long> fst = build(compiler, SEQUENTIAL_KEYS, SEQUENTIAL_VALUES);
    assertThat(compiler.getDirectAddressingNodeCount(), is(1L));
    assertThat(compiler.getBinarySearchNodeCount(), is(0L));
    assertSequentialKeys(fst);
  }

  @Test
  public void testSequentialKeysBinarySearch() throws Exception {
    FSTCompiler<Long> compiler = new FSTCompiler.Builder<>(FST.INPUT_TYPE.BYTE1, PositiveIntOutputs.getSingleton())
        .directAddressingMaxOversizingFactor(0f)
        .build();
    FST<Long> fst = build(compiler, SEQUENTIAL_KEYS, SEQUENTIAL_VALUES);
    assertThat(compiler.getDirectAddressingNodeCount(), is(0L));
    assertThat(compiler.getBinarySearchNodeCount(), is(1L));
    assertSequentialKeys(fst);
  }

  @Test
  public void testSequentialKeysVariableLength() throws Exception {
    FSTCompiler<Long> compiler = new FSTCompiler.Builder<>(FST.INPUT_TYPE.BYTE1, PositiveIntOutputs.getSingleton())
        .allowFixedLengthArcs(false)
        .build();
    FST<Long> fst = build(compiler, SEQUENTIAL_KEYS, SEQUENTIAL_VALUES);
    assertThat(compiler.getDirectAddressingNodeCount(), is(0L));
    assertThat(compiler.getBinarySearchNodeCount(), is(0L));
    assertSequentialKeys(fst);
  }

  private static void assertSequentialKeys(FST<Long> fst) throws IOException {
    FST.Arc<Long> arc = fst.getFirstArc(new FST.Arc<>());
    FST.Arc<Long> m = fst.findTargetArc('m', arc, new FST.Arc<>(), fst.getBytesReader());
    assertThat(m.output(), is(12L));

    BytesRefFSTEnum<Long> fstEnum = new BytesRefFSTEnum<>(fst);
    assertThat(fstEnum.seekExact(new BytesRef("m1")).output, is(100L));
    assertThat(fstEnum.seekExact(new BytesRef("mc")).output, is(14L));
    assertThat(fstEnum.seekExact(new BytesRef("m0")), is(nullValue()));
    assertThat(fstEnum.seekExact(new BytesRef("m:")), is(nullValue()));
    for (int i = 0; i < SEQUENTIAL_KEYS.length; i++) {
      assertThat(Util.get(fst, new BytesRef(SEQUENTIAL_KEYS[i])), is(SEQUENTIAL_VALUES[i]));
    }
  }

  @Test
  public void testRootArcs() throws Exception {
    FST<Long> fst = build(newCompiler(), GOLDEN_KEYS, GOLDEN_VALUES);
    FST.BytesReader in = fst.getBytesReader();
    FST.Arc<Long> arc = fst.readFirstTargetArc(fst.getFirstArc(new FST.Arc<>()), new FST.Arc<>(), in);
    StringBuilder labels = new StringBuilder();
    while (true) {
      labels.append((char) arc.label());
      if (arc.isLast()) {
        break;
      }
      fst.readNextArc(arc, in);
    }
    assertThat(labels.toString(), is("mpst"));

    try {
      fst.readNextArc(arc, in);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  @Test
  public void testEmptyInput() throws Exception {
    FSTCompiler<Long> compiler = newCompiler();
    IntsRefBuilder scratch = new IntsRefBuilder();
    compiler.add(Util.toIntsRef(new BytesRef(""), scratch), 7L);
    compiler.add(Util.toIntsRef(new BytesRef("a"), scratch), 3L);
    FST<Long> fst = compiler.compile();
    assertThat(fst.getEmptyOutput(), is(7L));

    byte[] saved = saveToBytes(fst);
    FST<Long> loaded = new FST<>(new ByteArrayDataInput(saved), new ByteArrayDataInput(saved),
        PositiveIntOutputs.getSingleton());
    assertThat(loaded.getEmptyOutput(), is(7L));
    assertThat(Util.get(loaded, new BytesRef("")), is(7L));
    assertThat(Util.get(loaded, new BytesRef("a")), is(3L));
    assertThat(Util.get(loaded, new BytesRef("b")), is(nullValue()));
  }

  @Test
  public void testOnlyEmptyInput() throws Exception {
    FSTCompiler<Long> compiler = newCompiler();
    compiler.add(Util.toIntsRef(new BytesRef(""), new IntsRefBuilder()), 5L);
    FST<Long> fst = compiler.compile();
    assertThat(fst, is(not(nullValue())));
    assertThat(Util.get(fst, new BytesRef("")), is(5L));
    assertThat(Util.get(fst, new BytesRef("a")), is(nullValue()));
  }

  @Test
  public void testNothingAdded() throws Exception {
    assertThat(newCompiler().compile(), is(nullValue()));
  }

  @Test
  public void testByteSequenceOutputs() throws Exception {
    TreeMap<String, BytesRef> entries = new TreeMap<>();
    entries.put("cat", new BytesRef("feline"));
    entries.put("cats", new BytesRef("felines"));
    entries.put("dog", new BytesRef("canine"));
    entries.put("dogs", new BytesRef("canines"));
    FST<BytesRef> fst = build(new FSTCompiler<>(FST.INPUT_TYPE.BYTE1, ByteSequenceOutputs.getSingleton()), entries);
    byte[] saved = saveToBytes(fst);
    FST<BytesRef> loaded = new FST<>(new ByteArrayDataInput(saved), new ByteArrayDataInput(saved),
        ByteSequenceOutputs.getSingleton());
    for (Map.Entry<String, BytesRef> entry : entries.entrySet()) {
      assertThat(Util.get(loaded, new BytesRef(entry.getKey())), is(entry.getValue()));
    }
    assertThat(Util.get(loaded, new BytesRef("ca")), is(nullValue()));
  }

  @Test
  public void testCounts() throws Exception {
    FSTCompiler<Long> compiler = newCompiler();
    build(compiler, GOLDEN_KEYS, GOLDEN_VALUES);
    assertThat(compiler.getTermCount(), is(6L));
    assertThat(compiler.getArcCount(), is(lessThan(22L)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testOutOfOrder() throws Exception {
    FSTCompiler<Long> compiler = newCompiler();
    IntsRefBuilder scratch = new IntsRefBuilder();
    compiler.add(Util.toIntsRef(new BytesRef("b"), scratch), 1L);
    compiler.add(Util.toIntsRef(new BytesRef("a"), scratch), 2L);
  }

  @Test(expected = IllegalStateException.class)
  public void testFinishTwice() throws Exception {
    FST<Long> fst = build(newCompiler(), GOLDEN_KEYS, GOLDEN_VALUES);
    fst.finish(0);
  }

  @Test(expected = IllegalStateException.class)
  public void testSaveBeforeFinish() throws Exception {
    FST<Long> fst = new FST<>(FST.INPUT_TYPE.BYTE1, PositiveIntOutputs.getSingleton(), 15);
    GrowableByteArrayDataOutput out = new GrowableByteArrayDataOutput(16);
    fst.save(out, out);
  }

  @Test
  public void testBadInputType() throws Exception {
    byte[] saved = saveToBytes(build(newCompiler(), GOLDEN_KEYS, GOLDEN_VALUES));
    saved[13] = 5;
    try {
      new FST<>(new ByteArrayDataInput(saved), new ByteArrayDataInput(saved), PositiveIntOutputs.getSingleton());
      fail("Expected CorruptIndexException");
    } catch (CorruptIndexException e) {
      assertThat(e, is(not(instanceOf(UnknownFormatException.class))));
    }
  }

  @Test(expected = UnknownFormatException.class)
  public void testUnsupportedVersion() throws Exception {
    byte[] saved = saveToBytes(build(newCompiler(), GOLDEN_KEYS, GOLDEN_VALUES));
    // last byte of the big-endian version int
    saved[11] = 99;
    new FST<>(new ByteArrayDataInput(saved), new ByteArrayDataInput(saved), PositiveIntOutputs.getSingleton());
  }

  @Test(expected = CorruptIndexException.class)
  public void testBadMagic() throws Exception {
    byte[] saved = saveToBytes(build(newCompiler(), GOLDEN_KEYS, GOLDEN_VALUES));
    saved[0] = 0;
    new FST<>(new ByteArrayDataInput(saved), new ByteArrayDataInput(saved), PositiveIntOutputs.getSingleton());
  }

  @Test
  public void testWideLabels() throws Exception {
    TreeMap<String, Long> entries = new TreeMap<>();
    entries.put("abc", 1L);
    entries.put("été", 2L);
    entries.put("日本", 3L);
    FSTCompiler<Long> compiler = new FSTCompiler<>(FST.INPUT_TYPE.BYTE4, PositiveIntOutputs.getSingleton());
    IntsRefBuilder scratch = new IntsRefBuilder();
    for (Map.Entry<String, Long> entry : entries.entrySet()) {
      compiler.add(Util.toUTF32(entry.getKey(), scratch), entry.getValue());
    }
    FST<Long> fst = compiler.compile();
    byte[] saved = saveToBytes(fst);
    FST<Long> loaded = new FST<>(new ByteArrayDataInput(saved), new ByteArrayDataInput(saved),
        PositiveIntOutputs.getSingleton());
    assertThat(loaded.getInputType(), is(FST.INPUT_TYPE.BYTE4));
    for (Map.Entry<String, Long> entry : entries.entrySet()) {
      assertThat(Util.get(loaded, Util.toUTF32(entry.getKey(), scratch)), is(entry.getValue()));
    }

    IntsRefFSTEnum<Long> fstEnum = new IntsRefFSTEnum<>(loaded);
    assertThat(fstEnum.next().output, is(1L));
    assertThat(fstEnum.next().output, is(2L));
    assertThat(fstEnum.next().output, is(3L));
    assertThat(fstEnum.next(), is(nullValue()));
  }

  @Test
  public void testEnumVisitsAllInOrder() throws Exception {
    TreeMap<String, Long> entries = randomEntries(5, 1000);
    FST<Long> fst = build(newCompiler(), entries);
    BytesRefFSTEnum<Long> fstEnum = new BytesRefFSTEnum<>(fst);
    TreeMap<String, Long> seen = new TreeMap<>();
    BytesRefFSTEnum.InputOutput<Long> entry;
    String last = null;
    while ((entry = fstEnum.next()) != null) {
      String key = entry.input.utf8ToString();
      if (last != null) {
        assertThat(last.compareTo(key), is(lessThan(0)));
      }
      seen.put(key, entry.output);
      last = key;
    }
    assertThat(seen, is(entries));
  }

  @Test
  public void testEnumGolden() throws Exception {
    FST<Long> fst = build(newCompiler(), GOLDEN_KEYS, GOLDEN_VALUES);
    BytesRefFSTEnum<Long> fstEnum = new BytesRefFSTEnum<>(fst);
    List<String> keys = new ArrayList<>();
    BytesRefFSTEnum.InputOutput<Long> entry;
    while ((entry = fstEnum.next()) != null) {
      keys.add(entry.input.utf8ToString());
    }
    assertThat(keys, contains(GOLDEN_KEYS));
  }

  private static void assertAllPresent(FST<Long> fst, Map<String, Long> entries) throws IOException {
    for (Map.Entry<String, Long> entry : entries.entrySet()) {
      assertThat(entry.getKey(), Util.get(fst, new BytesRef(entry.getKey())), is(entry.getValue()));
    }
  }
}
