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
import java.util.Arrays;
import java.util.Collection;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.trypticon.lucenefst.internal.lucene.util.BytesRef;
import org.trypticon.lucenefst.internal.lucene.util.IntsRefBuilder;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

/**
 * Tests for {@link BytesRefFSTEnum} and {@link IntsRefFSTEnum}, comparing seeks against a sorted map.
 */
@RunWith(Parameterized.class)
public class TestFSTEnum {
  private final String layout;
  private FST<Long> golden;
  private FST<Long> dense;
  private TreeMap<String, Long> denseEntries;

  public TestFSTEnum(String layout) {
    this.layout = layout;
  }

  @Parameterized.Parameters(name = "{0}")
  public static Collection<Object[]> data() {
    return Arrays.asList(new Object[][]{ {"default"}, {"binarySearch"}, {"variableLength"} });
  }

  private FSTCompiler<Long> newCompiler() {
    FSTCompiler.Builder<Long> builder = new FSTCompiler.Builder<>(FST.INPUT_TYPE.BYTE1, PositiveIntOutputs.getSingleton());
    switch (layout) {
      case "binarySearch":
        builder.directAddressingMaxOversizingFactor(0f);
        break;
      case "variableLength":
        builder.allowFixedLengthArcs(false);
        break;
      default:
        break;
    }
    return builder.build();
  }

  @Before
  public void setUp() throws Exception {
    golden = TestFSTs.build(newCompiler(), TestFSTs.GOLDEN_KEYS, TestFSTs.GOLDEN_VALUES);

    // Short keys give wide nodes near the root.
    Random random = new Random(31);
    denseEntries = new TreeMap<>();
    while (denseEntries.size() < 3000) {
      int length = 1 + random.nextInt(4);
      StringBuilder key = new StringBuilder(length);
      for (int i = 0; i < length; i++) {
        // every other letter, so that direct addressing tables have gaps
        key.append((char) ('a' + 2 * random.nextInt(13)));
      }
      denseEntries.put(key.toString(), (long) random.nextInt(1000));
    }
    dense = TestFSTs.build(newCompiler(), denseEntries);
  }

  @Test
  public void testGoldenSeeks() throws Exception {
    BytesRefFSTEnum<Long> fstEnum = new BytesRefFSTEnum<>(golden);

    assertThat(fstEnum.seekExact(new BytesRef("moth1")), is(nullValue()));
    assertThat(fstEnum.seekExact(new BytesRef("toz")), is(nullValue()));
    assertEntry(fstEnum.seekExact(new BytesRef("stop")), "stop", 54L);

    assertEntry(fstEnum.seekCeil(new BytesRef("moq")), "moth", 91L);
    assertEntry(fstEnum.next(), "pop", 72L);
    assertEntry(fstEnum.seekFloor(new BytesRef("poo")), "moth", 91L);
    assertEntry(fstEnum.next(), "pop", 72L);

    assertEntry(fstEnum.seekCeil(new BytesRef("")), "mop", 100L);
    assertThat(fstEnum.seekCeil(new BytesRef("tops")), is(nullValue()));
    assertThat(fstEnum.seekFloor(new BytesRef("a")), is(nullValue()));
    assertEntry(fstEnum.seekFloor(new BytesRef("zzz")), "top", 55L);
  }

  @Test
  public void testCurrent() throws Exception {
    BytesRefFSTEnum<Long> fstEnum = new BytesRefFSTEnum<>(golden);
    fstEnum.seekCeil(new BytesRef("s"));
    assertEntry(fstEnum.current(), "star", 83L);
  }

  @Test
  public void testSeeksMatchSortedMap() throws Exception {
    Random random = new Random(17);
    BytesRefFSTEnum<Long> fstEnum = new BytesRefFSTEnum<>(dense);
    for (int iter = 0; iter < 2000; iter++) {
      String target = randomTarget(random);
      BytesRef targetBytes = new BytesRef(target);
      switch (iter % 3) {
        case 0:
          assertMatches("seekCeil " + target, fstEnum.seekCeil(targetBytes), denseEntries.ceilingEntry(target));
          break;
        case 1:
          assertMatches("seekFloor " + target, fstEnum.seekFloor(targetBytes), denseEntries.floorEntry(target));
          break;
        default:
          Long expected = denseEntries.get(target);
          BytesRefFSTEnum.InputOutput<Long> actual = fstEnum.seekExact(targetBytes);
          if (expected == null) {
            assertThat("seekExact " + target, actual, is(nullValue()));
          } else {
            assertEntry(actual, target, expected);
          }
          break;
      }
    }
  }

  @Test
  public void testSeekThenNext() throws Exception {
    Random random = new Random(23);
    BytesRefFSTEnum<Long> fstEnum = new BytesRefFSTEnum<>(dense);
    for (int iter = 0; iter < 300; iter++) {
      String target = randomTarget(random);
      BytesRefFSTEnum.InputOutput<Long> actual = fstEnum.seekCeil(new BytesRef(target));
      Map.Entry<String, Long> expected = denseEntries.ceilingEntry(target);
      for (int i = 0; i < 5 && expected != null; i++) {
        assertMatches("next after seekCeil " + target, actual, expected);
        expected = denseEntries.higherEntry(expected.getKey());
        actual = fstEnum.next();
      }
      if (expected == null) {
        assertThat(actual, is(nullValue()));
      }
    }
  }

  @Test
  public void testIntsRefEnum() throws Exception {
    TreeMap<String, Long> entries = new TreeMap<>();
    Random random = new Random(3);
    while (entries.size() < 500) {
      int length = 1 + random.nextInt(3);
      StringBuilder key = new StringBuilder(length);
      for (int i = 0; i < length; i++) {
        key.append((char) (0x4e00 + 3 * random.nextInt(40)));
      }
      entries.put(key.toString(), (long) random.nextInt(1000));
    }
    FSTCompiler<Long> compiler = new FSTCompiler<>(FST.INPUT_TYPE.BYTE4, PositiveIntOutputs.getSingleton());
    IntsRefBuilder scratch = new IntsRefBuilder();
    for (Map.Entry<String, Long> entry : entries.entrySet()) {
      compiler.add(Util.toUTF32(entry.getKey(), scratch), entry.getValue());
    }
    FST<Long> fst = compiler.compile();

    IntsRefFSTEnum<Long> fstEnum = new IntsRefFSTEnum<>(fst);
    for (int iter = 0; iter < 500; iter++) {
      StringBuilder target = new StringBuilder();
      int length = 1 + random.nextInt(3);
      for (int i = 0; i < length; i++) {
        target.append((char) (0x4e00 + random.nextInt(120)));
      }
      String targetString = target.toString();
      IntsRefFSTEnum.InputOutput<Long> ceil = fstEnum.seekCeil(Util.toUTF32(targetString, scratch));
      Map.Entry<String, Long> expected = entries.ceilingEntry(targetString);
      if (expected == null) {
        assertThat(ceil, is(nullValue()));
      } else {
        assertThat(toString(ceil), is(expected.getKey()));
        assertThat(ceil.output, is(expected.getValue()));
      }

      IntsRefFSTEnum.InputOutput<Long> floor = fstEnum.seekFloor(Util.toUTF32(targetString, scratch));
      expected = entries.floorEntry(targetString);
      if (expected == null) {
        assertThat(floor, is(nullValue()));
      } else {
        assertThat(toString(floor), is(expected.getKey()));
        assertThat(floor.output, is(expected.getValue()));
      }
    }
  }

  private static String toString(IntsRefFSTEnum.InputOutput<Long> entry) {
    return new String(entry.input.ints, entry.input.offset, entry.input.length);
  }

  private static String randomTarget(Random random) {
    int length = random.nextInt(6);
    StringBuilder target = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      // one either side of the key alphabet too
      target.append((char) ('`' + random.nextInt(28)));
    }
    return target.toString();
  }

  private static void assertMatches(String reason, BytesRefFSTEnum.InputOutput<Long> actual, Map.Entry<String, Long> expected) {
    if (expected == null) {
      assertThat(reason, actual, is(nullValue()));
    } else {
      assertThat(reason, actual.input.utf8ToString(), is(expected.getKey()));
      assertThat(reason, actual.output, is(expected.getValue()));
    }
  }

  private static void assertEntry(BytesRefFSTEnum.InputOutput<Long> actual, String key, long value) {
    assertThat(actual.input.utf8ToString(), is(key));
    assertThat(actual.output, is(value));
  }
}
