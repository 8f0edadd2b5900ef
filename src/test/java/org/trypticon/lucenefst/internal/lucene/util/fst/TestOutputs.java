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

import java.util.Map;
import java.util.TreeMap;

import org.junit.Test;
import org.trypticon.lucenefst.internal.lucene.store.ByteArrayDataInput;
import org.trypticon.lucenefst.internal.lucene.store.GrowableByteArrayDataOutput;
import org.trypticon.lucenefst.internal.lucene.util.BytesRef;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

/**
 * Tests for the {@link Outputs} implementations.
 */
public class TestOutputs {

  @Test
  public void testPositiveIntLaws() {
    PositiveIntOutputs outputs = PositiveIntOutputs.getSingleton();
    long[] values = {0, 1, 7, 54, 55, 100, Long.MAX_VALUE};
    for (long a : values) {
      for (long b : values) {
        assertPrefixLaw(outputs, normalize(outputs, a), normalize(outputs, b));
      }
      assertThat(outputs.add(outputs.getNoOutput(), normalize(outputs, a)), is(a));
      assertThat(outputs.add(normalize(outputs, a), outputs.getNoOutput()), is(a));
    }
    assertThat(outputs.common(100L, 91L), is(91L));
    assertThat(outputs.subtract(91L, 91L), is(sameInstance(outputs.getNoOutput())));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testPositiveIntSubtractTooMuch() {
    PositiveIntOutputs.getSingleton().subtract(5L, 6L);
  }

  @Test
  public void testByteSequenceLaws() {
    ByteSequenceOutputs outputs = ByteSequenceOutputs.getSingleton();
    String[] values = {"", "f", "foo", "food", "foobar", "bar"};
    for (String a : values) {
      for (String b : values) {
        assertPrefixLaw(outputs, bytes(outputs, a), bytes(outputs, b));
      }
    }
    assertThat(outputs.common(new BytesRef("foobar"), new BytesRef("food")), is(new BytesRef("foo")));
    assertThat(outputs.subtract(new BytesRef("foobar"), new BytesRef("foo")), is(new BytesRef("bar")));
    assertThat(outputs.add(new BytesRef("foo"), new BytesRef("bar")), is(new BytesRef("foobar")));
    assertThat(outputs.common(new BytesRef("abc"), new BytesRef("xyz")), is(sameInstance(outputs.getNoOutput())));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testByteSequenceSubtractNotPrefix() {
    ByteSequenceOutputs.getSingleton().subtract(new BytesRef("foobar"), new BytesRef("bar"));
  }

  @Test
  public void testPairLaws() {
    PairOutputs<Long, BytesRef> outputs = new PairOutputs<>(PositiveIntOutputs.getSingleton(),
        ByteSequenceOutputs.getSingleton());
    PairOutputs.Pair<Long, BytesRef> a = outputs.newPair(10L, new BytesRef("food"));
    PairOutputs.Pair<Long, BytesRef> b = outputs.newPair(4L, new BytesRef("foobar"));
    assertPrefixLaw(outputs, a, b);
    assertPrefixLaw(outputs, b, a);
    assertThat(outputs.common(a, b), is(outputs.newPair(4L, new BytesRef("foo"))));
    assertThat(outputs.newPair(0L, new BytesRef()), is(sameInstance(outputs.getNoOutput())));
  }

  @Test
  public void testWriteRead() throws Exception {
    PairOutputs<Long, BytesRef> outputs = new PairOutputs<>(PositiveIntOutputs.getSingleton(),
        ByteSequenceOutputs.getSingleton());
    PairOutputs.Pair<Long, BytesRef> pair = outputs.newPair(300L, new BytesRef("value"));
    GrowableByteArrayDataOutput out = new GrowableByteArrayDataOutput(16);
    outputs.write(pair, out);
    outputs.write(outputs.getNoOutput(), out);
    outputs.write(pair, out);

    ByteArrayDataInput in = new ByteArrayDataInput(out.toByteArray());
    assertThat(outputs.read(in), is(pair));
    assertThat(outputs.read(in), is(sameInstance(outputs.getNoOutput())));
    outputs.skipOutput(in);
    assertThat(in.eof(), is(true));
  }

  @Test
  public void testPairOutputsInFst() throws Exception {
    PairOutputs<Long, BytesRef> outputs = new PairOutputs<>(PositiveIntOutputs.getSingleton(),
        ByteSequenceOutputs.getSingleton());
    TreeMap<String, PairOutputs.Pair<Long, BytesRef>> entries = new TreeMap<>();
    entries.put("apple", outputs.newPair(5L, new BytesRef("red")));
    entries.put("apricot", outputs.newPair(3L, new BytesRef("orange")));
    entries.put("banana", outputs.newPair(8L, new BytesRef("yellow")));
    entries.put("blueberry", outputs.newPair(8L, new BytesRef("blue")));
    FST<PairOutputs.Pair<Long, BytesRef>> fst = TestFSTs.build(new FSTCompiler<>(FST.INPUT_TYPE.BYTE1, outputs), entries);
    for (Map.Entry<String, PairOutputs.Pair<Long, BytesRef>> entry : entries.entrySet()) {
      assertThat(Util.get(fst, new BytesRef(entry.getKey())), is(entry.getValue()));
    }
  }

  private static <T> void assertPrefixLaw(Outputs<T> outputs, T a, T b) {
    T common = outputs.common(a, b);
    assertThat(outputs.add(common, outputs.subtract(a, common)), is(a));
    assertThat(outputs.add(common, outputs.subtract(b, common)), is(b));
  }

  private static Long normalize(PositiveIntOutputs outputs, long value) {
    return value == 0 ? outputs.getNoOutput() : value;
  }

  private static BytesRef bytes(ByteSequenceOutputs outputs, String value) {
    return value.isEmpty() ? outputs.getNoOutput() : new BytesRef(value);
  }
}
