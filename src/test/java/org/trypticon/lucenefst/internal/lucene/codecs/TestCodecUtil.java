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
package org.trypticon.lucenefst.internal.lucene.codecs;

import org.junit.Test;
import org.trypticon.lucenefst.UnknownFormatException;
import org.trypticon.lucenefst.internal.lucene.index.CorruptIndexException;
import org.trypticon.lucenefst.internal.lucene.store.ByteArrayDataInput;
import org.trypticon.lucenefst.internal.lucene.store.ByteArrayIndexInput;
import org.trypticon.lucenefst.internal.lucene.store.GrowableByteArrayDataOutput;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class TestCodecUtil {

  private static byte[] header(String codec, int version) throws Exception {
    GrowableByteArrayDataOutput out = new GrowableByteArrayDataOutput(16);
    CodecUtil.writeHeader(out, codec, version);
    return out.toByteArray();
  }

  @Test
  public void testRoundTrip() throws Exception {
    byte[] bytes = header("FST", 7);
    assertThat(bytes.length, is(CodecUtil.headerLength("FST")));
    assertThat(CodecUtil.checkHeader(new ByteArrayDataInput(bytes), "FST", 6, 7), is(7));
  }

  @Test
  public void testWrongCodec() throws Exception {
    try {
      CodecUtil.checkHeader(new ByteArrayIndexInput("header", header("FSX", 7)), "FST", 6, 7);
      fail("Expected CorruptIndexException");
    } catch (CorruptIndexException e) {
      assertThat(e.getMessage(), containsString("codec mismatch"));
      assertThat(e.getResourceDescription(), is("header"));
    }
  }

  @Test(expected = CorruptIndexException.class)
  public void testWrongMagic() throws Exception {
    byte[] bytes = header("FST", 7);
    bytes[3] ^= 1;
    CodecUtil.checkHeader(new ByteArrayDataInput(bytes), "FST", 6, 7);
  }

  @Test(expected = UnknownFormatException.class)
  public void testTooOld() throws Exception {
    CodecUtil.checkHeader(new ByteArrayDataInput(header("FST", 5)), "FST", 6, 7);
  }

  @Test(expected = UnknownFormatException.class)
  public void testTooNew() throws Exception {
    CodecUtil.checkHeader(new ByteArrayDataInput(header("FST", 8)), "FST", 6, 7);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonAsciiCodec() throws Exception {
    header("FSTé", 1);
  }
}
