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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.util.Arrays;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertArrayEquals;

public class TestDataInputOutput {

  private static void writeAll(DataOutput out) throws IOException {
    out.writeByte((byte) -3);
    out.writeShort((short) -12345);
    out.writeInt(0xCAFEBABE);
    out.writeLong(0x0123456789ABCDEFL);
    out.writeVInt(0);
    out.writeVInt(300);
    out.writeVInt(Integer.MAX_VALUE);
    out.writeVInt(-1);
    out.writeVLong(0);
    out.writeVLong(1L << 40);
    out.writeVLong(Long.MAX_VALUE);
    out.writeString("");
    out.writeString("héllo");
    out.writeBytes(new byte[]{9, 8, 7, 6}, 1, 2);
  }

  private static void readAll(DataInput in) throws IOException {
    assertThat(in.readByte(), is((byte) -3));
    assertThat(in.readShort(), is((short) -12345));
    assertThat(in.readInt(), is(0xCAFEBABE));
    assertThat(in.readLong(), is(0x0123456789ABCDEFL));
    assertThat(in.readVInt(), is(0));
    assertThat(in.readVInt(), is(300));
    assertThat(in.readVInt(), is(Integer.MAX_VALUE));
    assertThat(in.readVInt(), is(-1));
    assertThat(in.readVLong(), is(0L));
    assertThat(in.readVLong(), is(1L << 40));
    assertThat(in.readVLong(), is(Long.MAX_VALUE));
    assertThat(in.readString(), is(""));
    assertThat(in.readString(), is("héllo"));
    byte[] bytes = new byte[2];
    in.readBytes(bytes, 0, 2);
    assertArrayEquals(new byte[]{8, 7}, bytes);
  }

  @Test
  public void testByteArrays() throws Exception {
    GrowableByteArrayDataOutput out = new GrowableByteArrayDataOutput(4);
    writeAll(out);
    ByteArrayDataInput in = new ByteArrayDataInput(out.toByteArray());
    readAll(in);
    assertThat(in.eof(), is(true));
  }

  @Test
  public void testStreams() throws Exception {
    ByteArrayOutputStream stream = new ByteArrayOutputStream();
    writeAll(new OutputStreamDataOutput(stream));
    readAll(new InputStreamDataInput(new ByteArrayInputStream(stream.toByteArray())));
  }

  @Test
  public void testFixedByteArray() throws Exception {
    byte[] bytes = new byte[64];
    ByteArrayDataOutput out = new ByteArrayDataOutput(bytes);
    writeAll(out);
    int length = out.getPosition();
    readAll(new ByteArrayDataInput(bytes, 0, length));
  }

  @Test
  public void testVIntEncoding() throws Exception {
    GrowableByteArrayDataOutput out = new GrowableByteArrayDataOutput(4);
    out.writeVInt(300);
    assertArrayEquals(new byte[]{(byte) 0xAC, 0x02}, out.toByteArray());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeVLong() throws Exception {
    new GrowableByteArrayDataOutput(4).writeVLong(-1);
  }

  @Test(expected = IOException.class)
  public void testCorruptVLong() throws Exception {
    byte[] bytes = new byte[9];
    Arrays.fill(bytes, (byte) 0xFF);
    new ByteArrayDataInput(bytes).readVLong();
  }

  @Test
  public void testSkipAndCopy() throws Exception {
    byte[] source = new byte[100];
    for (int i = 0; i < source.length; i++) {
      source[i] = (byte) i;
    }
    InputStreamDataInput in = new InputStreamDataInput(new ByteArrayInputStream(source));
    in.skipBytes(10);
    GrowableByteArrayDataOutput out = new GrowableByteArrayDataOutput(4);
    out.copyBytes(in, 50);
    byte[] copied = out.toByteArray();
    assertThat(copied.length, is(50));
    assertThat(copied[0], is((byte) 10));
    assertThat(copied[49], is((byte) 59));
  }

  @Test(expected = EOFException.class)
  public void testReadPastEnd() throws Exception {
    new InputStreamDataInput(new ByteArrayInputStream(new byte[3])).readInt();
  }
}
