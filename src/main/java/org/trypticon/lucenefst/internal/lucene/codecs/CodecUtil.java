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


import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.trypticon.lucenefst.UnknownFormatException;
import org.trypticon.lucenefst.internal.lucene.index.CorruptIndexException;
import org.trypticon.lucenefst.internal.lucene.store.DataInput;
import org.trypticon.lucenefst.internal.lucene.store.DataOutput;


public final class CodecUtil {
  private CodecUtil() {} // no instance

  public final static int CODEC_MAGIC = 0x3fd76c17;

  public static void writeHeader(DataOutput out, String codec, int version) throws IOException {
    byte[] bytes = codec.getBytes(StandardCharsets.UTF_8);
    if (bytes.length != codec.length() || bytes.length >= 128) {
      throw new IllegalArgumentException("codec must be simple ASCII, less than 128 characters in length [got " + codec + "]");
    }
    out.writeInt(CODEC_MAGIC);
    out.writeString(codec);
    out.writeInt(version);
  }

  public static int headerLength(String codec) {
    return 9+codec.length();
  }

  public static int checkHeader(DataInput in, String codec, int minVersion, int maxVersion) throws IOException {
    // Safety to guard against reading a bogus string:
    final int actualHeader = in.readInt();
    if (actualHeader != CODEC_MAGIC) {
      throw new CorruptIndexException("codec header mismatch: actual header=" + actualHeader + " vs expected header=" + CODEC_MAGIC, in);
    }
    return checkHeaderNoMagic(in, codec, minVersion, maxVersion);
  }

  public static int checkHeaderNoMagic(DataInput in, String codec, int minVersion, int maxVersion) throws IOException {
    final String actualCodec = in.readString();
    if (!actualCodec.equals(codec)) {
      throw new CorruptIndexException("codec mismatch: actual codec=" + actualCodec + " vs expected codec=" + codec, in);
    }

    final int actualVersion = in.readInt();
    if (actualVersion < minVersion || actualVersion > maxVersion) {
      throw new UnknownFormatException("Format version is not supported (resource " + in + "): "
          + actualVersion + " (needs to be between " + minVersion + " and " + maxVersion + ")");
    }

    return actualVersion;
  }
}
