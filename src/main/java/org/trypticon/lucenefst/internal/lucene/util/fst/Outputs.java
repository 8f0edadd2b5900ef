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

/**
 * The algebra of the values an FST maps its inputs to. Outputs are pushed
 * towards the root while building, so implementations must satisfy
 * {@code add(common(a, b), subtract(a, common(a, b))) == a}.
 */
public abstract class Outputs<T> {

  // TODO: maybe change this API to allow for re-use of the
  // output instances -- this is an insane amount of garbage
  // (new object per byte/char/int) if eg used during
  // analysis

  /** Eg common("foobar", "food") -&gt; "foo" */
  public abstract T common(T output1, T output2);

  /** Eg subtract("foobar", "foo") -&gt; "bar" */
  public abstract T subtract(T output, T inc);

  /** Eg add("foo", "bar") -&gt; "foobar" */
  public abstract T add(T prefix, T output);

  public abstract void write(T output, DataOutput out) throws IOException;

  public void writeFinalOutput(T output, DataOutput out) throws IOException {
    write(output, out);
  }

  public abstract T read(DataInput in) throws IOException;

  /** Skips exactly the bytes {@link #write} produced for one output. */
  public void skipOutput(DataInput in) throws IOException {
    read(in);
  }

  public T readFinalOutput(DataInput in) throws IOException {
    return read(in);
  }

  public void skipFinalOutput(DataInput in) throws IOException {
    skipOutput(in);
  }

  /** The identity for {@link #add}. Always the same instance. */
  public abstract T getNoOutput();

  public abstract String outputToString(T output);

  /** Combines the outputs of a key added twice in a row. */
  public T merge(T first, T second) {
    throw new UnsupportedOperationException();
  }
}
