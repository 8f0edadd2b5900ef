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

// Used to dedup states (lookup already-frozen states)
final class NodeHash<T> {

  // Open addressing table of node addresses; 0 marks an empty slot.
  private long[] table;
  private long count;
  private int mask;
  private final FST<T> fst;
  private final FST.Arc<T> scratchArc = new FST.Arc<>();
  private final FST.BytesReader in;

  public NodeHash(FST<T> fst, FST.BytesReader in) {
    table = new long[16];
    mask = 15;
    this.fst = fst;
    this.in = in;
  }

  private boolean nodesEqual(FSTCompiler.UnCompiledNode<T> node, long address) throws IOException {
    fst.readFirstRealTargetArc(address, scratchArc, in);

    // Fail fast for a node with fixed length arcs.
    if (scratchArc.bytesPerArc() != 0) {
      if (scratchArc.nodeFlags() == FST.ARCS_FOR_BINARY_SEARCH) {
        if (node.numArcs != scratchArc.numArcs()) {
          return false;
        }
      } else {
        assert scratchArc.nodeFlags() == FST.ARCS_FOR_DIRECT_ADDRESSING;
        if ((node.arcs[node.numArcs - 1].label - node.arcs[0].label + 1) != scratchArc.numArcs()
            || node.numArcs != FST.Arc.BitTable.countBits(scratchArc, in)) {
          return false;
        }
      }
    }

    for(int arcUpto=0; arcUpto < node.numArcs; arcUpto++) {
      final FSTCompiler.Arc<T> arc = node.arcs[arcUpto];
      if (arc.label != scratchArc.label() ||
          !arc.output.equals(scratchArc.output()) ||
          ((FSTCompiler.CompiledNode) arc.target).node != scratchArc.target() ||
          !arc.nextFinalOutput.equals(scratchArc.nextFinalOutput()) ||
          arc.isFinal != scratchArc.isFinal()) {
        return false;
      }

      if (scratchArc.isLast()) {
        return arcUpto == node.numArcs-1;
      }
      fst.readNextRealArc(scratchArc, in);
    }

    return false;
  }

  // hash code for an unfrozen node.  This must be identical
  // to the frozen case (below)!!
  private long hash(FSTCompiler.UnCompiledNode<T> node) {
    long h = 0;
    // TODO: maybe if number of arcs is high we can safely subsample?
    for (int arcIdx=0; arcIdx < node.numArcs; arcIdx++) {
      final FSTCompiler.Arc<T> arc = node.arcs[arcIdx];
      long n = ((FSTCompiler.CompiledNode) arc.target).node;
      h = mix(h, arc.label, n, arc.output, arc.nextFinalOutput, arc.isFinal);
    }
    return h & Long.MAX_VALUE;
  }

  // hash code for a frozen node
  private long hash(long node) throws IOException {
    long h = 0;
    fst.readFirstRealTargetArc(node, scratchArc, in);
    while(true) {
      h = mix(h, scratchArc.label(), scratchArc.target(), scratchArc.output(),
          scratchArc.nextFinalOutput(), scratchArc.isFinal());
      if (scratchArc.isLast()) {
        break;
      }
      fst.readNextRealArc(scratchArc, in);
    }
    return h & Long.MAX_VALUE;
  }

  private static long mix(long h, int label, long target, Object output, Object nextFinalOutput, boolean isFinal) {
    final int PRIME = 31;
    h = PRIME * h + label;
    h = PRIME * h + (int) (target ^ (target >> 32));
    h = PRIME * h + output.hashCode();
    h = PRIME * h + nextFinalOutput.hashCode();
    if (isFinal) {
      h += 17;
    }
    return h;
  }

  /**
   * Returns the address of a frozen node equal to {@code nodeIn}, writing
   * it to the FST first if no such node exists yet.
   */
  public long add(FSTCompiler<T> fstCompiler, FSTCompiler.UnCompiledNode<T> nodeIn) throws IOException {
    final long h = hash(nodeIn);
    int pos = (int) (h & mask);
    int c = 0;
    while(true) {
      final long v = table[pos];
      if (v == 0) {
        // freeze & add
        final long node = fst.addNode(fstCompiler, nodeIn);
        assert hash(node) == h : "frozenHash=" + hash(node) + " vs h=" + h;
        count++;
        table[pos] = node;
        // Rehash at 2/3 occupancy:
        if (count > 2L * table.length / 3) {
          rehash();
        }
        return node;
      } else if (nodesEqual(nodeIn, v)) {
        // same node is already here
        return v;
      }

      // quadratic probe
      pos = (pos + (++c)) & mask;
    }
  }

  /** Number of distinct frozen nodes held. */
  long size() {
    return count;
  }

  // called only by rehash
  private void addNew(long address) throws IOException {
    int pos = (int) (hash(address) & mask);
    int c = 0;
    while(true) {
      if (table[pos] == 0) {
        table[pos] = address;
        break;
      }

      // quadratic probe
      pos = (pos + (++c)) & mask;
    }
  }

  private void rehash() throws IOException {
    final long[] oldTable = table;

    table = new long[2 * oldTable.length];
    mask = table.length - 1;
    for (long address : oldTable) {
      if (address != 0) {
        addNew(address);
      }
    }
  }
}
