/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.quarry.solve;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.quarry.instance.Bound;
import net.hydromatic.quarry.instance.RelationStore;

/**
 * Finds atoms that are interchangeable at the start of a run of decisions.
 *
 * <p>Two atoms are interchangeable in a store if exchanging them maps the
 * bound of every relation to itself. Constraints never mention atoms, so
 * exchanging interchangeable atoms in an instance gives another instance.
 * Within a run, the search therefore requires that the choice for an atom
 * has a rank no less than the choice for the previous interchangeable atom
 * (its <em>peer</em>).
 */
class SymmetryBreaker {
  private SymmetryBreaker() {}

  /** Returns whether decision {@code i} starts a run of decisions that
   * take part in symmetry breaking. */
  static boolean isRunStart(List<Decision> decisions, int i) {
    final Decision decision = decisions.get(i);
    return decision.symmetryAtom >= 0 && decision.runStart == i;
  }

  /**
   * Computes the peer of each decision in the run that starts at
   * {@code start}, writing the index of the peer (or -1) into
   * {@code peers}.
   */
  static void assignPeers(List<Decision> decisions, int start,
      RelationStore store, int[] peers) {
    final List<Integer> representatives = new ArrayList<>();
    final List<Integer> lastMembers = new ArrayList<>();
    for (int i = start; i < decisions.size()
        && decisions.get(i).runStart == start; i++) {
      final int atom = decisions.get(i).symmetryAtom;
      peers[i] = -1;
      int k = 0;
      for (; k < representatives.size(); k++) {
        if (interchangeable(store, representatives.get(k), atom)) {
          break;
        }
      }
      if (k < representatives.size()) {
        peers[i] = lastMembers.get(k);
        lastMembers.set(k, i);
      } else {
        representatives.add(atom);
        lastMembers.add(i);
      }
    }
  }

  /** Returns whether exchanging two atoms leaves every bound unchanged. */
  static boolean interchangeable(RelationStore store, int a, int b) {
    if (a == b) {
      return true;
    }
    for (int r = 0; r < store.layout().size(); r++) {
      final Bound bound = store.bound(r);
      if (!bound.swap(a, b).equals(bound)) {
        return false;
      }
    }
    return true;
  }

  /** Returns an array of peers in which no decision has a peer. */
  static int[] noPeers(int size) {
    final int[] peers = new int[size];
    Arrays.fill(peers, -1);
    return peers;
  }
}

// End SymmetryBreaker.java
