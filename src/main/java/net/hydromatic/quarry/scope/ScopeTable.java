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
package net.hydromatic.quarry.scope;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import net.hydromatic.quarry.model.Signature;

/**
 * Resolved scope: the bound of each bounded signature, and whether it is
 * exact.
 *
 * <p>A signature that has no bound shares the atoms of its nearest bounded
 * ancestor. Every top-level signature has a bound.
 */
public class ScopeTable {
  public final ScopeSpec spec;
  private final ImmutableMap<Signature, Integer> bounds;
  private final ImmutableSet<Signature> exact;

  ScopeTable(ScopeSpec spec, ImmutableMap<Signature, Integer> bounds,
      ImmutableSet<Signature> exact) {
    this.spec = requireNonNull(spec, "spec");
    this.bounds = requireNonNull(bounds, "bounds");
    this.exact = requireNonNull(exact, "exact");
  }

  /** Returns a description such as "Time=5 (exact), Event=4". */
  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    bounds.forEach((signature, bound) -> {
      if (b.length() > 0) {
        b.append(", ");
      }
      b.append(signature.name).append('=').append(bound);
      if (exact.contains(signature)) {
        b.append(" (exact)");
      }
    });
    return b.toString();
  }

  /** Returns whether a signature has a bound of its own. */
  public boolean isBounded(Signature signature) {
    return bounds.containsKey(signature);
  }

  /** Returns the bound of a signature; throws if it has none. */
  public int bound(Signature signature) {
    final Integer bound = bounds.get(signature);
    if (bound == null) {
      throw new IllegalArgumentException("signature '" + signature
          + "' has no bound");
    }
    return bound;
  }

  /** Returns whether a signature must have exactly its bound of atoms. */
  public boolean isExact(Signature signature) {
    return exact.contains(signature);
  }

  /** Returns the bounded signatures and their bounds, in declaration
   * order. */
  public ImmutableMap<Signature, Integer> bounds() {
    return bounds;
  }
}

// End ScopeTable.java
