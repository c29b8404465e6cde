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
package net.hydromatic.quarry.instance;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** Ordered list of atoms; a member of a relation. */
public class Tuple {
  public final ImmutableList<Atom> atoms;

  private Tuple(ImmutableList<Atom> atoms) {
    checkArgument(!atoms.isEmpty(), "tuple must have at least one atom");
    this.atoms = requireNonNull(atoms, "atoms");
  }

  public static Tuple of(Atom... atoms) {
    return new Tuple(ImmutableList.copyOf(atoms));
  }

  public static Tuple of(List<Atom> atoms) {
    return new Tuple(ImmutableList.copyOf(atoms));
  }

  /** Returns e.g. "Wheel$0->Data$1->Time$2". */
  @Override
  public String toString() {
    return Joiner.on("->").join(atoms);
  }

  @Override
  public int hashCode() {
    return atoms.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Tuple
            && atoms.equals(((Tuple) o).atoms);
  }

  public int arity() {
    return atoms.size();
  }

  public Atom atom(int i) {
    return atoms.get(i);
  }

  /** Returns the position of this tuple among all tuples of its arity in a
   * universe of {@code n} atoms. */
  int index(int n) {
    int index = 0;
    for (Atom atom : atoms) {
      index = index * n + atom.index;
    }
    return index;
  }
}

// End Tuple.java
