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

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.quarry.ast.Ast;
import net.hydromatic.quarry.model.Model;
import net.hydromatic.quarry.model.Signature;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Complete assignment of a value to every relation of a model.
 *
 * <p>Immutable.
 */
public class Instance {
  private final RelationStore store;

  Instance(RelationStore store) {
    this.store = requireNonNull(store, "store");
  }

  @Override
  public String toString() {
    return store.toString();
  }

  public Model model() {
    return store.layout().model;
  }

  public AtomPool pool() {
    return store.pool();
  }

  /** Returns the store, every relation of which is exact. */
  public RelationStore store() {
    return store;
  }

  /** Returns the value of a relation. */
  public TupleSet tuples(Ast.Relation relation) {
    return store.bound(relation).lower;
  }

  /** Returns the value of a relation, looked up by name. */
  public TupleSet tuples(String name) {
    return store.tuples(name);
  }

  /** Returns the atoms in a signature's extent. */
  public List<Atom> atoms(Signature signature) {
    final List<Atom> list = new ArrayList<>();
    for (Tuple tuple : tuples(signature.relation)) {
      list.add(tuple.atom(0));
    }
    return list;
  }

  /** Returns the most specific signature whose extent contains an atom, or
   * null if the atom is in no signature. */
  public @Nullable Signature signatureOf(Atom atom) {
    Signature best = null;
    for (Signature signature : model().signatures) {
      if (tuples(signature.relation).contains(atom.index)
          && (best == null || signature.isSubtypeOf(best))) {
        best = signature;
      }
    }
    return best;
  }
}

// End Instance.java
