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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.quarry.instance.AtomPool;
import net.hydromatic.quarry.instance.RelationStore;
import net.hydromatic.quarry.model.Model;
import net.hydromatic.quarry.scope.ScopeTable;

/**
 * Everything a search needs: the universe, the initial bound of every
 * relation, the constraints, and the order in which to decide relations.
 *
 * <p>Immutable; shared by every thread of a parallel search.
 */
public class Problem {
  public final Model model;
  public final ScopeTable scope;
  public final AtomPool pool;
  /** Initial store; signature extents and fields are bounded by the scope,
   * ordering relations are exact. */
  public final RelationStore store;
  public final ImmutableList<Constraint> constraints;
  public final ImmutableList<Decision> decisions;
  /** For each relation ordinal, the constraints that reference it. */
  private final ImmutableList<ImmutableList<Constraint>> constraintsOn;

  public Problem(Model model, ScopeTable scope, RelationStore store,
      ImmutableList<Constraint> constraints) {
    this.model = requireNonNull(model, "model");
    this.scope = requireNonNull(scope, "scope");
    this.store = requireNonNull(store, "store");
    this.pool = store.pool();
    this.constraints = requireNonNull(constraints, "constraints");
    this.decisions = Decision.plan(model, store);
    final List<ImmutableList.Builder<Constraint>> builders = new ArrayList<>();
    for (int i = 0; i < store.layout().size(); i++) {
      builders.add(ImmutableList.builder());
    }
    for (Constraint constraint : constraints) {
      constraint.relations.forEach(r -> builders.get(r).add(constraint));
    }
    final ImmutableList.Builder<ImmutableList<Constraint>> b =
        ImmutableList.builder();
    builders.forEach(builder -> b.add(builder.build()));
    this.constraintsOn = b.build();
  }

  /** Returns the constraints that reference a relation. */
  public ImmutableList<Constraint> constraintsOn(int relation) {
    return constraintsOn.get(relation);
  }
}

// End Problem.java
