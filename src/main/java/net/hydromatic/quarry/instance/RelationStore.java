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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import net.hydromatic.quarry.ast.Ast;
import net.hydromatic.quarry.model.Model;
import net.hydromatic.quarry.model.ModelException;
import net.hydromatic.quarry.model.Signature;
import org.apache.calcite.util.ImmutableBitSet;

/**
 * Current bound of every relation of a model.
 *
 * <p>A store is persistent: {@link #with} and {@link #assign} return a new
 * store that shares every unchanged bound with this one. The search keeps a
 * reference to the previous store, so backtracking costs nothing.
 */
public final class RelationStore {
  private final Layout layout;
  private final Bound[] bounds;

  private RelationStore(Layout layout, Bound[] bounds) {
    this.layout = requireNonNull(layout, "layout");
    this.bounds = requireNonNull(bounds, "bounds");
  }

  /** Creates a store with a bound for each relation of a layout. */
  public static RelationStore create(Layout layout, List<Bound> bounds) {
    checkArgument(bounds.size() == layout.relations.size(),
        "expected %s bounds, got %s", layout.relations.size(), bounds.size());
    for (int i = 0; i < bounds.size(); i++) {
      checkArgument(bounds.get(i).arity() == layout.relations.get(i).arity,
          "arity of bound for %s", layout.relations.get(i).name);
    }
    return new RelationStore(layout, bounds.toArray(new Bound[0]));
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < bounds.length; i++) {
      b.append(layout.relations.get(i).name).append(": ")
          .append(bounds[i]).append('\n');
    }
    return b.toString();
  }

  public Layout layout() {
    return layout;
  }

  public AtomPool pool() {
    return layout.pool;
  }

  public Bound bound(int ordinal) {
    return bounds[ordinal];
  }

  public Bound bound(Ast.Relation relation) {
    return bounds[layout.ordinal(relation)];
  }

  /** Returns the current value of a relation: the tuples that are
   * definitely in it. Once the relation is decided, this is its value. */
  public TupleSet tuples(Ast.Relation relation) {
    return bound(relation).lower;
  }

  /** Returns the value of a relation, looked up by name. */
  public TupleSet tuples(String name) {
    return tuples(layout.model.relation(name));
  }

  /** Returns whether a relation definitely contains a tuple. */
  public boolean contains(String name, Tuple tuple) {
    return bound(layout.model.relation(name)).lower.contains(tuple);
  }

  /** Returns a store in which a relation has a given value.
   *
   * @throws ModelException if the value's arity differs from the relation's,
   * or a tuple has an atom outside its column's signature */
  public RelationStore assign(String name, TupleSet value) {
    return assign(layout.model.relation(name), value);
  }

  /** Returns a store in which a relation has a given value. */
  public RelationStore assign(Ast.Relation relation, TupleSet value) {
    final int ordinal = layout.ordinal(relation);
    if (value.arity != relation.arity) {
      throw new ModelException("cannot assign value of arity " + value.arity
          + " to relation '" + relation.name + "' of arity "
          + relation.arity);
    }
    final List<Signature> columns = layout.columns(ordinal);
    for (int c = 0; c < columns.size(); c++) {
      final ImmutableBitSet allowed = layout.pool.upper(columns.get(c));
      final ImmutableBitSet outside = value.column(c).except(allowed);
      if (!outside.isEmpty()) {
        throw new ModelException("atom '"
            + layout.pool.atom(outside.nextSetBit(0)) + "' in column " + c
            + " of relation '" + relation.name + "' is not in signature '"
            + columns.get(c) + "'");
      }
    }
    return with(ordinal, Bound.exact(value));
  }

  /** Returns a store in which one relation has a different bound. */
  public RelationStore with(int ordinal, Bound bound) {
    if (bounds[ordinal].equals(bound)) {
      return this;
    }
    final Bound[] bounds2 = bounds.clone();
    bounds2[ordinal] = bound;
    return new RelationStore(layout, bounds2);
  }

  /** Returns whether every relation's value is known. */
  public boolean isComplete() {
    for (Bound bound : bounds) {
      if (!bound.isExact()) {
        return false;
      }
    }
    return true;
  }

  /** Converts a complete store into an instance. */
  public Instance toInstance() {
    if (!isComplete()) {
      throw new IllegalStateException("store is not complete");
    }
    return new Instance(this);
  }

  /** Assignment of ordinals to the relations of a model, and the atoms they
   * range over. Shared by every store of one analysis. */
  public static class Layout {
    public final Model model;
    public final AtomPool pool;
    public final ImmutableList<Ast.Relation> relations;
    /** Extents of the top-level signatures; their union is "univ". */
    public final ImmutableList<Ast.Relation> roots;
    private final ImmutableMap<Ast.Relation, Integer> ordinals;
    private final ImmutableList<ImmutableList<Signature>> columns;

    public Layout(Model model, AtomPool pool) {
      this.model = requireNonNull(model, "model");
      this.pool = requireNonNull(pool, "pool");
      this.relations = model.relations();
      final ImmutableMap.Builder<Ast.Relation, Integer> b =
          ImmutableMap.builder();
      final ImmutableList.Builder<ImmutableList<Signature>> b2 =
          ImmutableList.builder();
      for (int i = 0; i < relations.size(); i++) {
        b.put(relations.get(i), i);
        b2.add(model.columns(relations.get(i)));
      }
      this.ordinals = b.build();
      this.columns = b2.build();
      final ImmutableList.Builder<Ast.Relation> b3 = ImmutableList.builder();
      model.topLevelSignatures().forEach(s -> b3.add(s.relation));
      this.roots = b3.build();
    }

    /** Returns the ordinal of a relation; throws if it is not in the
     * model. */
    public int ordinal(Ast.Relation relation) {
      final Integer ordinal = ordinals.get(relation);
      if (ordinal == null) {
        throw new ModelException("relation '" + relation.name
            + "' is not declared in model '" + model.name + "'");
      }
      return ordinal;
    }

    /** Returns the column signatures of the relation with a given
     * ordinal. */
    public ImmutableList<Signature> columns(int ordinal) {
      return columns.get(ordinal);
    }

    public int size() {
      return relations.size();
    }
  }
}

// End RelationStore.java
