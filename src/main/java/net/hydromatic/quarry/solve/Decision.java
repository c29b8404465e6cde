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
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import net.hydromatic.quarry.instance.Bound;
import net.hydromatic.quarry.instance.RelationStore;
import net.hydromatic.quarry.instance.TupleSet;
import net.hydromatic.quarry.model.Field;
import net.hydromatic.quarry.model.Model;
import net.hydromatic.quarry.model.Multiplicity;
import net.hydromatic.quarry.model.Signature;
import org.apache.calcite.util.ImmutableBitSet;

/**
 * Point in the search where the value of part of one relation is chosen.
 *
 * <p>A decision offers a list of {@link Choice}s, each of which narrows the
 * relation's bound. Choices are offered in a fixed order, so the search is
 * deterministic.
 */
public abstract class Decision {
  /** Ordinal of the relation that this decision narrows. */
  public final int relation;
  /** Atom whose row this decision chooses, if the decision takes part in
   * symmetry breaking; otherwise -1. */
  public final int symmetryAtom;
  /** Index of the first decision in the run of consecutive decisions on the
   * same relation that take part in symmetry breaking. */
  int runStart;

  Decision(int relation, int symmetryAtom) {
    this.relation = relation;
    this.symmetryAtom = symmetryAtom;
  }

  /** Returns the choices that are consistent with the current store. */
  abstract List<Choice> choices(RelationStore store);

  /**
   * Plans the decisions of a search.
   *
   * <p>First, the extent of each signature whose extent is not fixed, one
   * decision per atom. Then each field, in declaration order: for a "one" or
   * "lone" field, one decision per prefix that chooses the single tuple with
   * that prefix (or none); for other fields, one decision per tuple. Last,
   * the tuples of "set" fields whose last column is an ordered signature,
   * one time step after another.
   */
  static ImmutableList<Decision> plan(Model model, RelationStore store) {
    final RelationStore.Layout layout = store.layout();
    final List<Decision> list = new ArrayList<>();
    for (Signature signature : model.signatures) {
      final int r = layout.ordinal(signature.relation);
      final Bound bound = store.bound(r);
      final ImmutableBitSet open =
          bound.upper.bits().except(bound.lower.bits());
      for (int a : open) {
        list.add(new TupleDecision(r, a, new int[] {a}, new int[0], a));
      }
    }
    final List<TupleDecision> timed = new ArrayList<>();
    final int n = store.pool().size();
    for (Field field : model.fields) {
      final int r = layout.ordinal(field.relation);
      final Bound bound = store.bound(r);
      final int[] columns = new int[field.arity()];
      for (int c = 0; c < columns.length; c++) {
        columns[c] = layout.ordinal(field.columns.get(c).relation);
      }
      final TupleSet upper = bound.upper;
      if (field.multiplicity == Multiplicity.SET) {
        final boolean isTimed = model.ordering(field.target()) != null;
        for (int t : upper.bits().except(bound.lower.bits())) {
          final TupleDecision decision =
              new TupleDecision(r, t, upper.atoms(t), columns, -1);
          if (isTimed) {
            timed.add(decision);
          } else {
            list.add(decision);
          }
        }
        continue;
      }
      // One decision per prefix. Tuples with the same prefix have
      // contiguous indexes.
      final boolean symmetric = field.arity() == 2
          && field.columns.get(0).root() != field.columns.get(1).root();
      final ImmutableBitSet bits = upper.bits();
      for (int t = bits.nextSetBit(0); t >= 0; ) {
        final int start = (t / n) * n;
        final ImmutableBitSet candidates =
            bits.intersect(ImmutableBitSet.range(start, start + n));
        final int[] atoms = upper.atoms(t);
        final int[] prefix = new int[atoms.length - 1];
        System.arraycopy(atoms, 0, prefix, 0, prefix.length);
        list.add(
            new GroupDecision(r, prefix, candidates, columns,
                field.multiplicity, symmetric ? prefix[0] : -1));
        t = bits.nextSetBit(start + n);
      }
    }
    timed.sort(Comparator.comparingInt(d -> d.atoms[d.atoms.length - 1]));
    list.addAll(timed);

    for (int i = 0; i < list.size(); i++) {
      final Decision d = list.get(i);
      final Decision previous = i > 0 ? list.get(i - 1) : null;
      d.runStart = previous != null
          && d.symmetryAtom >= 0
          && previous.symmetryAtom >= 0
          && previous.relation == d.relation
          && previous.getClass() == d.getClass()
          ? previous.runStart
          : i;
    }
    return ImmutableList.copyOf(list);
  }

  /** Returns whether every atom of a tuple may be in its column's
   * signature. */
  static boolean fits(RelationStore store, int[] atoms, int[] columns) {
    for (int c = 0; c < columns.length; c++) {
      if (!store.bound(columns[c]).upper.contains(atoms[c])) {
        return false;
      }
    }
    return true;
  }

  /** Returns whether every atom of a tuple is definitely in its column's
   * signature. */
  static boolean definitelyFits(RelationStore store, int[] atoms,
      int[] columns) {
    for (int c = 0; c < columns.length; c++) {
      if (!store.bound(columns[c]).lower.contains(atoms[c])) {
        return false;
      }
    }
    return true;
  }

  /** Result of a choice: a rank, used to break symmetry, and the relation's
   * new bound. */
  static class Choice {
    final int rank;
    final Bound bound;

    Choice(int rank, Bound bound) {
      this.rank = rank;
      this.bound = requireNonNull(bound, "bound");
    }
  }

  /** Decides whether one tuple is in a relation. Offers "out" (rank 0)
   * before "in" (rank 1). */
  static class TupleDecision extends Decision {
    final int tuple;
    final int[] atoms;
    /** Ordinals of the column signatures' extents; empty if the relation is
     * itself an extent. */
    final int[] columns;

    TupleDecision(int relation, int tuple, int[] atoms, int[] columns,
        int symmetryAtom) {
      super(relation, symmetryAtom);
      this.tuple = tuple;
      this.atoms = atoms;
      this.columns = columns;
    }

    @Override
    public String toString() {
      return "tuple " + tuple + " of relation " + relation;
    }

    @Override
    List<Choice> choices(RelationStore store) {
      final Bound bound = store.bound(relation);
      final List<Choice> list = new ArrayList<>(2);
      if (!bound.lower.contains(tuple)) {
        list.add(
            new Choice(0,
                Bound.of(bound.lower,
                    TupleSet.of(bound.upper.pool(), bound.arity(),
                        bound.upper.bits().clear(tuple)))));
      }
      if (bound.upper.contains(tuple) && fits(store, atoms, columns)) {
        list.add(
            new Choice(1,
                Bound.of(
                    TupleSet.of(bound.lower.pool(), bound.arity(),
                        bound.lower.bits().set(tuple)),
                    bound.upper)));
      }
      return list;
    }
  }

  /** Chooses the single tuple, or none, that a "one" or "lone" field has for
   * a prefix. The rank of a tuple is its last atom; "none" has rank -1. */
  static class GroupDecision extends Decision {
    final int[] prefix;
    /** Indexes of the tuples that start with {@link #prefix}. */
    final ImmutableBitSet candidates;
    final int[] columns;
    final Multiplicity multiplicity;

    GroupDecision(int relation, int[] prefix, ImmutableBitSet candidates,
        int[] columns, Multiplicity multiplicity, int symmetryAtom) {
      super(relation, symmetryAtom);
      this.prefix = prefix;
      this.candidates = candidates;
      this.columns = columns;
      this.multiplicity = multiplicity;
    }

    @Override
    public String toString() {
      return "row " + Arrays.toString(prefix) + " of relation "
          + relation;
    }

    @Override
    List<Choice> choices(RelationStore store) {
      final Bound bound = store.bound(relation);
      final ImmutableBitSet rowUpper = bound.upper.bits().intersect(candidates);
      final ImmutableBitSet rowLower = bound.lower.bits().intersect(candidates);
      final int n = store.pool().size();
      final List<Choice> list = new ArrayList<>();
      if (!rowLower.isEmpty()) {
        if (rowLower.cardinality() == 1) {
          final int t = rowLower.nextSetBit(0);
          list.add(choose(bound, rowUpper, t, t % n));
        }
        return list;
      }
      final int[] prefixColumns = new int[prefix.length];
      System.arraycopy(columns, 0, prefixColumns, 0, prefix.length);
      if (!fits(store, prefix, prefixColumns)) {
        list.add(none(bound, rowUpper));
        return list;
      }
      final boolean noneLast = multiplicity == Multiplicity.ONE;
      if (!noneLast) {
        list.add(none(bound, rowUpper));
      }
      final Bound lastColumn = store.bound(columns[columns.length - 1]);
      for (int t : rowUpper) {
        if (lastColumn.upper.contains(t % n)) {
          list.add(choose(bound, rowUpper, t, t % n));
        }
      }
      if (noneLast && !definitelyFits(store, prefix, prefixColumns)) {
        list.add(none(bound, rowUpper));
      }
      return list;
    }

    private static Choice none(Bound bound, ImmutableBitSet rowUpper) {
      return new Choice(-1,
          Bound.of(bound.lower,
              TupleSet.of(bound.upper.pool(), bound.arity(),
                  bound.upper.bits().except(rowUpper))));
    }

    private static Choice choose(Bound bound, ImmutableBitSet rowUpper,
        int t, int rank) {
      final ImmutableBitSet others = rowUpper.clear(t);
      return new Choice(rank,
          Bound.of(
              TupleSet.of(bound.lower.pool(), bound.arity(),
                  bound.lower.bits().set(t)),
              TupleSet.of(bound.upper.pool(), bound.arity(),
                  bound.upper.bits().except(others))));
    }
  }
}

// End Decision.java
