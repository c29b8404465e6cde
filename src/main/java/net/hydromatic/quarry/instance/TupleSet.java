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

import com.google.common.collect.Iterators;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import net.hydromatic.quarry.scope.ScopeException;
import org.apache.calcite.util.ImmutableBitSet;

/**
 * Immutable set of tuples of the same arity over an {@link AtomPool}.
 *
 * <p>A tuple (a<sub>0</sub>, ..., a<sub>k-1</sub>) in a universe of n atoms
 * has index a<sub>0</sub>&middot;n<sup>k-1</sup> + ... + a<sub>k-1</sub>; the
 * set is a bit set of those indexes. Tuples that share a prefix are
 * therefore contiguous, which makes joins and restrictions cheap.
 *
 * <p>Every operation returns a new set.
 */
public final class TupleSet implements Iterable<Tuple> {
  private final AtomPool pool;
  public final int arity;
  private final ImmutableBitSet bits;

  private TupleSet(AtomPool pool, int arity, ImmutableBitSet bits) {
    this.pool = requireNonNull(pool, "pool");
    this.arity = arity;
    this.bits = requireNonNull(bits, "bits");
  }

  /** Returns the empty set of a given arity. */
  public static TupleSet empty(AtomPool pool, int arity) {
    checkCapacity(pool, arity);
    return new TupleSet(pool, arity, ImmutableBitSet.of());
  }

  /** Creates a set from tuple indexes. */
  public static TupleSet of(AtomPool pool, int arity, ImmutableBitSet bits) {
    final int capacity = checkCapacity(pool, arity);
    checkArgument(bits.nextSetBit(capacity) < 0, "index out of range");
    return new TupleSet(pool, arity, bits);
  }

  /** Creates a unary set from atom indexes. */
  public static TupleSet ofAtoms(AtomPool pool, ImmutableBitSet atoms) {
    return of(pool, 1, atoms);
  }

  /** Creates a set from tuples, all of which must have the given arity. */
  public static TupleSet of(AtomPool pool, int arity, Iterable<Tuple> tuples) {
    checkCapacity(pool, arity);
    final ImmutableBitSet.Builder b = ImmutableBitSet.builder();
    for (Tuple tuple : tuples) {
      checkArgument(tuple.arity() == arity,
          "tuple %s does not have arity %s", tuple, arity);
      b.set(tuple.index(pool.size()));
    }
    return new TupleSet(pool, arity, b.build());
  }

  /** Returns the identity relation over a set of atoms. */
  public static TupleSet iden(TupleSet atoms) {
    checkArgument(atoms.arity == 1, "arity");
    final int n = atoms.pool.size();
    final ImmutableBitSet.Builder b = ImmutableBitSet.builder();
    for (int a = atoms.bits.nextSetBit(0); a >= 0;
         a = atoms.bits.nextSetBit(a + 1)) {
      b.set(a * n + a);
    }
    return new TupleSet(atoms.pool, 2, b.build());
  }

  /** Returns the number of possible tuples of a given arity, throwing if the
   * number is too large to index. */
  public static int checkCapacity(AtomPool pool, int arity) {
    checkArgument(arity > 0, "arity must be positive");
    long capacity = 1;
    for (int i = 0; i < arity; i++) {
      capacity *= Math.max(pool.size(), 1);
      if (capacity > Integer.MAX_VALUE) {
        throw new ScopeException("universe of " + pool.size()
            + " atoms is too large for relations of arity " + arity);
      }
    }
    return (int) capacity;
  }

  private static int pow(int n, int k) {
    int p = 1;
    for (int i = 0; i < k; i++) {
      p *= n;
    }
    return p;
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("{");
    for (Tuple tuple : this) {
      if (b.length() > 1) {
        b.append(", ");
      }
      b.append(tuple);
    }
    return b.append('}').toString();
  }

  @Override
  public int hashCode() {
    return Objects.hash(arity, bits);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof TupleSet
            && pool == ((TupleSet) o).pool
            && arity == ((TupleSet) o).arity
            && bits.equals(((TupleSet) o).bits);
  }

  @Override
  public Iterator<Tuple> iterator() {
    return Iterators.transform(bits.iterator(), this::tuple);
  }

  /** Returns the tuple indexes. */
  public ImmutableBitSet bits() {
    return bits;
  }

  public AtomPool pool() {
    return pool;
  }

  public int size() {
    return bits.cardinality();
  }

  public boolean isEmpty() {
    return bits.isEmpty();
  }

  public boolean contains(Tuple tuple) {
    return tuple.arity() == arity && bits.get(tuple.index(pool.size()));
  }

  public boolean contains(int index) {
    return bits.get(index);
  }

  /** Returns whether every tuple of {@code that} is in this set. */
  public boolean containsAll(TupleSet that) {
    checkSameArity(that);
    return bits.contains(that.bits);
  }

  private void checkSameArity(TupleSet that) {
    checkArgument(arity == that.arity, "arity mismatch: %s vs %s", arity,
        that.arity);
  }

  /** Returns the index of a tuple of atom indexes. */
  public int index(int... atoms) {
    checkArgument(atoms.length == arity, "arity");
    final int n = pool.size();
    int index = 0;
    for (int atom : atoms) {
      index = index * n + atom;
    }
    return index;
  }

  /** Returns the atom indexes of the tuple with a given index. */
  public int[] atoms(int index) {
    final int n = pool.size();
    final int[] atoms = new int[arity];
    for (int i = arity - 1; i >= 0; i--) {
      atoms[i] = index % n;
      index /= n;
    }
    return atoms;
  }

  /** Returns the tuple with a given index. */
  public Tuple tuple(int index) {
    final List<Atom> list = new ArrayList<>(arity);
    for (int atom : atoms(index)) {
      list.add(pool.atom(atom));
    }
    return Tuple.of(list);
  }

  /** Returns the atoms that occur in column {@code c}. */
  public ImmutableBitSet column(int c) {
    checkArgument(c >= 0 && c < arity, "column");
    final ImmutableBitSet.Builder b = ImmutableBitSet.builder();
    final int n = pool.size();
    final int divisor = pow(n, arity - 1 - c);
    for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
      b.set((i / divisor) % n);
    }
    return b.build();
  }

  private TupleSet with(ImmutableBitSet bits) {
    return bits.equals(this.bits) ? this : new TupleSet(pool, arity, bits);
  }

  public TupleSet union(TupleSet that) {
    checkSameArity(that);
    return with(bits.union(that.bits));
  }

  public TupleSet intersection(TupleSet that) {
    checkSameArity(that);
    return with(bits.intersect(that.bits));
  }

  public TupleSet difference(TupleSet that) {
    checkSameArity(that);
    return with(bits.except(that.bits));
  }

  /** Returns the cartesian product; its arity is the sum of the arities. */
  public TupleSet product(TupleSet that) {
    final int k = that.arity;
    final int shift = pow(pool.size(), k);
    checkCapacity(pool, arity + k);
    final ImmutableBitSet.Builder b = ImmutableBitSet.builder();
    for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
      for (int j = that.bits.nextSetBit(0); j >= 0;
           j = that.bits.nextSetBit(j + 1)) {
        b.set(i * shift + j);
      }
    }
    return new TupleSet(pool, arity + k, b.build());
  }

  /**
   * Returns the relational join, matching the last column of this set with
   * the first column of {@code that}.
   *
   * <p>The tuples of {@code that} that start with a given atom have
   * contiguous indexes, so each tuple of this set scans only its matches.
   */
  public TupleSet join(TupleSet that) {
    final int resultArity = arity + that.arity - 2;
    checkArgument(resultArity > 0, "join of two unary sets");
    final int n = pool.size();
    final int tail = pow(n, that.arity - 1);
    final ImmutableBitSet.Builder b = ImmutableBitSet.builder();
    for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
      final int last = i % n;
      final int prefix = i / n;
      final int start = last * tail;
      final int end = start + tail;
      for (int j = that.bits.nextSetBit(start); j >= 0 && j < end;
           j = that.bits.nextSetBit(j + 1)) {
        b.set(prefix * tail + (j - start));
      }
    }
    return new TupleSet(pool, resultArity, b.build());
  }

  /** Returns the transpose of a binary relation. */
  public TupleSet transpose() {
    checkArgument(arity == 2, "transpose of arity %s", arity);
    final int n = pool.size();
    final ImmutableBitSet.Builder b = ImmutableBitSet.builder();
    for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
      b.set((i % n) * n + i / n);
    }
    return new TupleSet(pool, 2, b.build());
  }

  /** Returns the transitive closure of a binary relation. */
  public TupleSet closure() {
    checkArgument(arity == 2, "closure of arity %s", arity);
    TupleSet r = this;
    for (;;) {
      final TupleSet r2 = r.union(r.join(this));
      if (r2.equals(r)) {
        return r;
      }
      r = r2;
    }
  }

  /** Returns the tuples whose first atom is in a unary set. */
  public TupleSet domainRestrict(TupleSet atoms) {
    checkArgument(atoms.arity == 1, "restriction by arity %s", atoms.arity);
    final int tail = pow(pool.size(), arity - 1);
    final ImmutableBitSet.Builder b = ImmutableBitSet.builder();
    for (int a = atoms.bits.nextSetBit(0); a >= 0;
         a = atoms.bits.nextSetBit(a + 1)) {
      final int end = (a + 1) * tail;
      for (int i = bits.nextSetBit(a * tail); i >= 0 && i < end;
           i = bits.nextSetBit(i + 1)) {
        b.set(i);
      }
    }
    return with(b.build());
  }

  /** Returns the tuples whose last atom is in a unary set. */
  public TupleSet rangeRestrict(TupleSet atoms) {
    checkArgument(atoms.arity == 1, "restriction by arity %s", atoms.arity);
    final int n = pool.size();
    final ImmutableBitSet.Builder b = ImmutableBitSet.builder();
    for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
      if (atoms.bits.get(i % n)) {
        b.set(i);
      }
    }
    return with(b.build());
  }

  /** Returns this set with atoms {@code a} and {@code b} exchanged in every
   * tuple. */
  public TupleSet swap(int a, int b) {
    final ImmutableBitSet.Builder builder = ImmutableBitSet.builder();
    for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
      final int[] atoms = atoms(i);
      for (int c = 0; c < atoms.length; c++) {
        if (atoms[c] == a) {
          atoms[c] = b;
        } else if (atoms[c] == b) {
          atoms[c] = a;
        }
      }
      builder.set(index(atoms));
    }
    return with(builder.build());
  }
}

// End TupleSet.java
