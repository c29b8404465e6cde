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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.quarry.model.Model;
import net.hydromatic.quarry.model.Signature;
import net.hydromatic.quarry.scope.ScopeException;
import net.hydromatic.quarry.scope.ScopeTable;
import org.apache.calcite.util.ImmutableBitSet;

/**
 * Fixed, finite universe of atoms for one analysis.
 *
 * <p>Each bounded signature reserves atoms for its bounded descendants and
 * keeps the rest as a pool, named after itself ("Event$0", "Event$1"), that
 * it shares with its unbounded descendants. For each signature the pool
 * records the atoms that may be in its extent ({@link #upper}) and the atoms
 * that must be ({@link #lower}).
 *
 * <p>Immutable, and therefore safe to share among threads.
 */
public class AtomPool {
  private final ImmutableList<Atom> atoms;
  private final ImmutableMap<String, Atom> atomsByName;
  private final ImmutableMap<Signature, ImmutableBitSet> lower;
  private final ImmutableMap<Signature, ImmutableBitSet> upper;

  private AtomPool(ImmutableList<Atom> atoms,
      ImmutableMap<Signature, ImmutableBitSet> lower,
      ImmutableMap<Signature, ImmutableBitSet> upper) {
    this.atoms = requireNonNull(atoms, "atoms");
    this.lower = requireNonNull(lower, "lower");
    this.upper = requireNonNull(upper, "upper");
    final ImmutableMap.Builder<String, Atom> b = ImmutableMap.builder();
    atoms.forEach(a -> b.put(a.name, a));
    this.atomsByName = b.build();
  }

  /** Allocates atoms for every signature of a model within a scope.
   *
   * @throws ScopeException if a signature's bounded descendants need more
   * atoms than the signature's own bound */
  public static AtomPool allocate(Model model, ScopeTable scope) {
    final Allocator allocator = new Allocator(model, scope);
    for (Signature root : model.topLevelSignatures()) {
      if (!scope.isBounded(root)) {
        throw new ScopeException("no bound for top-level signature '"
            + root + "'");
      }
      allocator.allocate(root);
    }
    final Map<Signature, ImmutableBitSet> upper = new LinkedHashMap<>();
    final Map<Signature, ImmutableBitSet> lower = new LinkedHashMap<>();
    for (Signature signature : model.signatures) {
      upper.put(signature, allocator.upper(signature));
    }
    // Children follow their parent, so visit in reverse to compute lower
    // bounds bottom-up.
    for (Signature signature : model.signatures.reverse()) {
      ImmutableBitSet bits = scope.isExact(signature)
          ? upper.get(signature)
          : ImmutableBitSet.of();
      for (Signature child : model.children(signature)) {
        bits = bits.union(lower.get(child));
      }
      lower.put(signature, bits);
    }
    final ImmutableMap.Builder<Signature, ImmutableBitSet> lowerBuilder =
        ImmutableMap.builder();
    model.signatures.forEach(s -> lowerBuilder.put(s, lower.get(s)));
    return new AtomPool(ImmutableList.copyOf(allocator.atoms),
        lowerBuilder.build(), ImmutableMap.copyOf(upper));
  }

  @Override
  public String toString() {
    return atoms.toString();
  }

  /** Returns the number of atoms in the universe. */
  public int size() {
    return atoms.size();
  }

  /** Returns the atom with a given index. */
  public Atom atom(int index) {
    return atoms.get(index);
  }

  /** Returns the atom with a given name; throws if not found. */
  public Atom atom(String name) {
    final Atom atom = atomsByName.get(name);
    if (atom == null) {
      throw new IllegalArgumentException("no atom '" + name + "'");
    }
    return atom;
  }

  /** Returns all atoms. */
  public ImmutableList<Atom> atoms() {
    return atoms;
  }

  /** Returns the number of atoms that may belong to a signature, including
   * those of its descendants. */
  public int count(Signature signature) {
    return upper(signature).cardinality();
  }

  /** Returns the atoms that may belong to a signature, lazily.
   *
   * <p>The result may be iterated any number of times. */
  public Iterable<Atom> atoms(Signature signature) {
    return Iterables.transform(upper(signature), atoms::get);
  }

  /** Returns the indexes of atoms that may belong to a signature. */
  public ImmutableBitSet upper(Signature signature) {
    return requireNonNull(upper.get(signature), signature.name);
  }

  /** Returns the indexes of atoms that must belong to a signature. */
  public ImmutableBitSet lower(Signature signature) {
    return requireNonNull(lower.get(signature), signature.name);
  }

  /** Allocates atoms, depth-first. */
  private static class Allocator {
    final Model model;
    final ScopeTable scope;
    final List<Atom> atoms = new ArrayList<>();
    /** Atoms each bounded signature keeps for itself and its unbounded
     * descendants. */
    final Map<Signature, ImmutableBitSet> pools = new HashMap<>();

    Allocator(Model model, ScopeTable scope) {
      this.model = model;
      this.scope = scope;
    }

    void allocate(Signature signature) {
      final int bound = scope.bound(signature);
      final List<Signature> reserved = reserved(signature);
      int reservedCount = 0;
      for (Signature child : reserved) {
        reservedCount += scope.bound(child);
      }
      if (reservedCount > bound) {
        throw new ScopeException("signature '" + signature + "' has bound "
            + bound + ", but its sub-signatures " + reserved + " need "
            + reservedCount + " atoms");
      }
      final boolean hasPool =
          !signature.isAbstract || hasUnboundedChild(signature);
      final ImmutableBitSet.Builder pool = ImmutableBitSet.builder();
      if (hasPool) {
        for (int i = 0; i < bound - reservedCount; i++) {
          pool.set(atoms.size());
          atoms.add(new Atom(atoms.size(), signature.name + "$" + i,
              signature));
        }
      }
      pools.put(signature, pool.build());
      for (Signature child : reserved) {
        allocate(child);
      }
    }

    /** Returns the bounded descendants of a signature that are reached only
     * through unbounded signatures. */
    List<Signature> reserved(Signature signature) {
      final List<Signature> list = new ArrayList<>();
      for (Signature child : model.children(signature)) {
        if (scope.isBounded(child)) {
          list.add(child);
        } else {
          list.addAll(reserved(child));
        }
      }
      return list;
    }

    boolean hasUnboundedChild(Signature signature) {
      for (Signature child : model.children(signature)) {
        if (!scope.isBounded(child)) {
          return true;
        }
      }
      return false;
    }

    /** Returns the atoms that may belong to a signature. */
    ImmutableBitSet upper(Signature signature) {
      Signature owner = signature;
      while (!scope.isBounded(owner)) {
        owner = requireNonNull(owner.parent, "parent");
      }
      ImmutableBitSet bits = requireNonNull(pools.get(owner), "pool");
      for (Signature child : reserved(signature)) {
        bits = bits.union(upper(child));
      }
      return bits;
    }
  }
}

// End AtomPool.java
