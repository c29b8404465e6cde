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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.quarry.ast.Ast;
import net.hydromatic.quarry.ast.RelationFinder;
import net.hydromatic.quarry.model.Field;
import net.hydromatic.quarry.model.Model;
import net.hydromatic.quarry.model.Multiplicity;
import net.hydromatic.quarry.model.Predicate;
import net.hydromatic.quarry.model.Signature;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Resolves a {@link ScopeSpec} against the signatures of a model.
 *
 * <p>Rules:
 *
 * <ul>
 *   <li>A top-level signature not named in the scope gets the default bound.
 *   If there is no default, a top-level signature that a fact, field or
 *   predicate references is an error; one that nothing references gets
 *   bound 0.
 *   <li>A "one" signature has exactly 1 atom; a "lone" signature at most 1;
 *   a "some" signature may not have bound 0.
 *   <li>An ordered signature has exactly its bound of atoms.
 *   <li>A sub-signature not named in the scope has no bound of its own, and
 *   shares its parent's atoms.
 *   <li>The bounds of a signature's bounded sub-signatures may not sum to
 *   more than its own bound; the children of an exact abstract signature
 *   must be able to fill it.
 * </ul>
 */
public class ScopeManager {
  private ScopeManager() {}

  /** Resolves a scope; throws {@link ScopeException} naming the offending
   * signature if the scope is inconsistent with the model. */
  public static ScopeTable resolve(ScopeSpec spec, Model model) {
    for (String name : spec.bounds.keySet()) {
      if (find(model, name) == null) {
        throw new ScopeException("scope '" + spec
            + "' bounds unknown signature '" + name + "'");
      }
    }
    final Set<Signature> referenced = referencedRoots(model);
    final Map<Signature, Integer> bounds = new LinkedHashMap<>();
    final Set<Signature> exact = new LinkedHashSet<>();
    for (Signature signature : model.signatures) {
      @Nullable Integer bound = spec.bounds.get(signature.name);
      boolean isExact = spec.exact.contains(signature.name);
      switch (signature.multiplicity) {
        case ONE:
          if (bound != null && bound != 1) {
            throw new ScopeException("signature '" + signature
                + "' is 'one', but scope gives it " + bound + " atoms");
          }
          bound = 1;
          isExact = true;
          break;
        case LONE:
          if (bound != null && bound > 1) {
            throw new ScopeException("signature '" + signature
                + "' is 'lone', but scope gives it " + bound + " atoms");
          }
          if (bound == null) {
            bound = 1;
          }
          break;
        default:
          break;
      }
      if (bound == null && signature.isTopLevel()) {
        if (spec.defaultBound != null) {
          bound = spec.defaultBound;
        } else if (model.ordering(signature) != null) {
          throw new ScopeException("ordered signature '" + signature
              + "' has no bound");
        } else if (referenced.contains(signature)
            || signature.multiplicity == Multiplicity.SOME) {
          throw new ScopeException("signature '" + signature
              + "' has no bound, and scope '" + spec + "' has no default");
        } else {
          bound = 0;
        }
      }
      if (signature.multiplicity == Multiplicity.SOME
          && bound != null && bound == 0) {
        throw new ScopeException("signature '" + signature
            + "' is 'some', but scope gives it 0 atoms");
      }
      if (model.ordering(signature) != null) {
        isExact = true;
      }
      if (bound != null) {
        bounds.put(signature, bound);
        if (isExact) {
          exact.add(signature);
        }
      }
    }
    final ScopeTable table =
        new ScopeTable(spec, ImmutableMap.copyOf(bounds),
            ImmutableSet.copyOf(exact));
    checkFits(model, table);
    return table;
  }

  private static @Nullable Signature find(Model model, String name) {
    for (Signature signature : model.signatures) {
      if (signature.name.equals(name)) {
        return signature;
      }
    }
    return null;
  }

  /** Checks that the children of each bounded signature fit within it. */
  private static void checkFits(Model model, ScopeTable table) {
    for (Signature signature : model.signatures) {
      if (!table.isBounded(signature)) {
        continue;
      }
      final int bound = table.bound(signature);
      final List<Signature> reserved = new ArrayList<>();
      final boolean allBounded = reserved(model, table, signature, reserved);
      int sum = 0;
      for (Signature child : reserved) {
        sum += table.bound(child);
      }
      if (sum > bound) {
        throw new ScopeException("signature '" + signature + "' has bound "
            + bound + ", but its sub-signatures " + reserved + " need "
            + sum + " atoms");
      }
      if (signature.isAbstract
          && table.isExact(signature)
          && allBounded
          && sum < bound) {
        throw new ScopeException("abstract signature '" + signature
            + "' must have exactly " + bound + " atoms, but its"
            + " sub-signatures " + reserved + " have at most " + sum);
      }
    }
  }

  /** Adds to a list the bounded descendants of a signature that are reached
   * only through unbounded signatures; returns whether every child is
   * bounded. */
  private static boolean reserved(Model model, ScopeTable table,
      Signature signature, List<Signature> list) {
    boolean allBounded = true;
    for (Signature child : model.children(signature)) {
      if (table.isBounded(child)) {
        list.add(child);
      } else {
        allBounded = false;
        reserved(model, table, child, list);
      }
    }
    return allBounded;
  }

  /** Returns the top-level signatures that facts, fields and predicates
   * reference. */
  private static Set<Signature> referencedRoots(Model model) {
    final Set<Signature> roots = new LinkedHashSet<>();
    for (Field field : model.fields) {
      field.columns.forEach(c -> roots.add(c.root()));
    }
    final Set<Ast.Node> nodes = new LinkedHashSet<>(model.facts.values());
    for (Predicate predicate : model.predicates.values()) {
      nodes.add(predicate.body);
      predicate.params.forEach(p -> nodes.add(p.domain));
    }
    model.functions.values().forEach(f -> nodes.add(f.body));
    for (Ast.Node node : nodes) {
      final RelationFinder finder = RelationFinder.of(node);
      if (finder.usesUniverse) {
        roots.addAll(model.topLevelSignatures());
      }
      for (Ast.Relation relation : finder.relations) {
        model.columns(relation).forEach(c -> roots.add(c.root()));
      }
    }
    return roots;
  }
}

// End ScopeManager.java
