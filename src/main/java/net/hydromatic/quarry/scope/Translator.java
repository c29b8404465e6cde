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

import static net.hydromatic.quarry.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.quarry.ast.Ast;
import net.hydromatic.quarry.ast.Quantifier;
import net.hydromatic.quarry.ast.RelationFinder;
import net.hydromatic.quarry.instance.AtomPool;
import net.hydromatic.quarry.instance.Bound;
import net.hydromatic.quarry.instance.RelationStore;
import net.hydromatic.quarry.instance.TupleSet;
import net.hydromatic.quarry.model.Field;
import net.hydromatic.quarry.model.Model;
import net.hydromatic.quarry.model.Multiplicity;
import net.hydromatic.quarry.model.Ordering;
import net.hydromatic.quarry.model.Signature;
import net.hydromatic.quarry.solve.Constraint;
import net.hydromatic.quarry.solve.Problem;
import org.apache.calcite.util.ImmutableBitSet;

/**
 * Translates a model, a resolved scope and a goal into a {@link Problem}.
 *
 * <p>Allocates the atoms, gives every relation its initial bound, and
 * generates the constraints that the declarations of signatures and fields
 * imply. The model's facts and the goal follow them.
 */
public class Translator {
  private final Model model;
  private final AtomPool pool;
  private final RelationStore.Layout layout;
  private final List<Constraint> constraints = new ArrayList<>();

  private Translator(Model model, AtomPool pool) {
    this.model = model;
    this.pool = pool;
    this.layout = new RelationStore.Layout(model, pool);
  }

  /**
   * Creates a problem whose instances satisfy the facts of a model and a
   * goal.
   *
   * @param model Model
   * @param scope Resolved scope
   * @param goal Expanded goal formula
   * @param goalName Name under which the goal appears in diagnostics
   * @throws ScopeException if the universe is too large to represent
   */
  public static Problem translate(Model model, ScopeTable scope,
      Ast.Formula goal, String goalName) {
    final AtomPool pool = AtomPool.allocate(model, scope);
    for (Ast.Relation relation : model.relations()) {
      TupleSet.checkCapacity(pool, relation.arity);
    }
    final Translator translator = new Translator(model, pool);
    final RelationStore store =
        RelationStore.create(translator.layout, translator.initialBounds());
    translator.declarations();
    model.facts.forEach((name, fact) ->
        translator.add(name, Constraint.Kind.FACT, model.expand(fact)));
    translator.add(goalName, Constraint.Kind.GOAL, goal);
    return new Problem(model, scope, store,
        ImmutableList.copyOf(translator.constraints));
  }

  private List<Bound> initialBounds() {
    final Map<Ast.Relation, Bound> orderingBounds = new HashMap<>();
    model.orderings.values().forEach(o -> orderingBounds(o, orderingBounds));
    final List<Bound> bounds = new ArrayList<>();
    for (Ast.Relation relation : layout.relations) {
      final Signature signature = model.signatureOf(relation);
      final Field field = model.fieldOf(relation);
      if (signature != null) {
        bounds.add(
            Bound.of(TupleSet.ofAtoms(pool, pool.lower(signature)),
                TupleSet.ofAtoms(pool, pool.upper(signature))));
      } else if (field != null) {
        TupleSet upper =
            TupleSet.ofAtoms(pool, pool.upper(field.columns.get(0)));
        for (Signature column : field.columns.subList(1, field.arity())) {
          upper = upper.product(TupleSet.ofAtoms(pool, pool.upper(column)));
        }
        bounds.add(Bound.of(TupleSet.empty(pool, field.arity()), upper));
      } else {
        final Bound bound = orderingBounds.get(relation);
        if (bound == null) {
          throw new IllegalArgumentException("relation '" + relation
              + "' is neither a signature, a field nor an ordering");
        }
        bounds.add(bound);
      }
    }
    return bounds;
  }

  /** Computes the constant relations of an ordering. The signature's atoms
   * are ordered by index. */
  private void orderingBounds(Ordering ordering, Map<Ast.Relation, Bound> map) {
    final int n = pool.size();
    final List<Integer> atoms = pool.upper(ordering.signature).asList();
    final ImmutableBitSet.Builder first = ImmutableBitSet.builder();
    final ImmutableBitSet.Builder last = ImmutableBitSet.builder();
    final ImmutableBitSet.Builder next = ImmutableBitSet.builder();
    final ImmutableBitSet.Builder nexts = ImmutableBitSet.builder();
    if (!atoms.isEmpty()) {
      first.set(atoms.get(0));
      last.set(atoms.get(atoms.size() - 1));
    }
    for (int i = 0; i < atoms.size(); i++) {
      if (i + 1 < atoms.size()) {
        next.set(atoms.get(i) * n + atoms.get(i + 1));
      }
      for (int j = i + 1; j < atoms.size(); j++) {
        nexts.set(atoms.get(i) * n + atoms.get(j));
      }
    }
    map.put(ordering.first, Bound.exact(TupleSet.of(pool, 1, first.build())));
    map.put(ordering.last, Bound.exact(TupleSet.of(pool, 1, last.build())));
    map.put(ordering.next, Bound.exact(TupleSet.of(pool, 2, next.build())));
    map.put(ordering.nexts, Bound.exact(TupleSet.of(pool, 2, nexts.build())));
  }

  /** Generates the constraints implied by the declarations. */
  private void declarations() {
    for (Signature signature : model.signatures) {
      final Ast.Expr s = signature.expr();
      if (signature.parent != null) {
        add(signature.name + " extends " + signature.parent.name,
            ast.in(s, signature.parent.expr()));
      }
      final List<Signature> children = model.children(signature);
      for (int i = 0; i < children.size(); i++) {
        for (int j = i + 1; j < children.size(); j++) {
          final Signature a = children.get(i);
          final Signature b = children.get(j);
          if (pool.upper(a).intersects(pool.upper(b))) {
            add(a.name + " disjoint from " + b.name,
                ast.multiplicity(Quantifier.NO,
                    ast.intersection(a.expr(), b.expr())));
          }
        }
      }
      if (signature.isAbstract) {
        if (children.isEmpty()) {
          add("abstract " + signature.name,
              ast.multiplicity(Quantifier.NO, s));
        } else {
          Ast.Expr union = children.get(0).expr();
          for (Signature child : children.subList(1, children.size())) {
            union = ast.union(union, child.expr());
          }
          add("abstract " + signature.name, ast.in(s, union));
        }
      }
      switch (signature.multiplicity) {
        case ONE:
          add("one sig " + signature.name,
              ast.multiplicity(Quantifier.ONE, s));
          break;
        case LONE:
          add("lone sig " + signature.name,
              ast.multiplicity(Quantifier.LONE, s));
          break;
        case SOME:
          add("some sig " + signature.name,
              ast.multiplicity(Quantifier.SOME, s));
          break;
        default:
          break;
      }
    }
    for (Field field : model.fields) {
      Ast.Expr type = field.columns.get(0).expr();
      for (Signature column : field.columns.subList(1, field.arity())) {
        type = ast.product(type, column.expr());
      }
      add(field.owner.name + "." + field.name + " type",
          ast.in(field.expr(), type));
      switch (field.multiplicity) {
        case ONE:
        case LONE:
          add(field.owner.name + "." + field.name + " multiplicity",
              multiplicity(field));
          break;
        default:
          break;
      }
    }
  }

  /** Creates "all x0: C0, ... | one x(k-2). ... .x0.f" (or "lone"). */
  private static Ast.Formula multiplicity(Field field) {
    final List<Ast.Decl> decls = new ArrayList<>();
    Ast.Expr e = field.expr();
    for (int i = 0; i < field.arity() - 1; i++) {
      final Ast.Variable v = ast.var("x" + i);
      decls.add(ast.decl(v, field.columns.get(i).expr()));
      e = ast.join(v, e);
    }
    final Quantifier quantifier =
        field.multiplicity == Multiplicity.ONE ? Quantifier.ONE
            : Quantifier.LONE;
    return ast.quantified(Quantifier.ALL, decls,
        ast.multiplicity(quantifier, e));
  }

  private void add(String name, Ast.Formula formula) {
    add(name, Constraint.Kind.DECLARATION, formula);
  }

  private void add(String name, Constraint.Kind kind, Ast.Formula formula) {
    final RelationFinder finder = RelationFinder.of(formula);
    final ImmutableBitSet.Builder relations = ImmutableBitSet.builder();
    finder.relations.forEach(r -> relations.set(layout.ordinal(r)));
    if (finder.usesUniverse) {
      layout.roots.forEach(r -> relations.set(layout.ordinal(r)));
    }
    constraints.add(
        new Constraint(constraints.size(), name, kind, formula,
            relations.build()));
  }
}

// End Translator.java
