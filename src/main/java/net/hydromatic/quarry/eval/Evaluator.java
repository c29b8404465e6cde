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
package net.hydromatic.quarry.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.quarry.ast.Ast;
import net.hydromatic.quarry.ast.Quantifier;
import net.hydromatic.quarry.instance.Atom;
import net.hydromatic.quarry.instance.AtomPool;
import net.hydromatic.quarry.instance.Bound;
import net.hydromatic.quarry.instance.Instance;
import net.hydromatic.quarry.instance.RelationStore;
import net.hydromatic.quarry.instance.TupleSet;
import org.apache.calcite.util.ImmutableBitSet;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluates formulas and expressions against a relation store.
 *
 * <p>An expression evaluates to a {@link Bound}; a formula evaluates to a
 * {@link Truth}, which is {@link Truth#UNKNOWN} if its value depends on
 * relations that are not yet decided. Over a complete store, every
 * expression is exact and every formula is true or false.
 *
 * <p>Quantifiers enumerate the atoms that may be in the domain of each
 * declared variable. A binding whose atom is only possibly in the domain
 * contributes an unknown membership, which is combined with the body's
 * value.
 *
 * <p>Formulas must be expanded (see
 * {@link net.hydromatic.quarry.model.Expander}) before evaluation.
 */
public class Evaluator {
  private final RelationStore store;
  private final AtomPool pool;
  private @Nullable Bound univ;

  private Evaluator(RelationStore store) {
    this.store = requireNonNull(store, "store");
    this.pool = store.pool();
  }

  /** Evaluates a formula. */
  public static Truth evaluate(Ast.Formula formula, RelationStore store) {
    return new Evaluator(store).formula(formula, Env.EMPTY);
  }

  /** Evaluates an expression. */
  public static Bound evaluate(Ast.Expr expr, RelationStore store) {
    return new Evaluator(store).expr(expr, Env.EMPTY);
  }

  /** Returns whether a formula holds in an instance. */
  public static boolean holds(Ast.Formula formula, Instance instance) {
    final Truth truth = evaluate(formula, instance.store());
    if (truth == Truth.UNKNOWN) {
      throw new IllegalStateException("formula is neither true nor false "
          + "in a complete instance: " + formula);
    }
    return truth == Truth.TRUE;
  }

  /** Returns the value of an expression in an instance. */
  public static TupleSet value(Ast.Expr expr, Instance instance) {
    return evaluate(expr, instance.store()).lower;
  }

  /**
   * Returns the bindings that decide a quantified formula in an instance.
   *
   * <p>For "all", these are the counter-witnesses, the bindings for which
   * the body is false; for the other quantifiers, the witnesses, the
   * bindings for which the body is true. Each binding lists one atom per
   * declared variable.
   */
  public static List<List<Atom>> witnesses(Ast.Quantified quantified,
      Instance instance) {
    final Evaluator evaluator = new Evaluator(instance.store());
    final Truth wanted =
        quantified.quantifier == Quantifier.ALL ? Truth.FALSE : Truth.TRUE;
    final List<List<Atom>> list = new ArrayList<>();
    evaluator.forEachBinding(quantified.decls, 0, Env.EMPTY, Truth.TRUE,
        (env, membership) -> {
          if (evaluator.formula(quantified.body, env) == wanted) {
            final ImmutableList.Builder<Atom> atoms = ImmutableList.builder();
            for (Ast.Decl decl : quantified.decls) {
              atoms.add(evaluator.pool.atom(env.get(decl.variable)));
            }
            list.add(atoms.build());
          }
          return true;
        });
    return list;
  }

  private Truth formula(Ast.Formula formula, Env env) {
    switch (formula.op) {
      case AND:
        Truth and = Truth.TRUE;
        for (Ast.Formula f : ((Ast.NaryFormula) formula).formulas) {
          and = and.and(formula(f, env));
          if (and == Truth.FALSE) {
            break;
          }
        }
        return and;
      case OR:
        Truth or = Truth.FALSE;
        for (Ast.Formula f : ((Ast.NaryFormula) formula).formulas) {
          or = or.or(formula(f, env));
          if (or == Truth.TRUE) {
            break;
          }
        }
        return or;
      case NOT:
        return formula(((Ast.Not) formula).formula, env).not();
      case IMPLIES:
        final Ast.BinaryFormula implies = (Ast.BinaryFormula) formula;
        final Truth premise = formula(implies.left, env);
        if (premise == Truth.FALSE) {
          return Truth.TRUE;
        }
        return premise.implies(formula(implies.right, env));
      case IFF:
        final Ast.BinaryFormula iff = (Ast.BinaryFormula) formula;
        return formula(iff.left, env).iff(formula(iff.right, env));
      case IN:
        final Ast.Comparison in = (Ast.Comparison) formula;
        return subset(expr(in.left, env), expr(in.right, env));
      case EQ:
        final Ast.Comparison eq = (Ast.Comparison) formula;
        final Bound left = expr(eq.left, env);
        final Bound right = expr(eq.right, env);
        return subset(left, right).and(subset(right, left));
      case MULTIPLICITY:
        final Ast.MultiplicityFormula m = (Ast.MultiplicityFormula) formula;
        return multiplicity(m.quantifier, expr(m.expr, env));
      case QUANTIFIED:
        return quantified((Ast.Quantified) formula, env);
      default:
        throw new IllegalArgumentException("cannot evaluate " + formula.op
            + "; formula must be expanded: " + formula);
    }
  }

  /** Evaluates "a in b". */
  private static Truth subset(Bound a, Bound b) {
    if (b.lower.containsAll(a.upper)) {
      return Truth.TRUE;
    }
    if (!b.upper.containsAll(a.lower)) {
      return Truth.FALSE;
    }
    return Truth.UNKNOWN;
  }

  private static Truth multiplicity(Quantifier quantifier, Bound bound) {
    final int lower = bound.lower.size();
    final int upper = bound.upper.size();
    switch (quantifier) {
      case SOME:
        return lower > 0 ? Truth.TRUE
            : upper == 0 ? Truth.FALSE
            : Truth.UNKNOWN;
      case NO:
        return multiplicity(Quantifier.SOME, bound).not();
      case ONE:
        return lower > 1 || upper == 0 ? Truth.FALSE
            : lower == 1 && upper == 1 ? Truth.TRUE
            : Truth.UNKNOWN;
      case LONE:
        return lower > 1 ? Truth.FALSE
            : upper <= 1 ? Truth.TRUE
            : Truth.UNKNOWN;
      default:
        throw new AssertionError(quantifier);
    }
  }

  private Truth quantified(Ast.Quantified quantified, Env env) {
    final Tally tally = new Tally();
    switch (quantified.quantifier) {
      case ALL:
        tally.truth = Truth.TRUE;
        forEachBinding(quantified.decls, 0, env, Truth.TRUE,
            (env2, membership) -> {
              tally.truth = tally.truth.and(
                  membership.implies(formula(quantified.body, env2)));
              return tally.truth != Truth.FALSE;
            });
        return tally.truth;
      case SOME:
      case NO:
        tally.truth = Truth.FALSE;
        forEachBinding(quantified.decls, 0, env, Truth.TRUE,
            (env2, membership) -> {
              tally.truth = tally.truth.or(
                  membership.and(formula(quantified.body, env2)));
              return tally.truth != Truth.TRUE;
            });
        return quantified.quantifier == Quantifier.NO
            ? tally.truth.not()
            : tally.truth;
      case ONE:
      case LONE:
        forEachBinding(quantified.decls, 0, env, Truth.TRUE,
            (env2, membership) -> {
              final Truth t = membership.and(formula(quantified.body, env2));
              if (t == Truth.TRUE) {
                ++tally.definite;
              }
              if (t != Truth.FALSE) {
                ++tally.possible;
              }
              return tally.definite <= 1;
            });
        if (tally.definite > 1) {
          return Truth.FALSE;
        }
        if (quantified.quantifier == Quantifier.LONE) {
          return tally.possible <= 1 ? Truth.TRUE : Truth.UNKNOWN;
        }
        return tally.possible == 0 ? Truth.FALSE
            : tally.definite == 1 && tally.possible == 1 ? Truth.TRUE
            : Truth.UNKNOWN;
      default:
        throw new AssertionError(quantified.quantifier);
    }
  }

  /** Calls a consumer for each combination of atoms of the declared
   * variables; stops, returning false, when the consumer returns false. */
  private boolean forEachBinding(List<Ast.Decl> decls, int i, Env env,
      Truth membership, BindingConsumer consumer) {
    if (i == decls.size()) {
      return consumer.accept(env, membership);
    }
    final Ast.Decl decl = decls.get(i);
    final Bound domain = expr(decl.domain, env);
    final ImmutableBitSet upper = domain.upper.bits();
    for (int a = upper.nextSetBit(0); a >= 0; a = upper.nextSetBit(a + 1)) {
      final Truth membership2 =
          domain.lower.contains(a) ? membership
              : membership.and(Truth.UNKNOWN);
      if (!forEachBinding(decls, i + 1, env.bind(decl.variable, a),
          membership2, consumer)) {
        return false;
      }
    }
    return true;
  }

  private Bound expr(Ast.Expr expr, Env env) {
    switch (expr.op) {
      case RELATION:
        return store.bound((Ast.Relation) expr);
      case VARIABLE:
        final int atom = env.get((Ast.Variable) expr);
        return Bound.exact(TupleSet.ofAtoms(pool, ImmutableBitSet.of(atom)));
      case UNIV:
        return univ();
      case NONE:
        return Bound.exact(TupleSet.empty(pool, expr.arity));
      case IDEN:
        final Bound u = univ();
        return Bound.of(TupleSet.iden(u.lower), TupleSet.iden(u.upper));
      case JOIN:
        final Ast.BinaryExpr join = (Ast.BinaryExpr) expr;
        return expr(join.left, env).join(expr(join.right, env));
      case PRODUCT:
        final Ast.BinaryExpr product = (Ast.BinaryExpr) expr;
        return expr(product.left, env).product(expr(product.right, env));
      case UNION:
        final Ast.BinaryExpr union = (Ast.BinaryExpr) expr;
        return expr(union.left, env).union(expr(union.right, env));
      case DIFFERENCE:
        final Ast.BinaryExpr difference = (Ast.BinaryExpr) expr;
        return expr(difference.left, env)
            .difference(expr(difference.right, env));
      case INTERSECTION:
        final Ast.BinaryExpr intersection = (Ast.BinaryExpr) expr;
        return expr(intersection.left, env)
            .intersection(expr(intersection.right, env));
      case DOMAIN_RESTRICT:
        final Ast.BinaryExpr domainRestrict = (Ast.BinaryExpr) expr;
        return expr(domainRestrict.right, env)
            .domainRestrict(expr(domainRestrict.left, env));
      case RANGE_RESTRICT:
        final Ast.BinaryExpr rangeRestrict = (Ast.BinaryExpr) expr;
        return expr(rangeRestrict.left, env)
            .rangeRestrict(expr(rangeRestrict.right, env));
      case TRANSPOSE:
        return expr(((Ast.UnaryExpr) expr).expr, env).transpose();
      case CLOSURE:
        return expr(((Ast.UnaryExpr) expr).expr, env).closure();
      default:
        throw new IllegalArgumentException("cannot evaluate " + expr.op
            + "; expression must be expanded: " + expr);
    }
  }

  /** Returns the bound of "univ", the union of the top-level extents. */
  private Bound univ() {
    if (univ == null) {
      Bound b = Bound.exact(TupleSet.empty(pool, 1));
      for (Ast.Relation root : store.layout().roots) {
        b = b.union(store.bound(root));
      }
      univ = b;
    }
    return univ;
  }

  /** Callback for {@link #forEachBinding}. */
  private interface BindingConsumer {
    /** Accepts a binding; returns whether to continue. */
    boolean accept(Env env, Truth membership);
  }

  /** Mutable accumulator for quantifier evaluation. */
  private static class Tally {
    Truth truth = Truth.UNKNOWN;
    int definite;
    int possible;
  }
}

// End Evaluator.java
