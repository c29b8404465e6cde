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
package net.hydromatic.quarry.model;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.quarry.ast.Ast;

/**
 * Checks that relations are declared, variables are bound, and that joins
 * and comparisons combine columns from compatible signature hierarchies.
 *
 * <p>The type of an expression is, for each column, the set of top-level
 * signatures whose atoms may appear in that column. A join whose adjacent
 * columns have disjoint types, or a comparison with disjoint types in some
 * column, is always empty or always false; such expressions are rejected.
 *
 * <p>Formulas must be expanded (see {@link Expander}) before checking.
 */
public class TypeChecker {
  private final Model model;
  private final ImmutableSet<Signature> roots;

  TypeChecker(Model model) {
    this.model = requireNonNull(model, "model");
    this.roots = ImmutableSet.copyOf(model.topLevelSignatures());
  }

  /** Checks a formula whose free variables are the given parameters. */
  public void check(Ast.Formula formula, List<Ast.Decl> params) {
    formula(formula, bind(params));
  }

  /** Checks an expression whose free variables are the given parameters. */
  public void check(Ast.Expr expr, List<Ast.Decl> params) {
    type(expr, bind(params));
  }

  private Map<Ast.Variable, List<Set<Signature>>> bind(List<Ast.Decl> params) {
    final Map<Ast.Variable, List<Set<Signature>>> env = new HashMap<>();
    for (Ast.Decl param : params) {
      env.put(param.variable, type(param.domain, env));
    }
    return env;
  }

  private void formula(Ast.Formula formula,
      Map<Ast.Variable, List<Set<Signature>>> env) {
    switch (formula.op) {
      case AND:
      case OR:
        for (Ast.Formula f : ((Ast.NaryFormula) formula).formulas) {
          formula(f, env);
        }
        return;
      case NOT:
        formula(((Ast.Not) formula).formula, env);
        return;
      case IMPLIES:
      case IFF:
        final Ast.BinaryFormula binary = (Ast.BinaryFormula) formula;
        formula(binary.left, env);
        formula(binary.right, env);
        return;
      case IN:
      case EQ:
        final Ast.Comparison comparison = (Ast.Comparison) formula;
        final List<Set<Signature>> left = type(comparison.left, env);
        final List<Set<Signature>> right = type(comparison.right, env);
        for (int i = 0; i < left.size(); i++) {
          if (Collections.disjoint(left.get(i), right.get(i))) {
            throw new ModelException("type error in '" + formula
                + "': column " + i + " of '" + comparison.left + "' is "
                + left.get(i) + " but column " + i + " of '"
                + comparison.right + "' is " + right.get(i));
          }
        }
        return;
      case MULTIPLICITY:
        type(((Ast.MultiplicityFormula) formula).expr, env);
        return;
      case QUANTIFIED:
        final Ast.Quantified quantified = (Ast.Quantified) formula;
        final Map<Ast.Variable, List<Set<Signature>>> env2 =
            new HashMap<>(env);
        for (Ast.Decl decl : quantified.decls) {
          env2.put(decl.variable, type(decl.domain, env2));
        }
        formula(quantified.body, env2);
        return;
      default:
        throw new AssertionError("unexpected " + formula.op
            + "; formula must be expanded: " + formula);
    }
  }

  private List<Set<Signature>> type(Ast.Expr expr,
      Map<Ast.Variable, List<Set<Signature>>> env) {
    switch (expr.op) {
      case RELATION:
        final Ast.Relation relation = (Ast.Relation) expr;
        final List<Signature> columns = model.columnsOpt(relation);
        if (columns == null) {
          throw new ModelException("relation '" + relation.name
              + "' is not declared in model '" + model.name + "'");
        }
        final ImmutableList.Builder<Set<Signature>> b =
            ImmutableList.builder();
        columns.forEach(c -> b.add(ImmutableSet.of(c.root())));
        return b.build();
      case VARIABLE:
        final List<Set<Signature>> type = env.get((Ast.Variable) expr);
        if (type == null) {
          throw new ModelException("unbound variable '" + expr + "'");
        }
        return type;
      case UNIV:
      case NONE:
      case IDEN:
        return Collections.nCopies(expr.arity, roots);
      case JOIN:
        final Ast.BinaryExpr join = (Ast.BinaryExpr) expr;
        final List<Set<Signature>> left = type(join.left, env);
        final List<Set<Signature>> right = type(join.right, env);
        final Set<Signature> leftLast = left.get(left.size() - 1);
        if (Collections.disjoint(leftLast, right.get(0))) {
          throw new ModelException("type error in '" + expr
              + "': last column of '" + join.left + "' is " + leftLast
              + " but first column of '" + join.right + "' is "
              + right.get(0));
        }
        return ImmutableList.<Set<Signature>>builder()
            .addAll(left.subList(0, left.size() - 1))
            .addAll(right.subList(1, right.size()))
            .build();
      case PRODUCT:
        final Ast.BinaryExpr product = (Ast.BinaryExpr) expr;
        return ImmutableList.<Set<Signature>>builder()
            .addAll(type(product.left, env))
            .addAll(type(product.right, env))
            .build();
      case UNION:
        final Ast.BinaryExpr union = (Ast.BinaryExpr) expr;
        final List<Set<Signature>> t0 = type(union.left, env);
        final List<Set<Signature>> t1 = type(union.right, env);
        final ImmutableList.Builder<Set<Signature>> b2 =
            ImmutableList.builder();
        for (int i = 0; i < t0.size(); i++) {
          b2.add(Sets.union(t0.get(i), t1.get(i)).immutableCopy());
        }
        return b2.build();
      case DIFFERENCE:
      case INTERSECTION:
        final Ast.BinaryExpr binary = (Ast.BinaryExpr) expr;
        type(binary.right, env);
        return type(binary.left, env);
      case DOMAIN_RESTRICT:
        final Ast.BinaryExpr domainRestrict = (Ast.BinaryExpr) expr;
        type(domainRestrict.left, env);
        return type(domainRestrict.right, env);
      case RANGE_RESTRICT:
        final Ast.BinaryExpr rangeRestrict = (Ast.BinaryExpr) expr;
        type(rangeRestrict.right, env);
        return type(rangeRestrict.left, env);
      case TRANSPOSE:
        final List<Set<Signature>> t = type(((Ast.UnaryExpr) expr).expr, env);
        return ImmutableList.of(t.get(1), t.get(0));
      case CLOSURE:
        final List<Set<Signature>> t2 =
            type(((Ast.UnaryExpr) expr).expr, env);
        final Set<Signature> both =
            Sets.union(t2.get(0), t2.get(1)).immutableCopy();
        return ImmutableList.of(both, both);
      default:
        throw new AssertionError("unexpected " + expr.op
            + "; expression must be expanded: " + expr);
    }
  }
}

// End TypeChecker.java
