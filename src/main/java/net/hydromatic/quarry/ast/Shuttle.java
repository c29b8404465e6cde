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
package net.hydromatic.quarry.ast;

import static net.hydromatic.quarry.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Visits and transforms syntax trees.
 *
 * <p>Each method returns the original node if none of its children changed.
 */
public class Shuttle {
  protected List<Ast.Expr> visitList(List<Ast.Expr> exprs) {
    final ImmutableList.Builder<Ast.Expr> list = ImmutableList.builder();
    for (Ast.Expr expr : exprs) {
      list.add(expr.accept(this));
    }
    return list.build();
  }

  // expressions

  protected Ast.Expr visit(Ast.Relation relation) {
    return relation; // leaf
  }

  protected Ast.Expr visit(Ast.Variable variable) {
    return variable; // leaf
  }

  protected Ast.Expr visit(Ast.ConstantExpr constantExpr) {
    return constantExpr; // leaf
  }

  protected Ast.Expr visit(Ast.BinaryExpr binaryExpr) {
    final Ast.Expr left = binaryExpr.left.accept(this);
    final Ast.Expr right = binaryExpr.right.accept(this);
    if (left == binaryExpr.left && right == binaryExpr.right) {
      return binaryExpr;
    }
    switch (binaryExpr.op) {
      case JOIN:
        return ast.join(left, right);
      case PRODUCT:
        return ast.product(left, right);
      case UNION:
        return ast.union(left, right);
      case DIFFERENCE:
        return ast.difference(left, right);
      case INTERSECTION:
        return ast.intersection(left, right);
      case DOMAIN_RESTRICT:
        return ast.domainRestrict(left, right);
      case RANGE_RESTRICT:
        return ast.rangeRestrict(left, right);
      default:
        throw new AssertionError("unexpected " + binaryExpr.op);
    }
  }

  protected Ast.Expr visit(Ast.UnaryExpr unaryExpr) {
    final Ast.Expr expr = unaryExpr.expr.accept(this);
    if (expr == unaryExpr.expr) {
      return unaryExpr;
    }
    return unaryExpr.op == Op.TRANSPOSE
        ? ast.transpose(expr)
        : ast.closure(expr);
  }

  protected Ast.Expr visit(Ast.FunCall funCall) {
    final List<Ast.Expr> args = visitList(funCall.args);
    if (args.equals(funCall.args)) {
      return funCall;
    }
    return ast.funCall(funCall.name, funCall.arity, args);
  }

  // formulas

  protected Ast.Formula visit(Ast.NaryFormula naryFormula) {
    final ImmutableList.Builder<Ast.Formula> b = ImmutableList.builder();
    boolean changed = false;
    for (Ast.Formula formula : naryFormula.formulas) {
      final Ast.Formula formula2 = formula.accept(this);
      changed |= formula2 != formula;
      b.add(formula2);
    }
    if (!changed) {
      return naryFormula;
    }
    return naryFormula.op == Op.AND ? ast.and(b.build()) : ast.or(b.build());
  }

  protected Ast.Formula visit(Ast.Not not) {
    final Ast.Formula formula = not.formula.accept(this);
    return formula == not.formula ? not : ast.not(formula);
  }

  protected Ast.Formula visit(Ast.BinaryFormula binaryFormula) {
    final Ast.Formula left = binaryFormula.left.accept(this);
    final Ast.Formula right = binaryFormula.right.accept(this);
    if (left == binaryFormula.left && right == binaryFormula.right) {
      return binaryFormula;
    }
    return binaryFormula.op == Op.IMPLIES
        ? ast.implies(left, right)
        : ast.iff(left, right);
  }

  protected Ast.Formula visit(Ast.Comparison comparison) {
    final Ast.Expr left = comparison.left.accept(this);
    final Ast.Expr right = comparison.right.accept(this);
    if (left == comparison.left && right == comparison.right) {
      return comparison;
    }
    return comparison.op == Op.IN ? ast.in(left, right) : ast.eq(left, right);
  }

  protected Ast.Formula visit(Ast.MultiplicityFormula multiplicityFormula) {
    final Ast.Expr expr = multiplicityFormula.expr.accept(this);
    if (expr == multiplicityFormula.expr) {
      return multiplicityFormula;
    }
    return ast.multiplicity(multiplicityFormula.quantifier, expr);
  }

  protected Ast.Formula visit(Ast.Quantified quantified) {
    final ImmutableList.Builder<Ast.Decl> decls = ImmutableList.builder();
    boolean changed = false;
    for (Ast.Decl decl : quantified.decls) {
      final Ast.Expr domain = decl.domain.accept(this);
      if (domain == decl.domain) {
        decls.add(decl);
      } else {
        decls.add(ast.decl(decl.variable, domain));
        changed = true;
      }
    }
    final Ast.Formula body = quantified.body.accept(this);
    if (!changed && body == quantified.body) {
      return quantified;
    }
    return ast.quantified(quantified.quantifier, decls.build(), body);
  }

  protected Ast.Formula visit(Ast.PredCall predCall) {
    final List<Ast.Expr> args = visitList(predCall.args);
    if (args.equals(predCall.args)) {
      return predCall;
    }
    return ast.predCall(predCall.name, args);
  }
}

// End Shuttle.java
