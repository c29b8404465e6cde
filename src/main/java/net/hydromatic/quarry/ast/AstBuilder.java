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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.quarry.model.ModelException;

/**
 * Builds parse tree nodes.
 *
 * <p>Every factory method checks arities, and throws {@link ModelException} if
 * the operands cannot be combined.
 */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient
   * for use via 'import static'.
   */
  ast;

  private static final Ast.ConstantExpr UNIV =
      new Ast.ConstantExpr(Op.UNIV, 1);
  private static final Ast.ConstantExpr IDEN =
      new Ast.ConstantExpr(Op.IDEN, 2);

  // leaves

  /** Creates a relation. */
  public Ast.Relation relation(String name, int arity) {
    checkArgument(arity > 0, "arity must be positive: %s", arity);
    return new Ast.Relation(name, arity);
  }

  /** Creates a variable. */
  public Ast.Variable var(String name) {
    return new Ast.Variable(name);
  }

  /** Returns the unary relation containing every atom. */
  public Ast.Expr univ() {
    return UNIV;
  }

  /** Returns the identity relation over every atom. */
  public Ast.Expr iden() {
    return IDEN;
  }

  /** Returns the empty relation of a given arity. */
  public Ast.Expr none(int arity) {
    checkArgument(arity > 0, "arity must be positive: %s", arity);
    return new Ast.ConstantExpr(Op.NONE, arity);
  }

  // expressions

  public Ast.Expr join(Ast.Expr left, Ast.Expr right) {
    final int arity = left.arity + right.arity - 2;
    if (arity < 1) {
      throw new ModelException(
          "join of '" + left + "' and '" + right + "' has arity 0");
    }
    return new Ast.BinaryExpr(Op.JOIN, left, right, arity);
  }

  /** Joins a sequence of expressions, left to right. */
  public Ast.Expr join(Ast.Expr e0, Ast.Expr e1, Ast.Expr... rest) {
    Ast.Expr e = join(e0, e1);
    for (Ast.Expr e2 : rest) {
      e = join(e, e2);
    }
    return e;
  }

  public Ast.Expr product(Ast.Expr left, Ast.Expr right) {
    return new Ast.BinaryExpr(
        Op.PRODUCT, left, right, left.arity + right.arity);
  }

  public Ast.Expr union(Ast.Expr left, Ast.Expr right) {
    return sameArity(Op.UNION, left, right);
  }

  public Ast.Expr difference(Ast.Expr left, Ast.Expr right) {
    return sameArity(Op.DIFFERENCE, left, right);
  }

  public Ast.Expr intersection(Ast.Expr left, Ast.Expr right) {
    return sameArity(Op.INTERSECTION, left, right);
  }

  private Ast.Expr sameArity(Op op, Ast.Expr left, Ast.Expr right) {
    checkSameArity(op, left, right);
    return new Ast.BinaryExpr(op, left, right, left.arity);
  }

  private static void checkSameArity(Op op, Ast.Expr left, Ast.Expr right) {
    if (left.arity != right.arity) {
      throw new ModelException("arity mismatch in '" + op.str.trim()
          + "': '" + left + "' has arity " + left.arity + ", '" + right
          + "' has arity " + right.arity);
    }
  }

  /** Creates "s &lt;: r", the tuples of {@code r} whose first atom is in
   * {@code s}. */
  public Ast.Expr domainRestrict(Ast.Expr s, Ast.Expr r) {
    checkUnary(s, "domain restriction");
    return new Ast.BinaryExpr(Op.DOMAIN_RESTRICT, s, r, r.arity);
  }

  /** Creates "r :&gt; s", the tuples of {@code r} whose last atom is in
   * {@code s}. */
  public Ast.Expr rangeRestrict(Ast.Expr r, Ast.Expr s) {
    checkUnary(s, "range restriction");
    return new Ast.BinaryExpr(Op.RANGE_RESTRICT, r, s, r.arity);
  }

  public Ast.Expr transpose(Ast.Expr e) {
    checkBinary(e, "transpose");
    return new Ast.UnaryExpr(Op.TRANSPOSE, e);
  }

  public Ast.Expr closure(Ast.Expr e) {
    checkBinary(e, "closure");
    return new Ast.UnaryExpr(Op.CLOSURE, e);
  }

  private static void checkUnary(Ast.Expr e, String context) {
    if (e.arity != 1) {
      throw new ModelException(context + " requires a set, but '" + e
          + "' has arity " + e.arity);
    }
  }

  private static void checkBinary(Ast.Expr e, String context) {
    if (e.arity != 2) {
      throw new ModelException(context + " requires a binary relation, but '"
          + e + "' has arity " + e.arity);
    }
  }

  /** Creates a call to a function whose body has a given arity. */
  public Ast.Expr funCall(String name, int arity,
      List<? extends Ast.Expr> args) {
    return new Ast.FunCall(name, arity, ImmutableList.copyOf(args));
  }

  // formulas

  public Ast.Formula in(Ast.Expr left, Ast.Expr right) {
    checkSameArity(Op.IN, left, right);
    return new Ast.Comparison(Op.IN, left, right);
  }

  public Ast.Formula eq(Ast.Expr left, Ast.Expr right) {
    checkSameArity(Op.EQ, left, right);
    return new Ast.Comparison(Op.EQ, left, right);
  }

  public Ast.Formula multiplicity(Quantifier quantifier, Ast.Expr e) {
    checkArgument(quantifier != Quantifier.ALL,
        "'all' is not a multiplicity");
    return new Ast.MultiplicityFormula(quantifier, e);
  }

  /** Returns the formula that is always true (an empty "and"). */
  public Ast.Formula trueFormula() {
    return new Ast.NaryFormula(Op.AND, ImmutableList.of());
  }

  /** Returns the formula that is always false (an empty "or"). */
  public Ast.Formula falseFormula() {
    return new Ast.NaryFormula(Op.OR, ImmutableList.of());
  }

  public Ast.Formula and(Ast.Formula... formulas) {
    return and(Arrays.asList(formulas));
  }

  /** Creates a conjunction, flattening nested conjunctions. */
  public Ast.Formula and(Iterable<? extends Ast.Formula> formulas) {
    return nary(Op.AND, formulas);
  }

  public Ast.Formula or(Ast.Formula... formulas) {
    return or(Arrays.asList(formulas));
  }

  /** Creates a disjunction, flattening nested disjunctions. */
  public Ast.Formula or(Iterable<? extends Ast.Formula> formulas) {
    return nary(Op.OR, formulas);
  }

  private Ast.Formula nary(Op op, Iterable<? extends Ast.Formula> formulas) {
    final ImmutableList.Builder<Ast.Formula> b = ImmutableList.builder();
    for (Ast.Formula formula : formulas) {
      if (formula.op == op) {
        b.addAll(((Ast.NaryFormula) formula).formulas);
      } else {
        b.add(formula);
      }
    }
    return new Ast.NaryFormula(op, b.build());
  }

  public Ast.Formula not(Ast.Formula formula) {
    return new Ast.Not(formula);
  }

  public Ast.Formula implies(Ast.Formula left, Ast.Formula right) {
    return new Ast.BinaryFormula(Op.IMPLIES, left, right);
  }

  public Ast.Formula iff(Ast.Formula left, Ast.Formula right) {
    return new Ast.BinaryFormula(Op.IFF, left, right);
  }

  public Ast.Decl decl(Ast.Variable variable, Ast.Expr domain) {
    checkUnary(domain, "declaration of '" + variable.name + "'");
    return new Ast.Decl(variable, domain);
  }

  public Ast.Formula quantified(Quantifier quantifier,
      List<Ast.Decl> decls, Ast.Formula body) {
    checkArgument(!decls.isEmpty(), "quantifier must declare a variable");
    return new Ast.Quantified(quantifier, ImmutableList.copyOf(decls), body);
  }

  public Ast.Formula all(Ast.Decl decl, Ast.Formula body) {
    return quantified(Quantifier.ALL, ImmutableList.of(decl), body);
  }

  public Ast.Formula all(Ast.Decl decl0, Ast.Decl decl1, Ast.Formula body) {
    return quantified(Quantifier.ALL, ImmutableList.of(decl0, decl1), body);
  }

  public Ast.Formula some(Ast.Decl decl, Ast.Formula body) {
    return quantified(Quantifier.SOME, ImmutableList.of(decl), body);
  }

  public Ast.Formula some(Ast.Decl decl0, Ast.Decl decl1, Ast.Formula body) {
    return quantified(Quantifier.SOME, ImmutableList.of(decl0, decl1), body);
  }

  public Ast.Formula no(Ast.Decl decl, Ast.Formula body) {
    return quantified(Quantifier.NO, ImmutableList.of(decl), body);
  }

  public Ast.Formula one(Ast.Decl decl, Ast.Formula body) {
    return quantified(Quantifier.ONE, ImmutableList.of(decl), body);
  }

  public Ast.Formula lone(Ast.Decl decl, Ast.Formula body) {
    return quantified(Quantifier.LONE, ImmutableList.of(decl), body);
  }

  public Ast.Formula predCall(String name, List<? extends Ast.Expr> args) {
    return new Ast.PredCall(name, ImmutableList.copyOf(args));
  }
}

// End AstBuilder.java
