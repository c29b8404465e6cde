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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.quarry.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Various sub-classes of relational expressions and formulas. */
public class Ast {
  private Ast() {}

  /** Base class for all nodes (expressions and formulas). */
  public abstract static class Node {
    public final Op op;

    Node(Op op) {
      this.op = requireNonNull(op, "op");
    }

    /**
     * Converts this node into a string, inserting parentheses only where
     * operator precedence requires them.
     */
    @Override
    public final String toString() {
      // Marked final because you should override unparse, not toString
      return unparse(new StringBuilder(), 0, 0).toString();
    }

    abstract StringBuilder unparse(StringBuilder buf, int left, int right);

    /** Accepts a visitor. */
    public abstract void accept(Visitor visitor);

    /** Returns whether this node must be wrapped in parentheses. */
    final boolean needsParens(int left, int right) {
      return left > op.left || right > op.right;
    }
  }

  /** Relational expression; its value is a set of tuples of a given arity. */
  public abstract static class Expr extends Node {
    public final int arity;

    Expr(Op op, int arity) {
      super(op);
      this.arity = arity;
    }

    /** Accepts a shuttle, returning the possibly rewritten expression. */
    public abstract Expr accept(Shuttle shuttle);

    /** Returns the relational join "this.e". */
    public Expr join(Expr e) {
      return ast.join(this, e);
    }

    /** Returns the cartesian product "this->e". */
    public Expr product(Expr e) {
      return ast.product(this, e);
    }

    /** Returns the union "this + e". */
    public Expr union(Expr e) {
      return ast.union(this, e);
    }

    /** Returns the difference "this - e". */
    public Expr difference(Expr e) {
      return ast.difference(this, e);
    }

    /** Returns the intersection "this &amp; e". */
    public Expr intersection(Expr e) {
      return ast.intersection(this, e);
    }

    /** Returns the transpose "~this". */
    public Expr transpose() {
      return ast.transpose(this);
    }

    /** Returns the transitive closure "^this". */
    public Expr closure() {
      return ast.closure(this);
    }

    /** Returns the domain restriction "s &lt;: this". */
    public Expr domainRestrict(Expr s) {
      return ast.domainRestrict(s, this);
    }

    /** Returns the range restriction "this :&gt; s". */
    public Expr rangeRestrict(Expr s) {
      return ast.rangeRestrict(this, s);
    }

    /** Returns the formula "this in e". */
    public Formula in(Expr e) {
      return ast.in(this, e);
    }

    /** Returns the formula "this = e". */
    public Formula eq(Expr e) {
      return ast.eq(this, e);
    }

    public Formula some() {
      return ast.multiplicity(Quantifier.SOME, this);
    }

    public Formula no() {
      return ast.multiplicity(Quantifier.NO, this);
    }

    public Formula one() {
      return ast.multiplicity(Quantifier.ONE, this);
    }

    public Formula lone() {
      return ast.multiplicity(Quantifier.LONE, this);
    }
  }

  /** Formula; its value is true or false. */
  public abstract static class Formula extends Node {
    Formula(Op op) {
      super(op);
    }

    /** Accepts a shuttle, returning the possibly rewritten formula. */
    public abstract Formula accept(Shuttle shuttle);

    public Formula and(Formula f) {
      return ast.and(this, f);
    }

    public Formula or(Formula f) {
      return ast.or(this, f);
    }

    public Formula implies(Formula f) {
      return ast.implies(this, f);
    }

    public Formula iff(Formula f) {
      return ast.iff(this, f);
    }

    public Formula not() {
      return ast.not(this);
    }
  }

  /**
   * Leaf relation: a signature's extent, a field, or a relation generated by
   * the scope (such as an ordering's successor relation).
   *
   * <p>Two relations are equal only if they are the same object.
   */
  public static class Relation extends Expr {
    public final String name;

    Relation(String name, int arity) {
      super(Op.RELATION, arity);
      this.name = requireNonNull(name, "name");
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      return buf.append(name);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Variable bound by a quantifier or a predicate parameter. Its value is a
   * single atom.
   */
  public static class Variable extends Expr {
    public final String name;

    Variable(String name) {
      super(Op.VARIABLE, 1);
      this.name = requireNonNull(name, "name");
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      return buf.append(name);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Constant expression: "univ", "none" or "iden". */
  public static class ConstantExpr extends Expr {
    ConstantExpr(Op op, int arity) {
      super(op, arity);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      return buf.append(op.str);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Expression with two arguments, such as join or union. */
  public static class BinaryExpr extends Expr {
    public final Expr left;
    public final Expr right;

    BinaryExpr(Op op, Expr left, Expr right, int arity) {
      super(op, arity);
      this.left = requireNonNull(left, "left");
      this.right = requireNonNull(right, "right");
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      if (needsParens(left, right)) {
        return unparse(buf.append('('), 0, 0).append(')');
      }
      this.left.unparse(buf, left, op.left);
      buf.append(op.str);
      return this.right.unparse(buf, op.right, right);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Transpose or transitive closure of a binary expression. */
  public static class UnaryExpr extends Expr {
    public final Expr expr;

    UnaryExpr(Op op, Expr expr) {
      super(op, 2);
      this.expr = requireNonNull(expr, "expr");
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      if (needsParens(left, right)) {
        return unparse(buf.append('('), 0, 0).append(')');
      }
      return expr.unparse(buf.append(op.str), op.right, right);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Call to a named function; expanded before evaluation. */
  public static class FunCall extends Expr {
    public final String name;
    public final ImmutableList<Expr> args;

    FunCall(String name, int arity, ImmutableList<Expr> args) {
      super(Op.FUN_CALL, arity);
      this.name = requireNonNull(name, "name");
      this.args = requireNonNull(args, "args");
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      return unparseCall(buf, name, args);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Declaration "x: domain" in a quantifier or a parameter list. */
  public static class Decl {
    public final Variable variable;
    public final Expr domain;

    Decl(Variable variable, Expr domain) {
      this.variable = requireNonNull(variable, "variable");
      this.domain = requireNonNull(domain, "domain");
    }

    @Override
    public String toString() {
      return variable.name + ": " + domain;
    }
  }

  /**
   * Formula that has a variable number of arguments ("and" or "or"). An empty
   * "and" is true; an empty "or" is false.
   */
  public static class NaryFormula extends Formula {
    public final ImmutableList<Formula> formulas;

    NaryFormula(Op op, ImmutableList<Formula> formulas) {
      super(op);
      this.formulas = requireNonNull(formulas, "formulas");
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      switch (formulas.size()) {
        case 0:
          return buf.append(op.emptyName);
        case 1:
          return formulas.get(0).unparse(buf, left, right);
      }
      if (needsParens(left, right)) {
        return unparse(buf.append('('), 0, 0).append(')');
      }
      for (int i = 0; i < formulas.size(); i++) {
        final Formula formula = formulas.get(i);
        if (i > 0) {
          buf.append(op.str);
        }
        formula.unparse(
            buf,
            i == 0 ? left : op.right,
            i == formulas.size() - 1 ? right : op.left);
      }
      return buf;
    }

    @Override
    public Formula accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Negation. */
  public static class Not extends Formula {
    public final Formula formula;

    Not(Formula formula) {
      super(Op.NOT);
      this.formula = requireNonNull(formula, "formula");
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      if (needsParens(left, right)) {
        return unparse(buf.append('('), 0, 0).append(')');
      }
      return formula.unparse(buf.append(op.str), op.right, right);
    }

    @Override
    public Formula accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Implication or equivalence. */
  public static class BinaryFormula extends Formula {
    public final Formula left;
    public final Formula right;

    BinaryFormula(Op op, Formula left, Formula right) {
      super(op);
      this.left = requireNonNull(left, "left");
      this.right = requireNonNull(right, "right");
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      if (needsParens(left, right)) {
        return unparse(buf.append('('), 0, 0).append(')');
      }
      this.left.unparse(buf, left, op.left);
      buf.append(op.str);
      return this.right.unparse(buf, op.right, right);
    }

    @Override
    public Formula accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Subset ("in") or equality comparison of two expressions. */
  public static class Comparison extends Formula {
    public final Expr left;
    public final Expr right;

    Comparison(Op op, Expr left, Expr right) {
      super(op);
      this.left = requireNonNull(left, "left");
      this.right = requireNonNull(right, "right");
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      if (needsParens(left, right)) {
        return unparse(buf.append('('), 0, 0).append(')');
      }
      this.left.unparse(buf, left, op.left);
      buf.append(op.str);
      return this.right.unparse(buf, op.right, right);
    }

    @Override
    public Formula accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Multiplicity test on an expression, such as "some e" or "lone e". */
  public static class MultiplicityFormula extends Formula {
    public final Quantifier quantifier;
    public final Expr expr;

    MultiplicityFormula(Quantifier quantifier, Expr expr) {
      super(Op.MULTIPLICITY);
      this.quantifier = requireNonNull(quantifier, "quantifier");
      this.expr = requireNonNull(expr, "expr");
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      if (needsParens(left, right)) {
        return unparse(buf.append('('), 0, 0).append(')');
      }
      buf.append(quantifier.keyword).append(' ');
      return expr.unparse(buf, op.right, right);
    }

    @Override
    public Formula accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Quantified formula, such as "all x: S, y: T | body".
   *
   * <p>The domain of each declaration may refer to variables declared to its
   * left. For {@link Quantifier#ONE} and {@link Quantifier#LONE}, the count is
   * over combinations of all declared variables.
   */
  public static class Quantified extends Formula {
    public final Quantifier quantifier;
    public final ImmutableList<Decl> decls;
    public final Formula body;

    Quantified(Quantifier quantifier, ImmutableList<Decl> decls, Formula body) {
      super(Op.QUANTIFIED);
      this.quantifier = requireNonNull(quantifier, "quantifier");
      this.decls = requireNonNull(decls, "decls");
      this.body = requireNonNull(body, "body");
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      if (needsParens(left, right)) {
        return unparse(buf.append('('), 0, 0).append(')');
      }
      buf.append(quantifier.keyword).append(' ');
      for (int i = 0; i < decls.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        final Decl decl = decls.get(i);
        buf.append(decl.variable.name).append(": ");
        decl.domain.unparse(buf, 0, 0);
      }
      buf.append(" | ");
      return body.unparse(buf, 0, 0);
    }

    @Override
    public Formula accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Call to a named predicate; expanded before evaluation. */
  public static class PredCall extends Formula {
    public final String name;
    public final ImmutableList<Expr> args;

    PredCall(String name, ImmutableList<Expr> args) {
      super(Op.PRED_CALL);
      this.name = requireNonNull(name, "name");
      this.args = requireNonNull(args, "args");
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      return unparseCall(buf, name, args);
    }

    @Override
    public Formula accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  static StringBuilder unparseCall(
      StringBuilder buf, String name, List<Expr> args) {
    buf.append(name).append('[');
    for (int i = 0; i < args.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      args.get(i).unparse(buf, 0, 0);
    }
    return buf.append(']');
  }
}

// End Ast.java
