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

/** Visits syntax trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends Ast.Node> void accept(E e) {
    e.accept(this);
  }

  // expressions

  protected void visit(Ast.Relation relation) {}

  protected void visit(Ast.Variable variable) {}

  protected void visit(Ast.ConstantExpr constantExpr) {}

  protected void visit(Ast.BinaryExpr binaryExpr) {
    binaryExpr.left.accept(this);
    binaryExpr.right.accept(this);
  }

  protected void visit(Ast.UnaryExpr unaryExpr) {
    unaryExpr.expr.accept(this);
  }

  protected void visit(Ast.FunCall funCall) {
    funCall.args.forEach(this::accept);
  }

  // formulas

  protected void visit(Ast.NaryFormula naryFormula) {
    naryFormula.formulas.forEach(this::accept);
  }

  protected void visit(Ast.Not not) {
    not.formula.accept(this);
  }

  protected void visit(Ast.BinaryFormula binaryFormula) {
    binaryFormula.left.accept(this);
    binaryFormula.right.accept(this);
  }

  protected void visit(Ast.Comparison comparison) {
    comparison.left.accept(this);
    comparison.right.accept(this);
  }

  protected void visit(Ast.MultiplicityFormula multiplicityFormula) {
    multiplicityFormula.expr.accept(this);
  }

  protected void visit(Ast.Quantified quantified) {
    quantified.decls.forEach(decl -> decl.domain.accept(this));
    quantified.body.accept(this);
  }

  protected void visit(Ast.PredCall predCall) {
    predCall.args.forEach(this::accept);
  }
}

// End Visitor.java
