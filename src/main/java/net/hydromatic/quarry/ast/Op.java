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

/**
 * Operator (or type of node), with its left and right precedence and print
 * name.
 *
 * <p>A node is printed in parentheses if the precedence of the context on
 * either side exceeds the node's own precedence on that side. Left-associative
 * operators have {@code left < right}; right-associative operators, such as
 * {@link #IMPLIES}, have {@code left > right}.
 */
public enum Op {
  // formulas
  OR(1, 2, " || ", "false"),
  IFF(3, 4, " <=> ", ""),
  IMPLIES(6, 5, " => ", ""),
  AND(7, 8, " && ", "true"),
  NOT(10, 10, "!", ""),
  IN(11, 12, " in ", ""),
  EQ(11, 12, " = ", ""),
  MULTIPLICITY(13, 13, "", ""),
  QUANTIFIED(0, 0, "", ""),
  PRED_CALL(100, 100, "", ""),

  // expressions
  UNION(21, 22, " + ", ""),
  DIFFERENCE(21, 22, " - ", ""),
  INTERSECTION(23, 24, " & ", ""),
  PRODUCT(25, 26, "->", ""),
  DOMAIN_RESTRICT(27, 28, " <: ", ""),
  RANGE_RESTRICT(27, 28, " :> ", ""),
  JOIN(31, 32, ".", ""),
  TRANSPOSE(33, 33, "~", ""),
  CLOSURE(33, 33, "^", ""),
  FUN_CALL(100, 100, "", ""),

  // leaves
  RELATION(100, 100, "", ""),
  VARIABLE(100, 100, "", ""),
  UNIV(100, 100, "univ", ""),
  NONE(100, 100, "none", ""),
  IDEN(100, 100, "iden", "");

  final int left;
  final int right;
  public final String str;
  final String emptyName;

  Op(int left, int right, String str, String emptyName) {
    this.left = left;
    this.right = right;
    this.str = str;
    this.emptyName = emptyName;
  }

  /** Returns whether this operator combines two relational expressions. */
  public boolean isBinaryExpr() {
    switch (this) {
      case UNION:
      case DIFFERENCE:
      case INTERSECTION:
      case PRODUCT:
      case DOMAIN_RESTRICT:
      case RANGE_RESTRICT:
      case JOIN:
        return true;
      default:
        return false;
    }
  }
}

// End Op.java
