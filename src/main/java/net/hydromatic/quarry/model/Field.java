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
import net.hydromatic.quarry.ast.Ast;

/**
 * Field declared in a signature.
 *
 * <p>A field is a relation whose first column is its owner signature. For
 * example, {@code sig Wheel { history: Data -> Time }} declares a relation of
 * arity 3 with columns (Wheel, Data, Time).
 */
public class Field {
  public final String name;
  public final Signature owner;
  /** Column signatures, starting with {@link #owner}. */
  public final ImmutableList<Signature> columns;
  /** Bound on the number of tuples for each prefix (all columns but the
   * last). */
  public final Multiplicity multiplicity;
  public final Ast.Relation relation;

  Field(String name, ImmutableList<Signature> columns,
      Multiplicity multiplicity, Ast.Relation relation) {
    this.name = requireNonNull(name, "name");
    this.columns = requireNonNull(columns, "columns");
    this.owner = columns.get(0);
    this.multiplicity = requireNonNull(multiplicity, "multiplicity");
    this.relation = requireNonNull(relation, "relation");
  }

  @Override
  public String toString() {
    final StringBuilder b =
        new StringBuilder(owner.name).append('.').append(name).append(": ");
    final int last = columns.size() - 1;
    for (int i = 1; i <= last; i++) {
      if (i > 1) {
        b.append(" -> ");
      }
      if (i == last && (last == 1 || multiplicity != Multiplicity.SET)) {
        b.append(multiplicity.keyword).append(' ');
      }
      b.append(columns.get(i).name);
    }
    return b.toString();
  }

  public int arity() {
    return columns.size();
  }

  /** Returns the last column. */
  public Signature target() {
    return columns.get(columns.size() - 1);
  }

  /** Returns the field as an expression. */
  public Ast.Expr expr() {
    return relation;
  }
}

// End Field.java
