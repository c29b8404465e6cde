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
package net.hydromatic.quarry.solve;

import static java.util.Objects.requireNonNull;

import net.hydromatic.quarry.ast.Ast;
import org.apache.calcite.util.ImmutableBitSet;

/** Formula that every instance of a {@link Problem} must satisfy. */
public class Constraint {
  /** Position in {@link Problem#constraints}. */
  public final int id;
  public final String name;
  public final Kind kind;
  /** Expanded formula. */
  public final Ast.Formula formula;
  /** Ordinals of the relations that the formula references. */
  public final ImmutableBitSet relations;

  public Constraint(int id, String name, Kind kind, Ast.Formula formula,
      ImmutableBitSet relations) {
    this.id = id;
    this.name = requireNonNull(name, "name");
    this.kind = requireNonNull(kind, "kind");
    this.formula = requireNonNull(formula, "formula");
    this.relations = requireNonNull(relations, "relations");
  }

  @Override
  public String toString() {
    return name + ": " + formula;
  }

  /** Where a constraint comes from. */
  public enum Kind {
    /** Generated from the declarations of signatures and fields. */
    DECLARATION,
    /** A fact of the model. */
    FACT,
    /** The formula that the command is looking for an instance of. */
    GOAL
  }
}

// End Constraint.java
