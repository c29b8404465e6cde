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

import net.hydromatic.quarry.ast.Ast;
import net.hydromatic.quarry.model.ModelException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Immutable binding of quantified variables to atoms.
 *
 * <p>Each binding is a link to its parent, so binding a variable costs
 * constant time and never affects enclosing environments.
 */
public final class Env {
  /** Environment that binds no variables. */
  public static final Env EMPTY = new Env(null, null, -1);

  private final @Nullable Env parent;
  private final Ast.@Nullable Variable variable;
  private final int atom;

  private Env(@Nullable Env parent, Ast.@Nullable Variable variable,
      int atom) {
    this.parent = parent;
    this.variable = variable;
    this.atom = atom;
  }

  /** Returns an environment that also binds {@code variable}. */
  public Env bind(Ast.Variable variable, int atom) {
    return new Env(this, requireNonNull(variable, "variable"), atom);
  }

  /** Returns the index of the atom bound to a variable. */
  public int get(Ast.Variable variable) {
    for (Env e = this; e != null; e = e.parent) {
      if (e.variable == variable) {
        return e.atom;
      }
    }
    throw new ModelException("unbound variable '" + variable + "'");
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("{");
    for (Env e = this; e.variable != null; e = requireNonNull(e.parent)) {
      if (b.length() > 1) {
        b.append(", ");
      }
      b.append(e.variable.name).append('=').append(e.atom);
    }
    return b.append('}').toString();
  }
}

// End Env.java
