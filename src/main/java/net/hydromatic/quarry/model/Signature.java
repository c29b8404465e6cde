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

import net.hydromatic.quarry.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Signature: a named set of atoms in a single-inheritance hierarchy.
 *
 * <p>The signature's extent is the unary relation {@link #relation}, which
 * has the same name as the signature. An atom of a sub-signature is also in
 * the extent of every ancestor.
 */
public class Signature {
  public final String name;
  public final @Nullable Signature parent;
  public final boolean isAbstract;
  public final Multiplicity multiplicity;
  public final Ast.Relation relation;
  /** Position in the model's list of signatures. */
  public final int ordinal;

  Signature(String name, @Nullable Signature parent, boolean isAbstract,
      Multiplicity multiplicity, Ast.Relation relation, int ordinal) {
    this.name = requireNonNull(name, "name");
    this.parent = parent;
    this.isAbstract = isAbstract;
    this.multiplicity = requireNonNull(multiplicity, "multiplicity");
    this.relation = requireNonNull(relation, "relation");
    this.ordinal = ordinal;
  }

  @Override
  public String toString() {
    return name;
  }

  /** Returns whether this signature has no parent. */
  public boolean isTopLevel() {
    return parent == null;
  }

  /** Returns the top-level ancestor of this signature (or itself). */
  public Signature root() {
    Signature s = this;
    while (s.parent != null) {
      s = s.parent;
    }
    return s;
  }

  /** Returns whether this signature is {@code sig} or a descendant of it. */
  public boolean isSubtypeOf(Signature sig) {
    for (Signature s = this; s != null; s = s.parent) {
      if (s == sig) {
        return true;
      }
    }
    return false;
  }

  /** Returns the signature's extent, for use in expressions. */
  public Ast.Expr expr() {
    return relation;
  }
}

// End Signature.java
