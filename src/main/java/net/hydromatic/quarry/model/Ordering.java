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
 * Total order over the atoms of a signature.
 *
 * <p>The scope forces an ordered signature to have exactly its bound of
 * atoms. The four relations are constants, computed once per scope:
 * {@code S/first} and {@code S/last} are singletons, {@code S/next} relates
 * each atom to its successor, and {@code S/nexts} relates each atom to every
 * later atom.
 */
public class Ordering {
  public final Signature signature;
  public final Ast.Relation first;
  public final Ast.Relation last;
  public final Ast.Relation next;
  public final Ast.Relation nexts;

  Ordering(Signature signature, Ast.Relation first, Ast.Relation last,
      Ast.Relation next, Ast.Relation nexts) {
    this.signature = requireNonNull(signature, "signature");
    this.first = requireNonNull(first, "first");
    this.last = requireNonNull(last, "last");
    this.next = requireNonNull(next, "next");
    this.nexts = requireNonNull(nexts, "nexts");
  }

  /** Returns the relations, in the order first, last, next, nexts. */
  public ImmutableList<Ast.Relation> relations() {
    return ImmutableList.of(first, last, next, nexts);
  }

  /** Returns "t.next", the successor of {@code t}. */
  public Ast.Expr next(Ast.Expr t) {
    return t.join(next);
  }

  /** Returns "next.t", the predecessor of {@code t}. */
  public Ast.Expr prev(Ast.Expr t) {
    return next.join(t);
  }

  /** Returns "t.nexts", every atom after {@code t}. */
  public Ast.Expr nexts(Ast.Expr t) {
    return t.join(nexts);
  }

  /** Returns "nexts.t", every atom before {@code t}. */
  public Ast.Expr prevs(Ast.Expr t) {
    return nexts.join(t);
  }
}

// End Ordering.java
