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
import static net.hydromatic.quarry.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import net.hydromatic.quarry.ast.Ast;

/** Named, parameterized relational expression. */
public class Function {
  public final String name;
  public final ImmutableList<Ast.Decl> params;
  public final Ast.Expr body;

  Function(String name, ImmutableList<Ast.Decl> params, Ast.Expr body) {
    this.name = requireNonNull(name, "name");
    this.params = requireNonNull(params, "params");
    this.body = requireNonNull(body, "body");
  }

  @Override
  public String toString() {
    return "fun " + name + params + " { " + body + " }";
  }

  /** Returns a call to this function. */
  public Ast.Expr call(Ast.Expr... args) {
    return ast.funCall(name, body.arity, Arrays.asList(args));
  }
}

// End Function.java
