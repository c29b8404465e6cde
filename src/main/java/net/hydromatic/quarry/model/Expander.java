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
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.quarry.ast.Ast;
import net.hydromatic.quarry.ast.Shuttle;

/**
 * Shuttle that inlines calls to predicates and functions, substituting
 * arguments for parameters.
 *
 * <p>The result contains no {@link Ast.PredCall} or {@link Ast.FunCall}. A
 * call to an unknown predicate or function, a call with the wrong number of
 * arguments, and a recursive chain of calls all throw {@link ModelException}.
 */
public class Expander extends Shuttle {
  private final Model model;
  private final Map<Ast.Variable, Ast.Expr> substitution;
  private final Deque<String> stack;

  private Expander(Model model, Map<Ast.Variable, Ast.Expr> substitution,
      Deque<String> stack) {
    this.model = requireNonNull(model, "model");
    this.substitution = requireNonNull(substitution, "substitution");
    this.stack = requireNonNull(stack, "stack");
  }

  /** Creates an Expander. */
  public static Expander create(Model model) {
    return new Expander(model, new HashMap<>(), new ArrayDeque<>());
  }

  public Ast.Formula expand(Ast.Formula formula) {
    return formula.accept(this);
  }

  public Ast.Expr expand(Ast.Expr expr) {
    return expr.accept(this);
  }

  @Override
  protected Ast.Expr visit(Ast.Variable variable) {
    return substitution.getOrDefault(variable, variable);
  }

  @Override
  protected Ast.Formula visit(Ast.PredCall predCall) {
    final Predicate predicate = model.predicates.get(predCall.name);
    if (predicate == null) {
      throw new ModelException("unknown predicate '" + predCall.name + "'");
    }
    final Expander expander =
        push(predCall.name, predicate.params, predCall.args);
    try {
      return predicate.body.accept(expander);
    } finally {
      stack.pop();
    }
  }

  @Override
  protected Ast.Expr visit(Ast.FunCall funCall) {
    final Function function = model.functions.get(funCall.name);
    if (function == null) {
      throw new ModelException("unknown function '" + funCall.name + "'");
    }
    final Expander expander =
        push(funCall.name, function.params, funCall.args);
    try {
      return function.body.accept(expander);
    } finally {
      stack.pop();
    }
  }

  /** Checks a call, then returns an expander that binds the parameters of the
   * called definition to the arguments. */
  private Expander push(String name, ImmutableList<Ast.Decl> params,
      List<Ast.Expr> args) {
    if (params.size() != args.size()) {
      throw new ModelException("'" + name + "' expects " + params.size()
          + " argument(s) but was given " + args.size());
    }
    if (stack.contains(name)) {
      final StringBuilder b = new StringBuilder();
      stack.descendingIterator()
          .forEachRemaining(s -> b.append(s).append(" -> "));
      throw new ModelException("recursive definition: " + b + name);
    }
    final List<Ast.Expr> args2 = visitList(args);
    final Map<Ast.Variable, Ast.Expr> substitution2 = new HashMap<>();
    for (int i = 0; i < params.size(); i++) {
      final Ast.Expr arg = args2.get(i);
      if (arg.arity != 1) {
        throw new ModelException("argument '" + arg + "' of '" + name
            + "' must be a set, but has arity " + arg.arity);
      }
      substitution2.put(params.get(i).variable, arg);
    }
    stack.push(name);
    return new Expander(model, substitution2, stack);
  }
}

// End Expander.java
