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
import static net.hydromatic.quarry.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.quarry.ast.Ast;
import net.hydromatic.quarry.ast.Op;
import net.hydromatic.quarry.ast.Quantifier;
import net.hydromatic.quarry.eval.Evaluator;
import net.hydromatic.quarry.instance.Atom;
import net.hydromatic.quarry.model.Command;
import net.hydromatic.quarry.model.Model;
import net.hydromatic.quarry.scope.ScopeManager;
import net.hydromatic.quarry.scope.ScopeTable;
import net.hydromatic.quarry.scope.Translator;
import net.hydromatic.quarry.util.QuarryException;

/**
 * Executes the commands of a model.
 *
 * <p>To check an assertion, searches for an instance of the facts and the
 * negated assertion; an instance is a counterexample. To run a predicate,
 * searches for an instance of the facts and the predicate.
 */
public class Checker {
  private final Model model;
  private final ImmutableMap<Prop, Object> props;
  private final Tracer tracer;

  public Checker(Model model, Map<Prop, Object> props, Tracer tracer) {
    this.model = requireNonNull(model, "model");
    this.props = ImmutableMap.copyOf(props);
    this.tracer = requireNonNull(tracer, "tracer");
  }

  /** Executes a command of the model, looked up by name. */
  public Verdict execute(String commandName) {
    return execute(model.command(commandName));
  }

  /** Executes a command, dispatching on its kind.
   *
   * @throws net.hydromatic.quarry.model.ModelException if the command's
   * target is not valid
   * @throws net.hydromatic.quarry.scope.ScopeException if its scope is
   * inconsistent with the model */
  public Verdict execute(Command command) {
    switch (command.kind) {
      case CHECK:
        return check(command);
      case RUN:
        return run(command);
      default:
        throw new AssertionError(command.kind);
    }
  }

  /**
   * Executes every command of the model, in declaration order.
   *
   * <p>If a command fails with a model or scope error and the tracer
   * handles the error, continues with the next command; otherwise throws.
   * An {@link InvariantViolationException} is never passed to the tracer;
   * it stops the run.
   */
  public List<Verdict> executeAll() {
    final ImmutableList.Builder<Verdict> verdicts = ImmutableList.builder();
    for (Command command : model.commands.values()) {
      try {
        verdicts.add(execute(command));
      } catch (RuntimeException e) {
        if (!(e instanceof QuarryException)
            || e instanceof InvariantViolationException
            || !tracer.onException((QuarryException) e)) {
          throw e;
        }
      }
    }
    return verdicts.build();
  }

  /** Searches for a counterexample to the assertion that a "check"
   * command names. */
  public Verdict check(Command command) {
    checkKind(command, Command.Kind.CHECK);
    tracer.onCommand(command);
    final ScopeTable scope = ScopeManager.resolve(command.scope, model);
    tracer.onScope(command, scope);
    final Ast.Formula assertion = model.goal(command);
    final Outcome outcome = solve(scope, ast.not(assertion), command);
    final Verdict verdict;
    switch (outcome.kind) {
      case SAT:
        List<List<Atom>> witnesses = ImmutableList.of();
        if (assertion.op == Op.QUANTIFIED
            && ((Ast.Quantified) assertion).quantifier == Quantifier.ALL) {
          witnesses = Evaluator.witnesses((Ast.Quantified) assertion,
              requireNonNull(outcome.instance));
        }
        verdict = new Verdict(command, Verdict.Kind.COUNTEREXAMPLE,
            outcome.instance, scope, outcome.statistics, witnesses);
        break;
      case UNSAT:
        verdict = new Verdict(command, Verdict.Kind.VERIFIED, null, scope,
            outcome.statistics, ImmutableList.of());
        break;
      default:
        verdict = timeout(command, scope, outcome);
        break;
    }
    tracer.onVerdict(verdict);
    return verdict;
  }

  /** Searches for an instance of the predicate that a "run" command
   * names. */
  public Verdict run(Command command) {
    checkKind(command, Command.Kind.RUN);
    tracer.onCommand(command);
    final ScopeTable scope = ScopeManager.resolve(command.scope, model);
    tracer.onScope(command, scope);
    final Outcome outcome = solve(scope, model.goal(command), command);
    final Verdict verdict;
    switch (outcome.kind) {
      case SAT:
        verdict = new Verdict(command, Verdict.Kind.SATISFIABLE,
            outcome.instance, scope, outcome.statistics, ImmutableList.of());
        break;
      case UNSAT:
        verdict = new Verdict(command, Verdict.Kind.UNSATISFIABLE, null,
            scope, outcome.statistics, ImmutableList.of());
        break;
      default:
        verdict = timeout(command, scope, outcome);
        break;
    }
    tracer.onVerdict(verdict);
    return verdict;
  }

  private Outcome solve(ScopeTable scope, Ast.Formula goal,
      Command command) {
    final Problem problem =
        Translator.translate(model, scope, goal, command.name);
    return new Solver(problem, props, tracer).solve();
  }

  private static Verdict timeout(Command command, ScopeTable scope,
      Outcome outcome) {
    return new Verdict(command, Verdict.Kind.TIMEOUT, null, scope,
        outcome.statistics, ImmutableList.of());
  }

  private static void checkKind(Command command, Command.Kind kind) {
    if (command.kind != kind) {
      throw new IllegalArgumentException("command '" + command.name
          + "' is not a '" + kind.keyword + "' command");
    }
  }
}

// End Checker.java
