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

import static net.hydromatic.quarry.Matchers.isTuples;
import static net.hydromatic.quarry.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.quarry.TestModels;
import net.hydromatic.quarry.ast.Ast;
import net.hydromatic.quarry.eval.Evaluator;
import net.hydromatic.quarry.instance.Instance;
import net.hydromatic.quarry.model.Command;
import net.hydromatic.quarry.model.Model;
import net.hydromatic.quarry.scope.ScopeManager;
import net.hydromatic.quarry.scope.ScopeSpec;
import net.hydromatic.quarry.scope.ScopeTable;
import net.hydromatic.quarry.scope.Translator;
import org.junit.jupiter.api.Test;

/** Tests for {@link Solver}. */
public class SolverTest {
  private static Problem problem(Model model, String commandName) {
    final Command command = model.command(commandName);
    final ScopeTable scope = ScopeManager.resolve(command.scope, model);
    Ast.Formula goal = model.goal(command);
    if (command.kind == Command.Kind.CHECK) {
      goal = ast.not(goal);
    }
    return Translator.translate(model, scope, goal, command.name);
  }

  private static Outcome solve(Problem problem, Map<Prop, Object> props) {
    return new Solver(problem, props, Tracers.empty()).solve();
  }

  @Test void testProblem() {
    final Problem problem = problem(TestModels.list(), "NonEmpty");
    assertThat(problem.pool, hasToString("[Node$0, Node$1, Node$2]"));
    // 3 atoms of Node, then a group of "next" per atom
    assertThat(problem.decisions, hasSize(6));
    assertThat(problem.constraints.get(problem.constraints.size() - 1),
        hasToString("NonEmpty: some next"));
    assertThat(problem.constraints.get(problem.constraints.size() - 1).kind,
        is(Constraint.Kind.GOAL));
  }

  @Test void testSat() {
    final Problem problem = problem(TestModels.list(), "NonEmpty");
    final Outcome outcome = solve(problem, new HashMap<>());
    assertThat(outcome.kind, is(Outcome.Kind.SAT));
    final Instance instance = outcome.instance;
    assertThat(instance, notNullValue());
    assertThat(instance.tuples("Node"), isTuples("{Node$1, Node$2}"));
    assertThat(instance.tuples("next"), isTuples("{Node$2->Node$1}"));
    for (Constraint constraint : problem.constraints) {
      assertThat(constraint.name,
          Evaluator.holds(constraint.formula, instance), is(true));
    }
    assertThat(outcome.statistics.nodes, greaterThan(0L));
  }

  /** Tests that a goal satisfiable in one scope stays satisfiable in every
   * larger scope. An acyclic list needs two nodes to have a "next". */
  @Test void testScopeMonotonicity() {
    final Model model = TestModels.list();
    final Command command = model.command("NonEmpty");
    final List<Outcome.Kind> kinds = new ArrayList<>();
    for (int n = 1; n <= 4; n++) {
      final ScopeTable scope = ScopeManager.resolve(ScopeSpec.of(n), model);
      final Problem problem =
          Translator.translate(model, scope, model.goal(command),
              command.name);
      final Outcome outcome = solve(problem, new HashMap<>());
      kinds.add(outcome.kind);
      if (outcome.kind == Outcome.Kind.SAT) {
        final Instance instance = outcome.instance;
        assertThat(instance, notNullValue());
        assertThat(instance.tuples("next").isEmpty(), is(false));
      }
    }
    assertThat(kinds, hasToString("[UNSAT, SAT, SAT, SAT]"));
  }

  @Test void testUnsat() {
    final Outcome outcome =
        solve(problem(TestModels.list(), "Cyclic"), new HashMap<>());
    assertThat(outcome.kind, is(Outcome.Kind.UNSAT));
    assertThat(outcome.instance, nullValue());
  }

  /** Tests that a goal that is false before any decision is made gives
   * "unsat" without searching. */
  @Test void testTriviallyUnsat() {
    final Model model = TestModels.pets();
    final ScopeTable scope = ScopeManager.resolve(ScopeSpec.of(3), model);
    final Problem problem =
        Translator.translate(model, scope,
            model.relation("Rex").in(model.relation("Cat")), "goal");
    final Outcome outcome = solve(problem, new HashMap<>());
    assertThat(outcome.kind, is(Outcome.Kind.UNSAT));
    assertThat(outcome.statistics.nodes, is(0L));
  }

  /** Tests that a search that runs out of budget reports "timeout", not
   * "unsat". */
  @Test void testBudget() {
    final Map<Prop, Object> props = new HashMap<>();
    Budget.ofNodes(2).apply(props);
    final Outcome outcome =
        solve(problem(TestModels.list(), "NoSelfLoop"), props);
    assertThat(outcome.kind, is(Outcome.Kind.TIMEOUT));
    assertThat(outcome.instance, nullValue());
    assertThat(outcome.statistics.nodes, is(3L));
  }

  /** Tests that symmetry breaking does not change the outcome, and does not
   * increase the work. */
  @Test void testSymmetryBreaking() {
    final Model model = TestModels.list();
    for (String name : model.commands.keySet()) {
      final Map<Prop, Object> props = new HashMap<>();
      final Outcome with = solve(problem(model, name), props);
      Prop.SYMMETRY_BREAKING.set(props, false);
      final Outcome without = solve(problem(model, name), props);
      assertThat(name, without.kind, is(with.kind));
      if (with.kind == Outcome.Kind.UNSAT) {
        assertThat(name, with.statistics.nodes,
            lessThanOrEqualTo(without.statistics.nodes));
      }
    }
  }

  @Test void testDeterministic() {
    final Model model = TestModels.pets();
    final Outcome outcome1 =
        solve(problem(model, "CatsEat"), new HashMap<>());
    final Outcome outcome2 =
        solve(problem(model, "CatsEat"), new HashMap<>());
    assertThat(outcome1.kind, is(Outcome.Kind.SAT));
    assertThat(outcome2.statistics.nodes, is(outcome1.statistics.nodes));
    assertThat(String.valueOf(outcome2.instance),
        is(String.valueOf(outcome1.instance)));
  }

  @Test void testParallel() {
    final Model model = TestModels.list();
    final Map<Prop, Object> props = new HashMap<>();
    Prop.PARALLELISM.set(props, 3);
    assertThat(solve(problem(model, "NonEmpty"), props).kind,
        is(Outcome.Kind.SAT));
    assertThat(solve(problem(model, "Cyclic"), props).kind,
        is(Outcome.Kind.UNSAT));
    assertThat(solve(problem(model, "NoSelfLoop"), props).kind,
        is(Outcome.Kind.UNSAT));
    assertThat(solve(problem(model, "OneHead"), props).kind,
        is(Outcome.Kind.SAT));

    Prop.PARALLELISM.set(props, 0);
    final Problem problem = problem(model, "NonEmpty");
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> new Solver(problem, props, Tracers.empty()));
    assertThat(e.getMessage(), is("parallelism must be positive: 0"));
  }

  @Test void testTracer() {
    final List<Instance> solutions = new ArrayList<>();
    final List<Statistics> progress =
        Collections.synchronizedList(new ArrayList<>());
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnSolution(tracer, solutions::add);
    tracer = Tracers.withOnProgress(tracer, progress::add);
    final Map<Prop, Object> props = new HashMap<>();
    Prop.PROGRESS_INTERVAL.set(props, 1L);
    final Outcome outcome =
        new Solver(problem(TestModels.list(), "NonEmpty"), props, tracer)
            .solve();
    assertThat(solutions, hasSize(1));
    assertThat(solutions.get(0), is(outcome.instance));
    assertThat((long) progress.size(), is(outcome.statistics.nodes));
  }

  @Test void testInvariantViolation() {
    final InvariantViolationException e =
        new InvariantViolationException("instance violates fact constraint"
            + " 'acyclic'", "acyclic: no n: Node | n in n.^next",
            "next: {Node$0->Node$0}\n");
    assertThat(e.constraint(), is("acyclic: no n: Node | n in n.^next"));
    assertThat(e.describeTo(new StringBuilder()),
        hasToString("Internal error: instance violates fact constraint"
            + " 'acyclic': acyclic: no n: Node | n in n.^next\n"
            + "next: {Node$0->Node$0}\n"));
  }
}

// End SolverTest.java
