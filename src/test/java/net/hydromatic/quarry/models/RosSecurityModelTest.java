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
package net.hydromatic.quarry.models;

import static net.hydromatic.quarry.Matchers.isVerdict;
import static net.hydromatic.quarry.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.util.List;
import net.hydromatic.quarry.ast.Ast;
import net.hydromatic.quarry.eval.Evaluator;
import net.hydromatic.quarry.instance.Atom;
import net.hydromatic.quarry.instance.Instance;
import net.hydromatic.quarry.instance.Tuple;
import net.hydromatic.quarry.instance.TupleSet;
import net.hydromatic.quarry.model.Model;
import net.hydromatic.quarry.model.ModelException;
import net.hydromatic.quarry.report.InstanceReporter;
import net.hydromatic.quarry.scope.ScopeManager;
import net.hydromatic.quarry.solve.Checker;
import net.hydromatic.quarry.solve.Tracers;
import net.hydromatic.quarry.solve.Verdict;
import org.junit.jupiter.api.Test;

/** Tests for {@link RosSecurityModel}. */
public class RosSecurityModelTest {
  private static Verdict execute(String commandName) {
    final Model model = RosSecurityModel.create();
    return new Checker(model, ImmutableMap.of(), Tracers.empty())
        .execute(commandName);
  }

  @Test void testStructure() {
    final Model model = RosSecurityModel.create();
    assertThat(model.signatures,
        hasToString("[Time, Component, Joystick, Wheel, Attacker, Topic,"
            + " CmdVel, Data, Event, Publish, Callback]"));
    assertThat(model.fields.get(model.fields.size() - 1),
        hasToString("Wheel.history: Data -> Time"));
    assertThat(model.commands.keySet(),
        hasToString("[NoAttackerWheelSafe, AttackerWheelUnsafe,"
            + " JoystickCommandReachesWheel]"));
    assertThat(model.command(RosSecurityModel.ATTACKER_WHEEL_UNSAFE)
        .expectsInstance(), is(true));
    assertThat(
        ScopeManager.resolve(
            model.command(RosSecurityModel.NO_ATTACKER_WHEEL_SAFE).scope,
            model),
        hasToString("Time=5 (exact), Component=3, Joystick=1 (exact),"
            + " Wheel=1 (exact), Attacker=0 (exact), Topic=3,"
            + " CmdVel=1 (exact), Data=3, Event=4"));
  }

  /** Without an attacker, every command the wheel receives comes from the
   * joystick. */
  @Test void testNoAttackerWheelSafe() {
    final Verdict verdict = execute(RosSecurityModel.NO_ATTACKER_WHEEL_SAFE);
    assertThat(verdict, isVerdict(Verdict.Kind.VERIFIED));
    assertThat(verdict.isExpected(), is(true));
    assertThat(verdict.message, containsString("bounded check"));
  }

  /** With an attacker, the wheel may receive a command that the joystick
   * never issues; the attacker publishes it to CmdVel. */
  @Test void testAttackerWheelUnsafe() {
    final Verdict verdict = execute(RosSecurityModel.ATTACKER_WHEEL_UNSAFE);
    assertThat(verdict, isVerdict(Verdict.Kind.COUNTEREXAMPLE));
    assertThat(verdict.isExpected(), is(true));
    final Instance instance = verdict.instance;
    assertThat(instance, notNullValue());

    final Model model = instance.model();
    final Ast.Expr behavior =
        model.relation("Joystick").join(model.relation("behavior"));
    final Ast.Variable p = ast.var("p");
    final Ast.Formula attackerPublishes =
        ast.some(ast.decl(p, model.relation("Publish")),
            ast.and(
                p.join(model.relation("caller"))
                    .in(model.relation("Attacker")),
                p.join(model.relation("topic"))
                    .in(model.relation("CmdVel")),
                p.join(model.relation("message")).in(behavior).not()));
    assertThat(Evaluator.holds(attackerPublishes, instance), is(true));

    // Each witness is a (time, data) pair where the wheel holds data that
    // is not in the joystick's behavior.
    assertThat(verdict.witnesses, not(empty()));
    final TupleSet allowed = Evaluator.value(behavior, instance);
    for (List<Atom> witness : verdict.witnesses) {
      assertThat(witness, hasSize(2));
      assertThat(allowed.contains(Tuple.of(witness.get(1))), is(false));
    }

    final String report = new InstanceReporter(ImmutableMap.of())
        .report(verdict);
    assertThat(report, containsString("Verdict: COUNTEREXAMPLE"));
    assertThat(report, containsString("Witnesses:"));
    assertThat(report, containsString("Trace of Time:"));
    assertThat(report, containsString("caller=Attacker$0"));
  }

  /** The model is not vacuous: the joystick's commands can reach the
   * wheel. */
  @Test void testJoystickCommandReachesWheel() {
    final Verdict verdict =
        execute(RosSecurityModel.JOYSTICK_COMMAND_REACHES_WHEEL);
    assertThat(verdict, isVerdict(Verdict.Kind.SATISFIABLE));
    final Instance instance = verdict.instance;
    assertThat(instance, notNullValue());
    final Model model = instance.model();
    assertThat(instance.tuples("history").isEmpty(), is(false));
    assertThat(
        Evaluator.holds(
            model.relation("Wheel").join(model.relation("history"))
                .join(model.relation("Time/first")).no(),
            instance),
        is(true));
  }

  @Test void testCatalog() {
    assertThat(ModelCatalog.names(), hasToString("[ros]"));
    assertThat(ModelCatalog.create(RosSecurityModel.NAME).name,
        is("RosSecurity"));
    final ModelException e = assertThrows(ModelException.class,
        () -> ModelCatalog.create("nope"));
    assertThat(e.getMessage(), is("unknown model 'nope'; available: [ros]"));
  }
}

// End RosSecurityModelTest.java
