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
package net.hydromatic.quarry.report;

import static net.hydromatic.quarry.TestModels.atoms;
import static net.hydromatic.quarry.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableMap;
import net.hydromatic.quarry.TestModels;
import net.hydromatic.quarry.instance.AtomPool;
import net.hydromatic.quarry.instance.Instance;
import net.hydromatic.quarry.instance.RelationStore;
import net.hydromatic.quarry.instance.TupleSet;
import net.hydromatic.quarry.model.Model;
import net.hydromatic.quarry.model.Multiplicity;
import net.hydromatic.quarry.model.Signature;
import net.hydromatic.quarry.scope.ScopeManager;
import net.hydromatic.quarry.scope.ScopeSpec;
import net.hydromatic.quarry.scope.ScopeTable;
import net.hydromatic.quarry.scope.Translator;
import net.hydromatic.quarry.solve.Checker;
import net.hydromatic.quarry.solve.Prop;
import net.hydromatic.quarry.solve.Tracers;
import net.hydromatic.quarry.solve.Verdict;
import org.apache.calcite.util.ImmutableBitSet;
import org.junit.jupiter.api.Test;

/** Tests for {@link InstanceReporter}. */
public class InstanceReporterTest {
  /**
   * Returns an instance of a model of colored events over ordered time.
   *
   * <pre>
   * open util/ordering[Time]
   * sig Time {}
   * sig Event { at: one Time, color: one Color }
   * sig Color {}
   * </pre>
   *
   * <p>In scope 2, Event$0 happens at Time$0 and Event$1 at Time$1, and
   * both are colored Color$0.
   */
  private static Instance trafficInstance() {
    final Model.Builder b = Model.builder("traffic");
    final Signature time = b.sig("Time");
    b.ordered(time);
    final Signature event = b.sig("Event");
    final Signature color = b.sig("Color");
    b.field(event, "at", Multiplicity.ONE, time);
    b.field(event, "color", Multiplicity.ONE, color);
    final Model model = b.build();

    final ScopeTable scope = ScopeManager.resolve(ScopeSpec.of(2), model);
    final RelationStore store =
        Translator.translate(model, scope, ast.trueFormula(), "goal").store;
    final AtomPool pool = store.pool();
    return store.assign("Event", atoms(pool, 2, 3))
        .assign("Color", atoms(pool, 4))
        .assign("at",
            TupleSet.of(pool, 2, ImmutableBitSet.of(2 * 6, 3 * 6 + 1)))
        .assign("color",
            TupleSet.of(pool, 2, ImmutableBitSet.of(2 * 6 + 4, 3 * 6 + 4)))
        .toInstance();
  }

  @Test void testDescribe() {
    final String expected = "Atoms:\n"
        + "  Time: Time$0, Time$1\n"
        + "  Event: Event$0, Event$1\n"
        + "  Color: Color$0\n"
        + "Fields:\n"
        + "  Event\n"
        + "    at: Event$0->Time$0, Event$1->Time$1\n"
        + "    color: Event$0->Color$0, Event$1->Color$0\n"
        + "Trace of Time:\n"
        + "  Time$0: at: Event$0 (color=Color$0)\n"
        + "  Time$1: at: Event$1 (color=Color$0)\n";
    final InstanceReporter reporter = new InstanceReporter(ImmutableMap.of());
    assertThat(reporter.describe(trafficInstance()), is(expected));
  }

  @Test void testTraceLength() {
    final InstanceReporter reporter =
        new InstanceReporter(ImmutableMap.of(Prop.TRACE_LENGTH, 1));
    final String s = reporter.describe(trafficInstance());
    assertThat(s,
        containsString("Trace of Time:\n"
            + "  Time$0: at: Event$0 (color=Color$0)\n"
            + "  ...\n"));
    assertThat(s, not(containsString("  Time$1: ")));
  }

  /** An empty field prints as "{}"; a model without an ordering has no
   * trace. */
  @Test void testDescribeUnordered() {
    final String s = new InstanceReporter(ImmutableMap.of())
        .describe(TestModels.petsInstance());
    assertThat(s,
        containsString("  Dog: Animal$1\n"
            + "  Cat: Animal$0\n"
            + "  Rex: Rex$0\n"
            + "  Food: Food$0, Food$1\n"));
    assertThat(s,
        containsString("    eats: Animal$0->Food$0, Rex$0->Food$1\n"));
    assertThat(s, not(containsString("Trace of")));
  }

  @Test void testReport() {
    final Checker checker =
        new Checker(TestModels.list(), ImmutableMap.of(), Tracers.empty());
    final Verdict verdict = checker.execute("NonEmpty");
    final String s = new InstanceReporter(ImmutableMap.of()).report(verdict);
    assertThat(s, containsString("Command NonEmpty: run nonEmpty for 3\n"));
    assertThat(s, containsString("Verdict: SATISFIABLE\n"));
    assertThat(s, containsString("Scope: Node=3\n"));
    assertThat(s, containsString("  Node: Node$1, Node$2\n"));
    assertThat(s, containsString("    next: Node$2->Node$1\n"));
    assertThat(s, not(containsString("Witnesses:")));
  }

  @Test void testReportWithoutInstance() {
    final Checker checker =
        new Checker(TestModels.list(), ImmutableMap.of(), Tracers.empty());
    final String s = new InstanceReporter(ImmutableMap.of())
        .report(checker.execute("NoSelfLoop"));
    assertThat(s, containsString("Verdict: VERIFIED\n"));
    assertThat(s, not(containsString("Atoms:")));
  }
}

// End InstanceReporterTest.java
