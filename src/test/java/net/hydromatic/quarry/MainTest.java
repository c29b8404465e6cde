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
package net.hydromatic.quarry;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.StringWriter;
import java.util.List;
import net.hydromatic.quarry.models.RosSecurityModel;
import net.hydromatic.quarry.solve.Checker;
import net.hydromatic.quarry.solve.Prop;
import net.hydromatic.quarry.solve.Tracers;
import org.junit.jupiter.api.Test;

/** Tests for {@link Main}, the command-line entry point. */
public class MainTest {
  /** Runs Main with the given arguments and checks its exit code; returns
   * what it printed. */
  private static String run(int expectedCode, String... args) {
    final StringWriter w = new StringWriter();
    final Main main = new Main(ImmutableList.copyOf(args), w,
        ImmutableMap.of());
    assertThat(main.run(), is(expectedCode));
    return w.toString();
  }

  @Test void testList() {
    final String s = run(Main.EXIT_EXPECTED, "--list");
    assertThat(s, startsWith("Models: [ros]\n"));
    assertThat(s,
        containsString("NoAttackerWheelSafe: check WheelSafe for 3 but"
            + " 5 Time, 4 Event, exactly 0 Attacker\n"));
    assertThat(s,
        containsString("JoystickCommandReachesWheel: run"
            + " joystickCommandReachesWheel for 3 but 5 Time, 4 Event\n"));
    assertThat(s, not(containsString("Executing")));
  }

  @Test void testUnknownModel() {
    final String s = run(Main.EXIT_ERROR, "--model", "nope");
    assertThat(s,
        is("Model error: unknown model 'nope'; available: [ros]\n"));
  }

  @Test void testUnknownCommand() {
    final String s = run(Main.EXIT_ERROR, "--command", "Fly");
    assertThat(s, startsWith("Model error: "));
    assertThat(s, containsString("Fly"));
  }

  @Test void testBadArguments() {
    String s = run(Main.EXIT_ERROR, "--bogus");
    assertThat(s, startsWith("Error: unknown argument '--bogus'\n"
        + "Usage: quarry "));

    s = run(Main.EXIT_ERROR, "--budget");
    assertThat(s, startsWith("Error: missing value for --budget\n"));

    s = run(Main.EXIT_ERROR, "--set", "nodeBudget=abc");
    assertThat(s,
        startsWith("Error: value for property nodeBudget must be a number:"
            + " abc\n"));

    s = run(Main.EXIT_ERROR, "--set", "nodeBudget");
    assertThat(s, startsWith("Error: expected prop=value, got 'nodeBudget'"));

    s = run(Main.EXIT_ERROR, "--set", "speed=3");
    assertThat(s, startsWith("Error: property speed not found\n"));
  }

  /** A budget too small for any verdict gives exit code 2. */
  @Test void testTimeout() {
    final String s = run(Main.EXIT_TIMEOUT,
        "--command", RosSecurityModel.ATTACKER_WHEEL_UNSAFE,
        "--budget", "2");
    assertThat(s, startsWith("Executing AttackerWheelUnsafe...\n"));
    assertThat(s, containsString("Verdict: TIMEOUT\n"));
    assertThat(s,
        containsString("  search budget exhausted after 3 nodes;"
            + " no verdict\n"));
  }

  @Test void testProgress() {
    final String s = run(Main.EXIT_TIMEOUT,
        "--command", RosSecurityModel.NO_ATTACKER_WHEEL_SAFE,
        "--budget", "10", "--set", "progressInterval=5");
    assertThat(s, containsString("  progress: "));
  }

  @Test void testExitCode() {
    final Checker checker =
        new Checker(TestModels.list(), ImmutableMap.of(), Tracers.empty());
    assertThat(Main.exitCode(checker.execute("NonEmpty")),
        is(Main.EXIT_EXPECTED));
    assertThat(Main.exitCode(checker.execute("Cyclic")),
        is(Main.EXIT_EXPECTED));
    assertThat(Main.exitCode(checker.execute("OneHead")),
        is(Main.EXIT_UNEXPECTED));

    final Checker limited =
        new Checker(TestModels.list(), ImmutableMap.of(Prop.NODE_BUDGET, 2L),
            Tracers.empty());
    assertThat(Main.exitCode(limited.execute("NoSelfLoop")),
        is(Main.EXIT_TIMEOUT));
  }

  /** Runs every command of the default model; the worst verdict decides the
   * exit code. */
  @Test void testExecuteAll() {
    final List<String> args = ImmutableList.of();
    final StringWriter w = new StringWriter();
    final int code =
        new Main(args, w, ImmutableMap.of(Prop.PARALLELISM, 2)).run();
    assertThat(code, is(Main.EXIT_EXPECTED));
    final String s = w.toString();
    assertThat(s, containsString("Executing NoAttackerWheelSafe...\n"));
    assertThat(s, containsString("Executing AttackerWheelUnsafe...\n"));
    assertThat(s,
        containsString("Executing JoystickCommandReachesWheel...\n"));
    assertThat(s, containsString("Verdict: VERIFIED\n"));
    assertThat(s, containsString("Verdict: COUNTEREXAMPLE\n"));
    assertThat(s, containsString("Verdict: SATISFIABLE\n"));
  }
}

// End MainTest.java
