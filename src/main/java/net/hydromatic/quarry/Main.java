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

import com.google.common.collect.ImmutableList;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.quarry.model.Command;
import net.hydromatic.quarry.model.Model;
import net.hydromatic.quarry.models.ModelCatalog;
import net.hydromatic.quarry.models.RosSecurityModel;
import net.hydromatic.quarry.report.InstanceReporter;
import net.hydromatic.quarry.solve.Budget;
import net.hydromatic.quarry.solve.Checker;
import net.hydromatic.quarry.solve.InvariantViolationException;
import net.hydromatic.quarry.solve.Prop;
import net.hydromatic.quarry.solve.Tracer;
import net.hydromatic.quarry.solve.Tracers;
import net.hydromatic.quarry.solve.Verdict;
import net.hydromatic.quarry.util.QuarryException;

/**
 * Command-line entry point.
 *
 * <p>Usage:
 *
 * <pre>
 * quarry [--model NAME] [--command NAME] [--budget N|Nms|Ns]
 *     [--parallelism N] [--no-symmetry] [--set prop=value]... [--list]
 * </pre>
 *
 * <p>Executes the named command of the named built-in model, or every
 * command if none is named, and prints each verdict. The exit code is 0 if
 * every verdict is as expected, 1 if a verdict is unexpected (for example,
 * a counterexample to a "check"), 2 if a search ran out of budget, 3 if
 * the model, the scope or the arguments are invalid, and 4 if the engine
 * produced an instance that violates a constraint. The last is fatal: no
 * further command runs.
 */
public class Main {
  public static final int EXIT_EXPECTED = 0;
  public static final int EXIT_UNEXPECTED = 1;
  public static final int EXIT_TIMEOUT = 2;
  public static final int EXIT_ERROR = 3;
  public static final int EXIT_INTERNAL_ERROR = 4;

  private final List<String> argList;
  private final PrintWriter out;
  private final Map<Prop, Object> propMap;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Main main =
        new Main(ImmutableList.copyOf(args), System.out,
            new LinkedHashMap<>());
    final int code = main.run();
    System.exit(code);
  }

  /** Creates a Main. */
  public Main(List<String> argList, PrintStream out,
      Map<Prop, Object> propMap) {
    this(argList, new OutputStreamWriter(out, StandardCharsets.UTF_8),
        propMap);
  }

  /** Creates a Main. */
  public Main(List<String> argList, Writer out, Map<Prop, Object> propMap) {
    this.argList = ImmutableList.copyOf(argList);
    this.out = out instanceof PrintWriter
        ? (PrintWriter) out
        : new PrintWriter(out);
    this.propMap = new LinkedHashMap<>(propMap);
  }

  /** Runs the commands; returns the exit code. */
  public int run() {
    try {
      return run2();
    } catch (IllegalArgumentException e) {
      out.println("Error: " + e.getMessage());
      usage();
      return EXIT_ERROR;
    } catch (InvariantViolationException e) {
      out.println(e.describeTo(new StringBuilder()));
      return EXIT_INTERNAL_ERROR;
    } catch (RuntimeException e) {
      if (e instanceof QuarryException) {
        out.println(
            ((QuarryException) e).describeTo(new StringBuilder()));
        return EXIT_ERROR;
      }
      throw e;
    } finally {
      out.flush();
    }
  }

  private int run2() {
    String modelName = RosSecurityModel.NAME;
    String commandName = null;
    boolean list = false;
    for (int i = 0; i < argList.size(); i++) {
      final String arg = argList.get(i);
      switch (arg) {
        case "--model":
          modelName = value(arg, ++i);
          break;
        case "--command":
          commandName = value(arg, ++i);
          break;
        case "--budget":
          Budget.parse(value(arg, ++i)).apply(propMap);
          break;
        case "--parallelism":
          Prop.PARALLELISM.setLenient(propMap, value(arg, ++i));
          break;
        case "--no-symmetry":
          Prop.SYMMETRY_BREAKING.set(propMap, false);
          break;
        case "--set":
          final String assignment = value(arg, ++i);
          final int eq = assignment.indexOf('=');
          if (eq < 0) {
            throw new IllegalArgumentException("expected prop=value, got '"
                + assignment + "'");
          }
          Prop.lookup(assignment.substring(0, eq))
              .setLenient(propMap, assignment.substring(eq + 1));
          break;
        case "--list":
          list = true;
          break;
        default:
          throw new IllegalArgumentException("unknown argument '" + arg
              + "'");
      }
    }

    final Model model = ModelCatalog.create(modelName);
    if (list) {
      out.println("Models: " + ModelCatalog.names());
      for (Command command : model.commands.values()) {
        out.println(command);
      }
      return EXIT_EXPECTED;
    }

    final List<QuarryException> errors = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnCommand(tracer, command ->
        out.println("Executing " + command.name + "..."));
    tracer = Tracers.withOnProgress(tracer, statistics ->
        out.println("  progress: " + statistics));
    tracer = Tracers.withOnException(tracer, errors::add);
    final Checker checker = new Checker(model, propMap, tracer);
    final InstanceReporter reporter = new InstanceReporter(propMap);

    final List<Verdict> verdicts = commandName == null
        ? checker.executeAll()
        : ImmutableList.of(checker.execute(commandName));
    int code = EXIT_EXPECTED;
    for (Verdict verdict : verdicts) {
      out.print(reporter.report(verdict));
      out.println();
      code = Math.max(code, exitCode(verdict));
    }
    for (QuarryException error : errors) {
      out.println(error.describeTo(new StringBuilder()));
      code = EXIT_ERROR;
    }
    return code;
  }

  private String value(String arg, int i) {
    if (i >= argList.size()) {
      throw new IllegalArgumentException("missing value for " + arg);
    }
    return argList.get(i);
  }

  private void usage() {
    out.println("Usage: quarry [--model NAME] [--command NAME]"
        + " [--budget N|Nms|Ns] [--parallelism N] [--no-symmetry]"
        + " [--set prop=value]... [--list]");
  }

  /** Returns the exit code for a verdict. */
  static int exitCode(Verdict verdict) {
    if (verdict.kind == Verdict.Kind.TIMEOUT) {
      return EXIT_TIMEOUT;
    }
    return verdict.isExpected() ? EXIT_EXPECTED : EXIT_UNEXPECTED;
  }
}

// End Main.java
