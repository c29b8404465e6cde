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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.quarry.instance.Atom;
import net.hydromatic.quarry.instance.Instance;
import net.hydromatic.quarry.model.Command;
import net.hydromatic.quarry.scope.ScopeTable;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Result of a command.
 *
 * <p>A "check" that finds no counterexample is {@link Kind#VERIFIED} only
 * within the scope it searched. A counterexample may exist in a larger
 * scope.
 */
public class Verdict {
  public final Command command;
  public final Kind kind;
  /** Counterexample or instance; null unless {@link #kind} is
   * {@link Kind#COUNTEREXAMPLE} or {@link Kind#SATISFIABLE}. */
  public final @Nullable Instance instance;
  public final ScopeTable scope;
  public final Statistics statistics;
  public final String message;
  /** For a counterexample to an "all" assertion, the bindings of the
   * quantified variables for which the assertion's body is false. */
  public final ImmutableList<List<Atom>> witnesses;

  Verdict(Command command, Kind kind, @Nullable Instance instance,
      ScopeTable scope, Statistics statistics,
      List<List<Atom>> witnesses) {
    this.command = requireNonNull(command, "command");
    this.kind = requireNonNull(kind, "kind");
    this.instance = instance;
    this.scope = requireNonNull(scope, "scope");
    this.statistics = requireNonNull(statistics, "statistics");
    this.witnesses = ImmutableList.copyOf(witnesses);
    this.message = message(command, kind, scope, statistics);
  }

  private static String message(Command command, Kind kind,
      ScopeTable scope, Statistics statistics) {
    switch (kind) {
      case VERIFIED:
        return "no counterexample found within scope " + scope
            + " (bounded check; not a proof for larger scopes)";
      case COUNTEREXAMPLE:
        return "counterexample found; assertion '" + command.target
            + "' does not hold within scope " + scope;
      case SATISFIABLE:
        return "instance found; predicate '" + command.target
            + "' is consistent with the facts";
      case UNSATISFIABLE:
        return "no instance found within scope " + scope + "; predicate '"
            + command.target + "' contradicts the facts, or needs a larger"
            + " scope";
      case TIMEOUT:
        return "search budget exhausted after " + statistics.nodes
            + " nodes; no verdict";
      default:
        throw new AssertionError(kind);
    }
  }

  @Override
  public String toString() {
    return command.name + ": " + kind + ": " + message;
  }

  /** Returns whether the command found an instance (a counterexample, for
   * "check"). */
  public boolean foundInstance() {
    return instance != null;
  }

  /**
   * Returns whether the verdict is what the command expects.
   *
   * <p>A timeout is never expected.
   */
  public boolean isExpected() {
    if (kind == Kind.TIMEOUT) {
      return false;
    }
    return foundInstance() == command.expectsInstance();
  }

  /** Kind of verdict. */
  public enum Kind {
    /** "check" found no counterexample within the scope. */
    VERIFIED,
    /** "check" found an instance that violates the assertion. */
    COUNTEREXAMPLE,
    /** "run" found an instance. */
    SATISFIABLE,
    /** "run" found no instance within the scope. */
    UNSATISFIABLE,
    /** The budget was exhausted. Distinct from {@link #VERIFIED} and
     * {@link #UNSATISFIABLE}. */
    TIMEOUT
  }
}

// End Verdict.java
