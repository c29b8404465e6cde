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

import net.hydromatic.quarry.scope.ScopeSpec;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Analysis command: "check" an assertion or "run" a predicate within a
 * scope.
 */
public class Command {
  public final String name;
  public final Kind kind;
  /** Name of the predicate (or assertion) that the command analyzes. */
  public final String target;
  public final ScopeSpec scope;
  /** Expected number of instances (0 or 1), or null to use the default. */
  public final @Nullable Integer expect;

  Command(String name, Kind kind, String target, ScopeSpec scope,
      @Nullable Integer expect) {
    this.name = requireNonNull(name, "name");
    this.kind = requireNonNull(kind, "kind");
    this.target = requireNonNull(target, "target");
    this.scope = requireNonNull(scope, "scope");
    this.expect = expect;
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder(name).append(": ")
        .append(kind.keyword).append(' ').append(target)
        .append(" for ").append(scope);
    if (expect != null) {
      b.append(" expect ").append(expect);
    }
    return b.toString();
  }

  /**
   * Returns whether the command expects to find an instance.
   *
   * <p>Unless the command says otherwise, "check" expects no counterexample
   * and "run" expects an instance.
   */
  public boolean expectsInstance() {
    if (expect != null) {
      return expect > 0;
    }
    return kind == Kind.RUN;
  }

  /** Kind of command. */
  public enum Kind {
    /** Searches for a counterexample to an assertion. */
    CHECK("check"),
    /** Searches for an instance of a predicate. */
    RUN("run");

    public final String keyword;

    Kind(String keyword) {
      this.keyword = keyword;
    }
  }
}

// End Command.java
