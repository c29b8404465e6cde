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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import net.hydromatic.quarry.instance.Instance;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Result of a search. */
public class Outcome {
  public final Kind kind;
  /** The instance found, if {@link #kind} is {@link Kind#SAT}. */
  public final @Nullable Instance instance;
  public final Statistics statistics;

  private Outcome(Kind kind, @Nullable Instance instance,
      Statistics statistics) {
    this.kind = requireNonNull(kind, "kind");
    this.instance = instance;
    this.statistics = requireNonNull(statistics, "statistics");
    checkArgument((kind == Kind.SAT) == (instance != null),
        "an instance is required if and only if satisfiable");
  }

  public static Outcome sat(Instance instance, Statistics statistics) {
    return new Outcome(Kind.SAT, requireNonNull(instance), statistics);
  }

  public static Outcome unsat(Statistics statistics) {
    return new Outcome(Kind.UNSAT, null, statistics);
  }

  public static Outcome timeout(Statistics statistics) {
    return new Outcome(Kind.TIMEOUT, null, statistics);
  }

  @Override
  public String toString() {
    return kind + " (" + statistics + ")";
  }

  /** Kind of outcome. */
  public enum Kind {
    /** An instance satisfies every constraint. */
    SAT,
    /** No instance within the scope satisfies every constraint. */
    UNSAT,
    /** The budget ran out before the search finished. Says nothing about
     * whether an instance exists. */
    TIMEOUT
  }
}

// End Outcome.java
