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

import java.util.Locale;
import java.util.Map;

/**
 * Limit on the resources of one search: a number of nodes, a wall-clock
 * duration, or both. Zero means no limit.
 */
public class Budget {
  public final long nodes;
  public final long millis;

  private Budget(long nodes, long millis) {
    if (nodes < 0 || millis < 0) {
      throw new IllegalArgumentException("budget must not be negative");
    }
    this.nodes = nodes;
    this.millis = millis;
  }

  /** Returns a budget with no limit. */
  public static Budget unlimited() {
    return new Budget(0, 0);
  }

  public static Budget ofNodes(long nodes) {
    return new Budget(nodes, 0);
  }

  public static Budget ofMillis(long millis) {
    return new Budget(0, millis);
  }

  /** Returns the budget given by the {@link Prop#NODE_BUDGET} and
   * {@link Prop#TIMEOUT_MILLIS} properties. */
  public static Budget of(Map<Prop, Object> map) {
    return new Budget(Prop.NODE_BUDGET.longValue(map),
        Prop.TIMEOUT_MILLIS.longValue(map));
  }

  /**
   * Parses a budget: "1000" is a number of nodes, "500ms" a number of
   * milliseconds, "30s" a number of seconds.
   */
  public static Budget parse(String s) {
    final String t = s.trim().toLowerCase(Locale.ROOT);
    try {
      if (t.endsWith("ms")) {
        return ofMillis(Long.parseLong(t.substring(0, t.length() - 2)));
      }
      if (t.endsWith("s")) {
        return ofMillis(
            Long.parseLong(t.substring(0, t.length() - 1)) * 1_000L);
      }
      return ofNodes(Long.parseLong(t));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid budget '" + s
          + "'; expected a node count, or a duration such as 500ms or 30s",
          e);
    }
  }

  /** Stores this budget in a property map. */
  public void apply(Map<Prop, Object> map) {
    Prop.NODE_BUDGET.set(map, nodes);
    Prop.TIMEOUT_MILLIS.set(map, millis);
  }

  @Override
  public String toString() {
    if (nodes == 0 && millis == 0) {
      return "unlimited";
    }
    if (millis == 0) {
      return nodes + " nodes";
    }
    if (nodes == 0) {
      return millis + "ms";
    }
    return nodes + " nodes, " + millis + "ms";
  }

  /** Returns whether a search that has explored {@code nodes} nodes in
   * {@code elapsedMillis} has exhausted this budget. */
  public boolean isExhausted(long nodes, long elapsedMillis) {
    return this.nodes > 0 && nodes > this.nodes
        || millis > 0 && elapsedMillis > millis;
  }
}

// End Budget.java
