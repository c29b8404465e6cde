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
package net.hydromatic.quarry.scope;

import static java.util.Objects.requireNonNull;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Scope specification of a command, as written by the user.
 *
 * <p>For example, "3 but 5 Time, 4 Event, exactly 0 Attacker" has default
 * bound 3; signatures Time and Event are bounded above by 5 and 4; signature
 * Attacker has exactly 0 atoms.
 *
 * <p>A specification is resolved against a model by {@link ScopeManager}.
 */
public class ScopeSpec {
  private static final Splitter COMMA = Splitter.on(',').trimResults();
  private static final Splitter SPACE =
      Splitter.on(' ').trimResults().omitEmptyStrings();

  /** Bound of top-level signatures not named in {@link #bounds}, or null. */
  public final @Nullable Integer defaultBound;
  /** Bounds of named signatures, in the order written. */
  public final ImmutableMap<String, Integer> bounds;
  /** Signatures whose bound is exact. */
  public final ImmutableSet<String> exact;

  private ScopeSpec(@Nullable Integer defaultBound,
      ImmutableMap<String, Integer> bounds, ImmutableSet<String> exact) {
    this.defaultBound = defaultBound;
    this.bounds = requireNonNull(bounds, "bounds");
    this.exact = requireNonNull(exact, "exact");
  }

  /** Creates a scope with a default bound and no overrides. */
  public static ScopeSpec of(int defaultBound) {
    checkBound(defaultBound, "default");
    return new ScopeSpec(defaultBound, ImmutableMap.of(), ImmutableSet.of());
  }

  /** Parses a scope such as "3 but 5 Time, exactly 1 Attacker". A leading
   * "for" is ignored. */
  public static ScopeSpec parse(String s) {
    String rest = s.trim();
    if (rest.startsWith("for ")) {
      rest = rest.substring("for ".length()).trim();
    }
    if (rest.isEmpty()) {
      throw new ScopeException("empty scope");
    }
    @Nullable Integer defaultBound = null;
    final int but = rest.indexOf(" but ");
    if (but >= 0) {
      defaultBound = parseBound(s, rest.substring(0, but).trim());
      rest = rest.substring(but + " but ".length());
    } else if (!rest.contains(" ")) {
      return of(parseBound(s, rest));
    }
    final Map<String, Integer> bounds = new LinkedHashMap<>();
    final Set<String> exact = new LinkedHashSet<>();
    for (String entry : COMMA.split(rest)) {
      final List<String> tokens = SPACE.splitToList(entry);
      final boolean isExact =
          !tokens.isEmpty() && tokens.get(0).equals("exactly");
      final List<String> tokens2 =
          isExact ? tokens.subList(1, tokens.size()) : tokens;
      if (tokens2.size() != 2) {
        throw new ScopeException("invalid scope '" + s + "': expected "
            + "'[exactly] <number> <signature>', got '" + entry + "'");
      }
      final String name = tokens2.get(1);
      final int bound = parseBound(s, tokens2.get(0));
      if (bounds.put(name, bound) != null) {
        throw new ScopeException("invalid scope '" + s
            + "': signature '" + name + "' is bounded more than once");
      }
      if (isExact) {
        exact.add(name);
      }
    }
    return new ScopeSpec(defaultBound, ImmutableMap.copyOf(bounds),
        ImmutableSet.copyOf(exact));
  }

  private static int parseBound(String s, String token) {
    final int bound;
    try {
      bound = Integer.parseInt(token);
    } catch (NumberFormatException e) {
      throw new ScopeException("invalid scope '" + s + "': '" + token
          + "' is not a number");
    }
    checkBound(bound, token);
    return bound;
  }

  private static void checkBound(int bound, String context) {
    if (bound < 0) {
      throw new ScopeException("negative bound " + bound + " for " + context);
    }
  }

  /** Returns a copy of this scope with a bound on a signature. */
  public ScopeSpec with(String name, int bound, boolean isExact) {
    checkBound(bound, name);
    final Map<String, Integer> bounds = new LinkedHashMap<>(this.bounds);
    bounds.put(name, bound);
    final Set<String> exact = new LinkedHashSet<>(this.exact);
    if (isExact) {
      exact.add(name);
    } else {
      exact.remove(name);
    }
    return new ScopeSpec(defaultBound, ImmutableMap.copyOf(bounds),
        ImmutableSet.copyOf(exact));
  }

  @Override
  public int hashCode() {
    return Objects.hash(defaultBound, bounds, exact);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ScopeSpec
            && Objects.equals(defaultBound, ((ScopeSpec) o).defaultBound)
            && bounds.equals(((ScopeSpec) o).bounds)
            && exact.equals(((ScopeSpec) o).exact);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    if (defaultBound != null) {
      b.append(defaultBound);
      if (!bounds.isEmpty()) {
        b.append(" but ");
      }
    }
    bounds.forEach((name, bound) -> {
      if (b.length() > 0 && !b.toString().endsWith(" but ")) {
        b.append(", ");
      }
      if (exact.contains(name)) {
        b.append("exactly ");
      }
      b.append(bound).append(' ').append(name);
    });
    return b.toString();
  }
}

// End ScopeSpec.java
