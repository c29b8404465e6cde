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

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import net.hydromatic.quarry.eval.Evaluator;
import net.hydromatic.quarry.eval.Truth;
import net.hydromatic.quarry.instance.Instance;
import net.hydromatic.quarry.instance.RelationStore;
import org.apache.calcite.util.ImmutableBitSet;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Backtracking search for an instance of a {@link Problem}.
 *
 * <p>The search makes the problem's decisions in order. After each choice
 * it evaluates the constraints that reference the changed relation, and
 * backtracks as soon as one is false. A constraint that is true under a
 * partial assignment is true in every refinement, so it is not evaluated
 * again in that subtree.
 *
 * <p>If {@link Prop#PARALLELISM} is greater than 1, the tree is first
 * expanded to a frontier of disjoint subtrees, which are searched by a pool
 * of threads. Otherwise the search is deterministic.
 */
public class Solver {
  /** Number of frontier subtrees per thread. */
  private static final int FRONTIER_FACTOR = 4;

  private final Problem problem;
  private final Tracer tracer;
  private final Budget budget;
  private final int parallelism;
  private final boolean symmetryBreaking;
  private final boolean revalidate;
  private final long progressInterval;

  private final AtomicLong nodes = new AtomicLong();
  private final AtomicLong backtracks = new AtomicLong();
  /** Set when an instance is found or the budget is exhausted; workers
   * poll it before each decision. */
  private final AtomicBoolean stop = new AtomicBoolean();
  private volatile boolean exhausted;
  private long startMillis;

  public Solver(Problem problem, Map<Prop, Object> props, Tracer tracer) {
    this.problem = requireNonNull(problem, "problem");
    this.tracer = requireNonNull(tracer, "tracer");
    this.budget = Budget.of(props);
    this.parallelism = Prop.PARALLELISM.intValue(props);
    this.symmetryBreaking = Prop.SYMMETRY_BREAKING.booleanValue(props);
    this.revalidate = Prop.REVALIDATE.booleanValue(props);
    this.progressInterval = Prop.PROGRESS_INTERVAL.longValue(props);
    if (parallelism < 1) {
      throw new IllegalArgumentException("parallelism must be positive: "
          + parallelism);
    }
  }

  /** Searches for an instance. A solver may be used only once. */
  public Outcome solve() {
    startMillis = System.currentTimeMillis();
    final ImmutableBitSet.Builder satisfied = ImmutableBitSet.builder();
    for (Constraint constraint : problem.constraints) {
      final Truth truth = Evaluator.evaluate(constraint.formula, problem.store);
      if (truth == Truth.FALSE) {
        return Outcome.unsat(statistics());
      }
      if (truth == Truth.TRUE) {
        satisfied.set(constraint.id);
      }
    }
    final int n = problem.decisions.size();
    final Frame root = new Frame(0, problem.store, satisfied.build(),
        new int[n], SymmetryBreaker.noPeers(n));
    final Instance instance =
        parallelism > 1 ? searchParallel(root) : search(root);
    if (instance != null) {
      return Outcome.sat(instance, statistics());
    }
    if (exhausted) {
      return Outcome.timeout(statistics());
    }
    return Outcome.unsat(statistics());
  }

  /** Returns the counters so far. */
  public Statistics statistics() {
    return new Statistics(nodes.get(), backtracks.get(),
        System.currentTimeMillis() - startMillis);
  }

  private @Nullable Instance search(Frame frame) {
    return search(frame, frame.depth, frame.store, frame.satisfied);
  }

  /** Depth-first search below decision {@code i}. Uses the frame's rank
   * and peer arrays as scratch space. */
  private @Nullable Instance search(Frame frame, int i, RelationStore store,
      ImmutableBitSet satisfied) {
    if (i == problem.decisions.size()) {
      return complete(store, satisfied);
    }
    if (stop.get()) {
      return null;
    }
    final Decision decision = problem.decisions.get(i);
    final int minRank = minRank(frame, i, store);
    for (Decision.Choice choice : decision.choices(store)) {
      if (choice.rank < minRank) {
        continue;
      }
      if (!tick()) {
        return null;
      }
      final RelationStore store2 =
          store.with(decision.relation, choice.bound);
      final ImmutableBitSet satisfied2 =
          propagate(store2, decision.relation, satisfied);
      if (satisfied2 == null) {
        backtracks.incrementAndGet();
        continue;
      }
      frame.ranks[i] = choice.rank;
      final Instance instance = search(frame, i + 1, store2, satisfied2);
      if (instance != null || stop.get()) {
        return instance;
      }
    }
    return null;
  }

  /** Returns the least rank that a choice for decision {@code i} may have
   * without repeating an isomorphic subtree. */
  private int minRank(Frame frame, int i, RelationStore store) {
    if (!symmetryBreaking) {
      return Integer.MIN_VALUE;
    }
    if (SymmetryBreaker.isRunStart(problem.decisions, i)) {
      SymmetryBreaker.assignPeers(problem.decisions, i, store, frame.peers);
    }
    if (problem.decisions.get(i).symmetryAtom < 0) {
      return Integer.MIN_VALUE;
    }
    final int peer = frame.peers[i];
    return peer < 0 ? Integer.MIN_VALUE : frame.ranks[peer];
  }

  /** Evaluates the unsatisfied constraints that reference a relation.
   * Returns the new set of satisfied constraints, or null if a constraint
   * is false. */
  private @Nullable ImmutableBitSet propagate(RelationStore store,
      int relation, ImmutableBitSet satisfied) {
    ImmutableBitSet result = satisfied;
    for (Constraint constraint : problem.constraintsOn(relation)) {
      if (result.get(constraint.id)) {
        continue;
      }
      switch (Evaluator.evaluate(constraint.formula, store)) {
        case FALSE:
          return null;
        case TRUE:
          result = result.set(constraint.id);
          break;
        default:
          break;
      }
    }
    return result;
  }

  /** Counts a node. Returns false if the budget is exhausted. */
  private boolean tick() {
    final long n = nodes.incrementAndGet();
    if (progressInterval > 0 && n % progressInterval == 0) {
      tracer.onProgress(statistics());
    }
    if ((budget.nodes > 0 || (n & 1023) == 0)
        && budget.isExhausted(n, System.currentTimeMillis() - startMillis)) {
      exhausted = true;
      stop.set(true);
      return false;
    }
    return true;
  }

  /** Converts the store at a leaf of the search tree into an instance,
   * checking that it satisfies every constraint. */
  private Instance complete(RelationStore store, ImmutableBitSet satisfied) {
    if (!store.isComplete()) {
      throw new InvariantViolationException(
          "search reached a leaf with undecided relations", "",
          store.toString());
    }
    for (Constraint constraint : problem.constraints) {
      if (!satisfied.get(constraint.id)) {
        throw new InvariantViolationException(
            "constraint was never decided", constraint.toString(),
            store.toString());
      }
    }
    final Instance instance = store.toInstance();
    if (revalidate) {
      for (Constraint constraint : problem.constraints) {
        if (!Evaluator.holds(constraint.formula, instance)) {
          final String kind = constraint.kind.name().toLowerCase(Locale.ROOT);
          throw new InvariantViolationException(
              "instance violates " + kind + " constraint '" + constraint.name
                  + "'",
              constraint.toString(), store.toString());
        }
      }
    }
    stop.set(true);
    tracer.onSolution(instance);
    return instance;
  }

  private @Nullable Instance searchParallel(Frame root) {
    final int target = FRONTIER_FACTOR * parallelism;
    List<Frame> frontier = ImmutableList.of(root);
    for (;;) {
      if (frontier.isEmpty() || frontier.size() >= target) {
        break;
      }
      final List<Frame> next = new ArrayList<>();
      boolean expanded = false;
      for (Frame frame : frontier) {
        if (frame.depth == problem.decisions.size()) {
          next.add(frame);
          continue;
        }
        expanded = true;
        if (!expand(frame, next)) {
          return null;
        }
      }
      frontier = next;
      if (!expanded) {
        break;
      }
    }

    final ExecutorService executor =
        Executors.newFixedThreadPool(parallelism);
    try {
      final List<Future<@Nullable Instance>> futures = new ArrayList<>();
      for (Frame frame : frontier) {
        futures.add(executor.submit(() -> search(frame)));
      }
      Instance result = null;
      for (Future<@Nullable Instance> future : futures) {
        final Instance instance = future.get();
        if (result == null) {
          result = instance;
        }
      }
      return result;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("search was interrupted", e);
    } catch (ExecutionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw new IllegalStateException(e.getCause());
    } finally {
      executor.shutdownNow();
    }
  }

  /** Adds the children of a frame to a list. Returns false if the budget is
   * exhausted. */
  private boolean expand(Frame frame, List<Frame> children) {
    final int i = frame.depth;
    final Decision decision = problem.decisions.get(i);
    final int minRank = minRank(frame, i, frame.store);
    for (Decision.Choice choice : decision.choices(frame.store)) {
      if (choice.rank < minRank) {
        continue;
      }
      if (!tick()) {
        return false;
      }
      final RelationStore store2 =
          frame.store.with(decision.relation, choice.bound);
      final ImmutableBitSet satisfied2 =
          propagate(store2, decision.relation, frame.satisfied);
      if (satisfied2 == null) {
        backtracks.incrementAndGet();
        continue;
      }
      final Frame child = new Frame(i + 1, store2, satisfied2,
          frame.ranks.clone(), frame.peers.clone());
      child.ranks[i] = choice.rank;
      children.add(child);
    }
    return true;
  }

  /** Root of a subtree. Each frame owns its arrays of ranks and peers. */
  private static class Frame {
    final int depth;
    final RelationStore store;
    final ImmutableBitSet satisfied;
    /** Rank of the choice made at each decision above {@link #depth}. */
    final int[] ranks;
    /** Index of each decision's peer, or -1. */
    final int[] peers;

    Frame(int depth, RelationStore store, ImmutableBitSet satisfied,
        int[] ranks, int[] peers) {
      this.depth = depth;
      this.store = store;
      this.satisfied = satisfied;
      this.ranks = ranks;
      this.peers = peers;
    }
  }
}

// End Solver.java
