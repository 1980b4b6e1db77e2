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
package net.hydromatic.prover.explore;

import static java.util.Objects.requireNonNull;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutionException;
import net.hydromatic.prover.rule.Rewriter;
import net.hydromatic.prover.rule.StepResult;
import net.hydromatic.prover.term.Bag;
import net.hydromatic.prover.term.Term;
import net.hydromatic.prover.util.OracleTimeoutException;
import net.hydromatic.prover.util.ProverException;
import net.hydromatic.prover.util.Tracer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Drives symbolic execution.
 *
 * <p>The explorer expands open nodes in rounds. In breadth-first order a
 * round expands every open node; in depth-first order it expands the most
 * recent nodes, as many as the executor has threads. Nodes of a round are
 * expanded concurrently, and their results are combined in the order of
 * the nodes, so the outcome of a search does not depend on the number of
 * threads.
 *
 * <p>What happens at the leaves is up to a {@link Visitor}; the prover
 * uses it to apply circularities and to check terminal nodes against a
 * claim.
 */
public class Explorer {
  private final Rewriter rewriter;
  private final ListeningExecutorService executor;
  private final Options options;
  private final Tracer tracer;

  public Explorer(
      Rewriter rewriter,
      ListeningExecutorService executor,
      Options options,
      Tracer tracer) {
    this.rewriter = requireNonNull(rewriter);
    this.executor = requireNonNull(executor);
    this.options = requireNonNull(options);
    this.tracer = requireNonNull(tracer);
  }

  /** Runs a concrete configuration until no rule applies, choosing the
   * first successor at each step.
   *
   * @throws ProverException if the step limit is reached, or if a step
   *   depends on a condition that cannot be decided
   */
  public Bag run(Bag configuration) {
    ExecutionNode node = ExecutionNode.root(configuration, ImmutableList.of());
    for (int i = 0; i < options.maxSteps; i++) {
      final StepResult result =
          rewriter.step(node.configuration, node.pathCondition,
              node.freshCounter);
      if (result.successors.isEmpty()) {
        return rewriter.expand(node.configuration);
      }
      final StepResult.Successor successor = result.successors.get(0);
      if (!successor.conditions.isEmpty()) {
        throw new ProverException("configuration is not concrete; step "
            + successor.ruleId + " depends on " + successor.conditions);
      }
      node = node.successor(successor, result.freshCounter);
    }
    throw new ProverException("no result after " + options.maxSteps
        + " steps");
  }

  /** Expands a node by one step. */
  public Expansion expand(ExecutionNode node) {
    final StepResult result =
        rewriter.step(node.configuration, node.pathCondition,
            node.freshCounter);
    final ImmutableList.Builder<ExecutionNode> successors =
        ImmutableList.builder();
    for (StepResult.Successor successor : result.successors) {
      successors.add(node.successor(successor, result.freshCounter));
    }
    final ImmutableList.Builder<ExecutionNode> finals =
        ImmutableList.builder();
    for (ImmutableList<Term> residual : result.residuals) {
      finals.add(
          node.constrain(residual)
              .withConfiguration(rewriter.expand(node.configuration)));
    }
    return new Expansion(successors.build(), finals.build());
  }

  /** Explores the tree below some start nodes. */
  public <R> SearchResult<R> search(
      List<ExecutionNode> start, Visitor<R> visitor) {
    final Deque<ExecutionNode> open = new ArrayDeque<>(start);
    final List<R> failures = new ArrayList<>();
    int steps = 0;
    int closed = 0;
    while (!open.isEmpty()) {
      final List<ExecutionNode> batch = new ArrayList<>();
      if (options.searchOrder == SearchOrder.BREADTH_FIRST) {
        batch.addAll(open);
        open.clear();
      } else {
        for (int i = 0; i < options.parallelism && !open.isEmpty(); i++) {
          batch.add(open.pop());
        }
      }
      final List<Work<R>> works;
      try {
        works = process(batch, visitor);
      } catch (OracleTimeoutException e) {
        return SearchResult.exhausted("solver timeout", steps, failures);
      }
      final List<ExecutionNode> next = new ArrayList<>();
      for (Work<R> work : works) {
        steps += work.steps;
        closed += work.closed;
        next.addAll(work.next);
        if (work.depthExceeded) {
          return SearchResult.exhausted("maxDepth", options.maxDepth,
              failures);
        }
        for (R failure : work.failures) {
          failures.add(failure);
          if (!options.exhaustive && visitor.isDecisive(failure)) {
            return SearchResult.refuted(steps, failures);
          }
        }
      }
      if (options.searchOrder == SearchOrder.BREADTH_FIRST) {
        open.addAll(next);
      } else {
        for (int i = next.size() - 1; i >= 0; i--) {
          open.push(next.get(i));
        }
      }
      if (steps > options.maxSteps) {
        return SearchResult.exhausted("maxSteps", steps, failures);
      }
      if (open.size() > options.maxBranches) {
        return SearchResult.exhausted("maxBranches", open.size(), failures);
      }
    }
    return failures.isEmpty()
        ? SearchResult.complete(steps, closed)
        : SearchResult.refuted(steps, failures);
  }

  /** Processes a batch of nodes, concurrently if the executor allows. */
  private <R> List<Work<R>> process(
      List<ExecutionNode> batch, Visitor<R> visitor) {
    if (batch.size() == 1) {
      return ImmutableList.of(process(batch.get(0), visitor));
    }
    final List<ListenableFuture<Work<R>>> futures = new ArrayList<>();
    for (ExecutionNode node : batch) {
      futures.add(executor.submit(() -> process(node, visitor)));
    }
    try {
      return Futures.allAsList(futures).get();
    } catch (ExecutionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw new ProverException("error while exploring", e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      futures.forEach(f -> f.cancel(true));
      throw new ProverException("interrupted", e);
    }
  }

  /** Processes one node. */
  private <R> Work<R> process(ExecutionNode node, Visitor<R> visitor) {
    final List<ExecutionNode> replacements = visitor.intercept(node);
    if (replacements != null) {
      if (replacements.isEmpty()) {
        tracer.onNodeClosed("circular", node.configuration);
      }
      return new Work<>(replacements, ImmutableList.of(), 0,
          replacements.isEmpty() ? 1 : 0, false);
    }
    if (node.depth >= options.maxDepth) {
      return new Work<>(ImmutableList.of(), ImmutableList.of(), 0, 0, true);
    }
    final Expansion expansion = expand(node);
    final ImmutableList.Builder<R> failures = ImmutableList.builder();
    int closed = 0;
    for (ExecutionNode f : expansion.finals) {
      final Status status =
          f.isExhausted(options.controlCell) ? Status.TERMINAL : Status.STUCK;
      final R failure = visitor.close(f, status);
      if (failure == null) {
        ++closed;
        tracer.onNodeClosed(status.name().toLowerCase(), f.configuration);
      } else {
        failures.add(failure);
      }
    }
    return new Work<>(expansion.successors, failures.build(),
        expansion.successors.size(), closed, false);
  }

  /** Order in which open nodes are expanded. */
  public enum SearchOrder {
    /** Expand all open branches, one step each, in rounds. The default. */
    BREADTH_FIRST,
    /** Expand the most recently created branch first. */
    DEPTH_FIRST
  }

  /** Classification of a node to which no rule applies. */
  public enum Status {
    /** The control cell is empty. */
    TERMINAL,
    /** The control cell is not empty; the program is stuck. */
    STUCK
  }

  /** Callback that decides what happens at the leaves of a search.
   *
   * @param <R> Type of the result of a branch that refutes the search */
  public interface Visitor<R> {
    /** Examines a node before it is expanded. Returns null to expand the
     * node as usual, or the nodes that replace it; an empty list closes
     * the branch. */
    @Nullable List<ExecutionNode> intercept(ExecutionNode node);

    /** Examines a node to which no rule applies. Returns null if the
     * branch is closed successfully, otherwise the reason it failed. */
    @Nullable R close(ExecutionNode node, Status status);

    /** Returns whether a failure ends the search. */
    boolean isDecisive(R failure);
  }

  /** Result of expanding a node. */
  public static final class Expansion {
    public final ImmutableList<ExecutionNode> successors;
    /** Nodes, constrained by the residual conditions, in which no rule
     * applies. */
    public final ImmutableList<ExecutionNode> finals;

    Expansion(
        ImmutableList<ExecutionNode> successors,
        ImmutableList<ExecutionNode> finals) {
      this.successors = successors;
      this.finals = finals;
    }
  }

  /** What was learned by processing one node. */
  private static final class Work<R> {
    final List<ExecutionNode> next;
    final List<R> failures;
    final int steps;
    final int closed;
    final boolean depthExceeded;

    Work(
        List<ExecutionNode> next,
        List<R> failures,
        int steps,
        int closed,
        boolean depthExceeded) {
      this.next = next;
      this.failures = failures;
      this.steps = steps;
      this.closed = closed;
      this.depthExceeded = depthExceeded;
    }
  }

  /** Limits and strategy of an explorer. */
  public static final class Options {
    final String controlCell;
    final SearchOrder searchOrder;
    final int parallelism;
    final int maxSteps;
    final int maxBranches;
    final int maxDepth;
    final boolean exhaustive;

    public Options(
        String controlCell,
        SearchOrder searchOrder,
        int parallelism,
        int maxSteps,
        int maxBranches,
        int maxDepth,
        boolean exhaustive) {
      this.controlCell = requireNonNull(controlCell);
      this.searchOrder = requireNonNull(searchOrder);
      this.parallelism = Math.max(1, parallelism);
      this.maxSteps = maxSteps;
      this.maxBranches = maxBranches;
      this.maxDepth = maxDepth;
      this.exhaustive = exhaustive;
    }
  }

  /** Outcome of a search.
   *
   * @param <R> Type of the result of a failed branch */
  public static final class SearchResult<R> {
    public final Kind kind;
    /** Failed branches, in a deterministic order. */
    public final ImmutableList<R> failures;
    /** Number of rule applications. */
    public final int steps;
    /** Number of branches closed successfully. */
    public final int closed;
    /** If the search was cut short, the bound that was reached. */
    public final @Nullable String reason;
    /** If the search was cut short, the value of the bound. */
    public final long count;

    private SearchResult(
        Kind kind,
        List<R> failures,
        int steps,
        int closed,
        @Nullable String reason,
        long count) {
      this.kind = kind;
      this.failures = ImmutableList.copyOf(failures);
      this.steps = steps;
      this.closed = closed;
      this.reason = reason;
      this.count = count;
    }

    static <R> SearchResult<R> complete(int steps, int closed) {
      return new SearchResult<>(Kind.COMPLETE, ImmutableList.of(), steps,
          closed, null, 0);
    }

    static <R> SearchResult<R> refuted(int steps, List<R> failures) {
      return new SearchResult<>(Kind.REFUTED, failures, steps, 0, null, 0);
    }

    static <R> SearchResult<R> exhausted(
        String reason, long count, List<R> failures) {
      return new SearchResult<>(Kind.EXHAUSTED, failures, 0, 0, reason,
          count);
    }

    @Override
    public String toString() {
      return kind + (reason == null ? "" : "(" + reason + " " + count + ")")
          + (failures.isEmpty() ? "" : " " + failures);
    }

    /** Kind of search result. */
    public enum Kind {
      /** Every branch was closed successfully. */
      COMPLETE,
      /** At least one branch failed; the others were closed or not
       * explored. */
      REFUTED,
      /** A bound was reached. */
      EXHAUSTED
    }
  }
}

// End Explorer.java
