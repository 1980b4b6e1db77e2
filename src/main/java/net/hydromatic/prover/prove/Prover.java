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
package net.hydromatic.prover.prove;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.prover.term.TermBuilder.terms;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import net.hydromatic.prover.explore.ExecutionNode;
import net.hydromatic.prover.explore.Explorer;
import net.hydromatic.prover.lemma.Simplifier;
import net.hydromatic.prover.rule.Rewriter;
import net.hydromatic.prover.rule.RuleDatabase;
import net.hydromatic.prover.solver.Oracle;
import net.hydromatic.prover.term.Bag;
import net.hydromatic.prover.term.PatternMatcher;
import net.hydromatic.prover.term.Substitution;
import net.hydromatic.prover.term.Term;
import net.hydromatic.prover.util.OracleTimeoutException;
import net.hydromatic.prover.util.Tracer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Proves claims by symbolic execution.
 *
 * <p>The prover starts from a claim's left-hand side, with its
 * precondition as the path condition, and explores every branch. A
 * branch is closed successfully if
 *
 * <ul>
 *   <li>it terminates in a configuration that matches the claim's
 *       right-hand side, and the path condition entails the
 *       postcondition;
 *   <li>it reaches, after at least one step, a configuration that matches
 *       the left-hand side of a claim being proved, under a path condition
 *       that entails that claim's precondition, and the claim's
 *       right-hand side, applied as a rewrite, leads to a successful
 *       branch; or
 *   <li>its path condition is unsatisfiable.
 * </ul>
 *
 * <p>A branch that is stuck, or terminates in a configuration that does
 * not satisfy the right-hand side, disproves the claim if the oracle finds
 * that it can be reached. If the oracle cannot say, or times out, or a
 * bound is reached, the verdict is inconclusive.
 */
public class Prover {
  private final RuleDatabase database;
  private final Rewriter rewriter;
  private final Simplifier simplifier;
  private final Oracle oracle;
  private final Explorer.Options options;
  private final int parallelism;
  private final Tracer tracer;

  public Prover(
      RuleDatabase database,
      Rewriter rewriter,
      Simplifier simplifier,
      Oracle oracle,
      Explorer.Options options,
      int parallelism,
      Tracer tracer) {
    this.database = requireNonNull(database);
    this.rewriter = requireNonNull(rewriter);
    this.simplifier = requireNonNull(simplifier);
    this.oracle = requireNonNull(oracle);
    this.options = requireNonNull(options);
    this.parallelism = parallelism;
    this.tracer = requireNonNull(tracer);
  }

  /** Proves a claim. */
  public Verdict prove(Claim claim) {
    return prove(claim, ImmutableList.of(claim));
  }

  /** Proves a list of claims together. Each claim may be used as a
   * circularity in the proof of any claim, including itself. Trusted
   * claims are used but not proved, and have no verdict.
   *
   * @return Verdicts, keyed by claim name, in the order of the claims */
  public ImmutableMap<String, Verdict> proveAll(List<Claim> claims) {
    final Map<String, Verdict> verdicts = new LinkedHashMap<>();
    for (Claim claim : claims) {
      if (!claim.trusted) {
        verdicts.put(claim.name, prove(claim, claims));
      }
    }
    return ImmutableMap.copyOf(verdicts);
  }

  private Verdict prove(Claim claim, List<Claim> hypotheses) {
    database.schema.validate(claim.name, claim.lhs);
    final Verdict verdict = prove2(claim, hypotheses);
    tracer.onVerdict(claim.name, verdict.toString());
    return verdict;
  }

  private Verdict prove2(Claim claim, List<Claim> hypotheses) {
    final Term requires;
    try {
      requires = simplifier.simplify(claim.requires, terms.trueLiteral);
      switch (oracle.satisfiable(requires)) {
        case UNSAT:
          return Verdict.proved(claim.name, 0, 0, 0);
        case TIMEOUT:
          return Verdict.inconclusive(claim.name, "solver timeout", 0);
        default:
          break;
      }
    } catch (OracleTimeoutException e) {
      return Verdict.inconclusive(claim.name, "solver timeout", 0);
    }

    final ProofState state = new ProofState(claim, hypotheses);
    final ExecutionNode root =
        ExecutionNode.root(rewriter.expand(claim.lhs),
            terms.conjunctions(requires));
    final ListeningExecutorService executor = executor();
    final Explorer.SearchResult<Verdict> result;
    try {
      final Explorer explorer =
          new Explorer(rewriter, executor, options, tracer);
      result = explorer.search(ImmutableList.of(root), new Visitor(state));
    } finally {
      MoreExecutors.shutdownAndAwaitTermination(executor,
          Duration.ofSeconds(10));
    }
    for (Verdict failure : result.failures) {
      if (failure.kind == Verdict.Kind.DISPROVED) {
        return failure;
      }
    }
    if (result.kind == Explorer.SearchResult.Kind.EXHAUSTED) {
      return Verdict.inconclusive(claim.name,
          requireNonNull(result.reason), result.count);
    }
    if (!result.failures.isEmpty()) {
      return result.failures.get(0);
    }
    return Verdict.proved(claim.name, result.steps,
        state.dischargedCount(), state.circularityCount());
  }

  private ListeningExecutorService executor() {
    if (parallelism <= 1) {
      return MoreExecutors.newDirectExecutorService();
    }
    return MoreExecutors.listeningDecorator(
        Executors.newFixedThreadPool(parallelism,
            new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("prover-%d")
                .build()));
  }

  /** Returns whether the oracle confirms a condition. */
  private Oracle.Validity entails(Term assumption, Term goal) {
    if (goal.isBoolean(true)) {
      return Oracle.Validity.VALID;
    }
    if (goal.isBoolean(false)) {
      return Oracle.Validity.INVALID;
    }
    final Oracle.Validity validity = oracle.entails(assumption, goal);
    tracer.onOracle("entails", goal, validity.name());
    if (validity == Oracle.Validity.TIMEOUT) {
      throw new OracleTimeoutException(assumption + " => " + goal);
    }
    return validity;
  }

  /** Decides what happens at the leaves of the search for one claim. */
  private class Visitor implements Explorer.Visitor<Verdict> {
    final ProofState state;
    final Substitution identity;

    Visitor(ProofState state) {
      this.state = state;
      this.identity = state.claim.identity();
    }

    @Override
    public @Nullable List<ExecutionNode> intercept(ExecutionNode node) {
      if (node.depth == 0) {
        return null;
      }
      final Term pc = node.condition();
      for (Claim c : state.hypotheses) {
        for (PatternMatcher.Match match
            : PatternMatcher.DEFERRING.matchAll(c.lhs, node.configuration)) {
          final List<Term> conditions = new ArrayList<>(match.constraints);
          conditions.add(match.subst.apply(c.requires));
          final Term goal = simplifier.simplify(terms.and(conditions), pc);
          if (entails(pc, goal) != Oracle.Validity.VALID) {
            continue;
          }
          final Substitution subst =
              Rewriter.freshen(c.rule, match.subst, node.freshCounter);
          final int counter =
              node.freshCounter + c.rule.freshVariables().size();
          final Bag configuration =
              rewriter.rewrite(c.rule, subst, match.cells,
                  node.configuration, pc);
          final Term ensures = simplifier.simplify(subst.apply(c.ensures), pc);
          tracer.onCircularity(c.name, node.configuration);
          state.circularity();
          return ImmutableList.of(
              node.circularity(c.name, configuration,
                  terms.conjunctions(ensures), counter));
        }
      }
      return null;
    }

    @Override
    public @Nullable Verdict close(ExecutionNode node,
        Explorer.Status status) {
      final Term pc = node.condition();
      if (status == Explorer.Status.STUCK) {
        return refute(node, "stuck", pc);
      }
      final List<Term> negatedGoals = new ArrayList<>();
      boolean unknown = false;
      for (PatternMatcher.Match match
          : PatternMatcher.DEFERRING.matchAll(state.claim.target,
              node.configuration, identity)) {
        final List<Term> conditions = new ArrayList<>(match.constraints);
        conditions.add(match.subst.apply(state.claim.ensures));
        final Term goal = simplifier.simplify(terms.and(conditions), pc);
        switch (entails(pc, goal)) {
          case VALID:
            state.discharge(node);
            return null;
          case UNKNOWN:
            unknown = true;
            break;
          default:
            negatedGoals.add(terms.not(goal));
        }
      }
      if (unknown) {
        return Verdict.inconclusive(state.claim.name,
            "cannot decide whether the postcondition holds", node.depth);
      }
      final List<Term> counterexample = new ArrayList<>();
      counterexample.add(pc);
      counterexample.addAll(negatedGoals);
      return refute(node,
          negatedGoals.isEmpty()
              ? "final configuration does not match"
              : "postcondition does not hold",
          terms.and(counterexample));
    }

    @Override
    public boolean isDecisive(Verdict failure) {
      return failure.kind == Verdict.Kind.DISPROVED;
    }

    /** Returns a verdict for a failed branch, unless the oracle shows that
     * the failure cannot happen. */
    private @Nullable Verdict refute(ExecutionNode node, String reason,
        Term constraint) {
      final Oracle.Satisfiability satisfiability =
          oracle.satisfiable(constraint);
      tracer.onOracle("satisfiable", constraint, satisfiability.name());
      switch (satisfiability) {
        case UNSAT:
          state.discharge(node);
          return null;
        case SAT:
          return Verdict.disproved(state.claim.name, reason, node.trace,
              node.configuration, node.condition(), oracle.model(constraint));
        case TIMEOUT:
          throw new OracleTimeoutException(constraint.toString());
        default:
          return Verdict.inconclusive(state.claim.name,
              "cannot decide whether failed branch is reachable: " + reason,
              node.depth);
      }
    }
  }
}

// End Prover.java
