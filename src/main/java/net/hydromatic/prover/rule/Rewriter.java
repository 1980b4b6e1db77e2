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
package net.hydromatic.prover.rule;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.prover.term.TermBuilder.terms;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import net.hydromatic.prover.lemma.Simplifier;
import net.hydromatic.prover.solver.Oracle;
import net.hydromatic.prover.term.Bag;
import net.hydromatic.prover.term.Cell;
import net.hydromatic.prover.term.PatternMatcher;
import net.hydromatic.prover.term.Substitution;
import net.hydromatic.prover.term.Term;
import net.hydromatic.prover.term.Var;
import net.hydromatic.prover.util.OracleTimeoutException;
import net.hydromatic.prover.util.Tracer;

/**
 * Applies the step rules of the active modules to a configuration.
 *
 * <p>Rules are tried in priority groups. Within a group, every rule and
 * every way it matches is a candidate successor. A side condition is
 * simplified and, if still undecided, given to the oracle; if the oracle
 * cannot decide it either way, the configuration forks into a successor
 * that assumes the condition and a residual that assumes its negation.
 * Rules of the next group are tried only in the residual states, where
 * no rule of an earlier group applied.
 *
 * <p>The control cell is heated and cooled to a fixed point before and
 * after each step.
 */
public class Rewriter {
  private final ImmutableList<ImmutableList<Rule>> groups;
  private final StrictnessExpander expander;
  private final Simplifier simplifier;
  private final Oracle oracle;
  private final String controlCell;
  private final Tracer tracer;

  public Rewriter(
      RuleDatabase database,
      Collection<String> moduleNames,
      Simplifier simplifier,
      Oracle oracle,
      String controlCell,
      Tracer tracer) {
    this.groups =
        Rule.groups(database.rules(moduleNames, Rule.Kind.STEP));
    this.expander = new StrictnessExpander(database);
    this.simplifier = requireNonNull(simplifier);
    this.oracle = requireNonNull(oracle);
    this.controlCell = requireNonNull(controlCell);
    this.tracer = requireNonNull(tracer);
  }

  /** Heats and cools the control cell of a configuration. */
  public Bag expand(Bag configuration) {
    return expander.expand(configuration, controlCell);
  }

  /** Applies rules to a configuration under a path condition.
   *
   * @param configuration Configuration
   * @param pathCondition Conjuncts of the path condition
   * @param freshCounter  Counter used to name fresh symbols
   *
   * @throws OracleTimeoutException if the oracle times out on a side
   *   condition
   */
  public StepResult step(
      Bag configuration, List<Term> pathCondition, int freshCounter) {
    final Bag config = expand(configuration);
    final Counter counter = new Counter(freshCounter);
    final ImmutableList.Builder<StepResult.Successor> successors =
        ImmutableList.builder();
    List<ImmutableList<Term>> residuals = ImmutableList.of(ImmutableList.of());
    for (List<Rule> group : groups) {
      final List<ImmutableList<Term>> nextResiduals = new ArrayList<>();
      for (ImmutableList<Term> residual : residuals) {
        final Term assumption =
            terms.and(
                ImmutableList.<Term>builder().addAll(pathCondition)
                    .addAll(residual).build());
        final List<Term> negations = new ArrayList<>();
        boolean total = false;
        for (Rule rule : group) {
          for (PatternMatcher.Match match
              : PatternMatcher.STRICT.matchAll(rule.lhs, config)) {
            final Term condition =
                simplifier.simplify(match.subst.apply(rule.requires),
                    assumption);
            final Decision decision = decide(assumption, condition);
            if (decision == Decision.NEVER) {
              continue;
            }
            final ImmutableList<Term> conditions;
            if (decision == Decision.ALWAYS) {
              total = true;
              conditions = residual;
            } else {
              tracer.onBranch(rule.id, condition);
              negations.add(terms.not(condition));
              conditions =
                  ImmutableList.<Term>builder().addAll(residual)
                      .add(condition).build();
            }
            final Bag next =
                apply(rule, match, config,
                    terms.and(assumption, condition), counter);
            tracer.onStep(rule.id, config, next);
            successors.add(
                new StepResult.Successor(next, conditions, rule.id));
          }
        }
        if (total) {
          continue;
        }
        final ImmutableList<Term> nextResidual =
            ImmutableList.<Term>builder().addAll(residual)
                .addAll(negations).build();
        if (nextResidual.size() >= 2 && !negations.isEmpty()
            && !satisfiable(pathCondition, nextResidual)) {
          continue;
        }
        nextResiduals.add(nextResidual);
      }
      residuals = nextResiduals;
      if (residuals.isEmpty()) {
        break;
      }
    }
    return new StepResult(successors.build(),
        ImmutableList.copyOf(residuals), counter.value);
  }

  /** Whether a condition holds, fails, or may go either way. */
  private Decision decide(Term assumption, Term condition) {
    if (condition.isBoolean(true)) {
      return Decision.ALWAYS;
    }
    if (condition.isBoolean(false)) {
      return Decision.NEVER;
    }
    if (entails(assumption, condition) == Oracle.Validity.VALID) {
      return Decision.ALWAYS;
    }
    if (entails(assumption, terms.not(condition)) == Oracle.Validity.VALID) {
      return Decision.NEVER;
    }
    return Decision.MAYBE;
  }

  private Oracle.Validity entails(Term assumption, Term goal) {
    final Oracle.Validity validity = oracle.entails(assumption, goal);
    tracer.onOracle("entails", goal, validity.name());
    if (validity == Oracle.Validity.TIMEOUT) {
      throw new OracleTimeoutException(assumption + " => " + goal);
    }
    return validity;
  }

  private boolean satisfiable(List<Term> pathCondition, List<Term> residual) {
    final Term t =
        terms.and(
            ImmutableList.<Term>builder().addAll(pathCondition)
                .addAll(residual).build());
    final Oracle.Satisfiability satisfiability = oracle.satisfiable(t);
    tracer.onOracle("satisfiable", t, satisfiability.name());
    switch (satisfiability) {
      case UNSAT:
        return false;
      case TIMEOUT:
        throw new OracleTimeoutException(t.toString());
      default:
        return true;
    }
  }

  /** Rewrites the cells a rule matched; cells it did not mention are
   * unchanged. */
  private Bag apply(
      Rule rule,
      PatternMatcher.Match match,
      Bag config,
      Term assumption,
      Counter counter) {
    final Substitution subst = freshen(rule, match.subst, counter.value);
    counter.value += rule.freshVariables().size();
    return rewrite(rule, subst, match.cells, config, assumption);
  }

  /** Extends a substitution by binding each variable that occurs only on
   * the right-hand side of a rule to a fresh symbol.
   *
   * <p>Symbols are numbered from {@code counter}; the caller must advance
   * its counter by the number of {@link Rule#freshVariables()}. */
  public static Substitution freshen(
      Rule rule, Substitution subst, int counter) {
    Substitution s = subst;
    int i = counter;
    for (Var v : rule.freshVariables()) {
      s = s.plus(v, v.rename("?" + v.name + i++));
    }
    return s;
  }

  /** Replaces the content of each matched cell by the corresponding
   * right-hand cell of a rule, instantiated and simplified.
   *
   * @param rule       Rule
   * @param subst      Bindings of the rule's variables
   * @param cells      Map from paths of the rule's cells to paths of the
   *                   configuration's cells
   * @param config     Configuration
   * @param assumption Condition under which the result is simplified
   */
  public Bag rewrite(
      Rule rule,
      Substitution subst,
      Map<ImmutableList<Integer>, ImmutableList<Integer>> cells,
      Bag config,
      Term assumption) {
    Bag result = config;
    for (Map.Entry<ImmutableList<Integer>, ImmutableList<Integer>> e
        : cells.entrySet()) {
      final Cell lhsCell = rule.lhsCell(e.getKey());
      final Cell rhsCell = rule.rhsCell(e.getKey());
      if (rhsCell.content instanceof Bag
          || rhsCell.content.equals(lhsCell.content)) {
        continue;
      }
      final Term content =
          simplifier.simplify(subst.apply(rhsCell.content), assumption);
      result = Rule.replaceAt(result, e.getValue(), content);
    }
    return expand(result);
  }

  /** Outcome of evaluating a side condition. */
  private enum Decision {
    ALWAYS, NEVER, MAYBE
  }

  /** Mutable counter for fresh names. */
  private static class Counter {
    int value;

    Counter(int value) {
      this.value = value;
    }
  }
}

// End Rewriter.java
