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
package net.hydromatic.prover.lemma;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.prover.term.TermBuilder.terms;

import net.hydromatic.prover.rule.Rule;
import net.hydromatic.prover.solver.Oracle;
import net.hydromatic.prover.term.Apply;
import net.hydromatic.prover.term.Op;
import net.hydromatic.prover.term.PatternMatcher;
import net.hydromatic.prover.term.Term;
import net.hydromatic.prover.term.TermShuttle;
import net.hydromatic.prover.util.OracleTimeoutException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Simplifies terms of the background theory.
 *
 * <p>Each pass works bottom-up. At each application of a built-in function
 * it tries, in order: evaluation, if the arguments are known; boolean
 * simplification; normalization of linear arithmetic; and the active
 * lemmas whose left-hand side applies the same function. Passes repeat
 * until nothing changes or the pass limit is reached.
 *
 * <p>A lemma applies only if its condition, instantiated and simplified,
 * is {@code true}, or if the oracle says that the current assumption
 * entails it. If the oracle cannot decide, the lemma is not applied.
 */
public class Simplifier {
  /** How deeply lemma conditions may themselves be simplified using
   * lemmas. */
  private static final int MAX_CONDITION_DEPTH = 16;

  private final LemmaSet lemmas;
  private final Oracle oracle;
  private final int maxPasses;

  public Simplifier(LemmaSet lemmas, Oracle oracle, int maxPasses) {
    this.lemmas = requireNonNull(lemmas);
    this.oracle = requireNonNull(oracle);
    this.maxPasses = maxPasses;
  }

  public LemmaSet lemmas() {
    return lemmas;
  }

  /** Simplifies a term, assuming that {@code assumption} holds. */
  public Term simplify(Term term, Term assumption) {
    return simplify(term, assumption, 0);
  }

  private Term simplify(Term term, Term assumption, int depth) {
    final Pass pass = new Pass(assumption, depth);
    Term t = term;
    for (int i = 0; i < maxPasses; i++) {
      final Term t2 = t.accept(pass);
      if (t2.equals(t)) {
        return t2;
      }
      t = t2;
    }
    return t;
  }

  /** Simplifies an application whose arguments are already simplified.
   * Returns the application itself if nothing applies. */
  private Term reduce(Apply apply, Term assumption, int depth) {
    final Op op = apply.builtIn;
    if (op == null) {
      return apply;
    }
    final Term value = BuiltIns.evaluate(apply);
    if (value != null) {
      return value;
    }
    final Term t = reduceBuiltIn(op, apply);
    if (t != apply) {
      return t;
    }
    if (depth <= MAX_CONDITION_DEPTH) {
      for (Rule lemma : lemmas.lemmas(apply.op)) {
        final Term t2 = applyLemma(lemma, apply, assumption, depth);
        if (t2 != null) {
          return t2;
        }
      }
    }
    return apply;
  }

  private Term reduceBuiltIn(Op op, Apply apply) {
    switch (op) {
      case AND:
        if (apply.arg(0).isBoolean(true)) {
          return apply.arg(1);
        }
        if (apply.arg(1).isBoolean(true)
            || apply.arg(0).equals(apply.arg(1))) {
          return apply.arg(0);
        }
        if (apply.arg(0).isBoolean(false) || apply.arg(1).isBoolean(false)) {
          return terms.falseLiteral;
        }
        return apply;

      case OR:
        if (apply.arg(0).isBoolean(false)) {
          return apply.arg(1);
        }
        if (apply.arg(1).isBoolean(false)
            || apply.arg(0).equals(apply.arg(1))) {
          return apply.arg(0);
        }
        if (apply.arg(0).isBoolean(true) || apply.arg(1).isBoolean(true)) {
          return terms.trueLiteral;
        }
        return apply;

      case IMPLIES:
        if (apply.arg(0).isBoolean(false)
            || apply.arg(1).isBoolean(true)
            || apply.arg(0).equals(apply.arg(1))) {
          return terms.trueLiteral;
        }
        if (apply.arg(0).isBoolean(true)) {
          return apply.arg(1);
        }
        return apply;

      case NOT:
        return negate(apply.arg(0), apply);

      case INT_ADD:
      case INT_SUB:
      case INT_MUL:
        return canonical(apply, Linear.of(apply).toTerm());

      case INT_LT:
      case INT_LE:
      case INT_GT:
      case INT_GE:
      case INT_EQ:
      case INT_NE:
        return compare(op, apply);

      case EQ:
      case NE:
        if (apply.arg(0).equals(apply.arg(1))) {
          return terms.boolLiteral(op == Op.EQ);
        }
        if (PatternMatcher.isIntTyped(apply.arg(0))
            || PatternMatcher.isIntTyped(apply.arg(1))) {
          return terms.call(op == Op.EQ ? Op.INT_EQ : Op.INT_NE,
              apply.arg(0), apply.arg(1));
        }
        return apply;

      case IN_UNSIGNED_RANGE:
        if (apply.arg(0).isInteger()) {
          // #inUnsignedRange(W, V) is 0 <= V < 2^W
          final Term bound =
              BuiltIns.evaluate(
                  terms.pow(terms.intLiteral(2), apply.arg(0)));
          if (bound != null) {
            return terms.and(terms.le(terms.intLiteral(0), apply.arg(1)),
                terms.lt(apply.arg(1), bound));
          }
        }
        return apply;

      default:
        return apply;
    }
  }

  /** Returns the negation of a boolean term, pushing the negation into
   * comparisons; or {@code orElse} if there is no simpler form. */
  private static Term negate(Term term, Term orElse) {
    if (term instanceof Apply) {
      final Apply a = (Apply) term;
      final Op op = a.builtIn;
      if (op != null) {
        final Op negated;
        switch (op) {
          case NOT:
            return a.arg(0);
          case INT_LT:
            negated = Op.INT_GE;
            break;
          case INT_LE:
            negated = Op.INT_GT;
            break;
          case INT_GT:
            negated = Op.INT_LE;
            break;
          case INT_GE:
            negated = Op.INT_LT;
            break;
          case INT_EQ:
            negated = Op.INT_NE;
            break;
          case INT_NE:
            negated = Op.INT_EQ;
            break;
          case EQ:
            negated = Op.NE;
            break;
          case NE:
            negated = Op.EQ;
            break;
          default:
            return orElse;
        }
        return terms.call(negated, a.arg(0), a.arg(1));
      }
    }
    return orElse;
  }

  /** Simplifies a comparison between integers. If the difference between
   * the two sides is constant, evaluates it; otherwise puts both sides in
   * canonical form. */
  private static Term compare(Op op, Apply apply) {
    final Linear left = Linear.of(apply.arg(0));
    final Linear right = Linear.of(apply.arg(1));
    final Linear diff = left.minus(right);
    if (diff.isConstant()) {
      final Term t =
          BuiltIns.evaluate(
              terms.call(op, terms.intLiteral(diff.constant),
                  terms.intLiteral(0)));
      return requireNonNull(t);
    }
    return canonical(apply, terms.call(op, left.toTerm(), right.toTerm()));
  }

  /** Returns {@code t} if it differs from {@code apply}, otherwise
   * {@code apply}, so that callers can detect change by identity. */
  private static Term canonical(Apply apply, Term t) {
    return t.equals(apply) ? apply : t;
  }

  /** Applies a lemma to an application, if it matches and its condition
   * holds; otherwise returns null. */
  private @Nullable Term applyLemma(Rule lemma, Apply apply, Term assumption,
      int depth) {
    for (PatternMatcher.Match match
        : PatternMatcher.STRICT.matchAll(lemma.lhs, apply)) {
      final Term condition =
          simplify(match.subst.apply(lemma.requires), assumption, depth + 1);
      if (holds(condition, assumption)) {
        return match.subst.apply(lemma.rhs);
      }
    }
    return null;
  }

  /** Returns whether a simplified condition holds under an assumption. */
  private boolean holds(Term condition, Term assumption) {
    if (condition.isBoolean(true)) {
      return true;
    }
    if (condition.isBoolean(false)) {
      return false;
    }
    switch (oracle.entails(assumption, condition)) {
      case VALID:
        return true;
      case TIMEOUT:
        throw new OracleTimeoutException(assumption + " => " + condition);
      default:
        return false;
    }
  }

  /** One bottom-up simplification pass. */
  private class Pass extends TermShuttle {
    private final Term assumption;
    private final int depth;

    Pass(Term assumption, int depth) {
      this.assumption = assumption;
      this.depth = depth;
    }

    @Override
    public Term visit(Apply apply) {
      final Term t = super.visit(apply);
      return t instanceof Apply ? reduce((Apply) t, assumption, depth) : t;
    }
  }
}

// End Simplifier.java
