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
package net.hydromatic.prover.solver;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.prover.term.TermBuilder.terms;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.prover.lemma.LemmaSet;
import net.hydromatic.prover.lemma.Linear;
import net.hydromatic.prover.lemma.Simplifier;
import net.hydromatic.prover.term.Apply;
import net.hydromatic.prover.term.MapTerm;
import net.hydromatic.prover.term.Op;
import net.hydromatic.prover.term.PatternMatcher;
import net.hydromatic.prover.term.Term;
import net.hydromatic.prover.term.Var;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Oracle that decides linear integer arithmetic, in-process.
 *
 * <p>A formula's propositional skeleton is solved by {@link Sat}; each
 * satisfying assignment of its atoms yields a conjunction of linear
 * constraints, which is decided by Fourier-Motzkin elimination with
 * integer tightening. If elimination finds no contradiction, a model is
 * built by back-substitution and checked against the constraints. If that
 * fails the answer is {@code UNKNOWN}.
 *
 * <p>{@code X modInt K}, for a positive literal {@code K}, is encoded
 * exactly, as {@code X - K * q} with {@code 0 <= X - K * q < K}. Other
 * terms that are not linear, such as {@code #getRange} or a product of two
 * variables, become uninterpreted integers; so does a structural equality
 * between terms that are not integers. Uninterpreted terms make a model
 * untrustworthy, so in their presence this oracle can answer
 * {@code UNSAT}, but never {@code SAT}. The exception is
 * {@code #isByteMap(M)} for a variable {@code M}, which is realizable
 * whichever value it is given.
 */
public class LinearOracle implements Oracle {
  private static final int MAX_ASSIGNMENTS = 4096;
  private static final int MAX_CONSTRAINTS = 20_000;

  private final long timeoutMillis;
  private final Simplifier simplifier;

  public LinearOracle(long timeoutMillis) {
    this.timeoutMillis = timeoutMillis;
    this.simplifier = new Simplifier(LemmaSet.EMPTY, this, 8);
  }

  @Override
  public String toString() {
    return "LinearOracle(" + timeoutMillis + " ms)";
  }

  @Override
  public Validity entails(Term assumption, Term goal) {
    switch (solve(terms.and(assumption, terms.not(goal))).status) {
      case UNSAT:
        return Validity.VALID;
      case SAT:
        return Validity.INVALID;
      case TIMEOUT:
        return Validity.TIMEOUT;
      default:
        return Validity.UNKNOWN;
    }
  }

  @Override
  public Satisfiability satisfiable(Term constraint) {
    return solve(constraint).status;
  }

  @Override
  public @Nullable ImmutableMap<String, BigInteger> model(Term constraint) {
    return solve(constraint).model;
  }

  private Outcome solve(Term constraint) {
    // evaluate ground sub-terms and normalize arithmetic
    final Term t = simplifier.simplify(constraint, terms.trueLiteral);
    return new Query(System.currentTimeMillis() + timeoutMillis).solve(t);
  }

  /** Result of a query, with a model if it is satisfiable. */
  private static class Outcome {
    static final Outcome UNSAT = new Outcome(Satisfiability.UNSAT, null);
    static final Outcome UNKNOWN = new Outcome(Satisfiability.UNKNOWN, null);
    static final Outcome TIMEOUT = new Outcome(Satisfiability.TIMEOUT, null);

    final Satisfiability status;
    final @Nullable ImmutableMap<String, BigInteger> model;

    Outcome(
        Satisfiability status,
        @Nullable ImmutableMap<String, BigInteger> model) {
      this.status = status;
      this.model = model;
    }
  }

  /** Kind of theory atom. */
  private enum AtomKind {
    /** {@code d <= 0}. */
    LE,
    /** {@code d == 0}. */
    EQ
  }

  /** Linear constraint over integer variables: {@code a . x + c <= 0}, or
   * {@code == 0}, or {@code != 0}. */
  private static class Constraint {
    final BigInteger[] a;
    final BigInteger c;

    Constraint(BigInteger[] a, BigInteger c) {
      this.a = a;
      this.c = c;
    }

    @Override
    public String toString() {
      return Arrays.toString(a) + " + " + c;
    }

    boolean isConstant() {
      for (BigInteger ai : a) {
        if (ai.signum() != 0) {
          return false;
        }
      }
      return true;
    }

    Constraint negate() {
      final BigInteger[] b = new BigInteger[a.length];
      for (int i = 0; i < a.length; i++) {
        b[i] = a[i].negate();
      }
      return new Constraint(b, c.negate());
    }

    /** Returns {@code this * m + o * n}. */
    Constraint combine(BigInteger m, Constraint o, BigInteger n) {
      final BigInteger[] b = new BigInteger[a.length];
      for (int i = 0; i < a.length; i++) {
        b[i] = a[i].multiply(m).add(o.a[i].multiply(n));
      }
      return new Constraint(b, c.multiply(m).add(o.c.multiply(n)));
    }

    BigInteger gcd() {
      BigInteger g = BigInteger.ZERO;
      for (BigInteger ai : a) {
        g = g.gcd(ai);
      }
      return g;
    }

    /** Divides an inequality by the gcd of its coefficients, rounding the
     * constant up; this removes no integer solutions. */
    Constraint tighten() {
      final BigInteger g = gcd();
      if (g.signum() == 0 || g.equals(BigInteger.ONE)) {
        return this;
      }
      final BigInteger[] b = new BigInteger[a.length];
      for (int i = 0; i < a.length; i++) {
        b[i] = a[i].divide(g);
      }
      return new Constraint(b, ceilDiv(c, g));
    }

    BigInteger evaluate(BigInteger[] x) {
      BigInteger v = c;
      for (int i = 0; i < a.length; i++) {
        if (a[i].signum() != 0) {
          v = v.add(a[i].multiply(x[i]));
        }
      }
      return v;
    }

    Constraint resize(int n) {
      final BigInteger[] b = new BigInteger[n];
      Arrays.fill(b, BigInteger.ZERO);
      System.arraycopy(a, 0, b, 0, a.length);
      return new Constraint(b, c);
    }
  }

  /** Theory atom of the propositional skeleton. */
  private static class Atom {
    final AtomKind kind;
    final Linear linear;

    Atom(AtomKind kind, Linear linear) {
      this.kind = kind;
      this.linear = linear;
    }
  }

  /** Substitution of a variable, from an equality with a unit
   * coefficient. */
  private static class Definition {
    final int var;
    /** Constraint with zero coefficient for {@code var}; the variable's
     * value is the constraint's value. */
    final Constraint value;

    Definition(int var, Constraint value) {
      this.var = var;
      this.value = value;
    }
  }

  /** State of one query. */
  private class Query {
    final long deadline;
    final Sat sat = new Sat();
    final Map<String, Atom> atoms = new HashMap<>();
    /** Integer variables: atoms of linear forms, and auxiliary variables. */
    final List<Term> ints = new ArrayList<>();
    final Map<Term, Integer> intIndex = new HashMap<>();
    /** Constraints that define auxiliary variables; always asserted. */
    final List<Constraint> auxInequalities = new ArrayList<>();
    final List<Constraint> auxEqualities = new ArrayList<>();
    final Set<Integer> auxVars = new LinkedHashSet<>();
    boolean abstracted;

    Query(long deadline) {
      this.deadline = deadline;
    }

    boolean timedOut() {
      return System.currentTimeMillis() > deadline;
    }

    Outcome solve(Term constraint) {
      Sat.Term f = skeleton(constraint);
      boolean unknown = false;
      for (int i = 0; i < MAX_ASSIGNMENTS; i++) {
        if (timedOut()) {
          return Outcome.TIMEOUT;
        }
        final Map<Sat.Variable, Boolean> assignment = sat.solve(f);
        if (assignment == null) {
          return unknown ? Outcome.UNKNOWN : Outcome.UNSAT;
        }
        final Outcome outcome = theory(assignment);
        switch (outcome.status) {
          case SAT:
            return abstracted ? Outcome.UNKNOWN : outcome;
          case UNKNOWN:
            unknown = true;
            break;
          case TIMEOUT:
            return outcome;
          default:
            break;
        }
        f = sat.and(f, sat.block(assignment));
      }
      return Outcome.UNKNOWN;
    }

    /** Converts a boolean term to a propositional formula, registering
     * its atoms. */
    Sat.Term skeleton(Term t) {
      if (t.isBoolean(true)) {
        return sat.constant(true);
      }
      if (t.isBoolean(false)) {
        return sat.constant(false);
      }
      if (t instanceof Var) {
        return sat.variable(t.toString());
      }
      if (!(t instanceof Apply) || ((Apply) t).builtIn == null) {
        return opaque(t);
      }
      final Apply a = (Apply) t;
      switch (requireNonNull(a.builtIn)) {
        case AND:
          return sat.and(skeleton(a.arg(0)), skeleton(a.arg(1)));
        case OR:
          return sat.or(skeleton(a.arg(0)), skeleton(a.arg(1)));
        case IMPLIES:
          return sat.or(sat.not(skeleton(a.arg(0))), skeleton(a.arg(1)));
        case NOT:
          return sat.not(skeleton(a.arg(0)));
        case INT_LE:
          return atom(AtomKind.LE, a.arg(0), a.arg(1), BigInteger.ZERO);
        case INT_LT:
          return atom(AtomKind.LE, a.arg(0), a.arg(1), BigInteger.ONE);
        case INT_GE:
          return atom(AtomKind.LE, a.arg(1), a.arg(0), BigInteger.ZERO);
        case INT_GT:
          return atom(AtomKind.LE, a.arg(1), a.arg(0), BigInteger.ONE);
        case INT_EQ:
          return atom(AtomKind.EQ, a.arg(0), a.arg(1), BigInteger.ZERO);
        case INT_NE:
          return sat.not(
              atom(AtomKind.EQ, a.arg(0), a.arg(1), BigInteger.ZERO));
        case EQ:
        case NE:
          final Sat.Term eq;
          if (PatternMatcher.isIntTyped(a.arg(0))
              || PatternMatcher.isIntTyped(a.arg(1))) {
            eq = atom(AtomKind.EQ, a.arg(0), a.arg(1), BigInteger.ZERO);
          } else {
            eq = opaque(terms.eq(a.arg(0), a.arg(1)));
          }
          return a.isA(Op.EQ) ? eq : sat.not(eq);
        case IS_BYTE_MAP:
          if (a.arg(0) instanceof Var
              || a.arg(0) instanceof MapTerm
                  && ((MapTerm) a.arg(0)).entries.isEmpty()) {
            // a map variable can be chosen to satisfy either value
            return sat.variable(t.toString());
          }
          return opaque(t);
        default:
          return opaque(t);
      }
    }

    /** Registers an atom that this oracle does not interpret. */
    Sat.Term opaque(Term t) {
      abstracted = true;
      return sat.variable(t.toString());
    }

    /** Registers an atom {@code left - right + offset <= 0} or
     * {@code == 0}. */
    Sat.Term atom(AtomKind kind, Term left, Term right, BigInteger offset) {
      Linear d = Linear.of(left).minus(Linear.of(right))
          .plus(Linear.of(offset));
      if (d.isConstant()) {
        final int sign = d.constant.signum();
        return sat.constant(kind == AtomKind.LE ? sign <= 0 : sign == 0);
      }
      if (kind == AtomKind.EQ
          && d.coefficients.values().iterator().next().signum() < 0) {
        d = d.times(BigInteger.ONE.negate());
      }
      for (Term t : d.coefficients.keySet()) {
        intVar(t);
      }
      final String name = kind.name().toLowerCase() + ":" + d.toTerm();
      atoms.put(name, new Atom(kind, d));
      return sat.variable(name);
    }

    /** Returns the index of an integer variable, registering it and
     * any definition it needs. */
    int intVar(Term t) {
      final Integer index = intIndex.get(t);
      if (index != null) {
        return index;
      }
      final int i = ints.size();
      ints.add(t);
      intIndex.put(t, i);
      if (t instanceof Var) {
        return i;
      }
      if (t instanceof Apply
          && ((Apply) t).isA(Op.INT_MOD)
          && ((Apply) t).arg(1).isInteger()
          && Linear.of(((Apply) t).arg(1)).constant.signum() > 0) {
        // r = X mod K: X - K * q - r == 0, 0 <= r <= K - 1
        final BigInteger k = Linear.of(((Apply) t).arg(1)).constant;
        final Var q = terms.var("#q" + i);
        final Linear x = Linear.of(((Apply) t).arg(0));
        for (Term atom : x.coefficients.keySet()) {
          intVar(atom);
        }
        final int qi = intVar(q);
        auxVars.add(qi);
        auxEqualities.add(
            constraint(x.minus(Linear.atom(q).times(k))
                .minus(Linear.atom(t))));
        auxInequalities.add(constraint(Linear.atom(t).times(
            BigInteger.ONE.negate())));
        auxInequalities.add(
            constraint(Linear.atom(t).minus(Linear.of(k.subtract(
                BigInteger.ONE)))));
        return i;
      }
      abstracted = true;
      return i;
    }

    Constraint constraint(Linear linear) {
      final BigInteger[] a = new BigInteger[ints.size()];
      Arrays.fill(a, BigInteger.ZERO);
      linear.coefficients.forEach((t, c) -> a[intVar(t)] = c);
      return new Constraint(a, linear.constant);
    }

    /** Decides the theory constraints implied by an assignment. */
    Outcome theory(Map<Sat.Variable, Boolean> assignment) {
      final List<Constraint> ineqs = new ArrayList<>(auxInequalities);
      final List<Constraint> eqs = new ArrayList<>(auxEqualities);
      final List<Constraint> diseqs = new ArrayList<>();
      assignment.forEach(
          (v, b) -> {
            final Atom atom = atoms.get(v.name);
            if (atom == null) {
              return;
            }
            final Constraint c = constraint(atom.linear);
            if (atom.kind == AtomKind.LE) {
              // not (d <= 0) is -d + 1 <= 0
              ineqs.add(
                  b ? c : constraint(atom.linear.times(BigInteger.ONE.negate())
                      .plus(Linear.of(BigInteger.ONE))));
            } else if (b) {
              eqs.add(c);
            } else {
              diseqs.add(c);
            }
          });
      final int n = ints.size();
      return split(resize(ineqs, n), resize(eqs, n), resize(diseqs, n), 0);
    }

    /** Splits each disequality {@code d != 0} into {@code d <= -1} or
     * {@code -d <= -1}. */
    Outcome split(
        List<Constraint> ineqs,
        List<Constraint> eqs,
        List<Constraint> diseqs,
        int i) {
      if (i == diseqs.size()) {
        return eliminate(ineqs, eqs);
      }
      boolean unknown = false;
      final Constraint d = diseqs.get(i);
      for (Constraint c : ImmutableList.of(d, d.negate())) {
        final List<Constraint> ineqs2 = new ArrayList<>(ineqs);
        // c + 1 <= 0
        ineqs2.add(new Constraint(c.a, c.c.add(BigInteger.ONE)));
        final Outcome outcome = split(ineqs2, eqs, diseqs, i + 1);
        switch (outcome.status) {
          case SAT:
          case TIMEOUT:
            return outcome;
          case UNKNOWN:
            unknown = true;
            break;
          default:
            break;
        }
      }
      return unknown ? Outcome.UNKNOWN : Outcome.UNSAT;
    }

    /** Returns the index of a variable whose coefficient is 1 or -1, or
     * -1. */
    private int unitIndex(Constraint eq) {
      for (int j = 0; j < eq.a.length; j++) {
        if (eq.a[j].abs().equals(BigInteger.ONE)) {
          return j;
        }
      }
      return -1;
    }

    /** Decides a conjunction of inequalities and equalities. */
    Outcome eliminate(List<Constraint> ineqs0, List<Constraint> eqs0) {
      final int n = ints.size();
      List<Constraint> ineqs = new ArrayList<>(ineqs0);
      final List<Constraint> eqs = new ArrayList<>(eqs0);
      final List<Definition> definitions = new ArrayList<>();

      // Use equalities with a unit coefficient to substitute variables
      // away; turn the others into pairs of inequalities.
      while (!eqs.isEmpty()) {
        final Constraint eq = eqs.remove(0);
        final BigInteger g = eq.gcd();
        if (g.signum() == 0) {
          if (eq.c.signum() != 0) {
            return Outcome.UNSAT;
          }
          continue;
        }
        if (eq.c.mod(g).signum() != 0) {
          return Outcome.UNSAT;
        }
        final int unit = unitIndex(eq);
        if (unit < 0) {
          ineqs.add(eq);
          ineqs.add(eq.negate());
          continue;
        }
        // x = -(rest) / a_j = -a_j * rest, since a_j is 1 or -1
        final BigInteger aj = eq.a[unit];
        final BigInteger[] v = new BigInteger[n];
        for (int j = 0; j < n; j++) {
          v[j] = j == unit ? BigInteger.ZERO : eq.a[j].multiply(aj).negate();
        }
        final Constraint value = new Constraint(v, eq.c.multiply(aj).negate());
        definitions.add(new Definition(unit, value));
        eqs.replaceAll(c -> substitute(c, unit, value));
        ineqs.replaceAll(c -> substitute(c, unit, value));
      }

      // Fourier-Motzkin elimination, keeping the constraints of each
      // level for back-substitution.
      final List<List<Constraint>> levels = new ArrayList<>();
      ineqs = tightenAll(ineqs);
      if (ineqs == null) {
        return Outcome.UNSAT;
      }
      for (int k = 0; k < n; k++) {
        if (timedOut()) {
          return Outcome.TIMEOUT;
        }
        final List<Constraint> level = new ArrayList<>();
        final List<Constraint> pos = new ArrayList<>();
        final List<Constraint> neg = new ArrayList<>();
        final List<Constraint> rest = new ArrayList<>();
        for (Constraint c : ineqs) {
          switch (c.a[k].signum()) {
            case 1:
              pos.add(c);
              level.add(c);
              break;
            case -1:
              neg.add(c);
              level.add(c);
              break;
            default:
              rest.add(c);
          }
        }
        levels.add(level);
        for (Constraint p : pos) {
          for (Constraint q : neg) {
            rest.add(p.combine(q.a[k].negate(), q, p.a[k]));
          }
        }
        if (rest.size() > MAX_CONSTRAINTS) {
          return Outcome.UNKNOWN;
        }
        ineqs = tightenAll(rest);
        if (ineqs == null) {
          return Outcome.UNSAT;
        }
      }

      // Back-substitution.
      final BigInteger[] x = new BigInteger[n];
      Arrays.fill(x, BigInteger.ZERO);
      for (int k = n - 1; k >= 0; k--) {
        BigInteger lower = null;
        BigInteger upper = null;
        for (Constraint c : levels.get(k)) {
          // a_k x_k + rest <= 0
          final BigInteger ak = c.a[k];
          final BigInteger rest = c.evaluate(x).subtract(ak.multiply(x[k]));
          if (ak.signum() > 0) {
            final BigInteger u = floorDiv(rest.negate(), ak);
            upper = upper == null ? u : upper.min(u);
          } else {
            final BigInteger l = ceilDiv(rest, ak.negate());
            lower = lower == null ? l : lower.max(l);
          }
        }
        if (lower != null && upper != null && lower.compareTo(upper) > 0) {
          return Outcome.UNKNOWN;
        }
        x[k] = lower != null && lower.signum() > 0 ? lower
            : upper != null && upper.signum() < 0 ? upper
            : BigInteger.ZERO;
      }
      for (int i = definitions.size() - 1; i >= 0; i--) {
        final Definition d = definitions.get(i);
        x[d.var] = d.value.evaluate(x);
      }

      // Check the model against the original constraints.
      for (Constraint c : ineqs0) {
        if (c.evaluate(x).signum() > 0) {
          return Outcome.UNKNOWN;
        }
      }
      for (Constraint c : eqs0) {
        if (c.evaluate(x).signum() != 0) {
          return Outcome.UNKNOWN;
        }
      }
      final ImmutableMap.Builder<String, BigInteger> model =
          ImmutableMap.builder();
      for (int i = 0; i < n; i++) {
        if (!auxVars.contains(i)) {
          model.put(ints.get(i).toString(), x[i]);
        }
      }
      return new Outcome(Satisfiability.SAT, model.build());
    }
  }

  /** Replaces variable {@code j} in a constraint by a value. */
  private static Constraint substitute(Constraint c, int j, Constraint value) {
    final BigInteger cj = c.a[j];
    if (cj.signum() == 0) {
      return c;
    }
    final Constraint c2 = c.combine(BigInteger.ONE, value, cj);
    c2.a[j] = BigInteger.ZERO;
    return c2;
  }

  /** Tightens each inequality, and removes those without variables;
   * returns null if one of those is false. */
  private static @Nullable List<Constraint> tightenAll(List<Constraint> list) {
    final Map<String, Constraint> map = new LinkedHashMap<>();
    for (Constraint c : list) {
      if (c.isConstant()) {
        if (c.c.signum() > 0) {
          return null;
        }
        continue;
      }
      final Constraint t = c.tighten();
      map.putIfAbsent(t.toString(), t);
    }
    return new ArrayList<>(map.values());
  }

  private static List<Constraint> resize(List<Constraint> list, int n) {
    final List<Constraint> list2 = new ArrayList<>(list.size());
    for (Constraint c : list) {
      list2.add(c.a.length == n ? c : c.resize(n));
    }
    return list2;
  }

  /** Returns the ceiling of {@code x / y}, for positive {@code y}. */
  static BigInteger ceilDiv(BigInteger x, BigInteger y) {
    final BigInteger[] qr = x.divideAndRemainder(y);
    return qr[1].signum() > 0 ? qr[0].add(BigInteger.ONE) : qr[0];
  }

  /** Returns the floor of {@code x / y}, for positive {@code y}. */
  static BigInteger floorDiv(BigInteger x, BigInteger y) {
    final BigInteger[] qr = x.divideAndRemainder(y);
    return qr[1].signum() < 0 ? qr[0].subtract(BigInteger.ONE) : qr[0];
  }
}

// End LinearOracle.java
