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

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Ordering;
import java.math.BigInteger;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import net.hydromatic.prover.term.Apply;
import net.hydromatic.prover.term.Literal;
import net.hydromatic.prover.term.Op;
import net.hydromatic.prover.term.Term;

/**
 * Linear combination of integer atoms plus a constant.
 *
 * <p>An atom is any integer term that is not a sum, difference, or product
 * by a constant: a variable, or an application of a function such as
 * {@code #getRange} or {@code modInt}. Converting a term to a linear form
 * and back yields a canonical term, so that {@code (A +Int 3) -Int A} and
 * {@code 3} become the same term.
 */
public final class Linear {
  /** Orders atoms by their printed form. */
  public static final Ordering<Term> ATOM_ORDERING =
      Ordering.<String>natural().onResultOf(Term::toString);

  public static final Linear ZERO =
      new Linear(
          ImmutableSortedMap.<Term, BigInteger>orderedBy(ATOM_ORDERING)
              .build(),
          BigInteger.ZERO);

  /** Coefficient of each atom; never zero. */
  public final ImmutableSortedMap<Term, BigInteger> coefficients;
  public final BigInteger constant;

  private Linear(
      ImmutableSortedMap<Term, BigInteger> coefficients, BigInteger constant) {
    this.coefficients = requireNonNull(coefficients);
    this.constant = requireNonNull(constant);
  }

  /** Creates a linear form that is a constant. */
  public static Linear of(BigInteger constant) {
    return new Linear(ZERO.coefficients, constant);
  }

  /** Creates a linear form that is a single atom. */
  public static Linear atom(Term atom) {
    return new Linear(
        ImmutableSortedMap.<Term, BigInteger>orderedBy(ATOM_ORDERING)
            .put(atom, BigInteger.ONE)
            .build(),
        BigInteger.ZERO);
  }

  /** Converts an integer term to a linear form. */
  public static Linear of(Term term) {
    if (term.isInteger()) {
      return of(((Literal) term).bigIntegerValue());
    }
    if (term instanceof Apply) {
      final Apply apply = (Apply) term;
      if (apply.isA(Op.INT_ADD)) {
        return of(apply.arg(0)).plus(of(apply.arg(1)));
      }
      if (apply.isA(Op.INT_SUB)) {
        return of(apply.arg(0)).minus(of(apply.arg(1)));
      }
      if (apply.isA(Op.INT_MUL)) {
        final Linear a = of(apply.arg(0));
        final Linear b = of(apply.arg(1));
        if (a.isConstant()) {
          return b.times(a.constant);
        }
        if (b.isConstant()) {
          return a.times(b.constant);
        }
      }
    }
    return atom(term);
  }

  @Override
  public int hashCode() {
    return coefficients.hashCode() * 31 + constant.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Linear
            && coefficients.equals(((Linear) obj).coefficients)
            && constant.equals(((Linear) obj).constant);
  }

  @Override
  public String toString() {
    return toTerm().toString();
  }

  public boolean isConstant() {
    return coefficients.isEmpty();
  }

  public Linear plus(Linear o) {
    final SortedMap<Term, BigInteger> map = new TreeMap<>(ATOM_ORDERING);
    map.putAll(coefficients);
    o.coefficients.forEach(
        (atom, c) -> {
          final BigInteger sum =
              map.getOrDefault(atom, BigInteger.ZERO).add(c);
          if (sum.signum() == 0) {
            map.remove(atom);
          } else {
            map.put(atom, sum);
          }
        });
    return new Linear(ImmutableSortedMap.copyOfSorted(map),
        constant.add(o.constant));
  }

  public Linear minus(Linear o) {
    return plus(o.times(BigInteger.ONE.negate()));
  }

  public Linear times(BigInteger factor) {
    if (factor.signum() == 0) {
      return ZERO;
    }
    final ImmutableSortedMap.Builder<Term, BigInteger> b =
        ImmutableSortedMap.orderedBy(ATOM_ORDERING);
    coefficients.forEach((atom, c) -> b.put(atom, c.multiply(factor)));
    return new Linear(b.build(), constant.multiply(factor));
  }

  /** Returns the greatest common divisor of the coefficients, or zero if
   * there are none. */
  public BigInteger gcd() {
    BigInteger g = BigInteger.ZERO;
    for (BigInteger c : coefficients.values()) {
      g = g.gcd(c);
    }
    return g;
  }

  /**
   * Converts this linear form to a term.
   *
   * <p>Atoms with positive coefficients come first, in atom order, then
   * atoms with negative coefficients are subtracted, then the constant is
   * added or subtracted. For example, {@code 3 - B + 2A} becomes
   * {@code 2 *Int A -Int B +Int 3}.
   */
  public Term toTerm() {
    Term result = null;
    for (Map.Entry<Term, BigInteger> e : coefficients.entrySet()) {
      if (e.getValue().signum() > 0) {
        final Term t = scaled(e.getKey(), e.getValue());
        result = result == null ? t : terms.plus(result, t);
      }
    }
    if (result == null) {
      // no positive atoms; start from the constant
      result = terms.intLiteral(constant);
      for (Map.Entry<Term, BigInteger> e : coefficients.entrySet()) {
        result =
            terms.minus(result, scaled(e.getKey(), e.getValue().negate()));
      }
      return result;
    }
    for (Map.Entry<Term, BigInteger> e : coefficients.entrySet()) {
      if (e.getValue().signum() < 0) {
        result =
            terms.minus(result, scaled(e.getKey(), e.getValue().negate()));
      }
    }
    switch (constant.signum()) {
      case 1:
        return terms.plus(result, terms.intLiteral(constant));
      case -1:
        return terms.minus(result, terms.intLiteral(constant.negate()));
      default:
        return result;
    }
  }

  private static Term scaled(Term atom, BigInteger c) {
    return c.equals(BigInteger.ONE)
        ? atom
        : terms.times(terms.intLiteral(c), atom);
  }
}

// End Linear.java
