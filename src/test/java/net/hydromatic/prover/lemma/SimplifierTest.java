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

import static net.hydromatic.prover.term.TermBuilder.terms;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import net.hydromatic.prover.rule.RuleDatabase;
import net.hydromatic.prover.solver.LinearOracle;
import net.hydromatic.prover.solver.Oracle;
import net.hydromatic.prover.term.Literal;
import net.hydromatic.prover.term.Op;
import net.hydromatic.prover.term.Term;
import net.hydromatic.prover.term.Var;
import org.junit.jupiter.api.Test;

/** Tests for {@link Simplifier} and {@link StandardLemmas}. */
public class SimplifierTest {
  private static final RuleDatabase DB =
      StandardLemmas.addTo(RuleDatabase.builder()).build();

  private final Oracle oracle = new LinearOracle(10_000);
  private final Simplifier plain =
      new Simplifier(LemmaSet.EMPTY, oracle, 32);
  private final Simplifier simplifier =
      new Simplifier(
          LemmaSet.of(DB,
              ImmutableList.of(StandardLemmas.INT_ARITH,
                  StandardLemmas.BYTEMAP)),
          oracle, 32);

  private final Var x = terms.var("X");
  private final Var y = terms.var("Y");
  private final Var a = terms.var("A");
  private final Var d = terms.var("D");
  private final Var v = terms.var("V");

  private static Literal i(long n) {
    return terms.intLiteral(n);
  }

  private static Literal twoTo(int n) {
    return terms.intLiteral(BigInteger.ONE.shiftLeft(n));
  }

  private Term simplify(Term t) {
    return simplifier.simplify(t, terms.trueLiteral);
  }

  @Test void testEvaluate() {
    assertThat(simplify(terms.plus(i(2), i(3))), is(i(5)));
    assertThat(simplify(terms.pow(i(2), terms.times(i(8), i(8)))),
        is(twoTo(64)));
    assertThat(simplify(terms.mod(i(-1), i(256))), is(i(255)));
    assertThat(simplify(terms.lt(i(2), i(3))), is(terms.trueLiteral));
    // division by zero is left alone
    final Term div = terms.call(Op.INT_DIV, i(1), i(0));
    assertThat(simplify(div), is(div));
  }

  /** Sums are put in a canonical form, and comparisons whose sides differ
   * by a constant are decided. */
  @Test void testLinear() {
    assertThat(simplify(terms.plus(terms.plus(x, i(1)), i(-1))), is(x));
    assertThat(simplify(terms.minus(terms.plus(i(3), x), i(4))),
        hasToString("X -Int 1"));
    assertThat(simplify(terms.plus(y, terms.times(i(2), x))),
        hasToString("2 *Int X +Int Y"));
    assertThat(simplify(terms.le(terms.plus(x, i(1)), terms.plus(x, i(2)))),
        is(terms.trueLiteral));
    assertThat(simplify(terms.eqInt(terms.plus(a, i(0)), a)),
        is(terms.trueLiteral));
  }

  @Test void testBoolean() {
    final Term p = terms.le(x, y);
    assertThat(simplify(terms.and(terms.trueLiteral, p)), is(p));
    assertThat(simplify(terms.or(p, p)), is(p));
    assertThat(simplify(terms.implies(p, p)), is(terms.trueLiteral));
    assertThat(simplify(terms.not(p)), is(terms.gt(x, y)));
    assertThat(simplify(terms.not(terms.not(p))), is(p));
    assertThat(simplify(terms.eq(x, terms.plus(y, i(1)))),
        is(terms.eqInt(x, terms.plus(y, i(1)))));
    assertThat(simplify(terms.eq(d, d)), is(terms.trueLiteral));
    assertThat(simplify(terms.inUnsignedRange(8, x)),
        is(terms.and(terms.le(i(0), x), terms.lt(x, i(256)))));
  }

  /** "X modInt N" is X if X is known to be in range. */
  @Test void testModInRange() {
    final Term t = terms.mod(x, i(256));
    final Term inRange = terms.and(terms.le(i(0), x), terms.lt(x, i(100)));
    assertThat(simplifier.simplify(t, inRange), is(x));
    assertThat(simplifier.simplify(t, terms.trueLiteral), is(t));
    assertThat(plain.simplify(t, inRange), is(t));
  }

  /** If the oracle cannot decide a lemma's condition, the lemma is not
   * applied. */
  @Test void testUndecidedCondition() {
    final Oracle unknown =
        new Oracle() {
          @Override public Validity entails(Term assumption, Term goal) {
            return Validity.UNKNOWN;
          }

          @Override public Satisfiability satisfiable(Term constraint) {
            return Satisfiability.UNKNOWN;
          }
        };
    final Simplifier s =
        new Simplifier(
            LemmaSet.of(DB, ImmutableList.of(StandardLemmas.INT_ARITH)),
            unknown, 32);
    final Term t = terms.mod(x, i(256));
    assertThat(
        s.simplify(t, terms.and(terms.le(i(0), x), terms.lt(x, i(100)))),
        is(t));
    // ground terms are evaluated without the oracle
    assertThat(s.simplify(terms.mod(i(7), i(256)), terms.trueLiteral),
        is(i(7)));
  }

  @Test void testGetSetSame() {
    final Term t =
        terms.getRange(terms.setRange(d, a, v, i(8)), terms.plus(a, i(0)),
            i(8));
    assertThat(simplify(t), is(terms.mod(v, twoTo(64))));
  }

  @Test void testGetSetDisjoint() {
    final Term t =
        terms.getRange(terms.setRange(d, a, v, i(4)), terms.plus(a, i(4)),
            i(1));
    assertThat(simplify(t), hasToString("#getRange(D, A +Int 4, 1)"));

    // overlapping ranges: neither lemma applies
    final Term t2 =
        terms.getRange(terms.setRange(d, a, v, i(4)), terms.plus(a, i(3)),
            i(2));
    assertThat(simplify(t2).toString().startsWith("#getRange(#setRange"),
        is(true));
  }

  /** Writing back what was read leaves a byte-map unchanged; reading a
   * byte-map gives a value that is already in range. */
  @Test void testRoundTrip() {
    final Term byteMap = terms.isByteMap(d);
    final Term read = terms.getRange(d, a, i(8));
    final Term write =
        terms.setRange(d, a, terms.mod(read, twoTo(64)), i(8));
    assertThat(simplifier.simplify(write, byteMap), is(d));
    assertThat(simplifier.simplify(write, terms.trueLiteral),
        is(write));
    assertThat(
        simplifier.simplify(terms.mod(terms.getRange(d, a, i(1)), i(256)),
            byteMap),
        is(terms.getRange(d, a, i(1))));
    assertThat(
        simplifier.simplify(terms.isByteMap(terms.setRange(d, a, v, i(2))),
            byteMap),
        is(terms.trueLiteral));
  }

  /** A chain of single-byte stores, one per byte of a 64-bit value,
   * keeps memory a byte-map. */
  @Test void testByteMapChain() {
    Term m = d;
    for (int j = 0; j < 8; j++) {
      m = terms.setRange(m, terms.plus(a, i(j)), v, i(1));
    }
    assertThat(simplifier.simplify(terms.isByteMap(m), terms.isByteMap(d)),
        is(terms.trueLiteral));
    assertThat(
        simplifier.simplify(terms.isByteMap(m), terms.trueLiteral),
        is(terms.isByteMap(m)));
  }

  /** Reading the bytes of an 8-byte value in reverse order after writing
   * them one at a time. */
  @Test void testByteSwap() {
    Term mem = d;
    for (int k = 0; k < 8; k++) {
      final Term value =
          terms.mod(terms.getRange(d, terms.plus(a, i(7 - k)), i(1)),
              i(256));
      mem = terms.setRange(mem, terms.plus(a, i(k)), value, i(1));
    }
    final Term byteMap = terms.isByteMap(d);
    for (int k = 0; k < 8; k++) {
      final Term read = terms.getRange(mem, terms.plus(a, i(k)), i(1));
      assertThat(simplifier.simplify(read, byteMap),
          is(simplifier.simplify(
              terms.getRange(d, terms.plus(a, i(7 - k)), i(1)), byteMap)));
    }
  }
}

// End SimplifierTest.java
