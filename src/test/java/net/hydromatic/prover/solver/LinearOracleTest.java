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

import static net.hydromatic.prover.term.TermBuilder.terms;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import net.hydromatic.prover.term.Literal;
import net.hydromatic.prover.term.Term;
import net.hydromatic.prover.term.Var;
import org.junit.jupiter.api.Test;

/** Tests for {@link LinearOracle}. */
public class LinearOracleTest {
  private final Oracle oracle = new LinearOracle(10_000);

  private final Var x = terms.var("X");
  private final Var y = terms.var("Y");
  private final Var a = terms.var("A");
  private final Var d = terms.var("D");

  private static Literal i(long v) {
    return terms.intLiteral(v);
  }

  @Test void testEntails() {
    assertThat(oracle.entails(terms.ge(x, i(1)), terms.ge(x, i(0))),
        is(Oracle.Validity.VALID));
    assertThat(oracle.entails(terms.ge(x, i(0)), terms.ge(x, i(1))),
        is(Oracle.Validity.INVALID));
    assertThat(
        oracle.entails(terms.and(terms.le(x, y), terms.le(y, i(3))),
            terms.lt(x, i(4))),
        is(Oracle.Validity.VALID));
    assertThat(oracle.entails(terms.trueLiteral, terms.trueLiteral),
        is(Oracle.Validity.VALID));
  }

  @Test void testSatisfiable() {
    assertThat(
        oracle.satisfiable(terms.and(terms.lt(x, i(0)), terms.gt(x, i(0)))),
        is(Oracle.Satisfiability.UNSAT));
    assertThat(oracle.satisfiable(terms.neInt(x, x)),
        is(Oracle.Satisfiability.UNSAT));
    assertThat(oracle.satisfiable(terms.neInt(x, y)),
        is(Oracle.Satisfiability.SAT));
    // (X < 0 or X > 10) and 0 <= X <= 10
    assertThat(
        oracle.satisfiable(
            terms.and(terms.or(terms.lt(x, i(0)), terms.gt(x, i(10))),
                terms.ge(x, i(0)), terms.le(x, i(10)))),
        is(Oracle.Satisfiability.UNSAT));
  }

  /** Integers, not rationals: "2 * X == 1" and "1 <= 3 * X <= 2" have
   * rational solutions but no integer ones. */
  @Test void testIntegers() {
    assertThat(oracle.satisfiable(terms.eqInt(terms.times(i(2), x), i(1))),
        is(Oracle.Satisfiability.UNSAT));
    final Term threeX = terms.times(i(3), x);
    assertThat(
        oracle.satisfiable(
            terms.and(terms.ge(threeX, i(1)), terms.le(threeX, i(2)))),
        is(Oracle.Satisfiability.UNSAT));
  }

  @Test void testModel() {
    final Term t =
        terms.and(terms.eqInt(terms.plus(x, y), i(10)),
            terms.eqInt(terms.minus(x, y), i(4)));
    assertThat(oracle.satisfiable(t), is(Oracle.Satisfiability.SAT));
    assertThat(oracle.model(t),
        is(ImmutableMap.of("X", BigInteger.valueOf(7), "Y",
            BigInteger.valueOf(3))));
    assertThat(oracle.model(terms.lt(x, x)), nullValue());
  }

  /** Equalities whose variables have unit coefficients are substituted
   * away one after another; others become pairs of inequalities. */
  @Test void testEqualities() {
    final Var z = terms.var("Z");
    final Term chain =
        terms.and(terms.eqInt(x, terms.plus(y, i(1))),
            terms.eqInt(y, terms.plus(z, i(1))), terms.eqInt(z, i(3)));
    assertThat(oracle.entails(chain, terms.eqInt(x, i(5))),
        is(Oracle.Validity.VALID));
    assertThat(oracle.entails(chain, terms.eqInt(x, i(4))),
        is(Oracle.Validity.INVALID));
    final Term even =
        terms.eqInt(terms.times(i(2), x),
            terms.plus(terms.times(i(2), y), i(4)));
    assertThat(oracle.entails(even, terms.eqInt(x, terms.plus(y, i(2)))),
        is(Oracle.Validity.VALID));
  }

  /** "X modInt 256" is encoded exactly. */
  @Test void testMod() {
    final Term inByte = terms.and(terms.le(i(0), x), terms.lt(x, i(256)));
    assertThat(oracle.entails(inByte, terms.eqInt(terms.mod(x, i(256)), x)),
        is(Oracle.Validity.VALID));
    assertThat(oracle.satisfiable(terms.eqInt(terms.mod(x, i(4)), i(5))),
        is(Oracle.Satisfiability.UNSAT));
    assertThat(
        oracle.entails(terms.eqInt(x, i(-1)),
            terms.eqInt(terms.mod(x, i(256)), i(255))),
        is(Oracle.Validity.VALID));
  }

  /** Terms outside linear arithmetic are uninterpreted: they can make a
   * formula unsatisfiable, but a model that involves them is not
   * trusted. */
  @Test void testUninterpreted() {
    final Term g = terms.getRange(d, a, i(1));
    assertThat(oracle.satisfiable(terms.gt(g, i(3))),
        is(Oracle.Satisfiability.UNKNOWN));
    assertThat(
        oracle.satisfiable(terms.and(terms.gt(g, i(3)), terms.lt(g, i(2)))),
        is(Oracle.Satisfiability.UNSAT));
    assertThat(
        oracle.entails(terms.trueLiteral,
            terms.eq(terms.setRange(d, a, g, i(1)), d)),
        is(Oracle.Validity.UNKNOWN));
    assertThat(oracle.entails(terms.gt(g, i(3)), terms.gt(g, i(2))),
        is(Oracle.Validity.VALID));
  }

  /** "#isByteMap(D)" for a variable D is a free boolean. */
  @Test void testIsByteMap() {
    final Term b = terms.isByteMap(d);
    assertThat(oracle.satisfiable(b), is(Oracle.Satisfiability.SAT));
    assertThat(oracle.satisfiable(terms.and(b, terms.not(b))),
        is(Oracle.Satisfiability.UNSAT));
    assertThat(oracle.entails(terms.and(b, terms.gt(x, i(0))), b),
        is(Oracle.Validity.VALID));
  }

  @Test void testInUnsignedRange() {
    final Term range = terms.inUnsignedRange(32, x);
    assertThat(
        oracle.entails(range,
            terms.lt(x, terms.intLiteral(BigInteger.ONE.shiftLeft(32)))),
        is(Oracle.Validity.VALID));
    assertThat(oracle.entails(range, terms.lt(x, i(1 << 16))),
        is(Oracle.Validity.INVALID));
  }
}

// End LinearOracleTest.java
