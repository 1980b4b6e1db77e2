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
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.prover.term.Term;
import net.hydromatic.prover.term.Var;
import org.junit.jupiter.api.Test;

/** Tests for {@link CachingOracle}. */
public class CachingOracleTest {
  private final Var x = terms.var("X");
  private final Var y = terms.var("Y");

  /** Oracle that counts its calls, and answers according to a fixed
   * result. */
  private static class CountingOracle implements Oracle {
    final AtomicInteger calls = new AtomicInteger();
    Validity validity = Validity.VALID;

    @Override public Validity entails(Term assumption, Term goal) {
      calls.incrementAndGet();
      return validity;
    }

    @Override public Satisfiability satisfiable(Term constraint) {
      calls.incrementAndGet();
      return Satisfiability.SAT;
    }
  }

  @Test void testCanonize() {
    final Var q = terms.var("?V7");
    assertThat(CachingOracle.canonize(terms.le(q, terms.plus(x, q))),
        hasToString("$0 <=Int $1 +Int $0"));
    assertThat(CachingOracle.canonize(terms.trueLiteral),
        is(terms.trueLiteral));
  }

  /** Queries that differ only in the names of their variables share a
   * cache entry. */
  @Test void testHitModuloRenaming() {
    final CountingOracle counting = new CountingOracle();
    final CachingOracle oracle = new CachingOracle(counting, 100);
    final Term zero = terms.intLiteral(0);
    assertThat(oracle.entails(terms.gt(x, zero), terms.ge(x, zero)),
        is(Oracle.Validity.VALID));
    assertThat(oracle.entails(terms.gt(y, zero), terms.ge(y, zero)),
        is(Oracle.Validity.VALID));
    assertThat(counting.calls.get(), is(1));
    assertThat(oracle.stats().hitCount(), is(1L));
    assertThat(oracle.stats().missCount(), is(1L));

    // a different query, and the same formula as a satisfiability query,
    // are misses
    oracle.entails(terms.gt(y, zero), terms.ge(x, zero));
    oracle.satisfiable(terms.gt(x, zero));
    assertThat(counting.calls.get(), is(3));
  }

  @Test void testTimeoutNotCached() {
    final CountingOracle counting = new CountingOracle();
    counting.validity = Oracle.Validity.TIMEOUT;
    final CachingOracle oracle = new CachingOracle(counting, 100);
    final Term t = terms.gt(x, terms.intLiteral(0));
    assertThat(oracle.entails(t, t), is(Oracle.Validity.TIMEOUT));
    counting.validity = Oracle.Validity.VALID;
    assertThat(oracle.entails(t, t), is(Oracle.Validity.VALID));
    assertThat(oracle.entails(t, t), is(Oracle.Validity.VALID));
    assertThat(counting.calls.get(), is(2));
  }
}

// End CachingOracleTest.java
