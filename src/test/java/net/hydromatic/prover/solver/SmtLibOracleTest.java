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
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.google.common.collect.ImmutableList;
import java.io.File;
import net.hydromatic.prover.term.Op;
import net.hydromatic.prover.term.Term;
import net.hydromatic.prover.term.Var;
import net.hydromatic.prover.util.ProverException;
import org.junit.jupiter.api.Test;

/** Tests for {@link SmtLibOracle}.
 *
 * <p>These tests do not need a solver; where a process is needed, a shell
 * script stands in for one. */
public class SmtLibOracleTest {
  private final Var x = terms.var("X");
  private final Var d = terms.var("D");

  @Test void testScript() {
    final Term t =
        terms.and(terms.le(x, terms.intLiteral(-1)), terms.isByteMap(d));
    assertThat(SmtLibOracle.toSmtLib(t),
        is("(set-logic ALL)\n"
            + "(declare-const c!0 Int)\n"
            + "(declare-const c!1 Bool)\n"
            + "(assert (and (<= c!0 (- 1)) c!1))\n"
            + "(check-sat)\n"));
  }

  @Test void testScriptArithmetic() {
    final Term t =
        terms.or(terms.inUnsignedRange(8, x),
            terms.neInt(terms.mod(terms.plus(x, x), terms.intLiteral(4)),
                terms.getRange(d, x, terms.intLiteral(1))));
    assertThat(SmtLibOracle.toSmtLib(t),
        is("(set-logic ALL)\n"
            + "(declare-const c!0 Int)\n"
            + "(declare-const c!1 Int)\n"
            + "(assert (or (and (<= 0 c!0) (< c!0 256)) "
            + "(distinct (mod (+ c!0 c!0) 4) c!1)))\n"
            + "(check-sat)\n"));
  }

  /** Integer division rounds toward zero, so -7 / 2 is -3; SMT-LIB
   * {@code div} alone would give -4. */
  @Test void testScriptDivision() {
    final Term t =
        terms.le(terms.call(Op.INT_DIV, x, terms.intLiteral(2)),
            terms.intLiteral(-4));
    assertThat(SmtLibOracle.toSmtLib(t),
        is("(set-logic ALL)\n"
            + "(declare-const c!0 Int)\n"
            + "(assert (<= (ite (>= c!0 0) (div c!0 2) "
            + "(- (div (- c!0) 2))) (- 4)))\n"
            + "(check-sat)\n"));
  }

  /** Runs a script that ignores its input and says "unsat". */
  @Test void testProcess() {
    assumeTrue(new File("/bin/sh").exists());
    final Oracle oracle =
        new SmtLibOracle(
            ImmutableList.of("/bin/sh", "-c", "cat > /dev/null; echo unsat"),
            5_000);
    assertThat(oracle.satisfiable(terms.lt(x, x)),
        is(Oracle.Satisfiability.UNSAT));
    assertThat(oracle.entails(terms.trueLiteral, terms.le(x, x)),
        is(Oracle.Validity.VALID));

    // "sat" is downgraded if the query has uninterpreted terms
    final Oracle sat =
        new SmtLibOracle(
            ImmutableList.of("/bin/sh", "-c", "cat > /dev/null; echo sat"),
            5_000);
    assertThat(sat.satisfiable(terms.gt(x, terms.intLiteral(0))),
        is(Oracle.Satisfiability.SAT));
    assertThat(
        sat.satisfiable(
            terms.gt(terms.getRange(d, x, terms.intLiteral(1)), x)),
        is(Oracle.Satisfiability.UNKNOWN));
  }

  @Test void testMissingSolver() {
    final Oracle oracle =
        new SmtLibOracle(ImmutableList.of("/nonexistent/z3"), 1_000);
    final ProverException e =
        assertThrows(ProverException.class,
            () -> oracle.satisfiable(terms.trueLiteral));
    assertThat(e.getMessage(), containsString("cannot start solver"));
  }
}

// End SmtLibOracleTest.java
