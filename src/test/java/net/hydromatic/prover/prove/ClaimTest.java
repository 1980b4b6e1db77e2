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

import static net.hydromatic.prover.term.TermBuilder.terms;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.prover.term.Bag;
import net.hydromatic.prover.term.Term;
import net.hydromatic.prover.term.Var;
import net.hydromatic.prover.util.RuleException;
import org.junit.jupiter.api.Test;

/** Tests for {@link Claim}. */
public class ClaimTest {
  private static final Var K = terms.frame("K");
  private static final Var N = terms.var("N");
  private static final Var M = terms.var("M");

  private static Bag config(Term k, Term n, Term m) {
    return terms.bag(terms.cell("k", k),
        terms.cell("state",
            terms.bag(terms.cell("n", n), terms.cell("m", m))));
  }

  /** Cells that the right-hand side does not mention are unchanged; nested
   * cells are completed too. */
  @Test void testTarget() {
    final Claim claim =
        Claim.of("inc",
            config(terms.seq(terms.apply("inc"), K), N, M),
            terms.bag(terms.cell("k", terms.seq(K)),
                terms.cell("state",
                    terms.bag(
                        terms.cell("n", terms.plus(N, terms.intLiteral(1)))))),
            terms.ge(N, terms.intLiteral(0)), terms.gt(M, N));
    assertThat(claim.target,
        hasToString("<k> K </k> <state> <n> N +Int 1 </n> <m> M </m> "
            + "</state>"));
    assertThat(claim,
        hasToString("claim [inc]: <k> inc ~> K </k> <state> <n> N </n> "
            + "<m> M </m> </state> => <k> K </k> <state> "
            + "<n> N +Int 1 </n> </state> requires N >=Int 0 "
            + "ensures M >Int N"));
    assertThat(claim.trusted, is(false));
    assertThat(claim.trusted().trusted, is(true));
    assertThat(claim.trusted().toString().startsWith("trusted claim [inc]"),
        is(true));
  }

  /** Each anonymous variable becomes a distinct symbol. */
  @Test void testWildcards() {
    final Claim claim =
        Claim.of("w",
            config(terms.seq(), terms.wildcard(), terms.wildcard()),
            terms.bag(terms.cell("k", terms.seq())));
    assertThat(claim.lhs,
        hasToString("<k> . </k> <state> <n> _0 </n> <m> _1 </m> </state>"));
    assertThat(claim.lhs.variables().size(), is(2));
  }

  @Test void testInvalid() {
    final RuleException e =
        assertThrows(RuleException.class, () ->
            Claim.of("bad", config(terms.seq(), N, M),
                terms.bag(terms.cell("x", N))));
    assertThat(e.getMessage().contains("cell x of right-hand side does not "
        + "occur in left-hand side"), is(true));

    final RuleException e2 =
        assertThrows(RuleException.class, () ->
            Claim.of("bad", config(terms.seq(), N, M),
                terms.bag(terms.cell("k", terms.seq())),
                terms.trueLiteral, terms.gt(terms.var("Z"), N)));
    assertThat(e2.getMessage().contains("variable Z in postcondition"),
        is(true));
  }
}

// End ClaimTest.java
