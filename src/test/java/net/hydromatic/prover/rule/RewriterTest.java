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

import static net.hydromatic.prover.term.TermBuilder.terms;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.prover.lemma.LemmaSet;
import net.hydromatic.prover.lemma.Simplifier;
import net.hydromatic.prover.solver.LinearOracle;
import net.hydromatic.prover.solver.Oracle;
import net.hydromatic.prover.term.Bag;
import net.hydromatic.prover.term.Term;
import net.hydromatic.prover.term.Var;
import net.hydromatic.prover.util.OracleTimeoutException;
import net.hydromatic.prover.util.Tracers;
import org.junit.jupiter.api.Test;

/** Tests for {@link Rewriter}. */
public class RewriterTest {
  private static final Var N = terms.var("N");
  private static final Var V = terms.var("V");
  private static final Var K = terms.frame("K");
  private static final Term ZERO = terms.intLiteral(0);

  /** A machine with a control cell and a counter. */
  private static final RuleDatabase DB =
      RuleDatabase.builder()
          .add(
              new RuleModule("counter",
                  ImmutableList.of(
                      Rule.step("inc",
                          config(terms.seq(terms.apply("inc"), K), N),
                          config(terms.seq(K),
                              terms.plus(N, terms.intLiteral(1)))),
                      Rule.step("sign-pos",
                          config(terms.seq(terms.apply("sign"), K), N),
                          config(terms.seq(terms.apply("pos"), K), N),
                          terms.gt(N, ZERO)),
                      Rule.step("sign-neg",
                          config(terms.seq(terms.apply("sign"), K), N),
                          config(terms.seq(terms.apply("neg"), K), N),
                          terms.lt(N, ZERO)),
                      Rule.step("sign-zero",
                          config(terms.seq(terms.apply("sign"), K), N),
                          config(terms.seq(terms.apply("zero"), K), N),
                          terms.trueLiteral, Rule.OWISE_PRIORITY),
                      Rule.step("havoc",
                          config(terms.seq(terms.apply("havoc"), K),
                              terms.wildcard()),
                          config(terms.seq(K), V)))))
          .build();

  private static Bag config(Term k, Term n) {
    return terms.bag(terms.cell("k", k), terms.cell("n", n));
  }

  private static Rewriter rewriter(Oracle oracle) {
    final Simplifier simplifier =
        new Simplifier(LemmaSet.EMPTY, oracle, 32);
    return new Rewriter(DB, ImmutableList.of("counter"), simplifier, oracle,
        "k", Tracers.nullTracer());
  }

  private final Rewriter rewriter = rewriter(new LinearOracle(5_000));

  private static List<String> ruleIds(StepResult result) {
    final List<String> list = new ArrayList<>();
    result.successors.forEach(s -> list.add(s.ruleId));
    return list;
  }

  @Test void testConcrete() {
    final StepResult result =
        rewriter.step(
            config(terms.seq(terms.apply("inc"), terms.apply("inc")),
                terms.intLiteral(41)),
            ImmutableList.of(), 0);
    assertThat(ruleIds(result), is(ImmutableList.of("inc")));
    final StepResult.Successor s = result.successors.get(0);
    assertThat(s.conditions, empty());
    assertThat(s.configuration,
        hasToString("<k> inc </k> <n> 42 </n>"));
  }

  /** A symbolic counter splits three ways. The "otherwise" rule applies
   * in the residual state, where neither of the others did. */
  @Test void testBranch() {
    final StepResult result =
        rewriter.step(config(terms.seq(terms.apply("sign")), N),
            ImmutableList.of(), 0);
    assertThat(ruleIds(result),
        is(ImmutableList.of("sign-pos", "sign-neg", "sign-zero")));
    assertThat(result.successors.get(0).conditions, hasSize(1));
    assertThat(result.successors.get(1).conditions, hasSize(1));
    assertThat(result.successors.get(2).conditions, hasSize(2));
    // "sign-zero" is total in the residual state, so nothing is left
    assertThat(result.residuals, empty());
  }

  /** The path condition decides which rule applies. */
  @Test void testPathCondition() {
    final StepResult result =
        rewriter.step(config(terms.seq(terms.apply("sign")), N),
            ImmutableList.of(terms.gt(N, terms.intLiteral(5))), 0);
    assertThat(ruleIds(result), is(ImmutableList.of("sign-pos")));
    assertThat(result.successors.get(0).conditions, empty());

    final StepResult result2 =
        rewriter.step(config(terms.seq(terms.apply("sign")), ZERO),
            ImmutableList.of(), 0);
    assertThat(ruleIds(result2), is(ImmutableList.of("sign-zero")));
  }

  @Test void testStuck() {
    final StepResult result =
        rewriter.step(config(terms.seq(terms.apply("halt")), N),
            ImmutableList.of(), 0);
    assertThat(result.isFinal(), is(true));
    assertThat(result.residuals,
        is(ImmutableList.of(ImmutableList.<Term>of())));
  }

  /** A variable that occurs only on the right-hand side becomes a fresh
   * symbol, named using the counter. */
  @Test void testFresh() {
    final StepResult result =
        rewriter.step(
            config(terms.seq(terms.apply("havoc"), terms.apply("havoc")),
                ZERO),
            ImmutableList.of(), 3);
    assertThat(result.successors.get(0).configuration,
        hasToString("<k> havoc </k> <n> ?V3 </n>"));
    assertThat(result.freshCounter, is(4));
  }

  @Test void testTimeout() {
    final Oracle timingOut =
        new Oracle() {
          @Override public Validity entails(Term assumption, Term goal) {
            return Validity.TIMEOUT;
          }

          @Override public Satisfiability satisfiable(Term constraint) {
            return Satisfiability.TIMEOUT;
          }
        };
    final Rewriter r = rewriter(timingOut);
    assertThrows(OracleTimeoutException.class, () ->
        r.step(config(terms.seq(terms.apply("sign")), N),
            ImmutableList.of(), 0));
  }
}

// End RewriterTest.java
