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
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import net.hydromatic.prover.term.Bag;
import net.hydromatic.prover.term.Term;
import net.hydromatic.prover.term.Var;
import net.hydromatic.prover.util.ProverException;
import net.hydromatic.prover.util.RuleException;
import org.junit.jupiter.api.Test;

/** Tests for {@link Rule}, {@link RuleDatabase} and {@link CellSchema}. */
public class RuleTest {
  private final Var n = terms.var("N");
  private final Var v = terms.var("V");
  private final Var k = terms.frame("K");

  private Bag config(Term kContent, Term nContent) {
    return terms.bag(terms.cell("k", kContent), terms.cell("n", nContent));
  }

  @Test void testToString() {
    final Rule rule =
        Rule.step("inc",
            config(terms.seq(terms.apply("inc"), k), n),
            config(terms.seq(k), terms.plus(n, terms.intLiteral(1))),
            terms.ge(n, terms.intLiteral(0)));
    assertThat(rule,
        hasToString("rule [inc]: <k> inc ~> K </k> <n> N </n> => "
            + "<k> K </k> <n> N +Int 1 </n> requires N >=Int 0"));
    assertThat(rule.freshVariables().isEmpty(), is(true));
    assertThat(rule.priority, is(Rule.DEFAULT_PRIORITY));
  }

  /** A variable that occurs only on the right-hand side is fresh. */
  @Test void testFreshVariables() {
    final Rule rule =
        Rule.step("havoc",
            config(terms.seq(terms.apply("havoc"), k), terms.wildcard()),
            config(terms.seq(k), v));
    assertThat(rule.freshVariables(), is(ImmutableSet.of(v)));
  }

  @Test void testInvalidRules() {
    final RuleException e =
        assertThrows(RuleException.class, () ->
            Rule.step("bad",
                config(terms.seq(k), n),
                terms.bag(terms.cell("k", terms.seq(k)))));
    assertThat(e.getMessage(), containsString("same cells"));
    assertThat(e.ruleId(), is("bad"));

    final RuleException e2 =
        assertThrows(RuleException.class, () ->
            Rule.step("bad2", config(terms.seq(k), n),
                config(terms.seq(k), n), terms.ge(v, terms.intLiteral(0))));
    assertThat(e2.getMessage(),
        containsString("variable V in condition is not bound"));

    final RuleException e3 =
        assertThrows(RuleException.class, () ->
            Rule.step("bad3",
                config(terms.seq(k, terms.frame("K2")), n),
                config(terms.seq(k), n)));
    assertThat(e3.getMessage(), containsString("more than one frame"));

    final RuleException e4 =
        assertThrows(RuleException.class, () ->
            Rule.lemma("bad4", terms.apply("f", n), n));
    assertThat(e4.getMessage(), containsString("built-in function"));

    final RuleException e5 =
        assertThrows(RuleException.class, () ->
            Rule.lemma("bad5", terms.plus(n, terms.intLiteral(0)), v));
    assertThat(e5.getMessage(), containsString("right-hand side"));
  }

  @Test void testGroups() {
    final Rule a =
        Rule.step("a", config(terms.seq(k), n), config(terms.seq(k), n));
    final Rule b =
        Rule.step("b", config(terms.seq(k), n), config(terms.seq(k), n),
            terms.trueLiteral, Rule.OWISE_PRIORITY);
    final Rule c =
        Rule.step("c", config(terms.seq(k), n), config(terms.seq(k), n),
            terms.trueLiteral, 10);
    final List<ImmutableList<Rule>> groups =
        Rule.groups(ImmutableList.of(a, b, c));
    assertThat(groups,
        is(
            ImmutableList.of(ImmutableList.of(c), ImmutableList.of(a),
                ImmutableList.of(b))));
  }

  @Test void testReplaceAt() {
    final Bag bag =
        terms.bag(terms.cell("k", terms.seq()),
            terms.cell("mem",
                terms.bag(terms.cell("data", terms.map()),
                    terms.cell("size", n))));
    final Bag bag2 =
        Rule.replaceAt(bag, ImmutableList.of(1, 1), terms.intLiteral(8));
    assertThat(Rule.cellAt(bag2, ImmutableList.of(1, 1)),
        is(terms.cell("size", terms.intLiteral(8))));
    assertThat(Rule.cellAt(bag2, ImmutableList.of(0)),
        is(terms.cell("k", terms.seq())));
  }

  @Test void testDatabase() {
    final RuleModule m =
        new RuleModule("m",
            ImmutableList.of(
                Rule.step("s", config(terms.seq(k), n),
                    config(terms.seq(k), n)),
                Rule.lemma("l", terms.plus(n, terms.intLiteral(0)), n)));
    final RuleDatabase db = RuleDatabase.builder().add(m).build();
    assertThat(db.rules(ImmutableList.of("m"), Rule.Kind.STEP).size(),
        is(1));
    assertThat(db.rules(ImmutableList.of("m"), Rule.Kind.LEMMA).size(),
        is(1));
    final ProverException e =
        assertThrows(ProverException.class, () -> db.module("x"));
    assertThat(e.getMessage(), is("unknown module 'x'; available: [m]"));
    assertThrows(ProverException.class,
        () -> RuleDatabase.builder().add(m).add(m));
  }

  @Test void testCellSchema() {
    final CellSchema schema =
        CellSchema.of(
            ImmutableMap.of("k", CellSchema.Multiplicity.SINGLETON,
                "thread", CellSchema.Multiplicity.MULTIPLE));
    schema.validate("c", config(terms.seq(), n));
    schema.validate("c",
        terms.bag(terms.cell("k", terms.seq()),
            terms.cell("thread", n), terms.cell("thread", v)));

    final RuleException e =
        assertThrows(RuleException.class, () ->
            schema.validate("c",
                terms.bag(terms.cell("k", terms.seq()),
                    terms.cell("k", terms.seq()))));
    assertThat(e.getMessage(), containsString("singleton cell k occurs 2"));

    final RuleException e2 =
        assertThrows(RuleException.class, () ->
            schema.validate("c", terms.bag(terms.cell("n", n))));
    assertThat(e2.getMessage(), containsString("missing cell k"));
  }
}

// End RuleTest.java
