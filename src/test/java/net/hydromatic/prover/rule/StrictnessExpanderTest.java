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
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import net.hydromatic.prover.term.Apply;
import net.hydromatic.prover.term.Term;
import net.hydromatic.prover.term.Var;
import org.junit.jupiter.api.Test;

/** Tests for {@link StrictnessExpander}. */
public class StrictnessExpanderTest {
  private final RuleDatabase db =
      RuleDatabase.builder()
          .value("i32")
          .strict(Strictness.of("add", 2))
          .strict(Strictness.of("store", 3, 2, 1))
          .build();
  private final StrictnessExpander expander = new StrictnessExpander(db);

  private final Var a = terms.var("A");
  private final Var k = terms.frame("K");

  private static Apply get(int i) {
    return terms.apply("get", terms.intLiteral(i));
  }

  private static Apply i32(Term t) {
    return terms.apply("i32", t);
  }

  @Test void testIsValue() {
    assertThat(expander.isValue(terms.intLiteral(3)), is(true));
    assertThat(expander.isValue(i32(a)), is(true));
    assertThat(expander.isValue(get(0)), is(false));
    assertThat(expander.isValue(a), is(false));
  }

  /** Arguments are heated left to right; each is pulled out in front of a
   * freezer that holds its place. */
  @Test void testHeat() {
    final Term t = expander.expand(terms.seq(terms.apply("add", get(0),
        get(1)), k));
    assertThat(t, hasToString("get(0) ~> add(#hole, get(1)) ~> K"));
  }

  /** A value at the head of the sequence cools into its freezer, and the
   * next strict argument is heated. */
  @Test void testCoolThenHeat() {
    final Term t =
        expander.expand(
            terms.seq(i32(a), terms.apply("add", terms.hole, get(1)), k));
    assertThat(t, hasToString("get(1) ~> add(i32(A), #hole) ~> K"));

    final Term t2 =
        expander.expand(
            terms.seq(i32(terms.intLiteral(2)),
                terms.apply("add", i32(a), terms.hole), k));
    assertThat(t2, hasToString("add(i32(A), i32(2)) ~> K"));
  }

  /** Positions are evaluated in the declared order. */
  @Test void testOrder() {
    final Term t =
        expander.expand(
            terms.seq(terms.apply("store", terms.intLiteral(0), get(1),
                get(2))));
    assertThat(t, hasToString("get(2) ~> store(0, get(1), #hole)"));
  }

  /** Expanding a fully expanded sequence changes nothing. */
  @Test void testFixedPoint() {
    final Term t =
        expander.expand(terms.seq(terms.apply("add", get(0), get(1)), k));
    assertThat(expander.expand(t), sameInstance(t));

    final Term t2 = terms.seq(terms.apply("add", i32(a), i32(a)), k);
    assertThat(expander.expand(t2), sameInstance(t2));
    assertThat(StrictnessExpander.isFreezer(terms.apply("add", terms.hole,
        get(1))), is(true));
  }

  /** An application whose arity differs from the declaration is not
   * heated. */
  @Test void testArity() {
    final Term t = terms.seq(terms.apply("add", get(0)), k);
    assertThat(expander.expand(t), sameInstance(t));
  }
}

// End StrictnessExpanderTest.java
