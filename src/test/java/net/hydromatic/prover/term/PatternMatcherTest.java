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
package net.hydromatic.prover.term;

import static net.hydromatic.prover.term.TermBuilder.terms;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link PatternMatcher}. */
public class PatternMatcherTest {
  private final Var x = terms.var("X");
  private final Var y = terms.var("Y");
  private final Var a = terms.var("A");
  private final Var rest = terms.frame("REST");
  private final Var l = terms.frame("L");
  private final Literal zero = terms.intLiteral(0);
  private final Literal one = terms.intLiteral(1);

  @Test void testBind() {
    final PatternMatcher.Match m =
        PatternMatcher.STRICT.match(terms.apply("f", x, y),
            terms.apply("f", one, terms.apply("g", a)));
    assertThat(m, notNullValue());
    assertThat(m.subst.get(x), is(one));
    assertThat(m.subst.get(y), is(terms.apply("g", a)));
    assertThat(m.constraints, empty());

    assertThat(
        PatternMatcher.STRICT.match(terms.apply("f", x),
            terms.apply("g", one)),
        nullValue());
  }

  /** A variable that occurs twice must match equal sub-terms. */
  @Test void testNonLinear() {
    final Apply pattern = terms.apply("f", x, x);
    assertThat(
        PatternMatcher.STRICT.match(pattern, terms.apply("f", a, a)),
        notNullValue());
    assertThat(
        PatternMatcher.STRICT.match(pattern, terms.apply("f", one, zero)),
        nullValue());
    assertThat(
        PatternMatcher.DEFERRING.match(pattern,
            terms.apply("f", one, zero)),
        nullValue());
  }

  /** The deferring matcher turns a difference between symbolic terms into
   * a constraint. */
  @Test void testDeferring() {
    final Apply pattern = terms.apply("f", x, x);
    final Apply subject = terms.apply("f", a, terms.plus(a, zero));
    assertThat(PatternMatcher.STRICT.match(pattern, subject), nullValue());
    final PatternMatcher.Match m =
        PatternMatcher.DEFERRING.match(pattern, subject);
    assertThat(m, notNullValue());
    assertThat(m.constraints,
        is(ImmutableList.of(terms.eqInt(a, terms.plus(a, zero)))));
    assertThat(m, hasToString("[A/X] if A ==Int A +Int 0"));
  }

  /** A literal in a pattern against a symbolic subject term. */
  @Test void testDeferLiteral() {
    final Apply pattern = terms.apply("i32", zero);
    assertThat(
        PatternMatcher.STRICT.match(pattern, terms.apply("i32", a)),
        nullValue());
    final PatternMatcher.Match m =
        PatternMatcher.DEFERRING.match(pattern, terms.apply("i32", a));
    assertThat(m, notNullValue());
    assertThat(m.constraints, is(ImmutableList.of(terms.eqInt(zero, a))));
  }

  @Test void testSeqFrame() {
    final Apply head = terms.apply("local.get", zero);
    final PatternMatcher.Match m =
        PatternMatcher.STRICT.match(terms.seq(head, rest),
            terms.seq(head, terms.apply("b"), terms.apply("c")));
    assertThat(m, notNullValue());
    assertThat(m.subst.get(rest),
        is(terms.seq(terms.apply("b"), terms.apply("c"))));

    // a frame matches the empty sequence
    final PatternMatcher.Match m2 =
        PatternMatcher.STRICT.match(terms.seq(head, rest), terms.seq(head));
    assertThat(m2, notNullValue());
    assertThat(m2.subst.get(rest), is(terms.seq()));

    // a non-frame variable does not match a frame; the frame might be
    // empty
    assertThat(
        PatternMatcher.STRICT.match(terms.seq(x, rest),
            terms.seq(terms.frame("K"))),
        nullValue());
  }

  /** A key that is bound selects a single entry; the frame takes the
   * rest. */
  @Test void testMapBoundKey() {
    final MapTerm subject =
        terms.mapWithFrame(terms.frame("M"), zero, a, one,
            terms.apply("i32", y));
    final PatternMatcher.Match m =
        PatternMatcher.STRICT.match(terms.mapWithFrame(l, x, y), subject,
            Substitution.of(ImmutableMap.of(x, one)));
    assertThat(m, notNullValue());
    assertThat(m.subst.get(y), is(terms.apply("i32", y)));
    assertThat(m.subst.get(l),
        is(terms.mapWithFrame(terms.frame("M"), zero, a)));
  }

  /** An unbound key tries every entry, in key order. */
  @Test void testMapUnboundKey() {
    final MapTerm subject = terms.map(one, a, zero, y);
    final List<PatternMatcher.Match> matches =
        PatternMatcher.STRICT.matchAll(terms.mapWithFrame(l, x, y), subject);
    assertThat(matches, hasSize(2));
    assertThat(matches.get(0).subst.get(x), is(zero));
    assertThat(matches.get(1).subst.get(x), is(one));

    // without a frame, the pattern must account for every entry
    assertThat(
        PatternMatcher.STRICT.matchAll(terms.map(x, y), subject), empty());
  }

  /** Matches come out in the same order however the subject was built
   * and however often the match is repeated. */
  @Test void testMatchOrderIsDeterministic() {
    final Literal two = terms.intLiteral(2);
    final MapTerm subject = terms.map(two, y, zero, a, one, x);
    final MapTerm subject2 = terms.map(one, x, two, y, zero, a);
    final MapTerm pattern = terms.mapWithFrame(l, x, y);
    final List<PatternMatcher.Match> matches =
        PatternMatcher.STRICT.matchAll(pattern, subject);
    assertThat(matches, hasSize(3));
    assertThat(matches.get(0).subst.get(x), is(zero));
    assertThat(matches.get(1).subst.get(x), is(one));
    assertThat(matches.get(2).subst.get(x), is(two));
    final String expected = matches.toString();
    assertThat(PatternMatcher.STRICT.matchAll(pattern, subject),
        hasToString(expected));
    assertThat(PatternMatcher.STRICT.matchAll(pattern, subject2),
        hasToString(expected));
  }

  /** Cells match by name, in any order, and the match records which
   * subject cell each pattern cell matched. */
  @Test void testBag() {
    final Bag subject =
        terms.bag(terms.cell("stack", terms.seq()),
            terms.cell("k", terms.seq(terms.apply("nop"))),
            terms.cell("mem",
                terms.bag(terms.cell("size", a),
                    terms.cell("data", terms.map()))));
    final Bag pattern =
        terms.bag(terms.cell("k", terms.seq(x, rest)),
            terms.cell("mem", terms.bag(terms.cell("data", y))));
    final PatternMatcher.Match m =
        PatternMatcher.STRICT.match(pattern, subject);
    assertThat(m, notNullValue());
    assertThat(m.subst.get(x), is(terms.apply("nop")));
    assertThat(m.subst.get(y), is(terms.map()));
    assertThat(m.cells.get(ImmutableList.of(0)), is(ImmutableList.of(1)));
    assertThat(m.cells.get(ImmutableList.of(1)), is(ImmutableList.of(2)));
    assertThat(m.cells.get(ImmutableList.of(1, 0)),
        is(ImmutableList.of(2, 1)));

    assertThat(
        PatternMatcher.STRICT.match(
            terms.bag(terms.cell("locals", terms.wildcard())), subject),
        nullValue());
  }

  @Test void testWildcard() {
    final Var w = terms.wildcard();
    final PatternMatcher.Match m =
        PatternMatcher.STRICT.match(terms.apply("f", w, w),
            terms.apply("f", one, zero));
    assertThat(m, notNullValue());
    assertThat(m.subst.isEmpty(), is(true));
  }
}

// End PatternMatcherTest.java
