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

import com.google.common.collect.ImmutableList;
import net.hydromatic.prover.rule.Rule;
import net.hydromatic.prover.rule.RuleDatabase;
import net.hydromatic.prover.rule.RuleModule;
import net.hydromatic.prover.term.Term;
import net.hydromatic.prover.term.Var;

/**
 * Trusted lemma modules over integer and byte-map arithmetic.
 *
 * <p>These lemmas have been checked by hand, not by the engine. Each is
 * scoped by the invariants it relies on; for example, reading back bytes
 * that were just read and written is the identity only on a byte-map.
 */
public abstract class StandardLemmas {
  private StandardLemmas() {}

  /** Name of the module of integer arithmetic lemmas. */
  public static final String INT_ARITH = "int-arith";

  /** Name of the module of byte-map lemmas. */
  public static final String BYTEMAP = "bytemap";

  private static final Var X = terms.var("X");
  private static final Var N = terms.var("N");
  private static final Var M = terms.var("M");
  private static final Var P = terms.var("P");
  private static final Var Q = terms.var("Q");
  private static final Var V = terms.var("V");
  private static final Var W = terms.var("W");
  private static final Var W1 = terms.var("W1");
  private static final Var W2 = terms.var("W2");

  /** Adds the standard modules to a database. */
  public static RuleDatabase.Builder addTo(RuleDatabase.Builder builder) {
    return builder.add(intArith()).add(byteMap());
  }

  /** Returns the module of integer arithmetic lemmas. */
  public static RuleModule intArith() {
    return new RuleModule(INT_ARITH,
        ImmutableList.of(
            // X mod N is X if X is already in range
            Rule.lemma("mod-in-range", terms.mod(X, N), X,
                terms.and(terms.le(terms.intLiteral(0), X), terms.lt(X, N))),
            Rule.lemma("mod-mod", terms.mod(terms.mod(X, N), N),
                terms.mod(X, N), terms.gt(N, terms.intLiteral(0)))));
  }

  /** Returns the module of byte-map lemmas. */
  public static RuleModule byteMap() {
    return new RuleModule(BYTEMAP,
        ImmutableList.of(
            Rule.lemma("get-set-same",
                terms.getRange(terms.setRange(M, P, V, W), Q, W),
                terms.mod(V, byteRange(W)),
                terms.eqInt(P, Q)),
            Rule.lemma("get-set-disjoint",
                terms.getRange(terms.setRange(M, P, V, W1), Q, W2),
                terms.getRange(M, Q, W2),
                terms.or(terms.le(terms.plus(Q, W2), P),
                    terms.le(terms.plus(P, W1), Q))),
            Rule.lemma("set-get-same",
                terms.setRange(M, P, terms.getRange(M, P, W), W), M,
                terms.isByteMap(M)),
            Rule.lemma("get-mod",
                terms.mod(terms.getRange(M, P, W), N),
                terms.getRange(M, P, W),
                terms.and(terms.isByteMap(M), terms.eqInt(N, byteRange(W)))),
            // a store writes only bytes, so it preserves the invariant
            Rule.lemma("is-byte-map-set",
                terms.isByteMap(terms.setRange(M, P, V, W)),
                terms.trueLiteral, terms.isByteMap(M))));
  }

  /** Returns {@code 2 ^Int (8 *Int w)}, the number of distinct values of
   * {@code w} bytes. */
  private static Term byteRange(Term w) {
    return terms.pow(terms.intLiteral(2), terms.times(terms.intLiteral(8), w));
  }
}

// End StandardLemmas.java
