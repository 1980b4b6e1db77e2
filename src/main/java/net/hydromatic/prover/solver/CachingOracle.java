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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.prover.term.TermBuilder.terms;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.prover.term.Substitution;
import net.hydromatic.prover.term.Term;
import net.hydromatic.prover.term.Var;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Oracle that remembers the answers of another oracle.
 *
 * <p>Queries are identified modulo renaming of variables: the variables of
 * a query are renamed in order of first occurrence before it is looked up,
 * so two path conditions that differ only in the names of their fresh
 * symbols share an entry. Timeouts are not remembered.
 *
 * <p>The cache is safe for use by concurrent threads.
 */
public class CachingOracle implements Oracle {
  private final Oracle oracle;
  private final Cache<Term, Object> cache;

  public CachingOracle(Oracle oracle, long maximumSize) {
    this.oracle = requireNonNull(oracle);
    this.cache =
        CacheBuilder.newBuilder()
            .maximumSize(maximumSize)
            .recordStats()
            .build();
  }

  @Override
  public String toString() {
    return "CachingOracle(" + oracle + ")";
  }

  /** Returns the hit and miss counts. */
  public CacheStats stats() {
    return cache.stats();
  }

  @Override
  public Validity entails(Term assumption, Term goal) {
    final Term key =
        canonize(terms.apply("#entails", assumption, goal));
    final Object value = cache.getIfPresent(key);
    if (value != null) {
      return (Validity) value;
    }
    final Validity validity = oracle.entails(assumption, goal);
    if (validity != Validity.TIMEOUT) {
      cache.put(key, validity);
    }
    return validity;
  }

  @Override
  public Satisfiability satisfiable(Term constraint) {
    final Term key = canonize(terms.apply("#satisfiable", constraint));
    final Object value = cache.getIfPresent(key);
    if (value != null) {
      return (Satisfiability) value;
    }
    final Satisfiability satisfiability = oracle.satisfiable(constraint);
    if (satisfiability != Satisfiability.TIMEOUT) {
      cache.put(key, satisfiability);
    }
    return satisfiability;
  }

  /** {@inheritDoc}
   *
   * <p>Models are named after the caller's variables, so they are not
   * cached. */
  @Override
  public @Nullable ImmutableMap<String, BigInteger> model(Term constraint) {
    return oracle.model(constraint);
  }

  /** Renames the variables of a term to {@code $0}, {@code $1}, and so
   * forth, in order of first occurrence. */
  static Term canonize(Term term) {
    final ImmutableList<Var> vars = term.variables().asList();
    if (vars.isEmpty()) {
      return term;
    }
    final Map<Var, Term> map = new LinkedHashMap<>();
    for (int i = 0; i < vars.size(); i++) {
      final Var v = vars.get(i);
      map.put(v, v.rename("$" + i));
    }
    return Substitution.of(map).apply(term);
  }
}

// End CachingOracle.java
