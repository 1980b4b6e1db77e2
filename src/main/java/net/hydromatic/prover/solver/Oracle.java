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

import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import net.hydromatic.prover.term.Term;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Decision procedure for the background theory: integer arithmetic, booleans
 * and byte-maps.
 *
 * <p>Implementations must be thread-safe. An oracle never approximates: if
 * it cannot decide a query it answers {@code UNKNOWN}, and if it runs out of
 * time it answers {@code TIMEOUT}.
 */
public interface Oracle {
  /** Decides whether {@code assumption} implies {@code goal}. */
  Validity entails(Term assumption, Term goal);

  /** Decides whether a constraint has a model. */
  Satisfiability satisfiable(Term constraint);

  /** Returns a model of a constraint, as a map from each atom (variable or
   * uninterpreted sub-term, printed) to its value, or null if the oracle
   * cannot produce one. */
  default @Nullable ImmutableMap<String, BigInteger> model(Term constraint) {
    return null;
  }

  /** Result of {@link #entails}. */
  enum Validity {
    VALID,
    INVALID,
    UNKNOWN,
    TIMEOUT
  }

  /** Result of {@link #satisfiable}. */
  enum Satisfiability {
    SAT,
    UNSAT,
    UNKNOWN,
    TIMEOUT
  }
}

// End Oracle.java
