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

import com.google.common.collect.ImmutableList;

/** Utilities for {@link Oracle}. */
public abstract class Oracles {
  private Oracles() {}

  /** Returns an in-process oracle for linear integer arithmetic. */
  public static Oracle linear(long timeoutMillis) {
    return new LinearOracle(timeoutMillis);
  }

  /** Returns an oracle that runs {@code z3} as an external process. It
   * must be on the path. */
  public static Oracle z3(long timeoutMillis) {
    return new SmtLibOracle(ImmutableList.of("z3", "-in", "-smt2"),
        timeoutMillis);
  }

  /** Returns an oracle that remembers the answers of another. */
  public static CachingOracle cache(Oracle oracle, long maximumSize) {
    return new CachingOracle(oracle, maximumSize);
  }
}

// End Oracles.java
