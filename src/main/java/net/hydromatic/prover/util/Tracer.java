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
package net.hydromatic.prover.util;

import net.hydromatic.prover.term.Term;

/** Called on various events during symbolic execution and proof. */
public interface Tracer {
  /** Called when a rule rewrites a configuration. */
  void onStep(String ruleId, Term before, Term after);

  /** Called when a path splits on a condition that the solver cannot
   * decide; one successor assumes the condition, the other its negation. */
  void onBranch(String ruleId, Term condition);

  /** Called when a claim is applied as a circularity. */
  void onCircularity(String claimName, Term configuration);

  /** Called when a branch is closed; {@code status} is "terminal",
   * "circular", "vacuous", "stuck", "falsified" or "infeasible". */
  void onNodeClosed(String status, Term configuration);

  /** Called with the result of a solver query. */
  void onOracle(String query, Term goal, String result);

  /** Called when the verdict for a claim has been reached. */
  void onVerdict(String claimName, String verdict);
}

// End Tracer.java
