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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import net.hydromatic.prover.term.Bag;
import net.hydromatic.prover.term.Term;

/**
 * Result of applying the rules of a database to a configuration once.
 *
 * <p>Each {@link Successor} is the result of one rule applied under one
 * match, valid under the conditions it adds to the path condition.
 * Each element of {@link #residuals} is a set of conditions under which no
 * rule applies; if the list is empty, some rule applies in every state the
 * configuration represents.
 */
public final class StepResult {
  public final ImmutableList<Successor> successors;
  public final ImmutableList<ImmutableList<Term>> residuals;
  /** Value of the fresh-name counter after this step. */
  public final int freshCounter;

  StepResult(
      ImmutableList<Successor> successors,
      ImmutableList<ImmutableList<Term>> residuals,
      int freshCounter) {
    this.successors = requireNonNull(successors);
    this.residuals = requireNonNull(residuals);
    this.freshCounter = freshCounter;
  }

  @Override
  public String toString() {
    return "StepResult{successors=" + successors
        + ", residuals=" + residuals + "}";
  }

  /** Returns whether no rule applied in any state. */
  public boolean isFinal() {
    return successors.isEmpty();
  }

  /** Configuration produced by one rule application. */
  public static final class Successor {
    public final Bag configuration;
    /** Conditions to add to the path condition. */
    public final ImmutableList<Term> conditions;
    public final String ruleId;

    Successor(
        Bag configuration, ImmutableList<Term> conditions, String ruleId) {
      this.configuration = requireNonNull(configuration);
      this.conditions = requireNonNull(conditions);
      this.ruleId = requireNonNull(ruleId);
    }

    @Override
    public String toString() {
      return "[" + ruleId + "] " + configuration
          + (conditions.isEmpty() ? "" : " if " + conditions);
    }
  }
}

// End StepResult.java
