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
package net.hydromatic.prover.prove;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.prover.explore.ExecutionNode;
import net.hydromatic.prover.explore.Explorer;

/**
 * Working set of an attempt to prove one claim.
 *
 * <p>The open nodes belong to the {@link Explorer}; this object records
 * the claims that may be applied as circularities, and the branches that
 * have been closed. Branches close on several threads, so the mutators are
 * synchronized.
 */
class ProofState {
  final Claim claim;
  /** Claims that may be applied as circularities. */
  final ImmutableList<Claim> hypotheses;
  private final List<ExecutionNode> discharged = new ArrayList<>();
  private int circularities;

  ProofState(Claim claim, List<Claim> hypotheses) {
    this.claim = requireNonNull(claim);
    this.hypotheses = ImmutableList.copyOf(hypotheses);
  }

  /** Records that a branch reached the claim's right-hand side, or
   * cannot be reached. */
  synchronized void discharge(ExecutionNode node) {
    discharged.add(node);
  }

  /** Records that a claim was applied as a circularity. */
  synchronized void circularity() {
    ++circularities;
  }

  synchronized int dischargedCount() {
    return discharged.size();
  }

  synchronized int circularityCount() {
    return circularities;
  }
}

// End ProofState.java
