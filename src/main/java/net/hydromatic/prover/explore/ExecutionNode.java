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
package net.hydromatic.prover.explore;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.prover.term.TermBuilder.terms;
import static net.hydromatic.prover.util.Static.append;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.prover.rule.StepResult;
import net.hydromatic.prover.term.Bag;
import net.hydromatic.prover.term.Cell;
import net.hydromatic.prover.term.Seq;
import net.hydromatic.prover.term.Term;
import net.hydromatic.prover.term.Var;

/**
 * Node in a symbolic execution tree.
 *
 * <p>A node is immutable; advancing it creates new nodes. Sibling nodes
 * share no mutable state, so they can be expanded on different threads.
 */
public final class ExecutionNode {
  public final Bag configuration;
  /** Conjuncts of the path condition. */
  public final ImmutableList<Term> pathCondition;
  /** Names of the claims that have been applied as circularities along
   * the path to this node. */
  public final ImmutableList<String> history;
  /** Identifiers of the rules applied along the path to this node. */
  public final ImmutableList<String> trace;
  /** Number of steps from the start of the path. */
  public final int depth;
  /** Next number for naming fresh symbols. */
  public final int freshCounter;

  private ExecutionNode(
      Bag configuration,
      ImmutableList<Term> pathCondition,
      ImmutableList<String> history,
      ImmutableList<String> trace,
      int depth,
      int freshCounter) {
    this.configuration = requireNonNull(configuration);
    this.pathCondition = requireNonNull(pathCondition);
    this.history = requireNonNull(history);
    this.trace = requireNonNull(trace);
    this.depth = depth;
    this.freshCounter = freshCounter;
  }

  /** Creates the root node of a tree. */
  public static ExecutionNode root(
      Bag configuration, List<? extends Term> pathCondition) {
    return new ExecutionNode(configuration,
        ImmutableList.copyOf(pathCondition), ImmutableList.of(),
        ImmutableList.of(), 0, 0);
  }

  @Override
  public String toString() {
    return configuration
        + (pathCondition.isEmpty() ? "" : " if " + condition());
  }

  /** Returns the path condition as one term. */
  public Term condition() {
    return terms.and(pathCondition);
  }

  /** Returns whether the control cell contains nothing but frames. */
  public boolean isExhausted(String controlCell) {
    final Cell cell = configuration.find(controlCell);
    if (cell == null) {
      return false;
    }
    return cell.content instanceof Seq
        ? ((Seq) cell.content).isExhausted()
        : cell.content instanceof Var && ((Var) cell.content).isFrame();
  }

  /** Returns the node reached by a rule application. */
  public ExecutionNode successor(
      StepResult.Successor successor, int freshCounter) {
    return new ExecutionNode(successor.configuration,
        concat(pathCondition, successor.conditions), history,
        append(trace, successor.ruleId), depth + 1, freshCounter);
  }

  /** Returns this node with more conditions. */
  public ExecutionNode constrain(List<Term> conditions) {
    if (conditions.isEmpty()) {
      return this;
    }
    return new ExecutionNode(configuration,
        concat(pathCondition, conditions), history, trace, depth,
        freshCounter);
  }

  /** Returns this node with a different configuration that represents the
   * same states, such as the result of heating and cooling. */
  public ExecutionNode withConfiguration(Bag configuration) {
    if (configuration.equals(this.configuration)) {
      return this;
    }
    return new ExecutionNode(configuration, pathCondition, history, trace,
        depth, freshCounter);
  }

  /** Returns the node reached by applying a claim as a circularity. */
  public ExecutionNode circularity(
      String claimName,
      Bag configuration,
      List<Term> conditions,
      int freshCounter) {
    return new ExecutionNode(configuration,
        concat(pathCondition, conditions), append(history, claimName),
        append(trace, "circularity:" + claimName), depth + 1, freshCounter);
  }

  private static ImmutableList<Term> concat(
      List<Term> list0, List<Term> list1) {
    final ImmutableList.Builder<Term> b = ImmutableList.builder();
    b.addAll(list0);
    for (Term t : list1) {
      if (!t.isBoolean(true) && !list0.contains(t)) {
        b.add(t);
      }
    }
    return b.build();
  }
}

// End ExecutionNode.java
