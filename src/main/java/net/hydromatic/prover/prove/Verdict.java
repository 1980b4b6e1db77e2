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
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.List;
import net.hydromatic.prover.term.Bag;
import net.hydromatic.prover.term.Term;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Outcome of an attempt to prove a claim. */
public abstract class Verdict {
  public final String claimName;
  public final Kind kind;

  private Verdict(String claimName, Kind kind) {
    this.claimName = requireNonNull(claimName);
    this.kind = requireNonNull(kind);
  }

  /** Creates a verdict that a claim holds. */
  public static Proved proved(
      String claimName, int steps, int branches, int circularities) {
    return new Proved(claimName, steps, branches, circularities);
  }

  /** Creates a verdict that a claim does not hold. */
  public static Disproved disproved(
      String claimName,
      String reason,
      List<String> path,
      Bag configuration,
      Term pathCondition,
      @Nullable ImmutableMap<String, BigInteger> model) {
    return new Disproved(claimName, reason, ImmutableList.copyOf(path),
        configuration, pathCondition, model);
  }

  /** Creates a verdict that it is not known whether a claim holds. */
  public static Inconclusive inconclusive(
      String claimName, String reason, long count) {
    return new Inconclusive(claimName, reason, count);
  }

  /** Kind of verdict. */
  public enum Kind {
    PROVED, DISPROVED, INCONCLUSIVE
  }

  /** Every branch reached the claim's right-hand side, or re-entered a
   * claim. */
  public static final class Proved extends Verdict {
    public final int steps;
    /** Number of branches closed. */
    public final int branches;
    /** Number of times a claim was applied as a circularity. */
    public final int circularities;

    Proved(String claimName, int steps, int branches, int circularities) {
      super(claimName, Kind.PROVED);
      this.steps = steps;
      this.branches = branches;
      this.circularities = circularities;
    }

    @Override
    public String toString() {
      return "proved " + claimName + " (" + steps + " steps, " + branches
          + " branches, " + circularities + " circularities)";
    }
  }

  /** A branch that can be reached is stuck, or ends in a configuration
   * that does not satisfy the right-hand side. */
  public static final class Disproved extends Verdict {
    public final String reason;
    /** Identifiers of the rules applied along the failing branch. */
    public final ImmutableList<String> path;
    /** The configuration at the end of the failing branch. */
    public final Bag configuration;
    public final Term pathCondition;
    /** Values of the symbols in a state that reaches the failure, if the
     * oracle provided them. */
    public final @Nullable ImmutableMap<String, BigInteger> model;

    Disproved(
        String claimName,
        String reason,
        ImmutableList<String> path,
        Bag configuration,
        Term pathCondition,
        @Nullable ImmutableMap<String, BigInteger> model) {
      super(claimName, Kind.DISPROVED);
      this.reason = requireNonNull(reason);
      this.path = requireNonNull(path);
      this.configuration = requireNonNull(configuration);
      this.pathCondition = requireNonNull(pathCondition);
      this.model = model;
    }

    @Override
    public String toString() {
      return "disproved " + claimName + ": " + reason + " after " + path
          + (model == null ? "" : " with " + model);
    }
  }

  /** The search reached a bound, or the oracle could not answer. */
  public static final class Inconclusive extends Verdict {
    public final String reason;
    /** Value of the resource when the search stopped. */
    public final long count;

    Inconclusive(String claimName, String reason, long count) {
      super(claimName, Kind.INCONCLUSIVE);
      this.reason = requireNonNull(reason);
      this.count = count;
    }

    @Override
    public String toString() {
      return "inconclusive " + claimName + ": " + reason + " at " + count;
    }
  }
}

// End Verdict.java
