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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Declaration that an operator evaluates some of its arguments before it
 * can be stepped.
 *
 * <p>The arguments are evaluated in the order given by {@link #positions};
 * arguments not listed are left alone.
 */
public final class Strictness {
  public final String op;
  public final int arity;
  /** Zero-based argument positions, in evaluation order. */
  public final ImmutableList<Integer> positions;

  public Strictness(String op, int arity, List<Integer> positions) {
    this.op = requireNonNull(op, "op");
    this.arity = arity;
    this.positions = ImmutableList.copyOf(positions);
    for (int position : this.positions) {
      checkArgument(position >= 0 && position < arity,
          "position %s out of range for %s/%s", position, op, arity);
    }
  }

  /** Declares an operator strict in all arguments, left to right. */
  public static Strictness of(String op, int arity) {
    final ImmutableList.Builder<Integer> b = ImmutableList.builder();
    for (int i = 0; i < arity; i++) {
      b.add(i);
    }
    return new Strictness(op, arity, b.build());
  }

  /** Declares an operator strict in the given arguments, in that order. */
  public static Strictness of(String op, int arity, int... positions) {
    final ImmutableList.Builder<Integer> b = ImmutableList.builder();
    for (int position : positions) {
      b.add(position);
    }
    return new Strictness(op, arity, b.build());
  }

  @Override
  public String toString() {
    return op + "/" + arity + " strict" + positions;
  }
}

// End Strictness.java
