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
package net.hydromatic.prover.term;

import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Term: a variable, a literal, an application of an operator, or one of the
 * structural forms that make up configurations (sequences, maps, cells and
 * bags of cells).
 *
 * <p>Terms are immutable. Two terms are equal if they have the same
 * structure; maps compare by key set, sequences and bags by position.
 */
public abstract class Term {
  /** Kind of term. */
  public final Kind kind;

  Term(Kind kind) {
    this.kind = kind;
  }

  @Override
  public String toString() {
    return unparse(new StringBuilder()).toString();
  }

  /** Appends this term to a string builder. */
  public abstract StringBuilder unparse(StringBuilder buf);

  /** Accepts a shuttle, returning a term with the same or new contents. */
  public abstract Term accept(TermShuttle shuttle);

  /** Adds every variable (of any kind but wildcard) in this term to a set. */
  abstract void collectVariables(Set<Var> variables);

  /** Returns the variables in this term, in order of first occurrence. */
  public ImmutableSet<Var> variables() {
    final Set<Var> set = new LinkedHashSet<>();
    collectVariables(set);
    return ImmutableSet.copyOf(set);
  }

  /** Returns whether this term contains no variables. */
  public boolean isGround() {
    return variables().isEmpty();
  }

  /** Returns whether this term is a literal integer. */
  public boolean isInteger() {
    return this instanceof Literal && ((Literal) this).value instanceof Number;
  }

  /** Returns whether this term is a literal boolean with a given value. */
  public boolean isBoolean(boolean b) {
    return this instanceof Literal
        && ((Literal) this).value instanceof Boolean
        && (Boolean) ((Literal) this).value == b;
  }

  /** Kinds of term. */
  public enum Kind {
    VAR,
    LITERAL,
    APPLY,
    SEQ,
    MAP,
    CELL,
    BAG
  }
}

// End Term.java
