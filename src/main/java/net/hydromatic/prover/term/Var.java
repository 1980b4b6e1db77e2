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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Set;

/**
 * Variable.
 *
 * <p>In a rule or claim, a variable is a pattern variable. Once a claim's
 * left-hand side has been turned into an initial configuration, its
 * variables stand for unknown values (symbols) and are matched like
 * constants.
 *
 * <p>A {@link Flavor#FRAME frame} variable stands for a contiguous remainder
 * of a sequence, or for the remaining entries of a map. A {@link
 * Flavor#WILDCARD wildcard} matches anything and binds nothing.
 */
public final class Var extends Term implements Comparable<Var> {
  public final String name;
  public final Flavor flavor;

  Var(String name, Flavor flavor) {
    super(Kind.VAR);
    this.name = requireNonNull(name, "name");
    this.flavor = requireNonNull(flavor, "flavor");
    checkArgument(!name.isEmpty(), "empty variable name");
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + flavor.ordinal();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Var
            && name.equals(((Var) obj).name)
            && flavor == ((Var) obj).flavor;
  }

  @Override
  public int compareTo(Var o) {
    int c = name.compareTo(o.name);
    if (c == 0) {
      c = flavor.compareTo(o.flavor);
    }
    return c;
  }

  @Override
  public StringBuilder unparse(StringBuilder buf) {
    return buf.append(name);
  }

  @Override
  public Term accept(TermShuttle shuttle) {
    return shuttle.visit(this);
  }

  @Override
  void collectVariables(Set<Var> variables) {
    if (flavor != Flavor.WILDCARD) {
      variables.add(this);
    }
  }

  public boolean isFrame() {
    return flavor == Flavor.FRAME;
  }

  public boolean isWildcard() {
    return flavor == Flavor.WILDCARD;
  }

  /** Returns a variable with the same flavor and a different name. */
  public Var rename(String newName) {
    return new Var(newName, flavor);
  }

  /** Flavors of variable. */
  public enum Flavor {
    /** Binds to exactly one term. */
    VARIABLE,
    /** Binds to the remainder of a sequence or map. */
    FRAME,
    /** Matches anything, binds nothing. */
    WILDCARD
  }
}

// End Var.java
