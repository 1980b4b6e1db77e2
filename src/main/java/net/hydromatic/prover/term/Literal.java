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

import java.math.BigInteger;
import java.util.Set;

/**
 * Literal: an arbitrary-precision integer, a boolean, or a string token.
 */
public final class Literal extends Term {
  /** Value; a {@link BigInteger}, {@link Boolean} or {@link String}. */
  public final Comparable<?> value;

  Literal(Comparable<?> value) {
    super(Kind.LITERAL);
    this.value = requireNonNull(value, "value");
    checkArgument(
        value instanceof BigInteger
            || value instanceof Boolean
            || value instanceof String,
        "bad literal value %s",
        value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Literal && value.equals(((Literal) obj).value);
  }

  @Override
  public StringBuilder unparse(StringBuilder buf) {
    if (value instanceof String) {
      return buf.append('"').append(value).append('"');
    }
    return buf.append(value);
  }

  @Override
  public Term accept(TermShuttle shuttle) {
    return shuttle.visit(this);
  }

  @Override
  void collectVariables(Set<Var> variables) {}

  /** Returns the value of an integer literal. */
  public BigInteger bigIntegerValue() {
    return (BigInteger) value;
  }

  /** Returns the value of a boolean literal. */
  public boolean booleanValue() {
    return (Boolean) value;
  }
}

// End Literal.java
