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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Application of an operator to a list of arguments.
 *
 * <p>If the operator is {@link Op built-in}, the application is a function
 * call in the background theory; otherwise it is a constructor, such as an
 * instruction {@code local.get(0)} or a value {@code i64(5)}.
 */
public final class Apply extends Term {
  public final String op;
  public final ImmutableList<Term> args;
  /** Built-in operator, or null if this is a constructor. */
  public final @Nullable Op builtIn;

  Apply(String op, List<? extends Term> args) {
    super(Kind.APPLY);
    this.op = requireNonNull(op, "op");
    this.args = ImmutableList.copyOf(args);
    this.builtIn = Op.lookup(op);
    if (builtIn != null) {
      checkArgument(
          builtIn.arity == this.args.size(),
          "operator %s requires %s arguments",
          op,
          builtIn.arity);
    }
  }

  @Override
  public int hashCode() {
    return Objects.hash(op, args);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Apply
            && op.equals(((Apply) obj).op)
            && args.equals(((Apply) obj).args);
  }

  @Override
  public StringBuilder unparse(StringBuilder buf) {
    return unparse(buf, 0, 0);
  }

  StringBuilder unparse(StringBuilder buf, int left, int right) {
    if (builtIn != null && builtIn.infix()) {
      if (left > builtIn.left || right > builtIn.right) {
        return unparse(buf.append('('), 0, 0).append(')');
      }
      if (args.size() == 1) {
        buf.append(op).append(' ');
        return unparseArg(buf, args.get(0), builtIn.right, right);
      }
      unparseArg(buf, args.get(0), left, builtIn.left);
      buf.append(' ').append(op).append(' ');
      return unparseArg(buf, args.get(1), builtIn.right, right);
    }
    buf.append(op);
    if (args.isEmpty()) {
      return buf;
    }
    buf.append('(');
    for (int i = 0; i < args.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      args.get(i).unparse(buf);
    }
    return buf.append(')');
  }

  private static StringBuilder unparseArg(
      StringBuilder buf, Term arg, int left, int right) {
    if (arg instanceof Apply) {
      return ((Apply) arg).unparse(buf, left, right);
    }
    return arg.unparse(buf);
  }

  @Override
  public Term accept(TermShuttle shuttle) {
    return shuttle.visit(this);
  }

  @Override
  void collectVariables(Set<Var> variables) {
    args.forEach(arg -> arg.collectVariables(variables));
  }

  /** Returns the {@code i}th argument. */
  public Term arg(int i) {
    return args.get(i);
  }

  /** Returns whether this is an application of a given built-in operator. */
  public boolean isA(Op op) {
    return builtIn == op;
  }

  /** Returns a copy of this application with different arguments. */
  public Apply copy(List<? extends Term> args) {
    if (args.equals(this.args)) {
      return this;
    }
    return new Apply(op, args);
  }
}

// End Apply.java
