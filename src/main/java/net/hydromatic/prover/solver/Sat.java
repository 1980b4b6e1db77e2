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
package net.hydromatic.prover.solver;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Boolean satisfiability.
 *
 * <p>Searches for an assignment by backtracking over variables in order of
 * creation, and abandons a partial assignment as soon as it makes the term
 * false. The {@link LinearOracle} uses it to enumerate the assignments of
 * the propositional skeleton of a formula.
 */
public class Sat {
  private final List<Variable> variables = new ArrayList<>();
  private final Map<String, Variable> variablesByName = new HashMap<>();

  /**
   * Finds an assignment of variables such that a term evaluates to true, or
   * null if there is no solution.
   *
   * <p>The assignment is partial: a variable whose value does not affect
   * the result is absent, and every completion of the assignment is also a
   * solution.
   */
  public @Nullable Map<Variable, Boolean> solve(Term term) {
    final @Nullable Boolean[] env = new Boolean[variables.size()];
    if (!search(term, env, 0)) {
      return null;
    }
    final ImmutableMap.Builder<Variable, Boolean> builder =
        ImmutableMap.builder();
    for (Variable variable : variables) {
      final Boolean value = env[variable.id];
      if (value != null) {
        builder.put(variable, value);
      }
    }
    return builder.build();
  }

  private boolean search(Term term, @Nullable Boolean[] env, int i) {
    final Boolean value = term.evaluate(env);
    if (value != null) {
      return value;
    }
    if (i == env.length) {
      return false;
    }
    for (boolean b : new boolean[] {false, true}) {
      env[i] = b;
      if (search(term, env, i + 1)) {
        return true;
      }
    }
    env[i] = null;
    return false;
  }

  public Variable variable(String name) {
    Variable variable = variablesByName.get(name);
    if (variable != null) {
      return variable;
    }
    variable = new Variable(variables.size(), name);
    variables.add(variable);
    variablesByName.put(name, variable);
    return variable;
  }

  /** Returns the variables, in order of creation. */
  public List<Variable> variables() {
    return ImmutableList.copyOf(variables);
  }

  public Term not(Term term) {
    return new Not(term);
  }

  public Term and(Term... terms) {
    return new And(ImmutableList.copyOf(terms));
  }

  public Term and(Iterable<? extends Term> terms) {
    return new And(ImmutableList.copyOf(terms));
  }

  public Term or(Term... terms) {
    return new Or(ImmutableList.copyOf(terms));
  }

  public Term or(Iterable<? extends Term> terms) {
    return new Or(ImmutableList.copyOf(terms));
  }

  /** Returns a term that is the constant {@code true} or {@code false}. */
  public Term constant(boolean b) {
    return b ? and() : or();
  }

  /** Returns a clause that excludes an assignment, so that a subsequent
   * call to {@link #solve} finds a different one. */
  public Term block(Map<Variable, Boolean> assignment) {
    final List<Term> literals = new ArrayList<>();
    assignment.forEach((v, b) -> literals.add(b ? not(v) : v));
    return or(literals);
  }

  /** Base class for all terms (variables, and, or, not). */
  public abstract static class Term {
    final Op op;

    Term(Op op) {
      this.op = requireNonNull(op, "op");
    }

    @Override
    public String toString() {
      return unparse(new StringBuilder(), 0, 0).toString();
    }

    protected abstract StringBuilder unparse(
        StringBuilder buf, int left, int right);

    /** Evaluates this term under a partial assignment; returns null if the
     * value depends on an unassigned variable. */
    public abstract @Nullable Boolean evaluate(@Nullable Boolean[] env);
  }

  /** Variable. Its value can be true or false. */
  public static class Variable extends Term {
    public final int id;
    public final String name;

    Variable(int id, String name) {
      super(Op.VARIABLE);
      this.id = id;
      this.name = requireNonNull(name, "name");
    }

    @Override
    protected StringBuilder unparse(StringBuilder buf, int left, int right) {
      return buf.append(name);
    }

    @Override
    public @Nullable Boolean evaluate(@Nullable Boolean[] env) {
      return env[id];
    }
  }

  /** Term that has a variable number of arguments ("and" or "or"). */
  abstract static class Node extends Term {
    public final ImmutableList<Term> terms;

    Node(Op op, ImmutableList<Term> terms) {
      super(op);
      this.terms = requireNonNull(terms);
    }

    @Override
    protected StringBuilder unparse(StringBuilder buf, int left, int right) {
      switch (terms.size()) {
        case 0:
          // empty "and" prints as "true";
          // empty "or" prints as "false"
          return buf.append(op.emptyName);
        case 1:
          // singleton "and" and "or" print as the sole term
          return terms.get(0).unparse(buf, left, right);
      }
      if (left > op.left || right > op.right) {
        return unparse(buf.append('('), 0, 0).append(')');
      }
      for (int i = 0; i < terms.size(); i++) {
        final Term term = terms.get(i);
        if (i > 0) {
          buf.append(op.str);
        }
        term.unparse(
            buf,
            i == 0 ? left : op.right,
            i == terms.size() - 1 ? right : op.left);
      }
      return buf;
    }

    /** Evaluates the arguments; {@code dominant} is the value that decides
     * the result on its own (false for "and", true for "or"). */
    @Nullable Boolean evaluate(@Nullable Boolean[] env, boolean dominant) {
      boolean unknown = false;
      for (Term term : terms) {
        final Boolean b = term.evaluate(env);
        if (b == null) {
          unknown = true;
        } else if (b == dominant) {
          return dominant;
        }
      }
      return unknown ? null : !dominant;
    }
  }

  /** "And" term. */
  static class And extends Node {
    And(ImmutableList<Term> terms) {
      super(Op.AND, terms);
    }

    @Override
    public @Nullable Boolean evaluate(@Nullable Boolean[] env) {
      return evaluate(env, false);
    }
  }

  /** "Or" term. */
  static class Or extends Node {
    Or(ImmutableList<Term> terms) {
      super(Op.OR, terms);
    }

    @Override
    public @Nullable Boolean evaluate(@Nullable Boolean[] env) {
      return evaluate(env, true);
    }
  }

  /** "Not" term. */
  static class Not extends Term {
    public final Term term;

    Not(Term term) {
      super(Op.NOT);
      this.term = requireNonNull(term, "term");
    }

    @Override
    protected StringBuilder unparse(StringBuilder buf, int left, int right) {
      return term.unparse(buf.append(op.str), op.right, right);
    }

    @Override
    public @Nullable Boolean evaluate(@Nullable Boolean[] env) {
      final Boolean b = term.evaluate(env);
      return b == null ? null : !b;
    }
  }

  /**
   * Operator (or type of term), with its left and right precedence and print
   * name.
   */
  private enum Op {
    AND(3, 4, " ∧ ", "true"),
    OR(1, 2, " ∨ ", "false"),
    NOT(5, 5, "¬", ""),
    VARIABLE(0, 0, "", "");

    final int left;
    final int right;
    final String str;
    final String emptyName;

    Op(int left, int right, String str, String emptyName) {
      this.left = left;
      this.right = right;
      this.str = str;
      this.emptyName = emptyName;
    }
  }
}

// End Sat.java
