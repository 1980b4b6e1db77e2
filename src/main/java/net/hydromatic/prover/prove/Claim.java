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
import static net.hydromatic.prover.term.TermBuilder.terms;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.prover.rule.Rule;
import net.hydromatic.prover.term.Bag;
import net.hydromatic.prover.term.Cell;
import net.hydromatic.prover.term.Substitution;
import net.hydromatic.prover.term.Term;
import net.hydromatic.prover.term.TermShuttle;
import net.hydromatic.prover.term.Var;
import net.hydromatic.prover.util.RuleException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Proof obligation.
 *
 * <p>A claim asserts that every execution that starts in a configuration
 * matching {@link #lhs} and satisfying {@link #requires}, and terminates,
 * reaches a configuration matching {@link #rhs} in which {@link #ensures}
 * holds. Cells that {@code rhs} does not mention must be unchanged.
 *
 * <p>Each anonymous variable is given a name of its own when a claim is
 * created, so that it denotes one unknown value, not all values.
 */
public final class Claim {
  public final String name;
  public final Bag lhs;
  public final Bag rhs;
  public final Term requires;
  public final Term ensures;
  /** Whether the claim is assumed without proof. */
  public final boolean trusted;
  /** The right-hand side completed with the cells of the left-hand side
   * that it does not mention. */
  public final Bag target;
  /** Rewrite from {@link #lhs} to {@link #target}; used when the claim is
   * applied as a circularity. */
  final Rule rule;

  private Claim(
      String name,
      Bag lhs,
      Bag rhs,
      Term requires,
      Term ensures,
      boolean trusted) {
    this.name = requireNonNull(name);
    this.lhs = requireNonNull(lhs);
    this.rhs = requireNonNull(rhs);
    this.requires = requireNonNull(requires);
    this.ensures = requireNonNull(ensures);
    this.trusted = trusted;
    this.target = complete(name, lhs, rhs);
    this.rule = Rule.step(name, lhs, target, requires);
    final Set<Var> vars = lhs.variables();
    for (Var v : ensures.variables()) {
      if (!vars.contains(v) && !target.variables().contains(v)) {
        throw new RuleException(name,
            "variable " + v + " in postcondition does not occur in claim");
      }
    }
  }

  /** Creates a claim. */
  public static Claim of(
      String name, Bag lhs, Bag rhs, Term requires, Term ensures) {
    final NameWildcards shuttle = new NameWildcards();
    return new Claim(name, (Bag) lhs.accept(shuttle),
        (Bag) rhs.accept(shuttle), requires, ensures, false);
  }

  /** Creates a claim with no precondition and no postcondition. */
  public static Claim of(String name, Bag lhs, Bag rhs) {
    return of(name, lhs, rhs, terms.trueLiteral, terms.trueLiteral);
  }

  /** Returns a copy of this claim that is assumed without proof. */
  public Claim trusted() {
    return new Claim(name, lhs, rhs, requires, ensures, true);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    buf.append(trusted ? "trusted claim [" : "claim [")
        .append(name).append("]: ");
    lhs.unparse(buf).append(" => ");
    rhs.unparse(buf);
    if (!requires.isBoolean(true)) {
      requires.unparse(buf.append(" requires "));
    }
    if (!ensures.isBoolean(true)) {
      ensures.unparse(buf.append(" ensures "));
    }
    return buf.toString();
  }

  /** Returns a substitution that binds each variable of the left-hand
   * side to itself. In the initial configuration, the variables are
   * symbols that stand for the initial values. */
  Substitution identity() {
    final Map<Var, Term> map = new LinkedHashMap<>();
    lhs.variables().forEach(v -> map.put(v, v));
    return Substitution.of(map);
  }

  /** Completes the right-hand side: each left-hand cell that it does not
   * mention is carried over unchanged. */
  private static Bag complete(String name, Bag lhs, Bag rhs) {
    final List<Cell> unused = new ArrayList<>(rhs.cells);
    final ImmutableList.Builder<Cell> b = ImmutableList.builder();
    for (Cell l : lhs.cells) {
      final Cell r = take(unused, l.name);
      if (r == null) {
        b.add(l);
      } else if (l.content instanceof Bag && r.content instanceof Bag) {
        b.add(l.withContent(complete(name, (Bag) l.content,
            (Bag) r.content)));
      } else {
        b.add(r);
      }
    }
    if (!unused.isEmpty()) {
      throw new RuleException(name,
          "cell " + unused.get(0).name + " of right-hand side does not "
              + "occur in left-hand side");
    }
    return terms.bag(b.build());
  }

  private static @Nullable Cell take(List<Cell> cells, String name) {
    for (int i = 0; i < cells.size(); i++) {
      if (cells.get(i).name.equals(name)) {
        return cells.remove(i);
      }
    }
    return null;
  }

  /** Replaces each anonymous variable by a variable with a unique name. */
  private static class NameWildcards extends TermShuttle {
    int count;

    @Override
    public Term visit(Var var) {
      return var.isWildcard() ? terms.var("_" + count++) : var;
    }
  }
}

// End Claim.java
