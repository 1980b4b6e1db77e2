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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.prover.term.TermBuilder.terms;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import net.hydromatic.prover.term.Apply;
import net.hydromatic.prover.term.Bag;
import net.hydromatic.prover.term.Cell;
import net.hydromatic.prover.term.MapTerm;
import net.hydromatic.prover.term.Seq;
import net.hydromatic.prover.term.Term;
import net.hydromatic.prover.term.TermShuttle;
import net.hydromatic.prover.term.Var;
import net.hydromatic.prover.util.RuleException;

/**
 * Conditional rewrite rule.
 *
 * <p>A {@link Kind#STEP step} rule rewrites a configuration. Its left-hand
 * side is a {@link Bag} of cell patterns, and its right-hand side is a bag
 * with the same cells in the same order; each cell is rewritten to the
 * corresponding right-hand cell, and cells the rule does not mention are
 * left unchanged. Variables that occur only on the right-hand side stand
 * for fresh symbols.
 *
 * <p>A {@link Kind#LEMMA lemma} is an equality between terms of the
 * background theory, oriented left to right. Its left-hand side is an
 * application of a built-in function, and every variable on its
 * right-hand side or in its condition must occur on its left-hand side.
 *
 * <p>Rules with a lower {@link #priority} are tried first; a rule of a
 * higher priority applies only where no rule of a lower priority did.
 */
public final class Rule {
  /** Default priority. */
  public static final int DEFAULT_PRIORITY = 50;

  /** Priority of a rule that applies only if no other rule does. */
  public static final int OWISE_PRIORITY = 200;

  public final String id;
  public final Kind kind;
  public final Term lhs;
  public final Term rhs;
  public final Term requires;
  public final int priority;

  private Rule(
      String id, Kind kind, Term lhs, Term rhs, Term requires, int priority) {
    this.id = requireNonNull(id, "id");
    this.kind = requireNonNull(kind, "kind");
    this.lhs = requireNonNull(lhs, "lhs");
    this.rhs = requireNonNull(rhs, "rhs");
    this.requires = requireNonNull(requires, "requires");
    this.priority = priority;
  }

  /** Creates a step rule. */
  public static Rule step(
      String id, Bag lhs, Bag rhs, Term requires, int priority) {
    checkSameShape(id, lhs, rhs);
    checkFrames(id, lhs);
    checkBound(id, requires, lhs.variables(), "condition");
    return new Rule(id, Kind.STEP, lhs, rhs, requires, priority);
  }

  /** Creates an unconditional step rule of default priority. */
  public static Rule step(String id, Bag lhs, Bag rhs) {
    return step(id, lhs, rhs, terms.trueLiteral, DEFAULT_PRIORITY);
  }

  /** Creates a conditional step rule of default priority. */
  public static Rule step(String id, Bag lhs, Bag rhs, Term requires) {
    return step(id, lhs, rhs, requires, DEFAULT_PRIORITY);
  }

  /** Creates a lemma. */
  public static Rule lemma(String id, Term lhs, Term rhs, Term requires) {
    if (!(lhs instanceof Apply) || ((Apply) lhs).builtIn == null) {
      throw new RuleException(id,
          "left-hand side of lemma must apply a built-in function: " + lhs);
    }
    final Set<Var> vars = lhs.variables();
    checkBound(id, rhs, vars, "right-hand side");
    checkBound(id, requires, vars, "condition");
    return new Rule(id, Kind.LEMMA, lhs, rhs, requires, DEFAULT_PRIORITY);
  }

  /** Creates an unconditional lemma. */
  public static Rule lemma(String id, Term lhs, Term rhs) {
    return lemma(id, lhs, rhs, terms.trueLiteral);
  }

  private static void checkSameShape(String id, Bag lhs, Bag rhs) {
    if (lhs.cells.size() != rhs.cells.size()) {
      throw new RuleException(id,
          "right-hand side must mention the same cells as left-hand side");
    }
    for (int i = 0; i < lhs.cells.size(); i++) {
      final Cell l = lhs.cells.get(i);
      final Cell r = rhs.cells.get(i);
      if (!l.name.equals(r.name)) {
        throw new RuleException(id,
            "cell " + r.name + " does not correspond to " + l.name);
      }
      if (l.content instanceof Bag || r.content instanceof Bag) {
        if (!(l.content instanceof Bag && r.content instanceof Bag)) {
          throw new RuleException(id, "cell " + l.name + " changes shape");
        }
        checkSameShape(id, (Bag) l.content, (Bag) r.content);
      }
    }
  }

  /** Checks that no sequence or map in a pattern has more than one frame. */
  private static void checkFrames(String id, Term pattern) {
    pattern.accept(
        new TermShuttle() {
          @Override
          public Term visit(Seq seq) {
            int frames = 0;
            for (Term e : seq.elements) {
              if (e instanceof Var && ((Var) e).isFrame()) {
                ++frames;
              }
            }
            if (frames > 1) {
              throw new RuleException(id, "more than one frame in " + seq);
            }
            return super.visit(seq);
          }

          @Override
          public Term visit(MapTerm map) {
            for (Term key : map.entries.keySet()) {
              if (key instanceof Var && ((Var) key).isFrame()) {
                throw new RuleException(id, "frame used as key in " + map);
              }
            }
            return super.visit(map);
          }
        });
  }

  private static void checkBound(
      String id, Term term, Set<Var> vars, String what) {
    for (Var v : term.variables()) {
      if (!vars.contains(v)) {
        throw new RuleException(id,
            "variable " + v + " in " + what + " is not bound by left-hand "
                + "side");
      }
    }
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, lhs, rhs, requires);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Rule
            && id.equals(((Rule) obj).id)
            && kind == ((Rule) obj).kind
            && lhs.equals(((Rule) obj).lhs)
            && rhs.equals(((Rule) obj).rhs)
            && requires.equals(((Rule) obj).requires)
            && priority == ((Rule) obj).priority;
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    buf.append("rule [").append(id).append("]: ");
    lhs.unparse(buf).append(" => ");
    rhs.unparse(buf);
    if (!requires.isBoolean(true)) {
      requires.unparse(buf.append(" requires "));
    }
    return buf.toString();
  }

  /** Returns the variables that occur on the right-hand side but not the
   * left; each application binds them to fresh symbols. */
  public ImmutableSet<Var> freshVariables() {
    final ImmutableSet.Builder<Var> b = ImmutableSet.builder();
    final Set<Var> lhsVars = lhs.variables();
    for (Var v : rhs.variables()) {
      if (!lhsVars.contains(v)) {
        b.add(v);
      }
    }
    return b.build();
  }

  /** Returns the right-hand cell that corresponds to the left-hand cell
   * at a given path. */
  public Cell rhsCell(List<Integer> path) {
    return cellAt((Bag) rhs, path);
  }

  /** Returns the left-hand cell at a given path. */
  public Cell lhsCell(List<Integer> path) {
    return cellAt((Bag) lhs, path);
  }

  /** Returns the cell at a path of indexes through nested bags. */
  public static Cell cellAt(Bag bag, List<Integer> path) {
    Cell cell = bag.cells.get(path.get(0));
    for (int i = 1; i < path.size(); i++) {
      cell = ((Bag) cell.content).cells.get(path.get(i));
    }
    return cell;
  }

  /** Returns a bag in which the content of the cell at a given path has
   * been replaced. */
  public static Bag replaceAt(Bag bag, List<Integer> path, Term content) {
    final Cell cell = bag.cells.get(path.get(0));
    final Cell newCell;
    if (path.size() == 1) {
      newCell = cell.withContent(content);
    } else {
      newCell =
          cell.withContent(
              replaceAt((Bag) cell.content, path.subList(1, path.size()),
                  content));
    }
    return bag.replace(cell, newCell);
  }

  /** Kind of rule. */
  public enum Kind {
    /** Rewrites a configuration. */
    STEP,
    /** Simplifies a term of the background theory. */
    LEMMA
  }

  /** Returns the priority groups of a list of rules, in increasing order
   * of priority value. */
  public static ImmutableList<ImmutableList<Rule>> groups(List<Rule> rules) {
    final SortedMap<Integer, ImmutableList.Builder<Rule>> map =
        new TreeMap<>();
    for (Rule rule : rules) {
      map.computeIfAbsent(rule.priority, p -> ImmutableList.builder())
          .add(rule);
    }
    final ImmutableList.Builder<ImmutableList<Rule>> b =
        ImmutableList.builder();
    map.values().forEach(rb -> b.add(rb.build()));
    return b.build();
  }
}

// End Rule.java
