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

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.prover.term.Apply;
import net.hydromatic.prover.term.Bag;
import net.hydromatic.prover.term.Literal;
import net.hydromatic.prover.term.Seq;
import net.hydromatic.prover.term.Term;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Heats and cools the control sequence.
 *
 * <p>Heating takes a strict operator at the head of the sequence whose
 * next argument (in its declared evaluation order) is not yet a value,
 * moves that argument to the head, and leaves behind a "freezer": the
 * operator with a {@link net.hydromatic.prover.term.TermBuilder#hole hole}
 * in place of the argument. For example, {@code i64.store(i32(A),
 * i64.load(i32(A))) ~> K} heats to {@code i64.load(i32(A)) ~>
 * i64.store(i32(A), #hole) ~> K}.
 *
 * <p>Cooling is the reverse: a value at the head of the sequence followed
 * by a freezer is plugged into the hole.
 *
 * <p>{@link #expand} applies both to a fixed point. Heating never applies
 * to a value and cooling only to a value, so the two do not undo each
 * other, and expanding an expanded sequence changes nothing.
 */
public class StrictnessExpander {
  private final RuleDatabase database;

  public StrictnessExpander(RuleDatabase database) {
    this.database = requireNonNull(database);
  }

  /** Returns whether a term is a value. */
  public boolean isValue(Term term) {
    return term instanceof Literal
        || term instanceof Apply
            && database.valueConstructors.contains(((Apply) term).op);
  }

  /** Expands the content of the control cell of a configuration. */
  public Bag expand(Bag configuration, String controlCell) {
    return configuration.update(controlCell, this::expand);
  }

  /** Heats and cools a control sequence to a fixed point. */
  public Term expand(Term control) {
    if (!(control instanceof Seq)) {
      return control;
    }
    final List<Term> list = new ArrayList<>(((Seq) control).elements);
    boolean changed = false;
    for (;;) {
      if (cool(list) || heat(list)) {
        changed = true;
        continue;
      }
      break;
    }
    return changed ? terms.seq(list) : control;
  }

  /** Heats the head of the list, if possible. */
  private boolean heat(List<Term> list) {
    if (list.isEmpty() || !(list.get(0) instanceof Apply)) {
      return false;
    }
    final Apply head = (Apply) list.get(0);
    final Strictness strictness = database.strictness(head.op);
    if (strictness == null || strictness.arity != head.args.size()) {
      return false;
    }
    for (int position : strictness.positions) {
      final Term arg = head.arg(position);
      if (arg.equals(terms.hole)) {
        // already heated; wait for the value
        return false;
      }
      if (!isValue(arg)) {
        final List<Term> args = new ArrayList<>(head.args);
        args.set(position, terms.hole);
        list.set(0, head.copy(args));
        list.add(0, arg);
        return true;
      }
    }
    return false;
  }

  /** Cools the head of the list into the freezer that follows it, if
   * possible. */
  private boolean cool(List<Term> list) {
    if (list.size() < 2 || !isValue(list.get(0))) {
      return false;
    }
    final int position = holePosition(list.get(1));
    if (position < 0) {
      return false;
    }
    final Apply freezer = (Apply) list.get(1);
    final List<Term> args = new ArrayList<>(freezer.args);
    args.set(position, list.get(0));
    list.remove(0);
    list.set(0, freezer.copy(args));
    return true;
  }

  /** Returns the position of the hole in a freezer, or -1 if the term is
   * not a freezer. */
  private static int holePosition(@Nullable Term term) {
    if (term instanceof Apply) {
      final Apply apply = (Apply) term;
      for (int i = 0; i < apply.args.size(); i++) {
        if (apply.arg(i).equals(terms.hole)) {
          return i;
        }
      }
    }
    return -1;
  }

  /** Returns whether a term has a hole, that is, whether it is a
   * freezer. */
  public static boolean isFreezer(Term term) {
    return holePosition(term) >= 0;
  }
}

// End StrictnessExpander.java
