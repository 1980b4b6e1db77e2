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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Visits and transforms terms, bottom-up.
 *
 * <p>Each method returns the original term if none of its children changed,
 * so that callers can detect a fixed point by identity.
 */
public class TermShuttle {
  protected List<Term> visitList(List<Term> terms) {
    final List<Term> list = new ArrayList<>(terms.size());
    boolean changed = false;
    for (Term term : terms) {
      final Term term2 = term.accept(this);
      changed |= term2 != term;
      list.add(term2);
    }
    return changed ? list : terms;
  }

  public Term visit(Var var) {
    return var;
  }

  public Term visit(Literal literal) {
    return literal;
  }

  public Term visit(Apply apply) {
    final List<Term> args = visitList(apply.args);
    return args == apply.args ? apply : new Apply(apply.op, args);
  }

  public Term visit(Seq seq) {
    final List<Term> elements = visitList(seq.elements);
    return elements == seq.elements ? seq : new Seq(elements);
  }

  public Term visit(MapTerm map) {
    final Map<Term, Term> entries = new LinkedHashMap<>();
    boolean changed = false;
    for (Map.Entry<Term, Term> e : map.entries.entrySet()) {
      final Term key = e.getKey().accept(this);
      final Term value = e.getValue().accept(this);
      changed |= key != e.getKey() || value != e.getValue();
      entries.put(key, value);
    }
    Var frame = map.frame;
    if (frame != null) {
      final Term frame2 = frame.accept(this);
      if (frame2 != frame) {
        return mergeFrame(entries, frame2);
      }
    }
    return changed ? new MapTerm(entries, frame) : map;
  }

  /** Creates a map from entries plus the value that a frame variable has
   * been replaced by. */
  protected Term mergeFrame(Map<Term, Term> entries, Term frameValue) {
    if (frameValue instanceof MapTerm) {
      final MapTerm m = (MapTerm) frameValue;
      final Map<Term, Term> map = new LinkedHashMap<>(entries);
      map.putAll(m.entries);
      return new MapTerm(map, m.frame);
    }
    if (frameValue instanceof Var && ((Var) frameValue).isFrame()) {
      return new MapTerm(entries, (Var) frameValue);
    }
    throw new IllegalArgumentException("map frame bound to non-map "
        + frameValue);
  }

  public Term visit(Cell cell) {
    return cell.withContent(cell.content.accept(this));
  }

  public Term visit(Bag bag) {
    final ImmutableList.Builder<Cell> b = ImmutableList.builder();
    boolean changed = false;
    for (Cell cell : bag.cells) {
      final Cell cell2 = (Cell) cell.accept(this);
      changed |= cell2 != cell;
      b.add(cell2);
    }
    return changed ? new Bag(b.build()) : bag;
  }
}

// End TermShuttle.java
