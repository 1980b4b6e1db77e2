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
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Ordered group of cells.
 *
 * <p>A configuration is a top-level bag. As a pattern, a bag is open: cells
 * that it does not mention are matched implicitly and preserved unchanged by
 * a rewrite.
 */
public final class Bag extends Term {
  public final ImmutableList<Cell> cells;

  Bag(List<Cell> cells) {
    super(Kind.BAG);
    this.cells = ImmutableList.copyOf(cells);
  }

  @Override
  public int hashCode() {
    return cells.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Bag && cells.equals(((Bag) obj).cells);
  }

  @Override
  public StringBuilder unparse(StringBuilder buf) {
    for (int i = 0; i < cells.size(); i++) {
      if (i > 0) {
        buf.append(' ');
      }
      cells.get(i).unparse(buf);
    }
    return buf;
  }

  @Override
  public Term accept(TermShuttle shuttle) {
    return shuttle.visit(this);
  }

  @Override
  void collectVariables(Set<Var> variables) {
    cells.forEach(cell -> cell.collectVariables(variables));
  }

  /** Returns the first cell with a given name, or null. */
  public @Nullable Cell get(String name) {
    for (Cell cell : cells) {
      if (cell.name.equals(name)) {
        return cell;
      }
    }
    return null;
  }

  /** Returns the first cell with a given name, searching nested bags
   * depth-first, or null. */
  public @Nullable Cell find(String name) {
    for (Cell cell : cells) {
      if (cell.name.equals(name)) {
        return cell;
      }
      if (cell.content instanceof Bag) {
        final Cell c = ((Bag) cell.content).find(name);
        if (c != null) {
          return c;
        }
      }
    }
    return null;
  }

  /** Returns a bag in which one cell (compared by identity) has been
   * replaced. */
  public Bag replace(Cell cell, Cell newCell) {
    if (cell == newCell) {
      return this;
    }
    final ImmutableList.Builder<Cell> b = ImmutableList.builder();
    for (Cell c : cells) {
      b.add(c == cell ? newCell : c);
    }
    return new Bag(b.build());
  }

  /** Returns a bag in which the first cell with the given name, anywhere in
   * the tree, has had its content transformed. */
  public Bag update(String name, UnaryOperator<Term> fn) {
    final ImmutableList.Builder<Cell> b = ImmutableList.builder();
    boolean done = false;
    for (Cell c : cells) {
      if (!done && c.name.equals(name)) {
        b.add(c.withContent(fn.apply(c.content)));
        done = true;
      } else if (!done && c.content instanceof Bag) {
        final Bag bag = (Bag) c.content;
        final Bag bag2 = bag.update(name, fn);
        done = bag2 != bag;
        b.add(c.withContent(bag2));
      } else {
        b.add(c);
      }
    }
    return done ? new Bag(b.build()) : this;
  }
}

// End Bag.java
