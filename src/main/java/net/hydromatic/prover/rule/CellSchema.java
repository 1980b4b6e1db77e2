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

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Map;
import net.hydromatic.prover.term.Bag;
import net.hydromatic.prover.term.Cell;
import net.hydromatic.prover.util.RuleException;

/**
 * Declares which cells a configuration may contain, and how many times.
 *
 * <p>A {@link Multiplicity#SINGLETON singleton} cell occurs exactly once in
 * its enclosing group; a {@link Multiplicity#MULTIPLE multiple} cell, such
 * as one memory instance among several, may occur any number of times, and
 * a rule's pattern selects one instance by matching its contents.
 */
public final class CellSchema {
  /** Schema that accepts any configuration. */
  public static final CellSchema ANY = new CellSchema(ImmutableMap.of());

  private final ImmutableMap<String, Multiplicity> cells;

  private CellSchema(ImmutableMap<String, Multiplicity> cells) {
    this.cells = cells;
  }

  public static CellSchema of(Map<String, Multiplicity> cells) {
    return new CellSchema(ImmutableMap.copyOf(cells));
  }

  /** Returns the multiplicity of a cell; undeclared cells are singletons. */
  public Multiplicity multiplicity(String name) {
    return cells.getOrDefault(name, Multiplicity.SINGLETON);
  }

  /** Checks that a configuration conforms to this schema.
   *
   * @throws RuleException if a singleton cell occurs more than once in a
   *     group, or if a declared singleton cell is missing at the top level */
  public void validate(String id, Bag configuration) {
    validate(id, configuration, true);
  }

  private void validate(String id, Bag bag, boolean top) {
    final Map<String, Integer> counts = new HashMap<>();
    for (Cell cell : bag.cells) {
      counts.merge(cell.name, 1, Integer::sum);
      if (cell.content instanceof Bag) {
        validate(id, (Bag) cell.content, false);
      }
    }
    counts.forEach(
        (name, count) -> {
          if (count > 1 && multiplicity(name) == Multiplicity.SINGLETON) {
            throw new RuleException(id,
                "singleton cell " + name + " occurs " + count + " times");
          }
        });
    if (top) {
      cells.forEach(
          (name, multiplicity) -> {
            if (multiplicity == Multiplicity.SINGLETON
                && bag.find(name) == null) {
              throw new RuleException(id, "missing cell " + name);
            }
          });
    }
  }

  /** How many times a cell may occur in its group. */
  public enum Multiplicity {
    SINGLETON,
    MULTIPLE
  }
}

// End CellSchema.java
