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

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds terms. */
public enum TermBuilder {
  /**
   * The singleton instance of the term builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  terms;

  public final Literal trueLiteral = new Literal(true);
  public final Literal falseLiteral = new Literal(false);

  /** Placeholder for the position of an operand that has been heated out of
   * an expression; see {@code StrictnessExpander}. */
  public final Apply hole = new Apply("#hole", ImmutableList.of());

  private final Var wildcard = new Var("_", Var.Flavor.WILDCARD);

  /** Creates a variable. */
  public Var var(String name) {
    return new Var(name, Var.Flavor.VARIABLE);
  }

  /** Creates a frame variable. */
  public Var frame(String name) {
    return new Var(name, Var.Flavor.FRAME);
  }

  /** Returns the anonymous wildcard. */
  public Var wildcard() {
    return wildcard;
  }

  public Literal intLiteral(long value) {
    return new Literal(BigInteger.valueOf(value));
  }

  public Literal intLiteral(BigInteger value) {
    return new Literal(value);
  }

  public Literal boolLiteral(boolean value) {
    return value ? trueLiteral : falseLiteral;
  }

  public Literal stringLiteral(String value) {
    return new Literal(value);
  }

  /** Creates an application of an operator. */
  public Apply apply(String op, Term... args) {
    return new Apply(op, ImmutableList.copyOf(args));
  }

  /** Creates an application of an operator. */
  public Apply apply(String op, List<? extends Term> args) {
    return new Apply(op, args);
  }

  /** Creates an application of a built-in operator. */
  public Apply call(Op op, Term... args) {
    return new Apply(op.opName, ImmutableList.copyOf(args));
  }

  public Seq seq(Term... elements) {
    return new Seq(ImmutableList.copyOf(elements));
  }

  public Seq seq(List<? extends Term> elements) {
    return new Seq(elements);
  }

  /** Creates a map from alternating keys and values. */
  public MapTerm map(Term... keyValues) {
    return mapWithFrame(null, keyValues);
  }

  /** Creates a map from a frame and alternating keys and values. */
  public MapTerm mapWithFrame(@Nullable Var frame, Term... keyValues) {
    checkArgument(keyValues.length % 2 == 0, "odd number of arguments");
    final Map<Term, Term> map = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      map.put(keyValues[i], keyValues[i + 1]);
    }
    return new MapTerm(map, frame);
  }

  public MapTerm map(
      Map<? extends Term, ? extends Term> entries, @Nullable Var frame) {
    return new MapTerm(entries, frame);
  }

  /** Creates a concrete byte-map. Zero bytes are not stored. */
  public MapTerm byteMap(SortedMap<Long, Integer> bytes) {
    final Map<Term, Term> map = new LinkedHashMap<>();
    bytes.forEach(
        (address, value) -> {
          checkArgument(value >= 0 && value <= 255, "not a byte: %s", value);
          if (value != 0) {
            map.put(intLiteral(address), intLiteral(value));
          }
        });
    return new MapTerm(map, null);
  }

  public Cell cell(String name, Term content) {
    return new Cell(name, content);
  }

  public Bag bag(Cell... cells) {
    return new Bag(ImmutableList.copyOf(cells));
  }

  public Bag bag(List<Cell> cells) {
    return new Bag(cells);
  }

  // Arithmetic

  public Apply plus(Term a, Term b) {
    return call(Op.INT_ADD, a, b);
  }

  public Apply minus(Term a, Term b) {
    return call(Op.INT_SUB, a, b);
  }

  public Apply times(Term a, Term b) {
    return call(Op.INT_MUL, a, b);
  }

  public Apply mod(Term a, Term b) {
    return call(Op.INT_MOD, a, b);
  }

  public Apply pow(Term a, Term b) {
    return call(Op.INT_POW, a, b);
  }

  // Predicates

  public Apply lt(Term a, Term b) {
    return call(Op.INT_LT, a, b);
  }

  public Apply le(Term a, Term b) {
    return call(Op.INT_LE, a, b);
  }

  public Apply gt(Term a, Term b) {
    return call(Op.INT_GT, a, b);
  }

  public Apply ge(Term a, Term b) {
    return call(Op.INT_GE, a, b);
  }

  public Apply eqInt(Term a, Term b) {
    return call(Op.INT_EQ, a, b);
  }

  public Apply neInt(Term a, Term b) {
    return call(Op.INT_NE, a, b);
  }

  /** Creates a structural equality, "a ==K b". */
  public Apply eq(Term a, Term b) {
    return call(Op.EQ, a, b);
  }

  public Term not(Term a) {
    if (a instanceof Literal) {
      return boolLiteral(!((Literal) a).booleanValue());
    }
    return call(Op.NOT, a);
  }

  public Apply implies(Term a, Term b) {
    return call(Op.IMPLIES, a, b);
  }

  /** Creates a conjunction; returns "true" if there are no terms. */
  public Term and(Term... terms) {
    return and(ImmutableList.copyOf(terms));
  }

  /** Creates a conjunction; returns "true" if there are no terms. */
  public Term and(List<? extends Term> terms) {
    Term result = null;
    for (Term term : terms) {
      if (term.isBoolean(true)) {
        continue;
      }
      result = result == null ? term : call(Op.AND, result, term);
    }
    return result == null ? trueLiteral : result;
  }

  /** Creates a disjunction; returns "false" if there are no terms. */
  public Term or(List<? extends Term> terms) {
    Term result = null;
    for (Term term : terms) {
      if (term.isBoolean(false)) {
        continue;
      }
      result = result == null ? term : call(Op.OR, result, term);
    }
    return result == null ? falseLiteral : result;
  }

  public Term or(Term... terms) {
    return or(ImmutableList.copyOf(terms));
  }

  /** Decomposes a term into its conjuncts; "true" has none. */
  public List<Term> conjunctions(Term term) {
    final List<Term> list = new ArrayList<>();
    decompose(term, list);
    return list;
  }

  private static void decompose(Term term, List<Term> list) {
    if (term instanceof Apply && ((Apply) term).isA(Op.AND)) {
      decompose(((Apply) term).arg(0), list);
      decompose(((Apply) term).arg(1), list);
    } else if (!term.isBoolean(true)) {
      list.add(term);
    }
  }

  // Byte-maps

  public Apply getRange(Term byteMap, Term address, Term width) {
    return call(Op.GET_RANGE, byteMap, address, width);
  }

  public Apply setRange(Term byteMap, Term address, Term value, Term width) {
    return call(Op.SET_RANGE, byteMap, address, value, width);
  }

  public Apply isByteMap(Term byteMap) {
    return call(Op.IS_BYTE_MAP, byteMap);
  }

  public Apply inUnsignedRange(int width, Term value) {
    return call(Op.IN_UNSIGNED_RANGE, intLiteral(width), value);
  }
}

// End TermBuilder.java
