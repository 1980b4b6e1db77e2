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
package net.hydromatic.prover.lemma;

import static net.hydromatic.prover.term.TermBuilder.terms;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.prover.term.Apply;
import net.hydromatic.prover.term.Literal;
import net.hydromatic.prover.term.MapTerm;
import net.hydromatic.prover.term.Op;
import net.hydromatic.prover.term.Term;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluates applications of built-in functions whose arguments are known.
 *
 * <p>Operations that are undefined for their arguments, such as division
 * by zero, are not evaluated.
 */
public abstract class BuiltIns {
  private BuiltIns() {}

  /** Largest exponent or shift that will be evaluated. */
  private static final int MAX_EXPONENT = 1 << 16;

  private static final BigInteger BYTE = BigInteger.valueOf(256);

  /** Evaluates an application, returning a literal or a concrete
   * byte-map, or null if the application cannot be evaluated. */
  public static @Nullable Term evaluate(Apply apply) {
    final Op op = apply.builtIn;
    if (op == null) {
      return null;
    }
    final List<Term> args = apply.args;
    switch (op) {
      case EQ:
      case NE:
        if (isValue(args.get(0)) && isValue(args.get(1))) {
          final boolean eq = args.get(0).equals(args.get(1));
          return terms.boolLiteral(op == Op.EQ ? eq : !eq);
        }
        return null;

      case GET_RANGE:
        if (isConcrete(args.get(0))
            && args.get(1).isInteger()
            && isWidth(args.get(2))) {
          return terms.intLiteral(
              getRange((MapTerm) args.get(0), integer(args.get(1)),
                  integer(args.get(2)).intValue()));
        }
        return null;

      case SET_RANGE:
        if (isConcrete(args.get(0))
            && args.get(1).isInteger()
            && args.get(2).isInteger()
            && isWidth(args.get(3))) {
          return setRange((MapTerm) args.get(0), integer(args.get(1)),
              integer(args.get(2)), integer(args.get(3)).intValue());
        }
        return null;

      case IS_BYTE_MAP:
        if (isConcrete(args.get(0))) {
          return terms.boolLiteral(isByteMap((MapTerm) args.get(0)));
        }
        return null;

      default:
        break;
    }

    for (Term arg : args) {
      if (!(arg instanceof Literal)) {
        return null;
      }
    }
    switch (op.type) {
      case BOOL:
        if (args.get(0).isInteger() && args.get(1).isInteger()) {
          final Boolean b = compare(op, integer(args.get(0)),
              integer(args.get(1)));
          return b == null ? null : terms.boolLiteral(b);
        }
        return logic(op, args);
      case INT:
        final BigInteger i = arithmetic(op, args);
        return i == null ? null : terms.intLiteral(i);
      default:
        return null;
    }
  }

  private static @Nullable Boolean compare(Op op, BigInteger a,
      BigInteger b) {
    final int c = a.compareTo(b);
    switch (op) {
      case INT_LT:
        return c < 0;
      case INT_LE:
        return c <= 0;
      case INT_GT:
        return c > 0;
      case INT_GE:
        return c >= 0;
      case INT_EQ:
        return c == 0;
      case INT_NE:
        return c != 0;
      case IN_UNSIGNED_RANGE:
        // #inUnsignedRange(width, value)
        return isSmall(a) && b.signum() >= 0 && b.bitLength() <= a.intValue();
      default:
        return null;
    }
  }

  private static @Nullable Term logic(Op op, List<Term> args) {
    final boolean a = ((Literal) args.get(0)).booleanValue();
    switch (op) {
      case NOT:
        return terms.boolLiteral(!a);
      case AND:
        return terms.boolLiteral(a && ((Literal) args.get(1)).booleanValue());
      case OR:
        return terms.boolLiteral(a || ((Literal) args.get(1)).booleanValue());
      case IMPLIES:
        return terms.boolLiteral(!a || ((Literal) args.get(1)).booleanValue());
      default:
        return null;
    }
  }

  private static @Nullable BigInteger arithmetic(Op op, List<Term> args) {
    final BigInteger a = integer(args.get(0));
    final BigInteger b = integer(args.get(1));
    switch (op) {
      case INT_ADD:
        return a.add(b);
      case INT_SUB:
        return a.subtract(b);
      case INT_MUL:
        return a.multiply(b);
      case INT_DIV:
        return b.signum() == 0 ? null : a.divide(b);
      case INT_REM:
        return b.signum() == 0 ? null : a.remainder(b);
      case INT_MOD:
        return b.signum() == 0 ? null : a.mod(b.abs());
      case INT_POW:
        return isSmall(b) ? a.pow(b.intValue()) : null;
      case INT_AND:
        return a.and(b);
      case INT_OR:
        return a.or(b);
      case INT_XOR:
        return a.xor(b);
      case INT_SHL:
        return isSmall(b) ? a.shiftLeft(b.intValue()) : null;
      case INT_SHR:
        return isSmall(b) ? a.shiftRight(b.intValue()) : null;
      default:
        return null;
    }
  }

  /** Reads {@code width} bytes starting at {@code address}, little-endian.
   * Absent keys read as zero. */
  public static BigInteger getRange(
      MapTerm byteMap, BigInteger address, int width) {
    BigInteger result = BigInteger.ZERO;
    for (int i = width - 1; i >= 0; i--) {
      final Term b = byteMap.get(terms.intLiteral(address.add(
          BigInteger.valueOf(i))));
      result = result.shiftLeft(8);
      if (b != null) {
        result = result.add(integer(b));
      }
    }
    return result;
  }

  /** Writes the low {@code width} bytes of {@code value} starting at
   * {@code address}, little-endian. Zero bytes are removed from the map. */
  public static MapTerm setRange(
      MapTerm byteMap, BigInteger address, BigInteger value, int width) {
    final Map<Term, Term> map = new LinkedHashMap<>(byteMap.entries);
    BigInteger v = value.mod(BigInteger.ONE.shiftLeft(8 * width));
    for (int i = 0; i < width; i++) {
      final Term key = terms.intLiteral(address.add(BigInteger.valueOf(i)));
      final BigInteger b = v.mod(BYTE);
      v = v.shiftRight(8);
      if (b.signum() == 0) {
        map.remove(key);
      } else {
        map.put(key, terms.intLiteral(b));
      }
    }
    return terms.map(map, null);
  }

  /** Returns whether every value in a concrete map is a byte. */
  public static boolean isByteMap(MapTerm map) {
    for (Term value : map.entries.values()) {
      final BigInteger v = integer(value);
      if (v.signum() < 0 || v.compareTo(BYTE) >= 0) {
        return false;
      }
    }
    return true;
  }

  /** Returns whether a term is a value: ground, and free of built-in
   * function applications, so that two values are equal only if they are
   * structurally equal. */
  public static boolean isValue(Term term) {
    if (term instanceof Literal) {
      return true;
    }
    if (term instanceof Apply) {
      final Apply apply = (Apply) term;
      if (apply.builtIn != null) {
        return false;
      }
      for (Term arg : apply.args) {
        if (!isValue(arg)) {
          return false;
        }
      }
      return true;
    }
    if (term instanceof MapTerm) {
      return ((MapTerm) term).isConcrete();
    }
    return false;
  }

  private static boolean isConcrete(Term term) {
    return term instanceof MapTerm && ((MapTerm) term).isConcrete();
  }

  private static BigInteger integer(Term term) {
    return ((Literal) term).bigIntegerValue();
  }

  /** Returns whether an integer is non-negative and small enough to be
   * used as an exponent, shift or width. */
  private static boolean isSmall(BigInteger i) {
    return i.signum() >= 0
        && i.compareTo(BigInteger.valueOf(MAX_EXPONENT)) <= 0;
  }

  private static boolean isWidth(Term term) {
    return term.isInteger() && isSmall(integer(term));
  }
}

// End BuiltIns.java
