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

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Built-in operators of the background theory.
 *
 * <p>An {@link Apply} whose operator is one of these is a function
 * application, and is subject to evaluation and simplification. Any other
 * operator is a constructor.
 *
 * <p>Binary operators are printed infix, with a left and right precedence.
 */
public enum Op {
  INT_ADD("+Int", 2, 13, 14, Type.INT),
  INT_SUB("-Int", 2, 13, 14, Type.INT),
  INT_MUL("*Int", 2, 15, 16, Type.INT),
  /** Division, truncating towards zero. */
  INT_DIV("/Int", 2, 15, 16, Type.INT),
  /** Remainder; its sign is that of the dividend. */
  INT_REM("%Int", 2, 15, 16, Type.INT),
  /** Euclidean modulus; never negative. */
  INT_MOD("modInt", 2, 15, 16, Type.INT),
  INT_POW("^Int", 2, 18, 17, Type.INT),
  INT_AND("&Int", 2, 9, 10, Type.INT),
  INT_OR("|Int", 2, 9, 10, Type.INT),
  INT_XOR("xorInt", 2, 9, 10, Type.INT),
  INT_SHL("<<Int", 2, 11, 12, Type.INT),
  INT_SHR(">>Int", 2, 11, 12, Type.INT),

  INT_LT("<Int", 2, 7, 8, Type.BOOL),
  INT_LE("<=Int", 2, 7, 8, Type.BOOL),
  INT_GT(">Int", 2, 7, 8, Type.BOOL),
  INT_GE(">=Int", 2, 7, 8, Type.BOOL),
  INT_EQ("==Int", 2, 7, 8, Type.BOOL),
  INT_NE("=/=Int", 2, 7, 8, Type.BOOL),
  /** Structural equality between terms of any sort. */
  EQ("==K", 2, 7, 8, Type.BOOL),
  NE("=/=K", 2, 7, 8, Type.BOOL),

  AND("andBool", 2, 4, 5, Type.BOOL),
  OR("orBool", 2, 2, 3, Type.BOOL),
  IMPLIES("impliesBool", 2, 1, 0, Type.BOOL),
  NOT("notBool", 1, 6, 6, Type.BOOL),

  /** {@code #getRange(bm, addr, width)}: little-endian read of bytes. */
  GET_RANGE("#getRange", 3, 0, 0, Type.INT),
  /** {@code #setRange(bm, addr, value, width)}: little-endian write. */
  SET_RANGE("#setRange", 4, 0, 0, Type.MAP),
  /** {@code #isByteMap(bm)}: every present entry is in [0, 255]. */
  IS_BYTE_MAP("#isByteMap", 1, 0, 0, Type.BOOL),
  /** {@code #inUnsignedRange(width, v)}: 0 &le; v &lt; 2<sup>width</sup>. */
  IN_UNSIGNED_RANGE("#inUnsignedRange", 2, 0, 0, Type.BOOL);

  public final String opName;
  public final int arity;
  final int left;
  final int right;
  public final Type type;

  private static final ImmutableMap<String, Op> BY_NAME;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : values()) {
      b.put(op.opName, op);
    }
    BY_NAME = b.build();
  }

  Op(String opName, int arity, int left, int right, Type type) {
    this.opName = opName;
    this.arity = arity;
    this.left = left;
    this.right = right;
    this.type = type;
  }

  /** Looks up an operator by name; returns null if not built-in. */
  public static @Nullable Op lookup(String opName) {
    return BY_NAME.get(opName);
  }

  /** Whether this operator prints infix. */
  public boolean infix() {
    return left > 0 || right > 0;
  }

  /** Result type of an operator. */
  public enum Type {
    INT,
    BOOL,
    MAP
  }
}

// End Op.java
