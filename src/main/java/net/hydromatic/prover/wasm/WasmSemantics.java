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
package net.hydromatic.prover.wasm;

import static net.hydromatic.prover.term.TermBuilder.terms;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.List;
import net.hydromatic.prover.lemma.StandardLemmas;
import net.hydromatic.prover.rule.CellSchema;
import net.hydromatic.prover.rule.Rule;
import net.hydromatic.prover.rule.RuleDatabase;
import net.hydromatic.prover.rule.RuleModule;
import net.hydromatic.prover.rule.Strictness;
import net.hydromatic.prover.term.Apply;
import net.hydromatic.prover.term.Bag;
import net.hydromatic.prover.term.Cell;
import net.hydromatic.prover.term.Term;
import net.hydromatic.prover.term.Var;

/**
 * Semantics of a small stack machine in the style of WebAssembly.
 *
 * <p>A configuration has these cells:
 *
 * <pre>{@code
 * <k> instructions </k>
 * <stack> values, top first </stack>
 * <locals> index |-> value ... </locals>
 * <mem> <data> byte-map </data> <size> bytes </size> </mem>
 * }</pre>
 *
 * <p>Values are {@code i32(N)} and {@code i64(N)}, where {@code N} is
 * unsigned. Instructions may be written in stack form, such as
 * {@code local.get(0) ~> local.get(1) ~> i32.add}, or folded, such as
 * {@code i32.add(local.get(0), local.get(1))}; folded instructions are
 * strict in their operands.
 *
 * <p>A load or store whose range is not inside memory has no rule, so
 * execution gets stuck; that models a trap.
 */
public abstract class WasmSemantics {
  private WasmSemantics() {}

  /** Name of the module of step rules. */
  public static final String MODULE = "wasm";

  public static final String K = "k";
  public static final String STACK = "stack";
  public static final String LOCALS = "locals";
  public static final String MEM = "mem";
  public static final String DATA = "data";
  public static final String SIZE = "size";

  private static final BigInteger TWO_32 = BigInteger.ONE.shiftLeft(32);
  private static final BigInteger TWO_64 = BigInteger.ONE.shiftLeft(64);

  private static final Var A = terms.var("A");
  private static final Var C = terms.var("C");
  private static final Var D = terms.var("D");
  private static final Var E = terms.var("E");
  private static final Var I = terms.var("I");
  private static final Var N = terms.var("N");
  private static final Var OFF = terms.var("OFF");
  private static final Var SZ = terms.var("SZ");
  private static final Var T = terms.var("T");
  private static final Var V = terms.var("V");
  private static final Var X = terms.var("X");
  private static final Var Y = terms.var("Y");
  private static final Var REST = terms.frame("REST");
  private static final Var S = terms.frame("S");
  private static final Var L = terms.frame("L");

  /** Returns a database with the step rules and the standard lemmas. */
  public static RuleDatabase database() {
    final RuleDatabase.Builder b = RuleDatabase.builder().add(module());
    StandardLemmas.addTo(b);
    b.value("i32").value("i64");
    b.strict(Strictness.of("local.set", 2, 1))
        .strict(Strictness.of("i32.add", 2))
        .strict(Strictness.of("i32.sub", 2))
        .strict(Strictness.of("i32.ne", 2))
        .strict(Strictness.of("i32.eqz", 1))
        .strict(Strictness.of("drop", 1))
        .strict(Strictness.of("if", 3, 0))
        .strict(Strictness.of("i32.load", 2, 1))
        .strict(Strictness.of("i64.load", 2, 1))
        .strict(Strictness.of("i64.load8_u", 2, 1))
        .strict(Strictness.of("i32.store", 3, 1, 2))
        .strict(Strictness.of("i64.store", 3, 1, 2))
        .strict(Strictness.of("i64.store8", 3, 1, 2));
    b.schema(
        CellSchema.of(
            ImmutableMap.<String, CellSchema.Multiplicity>builder()
                .put(K, CellSchema.Multiplicity.SINGLETON)
                .put(STACK, CellSchema.Multiplicity.SINGLETON)
                .put(LOCALS, CellSchema.Multiplicity.SINGLETON)
                .put(MEM, CellSchema.Multiplicity.SINGLETON)
                .build()));
    return b.build();
  }

  /** Returns the module of step rules. */
  public static RuleModule module() {
    final ImmutableList.Builder<Rule> b = ImmutableList.builder();

    // Constants and the value stack
    b.add(
        Rule.step("i32.const",
            k(terms.apply("i32.const", N)),
            k(i32(terms.mod(N, terms.intLiteral(TWO_32))))),
        Rule.step("i64.const",
            k(terms.apply("i64.const", N)),
            k(i64(terms.mod(N, terms.intLiteral(TWO_64))))),
        Rule.step("push-i32",
            terms.bag(kCell(i32(X)), stackCell(S)),
            terms.bag(kCell(), stackCell(i32(X), S))),
        Rule.step("push-i64",
            terms.bag(kCell(i64(X)), stackCell(S)),
            terms.bag(kCell(), stackCell(i64(X), S))),
        Rule.step("drop",
            terms.bag(kCell(terms.apply("drop")), stackCell(V, S)),
            terms.bag(kCell(), stackCell(S))),
        Rule.step("drop-folded",
            k(terms.apply("drop", V)),
            k()));

    // Locals
    b.add(
        Rule.step("local.get",
            terms.bag(kCell(localGet(I)), localsCell(I, V)),
            terms.bag(kCell(V), localsCell(I, V))),
        Rule.step("local.set",
            terms.bag(kCell(localSet(I)), stackCell(V, S),
                localsCell(I, terms.wildcard())),
            terms.bag(kCell(), stackCell(S), localsCell(I, V))));
    for (String type : ImmutableList.of("i32", "i64")) {
      final Term value = terms.apply(type, X);
      b.add(
          Rule.step("local.set-folded-" + type,
              terms.bag(kCell(localSet(I, value)),
                  localsCell(I, terms.wildcard())),
              terms.bag(kCell(), localsCell(I, value))));
    }

    // Arithmetic
    b.add(
        Rule.step("i32.add",
            terms.bag(kCell(terms.apply("i32.add")),
                stackCell(i32(Y), i32(X), S)),
            terms.bag(kCell(i32(wrap32(terms.plus(X, Y)))), stackCell(S))),
        Rule.step("i32.add-folded",
            k(i32Add(i32(X), i32(Y))),
            k(i32(wrap32(terms.plus(X, Y))))),
        Rule.step("i32.sub-folded",
            k(i32Sub(i32(X), i32(Y))),
            k(i32(wrap32(terms.minus(X, Y))))),
        Rule.step("i32.ne-true",
            k(i32Ne(i32(X), i32(Y))), k(i32(terms.intLiteral(1))),
            terms.neInt(X, Y)),
        Rule.step("i32.ne-false",
            k(i32Ne(i32(X), i32(Y))), k(i32(terms.intLiteral(0))),
            terms.eqInt(X, Y)),
        Rule.step("i32.eqz-true",
            k(i32Eqz(i32(X))), k(i32(terms.intLiteral(1))),
            terms.eqInt(X, terms.intLiteral(0))),
        Rule.step("i32.eqz-false",
            k(i32Eqz(i32(X))), k(i32(terms.intLiteral(0))),
            terms.neInt(X, terms.intLiteral(0))));

    // Control
    b.add(
        Rule.step("if-true",
            k(terms.apply("if", i32(X), T, E)), k(T),
            terms.neInt(X, terms.intLiteral(0))),
        Rule.step("if-false",
            k(terms.apply("if", i32(X), T, E)), k(E),
            terms.eqInt(X, terms.intLiteral(0))),
        Rule.step("while",
            k(terms.apply("while", C, T)),
            k(terms.apply("if", C, terms.seq(T, terms.apply("while", C, T)),
                terms.seq()))));

    // Memory
    b.add(load("i32.load", i32(terms.getRange(D, ea(), width(4))), 4),
        load("i64.load", i64(terms.getRange(D, ea(), width(8))), 8),
        load("i64.load8_u", i64(terms.getRange(D, ea(), width(1))), 1),
        store("i32.store", i32(V), 4),
        store("i64.store", i64(V), 8),
        store("i64.store8", i64(V), 1));
    return new RuleModule(MODULE, b.build());
  }

  /** Effective address, {@code A +Int OFF}. */
  private static Term ea() {
    return terms.plus(A, OFF);
  }

  private static Term width(int w) {
    return terms.intLiteral(w);
  }

  /** Condition that {@code w} bytes at the effective address are inside
   * memory. */
  private static Term inBounds(int w) {
    return terms.le(terms.plus(ea(), width(w)), SZ);
  }

  private static Rule load(String op, Term result, int w) {
    return Rule.step(op,
        terms.bag(kCell(terms.apply(op, OFF, i32(A))), memCell(D, SZ)),
        terms.bag(kCell(result), memCell(D, SZ)),
        inBounds(w));
  }

  private static Rule store(String op, Apply value, int w) {
    final Term stored =
        terms.mod(value.arg(0),
            terms.intLiteral(BigInteger.ONE.shiftLeft(8 * w)));
    return Rule.step(op,
        terms.bag(kCell(terms.apply(op, OFF, i32(A), value)),
            memCell(D, SZ)),
        terms.bag(kCell(),
            memCell(terms.setRange(D, ea(), stored, width(w)), SZ)),
        inBounds(w));
  }

  private static Term wrap32(Term t) {
    return terms.mod(t, terms.intLiteral(TWO_32));
  }

  /** Returns a rule body that rewrites the head of the control cell. */
  private static Bag k(Term... heads) {
    return terms.bag(kCell(heads));
  }

  /** Returns a control cell {@code <k> heads ~> REST </k>}. */
  private static Cell kCell(Term... heads) {
    return terms.cell(K,
        terms.seq(
            ImmutableList.<Term>builder().add(heads).add(REST).build()));
  }

  private static Cell stackCell(Term... values) {
    return terms.cell(STACK, terms.seq(values));
  }

  private static Cell localsCell(Term index, Term value) {
    return terms.cell(LOCALS, terms.mapWithFrame(L, index, value));
  }

  private static Cell memCell(Term data, Term size) {
    return terms.cell(MEM,
        terms.bag(terms.cell(DATA, data), terms.cell(SIZE, size)));
  }

  // Configurations

  /** Creates a configuration. */
  public static Bag configuration(
      Term k, Term stack, Term locals, Term data, Term size) {
    return terms.bag(terms.cell(K, k), terms.cell(STACK, stack),
        terms.cell(LOCALS, locals), memCell(data, size));
  }

  /** Creates a control sequence. */
  public static Term program(Term... instructions) {
    return terms.seq(instructions);
  }

  /** Creates a control sequence. */
  public static Term program(List<? extends Term> instructions) {
    return terms.seq(instructions);
  }

  // Values and instructions

  public static Apply i32(Term n) {
    return terms.apply("i32", n);
  }

  public static Apply i64(Term n) {
    return terms.apply("i64", n);
  }

  public static Apply i32Const(long n) {
    return terms.apply("i32.const", terms.intLiteral(n));
  }

  public static Apply localGet(Term index) {
    return terms.apply("local.get", index);
  }

  public static Apply localGet(int index) {
    return localGet(terms.intLiteral(index));
  }

  /** Creates a {@code local.set} that pops its value from the stack. */
  public static Apply localSet(Term index) {
    return terms.apply("local.set", index);
  }

  public static Apply localSet(int index, Term value) {
    return localSet(terms.intLiteral(index), value);
  }

  public static Apply localSet(Term index, Term value) {
    return terms.apply("local.set", index, value);
  }

  public static Apply i32Add(Term a, Term b) {
    return terms.apply("i32.add", a, b);
  }

  public static Apply i32Sub(Term a, Term b) {
    return terms.apply("i32.sub", a, b);
  }

  public static Apply i32Ne(Term a, Term b) {
    return terms.apply("i32.ne", a, b);
  }

  public static Apply i32Eqz(Term a) {
    return terms.apply("i32.eqz", a);
  }

  public static Apply drop(Term a) {
    return terms.apply("drop", a);
  }

  public static Apply ifThenElse(
      Term condition, Term thenBranch, Term elseBranch) {
    return terms.apply("if", condition, thenBranch, elseBranch);
  }

  public static Apply whileLoop(Term condition, Term body) {
    return terms.apply("while", condition, body);
  }

  public static Apply i64Load(int offset, Term address) {
    return terms.apply("i64.load", terms.intLiteral(offset), address);
  }

  public static Apply i64Load8u(int offset, Term address) {
    return terms.apply("i64.load8_u", terms.intLiteral(offset), address);
  }

  public static Apply i32Load(int offset, Term address) {
    return terms.apply("i32.load", terms.intLiteral(offset), address);
  }

  public static Apply i64Store(int offset, Term address, Term value) {
    return terms.apply("i64.store", terms.intLiteral(offset), address,
        value);
  }

  public static Apply i64Store8(int offset, Term address, Term value) {
    return terms.apply("i64.store8", terms.intLiteral(offset), address,
        value);
  }

  public static Apply i32Store(int offset, Term address, Term value) {
    return terms.apply("i32.store", terms.intLiteral(offset), address,
        value);
  }

  /** Returns a program that reverses the 8 bytes at the address in local
   * 1, using local 0 as a temporary. */
  public static Term reverseBytes() {
    final ImmutableList.Builder<Term> b = ImmutableList.builder();
    for (int i = 0; i < 4; i++) {
      final int j = 7 - i;
      b.add(localSet(0, i64Load8u(i, localGet(1))),
          i64Store8(i, localGet(1), i64Load8u(j, localGet(1))),
          i64Store8(j, localGet(1), localGet(0)));
    }
    return program(b.build());
  }

  /** Returns a loop that decrements local 0 until it is zero. */
  public static Term countDown() {
    return program(
        whileLoop(i32Ne(localGet(0), i32Const(0)),
            program(localSet(0, i32Sub(localGet(0), i32Const(1))))));
  }
}

// End WasmSemantics.java
