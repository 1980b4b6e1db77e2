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
package net.hydromatic.prover.solver;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.prover.term.TermBuilder.terms;

import com.google.common.collect.ImmutableList;
import com.google.common.io.CharStreams;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import net.hydromatic.prover.term.Apply;
import net.hydromatic.prover.term.Literal;
import net.hydromatic.prover.term.Op;
import net.hydromatic.prover.term.PatternMatcher;
import net.hydromatic.prover.term.Term;
import net.hydromatic.prover.term.Var;
import net.hydromatic.prover.util.ProverException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Oracle that runs an external solver that reads SMT-LIB 2 on its
 * standard input, such as {@code z3 -in -smt2}.
 *
 * <p>Each query starts a process. If the solver does not answer within
 * the timeout, or answers {@code unknown}, the query is tried once more
 * with twice the timeout.
 *
 * <p>Terms outside linear integer arithmetic are declared as
 * uninterpreted constants, as in {@link LinearOracle}; in their presence
 * the answer {@code sat} becomes {@link Satisfiability#UNKNOWN}.
 */
public class SmtLibOracle implements Oracle {
  /** Time allowed for the process to start and exit, beyond the solver's
   * own timeout. */
  private static final long GRACE_MILLIS = 1_000;

  private final ImmutableList<String> command;
  private final long timeoutMillis;

  /** Creates an oracle.
   *
   * @param command Command line, for example {@code ["z3", "-in",
   *   "-smt2"]}; the timeout option is added
   * @param timeoutMillis Timeout of the first attempt
   */
  public SmtLibOracle(List<String> command, long timeoutMillis) {
    this.command = ImmutableList.copyOf(requireNonNull(command));
    this.timeoutMillis = timeoutMillis;
  }

  @Override
  public String toString() {
    return "SmtLibOracle(" + String.join(" ", command) + ")";
  }

  @Override
  public Validity entails(Term assumption, Term goal) {
    switch (satisfiable(terms.and(assumption, terms.not(goal)))) {
      case UNSAT:
        return Validity.VALID;
      case SAT:
        return Validity.INVALID;
      case TIMEOUT:
        return Validity.TIMEOUT;
      default:
        return Validity.UNKNOWN;
    }
  }

  @Override
  public Satisfiability satisfiable(Term constraint) {
    final Script script = new Script();
    final String text = script.build(constraint);
    @Nullable String answer = run(text, timeoutMillis);
    if (answer == null || answer.equals("unknown")) {
      answer = run(text, timeoutMillis * 2);
    }
    if (answer == null) {
      return Satisfiability.TIMEOUT;
    }
    switch (answer) {
      case "unsat":
        return Satisfiability.UNSAT;
      case "sat":
        return script.abstracted
            ? Satisfiability.UNKNOWN
            : Satisfiability.SAT;
      case "unknown":
        return Satisfiability.UNKNOWN;
      default:
        throw new ProverException("unexpected solver output: " + answer);
    }
  }

  /** Converts a constraint to an SMT-LIB 2 script. */
  static String toSmtLib(Term constraint) {
    return new Script().build(constraint);
  }

  /** Runs the solver; returns its first line of output, or null if it
   * did not finish in time. */
  private @Nullable String run(String script, long timeout) {
    final List<String> args =
        ImmutableList.<String>builder().addAll(command)
            .add("-t:" + timeout).build();
    final Process process;
    try {
      process = new ProcessBuilder(args).redirectErrorStream(true).start();
    } catch (IOException e) {
      throw new ProverException("cannot start solver " + args, e);
    }
    try {
      try (Writer w =
               new OutputStreamWriter(process.getOutputStream(),
                   StandardCharsets.UTF_8)) {
        w.write(script);
      }
      if (!process.waitFor(timeout + GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
        return null;
      }
      final String output =
          CharStreams.toString(
              new InputStreamReader(process.getInputStream(),
                  StandardCharsets.UTF_8));
      final String line = output.trim();
      final int newline = line.indexOf('\n');
      return newline < 0 ? line : line.substring(0, newline).trim();
    } catch (IOException e) {
      throw new ProverException("error communicating with solver", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return null;
    } finally {
      process.destroyForcibly();
    }
  }

  /** Translation of one query. */
  private static class Script {
    /** Declarations, keyed by the term or variable they stand for. */
    final Map<String, String> names = new LinkedHashMap<>();
    final StringBuilder declarations = new StringBuilder();
    boolean abstracted;

    String build(Term constraint) {
      final StringBuilder assertion = new StringBuilder();
      bool(assertion, constraint);
      return "(set-logic ALL)\n"
          + declarations
          + "(assert " + assertion + ")\n"
          + "(check-sat)\n";
    }

    /** Declares a constant; returns its name. */
    String declare(String key, String sort) {
      final String name = names.get(key + ":" + sort);
      if (name != null) {
        return name;
      }
      final String name2 = "c!" + names.size();
      names.put(key + ":" + sort, name2);
      declarations.append("(declare-const ").append(name2).append(' ')
          .append(sort).append(")\n");
      return name2;
    }

    void bool(StringBuilder buf, Term t) {
      if (t instanceof Literal) {
        buf.append(((Literal) t).booleanValue());
        return;
      }
      if (t instanceof Var) {
        buf.append(declare(((Var) t).name, "Bool"));
        return;
      }
      final Op op = t instanceof Apply ? ((Apply) t).builtIn : null;
      if (op == null) {
        abstracted = true;
        buf.append(declare(t.toString(), "Bool"));
        return;
      }
      final Apply a = (Apply) t;
      switch (op) {
        case AND:
          call(buf, "and", a, true);
          return;
        case OR:
          call(buf, "or", a, true);
          return;
        case IMPLIES:
          call(buf, "=>", a, true);
          return;
        case NOT:
          call(buf, "not", a, true);
          return;
        case INT_LT:
          call(buf, "<", a, false);
          return;
        case INT_LE:
          call(buf, "<=", a, false);
          return;
        case INT_GT:
          call(buf, ">", a, false);
          return;
        case INT_GE:
          call(buf, ">=", a, false);
          return;
        case INT_EQ:
          call(buf, "=", a, false);
          return;
        case INT_NE:
          call(buf, "distinct", a, false);
          return;
        case EQ:
        case NE:
          if (PatternMatcher.isIntTyped(a.arg(0))
              || PatternMatcher.isIntTyped(a.arg(1))) {
            call(buf, op == Op.EQ ? "=" : "distinct", a, false);
          } else {
            abstracted = true;
            final String name =
                declare(terms.eq(a.arg(0), a.arg(1)).toString(), "Bool");
            buf.append(op == Op.EQ ? name : "(not " + name + ")");
          }
          return;
        case IS_BYTE_MAP:
          if (a.arg(0) instanceof Var) {
            buf.append(declare(t.toString(), "Bool"));
            return;
          }
          break;
        case IN_UNSIGNED_RANGE:
          if (a.arg(0).isInteger()
              && ((Literal) a.arg(0)).bigIntegerValue().bitLength() < 16) {
            final BigInteger bound =
                BigInteger.ONE.shiftLeft(
                    ((Literal) a.arg(0)).bigIntegerValue().intValue());
            buf.append("(and (<= 0 ");
            integer(buf, a.arg(1));
            buf.append(") (< ");
            integer(buf, a.arg(1));
            buf.append(' ').append(bound).append("))");
            return;
          }
          break;
        default:
          break;
      }
      abstracted = true;
      buf.append(declare(t.toString(), "Bool"));
    }

    void integer(StringBuilder buf, Term t) {
      if (t instanceof Literal) {
        final BigInteger v = ((Literal) t).bigIntegerValue();
        if (v.signum() < 0) {
          buf.append("(- ").append(v.negate()).append(')');
        } else {
          buf.append(v);
        }
        return;
      }
      if (t instanceof Var) {
        buf.append(declare(((Var) t).name, "Int"));
        return;
      }
      final Op op = t instanceof Apply ? ((Apply) t).builtIn : null;
      if (op != null) {
        final Apply a = (Apply) t;
        switch (op) {
          case INT_ADD:
            call(buf, "+", a, false);
            return;
          case INT_SUB:
            call(buf, "-", a, false);
            return;
          case INT_MUL:
            call(buf, "*", a, false);
            return;
          case INT_MOD:
            call(buf, "mod", a, false);
            return;
          case INT_DIV:
            truncatingDiv(buf, a.arg(0), a.arg(1));
            return;
          default:
            break;
        }
      }
      abstracted = true;
      buf.append(declare(t.toString(), "Int"));
    }

    /** Writes division that rounds toward zero. SMT-LIB {@code div} is
     * Euclidean, so it agrees only when the dividend is non-negative. */
    void truncatingDiv(StringBuilder buf, Term x, Term y) {
      final StringBuilder xs = new StringBuilder();
      integer(xs, x);
      final StringBuilder ys = new StringBuilder();
      integer(ys, y);
      buf.append("(ite (>= ").append(xs).append(" 0) (div ").append(xs)
          .append(' ').append(ys).append(") (- (div (- ").append(xs)
          .append(") ").append(ys).append(")))");
    }

    void call(StringBuilder buf, String name, Apply a, boolean bool) {
      buf.append('(').append(name);
      for (Term arg : a.args) {
        buf.append(' ');
        if (bool) {
          bool(buf, arg);
        } else {
          integer(buf, arg);
        }
      }
      buf.append(')');
    }
  }
}

// End SmtLibOracle.java
