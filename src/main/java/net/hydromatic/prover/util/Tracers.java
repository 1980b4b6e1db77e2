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
package net.hydromatic.prover.util;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.prover.util.Static.str;

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.function.BiConsumer;
import net.hydromatic.prover.term.Term;

/** Implementations of {@link Tracer}. */
public class Tracers {

  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static ConfigurableTracer nullTracer() {
    return ConfigurableTracerImpl.INITIAL;
  }

  /** Returns a tracer that writes debugging messages to a writer. */
  public static ConfigurableTracer printTracer(PrintWriter w) {
    final PrintTracer p = new PrintTracer(w);
    return ConfigurableTracerImpl.INITIAL
        .withStepHandler(p::onStep)
        .withBranchHandler(p::onBranch)
        .withCircularityHandler(p::onCircularity)
        .withNodeClosedHandler(p::onNodeClosed)
        .withOracleHandler(p::onOracle)
        .withVerdictHandler(p::onVerdict);
  }

  /** Returns a tracer that writes debugging messages to a stream. */
  public static ConfigurableTracer printTracer(OutputStream stream) {
    return printTracer(
        new PrintWriter(
            new OutputStreamWriter(stream, StandardCharsets.UTF_8)));
  }

  /** Implementation of {@link Tracer} that writes to a given {@link
   * PrintWriter}. */
  private static class PrintTracer implements Tracer {
    private final StringBuilder b = new StringBuilder();
    private final PrintWriter w;

    PrintTracer(PrintWriter w) {
      this.w = requireNonNull(w);
    }

    private synchronized void flush() {
      w.println(str(b));
      w.flush();
    }

    @Override
    public void onStep(String ruleId, Term before, Term after) {
      synchronized (this) {
        b.append("step ").append(ruleId).append(": ").append(after);
        flush();
      }
    }

    @Override
    public void onBranch(String ruleId, Term condition) {
      synchronized (this) {
        b.append("branch ").append(ruleId).append(" on ").append(condition);
        flush();
      }
    }

    @Override
    public void onCircularity(String claimName, Term configuration) {
      synchronized (this) {
        b.append("circularity ").append(claimName).append(": ")
            .append(configuration);
        flush();
      }
    }

    @Override
    public void onNodeClosed(String status, Term configuration) {
      synchronized (this) {
        b.append("closed ").append(status).append(": ").append(configuration);
        flush();
      }
    }

    @Override
    public void onOracle(String query, Term goal, String result) {
      synchronized (this) {
        b.append(query).append(' ').append(goal).append(" -> ").append(result);
        flush();
      }
    }

    @Override
    public void onVerdict(String claimName, String verdict) {
      synchronized (this) {
        b.append("verdict ").append(claimName).append(": ").append(verdict);
        flush();
      }
    }
  }

  /** Tracer that allows each of its methods to be modified using a handler. */
  public interface ConfigurableTracer extends Tracer {
    /** Sets handler for {@link #onStep(String, Term, Term)}. */
    ConfigurableTracer withStepHandler(TriConsumer<String, Term, Term> handler);
    /** Sets handler for {@link #onBranch(String, Term)}. */
    ConfigurableTracer withBranchHandler(BiConsumer<String, Term> handler);
    /** Sets handler for {@link #onCircularity(String, Term)}. */
    ConfigurableTracer withCircularityHandler(BiConsumer<String, Term> handler);
    /** Sets handler for {@link #onNodeClosed(String, Term)}. */
    ConfigurableTracer withNodeClosedHandler(BiConsumer<String, Term> handler);
    /** Sets handler for {@link #onOracle(String, Term, String)}. */
    ConfigurableTracer withOracleHandler(
        TriConsumer<String, Term, String> handler);
    /** Sets handler for {@link #onVerdict(String, String)}. */
    ConfigurableTracer withVerdictHandler(BiConsumer<String, String> handler);
  }

  /**
   * Consumer that accepts three arguments.
   *
   * @param <T> First argument type
   * @param <U> Second argument type
   * @param <V> Third argument type
   */
  @FunctionalInterface
  public interface TriConsumer<T, U, V> {
    void accept(T t, U u, V v);
  }

  /**
   * Implementation of {@link ConfigurableTracer} that has a field for each
   * handler.
   */
  private static class ConfigurableTracerImpl implements ConfigurableTracer {
    static final ConfigurableTracerImpl INITIAL =
        new ConfigurableTracerImpl(
            (ruleId, before, after) -> {},
            (ruleId, condition) -> {},
            (claimName, configuration) -> {},
            (status, configuration) -> {},
            (query, goal, result) -> {},
            (claimName, verdict) -> {});

    private final TriConsumer<String, Term, Term> stepHandler;
    private final BiConsumer<String, Term> branchHandler;
    private final BiConsumer<String, Term> circularityHandler;
    private final BiConsumer<String, Term> nodeClosedHandler;
    private final TriConsumer<String, Term, String> oracleHandler;
    private final BiConsumer<String, String> verdictHandler;

    private ConfigurableTracerImpl(
        TriConsumer<String, Term, Term> stepHandler,
        BiConsumer<String, Term> branchHandler,
        BiConsumer<String, Term> circularityHandler,
        BiConsumer<String, Term> nodeClosedHandler,
        TriConsumer<String, Term, String> oracleHandler,
        BiConsumer<String, String> verdictHandler) {
      this.stepHandler = requireNonNull(stepHandler);
      this.branchHandler = requireNonNull(branchHandler);
      this.circularityHandler = requireNonNull(circularityHandler);
      this.nodeClosedHandler = requireNonNull(nodeClosedHandler);
      this.oracleHandler = requireNonNull(oracleHandler);
      this.verdictHandler = requireNonNull(verdictHandler);
    }

    @Override
    public ConfigurableTracer withStepHandler(
        TriConsumer<String, Term, Term> stepHandler) {
      return new ConfigurableTracerImpl(
          stepHandler,
          branchHandler,
          circularityHandler,
          nodeClosedHandler,
          oracleHandler,
          verdictHandler);
    }

    @Override
    public ConfigurableTracer withBranchHandler(
        BiConsumer<String, Term> branchHandler) {
      return new ConfigurableTracerImpl(
          stepHandler,
          branchHandler,
          circularityHandler,
          nodeClosedHandler,
          oracleHandler,
          verdictHandler);
    }

    @Override
    public ConfigurableTracer withCircularityHandler(
        BiConsumer<String, Term> circularityHandler) {
      return new ConfigurableTracerImpl(
          stepHandler,
          branchHandler,
          circularityHandler,
          nodeClosedHandler,
          oracleHandler,
          verdictHandler);
    }

    @Override
    public ConfigurableTracer withNodeClosedHandler(
        BiConsumer<String, Term> nodeClosedHandler) {
      return new ConfigurableTracerImpl(
          stepHandler,
          branchHandler,
          circularityHandler,
          nodeClosedHandler,
          oracleHandler,
          verdictHandler);
    }

    @Override
    public ConfigurableTracer withOracleHandler(
        TriConsumer<String, Term, String> oracleHandler) {
      return new ConfigurableTracerImpl(
          stepHandler,
          branchHandler,
          circularityHandler,
          nodeClosedHandler,
          oracleHandler,
          verdictHandler);
    }

    @Override
    public ConfigurableTracer withVerdictHandler(
        BiConsumer<String, String> verdictHandler) {
      return new ConfigurableTracerImpl(
          stepHandler,
          branchHandler,
          circularityHandler,
          nodeClosedHandler,
          oracleHandler,
          verdictHandler);
    }

    @Override
    public void onStep(String ruleId, Term before, Term after) {
      stepHandler.accept(ruleId, before, after);
    }

    @Override
    public void onBranch(String ruleId, Term condition) {
      branchHandler.accept(ruleId, condition);
    }

    @Override
    public void onCircularity(String claimName, Term configuration) {
      circularityHandler.accept(claimName, configuration);
    }

    @Override
    public void onNodeClosed(String status, Term configuration) {
      nodeClosedHandler.accept(status, configuration);
    }

    @Override
    public void onOracle(String query, Term goal, String result) {
      oracleHandler.accept(query, goal, result);
    }

    @Override
    public void onVerdict(String claimName, String verdict) {
      verdictHandler.accept(claimName, verdict);
    }
  }
}

// End Tracers.java
