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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.prover.util.ProverException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Collection of rule modules, plus the declarations that tell the engine
 * how to treat the operators the rules use: which are strict in which
 * arguments, and which construct values.
 *
 * <p>A database is immutable, and may be shared by any number of
 * concurrent proof attempts.
 */
public final class RuleDatabase {
  public final ImmutableMap<String, RuleModule> modules;
  public final ImmutableMap<String, Strictness> strictness;
  /** Names of constructors whose applications are values, such as
   * {@code i32}. Literals are always values. */
  public final ImmutableSet<String> valueConstructors;
  public final CellSchema schema;

  private RuleDatabase(
      ImmutableMap<String, RuleModule> modules,
      ImmutableMap<String, Strictness> strictness,
      ImmutableSet<String> valueConstructors,
      CellSchema schema) {
    this.modules = modules;
    this.strictness = strictness;
    this.valueConstructors = valueConstructors;
    this.schema = schema;
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns a module.
   *
   * @throws ProverException if there is no module with that name */
  public RuleModule module(String name) {
    final RuleModule module = modules.get(name);
    if (module == null) {
      throw new ProverException("unknown module '" + name + "'; "
          + "available: " + modules.keySet());
    }
    return module;
  }

  /** Returns the rules of a given kind in the given modules, in module
   * order. */
  public ImmutableList<Rule> rules(
      Collection<String> moduleNames, Rule.Kind kind) {
    final ImmutableList.Builder<Rule> b = ImmutableList.builder();
    for (String name : moduleNames) {
      b.addAll(module(name).rules(kind));
    }
    return b.build();
  }

  public @Nullable Strictness strictness(String op) {
    return strictness.get(op);
  }

  /** Builder for {@link RuleDatabase}. */
  public static class Builder {
    private final Map<String, RuleModule> modules = new LinkedHashMap<>();
    private final Map<String, Strictness> strictness = new LinkedHashMap<>();
    private final ImmutableSet.Builder<String> valueConstructors =
        ImmutableSet.builder();
    private CellSchema schema = CellSchema.ANY;

    @CanIgnoreReturnValue
    public Builder add(RuleModule module) {
      if (modules.put(module.name, module) != null) {
        throw new ProverException("duplicate module " + module.name);
      }
      return this;
    }

    @CanIgnoreReturnValue
    public Builder strict(Strictness s) {
      strictness.put(s.op, s);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder value(String constructor) {
      valueConstructors.add(constructor);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder schema(CellSchema schema) {
      this.schema = requireNonNull(schema);
      return this;
    }

    public RuleDatabase build() {
      return new RuleDatabase(ImmutableMap.copyOf(modules),
          ImmutableMap.copyOf(strictness), valueConstructors.build(), schema);
    }
  }
}

// End RuleDatabase.java
