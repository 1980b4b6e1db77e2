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
package net.hydromatic.prover.prove;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import net.hydromatic.prover.explore.Explorer.SearchOrder;
import net.hydromatic.prover.util.ProverException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property of a proof session.
 *
 * @see Session#props
 */
public enum Prop {
  /**
   * Integer property "maxSteps" is the number of rule applications, summed
   * over all branches, after which a proof attempt gives up. Default is
   * 10,000.
   */
  MAX_STEPS("maxSteps", Integer.class, true, 10_000),

  /**
   * Integer property "maxBranches" is the number of execution nodes that
   * may be open at once. Default is 1,000.
   */
  MAX_BRANCHES("maxBranches", Integer.class, true, 1_000),

  /** Integer property "maxDepth" is the length of the longest path that
   * will be explored. Default is 2,000. */
  MAX_DEPTH("maxDepth", Integer.class, true, 2_000),

  /**
   * Integer property "solverTimeoutMillis" is how long the oracle may
   * spend on one query. Default is 5,000.
   */
  SOLVER_TIMEOUT_MILLIS("solverTimeoutMillis", Integer.class, true, 5_000),

  /** Property "solver" chooses the oracle. Default is "linear". */
  SOLVER("solver", Solver.class, true, Solver.LINEAR),

  /**
   * Integer property "parallelism" is the number of threads that expand
   * branches. Default is 1, which expands branches on the calling thread.
   */
  PARALLELISM("parallelism", Integer.class, true, 1),

  /** Property "searchOrder" controls whether branches are explored
   * breadth-first or depth-first. Default is "breadth_first". */
  SEARCH_ORDER("searchOrder", SearchOrder.class, true,
      SearchOrder.BREADTH_FIRST),

  /**
   * Boolean property "exhaustive" controls whether the search continues
   * after a counterexample is found. Default is false.
   */
  EXHAUSTIVE("exhaustive", Boolean.class, true, false),

  /** Maximum number of simplification passes over a term. */
  MAX_SIMPLIFY_PASSES("maxSimplifyPasses", Integer.class, true, 32),

  /** Integer property "cacheSize" is the number of oracle answers that are
   * remembered. 0 disables the cache. Default is 10,000. */
  CACHE_SIZE("cacheSize", Integer.class, true, 10_000),

  /** String property "controlCell" is the name of the cell that holds the
   * sequence of pending instructions. Default is "k". */
  CONTROL_CELL("controlCell", String.class, true, "k");

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : ordering.sortedCopy(list)) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new ProverException("property " + propName + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return this.<Boolean>typeValue(map.get(this));
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return this.<Integer>typeValue(map.get(this));
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    return this.typeValue(map.get(this));
  }

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map, Class<E> type) {
    checkType(type);
    return this.typeValue(map.get(this));
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    return o == null ? (T) defaultValue : (T) o;
  }

  /** Sets the value of a property, allowing strings for enum types. */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (type.isEnum() && value instanceof String) {
      Optional<Enum> optional =
          Enums.getIfPresent(
              (Class<Enum>) type, ((String) value).toUpperCase(Locale.ROOT));
      if (!optional.isPresent()) {
        String values =
            Arrays.stream((Enum[]) type.getEnumConstants())
                .map(Enum::name)
                .collect(Collectors.joining("', '", "'", "'"));
        throw new ProverException("value must be one of: " + values);
      }
      set(map, optional.get());
      return;
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new ProverException("property is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new ProverException("value for property " + camelName
            + " must have type " + type.getSimpleName());
      }
      map.put(this, value);
    }
  }

  /** Allowed values for {@link #SOLVER} property. */
  public enum Solver {
    /** In-process decision procedure for linear integer arithmetic. The
     * default. */
    LINEAR,
    /** External "z3" process. */
    Z3
  }
}

// End Prop.java
