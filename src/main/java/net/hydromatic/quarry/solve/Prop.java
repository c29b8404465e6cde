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
package net.hydromatic.quarry.solve;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls the search.
 *
 * <p>Values are held in a {@code Map<Prop, Object>}; a property that is not
 * in the map has its default value.
 */
public enum Prop {
  /**
   * Long property "nodeBudget" is the maximum number of search nodes per
   * command. When the search exceeds it, the verdict is "timeout". Default is
   * 0, meaning no limit.
   */
  NODE_BUDGET("nodeBudget", Long.class, true, 0L),

  /**
   * Long property "timeoutMillis" is the maximum wall-clock time, in
   * milliseconds, per command. Default is 0, meaning no limit.
   */
  TIMEOUT_MILLIS("timeoutMillis", Long.class, true, 0L),

  /**
   * Integer property "parallelism" is the number of threads that search
   * disjoint subtrees. Default is 1, which gives a deterministic search.
   */
  PARALLELISM("parallelism", Integer.class, true, 1),

  /**
   * Boolean property "symmetryBreaking" controls whether the search skips
   * choices that are isomorphic to choices already explored. Default is
   * true.
   */
  SYMMETRY_BREAKING("symmetryBreaking", Boolean.class, true, true),

  /**
   * Boolean property "revalidate" controls whether each instance is
   * evaluated again against every constraint before it is reported. Default
   * is true.
   */
  REVALIDATE("revalidate", Boolean.class, true, true),

  /**
   * Long property "progressInterval" is the number of search nodes between
   * progress events sent to the tracer. Default is 100,000.
   */
  PROGRESS_INTERVAL("progressInterval", Long.class, true, 100_000L),

  /**
   * Integer property "traceLength" is the number of time steps that the
   * reporter prints in an instance's trace. Default is -1, meaning all.
   */
  TRACE_LENGTH("traceLength", Integer.class, true, -1);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
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
      throw new IllegalArgumentException("property " + propName
          + " not found");
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
    return (Boolean) get(map);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }

  /** Returns the value of a long property. */
  public long longValue(Map<Prop, Object> map) {
    checkType(Long.class);
    return (Long) get(map);
  }

  /** Sets the value of a property, converting strings to the property's
   * type. */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String && type != String.class) {
      final String s = ((String) value).trim();
      try {
        if (type == Integer.class) {
          set(map, Integer.valueOf(s));
          return;
        }
        if (type == Long.class) {
          set(map, Long.valueOf(s));
          return;
        }
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("value for property " + camelName
            + " must be a number: " + s, e);
      }
      if (type == Boolean.class) {
        switch (s.toLowerCase(Locale.ROOT)) {
          case "true":
            set(map, true);
            return;
          case "false":
            set(map, false);
            return;
          default:
            throw new IllegalArgumentException("value for property "
                + camelName + " must be true or false: " + s);
        }
      }
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException("property is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException("value for property must have "
            + "type " + type);
      }
      map.put(this, value);
    }
  }
}

// End Prop.java
