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
package net.hydromatic.pydecompiler;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.pydecompiler.ast.AstWriter;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls how source code is written.
 *
 * @see Decompiler#decompile(net.hydromatic.pydecompiler.ast.AstNode, Map)
 */
public enum Prop {
  /**
   * Integer property "indentation" is the number of spaces per level of
   * indentation. Default is 4.
   */
  INDENTATION("indentation", Integer.class, true,
      AstWriter.DEFAULT_INDENTATION),

  /**
   * Integer property "lineLength" is the length beyond which the decompiler
   * tries to break a list over several lines. It does not always succeed;
   * for example, a long name is never broken. Default is 100.
   */
  LINE_LENGTH("lineLength", Integer.class, true,
      AstWriter.DEFAULT_LINE_LENGTH);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final @Nullable Object defaultValue;

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

  Prop(String camelName, Class<?> type, boolean required,
      @Nullable Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    if (defaultValue == null) {
      checkArgument(
          !required, "required property %s must have default value", camelName);
    } else {
      checkArgument(type.isInstance(defaultValue));
    }
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
  public @Nullable Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkArgument(type == Integer.class, "invalid type %s for property %s",
        Integer.class, camelName);
    final Object o = get(map);
    if (o == null) {
      throw new IllegalArgumentException("no value for property " + camelName
          + " and no default value");
    }
    return (Integer) o;
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException("property " + camelName
            + " is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException("value for property " + camelName
            + " must have type " + type);
      }
      map.put(this, value);
    }
  }

  /**
   * Removes the value of this property from a map, returning the previous value
   * or null.
   */
  public @Nullable Object remove(Map<Prop, Object> map) {
    return map.remove(this);
  }
}

// End Prop.java
