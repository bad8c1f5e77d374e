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
package net.hydromatic.optim.type;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;
import net.hydromatic.optim.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Instance of a {@link StructType}.
 *
 * <p>Values are held positionally, in the order of the type's fields, and any
 * of them may be null. A Struct is immutable: lists are copied when the Struct
 * is built, and {@link #copy} returns a new Struct rather than modifying this
 * one.
 *
 * <p>The same Struct class represents every tree in a binding session. In a
 * declaration, storage fields hold {@link DenseArray} values whose shape is
 * used to create symbols; in a symbol tree they hold solver symbols; in a
 * guess tree, optional {@link DenseArray} initial values; in a solution tree,
 * solved {@link DenseArray} values. */
public class Struct {
  public final StructType type;
  private final List<@Nullable Object> values;

  private Struct(StructType type, List<@Nullable Object> values) {
    this.type = requireNonNull(type, "type");
    this.values = values;
    checkArgument(values.size() == type.fieldCount());
  }

  /** Creates a builder. */
  public static Builder builder(StructType type) {
    return new Builder(type);
  }

  /** Creates a Struct whose values are in field order. */
  public static Struct of(StructType type, @Nullable Object... values) {
    checkArgument(values.length == type.fieldCount(),
        "%s expects %s values, got %s", type.name, type.fieldCount(),
        values.length);
    final List<@Nullable Object> list = new ArrayList<>();
    for (Object value : values) {
      list.add(freeze(value));
    }
    return new Struct(type, Collections.unmodifiableList(list));
  }

  /** Returns the value of the {@code i}th field. */
  public @Nullable Object get(int i) {
    return values.get(i);
  }

  /** Returns the value of a field; throws if there is no such field. */
  public @Nullable Object get(String fieldName) {
    final int i = type.ordinal(fieldName);
    checkArgument(i >= 0, "%s has no field %s", type.name, fieldName);
    return values.get(i);
  }

  /** Returns whether the type of this Struct has a field of a given name. */
  public boolean has(String fieldName) {
    return type.ordinal(fieldName) >= 0;
  }

  /** Returns the values, in field order. */
  public List<@Nullable Object> values() {
    return values;
  }

  /** Returns a Struct of the same type whose values have been transformed
   * field by field. This Struct is not modified. */
  public Struct copy(
      BiFunction<Field, @Nullable Object, @Nullable Object> transform) {
    final List<@Nullable Object> list = new ArrayList<>(values.size());
    int differenceCount = 0;
    for (int i = 0; i < values.size(); i++) {
      final Object value = values.get(i);
      final Object value2 = transform.apply(type.fields.get(i), value);
      if (value2 != value) {
        ++differenceCount;
        list.add(freeze(value2));
      } else {
        list.add(value);
      }
    }
    return differenceCount == 0
        ? this
        : new Struct(type, Collections.unmodifiableList(list));
  }

  /** Returns a Struct of the same type with one value replaced. */
  public Struct with(String fieldName, @Nullable Object value) {
    final int i = type.ordinal(fieldName);
    checkArgument(i >= 0, "%s has no field %s", type.name, fieldName);
    return copy((field, v) -> field.name.equals(fieldName) ? value : v);
  }

  /** Makes lists, at any depth, unmodifiable. */
  private static @Nullable Object freeze(@Nullable Object value) {
    if (value instanceof List) {
      final List<@Nullable Object> list = new ArrayList<>();
      for (Object o : (List<?>) value) {
        list.add(freeze(o));
      }
      return Static.nullableCopy(list);
    }
    return value;
  }

  @Override public int hashCode() {
    return type.hashCode() * 31 + values.hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Struct
        && type.equals(((Struct) o).type)
        && values.equals(((Struct) o).values);
  }

  @Override public String toString() {
    final StringBuilder b = new StringBuilder(type.name).append('{');
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      b.append(type.fields.get(i).name).append('=').append(values.get(i));
    }
    return b.append('}').toString();
  }

  /** Builder for {@link Struct}. Fields that are not set are null. */
  public static class Builder {
    private final StructType type;
    private final @Nullable Object[] values;

    Builder(StructType type) {
      this.type = requireNonNull(type, "type");
      this.values = new Object[type.fieldCount()];
    }

    /** Sets the value of a field. */
    public Builder set(String fieldName, @Nullable Object value) {
      final int i = type.ordinal(fieldName);
      checkArgument(i >= 0, "%s has no field %s", type.name, fieldName);
      values[i] = value;
      return this;
    }

    public Struct build() {
      return Struct.of(type, values);
    }
  }

  /** Returns whether a value is a Struct, or a list whose elements are all
   * (recursively) Structs or such lists. */
  public static boolean isTree(@Nullable Object value) {
    if (value instanceof Struct) {
      return true;
    }
    if (value instanceof List) {
      return Static.allMatch((List<?>) value, Struct::isTree);
    }
    return false;
  }
}

// End Struct.java
