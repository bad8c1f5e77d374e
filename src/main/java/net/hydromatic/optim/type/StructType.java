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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Declaration of a structured record: a name and an ordered list of
 * {@link Field}s with distinct names.
 *
 * <p>A StructType is described once, when it is built, and is immutable
 * thereafter. Instances of it are {@link Struct} values. */
public class StructType {
  public final String name;
  public final ImmutableList<Field> fields;
  private final ImmutableMap<String, Integer> ordinals;

  private StructType(String name, ImmutableList<Field> fields) {
    this.name = requireNonNull(name, "name");
    this.fields = requireNonNull(fields, "fields");
    final ImmutableMap.Builder<String, Integer> b = ImmutableMap.builder();
    for (int i = 0; i < fields.size(); i++) {
      b.put(fields.get(i).name, i);
    }
    // Throws if two fields have the same name
    this.ordinals = b.buildOrThrow();
  }

  /** Creates a builder. */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  /** Creates a StructType with a list of fields. */
  public static StructType of(String name, List<Field> fields) {
    return new StructType(name, ImmutableList.copyOf(fields));
  }

  /** Returns the number of fields. */
  public int fieldCount() {
    return fields.size();
  }

  /** Returns the ordinal of a field, or -1 if there is no such field. */
  public int ordinal(String fieldName) {
    final Integer i = ordinals.get(fieldName);
    return i == null ? -1 : i;
  }

  /** Returns the field with a given name, or null. */
  public @Nullable Field field(String fieldName) {
    final int i = ordinal(fieldName);
    return i < 0 ? null : fields.get(i);
  }

  @Override public int hashCode() {
    return name.hashCode() * 31 + fields.hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof StructType
        && name.equals(((StructType) o).name)
        && fields.equals(((StructType) o).fields);
  }

  @Override public String toString() {
    return name + fields;
  }

  /** Builder for {@link StructType}. */
  public static class Builder {
    private final String name;
    private final Map<String, Field> fields = new LinkedHashMap<>();

    Builder(String name) {
      this.name = requireNonNull(name, "name");
    }

    /** Adds a field. */
    public Builder add(Field field) {
      checkArgument(!fields.containsKey(field.name),
          "duplicate field %s in %s", field.name, name);
      fields.put(field.name, field);
      return this;
    }

    public Builder variable(String fieldName) {
      return add(Field.variable(fieldName));
    }

    public Builder parameter(String fieldName) {
      return add(Field.parameter(fieldName));
    }

    public Builder variableList(String fieldName) {
      return add(Field.variableList(fieldName));
    }

    public Builder parameterList(String fieldName) {
      return add(Field.parameterList(fieldName));
    }

    public Builder composite(String fieldName) {
      return add(Field.composite(fieldName));
    }

    public Builder compositeList(String fieldName) {
      return add(Field.compositeList(fieldName));
    }

    public Builder plain(String fieldName) {
      return add(Field.plain(fieldName));
    }

    public StructType build() {
      return new StructType(name, ImmutableList.copyOf(fields.values()));
    }
  }
}

// End StructType.java
