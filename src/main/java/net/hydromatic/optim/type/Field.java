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

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Declaration of a field of a {@link StructType}.
 *
 * <p>A field has a name, a {@link FieldKind}, and, if the kind is a storage
 * kind, a {@link Role}. */
public class Field {
  public final String name;
  public final FieldKind kind;
  public final @Nullable Role role;

  private Field(String name, FieldKind kind, @Nullable Role role) {
    this.name = requireNonNull(name, "name");
    this.kind = requireNonNull(kind, "kind");
    this.role = role;
    checkArgument(!name.isEmpty(), "empty field name");
    checkArgument(kind.storage == (role != null),
        "field %s of kind %s must %shave a role", name, kind,
        kind.storage ? "" : "not ");
  }

  /** Creates a field that holds one leaf of a given role. */
  public static Field storage(String name, Role role) {
    return new Field(name, FieldKind.STORAGE, requireNonNull(role, "role"));
  }

  /** Creates a field that holds a list of leaves of a given role. */
  public static Field storageList(String name, Role role) {
    return new Field(name, FieldKind.STORAGE_LIST,
        requireNonNull(role, "role"));
  }

  public static Field variable(String name) {
    return storage(name, Role.VARIABLE);
  }

  public static Field parameter(String name) {
    return storage(name, Role.PARAMETER);
  }

  public static Field variableList(String name) {
    return storageList(name, Role.VARIABLE);
  }

  public static Field parameterList(String name) {
    return storageList(name, Role.PARAMETER);
  }

  /** Creates a field that holds a nested {@link Struct}. */
  public static Field composite(String name) {
    return new Field(name, FieldKind.COMPOSITE, null);
  }

  /** Creates a field that holds a list of {@link Struct} values (or lists of
   * them). */
  public static Field compositeList(String name) {
    return new Field(name, FieldKind.COMPOSITE_LIST, null);
  }

  /** Creates a field that holds untagged data. */
  public static Field plain(String name) {
    return new Field(name, FieldKind.PLAIN, null);
  }

  /** Returns the role; throws if this is not a storage field. */
  public Role role() {
    if (role == null) {
      throw new IllegalStateException("field " + name + " has no role");
    }
    return role;
  }

  @Override public int hashCode() {
    return Objects.hash(name, kind, role);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Field
        && name.equals(((Field) o).name)
        && kind == ((Field) o).kind
        && role == ((Field) o).role;
  }

  @Override public String toString() {
    return role == null
        ? name + ": " + kind
        : name + ": " + kind + " " + role;
  }
}

// End Field.java
