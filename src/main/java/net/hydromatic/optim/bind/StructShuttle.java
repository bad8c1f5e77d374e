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
package net.hydromatic.optim.bind;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.optim.type.Field;
import net.hydromatic.optim.type.Role;
import net.hydromatic.optim.type.Struct;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Walks a tree of {@link Struct} values and lists, and returns an
 * isomorphic tree in which every storage leaf has been rewritten.
 *
 * <p>Composite fields are walked recursively, storage fields are passed to
 * {@link #visitLeaf}, and plain fields are copied as they are. The tree being
 * walked is never modified. */
public abstract class StructShuttle {
  /** Rewrites a tree, which must be a {@link Struct} or a list of trees. */
  public Object visit(@Nullable Object tree, Path path) {
    if (tree instanceof Struct) {
      return visit((Struct) tree, path);
    }
    if (tree instanceof List) {
      return visitList((List<?>) tree, path);
    }
    throw new StructureMismatchException(path, "a record or a list of records",
        tree);
  }

  /** Rewrites a record. */
  public Struct visit(Struct struct, Path path) {
    return struct.copy((field, value) ->
        visitField(field, value, path.field(field.name)));
  }

  /** Rewrites a list of records (or of lists of records). */
  protected List<Object> visitList(List<?> list, Path path) {
    final ImmutableList.Builder<Object> b =
        ImmutableList.builderWithExpectedSize(list.size());
    for (int i = 0; i < list.size(); i++) {
      b.add(visit(list.get(i), path.index(i)));
    }
    return b.build();
  }

  /** Rewrites the value of a field. */
  protected @Nullable Object visitField(Field field, @Nullable Object value,
      Path path) {
    switch (field.kind) {
      case STORAGE:
        if (value instanceof List) {
          throw new StructureMismatchException(path, "a single leaf", value);
        }
        return visitLeaf(field.role(), value, path);

      case STORAGE_LIST:
        if (value == null) {
          throw new MissingValueException(path);
        }
        if (!(value instanceof List)) {
          throw new StructureMismatchException(path, "a list of leaves", value);
        }
        return visitLeafList(field.role(), (List<?>) value, path);

      case COMPOSITE:
        if (value == null) {
          return null;
        }
        if (!(value instanceof Struct)) {
          throw new StructureMismatchException(path, "a record", value);
        }
        return visit((Struct) value, path);

      case COMPOSITE_LIST:
        if (value == null) {
          return null;
        }
        if (!(value instanceof List)) {
          throw new StructureMismatchException(path, "a list of records",
              value);
        }
        return visitList((List<?>) value, path);

      case PLAIN:
        return value;

      default:
        throw new AssertionError(field.kind);
    }
  }

  /** Rewrites each leaf of a list, preserving order. */
  protected List<Object> visitLeafList(Role role, List<?> values, Path path) {
    final ImmutableList.Builder<Object> b =
        ImmutableList.builderWithExpectedSize(values.size());
    for (int i = 0; i < values.size(); i++) {
      b.add(visitLeaf(role, values.get(i), path.index(i)));
    }
    return b.build();
  }

  /** Rewrites a storage leaf. Must not return null. */
  protected abstract Object visitLeaf(Role role, @Nullable Object value,
      Path path);
}

// End StructShuttle.java
