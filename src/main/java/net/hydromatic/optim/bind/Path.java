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

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Location of a node in a tree, such as {@code legs[2].force}.
 *
 * <p>Used only in diagnostics; a path never affects how a tree is walked. */
public class Path {
  public static final Path ROOT = new Path(null, "");

  private final @Nullable Path parent;
  /** Either a field name or an index in brackets, e.g. "[2]". */
  private final String segment;

  private Path(@Nullable Path parent, String segment) {
    this.parent = parent;
    this.segment = requireNonNull(segment, "segment");
  }

  /** Returns the path of a field of the record at this path. */
  public Path field(String name) {
    return new Path(this, name);
  }

  /** Returns the path of an element of the list at this path. */
  public Path index(int i) {
    return new Path(this, "[" + i + "]");
  }

  public boolean isRoot() {
    return parent == null;
  }

  @Override public int hashCode() {
    return Objects.hash(parent, segment);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Path
        && segment.equals(((Path) o).segment)
        && Objects.equals(parent, ((Path) o).parent);
  }

  @Override public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    if (parent == null) {
      return buf;
    }
    parent.describeTo(buf);
    if (!parent.isRoot() && !segment.startsWith("[")) {
      buf.append('.');
    }
    return buf.append(segment);
  }
}

// End Path.java
