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

import net.hydromatic.optim.util.OptimException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Error detected while walking a tree.
 *
 * <p>Thrown at the point of detection; the walk is abandoned, and leaves
 * that were applied earlier in the same walk stay applied. */
public abstract class BindException extends RuntimeException
    implements OptimException {
  private final Path path;

  protected BindException(String message, Path path) {
    super(message);
    this.path = requireNonNull(path, "path");
  }

  /** Returns the location in the tree at which the error was detected. */
  public Path path() {
    return path;
  }

  @Override public String toString() {
    return super.toString() + " at " + where(path);
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Error: ").append(getMessage());
  }

  /** Describes a path for use in a message. */
  static String where(Path path) {
    return path.isRoot() ? "<root>" : path.toString();
  }

  /** Describes the kind of a value for use in a message. */
  static String kindOf(@Nullable Object value) {
    return value == null ? "null" : value.getClass().getSimpleName();
  }
}

// End BindException.java
