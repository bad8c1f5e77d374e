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
package net.hydromatic.optim.session;

import net.hydromatic.optim.type.Struct;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Result of a successful {@link OptimizationSession#solve()}.
 *
 * <p>Holds the solution tree, which has the same structure as the session's
 * symbol tree, and the value of the cost. Immutable. */
public class Solution {
  private final @Nullable Object values;
  private final double cost;

  Solution(@Nullable Object values, double cost) {
    this.values = values;
    this.cost = cost;
  }

  /** Returns the solution tree: a {@link Struct} or a list, depending on what
   * the session generated symbols from; null if it generated none. */
  public @Nullable Object values() {
    return values;
  }

  /** Returns the solution tree, which must be a single {@link Struct}. */
  public Struct struct() {
    if (!(values instanceof Struct)) {
      throw new IllegalStateException("solution is not a record: " + values);
    }
    return (Struct) values;
  }

  /** Returns the value of the cost at the solution. */
  public double cost() {
    return cost;
  }

  @Override public String toString() {
    return "Solution{cost=" + cost + ", values=" + values + "}";
  }
}

// End Solution.java
