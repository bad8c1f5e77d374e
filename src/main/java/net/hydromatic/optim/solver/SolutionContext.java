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
package net.hydromatic.optim.solver;

import net.hydromatic.optim.type.DenseArray;

/** Result of a successful {@link NlpSolver#solve()}.
 *
 * <p>Reading a value does not change the state of the solver. */
public interface SolutionContext {
  /** Returns the value of an expression, typically a {@link Symbol} or the
   * cost, at the solution. */
  DenseArray valueOf(Expr expr);
}

// End SolutionContext.java
