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

import net.hydromatic.optim.solver.Symbol;
import net.hydromatic.optim.type.DenseArray;
import net.hydromatic.optim.util.OptimException;

/** Called on various events while binding a tree to a solver. */
public interface Tracer {
  /** Called when a symbol has been created for the leaf at a path. */
  void onSymbol(Path path, Symbol symbol);

  /** Called when a guess has been assigned to the symbol at a path. */
  void onGuess(Path path, Symbol symbol, DenseArray value);

  /** Called when the value of the symbol at a path has been read back. */
  void onValue(Path path, DenseArray value);

  /** Called after a successful solve, with the value of the cost. */
  void onSolve(double cost);

  /** Called with an exception just before it is thrown to the caller. */
  void onException(OptimException e);
}

// End Tracer.java
