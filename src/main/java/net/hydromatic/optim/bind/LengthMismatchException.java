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

/** A list in a guess does not have the same length as the corresponding list
 * in the symbol tree. */
public class LengthMismatchException extends BindException {
  public final int expected;
  public final int actual;

  public LengthMismatchException(Path path, int expected, int actual) {
    super("The guess for " + where(path)
        + " is a list of the wrong size. Expected: " + expected
        + ". Guess: " + actual, path);
    this.expected = expected;
    this.actual = actual;
  }
}

// End LengthMismatchException.java
