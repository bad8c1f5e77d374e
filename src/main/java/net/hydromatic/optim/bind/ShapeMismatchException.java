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

import java.util.Arrays;
import net.hydromatic.optim.type.Shape;

/** A numeric array in a guess does not have the shape of the symbol it is
 * meant for. */
public class ShapeMismatchException extends BindException {
  public final Shape expected;

  public ShapeMismatchException(Path path, Shape expected, int[] actualDims) {
    super("The dimension of the guess for " + where(path)
        + " does not match the corresponding optimization symbol. Expected: "
        + expected + ". Guess: " + Arrays.toString(actualDims), path);
    this.expected = expected;
  }
}

// End ShapeMismatchException.java
