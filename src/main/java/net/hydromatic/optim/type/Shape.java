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

/** Dimensions of a two-dimensional symbolic leaf.
 *
 * <p>Every leaf is a matrix; a vector is a matrix with one column. */
public class Shape {
  public final int rows;
  public final int columns;

  private Shape(int rows, int columns) {
    checkArgument(rows >= 0 && columns >= 0, "invalid shape (%s, %s)",
        rows, columns);
    this.rows = rows;
    this.columns = columns;
  }

  /** Creates a Shape with a given number of rows and columns. */
  public static Shape of(int rows, int columns) {
    return new Shape(rows, columns);
  }

  /** Creates the Shape of a column vector. */
  public static Shape column(int rows) {
    return new Shape(rows, 1);
  }

  /** Returns the number of elements. */
  public int size() {
    return rows * columns;
  }

  @Override public int hashCode() {
    return rows * 31 + columns;
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Shape
        && rows == ((Shape) o).rows
        && columns == ((Shape) o).columns;
  }

  @Override public String toString() {
    return "(" + rows + ", " + columns + ")";
  }
}

// End Shape.java
