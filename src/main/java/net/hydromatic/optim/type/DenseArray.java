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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.primitives.ImmutableDoubleArray;
import com.google.common.primitives.ImmutableIntArray;

/** Immutable dense array of doubles, of any rank.
 *
 * <p>Elements are stored in row-major order. A rank-0 array is a scalar, a
 * rank-1 array a vector, a rank-2 array a matrix. Only arrays of rank 2 or
 * less can be bound to a solver symbol; see {@link #toShape()}. */
public class DenseArray {
  private final ImmutableIntArray dims;
  private final ImmutableDoubleArray data;

  private DenseArray(ImmutableIntArray dims, ImmutableDoubleArray data) {
    this.dims = dims;
    this.data = data;
    int size = 1;
    for (int i = 0; i < dims.length(); i++) {
      checkArgument(dims.get(i) >= 0, "negative dimension in %s", dims);
      size *= dims.get(i);
    }
    checkArgument(size == data.length(),
        "array of shape %s must have %s elements, has %s", dims, size,
        data.length());
  }

  /** Creates an array with given dimensions and row-major data. */
  public static DenseArray of(int[] dims, double... data) {
    return new DenseArray(ImmutableIntArray.copyOf(dims),
        ImmutableDoubleArray.copyOf(data));
  }

  /** Creates a rank-0 array. */
  public static DenseArray scalar(double value) {
    return new DenseArray(ImmutableIntArray.of(),
        ImmutableDoubleArray.of(value));
  }

  /** Creates a rank-1 array. */
  public static DenseArray vector(double... values) {
    return new DenseArray(ImmutableIntArray.of(values.length),
        ImmutableDoubleArray.copyOf(values));
  }

  /** Creates a rank-2 array with one column. */
  public static DenseArray column(double... values) {
    return new DenseArray(ImmutableIntArray.of(values.length, 1),
        ImmutableDoubleArray.copyOf(values));
  }

  /** Creates a rank-2 array from rows, which must all have the same length. */
  public static DenseArray matrix(double[]... rows) {
    final int columns = rows.length == 0 ? 0 : rows[0].length;
    final ImmutableDoubleArray.Builder b =
        ImmutableDoubleArray.builder(rows.length * columns);
    for (double[] row : rows) {
      checkArgument(row.length == columns, "ragged matrix");
      b.addAll(row);
    }
    return new DenseArray(ImmutableIntArray.of(rows.length, columns),
        b.build());
  }

  /** Creates an array of zeros. */
  public static DenseArray zeros(int... dims) {
    int size = 1;
    for (int dim : dims) {
      size *= dim;
    }
    return new DenseArray(ImmutableIntArray.copyOf(dims),
        ImmutableDoubleArray.copyOf(new double[size]));
  }

  /** Creates an array of zeros of a given two-dimensional shape. */
  public static DenseArray zeros(Shape shape) {
    return zeros(shape.rows, shape.columns);
  }

  /** Returns the number of dimensions. */
  public int rank() {
    return dims.length();
  }

  /** Returns the extent of each dimension. */
  public int[] dims() {
    return dims.toArray();
  }

  /** Returns the number of elements. */
  public int size() {
    return data.length();
  }

  /** Returns the elements in row-major order. */
  public double[] data() {
    return data.toArray();
  }

  /** Returns the element at a given row-major offset. */
  public double get(int offset) {
    return data.get(offset);
  }

  /** Returns an element of a rank-2 array. */
  public double get(int row, int column) {
    checkState(rank() == 2, "array of rank %s is not a matrix", rank());
    return data.get(row * dims.get(1) + column);
  }

  /** Returns whether this array has rank 2 or less, and can therefore be
   * described by a {@link Shape}. */
  public boolean isMatrixLike() {
    return rank() <= 2;
  }

  /** Returns the two-dimensional shape of this array.
   *
   * <p>A rank-1 array of length N is treated as a column, shape (N, 1);
   * a rank-0 array has shape (1, 1).
   *
   * @throws IllegalStateException if rank is greater than 2
   */
  public Shape toShape() {
    switch (rank()) {
      case 0:
        return Shape.of(1, 1);
      case 1:
        return Shape.column(dims.get(0));
      case 2:
        return Shape.of(dims.get(0), dims.get(1));
      default:
        throw new IllegalStateException("array of rank " + rank()
            + " has no two-dimensional shape");
    }
  }

  /** Returns an array with the same elements and a given two-dimensional
   * shape. Returns this array if it already has that shape. */
  public DenseArray reshape(Shape shape) {
    checkArgument(shape.size() == size(),
        "cannot reshape array of %s elements to %s", size(), shape);
    if (rank() == 2
        && dims.get(0) == shape.rows
        && dims.get(1) == shape.columns) {
      return this;
    }
    return new DenseArray(ImmutableIntArray.of(shape.rows, shape.columns),
        data);
  }

  @Override public int hashCode() {
    return dims.hashCode() * 31 + data.hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof DenseArray
        && dims.equals(((DenseArray) o).dims)
        && data.equals(((DenseArray) o).data);
  }

  @Override public String toString() {
    final StringBuilder b = new StringBuilder();
    describe(b, 0, 0);
    return b.toString();
  }

  /** Writes the sub-array of dimension {@code d} that starts at element
   * {@code offset}; returns the number of elements written. */
  private int describe(StringBuilder b, int d, int offset) {
    if (d == rank()) {
      b.append(data.get(offset));
      return 1;
    }
    b.append('[');
    int n = 0;
    for (int i = 0; i < dims.get(d); i++) {
      if (i > 0) {
        b.append(", ");
      }
      n += describe(b, d + 1, offset + n);
    }
    b.append(']');
    return n;
  }
}

// End DenseArray.java
