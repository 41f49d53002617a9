/*
 * MIT License
 *
 * Copyright (c) 2025 mnn-correct contributors
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.mnncorrect;

import java.util.Objects;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.DefaultRealMatrixChangingVisitor;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * In-memory features x samples matrix backed by a commons-math
 * {@link RealMatrix}.
 *
 * <p>This is also the type of the smoothed correction field. Shapes with a
 * zero dimension are allowed here even though {@code RealMatrix} rejects
 * them; such a matrix simply has nothing to read.</p>
 */
public final class DenseMatrix implements MatrixAccessor {
    private final int nrow;
    private final int ncol;
    private final RealMatrix values; // null when either dimension is zero

    private DenseMatrix(int nrow, int ncol, RealMatrix values) {
        this.nrow = nrow;
        this.ncol = ncol;
        this.values = values;
    }

    /** All-zero matrix of the given shape. */
    public static DenseMatrix zeros(int nrow, int ncol) {
        if (nrow < 0 || ncol < 0) {
            throw new IllegalArgumentException(
                    "Matrix dimensions must be non-negative, got " + nrow + " x " + ncol);
        }
        if (nrow == 0 || ncol == 0) {
            return new DenseMatrix(nrow, ncol, null);
        }
        return new DenseMatrix(nrow, ncol, new Array2DRowRealMatrix(nrow, ncol));
    }

    /**
     * Build from row arrays; {@code rows[i][j]} becomes element (i, j).
     * A zero-length array gives a 0 x 0 matrix.
     */
    public static DenseMatrix fromRows(double[][] rows) {
        Objects.requireNonNull(rows, "rows");
        int nc = checkRectangular(rows, "Row");
        return new DenseMatrix(rows.length, nc, rows.length == 0 || nc == 0 ? null : new Array2DRowRealMatrix(rows));
    }

    /**
     * Build from column arrays; {@code columns[j][i]} becomes element (i, j).
     * Sample matrices are usually easiest to write this way.
     */
    public static DenseMatrix fromColumns(double[][] columns) {
        Objects.requireNonNull(columns, "columns");
        int nr = checkRectangular(columns, "Column");
        return new DenseMatrix(nr, columns.length,
                columns.length == 0 || nr == 0 ? null : new Array2DRowRealMatrix(columns, false).transpose());
    }

    /** Wrap an existing matrix without copying it. */
    public static DenseMatrix wrap(RealMatrix matrix) {
        Objects.requireNonNull(matrix, "matrix");
        return new DenseMatrix(matrix.getRowDimension(), matrix.getColumnDimension(), matrix);
    }

    private static int checkRectangular(double[][] arrays, String what) {
        int length = arrays.length == 0 ? 0 : arrays[0].length;
        for (int k = 0; k < arrays.length; k++) {
            if (arrays[k].length != length) {
                throw new DimensionMismatchException(
                        what + " " + k + " has length " + arrays[k].length + ", expected " + length);
            }
        }
        return length;
    }

    @Override
    public int nrow() {
        return nrow;
    }

    @Override
    public int ncol() {
        return ncol;
    }

    public double get(int i, int j) {
        Objects.checkIndex(i, nrow);
        Objects.checkIndex(j, ncol);
        return values.getEntry(i, j);
    }

    public void set(int i, int j, double value) {
        Objects.checkIndex(i, nrow);
        Objects.checkIndex(j, ncol);
        values.setEntry(i, j, value);
    }

    @Override
    public void getRow(int i, double[] buffer) {
        Objects.checkIndex(i, nrow);
        if (ncol > 0) System.arraycopy(values.getRow(i), 0, buffer, 0, ncol);
    }

    @Override
    public void getColumn(int j, double[] buffer) {
        Objects.checkIndex(j, ncol);
        if (nrow > 0) System.arraycopy(values.getColumn(j), 0, buffer, 0, nrow);
    }

    /** Copy of column {@code j} as a new array. */
    public double[] column(int j) {
        double[] out = new double[nrow];
        getColumn(j, out);
        return out;
    }

    /** Copy of the contents; a matrix with a zero dimension has none. */
    public RealMatrix toRealMatrix() {
        if (values == null) {
            throw new IllegalStateException("Empty " + nrow + " x " + ncol + " matrix has no RealMatrix form");
        }
        return values.copy();
    }

    /** Add {@code mult * vector} to column {@code j}. */
    void addScaledToColumn(int j, double[] vector, double mult) {
        for (int i = 0; i < nrow; i++) values.addToEntry(i, j, vector[i] * mult);
    }

    /** Elementwise sum; shapes must already agree. */
    DenseMatrix plus(DenseMatrix other) {
        return values == null ? this : new DenseMatrix(nrow, ncol, values.add(other.values));
    }

    /** Divide every entry of column {@code j} by {@code divisors[j]}. */
    void divideColumns(final double[] divisors) {
        if (values == null) return;
        values.walkInOptimizedOrder(new DefaultRealMatrixChangingVisitor() {
            @Override
            public double visit(int row, int column, double value) {
                return value / divisors[column];
            }
        });
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DenseMatrix)) return false;
        DenseMatrix other = (DenseMatrix) o;
        return nrow == other.nrow && ncol == other.ncol && Objects.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * nrow + ncol) + Objects.hashCode(values);
    }

    @Override
    public String toString() {
        return "DenseMatrix[" + nrow + " x " + ncol + "]";
    }
}
