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

import java.util.Arrays;
import java.util.Objects;

import org.apache.commons.math3.linear.DefaultRealMatrixPreservingVisitor;
import org.apache.commons.math3.linear.OpenMapRealMatrix;

/**
 * Sparse features x samples matrix backed by a commons-math
 * {@link OpenMapRealMatrix}, which keeps only the non-zero entries in a hash
 * map keyed by position.
 */
public final class SparseMatrix implements MatrixAccessor {
    private final int nrow;
    private final int ncol;
    private final OpenMapRealMatrix values; // null when either dimension is zero

    private SparseMatrix(int nrow, int ncol, OpenMapRealMatrix values) {
        this.nrow = nrow;
        this.ncol = ncol;
        this.values = values;
    }

    public static Builder builder(int nrow, int ncol) {
        return new Builder(nrow, ncol);
    }

    @Override
    public int nrow() {
        return nrow;
    }

    @Override
    public int ncol() {
        return ncol;
    }

    /** Number of non-zero entries. */
    public int nonZeroCount() {
        if (values == null) return 0;
        int[] count = new int[1];
        values.walkInOptimizedOrder(new DefaultRealMatrixPreservingVisitor() {
            @Override
            public void visit(int row, int column, double value) {
                if (value != 0.0) count[0]++;
            }
        });
        return count[0];
    }

    @Override
    public void getRow(int i, double[] buffer) {
        Objects.checkIndex(i, nrow);
        if (values == null) {
            Arrays.fill(buffer, 0, ncol, 0.0);
            return;
        }
        for (int j = 0; j < ncol; j++) buffer[j] = values.getEntry(i, j);
    }

    @Override
    public void getColumn(int j, double[] buffer) {
        Objects.checkIndex(j, ncol);
        if (values == null) {
            Arrays.fill(buffer, 0, nrow, 0.0);
            return;
        }
        for (int i = 0; i < nrow; i++) buffer[i] = values.getEntry(i, j);
    }

    /**
     * Collects (row, column, value) entries. Repeated coordinates are summed;
     * entries that are or sum to zero are not stored.
     */
    public static final class Builder {
        private final int nrow;
        private final int ncol;
        private final OpenMapRealMatrix entries;

        private Builder(int nrow, int ncol) {
            if (nrow < 0 || ncol < 0) {
                throw new IllegalArgumentException(
                        "Matrix dimensions must be non-negative, got " + nrow + " x " + ncol);
            }
            this.nrow = nrow;
            this.ncol = ncol;
            this.entries = nrow == 0 || ncol == 0 ? null : new OpenMapRealMatrix(nrow, ncol);
        }

        public Builder add(int i, int j, double value) {
            Objects.checkIndex(i, nrow);
            Objects.checkIndex(j, ncol);
            entries.addToEntry(i, j, value);
            return this;
        }

        /** Snapshot of the entries added so far. */
        public SparseMatrix build() {
            return new SparseMatrix(nrow, ncol, entries == null ? null : entries.copy());
        }
    }
}
