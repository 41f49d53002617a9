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

/**
 * Random access to the rows and columns of a numeric matrix.
 *
 * <p>Implementations may keep their values densely, sparsely or outside the
 * heap. Callers only ever see values through the caller-owned buffers passed
 * to {@link #getRow} and {@link #getColumn}, so no memory layout is implied.</p>
 */
public interface MatrixAccessor {

    /** Number of rows. */
    int nrow();

    /** Number of columns. */
    int ncol();

    /**
     * Copy row {@code i} into the first {@link #ncol()} entries of {@code buffer}.
     *
     * @throws IndexOutOfBoundsException if {@code i} is not a valid row index
     */
    void getRow(int i, double[] buffer);

    /**
     * Copy column {@code j} into the first {@link #nrow()} entries of {@code buffer}.
     *
     * @throws IndexOutOfBoundsException if {@code j} is not a valid column index
     */
    void getColumn(int j, double[] buffer);
}
