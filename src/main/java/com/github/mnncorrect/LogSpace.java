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
 * Arithmetic on values kept as natural logarithms.
 */
public final class LogSpace {

    private LogSpace() {}

    /**
     * Compute {@code log(exp(x) + exp(y))} without leaving log space.
     *
     * <p>Uses {@code max(x, y) + log1p(exp(-|x - y|))}, so neither operand is
     * ever exponentiated on its own. {@code -Infinity} (log of zero) is the
     * identity element.</p>
     */
    public static double logspaceAdd(double x, double y) {
        if (x == Double.NEGATIVE_INFINITY) return y;
        if (y == Double.NEGATIVE_INFINITY) return x;
        double larger = Math.max(x, y);
        double diff = Math.abs(x - y);
        return larger + Math.log1p(Math.exp(-diff));
    }

    /**
     * Fold {@link #logspaceAdd} over {@code values[at[0]], values[at[1]], ...}
     * in the given order. An empty selection gives {@code -Infinity}.
     */
    public static double logSumExp(double[] values, int[] at) {
        double total = Double.NEGATIVE_INFINITY;
        for (int idx : at) total = logspaceAdd(total, values[idx]);
        return total;
    }

    /** {@link #logSumExp(double[], int[])} over every entry of {@code values}. */
    public static double logSumExp(double[] values) {
        double total = Double.NEGATIVE_INFINITY;
        for (double v : values) total = logspaceAdd(total, v);
        return total;
    }
}
