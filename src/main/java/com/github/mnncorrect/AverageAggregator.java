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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Averages correction vectors that share an anchor identifier.
 *
 * <p>Row {@code r} of the correction matrix belongs to anchor
 * {@code anchorIndex[r]}. Anchor identifiers are sample indices of the
 * population the field is later smoothed over, so they are bounded and the
 * result is held in dense arrays.</p>
 */
public final class AverageAggregator {
    private static final Logger log = LoggerFactory.getLogger(AverageAggregator.class);

    private AverageAggregator() {}

    /**
     * Average with identifier capacity {@code max(anchorIndex) + 1}.
     *
     * @throws DimensionMismatchException if {@code anchorIndex.length} differs
     *         from the number of correction rows
     * @throws IllegalArgumentException if any identifier is negative
     */
    public static AverageMap aggregate(MatrixAccessor correctionVectors, int[] anchorIndex) {
        Objects.requireNonNull(anchorIndex, "anchorIndex");
        int max = -1;
        for (int id : anchorIndex) max = Math.max(max, id);
        return aggregate(correctionVectors, anchorIndex, max + 1);
    }

    /**
     * Average with an explicit identifier capacity, normally the number of
     * samples the anchors index into.
     *
     * @throws DimensionMismatchException if {@code anchorIndex.length} differs
     *         from the number of correction rows
     * @throws IllegalArgumentException if any identifier is outside
     *         {@code [0, capacity)}
     */
    public static AverageMap aggregate(
            MatrixAccessor correctionVectors, int[] anchorIndex, int capacity) {
        Objects.requireNonNull(correctionVectors, "correctionVectors");
        Objects.requireNonNull(anchorIndex, "anchorIndex");
        final int npairs = correctionVectors.nrow();
        final int features = correctionVectors.ncol();
        if (anchorIndex.length != npairs) {
            throw new DimensionMismatchException(
                    "number of rows in correction vectors (" + npairs
                            + ") should be equal to length of anchor index (" + anchorIndex.length + ")");
        }
        for (int r = 0; r < npairs; r++) {
            int id = anchorIndex[r];
            if (id < 0 || id >= capacity) {
                throw new IllegalArgumentException(
                        "anchor identifier " + id + " at position " + r
                                + " is outside [0, " + capacity + ")");
            }
        }

        double[][] sums = new double[capacity][];
        int[] counts = new int[capacity];
        int distinct = 0;
        double[] row = new double[features];
        for (int r = 0; r < npairs; r++) {
            correctionVectors.getRow(r, row);
            int id = anchorIndex[r];
            if (sums[id] == null) {
                sums[id] = row.clone();
                distinct++;
            } else {
                double[] target = sums[id];
                for (int g = 0; g < features; g++) target[g] += row[g];
            }
            counts[id]++;
        }

        int[] present = new int[distinct];
        int k = 0;
        for (int id = 0; id < capacity; id++) {
            if (counts[id] == 0) continue;
            double[] target = sums[id];
            for (int g = 0; g < features; g++) target[g] /= counts[id];
            present[k++] = id;
        }

        log.debug("Averaged {} correction rows of length {} into {} anchors", npairs, features, distinct);
        return new AverageMap(features, sums, counts, present);
    }
}
