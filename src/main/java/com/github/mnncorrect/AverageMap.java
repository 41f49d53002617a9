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

/**
 * Mean correction vector and contributing row count for every anchor
 * identifier that occurred at least once.
 *
 * <p>Storage is dense over identifiers {@code 0..capacity-1}; the present
 * identifiers are kept separately in ascending order, which is also the
 * iteration order used by the smoother. An identifier with no rows is absent,
 * which is not the same as an anchor whose mean happens to be zero.</p>
 */
public final class AverageMap {
    private final int features;
    private final double[][] means; // null where absent
    private final int[] counts;
    private final int[] present;

    AverageMap(int features, double[][] means, int[] counts, int[] present) {
        this.features = features;
        this.means = means;
        this.counts = counts;
        this.present = present;
    }

    /** Length of every mean vector. */
    public int features() {
        return features;
    }

    /** One more than the largest identifier this map can hold. */
    public int capacity() {
        return counts.length;
    }

    /** Number of present identifiers. */
    public int size() {
        return present.length;
    }

    /** Present identifiers in ascending order (a copy). */
    public int[] anchors() {
        return present.clone();
    }

    public boolean contains(int anchor) {
        return anchor >= 0 && anchor < counts.length && counts[anchor] > 0;
    }

    /**
     * Mean correction vector of {@code anchor} (a copy).
     *
     * @throws IllegalArgumentException if the identifier is absent
     */
    public double[] mean(int anchor) {
        return meanView(anchor).clone();
    }

    /** Number of correction rows that shared {@code anchor}; 0 when absent. */
    public int count(int anchor) {
        return anchor >= 0 && anchor < counts.length ? counts[anchor] : 0;
    }

    // Unchecked internal access used in the accumulation loop
    double[] meanView(int anchor) {
        if (!contains(anchor)) {
            throw new IllegalArgumentException("No correction vectors for anchor " + anchor);
        }
        return means[anchor];
    }

    int[] anchorView() {
        return present;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("AverageMap{");
        for (int k = 0; k < present.length; k++) {
            int a = present[k];
            if (k > 0) sb.append(", ");
            sb.append(a).append('=').append(Arrays.toString(means[a]))
                    .append(" (n=").append(counts[a]).append(')');
        }
        return sb.append('}').toString();
    }
}
