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

import static org.junit.jupiter.api.Assertions.*;

import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class VarianceAdjusterTest {

    private static final double TOLERANCE = 1e-12;
    private static final CorrectionConfig SERIAL = CorrectionConfig.withThreads(1);

    @Nested
    @DisplayName("Quantile Matching")
    class QuantileTests {

        @Test
        @DisplayName("Centred sample of identical populations does not move")
        void identicalPopulations() {
            DenseMatrix population = line(-2, -1, 0, 1, 2);
            DenseMatrix gradients = sameGradient(5, 1.0);

            double[] scale = VarianceAdjuster.adjust(population, population, gradients, 1.0, SERIAL);

            assertEquals(0.0, scale[2], TOLERANCE);
            // Every sample maps onto itself
            for (double s : scale) assertEquals(0.0, s, TOLERANCE);
        }

        @Test
        @DisplayName("Shifted population maps back onto the reference")
        void shiftedPopulation() {
            DenseMatrix reference = line(0, 1, 2, 3, 4);
            DenseMatrix query = line(10, 11, 12, 13, 14);

            double[] scale = VarianceAdjuster.adjust(reference, query, sameGradient(5, 2.0), 1.0, SERIAL);

            // Each sample moves by -10, which is -5 times a gradient of length 2
            for (int c = 0; c < 5; c++) assertEquals(-5.0, scale[c], TOLERANCE, "sample " + c);
        }

        @Test
        @DisplayName("Compressed population is stretched to the reference spread")
        void stretchedPopulation() {
            DenseMatrix reference = line(-4, -2, 0, 2, 4);
            DenseMatrix query = line(-2, -1, 0, 1, 2);

            double[] scale = VarianceAdjuster.adjust(reference, query, sameGradient(5, 1.0), 1.0, SERIAL);

            assertArrayEquals(new double[] {-2, -1, 0, 1, 2}, scale, TOLERANCE);
        }

        @Test
        @DisplayName("Samples off the line are down-weighted by the kernel")
        void lineDistanceWeights() {
            // Query samples at (0,0) and (5,0), direction along the first axis
            DenseMatrix query = DenseMatrix.fromColumns(new double[][] {{0, 0}, {5, 0}});
            DenseMatrix reference = DenseMatrix.fromColumns(new double[][] {{-1, 0}, {1, 2}, {3, 0}});
            DenseMatrix gradients = DenseMatrix.fromRows(new double[][] {{1, 0}, {1, 0}});

            double[] scale = VarianceAdjuster.adjust(reference, query, gradients, 1.0, SERIAL);

            // Sample 0 sits at probability 1/2; (1,2) has weight exp(-4), enough to pass the target
            assertEquals(1.0, scale[0], TOLERANCE);
            // Sample 1 sits at probability 1, matching the last reference coordinate 3
            assertEquals(-2.0, scale[1], TOLERANCE);
        }

        @Test
        @DisplayName("Scaling a gradient by k scales its factor by 1/k")
        void gradientScaleInvariance() {
            Random rng = new Random(11);
            DenseMatrix reference = randomMatrix(rng, 3, 15);
            DenseMatrix query = randomMatrix(rng, 3, 10);
            DenseMatrix gradients = randomMatrix(rng, 10, 3);
            DenseMatrix scaled = DenseMatrix.zeros(10, 3);
            double k = 7.5;
            for (int c = 0; c < 10; c++) {
                for (int g = 0; g < 3; g++) scaled.set(c, g, gradients.get(c, g) * (c == 4 ? k : 1.0));
            }

            double[] base = VarianceAdjuster.adjust(reference, query, gradients, 0.8, SERIAL);
            double[] rescaled = VarianceAdjuster.adjust(reference, query, scaled, 0.8, SERIAL);

            assertEquals(base[4] / k, rescaled[4], 1e-9);
            for (int c = 0; c < 10; c++) {
                if (c != 4) assertEquals(base[c], rescaled[c], TOLERANCE, "sample " + c);
            }
        }

        @Test
        @DisplayName("Reference far from every line falls back to its smallest coordinate")
        void underflowedReferenceWeights() {
            // exp(-1e4) is zero, so the target is zero and the first sorted coordinate matches
            DenseMatrix query = DenseMatrix.fromColumns(new double[][] {{0, 0}});
            DenseMatrix reference = DenseMatrix.fromColumns(new double[][] {{2, 100}, {1, 100}});
            DenseMatrix gradients = DenseMatrix.fromRows(new double[][] {{1, 0}});

            double[] scale = VarianceAdjuster.adjust(reference, query, gradients, 1.0, SERIAL);
            assertEquals(1.0, scale[0], TOLERANCE);
        }
    }

    @Nested
    @DisplayName("Line Distance")
    class LineDistanceTests {

        @Test
        @DisplayName("Perpendicular squared distance to an axis-aligned line")
        void axisAligned() {
            double[] working = new double[2];
            double d = VarianceAdjuster.sqDistanceToLine(
                    new double[] {0, 0}, new double[] {1, 0}, new double[] {3, 4}, working);
            assertEquals(16.0, d, TOLERANCE);
        }

        @Test
        @DisplayName("Points on the line have zero distance")
        void onLine() {
            double r = Math.sqrt(0.5);
            double d = VarianceAdjuster.sqDistanceToLine(
                    new double[] {1, 1}, new double[] {r, r}, new double[] {-4, -4}, new double[2]);
            assertEquals(0.0, d, 1e-12);
        }

        @Test
        @DisplayName("Distance along a diagonal line")
        void diagonal() {
            double r = Math.sqrt(0.5);
            double d = VarianceAdjuster.sqDistanceToLine(
                    new double[] {0, 0}, new double[] {r, r}, new double[] {1, -1}, new double[2]);
            assertEquals(2.0, d, 1e-12);
        }
    }

    @Nested
    @DisplayName("Backends and Workers")
    class ExecutionTests {

        @Test
        @DisplayName("Parallel workers reproduce the serial result")
        void parallelMatchesSerial() {
            Random rng = new Random(99);
            DenseMatrix reference = randomMatrix(rng, 4, 25);
            DenseMatrix query = randomMatrix(rng, 4, 21);
            DenseMatrix gradients = randomMatrix(rng, 21, 4);

            double[] serial = VarianceAdjuster.adjust(reference, query, gradients, 1.2, SERIAL);
            double[] parallel = VarianceAdjuster.adjust(
                    reference, query, gradients, 1.2, CorrectionConfig.withThreads(3));
            assertArrayEquals(serial, parallel, 0.0);
        }

        @Test
        @DisplayName("Sparse gradients give the same factors as dense ones")
        void sparseGradients() {
            DenseMatrix reference = DenseMatrix.fromColumns(new double[][] {{0, 1}, {2, 0}, {1, 1}});
            DenseMatrix query = DenseMatrix.fromColumns(new double[][] {{0, 0}, {1, 2}});
            DenseMatrix dense = DenseMatrix.fromRows(new double[][] {{0, 3}, {1, 0}});
            SparseMatrix sparse = SparseMatrix.builder(2, 2).add(0, 1, 3).add(1, 0, 1).build();

            assertArrayEquals(
                    VarianceAdjuster.adjust(reference, query, dense, 2.0, SERIAL),
                    VarianceAdjuster.adjust(reference, query, sparse, 2.0, SERIAL),
                    TOLERANCE);
        }
    }

    @Nested
    @DisplayName("Edge Cases and Error Handling")
    class ErrorTests {

        @Test
        @DisplayName("Zero gradient gives NaN for that sample only")
        void zeroGradient() {
            DenseMatrix reference = line(0, 1, 2, 3, 4);
            DenseMatrix query = line(10, 11, 12);
            DenseMatrix gradients = DenseMatrix.fromRows(new double[][] {{1}, {0}, {1}});

            double[] scale = VarianceAdjuster.adjust(reference, query, gradients, 1.0, SERIAL);

            assertTrue(Double.isNaN(scale[1]));
            assertFinite(scale[0], "sample 0");
            assertFinite(scale[2], "sample 2");
        }

        @Test
        @DisplayName("Empty reference population gives NaN everywhere")
        void emptyReference() {
            DenseMatrix reference = DenseMatrix.zeros(1, 0);
            DenseMatrix query = line(1, 2);

            double[] scale = VarianceAdjuster.adjust(reference, query, sameGradient(2, 1.0), 1.0, SERIAL);

            assertEquals(2, scale.length);
            for (double s : scale) assertTrue(Double.isNaN(s));
        }

        @Test
        @DisplayName("Empty query population gives an empty result")
        void emptyQuery() {
            double[] scale = VarianceAdjuster.adjust(
                    line(0, 1), DenseMatrix.zeros(1, 0), DenseMatrix.zeros(0, 1), 1.0, SERIAL);
            assertEquals(0, scale.length);
        }

        @Test
        @DisplayName("Feature counts must agree")
        void featureMismatch() {
            DenseMatrix reference = DenseMatrix.zeros(2, 3);
            DenseMatrix query = DenseMatrix.zeros(3, 2);
            assertThrows(
                    DimensionMismatchException.class,
                    () -> VarianceAdjuster.adjust(reference, query, DenseMatrix.zeros(2, 3), 1.0, SERIAL));
            assertThrows(
                    DimensionMismatchException.class,
                    () -> VarianceAdjuster.adjust(
                            DenseMatrix.zeros(3, 3), query, DenseMatrix.zeros(2, 2), 1.0, SERIAL));
        }

        @Test
        @DisplayName("Gradient rows must match query samples")
        void sampleMismatch() {
            assertThrows(
                    DimensionMismatchException.class,
                    () -> VarianceAdjuster.adjust(
                            DenseMatrix.zeros(2, 3), DenseMatrix.zeros(2, 4), DenseMatrix.zeros(3, 2), 1.0, SERIAL));
        }

        @Test
        @DisplayName("Bandwidth must be positive and finite")
        void invalidBandwidth() {
            DenseMatrix population = line(0, 1);
            for (double sigma2 : new double[] {0, -2, Double.NaN, Double.NEGATIVE_INFINITY}) {
                assertThrows(
                        IllegalArgumentException.class,
                        () -> VarianceAdjuster.adjust(population, population, sameGradient(2, 1), sigma2, SERIAL),
                        "sigma2 = " + sigma2);
            }
        }
    }

    // Helper methods

    // One-feature population with the given coordinates
    private static DenseMatrix line(double... coords) {
        return DenseMatrix.fromRows(new double[][] {coords});
    }

    private static DenseMatrix sameGradient(int ncells, double value) {
        DenseMatrix m = DenseMatrix.zeros(ncells, 1);
        for (int c = 0; c < ncells; c++) m.set(c, 0, value);
        return m;
    }

    private static DenseMatrix randomMatrix(Random rng, int nrow, int ncol) {
        DenseMatrix m = DenseMatrix.zeros(nrow, ncol);
        for (int i = 0; i < nrow; i++) {
            for (int j = 0; j < ncol; j++) m.set(i, j, rng.nextGaussian());
        }
        return m;
    }

    private static void assertFinite(double value, String message) {
        assertTrue(Double.isFinite(value), message + " should be finite, got: " + value);
    }
}
