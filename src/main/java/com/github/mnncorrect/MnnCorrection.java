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
 * Entry points for the two numeric corrections used when removing batch
 * effects between sample populations.
 *
 * <p>{@link #smoothGaussianKernel} turns correction vectors attached to
 * anchor samples into a smooth correction field over all samples.
 * {@link #adjustShiftVariance} computes, for every sample of a query
 * population, how far along its correction vector it must move to reach
 * the matching quantile of a reference population.</p>
 *
 * <p>Inputs are read through {@link MatrixAccessor} and never modified.
 * Shapes are checked before any work is done. Each call is independent; no
 * state is kept between calls.</p>
 */
public final class MnnCorrection {
    private static final Logger log = LoggerFactory.getLogger(MnnCorrection.class);

    private MnnCorrection() {}

    /**
     * Smooth per-pair correction vectors over every sample with a Gaussian
     * kernel, using {@link CorrectionConfig#defaults()}.
     *
     * @see #smoothGaussianKernel(MatrixAccessor, int[], MatrixAccessor, double, CorrectionConfig)
     */
    public static DenseMatrix smoothGaussianKernel(
            MatrixAccessor correctionVectors, int[] anchorIndex, MatrixAccessor sampleMatrix, double sigma2) {
        return smoothGaussianKernel(
                correctionVectors, anchorIndex, sampleMatrix, sigma2, CorrectionConfig.defaults());
    }

    /**
     * Smooth per-pair correction vectors over every sample with a Gaussian
     * kernel.
     *
     * <p>Rows of {@code correctionVectors} that share an anchor are averaged
     * first. The anchors are then weighted by kernel proximity to each sample
     * and by the inverse of their own density among the anchors.</p>
     *
     * @param correctionVectors npairs x G correction vectors, one per pair
     * @param anchorIndex       length npairs; the sample (column of
     *                          {@code sampleMatrix}) each row belongs to
     * @param sampleMatrix      F x N matrix on which distances are computed
     * @param sigma2            kernel bandwidth, the kernel is {@code exp(-d^2/sigma2)}
     * @param config            worker count
     * @return G x N smoothed correction field
     * @throws DimensionMismatchException if {@code anchorIndex} and the
     *         correction rows disagree in length
     * @throws IllegalArgumentException if {@code sigma2} is not finite and
     *         positive, or an anchor is not a column of {@code sampleMatrix}
     * @throws DegenerateInputException if a sample receives no weight
     */
    public static DenseMatrix smoothGaussianKernel(
            MatrixAccessor correctionVectors,
            int[] anchorIndex,
            MatrixAccessor sampleMatrix,
            double sigma2,
            CorrectionConfig config) {
        Objects.requireNonNull(correctionVectors, "correctionVectors");
        Objects.requireNonNull(anchorIndex, "anchorIndex");
        Objects.requireNonNull(sampleMatrix, "sampleMatrix");
        if (correctionVectors.nrow() != anchorIndex.length) {
            throw new DimensionMismatchException(
                    "number of rows in correction vectors (" + correctionVectors.nrow()
                            + ") should be equal to length of anchor index (" + anchorIndex.length + ")");
        }
        checkBandwidth(sigma2);

        AverageMap averages =
                AverageAggregator.aggregate(correctionVectors, anchorIndex, sampleMatrix.ncol());
        return KernelSmoother.smooth(averages, sampleMatrix, sigma2, config);
    }

    /**
     * Quantile-matched scale factors, using {@link CorrectionConfig#defaults()}.
     *
     * @see #adjustShiftVariance(MatrixAccessor, MatrixAccessor, MatrixAccessor, double, CorrectionConfig)
     */
    public static double[] adjustShiftVariance(
            MatrixAccessor referenceMatrix,
            MatrixAccessor queryMatrix,
            MatrixAccessor gradientMatrix,
            double sigma2) {
        return adjustShiftVariance(
                referenceMatrix, queryMatrix, gradientMatrix, sigma2, CorrectionConfig.defaults());
    }

    /**
     * Quantile-matched scale factors for every query sample.
     *
     * <p>Multiplying row {@code c} of {@code gradientMatrix} by the returned
     * factor {@code c} moves query sample {@code c} along that vector to the
     * reference coordinate with the same kernel-weighted cumulative
     * probability as {@code c} has in its own population.</p>
     *
     * @param referenceMatrix F x N1 reference population
     * @param queryMatrix     F x N2 query population
     * @param gradientMatrix  N2 x F correction vectors of the query samples
     * @param sigma2          kernel bandwidth
     * @param config          worker count
     * @return N2 scale factors; {@code NaN} where the vector is zero or the
     *         reference population is empty
     * @throws DimensionMismatchException if feature counts or query sample
     *         counts disagree
     * @throws IllegalArgumentException if {@code sigma2} is not finite and positive
     */
    public static double[] adjustShiftVariance(
            MatrixAccessor referenceMatrix,
            MatrixAccessor queryMatrix,
            MatrixAccessor gradientMatrix,
            double sigma2,
            CorrectionConfig config) {
        return VarianceAdjuster.adjust(referenceMatrix, queryMatrix, gradientMatrix, sigma2, config);
    }

    /**
     * Validate a kernel bandwidth.
     *
     * @return {@code sigma2} unchanged
     * @throws IllegalArgumentException if {@code sigma2} is NaN, infinite or not positive
     */
    static double checkBandwidth(double sigma2) {
        if (!Double.isFinite(sigma2) || sigma2 <= 0) {
            log.debug("Rejected bandwidth {}", sigma2);
            throw new IllegalArgumentException("sigma should be a positive finite number, got " + sigma2);
        }
        return sigma2;
    }
}
