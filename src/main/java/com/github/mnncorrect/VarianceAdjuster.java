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
import java.util.Comparator;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rescales per-sample correction vectors so that corrected query samples
 * sit at the matching quantile of the reference population.
 *
 * <p>For query sample {@code c} with unit direction {@code u}, every sample
 * is projected onto {@code u} and weighted by a Gaussian kernel on its
 * squared distance to the line through {@code c} along {@code u}. The
 * weighted fraction of the query population at or before {@code c} along
 * the line gives a cumulative probability; the reference projection at the
 * same cumulative weighted probability is the target coordinate. The scale
 * factor moves {@code c} there in units of the original, unnormalised
 * direction vector.</p>
 *
 * <p>A zero or non-finite direction vector has no defined line, so that
 * sample's factor is {@code NaN}; the other samples are unaffected.</p>
 */
public final class VarianceAdjuster {
    private static final Logger log = LoggerFactory.getLogger(VarianceAdjuster.class);

    private static final Comparator<WeightedProjection> BY_PROJECTION =
            Comparator.<WeightedProjection>comparingDouble(p -> p.projection)
                    .thenComparingDouble(p -> p.weight);

    private VarianceAdjuster() {}

    /** Adjust with {@link CorrectionConfig#defaults()}. */
    public static double[] adjust(
            MatrixAccessor reference, MatrixAccessor query, MatrixAccessor gradients, double sigma2) {
        return adjust(reference, query, gradients, sigma2, CorrectionConfig.defaults());
    }

    /**
     * Compute one scale factor per query sample.
     *
     * @param reference features x N1 reference population
     * @param query     features x N2 query population
     * @param gradients N2 x features, one direction vector per query sample
     * @param sigma2    kernel bandwidth, finite and positive
     * @param config    worker count
     * @return length-N2 scale factors, {@code NaN} where undefined
     * @throws IllegalArgumentException   if {@code sigma2} is not a positive
     *                                    finite number
     * @throws DimensionMismatchException if the feature counts or the query
     *                                    sample counts disagree
     */
    public static double[] adjust(
            MatrixAccessor reference,
            MatrixAccessor query,
            MatrixAccessor gradients,
            double sigma2,
            CorrectionConfig config) {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(gradients, "gradients");
        Objects.requireNonNull(config, "config");
        final int ngenes = reference.nrow();
        if (ngenes != query.nrow() || ngenes != gradients.ncol()) {
            throw new DimensionMismatchException(
                    "number of features do not match up between matrices (reference " + ngenes
                            + ", query " + query.nrow() + ", gradients " + gradients.ncol() + ")");
        }
        final int ncells1 = reference.ncol();
        final int ncells2 = query.ncol();
        if (ncells2 != gradients.nrow()) {
            throw new DimensionMismatchException(
                    "number of samples do not match up between matrices (query " + ncells2
                            + ", gradient rows " + gradients.nrow() + ")");
        }
        final double s2 = MnnCorrection.checkBandwidth(sigma2);

        log.debug(
                "Adjusting variance for {} query samples against {} reference samples ({} features)",
                ncells2, ncells1, ngenes);
        if (ncells1 == 0 && ncells2 > 0) {
            log.warn("Reference population is empty; all {} scale factors are NaN", ncells2);
        }

        final double[] output = new double[ncells2];
        final AtomicInteger degenerate = new AtomicInteger();
        ParallelLoops.process(config.threads(), ncells2, (worker, from, to) -> {
            Workspace ws = new Workspace(ngenes, ncells1);
            for (int cell = from; cell < to; cell++) {
                output[cell] = adjustCell(cell, reference, query, gradients, s2, ws);
                if (ws.degenerateDirection) degenerate.incrementAndGet();
            }
        });

        if (degenerate.get() > 0) {
            log.warn("{} of {} query samples have a zero or non-finite direction vector; "
                    + "their scale factors are NaN", degenerate.get(), ncells2);
        }
        return output;
    }

    private static double adjustCell(
            int cell,
            MatrixAccessor reference,
            MatrixAccessor query,
            MatrixAccessor gradients,
            double s2,
            Workspace ws) {
        final double[] grad = ws.grad;
        final double[] curcell = ws.current;
        query.getColumn(cell, curcell);
        gradients.getRow(cell, grad);

        // Unit direction; the norm is kept to express the result in original units
        double l2norm = 0;
        for (double g : grad) l2norm += g * g;
        l2norm = Math.sqrt(l2norm);
        ws.degenerateDirection = !(l2norm > 0) || !Double.isFinite(l2norm);
        if (ws.degenerateDirection) {
            return Double.NaN;
        }
        for (int g = 0; g < grad.length; g++) grad[g] /= l2norm;

        final double curproj = dot(grad, curcell);

        // Cumulative probability of this sample within its own population
        double prob2 = 0;
        double totalprob2 = 0;
        final int ncells2 = query.ncol();
        for (int same = 0; same < ncells2; same++) {
            if (same == cell) {
                prob2 += 1;
                totalprob2 += 1;
                continue;
            }
            query.getColumn(same, ws.other);
            double sameproj = dot(grad, ws.other);
            double samedist = sqDistanceToLine(curcell, grad, ws.other, ws.working);
            double sameprob = Math.exp(-samedist / s2);
            if (sameproj <= curproj) {
                prob2 += sameprob;
            }
            totalprob2 += sameprob;
        }
        prob2 /= totalprob2;

        // Projected coordinates and weights of the reference population
        final WeightedProjection[] distance1 = ws.distance1;
        double totalprob1 = 0;
        for (int other = 0; other < distance1.length; other++) {
            reference.getColumn(other, ws.other);
            WeightedProjection p = distance1[other];
            p.projection = dot(grad, ws.other);
            p.weight = Math.exp(-sqDistanceToLine(curcell, grad, ws.other, ws.working) / s2);
            totalprob1 += p.weight;
        }
        Arrays.sort(distance1, BY_PROJECTION);

        // Reference quantile matching the query cumulative probability
        final double target = prob2 * totalprob1;
        double refQuan = distance1.length > 0 ? distance1[distance1.length - 1].projection : Double.NaN;
        double cumulative = 0;
        for (WeightedProjection p : distance1) {
            cumulative += p.weight;
            if (cumulative >= target) {
                refQuan = p.projection;
                break;
            }
        }

        return (refQuan - curproj) / l2norm;
    }

    /**
     * Squared distance from {@code point} to the line through {@code ref}
     * with unit direction {@code grad}. {@code working} is overwritten.
     */
    static double sqDistanceToLine(double[] ref, double[] grad, double[] point, double[] working) {
        for (int g = 0; g < working.length; g++) {
            working[g] = ref[g] - point[g];
        }
        final double scale = dot(working, grad);
        double dist = 0;
        for (int g = 0; g < working.length; g++) {
            working[g] -= scale * grad[g];
            dist += working[g] * working[g];
        }
        return dist;
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0;
        for (int g = 0; g < a.length; g++) sum += a[g] * b[g];
        return sum;
    }

    // Mutable pair so the per-sample sort reuses the same objects
    private static final class WeightedProjection {
        double projection;
        double weight;
    }

    private static final class Workspace {
        final double[] grad;
        final double[] current;
        final double[] other;
        final double[] working;
        final WeightedProjection[] distance1;
        boolean degenerateDirection;

        Workspace(int ngenes, int ncells1) {
            grad = new double[ngenes];
            current = new double[ngenes];
            other = new double[ngenes];
            working = new double[ngenes];
            distance1 = new WeightedProjection[ncells1];
            for (int i = 0; i < ncells1; i++) distance1[i] = new WeightedProjection();
        }
    }
}
