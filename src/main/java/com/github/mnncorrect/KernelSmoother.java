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
 * Smooths per-anchor mean correction vectors into one correction vector per
 * sample using a Gaussian kernel on sample-space distances.
 *
 * <p>For an anchor {@code a} and a sample {@code s} the log-weight is
 * {@code -|x_a - x_s|^2 / sigma2}. Each anchor's weights are divided by its
 * kernel density over all anchors, so anchors sitting in a crowded region
 * do not dominate the field. Every output column is the weight-normalised sum
 * of the anchors' mean vectors.</p>
 *
 * <p>All log-weights stay in log space until the final per-sample
 * multiplier; the density is folded with {@link LogSpace#logspaceAdd}.</p>
 */
public final class KernelSmoother {
    private static final Logger log = LoggerFactory.getLogger(KernelSmoother.class);

    private KernelSmoother() {}

    /** Smooth with {@link CorrectionConfig#defaults()}. */
    public static DenseMatrix smooth(AverageMap averages, MatrixAccessor samples, double sigma2) {
        return smooth(averages, samples, sigma2, CorrectionConfig.defaults());
    }

    /**
     * Smooth the averaged correction vectors over every sample (column) of
     * {@code samples}.
     *
     * @param averages per-anchor mean correction vectors; identifiers are
     *                 column indices of {@code samples}
     * @param samples  features x samples matrix used only for distances
     * @param sigma2   kernel bandwidth, finite and positive
     * @param config   worker count
     * @return correction features x samples field
     * @throws IllegalArgumentException   if {@code sigma2} is not a positive
     *                                    finite number
     * @throws DimensionMismatchException if an anchor is not a sample index
     * @throws DegenerateInputException   if some sample receives zero total
     *                                    weight from the anchors; no field is
     *                                    returned for any sample, so retry the
     *                                    whole call with a larger {@code sigma2}
     */
    public static DenseMatrix smooth(
            AverageMap averages, MatrixAccessor samples, double sigma2, CorrectionConfig config) {
        Objects.requireNonNull(averages, "averages");
        Objects.requireNonNull(samples, "samples");
        Objects.requireNonNull(config, "config");
        final int ncells = samples.ncol();
        final int ngenes = averages.features(); // output length, not the distance feature count
        final int[] anchors = averages.anchorView();
        if (anchors.length > 0 && anchors[anchors.length - 1] >= ncells) {
            throw new DimensionMismatchException(
                    "anchor " + anchors[anchors.length - 1] + " is not a sample index (only "
                            + ncells + " samples)");
        }
        final double s2 = MnnCorrection.checkBandwidth(sigma2);

        final int workers = ParallelLoops.workerCount(config.threads(), anchors.length);
        log.debug(
                "Smoothing {} anchors over {} samples ({} distance features, {} output features, {} workers)",
                anchors.length, ncells, samples.nrow(), ngenes, workers);

        final DenseMatrix[] partialOutput = new DenseMatrix[workers];
        final double[][] partialTotal = new double[workers][];
        ParallelLoops.process(config.threads(), anchors.length, (worker, from, to) -> {
            DenseMatrix output = DenseMatrix.zeros(ngenes, ncells);
            double[] totalprob = new double[ncells];
            Workspace ws = new Workspace(samples.nrow(), ncells);
            for (int k = from; k < to; k++) {
                accumulateAnchor(anchors[k], anchors, averages, samples, s2, ws, output, totalprob);
            }
            partialOutput[worker] = output;
            partialTotal[worker] = totalprob;
        });

        // Merge in worker order so the result does not depend on scheduling
        DenseMatrix output = partialOutput[0];
        double[] totalprob = partialTotal[0];
        for (int w = 1; w < workers; w++) {
            output = output.plus(partialOutput[w]);
            double[] part = partialTotal[w];
            for (int s = 0; s < ncells; s++) totalprob[s] += part[s];
        }

        for (int other = 0; other < ncells; other++) {
            double total = totalprob[other];
            if (!(total > 0) || !Double.isFinite(total)) {
                throw new DegenerateInputException(
                        "sample " + other + " has total kernel weight " + total
                                + " across " + anchors.length + " anchors; consider a larger sigma");
            }
        }
        output.divideColumns(totalprob);
        return output;
    }

    /**
     * Add one anchor's density-scaled kernel contribution to every sample.
     */
    private static void accumulateAnchor(
            int mnn,
            int[] anchors,
            AverageMap averages,
            MatrixAccessor samples,
            double s2,
            Workspace ws,
            DenseMatrix output,
            double[] totalprob) {
        final int ncells = ws.logProb.length;
        final int nfeatures = ws.anchorCell.length;
        samples.getColumn(mnn, ws.anchorCell);

        // Log-probabilities under the Gaussian kernel; the constant factor is dropped
        for (int other = 0; other < ncells; other++) {
            samples.getColumn(other, ws.otherCell);
            double curdist2 = 0;
            for (int g = 0; g < nfeatures; g++) {
                double tmp = ws.anchorCell[g] - ws.otherCell[g];
                curdist2 += tmp * tmp;
            }
            ws.logProb[other] = curdist2 / -s2;
        }

        double density = LogSpace.logSumExp(ws.logProb, anchors);

        double[] correction = averages.meanView(mnn);
        for (int other = 0; other < ncells; other++) {
            double mult = Math.exp(ws.logProb[other] - density);
            totalprob[other] += mult;
            output.addScaledToColumn(other, correction, mult);
        }
    }

    // Scratch buffers owned by one worker for the whole call
    private static final class Workspace {
        final double[] anchorCell;
        final double[] otherCell;
        final double[] logProb;

        Workspace(int nfeatures, int ncells) {
            anchorCell = new double[nfeatures];
            otherCell = new double[nfeatures];
            logProb = new double[ncells];
        }
    }
}
