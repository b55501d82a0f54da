/*
* Copyright 2016 Samsung Research America. All rights reserved.
*
* Licensed under the Apache License, Version 2.0 (the "License");
* you may not use this file except in compliance with the License.
* You may obtain a copy of the License at
*
*     http://www.apache.org/licenses/LICENSE-2.0
*
* Unless required by applicable law or agreed to in writing, software
* distributed under the License is distributed on an "AS IS" BASIS,
* WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
* See the License for the specific language governing permissions and
* limitations under the License.
*/
package com.samsung.sra.closurephase.inversion;

import com.samsung.sra.arraystore.Box;
import com.samsung.sra.arraystore.DatasetException;
import com.samsung.sra.arraystore.storage.BackingStoreException;
import com.samsung.sra.closurephase.ClosurePhaseException;
import com.samsung.sra.closurephase.NetworkInconsistencyException;
import com.samsung.sra.closurephase.closure.ClosurePhaseCache;
import com.samsung.sra.closurephase.parallel.LinearAlgebraThreads;
import com.samsung.sra.closurephase.ratio.DecayRatioEstimator;
import com.samsung.sra.closurephase.stack.DesignMatrices;
import com.samsung.sra.closurephase.stack.InterferogramStack;
import com.samsung.sra.closurephase.stack.TimeBase;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.function.IntConsumer;
import java.util.stream.IntStream;

/**
 * Inverts closure-phase-derived bias into a bias time series (metres) for the connection-1 interferograms of a
 * sequential network with connection levels 1..bandwidth.
 */
public class BiasEstimator {
    private static final Logger logger = LoggerFactory.getLogger(BiasEstimator.class);

    public enum Strategy {
        /** Closed form from the representative connection level and level 2 */
        APPROXIMATE,
        /** Per-pixel least squares over the whole network */
        EXACT
    }

    private final ClosurePhaseCache cache;
    private final TimeBase timeBase;
    private final DesignMatrices design;
    private final DecayRatioEstimator ratios;
    private final double coef;
    private final int referenceLevel, bandwidth;
    private RealMatrix pinvB = null;

    /**
     * @throws NetworkInconsistencyException  if the retained interferograms are not exactly the sequential network of
     *                                        the given bandwidth
     */
    public BiasEstimator(ClosurePhaseCache cache, InterferogramStack stack, int referenceLevel, int bandwidth)
            throws NetworkInconsistencyException {
        this.cache = cache;
        this.timeBase = stack.getTimeBase();
        this.design = stack.getDesignMatrices();
        this.referenceLevel = referenceLevel;
        this.bandwidth = bandwidth;
        double wavelength = stack.getMetadata().getWavelength();
        this.coef = DecayRatioEstimator.phaseToRangeCoefficient(wavelength);
        this.ratios = new DecayRatioEstimator(cache, timeBase, wavelength, referenceLevel);

        int N = timeBase.getNumDates();
        int expected = bandwidth * (2 * N - bandwidth - 1) / 2;
        if (bandwidth >= N || design.getNumIfgrams() != expected) {
            throw NetworkInconsistencyException.countMismatch(bandwidth, expected, design.getNumIfgrams());
        }
    }

    /** Bias time series in metres, [numDate][boxLength][boxWidth]; the first date is 0 */
    public float[][][] estimate(Strategy strategy, Box box)
            throws ClosurePhaseException, BackingStoreException, DatasetException {
        switch (strategy) {
            case APPROXIMATE:
                return estimateApproximate(box);
            case EXACT:
                return estimateExact(box);
            default:
                throw new IllegalStateException("unknown strategy " + strategy);
        }
    }

    /** Connection level whose average span is closest to the average span of the whole network */
    public int getRepresentativeLevel() {
        double avgSpan = timeBase.averageNetworkSpan(bandwidth);
        int best = 1;
        double bestDiff = Double.POSITIVE_INFINITY;
        for (int n = 1; n <= bandwidth; ++n) {
            double diff = Math.abs(timeBase.averageConnectionSpan(n) - avgSpan);
            if (diff < bestDiff) {
                best = n;
                bestDiff = diff;
            }
        }
        return best;
    }

    private float[][][] estimateApproximate(Box box)
            throws ClosurePhaseException, BackingStoreException, DatasetException {
        int p = getRepresentativeLevel();
        logger.info("average interferogram span is closest to connection level {}", p);
        float[][] wratioP = ratios.estimateRatio(p, box, false).ratio;
        float[][] wratio2 = ratios.estimateRatio(2, box, false).ratio;
        float[][][] ts2 = cache.get(2).readTimeSeries(box);
        float[][][] tsRef = cache.get(referenceLevel).readTimeSeries(box);

        int N = timeBase.getNumDates();
        float[][][] bias = new float[N][box.getLength()][box.getWidth()];
        for (int y = 0; y < box.getLength(); ++y) {
            for (int x = 0; x < box.getWidth(); ++x) {
                double wp = Float.isNaN(wratioP[y][x]) ? 0 : wratioP[y][x];
                double w2 = Float.isNaN(wratio2[y][x]) ? 0 : wratio2[y][x];
                if (Math.abs(w2 - 1) < 0.1) {
                    w2 = Double.NaN;
                }
                double ratio1 = wp / (1 - w2);
                for (int i = 0; i < N; ++i) {
                    double b = ts2[i][y][x] / coef * ratio1;
                    if (Double.isNaN(b)) {
                        b = tsRef[i][y][x] / coef * wp;
                    }
                    bias[i][y][x] = (float) (b / 100);
                }
            }
        }
        return bias;
    }

    private float[][][] estimateExact(Box box) throws ClosurePhaseException, BackingStoreException, DatasetException {
        int N = timeBase.getNumDates();
        int M = design.getNumIfgrams();
        int width = box.getWidth(), numPix = (int) box.getNumPixels();
        double[][] A = design.getA();
        double[] dt = timeBase.getIntervals();
        double deltaT = timeBase.getTotalSpan();
        RealMatrix pinv = getPseudoInverseB();

        float[][][] rough = cache.get(referenceLevel).readTimeSeries(box);
        float[][][] fine = cache.get(2).readTimeSeries(box);
        float[][] W = ratios.buildScalingMatrix(A, bandwidth, box);
        float[][][] bias = new float[N][box.getLength()][width];

        IntConsumer invertPixel = idx -> {
            int y = idx / width, x = idx % width;
            double[] D = new double[N];
            double fineLast = fine[N - 1][y][x];
            boolean useRough = Math.abs(fineLast / coef / deltaT) < DecayRatioEstimator.VELOCITY_THRESHOLD;
            for (int k = 0; k < N; ++k) {
                // fine time series rescaled so its end point matches the rough one
                D[k] = useRough ? rough[k][y][x] : fine[k][y][x] * (rough[N - 1][y][x] / fineLast);
            }
            double[] d = new double[M];
            for (int m = 0; m < M; ++m) {
                double ad = 0;
                for (int k = 0; k < N; ++k) {
                    ad += A[m][k] * D[k];
                }
                d[m] = W[idx][m] * ad;
            }
            double[] velocity = pinv.operate(d);
            double ts = 0;
            bias[0][y][x] = 0;
            for (int k = 0; k < N - 1; ++k) {
                ts += velocity[k] * dt[k];
                bias[k + 1][y][x] = (float) (ts / coef / 100);
            }
        };

        int threads = LinearAlgebraThreads.get();
        if (threads > 1 && numPix > 1) {
            ForkJoinPool pool = new ForkJoinPool(threads);
            try {
                pool.submit(() -> IntStream.range(0, numPix).parallel().forEach(invertPixel)).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ClosurePhaseException("interrupted during bias inversion", e, box);
            } catch (ExecutionException e) {
                throw new ClosurePhaseException("bias inversion failed: " + e.getCause().getMessage(), e.getCause(), box);
            } finally {
                pool.shutdown();
            }
        } else {
            for (int idx = 0; idx < numPix; ++idx) {
                invertPixel.accept(idx);
            }
        }
        logger.debug("inverted bias time series of {} pixels in box {}", numPix, box);
        return bias;
    }

    /** pinv(B), [(N-1) x M], computed once */
    private synchronized RealMatrix getPseudoInverseB() {
        if (pinvB == null) {
            pinvB = new SingularValueDecomposition(new Array2DRowRealMatrix(design.getB(), false))
                    .getSolver().getInverse();
        }
        return pinvB;
    }
}
