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
package com.samsung.sra.closurephase.ratio;

import com.samsung.sra.arraystore.Box;
import com.samsung.sra.arraystore.DatasetException;
import com.samsung.sra.arraystore.storage.BackingStoreException;
import com.samsung.sra.closurephase.ClosurePhaseException;
import com.samsung.sra.closurephase.NetworkInconsistencyException;
import com.samsung.sra.closurephase.closure.ClosurePhaseCache;
import com.samsung.sra.closurephase.stack.DesignMatrices;
import com.samsung.sra.closurephase.stack.TimeBase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-pixel bias decay ratios W(n) = w(n dt) / w(dt): the fraction of the connection-1 bias still present in
 * connection-n interferograms, estimated from cumulative closure phases relative to the bias-free reference level.
 */
public class DecayRatioEstimator {
    private static final Logger logger = LoggerFactory.getLogger(DecayRatioEstimator.class);

    /** Bias velocities below this (cm/year, i.e. 1 mm/year) are not significant */
    public static final double VELOCITY_THRESHOLD = 0.1;

    private final ClosurePhaseCache cache;
    private final TimeBase timeBase;
    private final double coef;
    private final int referenceLevel;

    /**
     * @param wavelength  radar wavelength in metres
     * @param referenceLevel  connection level assumed bias-free
     */
    public DecayRatioEstimator(ClosurePhaseCache cache, TimeBase timeBase, double wavelength, int referenceLevel) {
        this.cache = cache;
        this.timeBase = timeBase;
        this.coef = phaseToRangeCoefficient(wavelength);
        this.referenceLevel = referenceLevel;
    }

    /** -4 pi / wavelength with the wavelength converted to centimetres, so phase / coef is in cm */
    public static double phaseToRangeCoefficient(double wavelength) {
        return -4 * Math.PI / (wavelength * 100);
    }

    /** Ratio and bias velocity (cm/year) of one connection level over a block */
    public static class Ratio {
        public final float[][] ratio, velocity;

        Ratio(float[][] ratio, float[][] velocity) {
            this.ratio = ratio;
            this.velocity = velocity;
        }
    }

    /**
     * W(n) for one connection level. For n = 1 the ratio is 1; otherwise 1 - bias_n / bias_ref clamped to [0, 1], NaN
     * where undefined (0 / 0). The velocity is ratio times the reference-level bias velocity.
     *
     * @param mask  set the ratio to NaN where the reference-level bias velocity is not significant
     */
    public Ratio estimateRatio(int n, Box box, boolean mask)
            throws ClosurePhaseException, BackingStoreException, DatasetException {
        float[][] cumRef = cache.get(referenceLevel).readFinal(box);
        float[][] cumN = n == 1 ? null : cache.get(n).readFinal(box);
        double deltaT = timeBase.getTotalSpan();
        float[][] ratio = new float[box.getLength()][box.getWidth()];
        float[][] velocity = new float[box.getLength()][box.getWidth()];
        for (int y = 0; y < box.getLength(); ++y) {
            for (int x = 0; x < box.getWidth(); ++x) {
                double velRef = cumRef[y][x] / coef / deltaT;
                double r = n == 1 ? 1 : clamp(1 - (double) cumN[y][x] / cumRef[y][x]);
                velocity[y][x] = (float) (r * velRef);
                ratio[y][x] = mask && Math.abs(velRef) < VELOCITY_THRESHOLD ? Float.NaN : (float) r;
            }
        }
        return new Ratio(ratio, velocity);
    }

    /**
     * W(n) for n = 0..bandwidth, [bandwidth + 1][boxLength][boxWidth]. Bands 0 and 1 are 1, so band n is W(n).
     */
    public float[][][] estimateRatioAll(int bandwidth, Box box)
            throws ClosurePhaseException, BackingStoreException, DatasetException {
        float[][] cumRef = cache.get(referenceLevel).readFinal(box);
        float[][][] ratio = new float[bandwidth + 1][box.getLength()][box.getWidth()];
        for (int n = 0; n <= bandwidth; ++n) {
            float[][] cumN = n >= 2 ? cache.get(n).readFinal(box) : null;
            for (int y = 0; y < box.getLength(); ++y) {
                for (int x = 0; x < box.getWidth(); ++x) {
                    ratio[n][y][x] = cumN == null ? 1 : (float) clamp(1 - (double) cumN[y][x] / cumRef[y][x]);
                }
            }
        }
        return ratio;
    }

    /**
     * Diagonal of the bias scaling matrix Wr of every pixel, [boxLength * boxWidth][numIfgram]: column i holds W(n) for
     * the connection level n of interferogram i. Undefined ratios become 0.
     *
     * @param A  incidence matrix of the network, [numIfgram][numDate]
     * @throws NetworkInconsistencyException  if an interferogram's connection level is outside [1, bandwidth]
     */
    public float[][] buildScalingMatrix(double[][] A, int bandwidth, Box box)
            throws ClosurePhaseException, BackingStoreException, DatasetException {
        int M = A.length;
        int[] conn = new int[M];
        for (int i = 0; i < M; ++i) {
            conn[i] = DesignMatrices.connectionLevel(A[i]);
            if (conn[i] < 1 || conn[i] > bandwidth) {
                throw new NetworkInconsistencyException(String.format("interferogram %d has connection level %d"
                        + " outside the bandwidth [1, %d]; adjust the maximum connection level of the stack",
                        i, conn[i], bandwidth), conn[i]);
            }
        }
        float[][][] ratioAll = estimateRatioAll(bandwidth, box);
        int width = box.getWidth();
        float[][] W = new float[(int) box.getNumPixels()][M];
        long numNaN = 0;
        for (int p = 0; p < W.length; ++p) {
            int y = p / width, x = p % width;
            for (int i = 0; i < M; ++i) {
                float w = ratioAll[conn[i]][y][x];
                if (Float.isNaN(w)) {
                    w = 0;
                    ++numNaN;
                }
                W[p][i] = w;
            }
        }
        if (numNaN > 0) {
            logger.warn("box {}: {} undefined decay ratios replaced by 0", box, numNaN);
        }
        return W;
    }

    /** Clamp to [0, 1], leaving NaN alone */
    static double clamp(double ratio) {
        if (ratio > 1) return 1;
        if (ratio < 0) return 0;
        return ratio;
    }
}
