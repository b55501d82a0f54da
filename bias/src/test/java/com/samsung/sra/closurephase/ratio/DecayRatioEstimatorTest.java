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
import com.samsung.sra.closurephase.NetworkInconsistencyException;
import com.samsung.sra.closurephase.closure.ClosurePhaseCache;
import com.samsung.sra.closurephase.stack.InterferogramStack;
import com.samsung.sra.closurephase.stack.SyntheticStack;
import com.samsung.sra.closurephase.unwrap.GaussianKernelFilter;
import com.samsung.sra.closurephase.unwrap.PassThroughUnwrapper;
import com.samsung.sra.closurephase.unwrap.WindowCoherenceEstimator;
import org.junit.After;
import org.junit.Test;

import static org.junit.Assert.*;

public class DecayRatioEstimatorTest {
    private static final double WAVELENGTH = 0.0555;
    private static final Box FULL = Box.full(12, 12);

    private InterferogramStack stack = null;
    private ClosurePhaseCache cache = null;

    /** 5 acquisitions, bandwidth 2, bias injected over rows and columns 3..8 */
    private DecayRatioEstimator estimator(double... biasPerLevel) throws Exception {
        stack = new SyntheticStack().setWavelength(WAVELENGTH).setBias(new Box(3, 3, 9, 9), biasPerLevel).build(null);
        cache = new ClosurePhaseCache(stack, null, 1000, true,
                new GaussianKernelFilter(), new WindowCoherenceEstimator(), new PassThroughUnwrapper());
        return new DecayRatioEstimator(cache, stack.getTimeBase(), WAVELENGTH, 4);
    }

    @After
    public void tearDown() throws Exception {
        if (cache != null) cache.close();
        if (stack != null) stack.close();
    }

    @Test
    public void ratioOfLevelTwo() throws Exception {
        DecayRatioEstimator estimator = estimator(0, 0.2, 0.2);
        // cumulative bias: 0.4 rad at level 2, 0.8 rad at level 4
        double coef = DecayRatioEstimator.phaseToRangeCoefficient(WAVELENGTH);
        double velRef = 0.8 / coef / (48 / 365.25);
        DecayRatioEstimator.Ratio ratio = estimator.estimateRatio(2, FULL, false);
        assertEquals(0.5, ratio.ratio[5][5], 1e-5);
        assertEquals(0.5 * velRef, ratio.velocity[5][5], 1e-4);
        assertTrue(Float.isNaN(ratio.ratio[0][0]));

        DecayRatioEstimator.Ratio first = estimator.estimateRatio(1, FULL, false);
        assertEquals(1, first.ratio[5][5], 0);
        assertEquals(1, first.ratio[0][0], 0);
        assertEquals(velRef, first.velocity[5][5], 1e-4);
    }

    @Test
    public void insignificantVelocityIsMasked() throws Exception {
        DecayRatioEstimator estimator = estimator(0, 0.2, 0.2);
        DecayRatioEstimator.Ratio first = estimator.estimateRatio(1, FULL, true);
        assertEquals(1, first.ratio[5][5], 0);
        assertTrue(Float.isNaN(first.ratio[0][0]));
        assertEquals(0, first.velocity[0][0], 0);
    }

    @Test
    public void ratioIsClamped() throws Exception {
        // level-2 cumulative bias 1.2 rad, larger than at the reference level
        DecayRatioEstimator estimator = estimator(0, 0.2, -0.2);
        assertEquals(0, estimator.estimateRatio(2, FULL, false).ratio[5][5], 0);
        tearDown();

        // negative level-2 cumulative bias
        estimator = estimator(0, 0.2, 0.6);
        assertEquals(1, estimator.estimateRatio(2, FULL, false).ratio[5][5], 0);
    }

    @Test
    public void ratiosOfAllLevels() throws Exception {
        DecayRatioEstimator estimator = estimator(0, 0.2, 0.2);
        float[][][] ratios = estimator.estimateRatioAll(2, FULL);
        assertEquals(3, ratios.length);
        assertEquals(1, ratios[0][0][0], 0);
        assertEquals(1, ratios[1][5][5], 0);
        assertEquals(0.5, ratios[2][5][5], 1e-5);
        assertTrue(Float.isNaN(ratios[2][0][0]));

        Box box = new Box(4, 5, 7, 6);
        float[][][] block = estimator.estimateRatioAll(2, box);
        assertEquals(ratios[2][5][5], block[2][0][1], 0);
    }

    @Test
    public void scalingMatrix() throws Exception {
        DecayRatioEstimator estimator = estimator(0, 0.2, 0.2);
        double[][] A = stack.getDesignMatrices().getA();
        float[][] W = estimator.buildScalingMatrix(A, 2, FULL);
        assertEquals(144, W.length);
        assertEquals(A.length, W[0].length);
        for (int i = 0; i < A.length; ++i) {
            boolean unitStep = com.samsung.sra.closurephase.stack.DesignMatrices.connectionLevel(A[i]) == 1;
            assertEquals(unitStep ? 1 : 0.5, W[5 * 12 + 5][i], 1e-5);
            // undefined ratio outside the patch replaced by 0
            assertEquals(unitStep ? 1 : 0, W[0][i], 0);
        }
    }

    @Test
    public void levelAboveBandwidth() throws Exception {
        DecayRatioEstimator estimator = estimator(0, 0.2, 0.2);
        try {
            estimator.buildScalingMatrix(stack.getDesignMatrices().getA(), 1, FULL);
            fail("expected NetworkInconsistencyException");
        } catch (NetworkInconsistencyException e) {
            assertEquals(2, e.getConnectionLevel());
        }
    }
}
