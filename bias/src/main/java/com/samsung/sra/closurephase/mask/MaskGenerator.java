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
package com.samsung.sra.closurephase.mask;

import com.samsung.sra.arraystore.Box;
import com.samsung.sra.arraystore.DatasetException;
import com.samsung.sra.arraystore.storage.BackingStoreException;
import com.samsung.sra.closurephase.DataIncompleteException;
import com.samsung.sra.closurephase.closure.ComplexRaster;
import com.samsung.sra.closurephase.closure.SequentialClosurePhase;
import com.samsung.sra.closurephase.stack.InterferogramStack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Flags pixels susceptible to closure phase bias. The complex closure phases of the reference level are averaged over
 * time; a pixel is susceptible (false) if the angle of the average exceeds numSigma times the expected standard
 * deviation of an unbiased average. Pixels with a low-amplitude average are always left unmasked (true).
 */
public class MaskGenerator {
    private static final Logger logger = LoggerFactory.getLogger(MaskGenerator.class);

    private final InterferogramStack stack;

    public MaskGenerator(InterferogramStack stack) {
        this.stack = stack;
    }

    public static class Result {
        /** false = susceptible to bias */
        public final boolean[][] mask;
        /** Angle and amplitude of the time-averaged complex closure phase */
        public final float[][] phase, amplitude;
        public final int numTriplets;

        Result(boolean[][] mask, float[][] phase, float[][] amplitude, int numTriplets) {
            this.mask = mask;
            this.phase = phase;
            this.amplitude = amplitude;
            this.numTriplets = numTriplets;
        }
    }

    public Result generate(int referenceLevel, double numSigma, double amplitudeThreshold, List<Box> boxes)
            throws DataIncompleteException, BackingStoreException, DatasetException {
        SequentialClosurePhase closurePhase = new SequentialClosurePhase(stack);
        ComplexRaster avg = new ComplexRaster(stack.getLength(), stack.getWidth());
        int numCp = 0;
        for (int i = 0; i < boxes.size(); ++i) {
            Box box = boxes.get(i);
            if (boxes.size() > 1) {
                logger.info("processing patch {} out of {}, box {}", i + 1, boxes.size(), box);
            }
            SequentialClosurePhase.Cumulative cumulative = closurePhase.computeCumulative(box, referenceLevel, true);
            cumulative.sum.copyInto(avg, box.y0, box.x0);
            numCp = cumulative.numTriplets;
        }
        logger.info("phase threshold: {} rad ({} sigma, {} closure phases), amplitude threshold: {}",
                phaseThreshold(numCp, numSigma), numSigma, numCp, amplitudeThreshold);
        boolean[][] mask = threshold(avg, numCp, numSigma, amplitudeThreshold);
        return new Result(mask, avg.getPhase(), avg.getAmplitude(), numCp);
    }

    /** numSigma times the standard deviation of the mean of numTriplets uniform phases, pi / sqrt(3 numTriplets) */
    public static double phaseThreshold(int numTriplets, double numSigma) {
        return Math.PI / Math.sqrt(3.0 * numTriplets) * numSigma;
    }

    /** false where |angle| exceeds the phase threshold, except that amplitude <= amplitudeThreshold is always true */
    public static boolean[][] threshold(ComplexRaster avg, int numTriplets, double numSigma, double amplitudeThreshold) {
        double phaseThreshold = phaseThreshold(numTriplets, numSigma);
        boolean[][] mask = new boolean[avg.getLength()][avg.getWidth()];
        for (int y = 0; y < avg.getLength(); ++y) {
            for (int x = 0; x < avg.getWidth(); ++x) {
                double re = avg.getReal(y, x), im = avg.getImaginary(y, x);
                mask[y][x] = Math.abs(Math.atan2(im, re)) <= phaseThreshold
                        || Math.hypot(re, im) <= amplitudeThreshold;
            }
        }
        return mask;
    }
}
