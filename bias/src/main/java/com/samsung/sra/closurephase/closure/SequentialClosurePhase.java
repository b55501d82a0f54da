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
package com.samsung.sra.closurephase.closure;

import com.samsung.sra.arraystore.Box;
import com.samsung.sra.arraystore.DatasetException;
import com.samsung.sra.arraystore.storage.BackingStoreException;
import com.samsung.sra.closurephase.DataIncompleteException;
import com.samsung.sra.closurephase.stack.InterferogramStack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sequential closure phases of one spatial block. For connection level n and start acquisition i the closure phase is
 * phi(i, i+1) + ... + phi(i+n-1, i+n) - phi(i, i+n), every phase first referenced to the reference pixel.
 */
public class SequentialClosurePhase {
    private static final Logger logger = LoggerFactory.getLogger(SequentialClosurePhase.class);

    private final InterferogramStack stack;

    public SequentialClosurePhase(InterferogramStack stack) {
        this.stack = stack;
    }

    /** Sum of complex closure phases of a block and the number of triplets that went into it */
    public static class Cumulative {
        public final ComplexRaster sum;
        public final int numTriplets;

        Cumulative(ComplexRaster sum, int numTriplets) {
            this.sum = sum;
            this.numTriplets = numTriplets;
        }
    }

    /** Wrapped closure phases in (-pi, pi], [numTriplets][boxLength][boxWidth] */
    public float[][][] computeWrapped(Box box, int n)
            throws DataIncompleteException, BackingStoreException, DatasetException {
        ClosureTripletIndex index = getIndex(n);
        float[][][] phase = readReferencedPhase(box);
        float[][][] wrapped = new float[index.getNumTriplets()][box.getLength()][box.getWidth()];
        for (int t = 0; t < index.getNumTriplets(); ++t) {
            int[] plus = index.getPlusIndices(t);
            int minus = index.getMinusIndex(t);
            for (int y = 0; y < box.getLength(); ++y) {
                for (int x = 0; x < box.getWidth(); ++x) {
                    wrapped[t][y][x] = ComplexRaster.wrapToFloat(closurePhase(phase, plus, minus, y, x));
                }
            }
        }
        return wrapped;
    }

    /**
     * Sum over triplets of exp(i * closure phase). Averaging happens in the complex domain, so closure phases near
     * +-pi do not cancel out.
     *
     * @param normalize  divide the sum by the number of triplets
     */
    public Cumulative computeCumulative(Box box, int n, boolean normalize)
            throws DataIncompleteException, BackingStoreException, DatasetException {
        ClosureTripletIndex index = getIndex(n);
        float[][][] phase = readReferencedPhase(box);
        ComplexRaster sum = new ComplexRaster(box.getLength(), box.getWidth());
        for (int t = 0; t < index.getNumTriplets(); ++t) {
            int[] plus = index.getPlusIndices(t);
            int minus = index.getMinusIndex(t);
            for (int y = 0; y < box.getLength(); ++y) {
                for (int x = 0; x < box.getWidth(); ++x) {
                    sum.add(y, x, closurePhase(phase, plus, minus, y, x));
                }
            }
        }
        if (normalize) {
            sum.divide(index.getNumTriplets());
        }
        return new Cumulative(sum, index.getNumTriplets());
    }

    private ClosureTripletIndex getIndex(int n) throws DataIncompleteException {
        int expected = stack.getDateList(true).size() - n;
        ClosureTripletIndex index = stack.getClosurePhaseIndex(n);
        logger.debug("connection level {}: {} closure measurements expected, {} found",
                n, expected, index.getNumTriplets());
        return index;
    }

    /** Phase of all interferograms inside box with the reference pixel value subtracted wherever phase is non-zero */
    private float[][][] readReferencedPhase(Box box) throws BackingStoreException, DatasetException {
        float[][][] phase = stack.readPhase(box);
        float[] refPhase = stack.getReferencePhase();
        for (int i = 0; i < phase.length; ++i) {
            for (float[] row : phase[i]) {
                for (int x = 0; x < row.length; ++x) {
                    if (row[x] != 0) {
                        row[x] -= refPhase[i];
                    }
                }
            }
        }
        return phase;
    }

    private static double closurePhase(float[][][] phase, int[] plus, int minus, int y, int x) {
        double cp = 0;
        for (int idx : plus) {
            cp += phase[idx][y][x];
        }
        return cp - phase[minus][y][x];
    }
}
