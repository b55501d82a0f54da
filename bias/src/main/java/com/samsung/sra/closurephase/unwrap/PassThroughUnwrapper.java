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
package com.samsung.sra.closurephase.unwrap;

import com.samsung.sra.closurephase.closure.ComplexRaster;

/**
 * Takes the filtered phase as is. Adequate for closure phases, which are small after filtering; a real unwrapper can
 * be plugged in through {@link PhaseUnwrapper}. Pixels with coherence below the minimum get connected component 0.
 */
public class PassThroughUnwrapper implements PhaseUnwrapper {
    private final double minCoherence;

    public PassThroughUnwrapper() {
        this(0.0);
    }

    public PassThroughUnwrapper(double minCoherence) {
        if (minCoherence < 0 || minCoherence > 1) {
            throw new IllegalArgumentException("minimum coherence must be in [0, 1], got " + minCoherence);
        }
        this.minCoherence = minCoherence;
    }

    @Override
    public Result unwrap(ComplexRaster filtered, float[][] coherence) {
        float[][] phase = filtered.getPhase();
        int[][] components = new int[phase.length][phase.length == 0 ? 0 : phase[0].length];
        for (int y = 0; y < phase.length; ++y) {
            for (int x = 0; x < phase[y].length; ++x) {
                components[y][x] = coherence[y][x] >= minCoherence ? 1 : 0;
            }
        }
        return new Result(phase, components);
    }
}
