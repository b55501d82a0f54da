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

/** Magnitude of the mean unit phasor over a window x window neighbourhood (pixels outside the raster skipped) */
public class WindowCoherenceEstimator implements CoherenceEstimator {
    private final int window;

    public WindowCoherenceEstimator() {
        this(5);
    }

    public WindowCoherenceEstimator(int window) {
        if (window < 1 || window % 2 == 0) {
            throw new IllegalArgumentException("coherence window must be a positive odd number, got " + window);
        }
        this.window = window;
    }

    @Override
    public float[][] estimate(ComplexRaster filtered) {
        int length = filtered.getLength(), width = filtered.getWidth(), half = window / 2;
        float[][] coherence = new float[length][width];
        for (int y = 0; y < length; ++y) {
            for (int x = 0; x < width; ++x) {
                double re = 0, im = 0;
                int count = 0;
                for (int yy = Math.max(0, y - half); yy <= Math.min(length - 1, y + half); ++yy) {
                    for (int xx = Math.max(0, x - half); xx <= Math.min(width - 1, x + half); ++xx) {
                        double a = filtered.getReal(yy, xx), b = filtered.getImaginary(yy, xx);
                        double magnitude = Math.hypot(a, b);
                        if (magnitude > 0) {
                            re += a / magnitude;
                            im += b / magnitude;
                        }
                        ++count;
                    }
                }
                coherence[y][x] = (float) Math.min(1.0, Math.hypot(re, im) / count);
            }
        }
        return coherence;
    }
}
