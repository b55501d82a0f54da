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

public interface PhaseUnwrapper {
    /** Unwrapped phase (radians) and connected component labels; label 0 means unwrapping failed at that pixel */
    class Result {
        public final float[][] phase;
        public final int[][] connectedComponents;

        public Result(float[][] phase, int[][] connectedComponents) {
            this.phase = phase;
            this.connectedComponents = connectedComponents;
        }
    }

    Result unwrap(ComplexRaster filtered, float[][] coherence);
}
