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

import java.util.Arrays;

/**
 * Closure triplets of one connection level n. Triplet i is n + 1 interferogram indices: the n unit-step interferograms
 * whose phases are added, then the single connection-n interferogram whose phase is subtracted.
 */
public final class ClosureTripletIndex {
    private final int connectionLevel;
    private final int[][] triplets;

    ClosureTripletIndex(int connectionLevel, int[][] triplets) {
        this.connectionLevel = connectionLevel;
        this.triplets = triplets;
    }

    public int getConnectionLevel() {
        return connectionLevel;
    }

    public int getNumTriplets() {
        return triplets.length;
    }

    public int[] getTriplet(int i) {
        return triplets[i].clone();
    }

    public int[] getPlusIndices(int i) {
        return Arrays.copyOf(triplets[i], connectionLevel);
    }

    public int getMinusIndex(int i) {
        return triplets[i][connectionLevel];
    }

    @Override
    public String toString() {
        return "conn" + connectionLevel + Arrays.deepToString(triplets);
    }
}
