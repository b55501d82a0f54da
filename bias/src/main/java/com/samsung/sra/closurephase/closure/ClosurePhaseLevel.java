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

import com.samsung.sra.arraystore.ArrayStore;
import com.samsung.sra.arraystore.Box;
import com.samsung.sra.arraystore.DatasetException;
import com.samsung.sra.arraystore.storage.BackingStoreException;

/**
 * Closure phase artifacts of one connection level n over N acquisitions:
 * <ul>
 *     <li>{@value #WRAPPED}: wrapped sequential closure phases, [N - n, length, width]</li>
 *     <li>{@value #COHERENCE}, {@value #UNWRAPPED}: the same after filtering and unwrapping</li>
 *     <li>{@value #TIMESERIES}: cumulative sequential closure phase time series divided by n, [N, length, width]</li>
 *     <li>{@value #CONN_COMP_MASK}: true where every closure phase unwrapped inside a connected component</li>
 * </ul>
 */
public class ClosurePhaseLevel {
    public static final String WRAPPED = "wrapped";
    public static final String COHERENCE = "coherence";
    public static final String UNWRAPPED = "unwrapped";
    public static final String TIMESERIES = "timeseries";
    public static final String CONN_COMP_MASK = "connCompMask";
    static final String COMPLETE_AUX = "complete";

    private final int connectionLevel;
    private final ArrayStore store;

    ClosurePhaseLevel(int connectionLevel, ArrayStore store) {
        this.connectionLevel = connectionLevel;
        this.store = store;
    }

    public int getConnectionLevel() {
        return connectionLevel;
    }

    public int getNumTriplets() throws DatasetException {
        return store.getDatasetSpec(WRAPPED).bands;
    }

    public int getNumDates() throws DatasetException {
        return store.getDatasetSpec(TIMESERIES).bands;
    }

    public float[][][] readWrapped(Box box) throws DatasetException, BackingStoreException {
        return store.read(WRAPPED, box);
    }

    public float[][][] readUnwrapped(Box box) throws DatasetException, BackingStoreException {
        return store.read(UNWRAPPED, box);
    }

    /** [N][boxLength][boxWidth] */
    public float[][][] readTimeSeries(Box box) throws DatasetException, BackingStoreException {
        return store.read(TIMESERIES, box);
    }

    /** Last date of the time series, i.e. the cumulative closure phase over the whole stack */
    public float[][] readFinal(Box box) throws DatasetException, BackingStoreException {
        return store.read(TIMESERIES, getNumDates() - 1, box);
    }

    public boolean[][] readConnCompMask(Box box) throws DatasetException, BackingStoreException {
        return store.readMask(CONN_COMP_MASK, box);
    }

    ArrayStore getStore() {
        return store;
    }

    void close() throws BackingStoreException {
        store.close();
    }
}
