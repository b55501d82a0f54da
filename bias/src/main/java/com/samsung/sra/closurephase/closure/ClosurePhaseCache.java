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
import com.samsung.sra.arraystore.DatasetSpec;
import com.samsung.sra.arraystore.Metadata;
import com.samsung.sra.arraystore.storage.BackingStoreException;
import com.samsung.sra.closurephase.ClosurePhaseException;
import com.samsung.sra.closurephase.block.BlockScheduler;
import com.samsung.sra.closurephase.stack.InterferogramStack;
import com.samsung.sra.closurephase.unwrap.CoherenceEstimator;
import com.samsung.sra.closurephase.unwrap.PhaseFilter;
import com.samsung.sra.closurephase.unwrap.PhaseUnwrapper;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Content-addressed cache of per-level closure phase artifacts, keyed by (stack identity, connection level). Artifacts
 * of level n live in the container {@code <outdir>/closurePhase/S<stack identity>.conn<n>}, or in memory for the
 * lifetime of the cache when outdir is null. A container is only reused once marked complete.
 * <p>Only the wrapped closure phase is computed block by block; filtering and unwrapping read and write whole-raster
 * planes, one closure phase at a time, outside the max-memory block budget.</p>
 */
public class ClosurePhaseCache implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ClosurePhaseCache.class);

    private final InterferogramStack stack;
    private final String outdir;
    private final double maxMemory;
    private final boolean update;
    private final PhaseFilter filter;
    private final CoherenceEstimator coherenceEstimator;
    private final PhaseUnwrapper unwrapper;
    private final Map<Integer, ClosurePhaseLevel> levels = new TreeMap<>();

    /**
     * @param outdir  output directory, null to keep artifacts in memory
     * @param maxMemory  memory budget in GB for block-wise closure phase computation
     * @param update  compute missing artifacts; if false a missing level is an error
     */
    public ClosurePhaseCache(InterferogramStack stack, String outdir, double maxMemory, boolean update,
                             PhaseFilter filter, CoherenceEstimator coherenceEstimator, PhaseUnwrapper unwrapper) {
        this.stack = stack;
        this.outdir = outdir;
        this.maxMemory = maxMemory;
        this.update = update;
        this.filter = filter;
        this.coherenceEstimator = coherenceEstimator;
        this.unwrapper = unwrapper;
    }

    /** null when artifacts are kept in memory */
    public String getLevelDirectory(int n) {
        return outdir == null
                ? null
                : new File(new File(outdir, "closurePhase"), "S" + stack.getIdentity() + ".conn" + n).getPath();
    }

    /** Artifacts of level n, computing them first if needed */
    public synchronized ClosurePhaseLevel get(int n) throws ClosurePhaseException, BackingStoreException, DatasetException {
        ClosurePhaseLevel level = levels.get(n);
        return level != null ? level : computeOrLoad(n);
    }

    /**
     * Open the complete artifacts of level n if they exist, otherwise compute them (unless the cache was created with
     * update = false, in which case missing artifacts are an error).
     */
    public synchronized ClosurePhaseLevel computeOrLoad(int n)
            throws ClosurePhaseException, BackingStoreException, DatasetException {
        ClosurePhaseLevel level = levels.get(n);
        if (level != null) {
            return level;
        }
        String directory = getLevelDirectory(n);
        if (directory != null && ArrayStore.exists(directory)) {
            ArrayStore existing = new ArrayStore(directory, new ArrayStore.StoreOptions().setReadOnly(true));
            if (existing.getAux(ClosurePhaseLevel.COMPLETE_AUX) != null) {
                logger.warn("Closure phase of connection level {} already exists at {}, skip re-generating", n, directory);
                level = new ClosurePhaseLevel(n, existing);
                levels.put(n, level);
                return level;
            }
            existing.close();
            if (update) {
                logger.warn("Removing incomplete closure phase artifacts at {}", directory);
                try {
                    FileUtils.deleteDirectory(new File(directory));
                } catch (IOException e) {
                    throw new ClosurePhaseException("could not remove " + directory, e, n, null);
                }
            }
        }
        if (!update) {
            throw new ClosurePhaseException("closure phase of connection level " + n + " not found"
                    + (directory != null ? " at " + directory : "") + "; compute it first", n);
        }
        level = compute(n, directory);
        levels.put(n, level);
        return level;
    }

    private ClosurePhaseLevel compute(int n, String directory)
            throws ClosurePhaseException, BackingStoreException, DatasetException {
        long startTime = System.currentTimeMillis();
        Metadata metadata = stack.getMetadata();
        int length = metadata.getLength(), width = metadata.getWidth();
        List<String> dates = stack.getDateList(true);
        int N = dates.size();
        int numCp = stack.getClosurePhaseIndex(n).getNumTriplets();
        logger.info("connection level {}: scene length x width: {} x {}, {} acquisitions from {} to {}",
                n, length, width, N, dates.get(0), dates.get(N - 1));
        logger.info("connection level {}: {} closure measurements expected, {} found", n, N - n, numCp);

        ArrayStore store = new ArrayStore(directory);
        try {
            store.layout(metadata.withFileType("closurePhase").withAttribute("CONNECTION_LEVEL", Integer.toString(n)),
                    DatasetSpec.float32(ClosurePhaseLevel.WRAPPED, numCp, length, width),
                    DatasetSpec.float32(ClosurePhaseLevel.COHERENCE, numCp, length, width),
                    DatasetSpec.float32(ClosurePhaseLevel.UNWRAPPED, numCp, length, width),
                    DatasetSpec.float32(ClosurePhaseLevel.TIMESERIES, N, length, width),
                    DatasetSpec.bool(ClosurePhaseLevel.CONN_COMP_MASK, length, width));

            SequentialClosurePhase closurePhase = new SequentialClosurePhase(stack);
            List<Box> boxes = BlockScheduler.splitIntoBoxes(stack, maxMemory);
            for (int i = 0; i < boxes.size(); ++i) {
                Box box = boxes.get(i);
                if (boxes.size() > 1) {
                    logger.info("processing patch {} out of {}, box {}", i + 1, boxes.size(), box);
                }
                store.writeBlock(ClosurePhaseLevel.WRAPPED, closurePhase.computeWrapped(box, n), 0, box);
            }

            accumulateTimeSeries(store, n, N, numCp, metadata);
            store.putAux(ClosurePhaseLevel.COMPLETE_AUX, new byte[]{1});
        } catch (ClosurePhaseException | BackingStoreException | DatasetException | RuntimeException e) {
            store.close();
            throw e;
        }
        logger.info("connection level {}: closure phase computed in {} ms", n, System.currentTimeMillis() - startTime);
        return new ClosurePhaseLevel(n, store);
    }

    /**
     * Filter and unwrap every closure phase, re-reference it to the reference pixel and integrate into a time series:
     * ts[0] = 0, ts[1..N-n] = cumulative sum of closure phases, later dates extrapolated with the last closure phase,
     * everything divided by n.
     */
    private void accumulateTimeSeries(ArrayStore store, int n, int N, int numCp, Metadata metadata)
            throws BackingStoreException, DatasetException {
        int length = metadata.getLength(), width = metadata.getWidth();
        int refY = metadata.getRefY(), refX = metadata.getRefX();
        Box full = Box.full(length, width);
        double[][] cumulative = new double[length][width];
        float[][] lastCp = new float[length][width];
        boolean[][] connCompMask = new boolean[length][width];
        for (boolean[] row : connCompMask) {
            Arrays.fill(row, true);
        }

        store.writeBlock(ClosurePhaseLevel.TIMESERIES, new float[length][width], 0, full);
        for (int t = 0; t < numCp; ++t) {
            ComplexRaster filtered = filter.filter(ComplexRaster.fromPhase(store.read(ClosurePhaseLevel.WRAPPED, t, full)));
            float[][] coherence = coherenceEstimator.estimate(filtered);
            PhaseUnwrapper.Result unwrapped = unwrapper.unwrap(filtered, coherence);
            store.writeBlock(ClosurePhaseLevel.COHERENCE, coherence, t, full);
            store.writeBlock(ClosurePhaseLevel.UNWRAPPED, unwrapped.phase, t, full);

            float refValue = unwrapped.phase[refY][refX];
            float[][] ts = new float[length][width];
            for (int y = 0; y < length; ++y) {
                for (int x = 0; x < width; ++x) {
                    float cp = unwrapped.phase[y][x] - refValue;
                    lastCp[y][x] = cp;
                    cumulative[y][x] += cp;
                    ts[y][x] = (float) (cumulative[y][x] / n);
                    connCompMask[y][x] &= unwrapped.connectedComponents[y][x] >= 1;
                }
            }
            store.writeBlock(ClosurePhaseLevel.TIMESERIES, ts, t + 1, full);
            logger.debug("connection level {}: unwrapped closure phase {} out of {}", n, t + 1, numCp);
        }
        for (int i = numCp + 1; i < N; ++i) {
            float[][] ts = new float[length][width];
            for (int y = 0; y < length; ++y) {
                for (int x = 0; x < width; ++x) {
                    ts[y][x] = (float) (((i - N + n) * (double) lastCp[y][x] + cumulative[y][x]) / n);
                }
            }
            store.writeBlock(ClosurePhaseLevel.TIMESERIES, ts, i, full);
        }
        store.writeMask(ClosurePhaseLevel.CONN_COMP_MASK, connCompMask);
    }

    @Override
    public synchronized void close() throws BackingStoreException {
        BackingStoreException error = null;
        for (ClosurePhaseLevel level : levels.values()) {
            try {
                level.close();
            } catch (BackingStoreException e) {
                error = e;
            }
        }
        levels.clear();
        if (error != null) {
            throw error;
        }
    }
}
