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
package com.samsung.sra.closurephase;

import com.samsung.sra.arraystore.ArrayStore;
import com.samsung.sra.arraystore.Box;
import com.samsung.sra.arraystore.DatasetException;
import com.samsung.sra.arraystore.DatasetSpec;
import com.samsung.sra.arraystore.Metadata;
import com.samsung.sra.arraystore.Utilities;
import com.samsung.sra.arraystore.storage.BackingStoreException;
import com.samsung.sra.closurephase.block.BlockScheduler;
import com.samsung.sra.closurephase.closure.ClosurePhaseCache;
import com.samsung.sra.closurephase.inversion.BiasEstimator;
import com.samsung.sra.closurephase.mask.MaskGenerator;
import com.samsung.sra.closurephase.parallel.LinearAlgebraThreads;
import com.samsung.sra.closurephase.parallel.WorkerPool;
import com.samsung.sra.closurephase.ratio.DecayRatioEstimator;
import com.samsung.sra.closurephase.stack.InterferogramStack;
import com.samsung.sra.closurephase.unwrap.CoherenceEstimator;
import com.samsung.sra.closurephase.unwrap.GaussianKernelFilter;
import com.samsung.sra.closurephase.unwrap.PassThroughUnwrapper;
import com.samsung.sra.closurephase.unwrap.PhaseFilter;
import com.samsung.sra.closurephase.unwrap.PhaseUnwrapper;
import com.samsung.sra.closurephase.unwrap.WindowCoherenceEstimator;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the three bias-correction actions on one interferogram stack. Output containers go to
 * {@code <outdir>/<name>}, or stay in memory (see {@link #getOutput}) when the options carry no output directory.
 */
public class ClosurePhaseBias implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ClosurePhaseBias.class);

    public static final String MASK_FILE = "maskClosurePhase";
    public static final String AVG_CPX_FILE = "avgCpxClosurePhase";
    public static final String WRATIO_FILE = "Wratio";
    public static final String BIAS_APPROX_FILE = "bias_timeseries_approx";
    public static final String BIAS_FILE = "bias_timeseries";

    public static final String MASK = "mask";
    public static final String PHASE = "phase";
    public static final String AMPLITUDE = "amplitude";
    public static final String WRATIO = "wratio";
    public static final String BIAS_VELOCITY = "bias_velocity";
    public static final String TIMESERIES = "timeseries";
    /** aux key holding the date list of a time series output */
    public static final String DATES_AUX = "dates";

    public enum Action {
        MASK("mask"),
        QUICK_ESTIMATE("quick_estimate"),
        ESTIMATE("estimate");

        private final String name;

        Action(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        public static Action fromName(String name) {
            for (Action action : values()) {
                if (action.name.equals(name)) {
                    return action;
                }
            }
            throw new IllegalArgumentException("unknown action " + name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    private final InterferogramStack stack;
    private final BiasOptions options;
    private final ClosurePhaseCache cache;
    private final Map<String, ArrayStore> outputs = new LinkedHashMap<>();

    public ClosurePhaseBias(InterferogramStack stack, BiasOptions options) {
        this(stack, options, new GaussianKernelFilter(options.getKernelSize(), options.getKernelSigma()),
                new WindowCoherenceEstimator(), new PassThroughUnwrapper(options.getMinCoherence()));
    }

    public ClosurePhaseBias(InterferogramStack stack, BiasOptions options, PhaseFilter filter,
                            CoherenceEstimator coherenceEstimator, PhaseUnwrapper unwrapper) {
        this.stack = stack;
        this.options = options;
        this.cache = new ClosurePhaseCache(stack, options.getOutdir(), options.getMaxMemory(), options.getUpdate(),
                filter, coherenceEstimator, unwrapper);
    }

    public void run(Action action) throws ClosurePhaseException, BackingStoreException, DatasetException {
        long startTime = System.currentTimeMillis();
        logger.info("action {}: {}", action, options);
        switch (action) {
            case MASK:
                mask();
                break;
            case QUICK_ESTIMATE:
                quickEstimate();
                break;
            case ESTIMATE:
                estimate();
                break;
            default:
                throw new IllegalStateException("unknown action " + action);
        }
        logger.info("action {} finished in {} ms", action, System.currentTimeMillis() - startTime);
    }

    /** Bias-susceptibility mask and time-averaged complex closure phase of the reference level */
    public MaskGenerator.Result mask() throws ClosurePhaseException, BackingStoreException, DatasetException {
        int length = stack.getLength(), width = stack.getWidth();
        List<Box> boxes = BlockScheduler.splitIntoBoxes(stack, options.getMaxMemory());
        MaskGenerator.Result result = new MaskGenerator(stack).generate(options.getReferenceLevel(),
                options.getNumSigma(), options.getAmplitudeThreshold(), boxes);

        ArrayStore maskOut = createOutput(MASK_FILE, "mask", "1", DatasetSpec.bool(MASK, length, width));
        maskOut.writeMask(MASK, result.mask);
        ArrayStore avgOut = createOutput(AVG_CPX_FILE, "mask", "radian",
                DatasetSpec.float32(PHASE, length, width), DatasetSpec.float32(AMPLITUDE, length, width));
        avgOut.write(PHASE, result.phase);
        avgOut.write(AMPLITUDE, result.amplitude);
        return result;
    }

    /** Compute (or load) the closure phase artifacts of levels 2..max(2, bandwidth) and of the reference level */
    public void prepareClosurePhases() throws ClosurePhaseException, BackingStoreException, DatasetException {
        for (int n = 2; n <= Math.max(2, options.getBandwidth()); ++n) {
            cache.computeOrLoad(n);
        }
        cache.computeOrLoad(options.getReferenceLevel());
    }

    /** Decay ratios and bias velocities of levels 1..bandwidth, plus the approximate bias time series */
    public void quickEstimate() throws ClosurePhaseException, BackingStoreException, DatasetException {
        prepareClosurePhases();
        int bandwidth = options.getBandwidth();
        int N = stack.getTimeBase().getNumDates(), length = stack.getLength(), width = stack.getWidth();
        BiasEstimator estimator = new BiasEstimator(cache, stack, options.getReferenceLevel(), bandwidth);
        DecayRatioEstimator ratios = new DecayRatioEstimator(cache, stack.getTimeBase(),
                stack.getMetadata().getWavelength(), options.getReferenceLevel());

        ArrayStore wratioOut = createOutput(WRATIO_FILE, "wratio", "1",
                DatasetSpec.float32(WRATIO, bandwidth, length, width),
                DatasetSpec.float32(BIAS_VELOCITY, bandwidth, length, width));
        ArrayStore tsOut = createOutput(BIAS_APPROX_FILE, "timeseries", "m",
                DatasetSpec.float32(TIMESERIES, N, length, width));
        List<Box> boxes = BlockScheduler.splitIntoBoxes(stack, options.getMaxMemory());
        for (int i = 0; i < boxes.size(); ++i) {
            Box box = boxes.get(i);
            if (boxes.size() > 1) {
                logger.info("processing patch {} out of {}, box {}", i + 1, boxes.size(), box);
            }
            try {
                for (int n = 1; n <= bandwidth; ++n) {
                    DecayRatioEstimator.Ratio ratio = ratios.estimateRatio(n, box, true);
                    wratioOut.writeBlock(WRATIO, ratio.ratio, n - 1, box);
                    wratioOut.writeBlock(BIAS_VELOCITY, ratio.velocity, n - 1, box);
                }
                tsOut.writeBlock(TIMESERIES, estimator.estimate(BiasEstimator.Strategy.APPROXIMATE, box), 0, box);
            } catch (ClosurePhaseException e) {
                throw withBox(e, box);
            }
        }
    }

    /** Exact per-pixel bias time series, optionally with blocks dispatched to a worker pool */
    public void estimate() throws ClosurePhaseException, BackingStoreException, DatasetException {
        prepareClosurePhases();
        int N = stack.getTimeBase().getNumDates(), length = stack.getLength(), width = stack.getWidth();
        BiasEstimator estimator = new BiasEstimator(cache, stack, options.getReferenceLevel(), options.getBandwidth());
        ArrayStore out = createOutput(BIAS_FILE, "timeseries", "m", DatasetSpec.float32(TIMESERIES, N, length, width));
        List<Box> boxes = BlockScheduler.splitIntoBoxes(stack, options.getMaxMemory());

        if (options.getNumWorkers() > 0) {
            int previous = LinearAlgebraThreads.setThreads(1);
            try (WorkerPool pool = new WorkerPool(options.getNumWorkers())) {
                pool.open();
                pool.run(box -> estimator.estimate(BiasEstimator.Strategy.EXACT, box), boxes,
                        (box, ts) -> out.writeBlock(TIMESERIES, ts, 0, box));
            } finally {
                LinearAlgebraThreads.restoreThreads(previous);
            }
        } else {
            for (int i = 0; i < boxes.size(); ++i) {
                Box box = boxes.get(i);
                if (boxes.size() > 1) {
                    logger.info("processing patch {} out of {}, box {}", i + 1, boxes.size(), box);
                }
                try {
                    out.writeBlock(TIMESERIES, estimator.estimate(BiasEstimator.Strategy.EXACT, box), 0, box);
                } catch (ClosurePhaseException e) {
                    throw withBox(e, box);
                }
            }
        }
    }

    /** Output container written by the last run of an action, null if none */
    public ArrayStore getOutput(String name) {
        return outputs.get(name);
    }

    public ClosurePhaseCache getCache() {
        return cache;
    }

    private ArrayStore createOutput(String name, String fileType, String unit, DatasetSpec... datasets)
            throws BackingStoreException, DatasetException {
        String directory = options.getOutdir() == null ? null : new File(options.getOutdir(), name).getPath();
        ArrayStore previous = outputs.remove(name);
        if (previous != null) {
            previous.close();
        }
        if (directory != null && new File(directory).exists()) {
            logger.warn("{} already exists, overwriting", directory);
            try {
                FileUtils.deleteDirectory(new File(directory));
            } catch (IOException e) {
                throw new BackingStoreException("could not remove " + directory, e);
            }
        }
        ArrayStore out = new ArrayStore(directory);
        try {
            Metadata metadata = stack.getMetadata().withFileType(fileType).withAttribute("UNIT", unit);
            out.layout(metadata, datasets);
            out.putAux(DATES_AUX, Utilities.serialize(new ArrayList<>(stack.getDateList(true))));
        } catch (IOException e) {
            out.close();
            throw new BackingStoreException(e);
        } catch (DatasetException | BackingStoreException e) {
            out.close();
            throw e;
        }
        outputs.put(name, out);
        logger.info("writing {} to {}", name, directory != null ? directory : "memory");
        return out;
    }

    private static ClosurePhaseException withBox(ClosurePhaseException e, Box box) {
        return e.getBox() != null ? e : new ClosurePhaseException(e.getMessage(), e, box);
    }

    @Override
    public void close() throws BackingStoreException {
        BackingStoreException error = null;
        for (ArrayStore out : outputs.values()) {
            try {
                out.close();
            } catch (BackingStoreException e) {
                error = e;
            }
        }
        outputs.clear();
        try {
            cache.close();
        } catch (BackingStoreException e) {
            error = e;
        }
        if (error != null) {
            throw error;
        }
    }
}
