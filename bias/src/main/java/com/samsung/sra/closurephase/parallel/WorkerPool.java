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
package com.samsung.sra.closurephase.parallel;

import com.samsung.sra.arraystore.Box;
import com.samsung.sra.closurephase.ClosurePhaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Fixed-size pool processing independent blocks. Results are handed to a sink on the calling thread as they complete,
 * so the sink is the single writer of the output. The first failing block aborts the run.
 */
public class WorkerPool implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    public interface BlockTask {
        float[][][] apply(Box box) throws Exception;
    }

    public interface BlockSink {
        void accept(Box box, float[][][] result) throws Exception;
    }

    private final int numWorkers;
    private ExecutorService executor = null;

    public WorkerPool(int numWorkers) {
        if (numWorkers < 1) {
            throw new IllegalArgumentException("need at least one worker, got " + numWorkers);
        }
        this.numWorkers = numWorkers;
    }

    public void open() {
        if (executor != null) {
            throw new IllegalStateException("worker pool already open");
        }
        executor = Executors.newFixedThreadPool(numWorkers);
        logger.info("started worker pool with {} workers", numWorkers);
    }

    public void run(BlockTask task, List<Box> boxes, BlockSink sink) throws ClosurePhaseException {
        if (executor == null) {
            throw new IllegalStateException("worker pool not open");
        }
        CompletionService<float[][][]> completionService = new ExecutorCompletionService<>(executor);
        Map<Future<float[][][]>, Box> submitted = new HashMap<>();
        for (Box box : boxes) {
            submitted.put(completionService.submit(() -> task.apply(box)), box);
        }
        try {
            for (int i = 0; i < boxes.size(); ++i) {
                Future<float[][][]> future = completionService.take();
                Box box = submitted.get(future);
                float[][][] result;
                try {
                    result = future.get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    throw new ClosurePhaseException("processing box " + box + " failed: " + cause.getMessage(),
                            cause, box);
                }
                try {
                    sink.accept(box, result);
                } catch (Exception e) {
                    throw new ClosurePhaseException("writing box " + box + " failed: " + e.getMessage(), e, box);
                }
                logger.info("finished patch {} out of {}, box {}", i + 1, boxes.size(), box);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClosurePhaseException("interrupted while waiting for workers", e);
        } finally {
            for (Future<float[][][]> future : submitted.keySet()) {
                future.cancel(true);
            }
        }
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
            logger.info("worker pool closed");
        }
    }
}
