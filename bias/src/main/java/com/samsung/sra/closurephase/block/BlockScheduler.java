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
package com.samsung.sra.closurephase.block;

import com.samsung.sra.arraystore.Box;
import com.samsung.sra.closurephase.stack.InterferogramStack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a raster into full-width row bands small enough that processing one of them stays within a memory budget.
 * The bands tile the raster in order, without gaps or overlaps.
 */
public class BlockScheduler {
    private static final Logger logger = LoggerFactory.getLogger(BlockScheduler.class);

    private static final long BYTES_PER_GB = 1024L * 1024 * 1024;
    /** Headroom factor over the raw size of the working arrays */
    private static final double MEMORY_OVERHEAD = 1.5;

    private BlockScheduler() {}

    /** Split the stack's raster for a budget of maxMemory GB */
    public static List<Box> splitIntoBoxes(InterferogramStack stack, double maxMemory) {
        return splitIntoBoxes(stack.getNumIfgrams(false), stack.getDateList(true).size(),
                stack.getLength(), stack.getWidth(), maxMemory);
    }

    /**
     * The working set is estimated as two float32 cubes of numIfgram bands (phase and its referenced copy) plus one of
     * numDate bands (the time series).
     */
    public static List<Box> splitIntoBoxes(int numIfgram, int numDate, int length, int width, double maxMemory) {
        if (!(maxMemory > 0)) {
            throw new IllegalArgumentException("memory budget must be positive, got " + maxMemory);
        }
        if (length < 1 || width < 1) {
            throw new IllegalArgumentException("invalid raster size " + length + " x " + width);
        }
        double dsSize = ((double) numIfgram * 2 + numDate) * length * width * 4;
        int numBox = (int) Math.min(length, Math.ceil(dsSize * MEMORY_OVERHEAD / (maxMemory * BYTES_PER_GB)));
        if (numBox <= 1) {
            return Collections.singletonList(Box.full(length, width));
        }
        // rows per box, rounded to a multiple of 10
        int yStep = (int) (Math.rint((double) length / numBox / 10) * 10);
        if (yStep < 1) {
            yStep = (int) Math.ceil((double) length / numBox);
        }
        List<Box> boxes = new ArrayList<>();
        for (int y0 = 0; y0 < length; y0 += yStep) {
            boxes.add(new Box(0, y0, width, Math.min(length, y0 + yStep)));
        }
        logger.info("maximum memory size: {} GB, split {} lines into {} patches of up to {} lines",
                maxMemory, length, boxes.size(), yStep);
        return boxes;
    }
}
