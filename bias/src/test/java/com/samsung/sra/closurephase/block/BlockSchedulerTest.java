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
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class BlockSchedulerTest {
    /** Boxes span the full width and tile the rows without gaps or overlap */
    private static void assertCovers(List<Box> boxes, int length, int width) {
        assertFalse(boxes.isEmpty());
        int y = 0;
        for (Box box : boxes) {
            assertEquals(0, box.x0);
            assertEquals(width, box.x1);
            assertEquals(y, box.y0);
            y = box.y1;
        }
        assertEquals(length, y);
    }

    @Test
    public void fitsInOneBlock() {
        List<Box> boxes = BlockScheduler.splitIntoBoxes(50, 20, 1000, 100, 4.0);
        assertEquals(1, boxes.size());
        assertEquals(Box.full(1000, 100), boxes.get(0));
    }

    @Test
    public void splitsIntoRoundedBlocks() {
        // 72 MB working set (with overhead) over a 21 MB budget: 4 boxes of 250 lines
        List<Box> boxes = BlockScheduler.splitIntoBoxes(50, 20, 1000, 100, 0.02);
        assertEquals(4, boxes.size());
        assertEquals(new Box(0, 250, 100, 500), boxes.get(1));
        assertCovers(boxes, 1000, 100);

        // 3 boxes requested, lines rounded to 330 per box, leaving a short last one
        boxes = BlockScheduler.splitIntoBoxes(50, 20, 1000, 100, 0.025);
        assertEquals(4, boxes.size());
        assertEquals(new Box(0, 990, 100, 1000), boxes.get(3));
        assertCovers(boxes, 1000, 100);
    }

    @Test
    public void tinyBudgetGivesSingleLines() {
        List<Box> boxes = BlockScheduler.splitIntoBoxes(10, 5, 12, 12, 1e-9);
        assertEquals(12, boxes.size());
        for (Box box : boxes) {
            assertEquals(1, box.getLength());
        }
        assertCovers(boxes, 12, 12);
    }

    @Test
    public void fewerLinesThanRoundingStep() {
        List<Box> boxes = BlockScheduler.splitIntoBoxes(10, 5, 37, 3, 1e-8);
        assertCovers(boxes, 37, 3);
    }

    @Test(expected = IllegalArgumentException.class)
    public void nonPositiveBudget() {
        BlockScheduler.splitIntoBoxes(10, 5, 12, 12, 0);
    }
}
