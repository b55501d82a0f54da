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
package com.samsung.sra.closurephase.mask;

import com.samsung.sra.arraystore.Box;
import com.samsung.sra.closurephase.block.BlockScheduler;
import com.samsung.sra.closurephase.closure.ComplexRaster;
import com.samsung.sra.closurephase.stack.InterferogramStack;
import com.samsung.sra.closurephase.stack.SyntheticStack;
import org.junit.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class MaskGeneratorTest {
    @Test
    public void phaseThreshold() {
        assertEquals(Math.PI / Math.sqrt(3) * 3, MaskGenerator.phaseThreshold(1, 3), 1e-12);
        assertEquals(Math.PI / 30, MaskGenerator.phaseThreshold(300, 1), 1e-12);
    }

    @Test
    public void amplitudeAtThresholdIsUnmasked() {
        ComplexRaster avg = new ComplexRaster(1, 3);
        // angle pi/2, far above the phase threshold of 100 triplets
        avg.set(0, 0, 0, 0.3);
        avg.set(0, 1, 0, 0.30001);
        avg.set(0, 2, 0.9, 0.1);
        boolean[][] mask = MaskGenerator.threshold(avg, 100, 3, 0.3);
        assertTrue(mask[0][0]);
        assertFalse(mask[0][1]);
        assertTrue(mask[0][2]);
    }

    @Test
    public void flagsBiasedPatch() throws Exception {
        // level-2 closure phase of 1.6 rad inside the patch, above pi / 3
        try (InterferogramStack stack = new SyntheticStack().setBias(new Box(3, 3, 9, 9), 0, 0.8).build(null)) {
            MaskGenerator.Result result = new MaskGenerator(stack)
                    .generate(2, 1, 0.3, Collections.singletonList(Box.full(12, 12)));
            assertEquals(3, result.numTriplets);
            assertFalse(result.mask[5][5]);
            assertFalse(result.mask[8][3]);
            assertTrue(result.mask[0][0]);
            assertTrue(result.mask[5][9]);
            assertEquals(1.6, result.phase[5][5], 1e-5);
            assertEquals(1, result.amplitude[5][5], 1e-5);
            assertEquals(0, result.phase[0][0], 1e-6);
        }
    }

    @Test
    public void blocksMatchFullRaster() throws Exception {
        try (InterferogramStack stack = new SyntheticStack().setBias(new Box(2, 4, 7, 10), 0, 0.8, 0.1).build(null)) {
            MaskGenerator generator = new MaskGenerator(stack);
            MaskGenerator.Result full = generator.generate(2, 1, 0.3, Collections.singletonList(Box.full(12, 12)));
            List<Box> boxes = BlockScheduler.splitIntoBoxes(stack, 1e-9);
            assertEquals(12, boxes.size());
            MaskGenerator.Result tiled = generator.generate(2, 1, 0.3, boxes);
            for (int y = 0; y < 12; ++y) {
                assertArrayEquals(full.mask[y], tiled.mask[y]);
                assertArrayEquals(full.phase[y], tiled.phase[y], 0);
                assertArrayEquals(full.amplitude[y], tiled.amplitude[y], 0);
            }
        }
    }
}
