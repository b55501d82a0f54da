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
import org.junit.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.hamcrest.CoreMatchers.containsString;
import static org.junit.Assert.*;

public class WorkerPoolTest {
    private static List<Box> rows(int length, int width) {
        List<Box> boxes = new ArrayList<>();
        for (int y = 0; y < length; ++y) {
            boxes.add(new Box(0, y, width, y + 1));
        }
        return boxes;
    }

    @Test
    public void resultsWrittenOnCallingThread() throws Exception {
        Thread caller = Thread.currentThread();
        float[][] out = new float[20][4];
        Set<Box> seen = new HashSet<>();
        try (WorkerPool pool = new WorkerPool(3)) {
            pool.open();
            pool.run(box -> new float[][][]{{{box.y0, box.y0, box.y0, box.y0}}}, rows(20, 4), (box, result) -> {
                assertSame(caller, Thread.currentThread());
                assertTrue(seen.add(box));
                out[box.y0] = result[0][0];
            });
        }
        assertEquals(20, seen.size());
        for (int y = 0; y < 20; ++y) {
            assertEquals(y, out[y][3], 0);
        }
    }

    @Test
    public void failingBlockAbortsRun() {
        Box bad = new Box(0, 7, 4, 8);
        try (WorkerPool pool = new WorkerPool(2)) {
            pool.open();
            pool.run(box -> {
                if (box.equals(bad)) {
                    throw new IllegalStateException("no data");
                }
                return new float[1][1][4];
            }, rows(20, 4), (box, result) -> {});
            fail("expected ClosurePhaseException");
        } catch (ClosurePhaseException e) {
            assertEquals(bad, e.getBox());
            assertThat(e.getMessage(), containsString("no data"));
            assertTrue(e.getCause() instanceof IllegalStateException);
        }
    }

    @Test
    public void failingSinkAbortsRun() {
        try (WorkerPool pool = new WorkerPool(2)) {
            pool.open();
            pool.run(box -> new float[1][1][4], rows(5, 4), (box, result) -> {
                throw new java.io.IOException("disk full");
            });
            fail("expected ClosurePhaseException");
        } catch (ClosurePhaseException e) {
            assertNotNull(e.getBox());
            assertThat(e.getMessage(), containsString("disk full"));
        }
    }

    @Test(expected = IllegalStateException.class)
    public void runBeforeOpen() throws Exception {
        new WorkerPool(1).run(box -> null, rows(1, 1), (box, result) -> {});
    }

    @Test
    public void threadPinning() {
        int original = LinearAlgebraThreads.get();
        int previous = LinearAlgebraThreads.setThreads(1);
        try {
            assertEquals(original, previous);
            assertEquals(1, LinearAlgebraThreads.get());
        } finally {
            LinearAlgebraThreads.restoreThreads(previous);
        }
        assertEquals(original, LinearAlgebraThreads.get());
    }
}
