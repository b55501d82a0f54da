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
import com.samsung.sra.arraystore.Utilities;
import com.samsung.sra.closurephase.ratio.DecayRatioEstimator;
import com.samsung.sra.closurephase.stack.InterferogramStack;
import com.samsung.sra.closurephase.stack.SyntheticStack;
import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.nio.file.Files;
import java.util.List;

import static org.junit.Assert.*;

public class ClosurePhaseBiasTest {
    private static final double WAVELENGTH = 0.0555;
    private static final double BETA = 0.2;
    private static final Box PATCH = new Box(3, 3, 9, 9);
    private static final int L = 12, W = 12;

    private File dir;

    @Before
    public void setUp() throws Exception {
        dir = Files.createTempDirectory("closurephase").toFile();
    }

    @After
    public void tearDown() throws Exception {
        FileUtils.deleteDirectory(dir);
    }

    private static SyntheticStack synthetic(double... biasPerLevel) {
        return new SyntheticStack().setNumDates(5).setBandwidth(2).setMaxConnection(4).setSize(L, W)
                .setWavelength(WAVELENGTH).setBias(PATCH, biasPerLevel);
    }

    /** In-memory outputs, reference level 4, bandwidth 2 */
    private static BiasOptions options() {
        return new BiasOptions().setReferenceLevel(4).setBandwidth(2).setOutdir(null);
    }

    private static double coef() {
        return DecayRatioEstimator.phaseToRangeCoefficient(WAVELENGTH);
    }

    private static float[][][] readAll(ClosurePhaseBias bias, String file, String dataset) throws Exception {
        return bias.getOutput(file).read(dataset, null);
    }

    @Test
    public void zeroBias() throws Exception {
        try (InterferogramStack stack = synthetic().build(null);
             ClosurePhaseBias bias = new ClosurePhaseBias(stack, options())) {
            bias.run(ClosurePhaseBias.Action.MASK);
            boolean[][] mask = bias.getOutput(ClosurePhaseBias.MASK_FILE).readMask(ClosurePhaseBias.MASK, null);
            for (boolean[] row : mask) {
                for (boolean m : row) {
                    assertTrue(m);
                }
            }

            bias.run(ClosurePhaseBias.Action.ESTIMATE);
            bias.run(ClosurePhaseBias.Action.QUICK_ESTIMATE);
            for (String file : new String[]{ClosurePhaseBias.BIAS_FILE, ClosurePhaseBias.BIAS_APPROX_FILE}) {
                float[][][] ts = readAll(bias, file, ClosurePhaseBias.TIMESERIES);
                assertEquals(5, ts.length);
                for (float[][] band : ts) {
                    for (float[] row : band) {
                        for (float b : row) {
                            assertEquals(0, b, 1e-9);
                        }
                    }
                }
            }
            // no significant bias velocity anywhere
            float[][][] wratio = readAll(bias, ClosurePhaseBias.WRATIO_FILE, ClosurePhaseBias.WRATIO);
            assertEquals(2, wratio.length);
            assertTrue(Float.isNaN(wratio[0][5][5]));
        }
    }

    @Test
    public void injectedBiasRecovered() throws Exception {
        try (InterferogramStack stack = synthetic(0, BETA, BETA).build(null);
             ClosurePhaseBias bias = new ClosurePhaseBias(stack, options())) {
            bias.run(ClosurePhaseBias.Action.ESTIMATE);
            ArrayStore out = bias.getOutput(ClosurePhaseBias.BIAS_FILE);
            float[][] last = out.read(ClosurePhaseBias.TIMESERIES, 4, null);
            double expected = (8 * BETA + 10 * BETA) / 7 / coef() / 100;
            assertEquals(expected, last[5][5], Math.abs(expected) * 0.01);
            assertEquals(0, last[0][0], 1e-9);
            assertEquals(0, last[11][11], 1e-9);

            List<String> dates = Utilities.deserialize(out.getAux(ClosurePhaseBias.DATES_AUX));
            assertEquals(stack.getDateList(true), dates);
            assertEquals("timeseries", out.getMetadata().getFileType());
            assertEquals("m", out.getMetadata().getAttribute("UNIT"));
        }
    }

    @Test
    public void injectedBiasWithoutLevelTwoClosurePhase() throws Exception {
        try (InterferogramStack stack = synthetic(0, BETA, 2 * BETA).build(null);
             ClosurePhaseBias bias = new ClosurePhaseBias(stack, options())) {
            bias.run(ClosurePhaseBias.Action.ESTIMATE);
            float[][] last = bias.getOutput(ClosurePhaseBias.BIAS_FILE).read(ClosurePhaseBias.TIMESERIES, 4, null);
            double expected = 4 * BETA / coef() / 100;
            assertEquals(expected, last[5][5], Math.abs(expected) * 0.01);
        }
    }

    @Test
    public void quickEstimate() throws Exception {
        try (InterferogramStack stack = synthetic(0, BETA, BETA).build(null);
             ClosurePhaseBias bias = new ClosurePhaseBias(stack, options())) {
            bias.run(ClosurePhaseBias.Action.QUICK_ESTIMATE);
            float[][][] wratio = readAll(bias, ClosurePhaseBias.WRATIO_FILE, ClosurePhaseBias.WRATIO);
            float[][][] velocity = readAll(bias, ClosurePhaseBias.WRATIO_FILE, ClosurePhaseBias.BIAS_VELOCITY);
            assertEquals(1, wratio[0][5][5], 0);
            assertEquals(0.5, wratio[1][5][5], 1e-5);
            assertTrue(Float.isNaN(wratio[1][0][0]));
            double velRef = 4 * BETA / coef() / (48 / 365.25);
            assertEquals(velRef, velocity[0][5][5], Math.abs(velRef) * 1e-4);
            assertEquals(velRef / 2, velocity[1][5][5], Math.abs(velRef) * 1e-4);

            float[][] last = bias.getOutput(ClosurePhaseBias.BIAS_APPROX_FILE)
                    .read(ClosurePhaseBias.TIMESERIES, 4, null);
            double expected = 4 * BETA / coef() / 100;
            assertEquals(expected, last[5][5], Math.abs(expected) * 0.01);
        }
    }

    @Test
    public void tiledAndParallelRunsMatchSingleBlock() throws Exception {
        try (InterferogramStack stack = synthetic(0, BETA, 0.7 * BETA, 0.1).build(null)) {
            float[][][] single, tiled, parallel;
            boolean[][] singleMask, tiledMask;
            try (ClosurePhaseBias bias = new ClosurePhaseBias(stack, options().setMaxMemory(1000))) {
                bias.run(ClosurePhaseBias.Action.MASK);
                bias.run(ClosurePhaseBias.Action.ESTIMATE);
                single = readAll(bias, ClosurePhaseBias.BIAS_FILE, ClosurePhaseBias.TIMESERIES);
                singleMask = bias.getOutput(ClosurePhaseBias.MASK_FILE).readMask(ClosurePhaseBias.MASK, null);
            }
            try (ClosurePhaseBias bias = new ClosurePhaseBias(stack, options().setMaxMemory(1e-9))) {
                bias.run(ClosurePhaseBias.Action.MASK);
                bias.run(ClosurePhaseBias.Action.ESTIMATE);
                tiled = readAll(bias, ClosurePhaseBias.BIAS_FILE, ClosurePhaseBias.TIMESERIES);
                tiledMask = bias.getOutput(ClosurePhaseBias.MASK_FILE).readMask(ClosurePhaseBias.MASK, null);
            }
            try (ClosurePhaseBias bias = new ClosurePhaseBias(stack,
                    options().setMaxMemory(1e-9).setNumWorkers(3))) {
                bias.run(ClosurePhaseBias.Action.ESTIMATE);
                parallel = readAll(bias, ClosurePhaseBias.BIAS_FILE, ClosurePhaseBias.TIMESERIES);
            }
            assertTrue(single[4][5][5] != 0);
            for (int i = 0; i < single.length; ++i) {
                for (int y = 0; y < L; ++y) {
                    assertArrayEquals(single[i][y], tiled[i][y], 0);
                    assertArrayEquals(single[i][y], parallel[i][y], 0);
                }
            }
            for (int y = 0; y < L; ++y) {
                assertArrayEquals(singleMask[y], tiledMask[y]);
            }
        }
    }

    @Test
    public void missingArtifactsWithoutUpdate() throws Exception {
        try (InterferogramStack stack = synthetic(0, BETA, BETA).build(null);
             ClosurePhaseBias bias = new ClosurePhaseBias(stack,
                     options().setOutdir(dir.getAbsolutePath()).setUpdate(false))) {
            bias.run(ClosurePhaseBias.Action.ESTIMATE);
            fail("expected ClosurePhaseException");
        } catch (ClosurePhaseException e) {
            assertEquals(2, e.getConnectionLevel());
        }
    }

    @Test
    public void reusesArtifactsOnDisk() throws Exception {
        String outdir = new File(dir, "out").getAbsolutePath();
        try (InterferogramStack stack = synthetic(0, BETA, BETA).build(new File(dir, "stack").getAbsolutePath())) {
            float[][] first;
            try (ClosurePhaseBias bias = new ClosurePhaseBias(stack, options().setOutdir(outdir))) {
                bias.run(ClosurePhaseBias.Action.ESTIMATE);
                first = bias.getOutput(ClosurePhaseBias.BIAS_FILE).read(ClosurePhaseBias.TIMESERIES, 4, null);
                for (int n : new int[]{2, 4}) {
                    assertTrue(ArrayStore.exists(bias.getCache().getLevelDirectory(n)));
                }
                assertFalse(ArrayStore.exists(bias.getCache().getLevelDirectory(3)));
            }
            assertTrue(ArrayStore.exists(new File(outdir, ClosurePhaseBias.BIAS_FILE).getPath()));

            try (ClosurePhaseBias bias = new ClosurePhaseBias(stack, options().setOutdir(outdir).setUpdate(false))) {
                bias.run(ClosurePhaseBias.Action.ESTIMATE);
                float[][] second = bias.getOutput(ClosurePhaseBias.BIAS_FILE).read(ClosurePhaseBias.TIMESERIES, 4, null);
                for (int y = 0; y < L; ++y) {
                    assertArrayEquals(first[y], second[y], 0);
                }
            }
        }
    }

    @Test
    public void actionNames() {
        assertEquals(ClosurePhaseBias.Action.QUICK_ESTIMATE, ClosurePhaseBias.Action.fromName("quick_estimate"));
        assertEquals("estimate", ClosurePhaseBias.Action.ESTIMATE.getName());
        try {
            ClosurePhaseBias.Action.fromName("correct");
            fail();
        } catch (IllegalArgumentException expected) {
        }
    }
}
