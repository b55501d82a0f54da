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
package com.samsung.sra.closurephase.tools;

import com.samsung.sra.arraystore.Box;
import com.samsung.sra.closurephase.stack.InterferogramStack;
import com.samsung.sra.closurephase.stack.SyntheticStack;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.nio.file.Files;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.*;

public class GenerateSyntheticStackTest {
    private File dir;

    @Before
    public void setUp() throws Exception {
        dir = Files.createTempDirectory("synthetic").toFile();
    }

    @After
    public void tearDown() throws Exception {
        FileUtils.deleteDirectory(dir);
    }

    @Test
    public void parsesNetworkAndBias() throws Exception {
        Namespace parsed = GenerateSyntheticStack.buildParser().parseArgs(new String[]{
                "out", "-N", "6", "--bw", "2", "--max-connection", "3", "--length", "8", "--width", "8",
                "--bias", "0, 0.1,0.2", "--bias-patch", "1,1,4,4"});
        SyntheticStack synthetic = GenerateSyntheticStack.toSyntheticStack(parsed);
        assertThat(synthetic.getDates().size(), is(6));
        assertThat(synthetic.getDates().get(1), is("20200113"));
        assertThat(synthetic.getDatePairs().size(), is(5 + 4 + 3));

        try (InterferogramStack stack = synthetic.build(null)) {
            assertEquals(12, stack.getNumIfgrams(false));
            assertEquals(9, stack.getNumIfgrams(true));
            float[][][] phase = stack.readPhase(new Box(0, 0, 8, 8));
            // first pair is connection 1: 0.25 background plus 0.1 bias inside the patch
            assertEquals(0.35, phase[0][2][2], 1e-6);
            assertEquals(0.25, phase[0][6][6], 1e-6);
        }
    }

    @Test(expected = ArgumentParserException.class)
    public void rejectsMalformedNumberList() throws Exception {
        GenerateSyntheticStack.buildParser().parseArgs(new String[]{"out", "--bias", "0,x"});
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsShortPatch() throws Exception {
        Namespace parsed = GenerateSyntheticStack.buildParser().parseArgs(new String[]{
                "out", "--bias", "0,0.1", "--bias-patch", "1,1,4"});
        GenerateSyntheticStack.toSyntheticStack(parsed);
    }

    @Test
    public void helpScreen() {
        GenerateSyntheticStack.main(new String[]{"--help"});
        assertFalse(new File(dir, "out").exists());
    }

    @Test
    public void writesStackToDisk() throws Exception {
        File out = new File(dir, "stack");
        GenerateSyntheticStack.main(new String[]{out.getPath(), "-N", "5", "--bw", "2"});
        try (InterferogramStack stack = InterferogramStack.open(out.getPath())) {
            assertEquals(5, stack.getDateList(true).size());
            assertEquals(7, stack.getNumIfgrams(true));
            assertEquals(12, stack.getLength());
        }
    }
}
