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
package com.samsung.sra.arraystore.storage;

import com.samsung.sra.arraystore.ArrayStore;
import com.samsung.sra.arraystore.Box;
import com.samsung.sra.arraystore.DatasetException;
import com.samsung.sra.arraystore.DatasetSpec;
import com.samsung.sra.arraystore.Metadata;
import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.nio.file.Files;

import static org.junit.Assert.*;

public class RocksDBBackingStoreTest {
    private File dir;

    @Before
    public void setUp() throws Exception {
        dir = Files.createTempDirectory("arraystore").toFile();
    }

    @After
    public void tearDown() throws Exception {
        FileUtils.deleteDirectory(dir);
    }

    @Test
    public void persistsAcrossReopen() throws Exception {
        String loc = dir.getAbsolutePath() + "/container";
        assertFalse(ArrayStore.exists(loc));
        try (ArrayStore store = new ArrayStore(loc)) {
            store.layout(new Metadata(4, 3, 0.2, 0, 0, "ifgramStack"),
                    DatasetSpec.float32("phase", 2, 4, 3),
                    DatasetSpec.bool("mask", 4, 3));
            store.writeBlock("phase", new float[][]{{1.5f, 2.5f}}, 1, new Box(1, 2, 3, 3));
            store.writeMask("mask", new boolean[][]{{true, false, true}, {false, false, false},
                    {false, true, false}, {false, false, true}});
            store.putAux("complete", new byte[]{1});
        }
        assertTrue(ArrayStore.exists(loc));

        try (ArrayStore store = new ArrayStore(loc, new ArrayStore.StoreOptions().setReadOnly(true))) {
            assertEquals("ifgramStack", store.getMetadata().getFileType());
            assertEquals(0.2, store.getMetadata().getWavelength(), 0);
            float[][] band = store.read("phase", 1, null);
            assertEquals(0f, band[2][0], 0f);
            assertEquals(1.5f, band[2][1], 0f);
            assertEquals(2.5f, band[2][2], 0f);
            assertEquals(0f, store.read("phase", 0, null)[2][1], 0f);
            boolean[][] mask = store.readMask("mask", new Box(1, 2, 3, 4));
            assertTrue(mask[0][0]);
            assertTrue(mask[1][1]);
            assertFalse(mask[1][0]);
            assertArrayEquals(new byte[]{1}, store.getAux("complete"));
            try {
                store.putAux("complete", new byte[]{0});
                fail();
            } catch (DatasetException expected) {
            }
        }
    }
}
