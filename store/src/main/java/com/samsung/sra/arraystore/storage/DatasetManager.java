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

import com.samsung.sra.arraystore.Box;
import com.samsung.sra.arraystore.DataType;
import com.samsung.sra.arraystore.DatasetSpec;

/**
 * Reads and writes rectangular blocks of one dataset by touching only the rows the block covers. Writes narrower than
 * the full raster width merge into the existing row.
 */
public class DatasetManager {
    private final BackingStore backingStore;
    private final int datasetID;
    private final DatasetSpec spec;
    private final SerDe serDe;

    public DatasetManager(BackingStore backingStore, int datasetID, DatasetSpec spec) {
        this.backingStore = backingStore;
        this.datasetID = datasetID;
        this.spec = spec;
        this.serDe = new SerDe(spec.type, spec.width);
    }

    public DatasetSpec getSpec() {
        return spec;
    }

    public float[][] readFloats(int band, Box box) throws BackingStoreException {
        assert spec.type == DataType.FLOAT32;
        float[][] block = new float[box.getLength()][box.getWidth()];
        for (int y = box.y0; y < box.y1; ++y) {
            float[] row = serDe.deserializeFloats(backingStore.getRow(datasetID, band, y));
            System.arraycopy(row, box.x0, block[y - box.y0], 0, box.getWidth());
        }
        return block;
    }

    public void writeFloats(int band, Box box, float[][] block) throws BackingStoreException {
        assert spec.type == DataType.FLOAT32;
        boolean fullRow = box.x0 == 0 && box.x1 == spec.width;
        for (int y = box.y0; y < box.y1; ++y) {
            float[] row = fullRow
                    ? new float[spec.width]
                    : serDe.deserializeFloats(backingStore.getRow(datasetID, band, y));
            System.arraycopy(block[y - box.y0], 0, row, box.x0, box.getWidth());
            backingStore.putRow(datasetID, band, y, serDe.serializeFloats(row));
        }
    }

    public boolean[][] readBools(Box box) throws BackingStoreException {
        assert spec.type == DataType.BOOL;
        boolean[][] block = new boolean[box.getLength()][box.getWidth()];
        for (int y = box.y0; y < box.y1; ++y) {
            boolean[] row = serDe.deserializeBools(backingStore.getRow(datasetID, 0, y));
            System.arraycopy(row, box.x0, block[y - box.y0], 0, box.getWidth());
        }
        return block;
    }

    public void writeBools(Box box, boolean[][] block) throws BackingStoreException {
        assert spec.type == DataType.BOOL;
        boolean fullRow = box.x0 == 0 && box.x1 == spec.width;
        for (int y = box.y0; y < box.y1; ++y) {
            boolean[] row = fullRow
                    ? new boolean[spec.width]
                    : serDe.deserializeBools(backingStore.getRow(datasetID, 0, y));
            System.arraycopy(block[y - box.y0], 0, row, box.x0, box.getWidth());
            backingStore.putRow(datasetID, 0, y, serDe.serializeBools(row));
        }
    }
}
