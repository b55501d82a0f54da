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

import com.samsung.sra.arraystore.DataType;

import java.nio.ByteBuffer;

/** Encodes one raster row of a dataset. FLOAT32 rows are big-endian IEEE floats, BOOL rows one byte per pixel. */
class SerDe {
    private final DataType type;
    private final int width;

    SerDe(DataType type, int width) {
        this.type = type;
        this.width = width;
    }

    byte[] serializeFloats(float[] row) {
        assert type == DataType.FLOAT32 && row.length == width;
        ByteBuffer buffer = ByteBuffer.allocate(width * 4);
        for (float v : row) {
            buffer.putFloat(v);
        }
        return buffer.array();
    }

    /** A row that was never written reads back as zeros */
    float[] deserializeFloats(byte[] bytes) {
        float[] row = new float[width];
        if (bytes != null) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            for (int x = 0; x < width; ++x) {
                row[x] = buffer.getFloat();
            }
        }
        return row;
    }

    byte[] serializeBools(boolean[] row) {
        assert type == DataType.BOOL && row.length == width;
        byte[] bytes = new byte[width];
        for (int x = 0; x < width; ++x) {
            bytes[x] = row[x] ? (byte) 1 : (byte) 0;
        }
        return bytes;
    }

    boolean[] deserializeBools(byte[] bytes) {
        boolean[] row = new boolean[width];
        if (bytes != null) {
            for (int x = 0; x < width; ++x) {
                row[x] = bytes[x] != 0;
            }
        }
        return row;
    }
}
