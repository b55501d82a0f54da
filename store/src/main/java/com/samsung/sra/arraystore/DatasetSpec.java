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
package com.samsung.sra.arraystore;

import java.io.Serializable;

/** Name, element type and (bands, length, width) shape of one dataset. 2D datasets have a single band. */
public final class DatasetSpec implements Serializable {
    public final String name;
    public final DataType type;
    public final int bands, length, width;

    public DatasetSpec(String name, DataType type, int bands, int length, int width) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("dataset name must be non-empty");
        }
        if (bands <= 0 || length <= 0 || width <= 0) {
            throw new IllegalArgumentException("invalid shape for dataset " + name + ": "
                    + bands + " x " + length + " x " + width);
        }
        this.name = name;
        this.type = type;
        this.bands = bands;
        this.length = length;
        this.width = width;
    }

    public static DatasetSpec float32(String name, int bands, int length, int width) {
        return new DatasetSpec(name, DataType.FLOAT32, bands, length, width);
    }

    public static DatasetSpec float32(String name, int length, int width) {
        return float32(name, 1, length, width);
    }

    public static DatasetSpec bool(String name, int length, int width) {
        return new DatasetSpec(name, DataType.BOOL, 1, length, width);
    }

    /** Bytes needed to hold the dataset in memory */
    public long getSizeInBytes() {
        return (long) bands * length * width * type.getBytesPerPixel();
    }

    @Override
    public String toString() {
        return String.format("%s[%s: %d x %d x %d]", name, type, bands, length, width);
    }
}
