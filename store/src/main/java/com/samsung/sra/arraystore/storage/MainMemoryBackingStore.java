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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class MainMemoryBackingStore extends BackingStore {
    /** Map datasetID -> (band, row) -> encoded row */
    private final Map<Integer, ConcurrentHashMap<Long, byte[]>> rows = new ConcurrentHashMap<>();
    private final Map<String, byte[]> auxData = new ConcurrentHashMap<>();

    private static long rowKey(int band, int row) {
        return ((long) band << 32) | (row & 0xFFFFFFFFL);
    }

    @Override
    byte[] getRow(int datasetID, int band, int row) {
        Map<Long, byte[]> dataset = rows.get(datasetID);
        return dataset == null ? null : dataset.get(rowKey(band, row));
    }

    @Override
    void putRow(int datasetID, int band, int row, byte[] value) {
        rows.computeIfAbsent(datasetID, id -> new ConcurrentHashMap<>()).put(rowKey(band, row), value);
    }

    @Override
    public byte[] getAux(String key) {
        return auxData.get(key);
    }

    @Override
    public void putAux(String key, byte[] value) {
        auxData.put(key, value);
    }

    @Override
    public void close() {
        rows.clear();
    }
}
