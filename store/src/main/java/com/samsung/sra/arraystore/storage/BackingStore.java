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

/**
 * Underlying key-value store holding every raster row of every dataset in a container, addressed by
 * (datasetID, band, row). Most code should not talk to BackingStore directly and should go through ArrayStore instead.
 */
public abstract class BackingStore implements AutoCloseable {
    /** Encoded row, or null if the row was never written */
    abstract byte[] getRow(int datasetID, int band, int row) throws BackingStoreException;

    abstract void putRow(int datasetID, int band, int row, byte[] value) throws BackingStoreException;

    abstract public byte[] getAux(String key) throws BackingStoreException;

    abstract public void putAux(String key, byte[] value) throws BackingStoreException;

    @Override
    abstract public void close() throws BackingStoreException;
}
