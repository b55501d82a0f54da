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

import com.samsung.sra.arraystore.Utilities;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RocksDBBackingStore extends BackingStore {
    private static final Logger logger = LoggerFactory.getLogger(RocksDBBackingStore.class);

    private final RocksDB rocksDB;
    private final Options rocksDBOptions;
    private final WriteOptions rocksDBWriteOptions;

    /**
     * @param rocksPath  on-disk path
     * @throws BackingStoreException  wrapping RocksDBException
     */
    public RocksDBBackingStore(String rocksPath, boolean readonly) throws BackingStoreException {
        rocksDBOptions = new Options()
                .setCreateIfMissing(true)
                .setMaxOpenFiles(-1);
        rocksDBWriteOptions = new WriteOptions();
        try {
            rocksDB = readonly
                    ? RocksDB.openReadOnly(rocksDBOptions, rocksPath)
                    : RocksDB.open(rocksDBOptions, rocksPath);
        } catch (RocksDBException e) {
            rocksDBOptions.close();
            rocksDBWriteOptions.close();
            throw new BackingStoreException("could not open " + rocksPath, e);
        }
    }

    static {
        RocksDB.loadLibrary();
    }

    private static final int KEY_SIZE = 12;

    /** RocksDB key = <datasetID, band, row>, so each band of a dataset is laid out in row order */
    private static byte[] getRocksDBKey(int datasetID, int band, int row) {
        byte[] keyArray = new byte[KEY_SIZE];
        Utilities.intToByteArray(datasetID, keyArray, 0);
        Utilities.intToByteArray(band, keyArray, 4);
        Utilities.intToByteArray(row, keyArray, 8);
        return keyArray;
    }

    @Override
    byte[] getRow(int datasetID, int band, int row) throws BackingStoreException {
        try {
            return rocksDB.get(getRocksDBKey(datasetID, band, row));
        } catch (RocksDBException e) {
            throw new BackingStoreException(e);
        }
    }

    @Override
    void putRow(int datasetID, int band, int row, byte[] value) throws BackingStoreException {
        try {
            rocksDB.put(rocksDBWriteOptions, getRocksDBKey(datasetID, band, row), value);
        } catch (RocksDBException e) {
            throw new BackingStoreException(e);
        }
    }

    private static final int AUX_KEY_MIN_SIZE = KEY_SIZE + 1;

    private static byte[] getAuxRocksKey(String auxKey) {
        // "AUX" + enough zeroes to fill AUX_KEY_MIN_SIZE + auxKey
        byte[] auxKeyBytes = auxKey.getBytes();
        byte[] key = new byte[AUX_KEY_MIN_SIZE + auxKeyBytes.length];
        key[0] = 'A'; key[1] = 'U'; key[2] = 'X';
        System.arraycopy(auxKeyBytes, 0, key, AUX_KEY_MIN_SIZE, auxKeyBytes.length);
        return key;
    }

    @Override
    public byte[] getAux(String key) throws BackingStoreException {
        try {
            return rocksDB.get(getAuxRocksKey(key));
        } catch (RocksDBException e) {
            throw new BackingStoreException(e);
        }
    }

    @Override
    public void putAux(String key, byte[] value) throws BackingStoreException {
        try {
            rocksDB.put(rocksDBWriteOptions, getAuxRocksKey(key), value);
        } catch (RocksDBException e) {
            throw new BackingStoreException(e);
        }
    }

    @Override
    public void close() throws BackingStoreException {
        if (rocksDB != null) rocksDB.close();
        rocksDBWriteOptions.close();
        rocksDBOptions.close();
        logger.debug("rocksDB closed");
    }
}
