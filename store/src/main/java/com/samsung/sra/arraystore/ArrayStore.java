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

import com.samsung.sra.arraystore.storage.BackingStore;
import com.samsung.sra.arraystore.storage.BackingStoreException;
import com.samsung.sra.arraystore.storage.DatasetManager;
import com.samsung.sra.arraystore.storage.MainMemoryBackingStore;
import com.samsung.sra.arraystore.storage.RocksDBBackingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Start here. A self-describing container of named 3D (band, row, column) raster datasets plus container-level
 * {@link Metadata}. Every read and write is addressed by a {@link Box} and touches only the rows inside it.
 *
 * Writes are serialized internally; concurrent readers are fine.
 */
public class ArrayStore implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ArrayStore.class);
    private static final String EXTERNAL_AUX_PREFIX = "EXTERNAL_";
    private static final String ROCKSDB_SUBDIR = "/rocksdb";

    private final BackingStore backingStore;
    private final String directory;
    private final StoreOptions storeOptions;

    private Metadata metadata;
    /** Declaration order defines the dataset IDs used as backing store keys */
    private LinkedHashMap<String, DatasetSpec> specs;
    private final Map<String, DatasetManager> managers = new LinkedHashMap<>();

    public static class StoreOptions implements Serializable {
        private boolean readonly = false;

        /** Open store in read-only mode. Default false. */
        public StoreOptions setReadOnly(boolean readonly) {
            this.readonly = readonly;
            return this;
        }

        public boolean getReadOnly() {
            return readonly;
        }
    }

    /**
     * @param directory  Directory to keep the container in. Set to null to use a transient in-memory container
     */
    public ArrayStore(String directory, StoreOptions storeOptions) throws BackingStoreException {
        this.storeOptions = storeOptions;
        if (directory != null) {
            File dir = new File(directory);
            if (!dir.exists()) {
                if (storeOptions.readonly) {
                    throw new BackingStoreException("container " + directory + " does not exist");
                }
                if (!dir.mkdirs()) {
                    throw new BackingStoreException("could not create directory " + directory);
                }
            }
            this.backingStore = new RocksDBBackingStore(directory + ROCKSDB_SUBDIR, storeOptions.readonly);
            this.directory = directory;
        } else {
            this.backingStore = new MainMemoryBackingStore();
            this.directory = null;
        }
        deserializeMetadata();
    }

    /** Open a container with default options. */
    public ArrayStore(String directory) throws BackingStoreException {
        this(directory, new StoreOptions());
    }

    /** Does directory hold a container? */
    public static boolean exists(String directory) {
        return directory != null && new File(directory + ROCKSDB_SUBDIR).isDirectory();
    }

    public String getDirectory() {
        return directory;
    }

    /**
     * Declare (pre-allocate) datasets without writing data. Cells never written read back as 0 / false. Redeclaring a
     * dataset with the same shape and type is a no-op.
     */
    public synchronized void layout(Metadata metadata, DatasetSpec... datasets)
            throws DatasetException, BackingStoreException {
        checkWritable();
        if (this.metadata != null && (this.metadata.getLength() != metadata.getLength()
                || this.metadata.getWidth() != metadata.getWidth())) {
            throw new DatasetException("cannot change raster size of existing container from "
                    + this.metadata.getLength() + " x " + this.metadata.getWidth()
                    + " to " + metadata.getLength() + " x " + metadata.getWidth());
        }
        for (DatasetSpec spec : datasets) {
            if (spec.length != metadata.getLength() || spec.width != metadata.getWidth()) {
                throw new DatasetException("dataset " + spec + " does not match raster size "
                        + metadata.getLength() + " x " + metadata.getWidth());
            }
            DatasetSpec existing = specs.get(spec.name);
            if (existing != null && (existing.type != spec.type || existing.bands != spec.bands)) {
                throw new DatasetException("dataset " + spec.name + " already declared as " + existing);
            }
        }
        this.metadata = metadata;
        for (DatasetSpec spec : datasets) {
            if (!specs.containsKey(spec.name)) {
                managers.put(spec.name, new DatasetManager(backingStore, specs.size(), spec));
                specs.put(spec.name, spec);
                logger.debug("declared dataset {}", spec);
            }
        }
        serializeMetadata();
    }

    /** Replace the container metadata, e.g. to record a new reference pixel. Raster size must not change. */
    public synchronized void setMetadata(Metadata metadata) throws DatasetException, BackingStoreException {
        layout(metadata);
    }

    public Metadata getMetadata() {
        return metadata;
    }

    public boolean hasDataset(String name) {
        return specs.containsKey(name);
    }

    public DatasetSpec getDatasetSpec(String name) throws DatasetException {
        return getManager(name).getSpec();
    }

    public List<String> getDatasetNames() {
        return Collections.unmodifiableList(new ArrayList<>(specs.keySet()));
    }

    /** Write a whole FLOAT32 dataset, data[band][row][column] */
    public void write(String name, float[][][] data) throws DatasetException, BackingStoreException {
        DatasetSpec spec = getManager(name).getSpec();
        if (data.length != spec.bands) {
            throw new DatasetException("got " + data.length + " bands for " + spec);
        }
        writeBlock(name, data, 0, Box.full(spec.length, spec.width));
    }

    /** Write a whole single-band FLOAT32 dataset */
    public void write(String name, float[][] data) throws DatasetException, BackingStoreException {
        write(name, new float[][][]{data});
    }

    /**
     * Write data[b] into band band0 + b of dataset name, at the offset given by box. Each data[b] must be exactly
     * box-shaped.
     */
    public synchronized void writeBlock(String name, float[][][] data, int band0, Box box)
            throws DatasetException, BackingStoreException {
        checkWritable();
        DatasetManager manager = getManager(name);
        DatasetSpec spec = manager.getSpec();
        checkType(spec, DataType.FLOAT32);
        checkBox(spec, box);
        if (band0 < 0 || band0 + data.length > spec.bands) {
            throw new DatasetException("bands [" + band0 + ", " + (band0 + data.length) + ") out of range for " + spec);
        }
        for (float[][] band : data) {
            checkShape(name, band.length, band.length == 0 ? 0 : band[0].length, box);
        }
        for (int b = 0; b < data.length; ++b) {
            manager.writeFloats(band0 + b, box, data[b]);
        }
    }

    public void writeBlock(String name, float[][] data, int band, Box box)
            throws DatasetException, BackingStoreException {
        writeBlock(name, new float[][][]{data}, band, box);
    }

    public void writeMask(String name, boolean[][] mask) throws DatasetException, BackingStoreException {
        DatasetSpec spec = getManager(name).getSpec();
        writeMaskBlock(name, mask, Box.full(spec.length, spec.width));
    }

    public synchronized void writeMaskBlock(String name, boolean[][] mask, Box box)
            throws DatasetException, BackingStoreException {
        checkWritable();
        DatasetManager manager = getManager(name);
        checkType(manager.getSpec(), DataType.BOOL);
        checkBox(manager.getSpec(), box);
        checkShape(name, mask.length, mask.length == 0 ? 0 : mask[0].length, box);
        manager.writeBools(box, mask);
    }

    /** Read all bands of a FLOAT32 dataset inside box (null for the whole raster), as [band][row][column] */
    public float[][][] read(String name, Box box) throws DatasetException, BackingStoreException {
        DatasetManager manager = getManager(name);
        DatasetSpec spec = manager.getSpec();
        float[][][] ret = new float[spec.bands][][];
        for (int b = 0; b < spec.bands; ++b) {
            ret[b] = read(name, b, box);
        }
        return ret;
    }

    public float[][] read(String name, int band, Box box) throws DatasetException, BackingStoreException {
        DatasetManager manager = getManager(name);
        DatasetSpec spec = manager.getSpec();
        checkType(spec, DataType.FLOAT32);
        if (box == null) box = Box.full(spec.length, spec.width);
        checkBox(spec, box);
        if (band < 0 || band >= spec.bands) {
            throw new DatasetException("band " + band + " out of range for " + spec);
        }
        return manager.readFloats(band, box);
    }

    public boolean[][] readMask(String name, Box box) throws DatasetException, BackingStoreException {
        DatasetManager manager = getManager(name);
        DatasetSpec spec = manager.getSpec();
        checkType(spec, DataType.BOOL);
        if (box == null) box = Box.full(spec.length, spec.width);
        checkBox(spec, box);
        return manager.readBools(box);
    }

    /**
     * getAux and putAux are for retrieving and persistently storing small auxiliary blobs such as date lists and
     * network flags. Not advisable to store large or frequently updated objects here.
     */
    public byte[] getAux(String key) throws BackingStoreException {
        return key == null ? null : backingStore.getAux(EXTERNAL_AUX_PREFIX + key);
    }

    public synchronized void putAux(String key, byte[] value) throws BackingStoreException, DatasetException {
        checkWritable();
        if (key != null) {
            backingStore.putAux(EXTERNAL_AUX_PREFIX + key, value);
        }
    }

    private DatasetManager getManager(String name) throws DatasetException {
        DatasetManager manager = managers.get(name);
        if (manager == null) {
            throw new DatasetException("unknown dataset " + name + (directory != null ? " in " + directory : ""));
        }
        return manager;
    }

    private void checkWritable() throws DatasetException {
        if (storeOptions.readonly) {
            throw new DatasetException("container " + directory + " is read-only");
        }
    }

    private static void checkType(DatasetSpec spec, DataType type) throws DatasetException {
        if (spec.type != type) {
            throw new DatasetException("dataset " + spec.name + " has type " + spec.type + ", not " + type);
        }
    }

    private static void checkBox(DatasetSpec spec, Box box) throws DatasetException {
        if (!box.fitsIn(spec.length, spec.width)) {
            throw new DatasetException("box " + box + " outside " + spec);
        }
    }

    private static void checkShape(String name, int length, int width, Box box) throws DatasetException {
        if (length != box.getLength() || width != box.getWidth()) {
            throw new DatasetException("block of shape " + length + " x " + width + " does not fit box " + box
                    + " of dataset " + name);
        }
    }

    private void serializeMetadata() throws BackingStoreException {
        try {
            backingStore.putAux("metadata", Utilities.serialize(metadata));
            backingStore.putAux("datasets", Utilities.serialize(specs));
        } catch (IOException e) {
            throw new BackingStoreException(e);
        }
    }

    private void deserializeMetadata() throws BackingStoreException {
        byte[] metadataBytes = backingStore.getAux("metadata");
        byte[] specBytes = backingStore.getAux("datasets");
        if (metadataBytes == null || specBytes == null) {
            logger.debug("No metadata found, initializing empty container");
            metadata = null;
            specs = new LinkedHashMap<>();
            return;
        }
        try {
            metadata = Utilities.deserialize(metadataBytes);
            specs = Utilities.deserialize(specBytes);
        } catch (IOException | ClassNotFoundException e) {
            throw new BackingStoreException("corrupt container metadata", e);
        }
        int datasetID = 0;
        for (DatasetSpec spec : specs.values()) {
            managers.put(spec.name, new DatasetManager(backingStore, datasetID++, spec));
        }
    }

    @Override
    public void close() throws BackingStoreException {
        backingStore.close();
    }
}
