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
package com.samsung.sra.closurephase.stack;

import com.samsung.sra.arraystore.ArrayStore;
import com.samsung.sra.arraystore.Box;
import com.samsung.sra.arraystore.DatasetException;
import com.samsung.sra.arraystore.DatasetSpec;
import com.samsung.sra.arraystore.Metadata;
import com.samsung.sra.arraystore.Utilities;
import com.samsung.sra.arraystore.storage.BackingStoreException;
import com.samsung.sra.closurephase.DataIncompleteException;
import com.samsung.sra.closurephase.closure.ClosureIndexBuilder;
import com.samsung.sra.closurephase.closure.ClosureTripletIndex;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * A stack of unwrapped interferograms kept in an {@link ArrayStore}: dataset {@value #PHASE_DATASET} of shape
 * [numIfgram, length, width] in radians, the date pair of every interferogram, and a per-interferogram flag telling
 * whether it belongs to the active network. Dropped interferograms stay readable so closure loops can use them.
 */
public class InterferogramStack implements AutoCloseable {
    public static final String PHASE_DATASET = "unwrapPhase";
    public static final String FILE_TYPE = "ifgramStack";
    private static final String PAIRS_AUX = "date12List";
    private static final String RETAINED_AUX = "retained";

    private final ArrayStore store;
    private final List<DatePair> pairs;
    private final boolean[] retained;
    private float[] referencePhase = null;

    public InterferogramStack(ArrayStore store) throws BackingStoreException, DatasetException {
        this.store = store;
        if (store.getMetadata() == null || !store.hasDataset(PHASE_DATASET)) {
            throw new DatasetException("container is not an interferogram stack (no " + PHASE_DATASET + " dataset)");
        }
        byte[] pairBytes = store.getAux(PAIRS_AUX), retainedBytes = store.getAux(RETAINED_AUX);
        if (pairBytes == null || retainedBytes == null) {
            throw new DatasetException("interferogram stack without date pair list");
        }
        try {
            List<String> date12List = Utilities.deserialize(pairBytes);
            List<DatePair> parsed = new ArrayList<>(date12List.size());
            for (String date12 : date12List) {
                parsed.add(DatePair.parse(date12));
            }
            this.pairs = Collections.unmodifiableList(parsed);
            this.retained = Utilities.deserialize(retainedBytes);
        } catch (IOException | ClassNotFoundException e) {
            throw new BackingStoreException("corrupt date pair list", e);
        }
        if (pairs.size() != retained.length || pairs.size() != store.getDatasetSpec(PHASE_DATASET).bands) {
            throw new DatasetException("stack has " + store.getDatasetSpec(PHASE_DATASET).bands
                    + " interferograms but " + pairs.size() + " date pairs");
        }
    }

    /** Open an existing stack. directory == null is not allowed here since an in-memory stack would be empty. */
    public static InterferogramStack open(String directory) throws BackingStoreException, DatasetException {
        if (!ArrayStore.exists(directory)) {
            throw new DatasetException("no interferogram stack at " + directory);
        }
        return new InterferogramStack(new ArrayStore(directory, new ArrayStore.StoreOptions().setReadOnly(true)));
    }

    /**
     * Write a new stack.
     *
     * @param directory  where to write, null for an in-memory stack
     * @param phase  [numIfgram][length][width] unwrapped phase in radians
     */
    public static InterferogramStack create(String directory, Metadata metadata, List<DatePair> pairs,
                                            boolean[] retained, float[][][] phase)
            throws BackingStoreException, DatasetException {
        if (pairs.size() != retained.length || pairs.size() != phase.length) {
            throw new IllegalArgumentException("got " + pairs.size() + " date pairs, " + retained.length
                    + " network flags and " + phase.length + " interferograms");
        }
        if (!metadata.hasReferencePixel()) {
            throw new IllegalArgumentException("interferogram stack needs a reference pixel");
        }
        ArrayStore store = new ArrayStore(directory);
        try {
            store.layout(metadata.withFileType(FILE_TYPE), DatasetSpec.float32(PHASE_DATASET, pairs.size(),
                    metadata.getLength(), metadata.getWidth()));
            store.write(PHASE_DATASET, phase);
            ArrayList<String> date12List = new ArrayList<>();
            for (DatePair pair : pairs) {
                date12List.add(pair.toString());
            }
            store.putAux(PAIRS_AUX, Utilities.serialize(date12List));
            store.putAux(RETAINED_AUX, Utilities.serialize(retained.clone()));
        } catch (IOException e) {
            store.close();
            throw new BackingStoreException(e);
        } catch (DatasetException | BackingStoreException e) {
            store.close();
            throw e;
        }
        return new InterferogramStack(store);
    }

    public Metadata getMetadata() {
        return store.getMetadata();
    }

    public int getLength() {
        return store.getMetadata().getLength();
    }

    public int getWidth() {
        return store.getMetadata().getWidth();
    }

    public int getNumIfgrams(boolean retainedOnly) {
        return getDatePairs(retainedOnly).size();
    }

    public List<DatePair> getDatePairs(boolean retainedOnly) {
        if (!retainedOnly) {
            return pairs;
        }
        List<DatePair> ret = new ArrayList<>();
        for (int i = 0; i < pairs.size(); ++i) {
            if (retained[i]) ret.add(pairs.get(i));
        }
        return ret;
    }

    /** Sorted acquisition dates used by (optionally only the retained) interferograms */
    public List<String> getDateList(boolean retainedOnly) {
        TreeSet<String> dates = new TreeSet<>();
        for (DatePair pair : getDatePairs(retainedOnly)) {
            dates.add(pair.date1);
            dates.add(pair.date2);
        }
        return new ArrayList<>(dates);
    }

    public TimeBase getTimeBase() {
        return new TimeBase(getDateList(true));
    }

    /** A and B over the retained network */
    public DesignMatrices getDesignMatrices() {
        return DesignMatrices.of(getDatePairs(true), getTimeBase());
    }

    /** Closure triplets of level n over all interferograms, with dates from the retained network */
    public ClosureTripletIndex getClosurePhaseIndex(int n) throws DataIncompleteException {
        return ClosureIndexBuilder.build(getDateList(true), pairs, n);
    }

    /** Phase of every interferogram (retained or not) at the reference pixel */
    public synchronized float[] getReferencePhase() throws BackingStoreException, DatasetException {
        if (referencePhase == null) {
            Metadata metadata = getMetadata();
            Box refBox = new Box(metadata.getRefX(), metadata.getRefY(), metadata.getRefX() + 1, metadata.getRefY() + 1);
            float[][][] ref = store.read(PHASE_DATASET, refBox);
            referencePhase = new float[ref.length];
            for (int i = 0; i < ref.length; ++i) {
                referencePhase[i] = ref[i][0][0];
            }
        }
        return referencePhase.clone();
    }

    /** Phase of every interferogram inside box, [numIfgram][boxLength][boxWidth] */
    public float[][][] readPhase(Box box) throws BackingStoreException, DatasetException {
        return store.read(PHASE_DATASET, box);
    }

    /**
     * Deterministic identifier of the stack as closure phase processing sees it: location, raster size, reference
     * pixel, wavelength and network, as the hex SHA-256 of those fields. Used to name cached per-level artifacts.
     */
    public String getIdentity() {
        Metadata metadata = getMetadata();
        StringBuilder fields = new StringBuilder()
                .append(store.getDirectory() == null ? "" : new File(store.getDirectory()).getAbsolutePath())
                .append('\n').append(metadata.getLength()).append('x').append(metadata.getWidth())
                .append('\n').append(metadata.getRefY()).append(',').append(metadata.getRefX())
                .append('\n').append(metadata.getWavelength());
        for (int i = 0; i < pairs.size(); ++i) {
            fields.append('\n').append(pairs.get(i)).append(retained[i] ? '+' : '-');
        }
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        byte[] hash = digest.digest(fields.toString().getBytes(StandardCharsets.UTF_8));
        StringBuilder hex = new StringBuilder(2 * hash.length);
        for (byte b : hash) {
            hex.append(String.format("%02x", b));
        }
        return hex.toString();
    }

    @Override
    public void close() throws BackingStoreException {
        store.close();
    }
}
