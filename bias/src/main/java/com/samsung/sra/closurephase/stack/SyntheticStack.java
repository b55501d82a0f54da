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

import com.samsung.sra.arraystore.Box;
import com.samsung.sra.arraystore.DatasetException;
import com.samsung.sra.arraystore.Metadata;
import com.samsung.sra.arraystore.storage.BackingStoreException;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Deterministic synthetic interferogram stacks. Acquisitions are regularly spaced; every pair up to
 * {@link #setMaxConnection} acquisitions apart is formed and pairs up to {@link #setBandwidth} apart form the active
 * network. Each interferogram carries a linear deformation phase that closes exactly, plus, inside an optional patch, a
 * constant bias that depends only on the interferogram's connection level.
 */
public class SyntheticStack {
    private String startDate = "20200101";
    private int numDates = 5;
    private int spacingDays = 12;
    private int bandwidth = 2;
    private int maxConnection = 4;
    private int length = 12, width = 12;
    private double wavelength = 0.05546576;
    private int refY = 0, refX = 0;
    private double deformationPerStep = 0.25;
    private Box biasPatch = null;
    private double[] biasPerLevel = new double[0];

    public SyntheticStack setStartDate(String startDate) {
        TimeBase.parseDate(startDate);
        this.startDate = startDate;
        return this;
    }

    public SyntheticStack setNumDates(int numDates) {
        if (numDates < 2) {
            throw new IllegalArgumentException("need at least 2 acquisitions");
        }
        this.numDates = numDates;
        return this;
    }

    public SyntheticStack setSpacingDays(int spacingDays) {
        if (spacingDays < 1) {
            throw new IllegalArgumentException("acquisition spacing must be >= 1 day");
        }
        this.spacingDays = spacingDays;
        return this;
    }

    /** Largest connection level of the active network */
    public SyntheticStack setBandwidth(int bandwidth) {
        this.bandwidth = bandwidth;
        return this;
    }

    /** Largest connection level formed at all; pairs above the bandwidth are dropped from the active network */
    public SyntheticStack setMaxConnection(int maxConnection) {
        this.maxConnection = maxConnection;
        return this;
    }

    public SyntheticStack setSize(int length, int width) {
        this.length = length;
        this.width = width;
        return this;
    }

    /** Radar wavelength in metres */
    public SyntheticStack setWavelength(double wavelength) {
        this.wavelength = wavelength;
        return this;
    }

    public SyntheticStack setReferencePixel(int refY, int refX) {
        this.refY = refY;
        this.refX = refX;
        return this;
    }

    /** Deformation phase (radians) accumulated per acquisition step, the same everywhere */
    public SyntheticStack setDeformationPerStep(double deformationPerStep) {
        this.deformationPerStep = deformationPerStep;
        return this;
    }

    /**
     * Add biasPerLevel[k] radians to every connection-k interferogram inside patch. Levels beyond the array get no
     * bias.
     */
    public SyntheticStack setBias(Box patch, double... biasPerLevel) {
        this.biasPatch = patch;
        this.biasPerLevel = biasPerLevel.clone();
        return this;
    }

    public List<String> getDates() {
        LocalDate first = TimeBase.parseDate(startDate);
        List<String> dates = new ArrayList<>(numDates);
        for (int i = 0; i < numDates; ++i) {
            dates.add(first.plusDays((long) i * spacingDays).format(DateTimeFormatter.BASIC_ISO_DATE));
        }
        return dates;
    }

    /** All formed pairs, sorted by first then second date */
    public List<DatePair> getDatePairs() {
        List<String> dates = getDates();
        List<DatePair> pairs = new ArrayList<>();
        for (int i = 0; i < numDates; ++i) {
            for (int j = i + 1; j <= Math.min(numDates - 1, i + maxConnection); ++j) {
                pairs.add(new DatePair(dates.get(i), dates.get(j)));
            }
        }
        return pairs;
    }

    public InterferogramStack build(String directory) throws BackingStoreException, DatasetException {
        if (bandwidth < 1 || bandwidth > maxConnection) {
            throw new IllegalArgumentException("bandwidth " + bandwidth + " must be in [1, " + maxConnection + "]");
        }
        if (biasPatch != null && !biasPatch.fitsIn(length, width)) {
            throw new IllegalArgumentException("bias patch " + biasPatch + " outside " + length + " x " + width);
        }
        List<String> dates = getDates();
        List<DatePair> pairs = getDatePairs();
        boolean[] retained = new boolean[pairs.size()];
        float[][][] phase = new float[pairs.size()][length][width];
        for (int p = 0; p < pairs.size(); ++p) {
            int level = dates.indexOf(pairs.get(p).date2) - dates.indexOf(pairs.get(p).date1);
            retained[p] = level <= bandwidth;
            float background = (float) (deformationPerStep * level);
            float biased = (float) (deformationPerStep * level + (level < biasPerLevel.length ? biasPerLevel[level] : 0));
            for (float[] row : phase[p]) {
                Arrays.fill(row, background);
            }
            if (biasPatch != null) {
                for (int y = biasPatch.y0; y < biasPatch.y1; ++y) {
                    Arrays.fill(phase[p][y], biasPatch.x0, biasPatch.x1, biased);
                }
            }
        }
        Metadata metadata = new Metadata(length, width, wavelength, refY, refX, InterferogramStack.FILE_TYPE)
                .withAttribute("START_DATE", dates.get(0))
                .withAttribute("END_DATE", dates.get(dates.size() - 1));
        return InterferogramStack.create(directory, metadata, pairs, retained, phase);
    }
}
