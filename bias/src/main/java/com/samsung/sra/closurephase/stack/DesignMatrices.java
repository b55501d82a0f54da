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

import java.util.List;

/**
 * Design matrices of a small-baseline network. A [M x N] maps each interferogram to its acquisitions (-1 at the
 * earlier, +1 at the later date). B [M x (N-1)] holds, for each interferogram, the interval lengths (years) between
 * consecutive acquisitions it spans, so that B * velocity integrates a rate to a phase difference.
 */
public class DesignMatrices {
    private final double[][] A, B;

    private DesignMatrices(double[][] A, double[][] B) {
        this.A = A;
        this.B = B;
    }

    public static DesignMatrices of(List<DatePair> pairs, TimeBase timeBase) {
        int M = pairs.size(), N = timeBase.getNumDates();
        double[] years = timeBase.getYears();
        double[][] A = new double[M][N];
        // column N - 1 of the full-size B is always zero and is dropped
        double[][] B = new double[M][N - 1];
        for (int i = 0; i < M; ++i) {
            DatePair pair = pairs.get(i);
            int ind1 = timeBase.indexOf(pair.date1), ind2 = timeBase.indexOf(pair.date2);
            if (ind1 < 0 || ind2 < 0) {
                throw new IllegalArgumentException("interferogram " + pair + " uses a date outside the date list");
            }
            A[i][ind1] = -1;
            A[i][ind2] = 1;
            for (int k = ind1; k < ind2; ++k) {
                B[i][k] = years[k + 1] - years[k];
            }
        }
        return new DesignMatrices(A, B);
    }

    public double[][] getA() {
        return A;
    }

    public double[][] getB() {
        return B;
    }

    public int getNumIfgrams() {
        return A.length;
    }

    /** Index of the +1 entry minus index of the -1 entry of one row of A */
    public static int connectionLevel(double[] row) {
        int idx1 = -1, idx2 = -1;
        for (int k = 0; k < row.length; ++k) {
            if (row[k] == -1 && idx1 < 0) idx1 = k;
            if (row[k] == 1 && idx2 < 0) idx2 = k;
        }
        if (idx1 < 0 || idx2 < 0) {
            throw new IllegalArgumentException("design matrix row does not reference two dates");
        }
        return idx2 - idx1;
    }
}
