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
package com.samsung.sra.closurephase.closure;

import com.samsung.sra.closurephase.DataIncompleteException;
import com.samsung.sra.closurephase.stack.DatePair;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;
import java.util.TreeSet;

/** Enumerates the sequential closure triplets of a connection level */
public class ClosureIndexBuilder {
    private ClosureIndexBuilder() {}

    /**
     * For each start acquisition i, the triplet (i, i+1), (i+1, i+2), ..., (i+n-1, i+n), (i, i+n) is kept only if every
     * one of its interferograms exists. Indices point into {@code pairs}.
     *
     * @param dates  sorted acquisition dates
     * @param pairs  every available interferogram, including ones dropped from the active network
     * @throws DataIncompleteException  if fewer than N - n triplets are found
     */
    public static ClosureTripletIndex build(List<String> dates, List<DatePair> pairs, int n)
            throws DataIncompleteException {
        int N = dates.size();
        if (n < 1) {
            throw new IllegalArgumentException("connection level must be >= 1, got " + n);
        }
        if (n >= N) {
            throw DataIncompleteException.tooFewAcquisitions(n, N);
        }
        Object2IntMap<DatePair> pairIndex = new Object2IntOpenHashMap<>(pairs.size());
        pairIndex.defaultReturnValue(-1);
        for (int i = 0; i < pairs.size(); ++i) {
            pairIndex.put(pairs.get(i), i);
        }

        TreeSet<int[]> triplets = new TreeSet<>(ClosureIndexBuilder::compare);
        for (int i = 0; i < N - n; ++i) {
            int[] triplet = new int[n + 1];
            boolean complete = true;
            for (int k = 0; k < n && complete; ++k) {
                triplet[k] = pairIndex.getInt(new DatePair(dates.get(i + k), dates.get(i + k + 1)));
                complete = triplet[k] >= 0;
            }
            if (complete) {
                triplet[n] = pairIndex.getInt(new DatePair(dates.get(i), dates.get(i + n)));
                complete = triplet[n] >= 0;
            }
            if (complete) {
                triplets.add(triplet);
            }
        }
        if (triplets.size() < N - n) {
            throw new DataIncompleteException(n, N - n, triplets.size());
        }
        return new ClosureTripletIndex(n, triplets.toArray(new int[0][]));
    }

    private static int compare(int[] a, int[] b) {
        for (int i = 0; i < Math.min(a.length, b.length); ++i) {
            if (a[i] != b[i]) return Integer.compare(a[i], b[i]);
        }
        return Integer.compare(a.length, b.length);
    }
}
