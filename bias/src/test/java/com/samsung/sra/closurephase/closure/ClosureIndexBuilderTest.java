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
import com.samsung.sra.closurephase.stack.SyntheticStack;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class ClosureIndexBuilderTest {
    private final SyntheticStack synthetic = new SyntheticStack().setNumDates(5).setMaxConnection(4);
    private final List<String> dates = synthetic.getDates();

    @Test
    public void fullNetwork() throws Exception {
        List<DatePair> pairs = synthetic.getDatePairs();
        for (int n = 1; n < dates.size(); ++n) {
            ClosureTripletIndex index = ClosureIndexBuilder.build(dates, pairs, n);
            assertEquals(n, index.getConnectionLevel());
            assertEquals(dates.size() - n, index.getNumTriplets());
            for (int t = 0; t < index.getNumTriplets(); ++t) {
                int[] plus = index.getPlusIndices(t);
                assertEquals(n, plus.length);
                for (int k = 0; k < n; ++k) {
                    assertEquals(new DatePair(dates.get(t + k), dates.get(t + k + 1)), pairs.get(plus[k]));
                }
                assertEquals(new DatePair(dates.get(t), dates.get(t + n)), pairs.get(index.getMinusIndex(t)));
            }
        }
    }

    @Test
    public void tripletIndices() throws Exception {
        List<DatePair> pairs = synthetic.getDatePairs();
        ClosureTripletIndex level2 = ClosureIndexBuilder.build(dates, pairs, 2);
        assertArrayEquals(new int[]{0, 4, 1}, level2.getTriplet(0));
        assertArrayEquals(new int[]{4, 7, 5}, level2.getTriplet(1));
        assertArrayEquals(new int[]{7, 9, 8}, level2.getTriplet(2));
        ClosureTripletIndex level4 = ClosureIndexBuilder.build(dates, pairs, 4);
        assertArrayEquals(new int[]{0, 4, 7, 9, 3}, level4.getTriplet(0));
    }

    @Test
    public void missingInterferogram() throws Exception {
        List<DatePair> pairs = new ArrayList<>(synthetic.getDatePairs());
        assertTrue(pairs.remove(new DatePair(dates.get(2), dates.get(3))));
        try {
            ClosureIndexBuilder.build(dates, pairs, 2);
            fail("expected DataIncompleteException");
        } catch (DataIncompleteException e) {
            assertEquals(2, e.getConnectionLevel());
            assertEquals(3, e.getExpected());
            assertEquals(1, e.getFound());
        }
    }

    @Test
    public void missingLongInterferogram() throws Exception {
        List<DatePair> pairs = new ArrayList<>(synthetic.getDatePairs());
        pairs.remove(new DatePair(dates.get(1), dates.get(4)));
        // loops of the other levels do not use the missing pair
        assertEquals(3, ClosureIndexBuilder.build(dates, pairs, 2).getNumTriplets());
        assertEquals(1, ClosureIndexBuilder.build(dates, pairs, 4).getNumTriplets());
        try {
            ClosureIndexBuilder.build(dates, pairs, 3);
            fail("expected DataIncompleteException");
        } catch (DataIncompleteException e) {
            assertEquals(3, e.getConnectionLevel());
            assertEquals(2, e.getExpected());
            assertEquals(1, e.getFound());
        }
    }

    @Test
    public void levelTooLarge() throws Exception {
        try {
            ClosureIndexBuilder.build(dates, synthetic.getDatePairs(), 5);
            fail("expected DataIncompleteException");
        } catch (DataIncompleteException e) {
            assertEquals(5, e.getConnectionLevel());
            assertEquals("connection level 5 needs more than 5 acquisitions, got 5", e.getMessage());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void levelZero() throws Exception {
        ClosureIndexBuilder.build(dates, synthetic.getDatePairs(), 0);
    }
}
