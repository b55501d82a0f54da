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

import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class TimeBaseTest {
    private static final List<String> DATES = Arrays.asList("20200101", "20200113", "20200125", "20200206", "20200218");

    @Test
    public void years() {
        TimeBase timeBase = new TimeBase(DATES);
        assertEquals(5, timeBase.getNumDates());
        double[] years = timeBase.getYears();
        assertEquals(0, years[0], 0);
        assertEquals(12 / 365.25, years[1], 1e-12);
        assertEquals(48 / 365.25, timeBase.getTotalSpan(), 1e-12);
        for (double interval : timeBase.getIntervals()) {
            assertEquals(12 / 365.25, interval, 1e-12);
        }
        assertEquals(2, timeBase.indexOf("20200125"));
        assertEquals(-1, timeBase.indexOf("20200126"));
    }

    @Test
    public void spans() {
        TimeBase timeBase = new TimeBase(DATES);
        assertEquals(12, timeBase.averageConnectionSpan(1), 1e-12);
        assertEquals(24, timeBase.averageConnectionSpan(2), 1e-12);
        assertEquals(48, timeBase.averageConnectionSpan(4), 1e-12);
        // 4 pairs of 12 days, 3 of 24
        assertEquals(120.0 / 7, timeBase.averageNetworkSpan(2), 1e-12);
    }

    @Test(expected = IllegalArgumentException.class)
    public void datesMustIncrease() {
        new TimeBase(Arrays.asList("20200113", "20200101"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void connectionLevelOutOfRange() {
        new TimeBase(DATES).averageConnectionSpan(5);
    }
}
