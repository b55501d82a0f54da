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

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Acquisition dates of a stack expressed as time since the first acquisition. Years use 365.25-day years; ordinals are
 * day numbers.
 */
public class TimeBase {
    private static final double DAYS_PER_YEAR = 365.25;

    private final List<String> dates;
    private final long[] ordinals;
    private final double[] years;

    public TimeBase(List<String> dates) {
        if (dates.isEmpty()) {
            throw new IllegalArgumentException("empty date list");
        }
        this.dates = Collections.unmodifiableList(new ArrayList<>(dates));
        int N = dates.size();
        ordinals = new long[N];
        years = new double[N];
        LocalDate first = parseDate(dates.get(0));
        for (int i = 0; i < N; ++i) {
            LocalDate date = parseDate(dates.get(i));
            ordinals[i] = date.toEpochDay();
            if (i > 0 && ordinals[i] <= ordinals[i - 1]) {
                throw new IllegalArgumentException("dates not strictly increasing at " + dates.get(i));
            }
            years[i] = ChronoUnit.DAYS.between(first, date) / DAYS_PER_YEAR;
        }
    }

    public static LocalDate parseDate(String yyyymmdd) {
        try {
            return LocalDate.parse(yyyymmdd, DateTimeFormatter.BASIC_ISO_DATE);
        } catch (DateTimeParseException | NullPointerException e) {
            throw new IllegalArgumentException("invalid date " + yyyymmdd + ", expected YYYYMMDD", e);
        }
    }

    public List<String> getDates() {
        return dates;
    }

    public int getNumDates() {
        return dates.size();
    }

    public int indexOf(String date) {
        return dates.indexOf(date);
    }

    /** Years since the first acquisition */
    public double[] getYears() {
        return years.clone();
    }

    public long[] getOrdinals() {
        return ordinals.clone();
    }

    /** Years between consecutive acquisitions, size N - 1 */
    public double[] getIntervals() {
        double[] intervals = new double[years.length - 1];
        for (int i = 0; i < intervals.length; ++i) {
            intervals[i] = years[i + 1] - years[i];
        }
        return intervals;
    }

    /** Years between the first and last acquisition */
    public double getTotalSpan() {
        return years[years.length - 1] - years[0];
    }

    /** Average span in days of the connection-n interferograms of a sequential network */
    public double averageConnectionSpan(int n) {
        int N = ordinals.length;
        if (n < 1 || n >= N) {
            throw new IllegalArgumentException("connection level " + n + " out of range for " + N + " acquisitions");
        }
        double total = 0;
        for (int i = 0; i + n < N; ++i) {
            total += ordinals[i + n] - ordinals[i];
        }
        return total / (N - n);
    }

    /** Average span in days over all interferograms of a network with connection levels 1..bandwidth */
    public double averageNetworkSpan(int bandwidth) {
        int N = ordinals.length;
        if (bandwidth < 1 || bandwidth >= N) {
            throw new IllegalArgumentException("bandwidth " + bandwidth + " out of range for " + N + " acquisitions");
        }
        double total = 0;
        long numIfgrams = 0;
        for (int n = 1; n <= bandwidth; ++n) {
            for (int i = 0; i + n < N; ++i) {
                total += ordinals[i + n] - ordinals[i];
            }
            numIfgrams += N - n;
        }
        return total / numIfgrams;
    }
}
