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

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

import java.io.Serializable;

/** An interferogram's (reference date, secondary date) pair, both YYYYMMDD */
public final class DatePair implements Serializable {
    public final String date1, date2;

    public DatePair(String date1, String date2) {
        TimeBase.parseDate(date1);
        TimeBase.parseDate(date2);
        if (date1.compareTo(date2) >= 0) {
            throw new IllegalArgumentException("invalid date pair " + date1 + "_" + date2);
        }
        this.date1 = date1;
        this.date2 = date2;
    }

    /** Parse YYYYMMDD_YYYYMMDD */
    public static DatePair parse(String date12) {
        String[] parts = date12.split("_");
        if (parts.length != 2) {
            throw new IllegalArgumentException("invalid date pair " + date12);
        }
        return new DatePair(parts[0], parts[1]);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DatePair)) return false;
        DatePair that = (DatePair) o;
        return new EqualsBuilder().append(date1, that.date1).append(date2, that.date2).isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder().append(date1).append(date2).toHashCode();
    }

    @Override
    public String toString() {
        return date1 + "_" + date2;
    }
}
