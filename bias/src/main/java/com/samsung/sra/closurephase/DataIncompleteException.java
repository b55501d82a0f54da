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
package com.samsung.sra.closurephase;

/** Fewer closure triplets than acquisitions allow at some connection level, i.e. interferograms are missing */
public class DataIncompleteException extends ClosurePhaseException {
    private final int expected, found;

    public DataIncompleteException(int connectionLevel, int expected, int found) {
        this(String.format("connection level %d: found %d closure measurements, expected %d"
                + " --> some interferograms are missing!", connectionLevel, found, expected),
                connectionLevel, expected, found);
    }

    public DataIncompleteException(String msg, int connectionLevel, int expected, int found) {
        super(msg, connectionLevel);
        this.expected = expected;
        this.found = found;
    }

    /** Too few acquisitions to form a single closure loop of the given level */
    public static DataIncompleteException tooFewAcquisitions(int connectionLevel, int numDates) {
        return new DataIncompleteException(String.format("connection level %d needs more than %d acquisitions, got %d",
                connectionLevel, connectionLevel, numDates), connectionLevel, 1, 0);
    }

    public int getExpected() {
        return expected;
    }

    public int getFound() {
        return found;
    }
}
