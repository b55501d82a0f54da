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

/** The interferogram network does not match the requested bandwidth */
public class NetworkInconsistencyException extends ClosurePhaseException {
    public NetworkInconsistencyException(String msg) {
        super(msg);
    }

    public NetworkInconsistencyException(String msg, int connectionLevel) {
        super(msg, connectionLevel);
    }

    public static NetworkInconsistencyException countMismatch(int bandwidth, int expected, int found) {
        return new NetworkInconsistencyException(String.format("bandwidth %d network should have %d interferograms"
                + " but found %d; adjust the maximum connection level of the stack to match the bandwidth",
                bandwidth, expected, found));
    }
}
