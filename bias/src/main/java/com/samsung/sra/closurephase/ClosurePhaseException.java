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

import com.samsung.sra.arraystore.Box;

/**
 * Fatal error while estimating closure phase bias. Carries the connection level and box being processed when known so
 * that the command-line tools can report them.
 */
public class ClosurePhaseException extends Exception {
    private final int connectionLevel;
    private final Box box;

    public ClosurePhaseException(String msg) {
        this(msg, null, -1, null);
    }

    public ClosurePhaseException(String msg, Throwable cause) {
        this(msg, cause, -1, null);
    }

    public ClosurePhaseException(String msg, int connectionLevel) {
        this(msg, null, connectionLevel, null);
    }

    public ClosurePhaseException(String msg, Throwable cause, Box box) {
        this(msg, cause, cause instanceof ClosurePhaseException
                ? ((ClosurePhaseException) cause).getConnectionLevel() : -1, box);
    }

    public ClosurePhaseException(String msg, Throwable cause, int connectionLevel, Box box) {
        super(msg, cause);
        this.connectionLevel = connectionLevel;
        this.box = box;
    }

    /** -1 if not tied to a connection level */
    public int getConnectionLevel() {
        return connectionLevel;
    }

    /** null if not tied to a box */
    public Box getBox() {
        return box;
    }
}
