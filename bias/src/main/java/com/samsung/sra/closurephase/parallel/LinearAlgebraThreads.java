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
package com.samsung.sra.closurephase.parallel;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Number of threads the per-pixel linear algebra inside one block may use. Pin it to 1 while blocks themselves are
 * processed in parallel, then restore the previous value.
 */
public final class LinearAlgebraThreads {
    private static final AtomicInteger threads = new AtomicInteger(Runtime.getRuntime().availableProcessors());

    private LinearAlgebraThreads() {}

    public static int get() {
        return threads.get();
    }

    /** @return the previous thread count, to be passed to {@link #restoreThreads} */
    public static int setThreads(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("thread count must be >= 1, got " + n);
        }
        return threads.getAndSet(n);
    }

    public static void restoreThreads(int previous) {
        threads.set(previous);
    }
}
