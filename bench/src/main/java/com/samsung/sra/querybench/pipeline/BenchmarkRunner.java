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
package com.samsung.sra.querybench.pipeline;

import com.samsung.sra.querybench.BenchmarkSummary;
import com.samsung.sra.querybench.QueryExecutor;
import com.samsung.sra.querybench.QuerySet;

/**
 * Runs benchmark passes against one engine. Each pass sends every query of a query set, batchSize queries per request
 * and concurrency requests in flight:
 * <ul>
 *     <li>concurrency = 1, batchSize = size of the query set: one big batch</li>
 *     <li>concurrency = N, batchSize = 1: N single queries in parallel</li>
 *     <li>concurrency = N, batchSize = B: N concurrent batches of B queries</li>
 * </ul>
 *
 * Passes are run one at a time. {@link #cancel()} stops the active pass and every later one; a cancelled runner is
 * not reusable.
 */
public class BenchmarkRunner {
    private final QueryExecutor executor;
    private final RunOptions options;

    private volatile boolean cancelled = false;
    private volatile BenchmarkRun activeRun = null;

    public BenchmarkRunner(QueryExecutor executor) {
        this(executor, new RunOptions());
    }

    public BenchmarkRunner(QueryExecutor executor, RunOptions options) {
        this.executor = executor;
        this.options = options;
    }

    /** Never throws on engine or I/O failure; check {@link BenchmarkSummary#isFailed()} */
    public synchronized BenchmarkSummary run(QuerySet querySet, int concurrency, int batchSize) {
        if (concurrency < 1 || batchSize < 1) {
            throw new IllegalArgumentException(String.format(
                    "concurrency and batch size must be >= 1, got %d and %d", concurrency, batchSize));
        }
        BenchmarkRun run = new BenchmarkRun(executor, options, querySet, concurrency, batchSize);
        activeRun = run;
        if (cancelled) {
            run.cancel();
        }
        try {
            return run.execute();
        } finally {
            activeRun = null;
        }
    }

    public void cancel() {
        cancelled = true;
        BenchmarkRun run = activeRun;
        if (run != null) {
            run.cancel();
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
