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

import java.io.File;

/** Settings shared by every pass of a {@link BenchmarkRunner}. Concurrency and batch size are chosen per pass */
public class RunOptions {
    private int queueDepth = 0;
    private long columnCount = 0;
    private long shutdownTimeoutMillis = 10_000;
    private ResultsSink.Factory sinkFactory = FileResultsSink.inDirectory(new File("results"));

    /**
     * Capacity of the queue between producer and workers, in batches. Default 0, meaning twice the concurrency. The
     * queue between workers and collector holds this many batches' worth of records.
     */
    public RunOptions setQueueDepth(int queueDepth) {
        if (queueDepth < 0) {
            throw new IllegalArgumentException("queue depth must be >= 0");
        }
        this.queueDepth = queueDepth;
        return this;
    }

    /** Informational dataset size copied into every summary. Default 0 */
    public RunOptions setColumnCount(long columnCount) {
        this.columnCount = columnCount;
        return this;
    }

    /**
     * How long to wait for pipeline threads to exit after a pass ends. A worker blocked in a request only notices
     * cancellation once the request returns. Default 10 s.
     */
    public RunOptions setShutdownTimeoutMillis(long shutdownTimeoutMillis) {
        this.shutdownTimeoutMillis = shutdownTimeoutMillis;
        return this;
    }

    /** Where per-query results go. Default: files under ./results */
    public RunOptions setSinkFactory(ResultsSink.Factory sinkFactory) {
        this.sinkFactory = sinkFactory;
        return this;
    }

    public int getQueueDepth(int concurrency) {
        return queueDepth > 0 ? queueDepth : 2 * concurrency;
    }

    public long getColumnCount() {
        return columnCount;
    }

    public long getShutdownTimeoutMillis() {
        return shutdownTimeoutMillis;
    }

    public ResultsSink.Factory getSinkFactory() {
        return sinkFactory;
    }
}
