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
package com.samsung.sra.querybench;

import org.apache.commons.lang3.StringUtils;

/**
 * One member of a {@link QuerySet}: the inputs chosen for iteration n, the rendered query text, and after execution
 * either the engine's answer or the error that prevented one.
 *
 * Owned by exactly one pipeline stage at a time (producer, then a worker, then the collector), so no synchronization.
 */
public class QueryRecord {
    /** Emitted by each worker when it exits. Never written anywhere */
    public static final QueryRecord WORKER_DONE = new QueryRecord(-1, new int[0], "");

    private final long index;
    private final int[] inputs;
    private final String raw;

    private Long output = null;
    private Throwable error = null;
    /** Round trip time of the compound request this record was sent in */
    private long latencyNanos = 0;
    private boolean lastInBatch = false;

    public QueryRecord(long index, int[] inputs, String raw) {
        this.index = index;
        this.inputs = inputs;
        this.raw = raw;
    }

    /** Record standing in for a whole batch that failed; raw is the compound request */
    public static QueryRecord failed(String raw, Throwable error) {
        QueryRecord record = new QueryRecord(-1, new int[0], raw);
        record.error = error;
        return record;
    }

    public void complete(long output, long latencyNanos, boolean lastInBatch) {
        this.output = output;
        this.latencyNanos = latencyNanos;
        this.lastInBatch = lastInBatch;
    }

    public long getIndex() {
        return index;
    }

    public int[] getInputs() {
        return inputs.clone();
    }

    public String getRaw() {
        return raw;
    }

    public Long getOutput() {
        return output;
    }

    public Throwable getError() {
        return error;
    }

    public boolean isFailed() {
        return error != null;
    }

    public long getLatencyNanos() {
        return latencyNanos;
    }

    public boolean isLastInBatch() {
        return lastInBatch;
    }

    /** "output [in0 in1 ...]", the results file format */
    public String toResultLine() {
        return output + " [" + StringUtils.join(inputs, ' ') + "]";
    }

    @Override
    public String toString() {
        return isFailed()
                ? "<failed: " + error + ">"
                : "<query " + index + ": " + toResultLine() + ">";
    }
}
