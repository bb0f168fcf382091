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

import com.samsung.sra.querybench.QueryExecutionException;
import com.samsung.sra.querybench.QueryRecord;
import com.samsung.sra.querybench.Utilities;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;

/**
 * Drains answered records in arrival order (not index order) until every worker has signed off, writing each to the
 * sink. Stops at the first failed record or sink error; lines already written stay in the sink.
 */
class ResultCollector implements Callable<ResultCollector.Outcome> {
    private static final Logger logger = LoggerFactory.getLogger(ResultCollector.class);
    /** Characters of a failed compound request quoted in the error log */
    static final int MAX_LOGGED_REQUEST = 2000;

    private final BlockingQueue<QueryRecord> results; // input queue
    private final int numWorkers;
    private final ResultsSink sink;
    private final long expected;

    ResultCollector(BlockingQueue<QueryRecord> results, int numWorkers, ResultsSink sink, long expected) {
        this.results = results;
        this.numWorkers = numWorkers;
        this.sink = sink;
        this.expected = expected;
    }

    static class Outcome {
        final long count;
        /** Milliseconds per compound request */
        final DescriptiveStatistics latencies;
        /** System.nanoTime() when draining stopped */
        final long finishedAt;
        final Throwable error;

        private Outcome(long count, DescriptiveStatistics latencies, Throwable error) {
            this.count = count;
            this.latencies = latencies;
            this.finishedAt = System.nanoTime();
            this.error = error;
        }

        static Outcome failed(Throwable error) {
            return new Outcome(0, new DescriptiveStatistics(), error);
        }

        boolean isFailed() {
            return error != null;
        }
    }

    @Override
    public Outcome call() {
        DescriptiveStatistics latencies = new DescriptiveStatistics();
        long count = 0;
        int finishedWorkers = 0;
        while (finishedWorkers < numWorkers) {
            QueryRecord record = Utilities.take(results);
            if (record == QueryRecord.WORKER_DONE) {
                ++finishedWorkers;
                continue;
            }
            if (record.isFailed()) {
                logger.error("running query failed: {}\nrequest:\n{}", record.getError().toString(),
                        StringUtils.abbreviate(record.getRaw(), MAX_LOGGED_REQUEST));
                return new Outcome(count, latencies, record.getError());
            }
            try {
                sink.write(record);
            } catch (IOException e) {
                logger.error("writing results to {} failed after {} lines", sink.getLocation(), count, e);
                return new Outcome(count, latencies, e);
            }
            ++count;
            if (record.isLastInBatch()) {
                latencies.addValue(record.getLatencyNanos() / 1e6);
            }
        }
        if (count != expected) {
            return new Outcome(count, latencies, new QueryExecutionException(
                    String.format("collected %d results, expected %d", count, expected)));
        }
        return new Outcome(count, latencies, null);
    }
}
