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
import com.samsung.sra.querybench.QuerySet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Repeats a benchmark over a grid of (concurrency, batch size) settings: outer loop over concurrency, inner loop over
 * batch size. Passes run sequentially so each gets an uncontended measurement.
 */
public class SweepDriver {
    private static final Logger logger = LoggerFactory.getLogger(SweepDriver.class);

    public enum FailurePolicy {
        /** Record the failed pass and go on with the remaining settings */
        CONTINUE,
        /** Stop after the first failed pass */
        ABORT
    }

    private final BenchmarkRunner runner;
    private final FailurePolicy failurePolicy;

    public SweepDriver(BenchmarkRunner runner) {
        this(runner, FailurePolicy.CONTINUE);
    }

    public SweepDriver(BenchmarkRunner runner, FailurePolicy failurePolicy) {
        this.runner = runner;
        this.failurePolicy = failurePolicy;
    }

    /** One summary per pass, in execution order. Failed passes are included */
    public List<BenchmarkSummary> sweep(QuerySet querySet, List<Integer> concurrencies, List<Integer> batchSizes) {
        List<BenchmarkSummary> summaries = new ArrayList<>();
        for (int concurrency : concurrencies) {
            for (int batchSize : batchSizes) {
                if (runner.isCancelled()) {
                    logger.warn("sweep over {} cancelled after {} passes", querySet.getName(), summaries.size());
                    return summaries;
                }
                BenchmarkSummary summary = runner.run(querySet, concurrency, batchSize);
                summaries.add(summary);
                if (summary.isFailed() && failurePolicy == FailurePolicy.ABORT) {
                    logger.error("aborting sweep over {} after failed pass {}", querySet.getName(), summary);
                    return summaries;
                }
            }
        }
        return summaries;
    }
}
