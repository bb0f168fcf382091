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
import com.samsung.sra.querybench.QueryExecutionException;
import com.samsung.sra.querybench.QueryExecutor;
import com.samsung.sra.querybench.QueryRecord;
import com.samsung.sra.querybench.QuerySet;
import com.samsung.sra.querybench.RunCancelledException;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * A single pass over a query set: BatchProducer -> concurrency x BatchWorker -> ResultCollector, connected by two
 * bounded queues, bracketed by the query set's setup and teardown statements.
 *
 * Timing runs from just before setup until the collector has drained the last record; teardown is not timed. Teardown
 * runs whenever setup succeeded, including after a failed pass, so server-side state is not leaked into the next pass.
 */
class BenchmarkRun {
    private static final Logger logger = LoggerFactory.getLogger(BenchmarkRun.class);
    private static final int MAX_RESULT_QUEUE_SIZE = 100_000;

    private final QueryExecutor executor;
    private final RunOptions options;
    private final QuerySet querySet;
    private final int concurrency, batchSize;

    private volatile boolean cancelled = false;
    private volatile ExecutorService pool = null;

    BenchmarkRun(QueryExecutor executor, RunOptions options, QuerySet querySet, int concurrency, int batchSize) {
        this.executor = executor;
        this.options = options;
        this.querySet = querySet;
        this.concurrency = concurrency;
        this.batchSize = batchSize;
    }

    /** Interrupts producer, workers and collector wherever they are blocked. Safe to call from any thread */
    void cancel() {
        cancelled = true;
        ExecutorService p = pool;
        if (p != null) {
            p.shutdownNow();
        }
    }

    BenchmarkSummary execute() {
        long startMillis = System.currentTimeMillis();
        String name = querySet.getName();
        BenchmarkSummary summary = new BenchmarkSummary(name, concurrency, batchSize, startMillis / 1000)
                .setColumnCount(options.getColumnCount());
        if (cancelled) {
            return summary.setError("cancelled");
        }

        ResultsSink sink;
        try {
            sink = options.getSinkFactory().open(name, startMillis, concurrency, batchSize);
        } catch (IOException e) {
            logger.error("creating results sink for {}", name, e);
            return summary.setError("creating results sink: " + e.getMessage());
        }
        summary.setResultsFile(sink.getLocation());
        logger.info("running {} queries of {} at concurrency {}, batch size {}",
                querySet.size(), name, concurrency, batchSize);

        ResultCollector.Outcome outcome;
        long start = System.nanoTime();
        try (ResultsSink s = sink) {
            if (querySet.getSetup() != null) {
                try {
                    executor.execute(querySet.getSetup());
                } catch (QueryExecutionException | RuntimeException e) {
                    logger.error("error in setup of {}", name, e);
                    return summary.setError("setup: " + e.getMessage());
                }
            }
            try {
                outcome = runPipeline(s);
            } finally {
                teardown(summary);
            }
        } catch (IOException e) {
            logger.error("closing results sink {}", sink.getLocation(), e);
            return summary.setError("closing results sink: " + e.getMessage());
        }

        if (outcome.isFailed()) {
            Throwable error = outcome.error;
            String message = error instanceof RunCancelledException ? "cancelled" : error.toString();
            logger.error("{} failed after {} results; partial results kept in {}", name, outcome.count,
                    sink.getLocation());
            return summary.setError(message);
        }
        double seconds = (outcome.finishedAt - start) / 1e9;
        DescriptiveStatistics latencies = outcome.latencies;
        summary.setIterations(outcome.count).setSeconds(seconds);
        if (latencies.getN() > 0) {
            summary.setLatencies(latencies.getMean(), latencies.getPercentile(50), latencies.getPercentile(99),
                    latencies.getMax());
        }
        logger.info("wrote {} results to {} in {} s", outcome.count, sink.getLocation(), seconds);
        return summary;
    }

    private ResultCollector.Outcome runPipeline(ResultsSink sink) {
        int depth = options.getQueueDepth(concurrency);
        BlockingQueue<Batch> batches = new ArrayBlockingQueue<>(depth);
        BlockingQueue<QueryRecord> results = new ArrayBlockingQueue<>(
                (int) Math.min((long) depth * batchSize, MAX_RESULT_QUEUE_SIZE));

        ExecutorService p = Executors.newFixedThreadPool(concurrency + 2, new BasicThreadFactory.Builder()
                .namingPattern(querySet.getName() + "-c" + concurrency + "-b" + batchSize + "-%d")
                .daemon(true)
                .build());
        pool = p;
        try {
            if (cancelled) {
                return ResultCollector.Outcome.failed(new RunCancelledException(new InterruptedException()));
            }
            p.execute(new BatchProducer(querySet, batchSize, batches));
            for (int i = 0; i < concurrency; ++i) {
                p.execute(new BatchWorker(executor, batches, results));
            }
            Future<ResultCollector.Outcome> collected =
                    p.submit(new ResultCollector(results, concurrency, sink, querySet.size()));
            try {
                return collected.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ResultCollector.Outcome.failed(new RunCancelledException(e));
            } catch (CancellationException e) {
                return ResultCollector.Outcome.failed(new RunCancelledException(new InterruptedException()));
            } catch (ExecutionException e) {
                return ResultCollector.Outcome.failed(e.getCause());
            }
        } finally {
            p.shutdownNow();
            awaitTermination(p);
        }
    }

    private void awaitTermination(ExecutorService p) {
        try {
            if (!p.awaitTermination(options.getShutdownTimeoutMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("pipeline threads of {} still running {} ms after shutdown", querySet.getName(),
                        options.getShutdownTimeoutMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void teardown(BenchmarkSummary summary) {
        if (querySet.getTeardown() == null) {
            return;
        }
        try {
            executor.execute(querySet.getTeardown());
        } catch (QueryExecutionException | RuntimeException e) {
            logger.error("error in teardown of {}; server-side state may leak into the next run",
                    querySet.getName(), e);
            summary.setTeardownError(e.toString());
        }
    }
}
