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

/**
 * Outcome of one benchmark pass over a query set at a given (concurrency, batch size).
 *
 * A failed pass keeps name, concurrency, batch size and timestamp, reports zero iterations and seconds = -1, and names
 * the error. Tooling can tell success from failure by the timing field alone.
 */
public class BenchmarkSummary {
    public static final double FAILED_SECONDS = -1;

    private final String name;
    private final int concurrency;
    private final int batchSize;
    /** Unix time (seconds) at which the pass started */
    private final long timestamp;

    private long iterations = 0;
    private double seconds = FAILED_SECONDS;
    private long columnCount = 0;
    private double latencyMean = Double.NaN, latencyP50 = Double.NaN, latencyP99 = Double.NaN,
            latencyMax = Double.NaN;
    private String resultsFile = null;
    private String error = null;
    private String teardownError = null;

    public BenchmarkSummary(String name, int concurrency, int batchSize, long timestamp) {
        this.name = name;
        this.concurrency = concurrency;
        this.batchSize = batchSize;
        this.timestamp = timestamp;
    }

    public BenchmarkSummary setIterations(long iterations) {
        this.iterations = iterations;
        return this;
    }

    public BenchmarkSummary setSeconds(double seconds) {
        this.seconds = seconds;
        return this;
    }

    /** Informational size of the dataset under test (e.g. number of lineorder rows) */
    public BenchmarkSummary setColumnCount(long columnCount) {
        this.columnCount = columnCount;
        return this;
    }

    /** Per compound request round trip, in milliseconds */
    public BenchmarkSummary setLatencies(double mean, double p50, double p99, double max) {
        this.latencyMean = mean;
        this.latencyP50 = p50;
        this.latencyP99 = p99;
        this.latencyMax = max;
        return this;
    }

    public BenchmarkSummary setResultsFile(String resultsFile) {
        this.resultsFile = resultsFile;
        return this;
    }

    /** Marks the pass failed: timing is reset to the sentinel and iterations to zero */
    public BenchmarkSummary setError(String error) {
        this.error = error;
        this.seconds = FAILED_SECONDS;
        this.iterations = 0;
        return this;
    }

    /** Teardown failures do not invalidate the measurement, but leave server-side state behind */
    public BenchmarkSummary setTeardownError(String teardownError) {
        this.teardownError = teardownError;
        return this;
    }

    public String getName() {
        return name;
    }

    public long getIterations() {
        return iterations;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public double getSeconds() {
        return seconds;
    }

    public long getColumnCount() {
        return columnCount;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public double getLatencyMean() {
        return latencyMean;
    }

    public double getLatencyP50() {
        return latencyP50;
    }

    public double getLatencyP99() {
        return latencyP99;
    }

    public double getLatencyMax() {
        return latencyMax;
    }

    public String getResultsFile() {
        return resultsFile;
    }

    public String getError() {
        return error;
    }

    public String getTeardownError() {
        return teardownError;
    }

    public boolean isFailed() {
        return error != null;
    }

    @Override
    public String toString() {
        return isFailed()
                ? String.format("<%s c=%d b=%d: FAILED (%s)>", name, concurrency, batchSize, error)
                : String.format("<%s c=%d b=%d: %d queries in %.3f s>", name, concurrency, batchSize, iterations, seconds);
    }
}
