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
import com.samsung.sra.querybench.QuerySet;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SweepDriverTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static final QuerySet QS = new QuerySet("3.4", "Q(%d,%d)", new int[][]{{181, 185}, {181, 185, 190}});

    private BenchmarkRunner runner(QueryExecutor engine) {
        return new BenchmarkRunner(engine, new RunOptions().setSinkFactory(FileResultsSink.inDirectory(folder.getRoot())));
    }

    /** Fails every request sent while the batch size is 3, i.e. the requests of 3 queries */
    private static QueryExecutor failsOnBatchesOfThree() {
        EchoExecutor echo = new EchoExecutor();
        return request -> {
            if (EchoExecutor.countQueries(request) == 3) {
                throw new QueryExecutionException("boom");
            }
            return echo.execute(request);
        };
    }

    @Test
    public void gridOrderAndCounts() throws Exception {
        List<BenchmarkSummary> summaries = new SweepDriver(runner(new EchoExecutor()))
                .sweep(QS, Arrays.asList(1, 2), Arrays.asList(1, 3));
        assertEquals(4, summaries.size());
        int[][] expected = {{1, 1}, {1, 3}, {2, 1}, {2, 3}};
        for (int i = 0; i < expected.length; ++i) {
            BenchmarkSummary summary = summaries.get(i);
            assertFalse(summary.isFailed());
            assertEquals(expected[i][0], summary.getConcurrency());
            assertEquals(expected[i][1], summary.getBatchSize());
            assertEquals(6, summary.getIterations());
        }
    }

    @Test
    public void continuePastFailures() throws Exception {
        List<BenchmarkSummary> summaries = new SweepDriver(runner(failsOnBatchesOfThree()))
                .sweep(QS, Arrays.asList(1, 2), Arrays.asList(1, 3));
        assertEquals(4, summaries.size());
        assertFalse(summaries.get(0).isFailed());
        assertTrue(summaries.get(1).isFailed());
        assertFalse(summaries.get(2).isFailed());
        assertTrue(summaries.get(3).isFailed());
        assertEquals(3, summaries.get(3).getBatchSize());
        assertEquals(BenchmarkSummary.FAILED_SECONDS, summaries.get(3).getSeconds(), 0);
    }

    @Test
    public void abortOnFirstFailure() throws Exception {
        List<BenchmarkSummary> summaries = new SweepDriver(runner(failsOnBatchesOfThree()), SweepDriver.FailurePolicy.ABORT)
                .sweep(QS, Arrays.asList(1, 2), Arrays.asList(1, 3));
        assertEquals(2, summaries.size());
        assertFalse(summaries.get(0).isFailed());
        assertTrue(summaries.get(1).isFailed());
    }

    @Test
    public void cancelledRunnerStopsSweep() throws Exception {
        BenchmarkRunner runner = runner(new EchoExecutor());
        runner.cancel();
        List<BenchmarkSummary> summaries = new SweepDriver(runner).sweep(QS, Arrays.asList(1, 2), Arrays.asList(1, 3));
        assertTrue(summaries.isEmpty());
    }
}
