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
package com.samsung.sra.ssb;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.samsung.sra.querybench.BenchmarkSummary;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SummaryReportTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final ObjectMapper mapper = new ObjectMapper();

    private static BenchmarkSummary success() {
        return new BenchmarkSummary("2.1", 8, 4, 1_500_000_000L)
                .setIterations(280)
                .setSeconds(1.5)
                .setColumnCount(6_000_000)
                .setLatencies(2.0, 1.5, 9.0, 12.0)
                .setResultsFile("results/2.1-1500000000000-c8-b4.txt");
    }

    @Test
    public void lowercaseFieldNames() throws Exception {
        JsonNode json = mapper.readTree(SummaryReport.toJson(Collections.singletonList(success())));
        assertTrue(json.isArray());
        JsonNode summary = json.get(0);
        assertEquals("2.1", summary.get("name").asText());
        assertEquals(280, summary.get("iterations").asLong());
        assertEquals(8, summary.get("concurrency").asInt());
        assertEquals(4, summary.get("batchsize").asInt());
        assertEquals(1.5, summary.get("seconds").asDouble(), 0);
        assertEquals(6_000_000, summary.get("columncount").asLong());
        assertEquals(1_500_000_000L, summary.get("timestamp").asLong());
        assertEquals(9.0, summary.get("latencyp99").asDouble(), 0);
        assertEquals("results/2.1-1500000000000-c8-b4.txt", summary.get("resultsfile").asText());
        assertFalse(summary.has("error"));
        assertFalse(summary.has("teardownerror"));
    }

    @Test
    public void failedPass() throws Exception {
        BenchmarkSummary failed = new BenchmarkSummary("4.1rb", 16, 2, 1_500_000_000L).setError("setup: boom");
        JsonNode summary = mapper.readTree(SummaryReport.toJson(Arrays.asList(success(), failed))).get(1);
        assertEquals(-1, summary.get("seconds").asDouble(), 0);
        assertEquals(0, summary.get("iterations").asLong());
        assertEquals("setup: boom", summary.get("error").asText());
        assertEquals("NaN", summary.get("latencymean").asText());
    }

    @Test
    public void writesFile() throws Exception {
        File out = new File(folder.getRoot(), "summaries.json");
        SummaryReport.write(Collections.singletonList(success()), out);
        assertEquals(1, mapper.readTree(out).size());
    }
}
