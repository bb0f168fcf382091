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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.samsung.sra.querybench.BenchmarkSummary;
import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * JSON rendering of benchmark summaries, one object per pass with all-lowercase field names (name, iterations,
 * concurrency, batchsize, seconds, columncount, timestamp, ...). Unset error fields are left out; latencies of failed
 * passes are written as "NaN".
 */
public class SummaryReport {
    private static final ObjectMapper mapper = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.LOWER_CASE)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private SummaryReport() {}

    public static String toJson(List<BenchmarkSummary> summaries) throws JsonProcessingException {
        return mapper.writeValueAsString(summaries);
    }

    public static void write(List<BenchmarkSummary> summaries, File file) throws IOException {
        FileUtils.writeStringToFile(file, toJson(summaries) + System.lineSeparator(), StandardCharsets.UTF_8);
    }
}
