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

import com.samsung.sra.querybench.QueryRecord;

import java.io.Closeable;
import java.io.IOException;

/** Append-only destination for answered queries. Only ever written by the collector thread */
public interface ResultsSink extends Closeable {
    void write(QueryRecord record) throws IOException;

    /** Human-readable location, e.g. a file path */
    String getLocation();

    /** Opens one sink per benchmark pass */
    @FunctionalInterface
    interface Factory {
        ResultsSink open(String querySetName, long timestampMillis, int concurrency, int batchSize) throws IOException;
    }
}
