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

import java.util.Collections;
import java.util.List;

/** Contiguous run of query records sent to the engine as one compound request */
class Batch {
    /** Queued by the producer once the query set is exhausted. Workers put it back for their siblings */
    static final Batch END = new Batch(-1, Collections.emptyList(), null);

    private final long sequence;
    private final List<QueryRecord> records;
    /** Set instead of records when the producer itself failed */
    private final RuntimeException error;

    Batch(long sequence, List<QueryRecord> records) {
        this(sequence, records, null);
    }

    private Batch(long sequence, List<QueryRecord> records, RuntimeException error) {
        this.sequence = sequence;
        this.records = records;
        this.error = error;
    }

    static Batch failed(long sequence, RuntimeException error) {
        return new Batch(sequence, Collections.emptyList(), error);
    }

    long getSequence() {
        return sequence;
    }

    List<QueryRecord> getRecords() {
        return records;
    }

    int size() {
        return records.size();
    }

    RuntimeException getError() {
        return error;
    }

    /** Concatenation of the records' query texts, in record order */
    String toRequest() {
        StringBuilder sb = new StringBuilder();
        for (QueryRecord record : records) {
            sb.append(record.getRaw());
        }
        return sb.toString();
    }
}
