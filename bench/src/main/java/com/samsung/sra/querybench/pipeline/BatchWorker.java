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
import com.samsung.sra.querybench.QueryExecutor;
import com.samsung.sra.querybench.QueryRecord;
import com.samsung.sra.querybench.RunCancelledException;
import com.samsung.sra.querybench.Utilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.BlockingQueue;

/**
 * Pulls batches, sends each as one compound request, and hands the answered records to the collector one at a time.
 * The engine's i-th answer is attached to the batch's i-th record.
 *
 * A failed request is fatal: the worker emits a single failed record for the batch and exits without retrying, since
 * answers can no longer be matched to inputs once the response is in doubt.
 */
class BatchWorker implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(BatchWorker.class);

    private final QueryExecutor executor;
    private final BlockingQueue<Batch> batches; // input queue
    private final BlockingQueue<QueryRecord> results; // output queue

    BatchWorker(QueryExecutor executor, BlockingQueue<Batch> batches, BlockingQueue<QueryRecord> results) {
        this.executor = executor;
        this.batches = batches;
        this.results = results;
    }

    @Override
    public void run() {
        try {
            while (true) {
                Batch batch = Utilities.take(batches);
                if (batch == Batch.END) {
                    Utilities.put(batches, Batch.END);
                    break;
                }
                if (!process(batch)) {
                    break;
                }
            }
            Utilities.put(results, QueryRecord.WORKER_DONE);
        } catch (RunCancelledException e) {
            logger.debug("{} cancelled", Thread.currentThread().getName());
        }
    }

    /** @return false if the batch failed and the worker should stop */
    private boolean process(Batch batch) {
        if (batch.getError() != null) {
            Utilities.put(results, QueryRecord.failed("<batch " + batch.getSequence() + ">", batch.getError()));
            return false;
        }
        String request = batch.toRequest();
        List<QueryRecord> records = batch.getRecords();
        long start = System.nanoTime();
        List<Long> answers;
        try {
            answers = executor.execute(request);
            validate(answers, records.size());
        } catch (Throwable e) {
            // Errors included: every worker must still sign off with WORKER_DONE
            logger.debug("batch {} failed with {}:\n{}", batch.getSequence(), e, request);
            Utilities.put(results, QueryRecord.failed(request, e));
            return false;
        }
        long latency = System.nanoTime() - start;
        for (int i = 0; i < records.size(); ++i) {
            QueryRecord record = records.get(i);
            record.complete(answers.get(i), latency, i == records.size() - 1);
            Utilities.put(results, record);
        }
        return true;
    }

    private static void validate(List<Long> answers, int expected) throws QueryExecutionException {
        if (answers == null || answers.size() != expected) {
            throw new QueryExecutionException(String.format("expected %d results for compound request, got %d",
                    expected, answers == null ? 0 : answers.size()));
        }
        for (int i = 0; i < expected; ++i) {
            if (answers.get(i) == null) {
                throw new QueryExecutionException("no result for query " + i + " of compound request");
            }
        }
    }
}
