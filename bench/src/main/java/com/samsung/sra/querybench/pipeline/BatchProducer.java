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
import com.samsung.sra.querybench.QuerySet;
import com.samsung.sra.querybench.RunCancelledException;
import com.samsung.sra.querybench.Utilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;

/**
 * Renders the query set in index order and cuts it into batches of batchSize records (the last batch may be shorter),
 * then queues {@link Batch#END}. Runs ahead of the workers, blocking whenever the batch queue is full.
 */
class BatchProducer implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(BatchProducer.class);

    private final QuerySet querySet;
    private final int batchSize;
    private final BlockingQueue<Batch> batches; // output queue

    BatchProducer(QuerySet querySet, int batchSize, BlockingQueue<Batch> batches) {
        if (batchSize < 1) throw new IllegalArgumentException("batch size must be >= 1");
        this.querySet = querySet;
        this.batchSize = batchSize;
        this.batches = batches;
    }

    @Override
    public void run() {
        long sequence = 0;
        try {
            try {
                List<QueryRecord> records = new ArrayList<>(batchSize);
                for (long n = 0; n < querySet.size(); ++n) {
                    records.add(querySet.recordAt(n));
                    if (records.size() == batchSize) {
                        Utilities.put(batches, new Batch(sequence++, records));
                        records = new ArrayList<>(batchSize);
                    }
                }
                if (!records.isEmpty()) {
                    Utilities.put(batches, new Batch(sequence++, records));
                }
            } catch (RunCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                logger.error("failed rendering batch {} of {}", sequence, querySet.getName(), e);
                Utilities.put(batches, Batch.failed(sequence, e));
            }
            Utilities.put(batches, Batch.END);
            logger.debug("queued {} batches for {}", sequence, querySet.getName());
        } catch (RunCancelledException e) {
            logger.debug("producer cancelled after {} batches", sequence);
        }
    }
}
