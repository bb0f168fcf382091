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
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class BatchProducerTest {
    private static List<Batch> produce(QuerySet qs, int batchSize) {
        BlockingQueue<Batch> queue = new LinkedBlockingQueue<>();
        new BatchProducer(qs, batchSize, queue).run();
        List<Batch> batches = new ArrayList<>();
        queue.drainTo(batches);
        assertTrue(batches.size() > 0);
        assertTrue(batches.get(batches.size() - 1) == Batch.END);
        return batches.subList(0, batches.size() - 1);
    }

    @Test
    public void lastBatchIsShorter() throws Exception {
        QuerySet qs = new QuerySet("q", "Q(%d,%d)", new int[][]{{1, 2, 3}, {10, 20, 30, 40}});
        List<Batch> batches = produce(qs, 5);
        assertEquals(3, batches.size());
        int[] sizes = batches.stream().mapToInt(Batch::size).toArray();
        assertEquals(Arrays.toString(new int[]{5, 5, 2}), Arrays.toString(sizes));
    }

    @Test
    public void partitionIsExhaustiveAndContiguous() throws Exception {
        QuerySet qs = new QuerySet("q", "Q(%d,%d,%d)", new int[][]{{1, 2, 3}, {4, 5}, {6, 7, 8, 9, 10}});
        for (int batchSize : new int[]{1, 2, 3, 7, 30, 31, 100}) {
            List<Batch> batches = produce(qs, batchSize);
            long next = 0;
            for (int b = 0; b < batches.size(); ++b) {
                Batch batch = batches.get(b);
                assertEquals(b, batch.getSequence());
                if (b < batches.size() - 1) {
                    assertEquals(batchSize, batch.size());
                } else {
                    assertTrue(batch.size() >= 1 && batch.size() <= batchSize);
                }
                for (QueryRecord record : batch.getRecords()) {
                    assertEquals(next++, record.getIndex());
                }
            }
            assertEquals(qs.size(), next);
        }
    }

    @Test
    public void requestConcatenatesInOrder() throws Exception {
        QuerySet qs = new QuerySet("q", "Q(%d)", new int[][]{{1, 2, 3}});
        List<Batch> batches = produce(qs, 3);
        assertEquals("Q(1)\nQ(2)\nQ(3)\n", batches.get(0).toRequest());
    }

    @Test
    public void emptySetOnlyEnds() throws Exception {
        BlockingQueue<Batch> queue = new LinkedBlockingQueue<>();
        new BatchProducer(QuerySet.empty("none"), 4, queue).run();
        assertEquals(1, queue.size());
        assertTrue(queue.take() == Batch.END);
    }
}
