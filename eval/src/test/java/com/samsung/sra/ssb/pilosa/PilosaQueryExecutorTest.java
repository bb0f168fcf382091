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
package com.samsung.sra.ssb.pilosa;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.samsung.sra.querybench.QueryExecutionException;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class PilosaQueryExecutorTest {
    private final ObjectMapper mapper = new ObjectMapper();

    private FakePilosaServer server;
    private PilosaClient client;

    @Before
    public void start() throws Exception {
        server = new FakePilosaServer();
        server.start();
        client = new PilosaClient(server.getAddress(), 2, 1000, 5000);
    }

    @After
    public void stop() throws Exception {
        client.close();
        server.close();
    }

    @Test
    public void scalars() throws Exception {
        assertEquals(42, PilosaQueryExecutor.toScalar(mapper.readTree("{\"sum\": 42, \"count\": 3}")));
        assertEquals(7, PilosaQueryExecutor.toScalar(mapper.readTree("7")));
        assertEquals(1, PilosaQueryExecutor.toScalar(mapper.readTree("true")));
        assertEquals(0, PilosaQueryExecutor.toScalar(mapper.readTree("false")));
    }

    @Test(expected = QueryExecutionException.class)
    public void bitmapIsNotAScalar() throws Exception {
        PilosaQueryExecutor.toScalar(mapper.readTree("{\"attrs\": {}, \"bits\": [1, 2]}"));
    }

    @Test
    public void mixedRequest() throws Exception {
        PilosaQueryExecutor executor = new PilosaQueryExecutor(client, "ssb");
        String request = "Store(Bitmap(frame=\"s_region\", rowID=0), id=41)\n"
                + "Sum(Intersect(Bitmap(frame=\"c_nation\", rowID=2), Load(id=41)), frame=lo_profit, field=lo_profit)\n"
                + "Count(Bitmap(frame=\"p_mfgr\", rowID=0))\n";
        assertEquals(Arrays.asList(1L, 2L, FakePilosaServer.COUNT), executor.execute(request));
    }

    @Test
    public void engineErrorBecomesQueryFailure() {
        server.failQueriesContaining("Purge");
        try {
            new PilosaQueryExecutor(client, "ssb").execute("Purge(id=41)\n");
            fail("expected QueryExecutionException");
        } catch (QueryExecutionException e) {
            assertThat(e.getMessage(), containsString("executing: Purge"));
        }
    }
}
