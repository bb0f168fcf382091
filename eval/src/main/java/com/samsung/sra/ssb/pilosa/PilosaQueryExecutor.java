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

import com.fasterxml.jackson.databind.JsonNode;
import com.samsung.sra.querybench.QueryExecutionException;
import com.samsung.sra.querybench.QueryExecutor;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs compound requests against one Pilosa index. Each entry of the response becomes one scalar:
 * {@code {"sum": n, "count": m}} maps to n, a bare number to itself, and a boolean (the answer to Store or Purge) to
 * 1 or 0. Any other result shape is an error.
 */
public class PilosaQueryExecutor implements QueryExecutor {
    private final PilosaClient client;
    private final String index;

    public PilosaQueryExecutor(PilosaClient client, String index) {
        this.client = client;
        this.index = index;
    }

    @Override
    public List<Long> execute(String request) throws QueryExecutionException {
        List<JsonNode> results;
        try {
            results = client.query(index, request);
        } catch (PilosaException e) {
            throw new QueryExecutionException(e.getMessage(), e);
        }
        List<Long> ret = new ArrayList<>(results.size());
        for (JsonNode result : results) {
            ret.add(toScalar(result));
        }
        return ret;
    }

    static long toScalar(JsonNode result) throws QueryExecutionException {
        if (result.isObject() && result.has("sum")) {
            result = result.get("sum");
        }
        if (result.isIntegralNumber()) {
            return result.asLong();
        } else if (result.isBoolean()) {
            return result.asBoolean() ? 1 : 0;
        } else {
            throw new QueryExecutionException("result is not a scalar: " + result);
        }
    }
}
