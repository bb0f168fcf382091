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

import java.util.List;

/** Dataset-level numbers reported alongside benchmark results. */
public class DatasetStatistics {
    private final PilosaClient client;
    private final String index;

    public DatasetStatistics(PilosaClient client, String index) {
        this.client = client;
        this.index = index;
    }

    /**
     * Counts the columns of the index through a frame whose rows partition them, e.g. p_mfgr, where every lineorder
     * has exactly one of five manufacturers. All row counts go in a single compound request.
     */
    public long countColumns(String frame, int rows) throws PilosaException {
        StringBuilder pql = new StringBuilder();
        for (int row = 0; row < rows; ++row) {
            pql.append("Count(Bitmap(frame=\"").append(frame).append("\", rowID=").append(row).append("))\n");
        }
        List<JsonNode> results = client.query(index, pql.toString());
        if (results.size() != rows) {
            throw new PilosaException(String.format("expected %d counts, got %d", rows, results.size()), null);
        }
        long total = 0;
        for (JsonNode result : results) {
            if (!result.isIntegralNumber()) {
                throw new PilosaException("count result is not a number: " + result, null);
            }
            total += result.asLong();
        }
        return total;
    }
}
