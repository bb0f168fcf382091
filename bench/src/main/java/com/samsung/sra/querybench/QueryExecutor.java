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
package com.samsung.sra.querybench;

import java.util.List;

/**
 * Client side of the engine under test. A request is several single queries concatenated together; the engine must
 * answer with one scalar per query, in request order.
 *
 * Implementations are shared by all workers of a run and must be thread-safe.
 */
@FunctionalInterface
public interface QueryExecutor {
    /**
     * Send one compound request in a single round trip.
     *
     * @throws QueryExecutionException on transport failure or if the engine reports an error for any sub-query. No
     *                                 partial results are returned in that case.
     */
    List<Long> execute(String request) throws QueryExecutionException;
}
