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

import com.samsung.sra.querybench.QuerySet;

import java.util.Set;

/** Maps query-set names to query sets. */
public interface QueryCatalogue {
    /** Returns the named query set, or an empty set (which runs no queries) if the name is unknown. */
    QuerySet get(String name);

    Set<String> getNames();
}
