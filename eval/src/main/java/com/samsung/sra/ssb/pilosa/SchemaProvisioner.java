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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** Makes sure the benchmark's index and frames exist before any query is sent. */
public class SchemaProvisioner {
    private static final Logger logger = LoggerFactory.getLogger(SchemaProvisioner.class);

    private final PilosaClient client;
    private final String index;
    private final List<String> frames;

    public SchemaProvisioner(PilosaClient client, String index, List<String> frames) {
        this.client = client;
        this.index = index;
        this.frames = frames;
    }

    /** Returns the number of objects (index and frames) that had to be created */
    public int provision() throws PilosaException {
        int created = 0;
        if (client.ensureIndex(index)) {
            ++created;
        }
        for (String frame : frames) {
            if (client.ensureFrame(index, frame)) {
                ++created;
            }
        }
        logger.info("index {} with {} frames ready, {} created", index, frames.size(), created);
        return created;
    }
}
