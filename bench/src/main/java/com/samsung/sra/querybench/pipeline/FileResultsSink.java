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
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;

/** One line per record, "output [in0 in1 ...]", in the order records were collected */
public class FileResultsSink implements ResultsSink {
    private static final Logger logger = LoggerFactory.getLogger(FileResultsSink.class);

    private final File file;
    private final BufferedWriter writer;

    /** Creates the file; fails with FileAlreadyExistsException rather than overwrite an existing one */
    public FileResultsSink(File file) throws IOException {
        this.file = file;
        this.writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    }

    /**
     * Sinks named {@code <dir>/<name>-<millis>-c<concurrency>-b<batchSize>.txt}; dir is created on demand. If that
     * file already exists, -2, -3, ... is appended to the name.
     */
    public static ResultsSink.Factory inDirectory(File directory) {
        return (name, timestampMillis, concurrency, batchSize) -> {
            FileUtils.forceMkdir(directory);
            String base = String.format("%s-%d-c%d-b%d",
                    name.replaceAll("[^A-Za-z0-9._-]", "_"), timestampMillis, concurrency, batchSize);
            for (int attempt = 1; ; ++attempt) {
                File file = new File(directory, attempt == 1 ? base + ".txt" : base + "-" + attempt + ".txt");
                try {
                    return new FileResultsSink(file);
                } catch (FileAlreadyExistsException e) {
                    logger.debug("{} exists, trying the next name", file);
                }
            }
        };
    }

    @Override
    public void write(QueryRecord record) throws IOException {
        writer.write(record.toResultLine());
        writer.newLine();
    }

    @Override
    public String getLocation() {
        return file.getPath();
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
