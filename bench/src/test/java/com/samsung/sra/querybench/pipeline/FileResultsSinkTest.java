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
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

public class FileResultsSinkTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void samePassNameNeverOverwrites() throws Exception {
        ResultsSink.Factory factory = FileResultsSink.inDirectory(folder.getRoot());
        QueryRecord first = new QueryRecord(0, new int[]{1993}, "Q(1993)\n");
        first.complete(7, 1, true);
        QueryRecord second = new QueryRecord(0, new int[]{1994}, "Q(1994)\n");
        second.complete(8, 1, true);

        String firstLocation, secondLocation;
        try (ResultsSink sink = factory.open("1.1", 1_500_000_000_000L, 1, 1)) {
            sink.write(first);
            firstLocation = sink.getLocation();
        }
        try (ResultsSink sink = factory.open("1.1", 1_500_000_000_000L, 1, 1)) {
            sink.write(second);
            secondLocation = sink.getLocation();
        }
        assertNotEquals(firstLocation, secondLocation);
        assertEquals(new File(folder.getRoot(), "1.1-1500000000000-c1-b1.txt").getPath(), firstLocation);
        assertEquals(new File(folder.getRoot(), "1.1-1500000000000-c1-b1-2.txt").getPath(), secondLocation);
        assertEquals(Arrays.asList("7 [1993]"), Files.readAllLines(new File(firstLocation).toPath(), StandardCharsets.UTF_8));
        assertEquals(Arrays.asList("8 [1994]"), Files.readAllLines(new File(secondLocation).toPath(), StandardCharsets.UTF_8));
    }

    @Test(expected = FileAlreadyExistsException.class)
    public void constructorRefusesExistingFile() throws Exception {
        new FileResultsSink(folder.newFile("taken.txt")).close();
    }
}
