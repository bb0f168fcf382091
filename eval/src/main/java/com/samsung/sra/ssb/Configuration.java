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

import com.moandjiezana.toml.Toml;

import java.io.File;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Configuration backed by a Toml file. See example.toml for a sample config.
 *
 * Raises IllegalArgumentException on some parse errors but is generally optimistic and expects the file is a legal
 * config.
 */
public class Configuration {
    /** Frames of the SSB lineorder index as laid out by the importer */
    static final List<String> DEFAULT_FRAMES = Arrays.asList(
            "lo_quantity", "lo_quantity_b", "lo_extendedprice", "lo_discount", "lo_discount_b", "lo_revenue",
            "lo_supplycost", "lo_profit", "lo_revenue_computed",
            "c_city", "c_nation", "c_region",
            "s_city", "s_nation", "s_region",
            "p_mfgr", "p_category", "p_brand1",
            "lo_year", "lo_month", "lo_weeknum");

    private final Toml toml;
    private final File baseDirectory;

    public Configuration(File file) {
        if (!file.isFile()) throw new IllegalArgumentException("invalid or non-existent config file " + file);
        toml = new Toml().read(file);
        baseDirectory = file.getAbsoluteFile().getParentFile();
    }

    public Toml getToml() {
        return toml;
    }

    /** host:port of the Pilosa server */
    public String getPilosaAddress() {
        return toml.getString("pilosa", "localhost:10101");
    }

    public String getIndex() {
        return toml.getString("index", "ssb");
    }

    /** Where per-query result files are written; relative paths are resolved against the working directory */
    public File getResultsDirectory() {
        return new File(toml.getString("results-dir", "results"));
    }

    /** Query catalogue file, resolved against the config file's directory, or null to use the bundled SSB catalogue */
    public File getCatalogueFile() {
        String path = toml.getString("catalogue");
        if (path == null) {
            return null;
        }
        File file = new File(path);
        return file.isAbsolute() ? file : new File(baseDirectory, path);
    }

    public QueryCatalogue getCatalogue() {
        File file = getCatalogueFile();
        return file != null ? TomlQueryCatalogue.fromFile(file) : TomlQueryCatalogue.bundled();
    }

    /** Number of compound requests in flight in single-run mode */
    public int getConcurrency() {
        return positive("concurrency", toml.getLong("concurrency", 32L));
    }

    /** Number of queries per compound request in single-run mode */
    public int getBatchSize() {
        return positive("batch-size", toml.getLong("batch-size", 1L));
    }

    /** Batches buffered between producer and workers. 0 means twice the concurrency */
    public int getQueueDepth() {
        long depth = toml.getLong("queue-depth", 0L);
        if (depth < 0 || depth > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("queue-depth must be a non-negative integer, got " + depth);
        }
        return (int) depth;
    }

    /** Cancel the whole invocation after this many seconds. 0 means no deadline */
    public long getTimeoutSeconds() {
        return toml.getLong("timeout-seconds", 0L);
    }

    /** Create the index and frames before running if they do not exist yet */
    public boolean isProvisioningEnabled() {
        return toml.getBoolean("provision", true);
    }

    public List<String> getFrames() {
        List<String> frames = toml.getList("frames");
        return frames != null ? frames : DEFAULT_FRAMES;
    }

    public List<Integer> getSweepConcurrency() {
        return getSweepValues("concurrency", Arrays.asList(8L, 16L, 32L));
    }

    public List<Integer> getSweepBatchSizes() {
        return getSweepValues("batch-size", Arrays.asList(2L, 4L, 8L));
    }

    /** Whether a grid sweep stops at the first failed pass. Default false: failed passes are reported and skipped */
    public boolean isSweepStopOnFailure() {
        Toml conf = toml.getTable("sweep");
        return conf != null && conf.getBoolean("stop-on-failure", false);
    }

    private List<Integer> getSweepValues(String key, List<Long> defaultValues) {
        Toml conf = toml.getTable("sweep");
        List<Long> values = conf != null ? conf.getList(key, defaultValues) : defaultValues;
        if (values.isEmpty()) {
            throw new IllegalArgumentException("empty sweep." + key);
        }
        return values.stream().map(v -> positive("sweep." + key, v)).collect(Collectors.toList());
    }

    /** Frame whose rows partition the dataset; the sum of their counts is the reported dataset size */
    public String getCardinalityFrame() {
        Toml conf = toml.getTable("cardinality");
        return conf != null ? conf.getString("frame", "p_mfgr") : "p_mfgr";
    }

    public int getCardinalityRows() {
        Toml conf = toml.getTable("cardinality");
        return conf != null ? conf.getLong("rows", 5L).intValue() : 5;
    }

    public int getConnectTimeoutMillis() {
        Toml conf = toml.getTable("http");
        return conf != null ? conf.getLong("connect-timeout-ms", 5_000L).intValue() : 5_000;
    }

    public int getResponseTimeoutMillis() {
        Toml conf = toml.getTable("http");
        return conf != null ? conf.getLong("response-timeout-ms", 600_000L).intValue() : 600_000;
    }

    /** Largest number of concurrent requests any configured run can issue; sizes the HTTP connection pool */
    public int getMaxConcurrency() {
        int max = getConcurrency();
        for (int c : getSweepConcurrency()) {
            max = Math.max(max, c);
        }
        return max;
    }

    private static int positive(String key, Long value) {
        if (value == null || value < 1 || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(key + " must be a positive integer, got " + value);
        }
        return value.intValue();
    }
}
