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

import com.samsung.sra.querybench.BenchmarkSummary;
import com.samsung.sra.querybench.QuerySet;
import com.samsung.sra.querybench.pipeline.BenchmarkRunner;
import com.samsung.sra.querybench.pipeline.FileResultsSink;
import com.samsung.sra.querybench.pipeline.RunOptions;
import com.samsung.sra.querybench.pipeline.SweepDriver;
import com.samsung.sra.ssb.pilosa.DatasetStatistics;
import com.samsung.sra.ssb.pilosa.PilosaClient;
import com.samsung.sra.ssb.pilosa.PilosaException;
import com.samsung.sra.ssb.pilosa.PilosaQueryExecutor;
import com.samsung.sra.ssb.pilosa.SchemaProvisioner;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs Star Schema Benchmark query sets against a Pilosa server and prints one JSON summary per pass on stdout.
 *
 * Exit status is 0 if every pass succeeded, 1 if any failed, 2 on a bad command line or config.
 */
public class RunBenchmark {
    private static final Logger logger = LoggerFactory.getLogger(RunBenchmark.class);

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        ArgumentParser parser = ArgumentParsers.newArgumentParser("RunBenchmark", false).
                description("run query sets against Pilosa, once each or over a grid of concurrency and batch size").
                defaultHelp(true);
        parser.addArgument("conf").help("config file").type(File.class);
        parser.addArgument("queries").help("query set names, e.g. 1.1 2.1 4.1rb").nargs("+");
        parser.addArgument("-mode")
                .help("query: one pass per query set; grid: sweep over the [sweep] grid")
                .choices("query", "grid")
                .setDefault("query");
        parser.addArgument("-concurrency").help("concurrent requests in query mode (overrides config)").type(Integer.class);
        parser.addArgument("-batch-size").help("queries per request in query mode (overrides config)").type(Integer.class);
        parser.addArgument("-timeout").help("cancel everything after this many seconds (overrides config)").type(Long.class);
        parser.addArgument("-out").help("also write the summaries to this file").type(File.class);

        Configuration config;
        QueryCatalogue catalogue;
        List<String> names;
        List<Integer> sweepConcurrency, sweepBatchSizes;
        boolean grid;
        int concurrency, batchSize, queueDepth, maxConnections;
        long timeoutSeconds;
        File outFile;
        try {
            Namespace parsed = parser.parseArgs(args);
            config = new Configuration(parsed.get("conf"));
            catalogue = config.getCatalogue();
            names = parsed.getList("queries");
            grid = parsed.getString("mode").equals("grid");
            concurrency = ObjectUtils.defaultIfNull(parsed.getInt("concurrency"), config.getConcurrency());
            batchSize = ObjectUtils.defaultIfNull(parsed.getInt("batch_size"), config.getBatchSize());
            if (concurrency < 1 || batchSize < 1) {
                throw new IllegalArgumentException("concurrency and batch size must be positive");
            }
            queueDepth = config.getQueueDepth();
            sweepConcurrency = config.getSweepConcurrency();
            sweepBatchSizes = config.getSweepBatchSizes();
            maxConnections = Math.max(concurrency, config.getMaxConcurrency());
            timeoutSeconds = ObjectUtils.defaultIfNull(parsed.getLong("timeout"), config.getTimeoutSeconds());
            outFile = parsed.get("out");
        } catch (ArgumentParserException | IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            parser.printHelp(new PrintWriter(System.err, true));
            return 2;
        }

        List<BenchmarkSummary> summaries = new ArrayList<>();
        ScheduledExecutorService deadline = null;
        try (PilosaClient client = new PilosaClient(config.getPilosaAddress(), maxConnections,
                config.getConnectTimeoutMillis(), config.getResponseTimeoutMillis())) {
            logVersions(client);
            if (config.isProvisioningEnabled()) {
                new SchemaProvisioner(client, config.getIndex(), config.getFrames()).provision();
            }
            long columns = countColumns(client, config);
            BenchmarkRunner runner = new BenchmarkRunner(
                    new PilosaQueryExecutor(client, config.getIndex()),
                    new RunOptions()
                            .setQueueDepth(queueDepth)
                            .setColumnCount(columns)
                            .setSinkFactory(FileResultsSink.inDirectory(config.getResultsDirectory())));
            if (timeoutSeconds > 0) {
                deadline = Executors.newSingleThreadScheduledExecutor(
                        new BasicThreadFactory.Builder().namingPattern("deadline").daemon(true).build());
                deadline.schedule(() -> {
                    logger.error("deadline of {} s reached, cancelling", timeoutSeconds);
                    runner.cancel();
                }, timeoutSeconds, TimeUnit.SECONDS);
            }
            SweepDriver sweepDriver = new SweepDriver(runner, config.isSweepStopOnFailure()
                    ? SweepDriver.FailurePolicy.ABORT
                    : SweepDriver.FailurePolicy.CONTINUE);
            for (String name : names) {
                if (runner.isCancelled()) {
                    logger.warn("cancelled, skipping {}", name);
                    continue;
                }
                QuerySet querySet = catalogue.get(name);
                logger.info("{}", querySet);
                if (grid) {
                    summaries.addAll(sweepDriver.sweep(querySet, sweepConcurrency, sweepBatchSizes));
                } else {
                    summaries.add(runner.run(querySet, concurrency, batchSize));
                }
            }
        } catch (PilosaException e) {
            logger.error("preparing index {} on {}", config.getIndex(), config.getPilosaAddress(), e);
            return 1;
        } catch (IOException e) {
            logger.warn("closing HTTP client", e);
        } finally {
            if (deadline != null) {
                deadline.shutdownNow();
            }
        }

        try {
            out.println(SummaryReport.toJson(summaries));
            if (outFile != null) {
                SummaryReport.write(summaries, outFile);
                logger.info("wrote {} summaries to {}", summaries.size(), outFile);
            }
        } catch (IOException e) {
            logger.error("writing summaries", e);
            return 1;
        }
        return summaries.stream().anyMatch(BenchmarkSummary::isFailed) ? 1 : 0;
    }

    private static void logVersions(PilosaClient client) {
        String ours = ObjectUtils.defaultIfNull(RunBenchmark.class.getPackage().getImplementationVersion(), "dev");
        try {
            logger.info("querybench {} against Pilosa {} at {}", ours, client.getVersion(), client.getBaseUri());
        } catch (PilosaException e) {
            logger.warn("could not get Pilosa version from {}: {}", client.getBaseUri(), e.getMessage());
        }
    }

    /** Size of the dataset, reported with every summary. 0 if it cannot be computed */
    private static long countColumns(PilosaClient client, Configuration config) {
        try {
            long columns = new DatasetStatistics(client, config.getIndex())
                    .countColumns(config.getCardinalityFrame(), config.getCardinalityRows());
            logger.info("index {} has {} columns", config.getIndex(), columns);
            return columns;
        } catch (PilosaException e) {
            logger.warn("could not count columns of {}: {}", config.getIndex(), e.getMessage());
            return 0;
        }
    }
}
