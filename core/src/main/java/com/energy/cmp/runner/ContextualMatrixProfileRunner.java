/*
 * Copyright 2024 The Contextual Matrix Profile Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.energy.cmp.runner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.StringJoiner;

import lombok.extern.slf4j.Slf4j;

import com.energy.cmp.ContextualMatrixProfile;
import com.energy.cmp.returntypes.ClusterSummary;
import com.energy.cmp.returntypes.ContextResult;
import com.energy.cmp.returntypes.RunResult;
import com.energy.cmp.series.TimeSeries;

/**
 * A command-line application that parses command-line arguments, reads a series
 * from STDIN, analyzes the requested contexts and writes one row per cluster of
 * every context to STDOUT.
 */
@Slf4j
public class ContextualMatrixProfileRunner {

    public static final String[] RESULT_COLUMN_NAMES = { "context", "status", "rank", "size", "elapsed_ms",
            "anomaly_count", "representative_distance", "reason" };

    protected final ArgumentParser argumentParser;

    public ContextualMatrixProfileRunner() {
        this(new ArgumentParser(ContextualMatrixProfileRunner.class.getName(),
                "Detect anomalous subsequences in time of day contexts with the Contextual Matrix Profile."));
    }

    public ContextualMatrixProfileRunner(ArgumentParser argumentParser) {
        this.argumentParser = argumentParser;
    }

    public static void main(String... args) throws IOException {
        ContextualMatrixProfileRunner runner = new ContextualMatrixProfileRunner();
        runner.parse(args);
        log.info("Contextual Matrix Profile with contexts {}, k = {}, margin = {}",
                runner.argumentParser.getContextDefinitions(), runner.argumentParser.getNumberOfClusters(),
                runner.argumentParser.getAnomalyMargin());
        try {
            runner.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                    new PrintWriter(System.out, true, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            log.error("cannot read the input series: {}", e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Parse the given command-line arguments.
     *
     * @param arguments An array of command-line arguments.
     */
    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    /**
     * Read the series from an input stream, analyze it, and write the report to
     * an output stream.
     *
     * @param in  An input stream where the series will be read.
     * @param out An output stream where the report will be written.
     * @throws IOException if IO errors are encountered during reading or writing.
     */
    public void run(BufferedReader in, PrintWriter out) throws IOException {
        TimeSeries series = new TimeSeriesReader(argumentParser.getDelimiter(), argumentParser.getHeaderRow())
                .read(in);
        log.debug("read {} observations", series.size());

        ContextualMatrixProfile.Builder<?> builder = ContextualMatrixProfile.builder()
                .numberOfClusters(argumentParser.getNumberOfClusters())
                .anomalyMargin(argumentParser.getAnomalyMargin()).bandingStrategy(argumentParser.getBandingStrategy())
                .hoursPerCycle(argumentParser.getHoursPerCycle()).parallelExecutionEnabled(argumentParser.getParallel());
        if (argumentParser.getParallel() && argumentParser.getThreadPoolSize() > 0) {
            builder.threadPoolSize(argumentParser.getThreadPoolSize());
        }

        RunResult result = builder.build().analyze(series, argumentParser.getContextDefinitions());
        write(result, out);
        out.flush();
    }

    protected void write(RunResult result, PrintWriter out) {
        String delimiter = argumentParser.getDelimiter();
        out.println(String.join(delimiter, RESULT_COLUMN_NAMES));
        for (ContextResult contextResult : result.getContextResults()) {
            if (contextResult.isFailed()) {
                StringJoiner joiner = new StringJoiner(delimiter);
                joiner.add(contextResult.getLabel()).add(contextResult.getStatus().name()).add("").add("")
                        .add(formatMillis(contextResult.getElapsedMillis())).add("").add("")
                        .add(quote(contextResult.getFailureKind() + ": " + contextResult.getFailureReason()));
                out.println(joiner.toString());
                continue;
            }
            for (ClusterSummary row : contextResult.getClusterSummaries()) {
                StringJoiner joiner = new StringJoiner(delimiter);
                joiner.add(contextResult.getLabel()).add(contextResult.getStatus().name())
                        .add(Integer.toString(row.getRank())).add(Integer.toString(row.getSize()))
                        .add(formatMillis(row.getElapsedMillis())).add(Integer.toString(row.getAnomalyCount()))
                        .add(Double.toString(row.getRepresentativeDistance())).add("");
                out.println(joiner.toString());
            }
        }
    }

    static String formatMillis(double millis) {
        return String.format(Locale.ROOT, "%.3f", millis);
    }

    static String quote(String text) {
        return "\"" + text.replace("\"", "\"\"") + "\"";
    }
}
