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

import static com.energy.cmp.CommonUtils.checkArgument;
import static com.energy.cmp.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

import com.energy.cmp.config.BandingStrategy;
import com.energy.cmp.context.ContextDefinition;

/**
 * A utility class for parsing command-line arguments.
 */
public class ArgumentParser {

    public static final String ARCHIVE_NAME = "target/contextual-matrix-profile-core-1.0.0.jar";
    public static final String CONTEXT_SEPARATOR = ";";
    private final String runnerClass;
    private final String runnerDescription;
    private final Map<String, Argument<?>> shortFlags;
    private final Map<String, Argument<?>> longFlags;
    private final StringArgument contexts;
    private final IntegerArgument numberOfClusters;
    private final DoubleArgument anomalyMargin;
    private final IntegerArgument hoursPerCycle;
    private final Argument<BandingStrategy> banding;
    private final StringArgument delimiter;
    private final BooleanArgument headerRow;
    private final BooleanArgument parallel;
    private final IntegerArgument threadPoolSize;

    /**
     * Create a new ArgumentParser. The runner class and runner description will
     * be used in help text.
     *
     * @param runnerClass       The name of the runner class where this argument
     *                          parser is being invoked.
     * @param runnerDescription A description of the runner class where this
     *                          argument parser is being invoked.
     */
    public ArgumentParser(String runnerClass, String runnerDescription) {
        this.runnerClass = runnerClass;
        this.runnerDescription = runnerDescription;
        shortFlags = new HashMap<>();
        longFlags = new HashMap<>();

        contexts = new StringArgument("-x", "--contexts",
                "Contexts as start:end:m with start and end in hours and m in observations, separated by '"
                        + CONTEXT_SEPARATOR + "'.",
                "0:6:23", ArgumentParser::parseContexts);

        addArgument(contexts);

        numberOfClusters = new IntegerArgument("-k", "--number-of-clusters",
                "Number of distance bands per context.", 5,
                n -> checkArgument(n > 0, "number of clusters should be greater than 0"));

        addArgument(numberOfClusters);

        anomalyMargin = new DoubleArgument("-a", "--anomaly-margin",
                "Relative margin above the baseline band at which a band is anomalous.", 0.5,
                x -> checkArgument(x >= 0, "anomaly margin should be non-negative"));

        addArgument(anomalyMargin);

        hoursPerCycle = new IntegerArgument(null, "--hours-per-cycle", "Length of a recurrence cycle in hours.", 24,
                n -> checkArgument(n > 0, "hours per cycle should be greater than 0"));

        addArgument(hoursPerCycle);

        banding = new Argument<>(null, "--banding", "Banding strategy, EQUAL_WIDTH or EQUAL_COUNT.",
                BandingStrategy.EQUAL_WIDTH, s -> BandingStrategy.valueOf(s.trim().toUpperCase(Locale.ROOT)));

        addArgument(banding);

        delimiter = new StringArgument("-d", "--delimiter", "The character or string used as a field delimiter.",
                ",");

        addArgument(delimiter);

        headerRow = new BooleanArgument(null, "--header-row", "Set to 'true' if the data contains a header row.",
                false);

        addArgument(headerRow);

        parallel = new BooleanArgument(null, "--parallel", "Set to 'true' to analyze contexts in parallel.", false);

        addArgument(parallel);

        threadPoolSize = new IntegerArgument(null, "--thread-pool-size",
                "Number of threads used in parallel mode, or 0 for the default.", 0,
                n -> checkArgument(n >= 0, "thread pool size should be non-negative"));

        addArgument(threadPoolSize);
    }

    /**
     * Add a new argument to this argument parser.
     *
     * @param argument An Argument instance for a command-line argument that
     *                 should be parsed.
     */
    protected void addArgument(Argument<?> argument) {
        checkNotNull(argument, "argument should not be null");

        checkArgument(argument.getShortFlag() == null || !shortFlags.containsKey(argument.getShortFlag()),
                String.format("An argument mapping already exists for %s", argument.getShortFlag()));

        checkArgument(!longFlags.containsKey(argument.getLongFlag()),
                String.format("An argument mapping already exists for %s", argument.getLongFlag()));

        if (argument.getShortFlag() != null) {
            shortFlags.put(argument.getShortFlag(), argument);
        }

        longFlags.put(argument.getLongFlag(), argument);
    }

    /**
     * Parse the given array of command-line arguments.
     *
     * @param arguments An array of command-line arguments.
     */
    public void parse(String... arguments) {
        int i = 0;
        while (i < arguments.length) {
            String flag = arguments[i];

            try {
                if (shortFlags.containsKey(flag)) {
                    shortFlags.get(flag).parse(arguments[++i]);
                } else if (longFlags.containsKey(flag)) {
                    longFlags.get(flag).parse(arguments[++i]);
                } else if ("-h".equals(flag) || "--help".equals(flag)) {
                    printUsage();
                    Runtime.getRuntime().exit(0);
                } else {
                    throw new IllegalArgumentException("Unknown argument: " + flag);
                }
            } catch (Exception e) {
                printUsageAndExit("%s: %s", e.getClass().getName(), e.getMessage());
            }

            i++;
        }
    }

    /**
     * Print a usage message to STDOUT.
     */
    public void printUsage() {
        System.out.println(String.format("Usage: java -jar %s [options] < input_file > output_file", ARCHIVE_NAME));
        System.out.println();
        System.out.println(runnerDescription);
        System.out.println();
        System.out.println("Input rows: timestamp,value[,exogenous]");
        System.out.println();
        System.out.println("Options:");

        longFlags.values().stream().map(Argument::getHelpMessage).sorted()
                .forEach(msg -> System.out.println("\t" + msg));

        System.out.println();
        System.out.println("\t--help, -h: Print this help message and exit.");
    }

    /**
     * Print an error message, the usage message, and exit the application.
     *
     * @param errorMessage  An error message to show the user.
     * @param formatObjects An array of format objects that will be interpolated
     *                      into the error message using {@link String#format}.
     */
    public void printUsageAndExit(String errorMessage, Object... formatObjects) {
        System.err.println("Error: " + String.format(errorMessage, formatObjects));
        printUsage();
        System.exit(1);
    }

    public String getRunnerClass() {
        return runnerClass;
    }

    /**
     * @return the user-specified contexts, in declaration order
     */
    public List<ContextDefinition> getContextDefinitions() {
        return parseContexts(contexts.getValue());
    }

    /**
     * @return the user-specified value of the number-of-clusters parameter
     */
    public int getNumberOfClusters() {
        return numberOfClusters.getValue();
    }

    /**
     * @return the user-specified value of the anomaly-margin parameter
     */
    public double getAnomalyMargin() {
        return anomalyMargin.getValue();
    }

    public int getHoursPerCycle() {
        return hoursPerCycle.getValue();
    }

    public BandingStrategy getBandingStrategy() {
        return banding.getValue();
    }

    /**
     * @return the user-specified value of the delimiter parameter
     */
    public String getDelimiter() {
        return delimiter.getValue();
    }

    /**
     * @return the user-specified value of the header-row parameter
     */
    public boolean getHeaderRow() {
        return headerRow.getValue();
    }

    public boolean getParallel() {
        return parallel.getValue();
    }

    public int getThreadPoolSize() {
        return threadPoolSize.getValue();
    }

    /**
     * Parses a list of {@code start:end:m} entries such as {@code 0:6:23;5.25:9:16}.
     *
     * @param value the option value
     * @return the context definitions
     */
    public static List<ContextDefinition> parseContexts(String value) {
        checkNotNull(value, "contexts should not be null");
        List<ContextDefinition> result = new ArrayList<>();
        for (String entry : value.split(CONTEXT_SEPARATOR)) {
            if (entry.trim().isEmpty()) {
                continue;
            }
            String[] parts = entry.trim().split(":");
            checkArgument(parts.length == 3,
                    String.format("context '%s' should have the form start:end:m", entry.trim()));
            result.add(new ContextDefinition(Double.parseDouble(parts[0]), Double.parseDouble(parts[1]),
                    Integer.parseInt(parts[2])));
        }
        checkArgument(!result.isEmpty(), "at least one context should be given");
        return result;
    }

    public static class Argument<T> {

        private final String shortFlag;
        private final String longFlag;
        private final String description;
        private final T defaultValue;
        private final Function<String, T> parseFunction;
        private final Consumer<T> validateFunction;
        private T value;

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction, Consumer<T> validateFunction) {
            this.shortFlag = shortFlag;
            this.longFlag = longFlag;
            this.description = description;
            this.defaultValue = defaultValue;
            this.parseFunction = parseFunction;
            this.validateFunction = validateFunction;
            value = defaultValue;
        }

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction) {
            this(shortFlag, longFlag, description, defaultValue, parseFunction, t -> {
            });
        }

        public String getShortFlag() {
            return shortFlag;
        }

        public String getLongFlag() {
            return longFlag;
        }

        public String getDescription() {
            return description;
        }

        public T getDefaultValue() {
            return defaultValue;
        }

        public String getHelpMessage() {
            if (shortFlag != null) {
                return String.format("%s, %s: %s (default: %s)", longFlag, shortFlag, description, defaultValue);
            } else {
                return String.format("%s: %s (default: %s)", longFlag, description, defaultValue);
            }
        }

        public void parse(String string) {
            value = parseFunction.apply(string);
            validateFunction.accept(value);
        }

        public T getValue() {
            return value;
        }
    }

    public static class StringArgument extends Argument<String> {
        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue,
                Consumer<String> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, x -> x, validateFunction);
        }

        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, x -> x);
        }
    }

    public static class BooleanArgument extends Argument<Boolean> {
        public BooleanArgument(String shortFlag, String longFlag, String description, boolean defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Boolean::parseBoolean);
        }
    }

    public static class IntegerArgument extends Argument<Integer> {
        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue,
                Consumer<Integer> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt, validateFunction);
        }

        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt);
        }
    }

    public static class DoubleArgument extends Argument<Double> {
        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue,
                Consumer<Double> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble, validateFunction);
        }

        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble);
        }
    }
}
