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

package com.energy.cmp;

import static com.energy.cmp.CommonUtils.checkArgument;
import static com.energy.cmp.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.energy.cmp.aggregation.ResultAggregator;
import com.energy.cmp.clustering.DistanceBandClusterer;
import com.energy.cmp.config.BandingStrategy;
import com.energy.cmp.config.ExogenousFilter;
import com.energy.cmp.context.ContextDefinition;
import com.energy.cmp.context.IContextProvider;
import com.energy.cmp.context.StaticContextManager;
import com.energy.cmp.executor.AbstractContextExecutor;
import com.energy.cmp.executor.ContextAnalyzer;
import com.energy.cmp.executor.ParallelContextExecutor;
import com.energy.cmp.executor.SequentialContextExecutor;
import com.energy.cmp.profile.MatrixProfileEngine;
import com.energy.cmp.returntypes.ContextResult;
import com.energy.cmp.returntypes.RunResult;
import com.energy.cmp.series.TimeSeries;

/**
 * Contextual Matrix Profile anomaly detection. For every declared context the
 * subsequences lying in the context's time of day windows are compared with
 * each other, the resulting nearest neighbor distances are grouped into ranked
 * bands, and the bands far above the baseline are reported as anomalous.
 *
 * <pre>
 * ContextualMatrixProfile cmp = ContextualMatrixProfile.builder().numberOfClusters(5).anomalyMargin(0.5).build();
 * RunResult result = cmp.analyze(series, List.of(new ContextDefinition(0, 6, 23)));
 * </pre>
 *
 * A failure in one context never stops the others. Results are always
 * reported in the order the contexts were declared.
 */
@Slf4j
@Getter
public class ContextualMatrixProfile {

    /**
     * Default number of distance bands per context.
     */
    public static final int DEFAULT_NUMBER_OF_CLUSTERS = DistanceBandClusterer.DEFAULT_NUMBER_OF_CLUSTERS;

    /**
     * Default relative margin above the baseline at which a band is anomalous.
     */
    public static final double DEFAULT_ANOMALY_MARGIN = DistanceBandClusterer.DEFAULT_ANOMALY_MARGIN;

    public static final BandingStrategy DEFAULT_BANDING_STRATEGY = DistanceBandClusterer.DEFAULT_BANDING_STRATEGY;

    /**
     * Default length of a recurrence cycle, one day.
     */
    public static final int DEFAULT_HOURS_PER_CYCLE = StaticContextManager.DEFAULT_HOURS_PER_CYCLE;

    public static final double DEFAULT_STD_EPSILON = MatrixProfileEngine.DEFAULT_STD_EPSILON;

    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    private final int numberOfClusters;

    private final double anomalyMargin;

    private final BandingStrategy bandingStrategy;

    private final int hoursPerCycle;

    private final double stdEpsilon;

    private final ExogenousFilter exogenousFilter;

    private final boolean parallelExecutionEnabled;

    /**
     * Number of threads used when parallel execution is enabled, 0 otherwise.
     */
    private final int threadPoolSize;

    private final ResultAggregator aggregator;

    private final AbstractContextExecutor executor;

    public ContextualMatrixProfile(Builder<?> builder) {
        checkArgument(builder.numberOfClusters > 0, "numberOfClusters must be greater than 0");
        checkArgument(builder.anomalyMargin >= 0, "anomalyMargin must be non-negative");
        checkNotNull(builder.bandingStrategy, "bandingStrategy must not be null");
        checkArgument(builder.hoursPerCycle > 0, "hoursPerCycle must be greater than 0");
        checkArgument(builder.stdEpsilon > 0, "stdEpsilon must be greater than 0");
        builder.threadPoolSize.ifPresent(n -> checkArgument((n > 0) || ((n == 0) && !builder.parallelExecutionEnabled),
                "threadPoolSize must be greater/equal than 0. To disable thread pool, set parallel execution to 'false'."));

        numberOfClusters = builder.numberOfClusters;
        anomalyMargin = builder.anomalyMargin;
        bandingStrategy = builder.bandingStrategy;
        hoursPerCycle = builder.hoursPerCycle;
        stdEpsilon = builder.stdEpsilon;
        exogenousFilter = builder.exogenousFilter.orElse(null);
        parallelExecutionEnabled = builder.parallelExecutionEnabled;

        aggregator = new ResultAggregator();
        ContextAnalyzer analyzer = new ContextAnalyzer(new MatrixProfileEngine(stdEpsilon, exogenousFilter),
                new DistanceBandClusterer(numberOfClusters, anomalyMargin, bandingStrategy), aggregator);
        if (parallelExecutionEnabled) {
            threadPoolSize = builder.threadPoolSize
                    .orElse(Math.max(1, Runtime.getRuntime().availableProcessors() - 1));
            executor = new ParallelContextExecutor(analyzer, threadPoolSize);
        } else {
            threadPoolSize = 0;
            executor = new SequentialContextExecutor(analyzer);
        }
    }

    /**
     * @return a new builder.
     */
    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * Analyzes time of day contexts. Each definition becomes a context over the
     * configured cycle length.
     *
     * @param series      the series
     * @param definitions the contexts in declaration order
     * @return one result per definition, in declaration order
     */
    public RunResult analyze(TimeSeries series, List<ContextDefinition> definitions) {
        checkNotNull(series, "series must not be null");
        checkNotNull(definitions, "definitions must not be null");
        long start = System.nanoTime();

        int observationsPerCycle;
        try {
            observationsPerCycle = series.observationsPerCycle(hoursPerCycle);
        } catch (ConfigurationException e) {
            // no context can be derived when the cycle does not fit the sampling
            // interval
            log.warn("cannot derive contexts: {}", e.getMessage());
            List<ContextResult> failed = new ArrayList<>(definitions.size());
            for (int i = 0; i < definitions.size(); i++) {
                failed.add(aggregator.failed(i, definitions.get(i).getLabel(0), null, e, 0L));
            }
            return aggregator.collect(failed, System.nanoTime() - start);
        }

        List<IContextProvider> providers = new ArrayList<>(definitions.size());
        for (ContextDefinition definition : definitions) {
            providers.add(new StaticContextManager(definition, observationsPerCycle, hoursPerCycle));
        }
        return run(series, providers, start);
    }

    /**
     * Analyzes contexts supplied by arbitrary providers.
     *
     * @param series    the series
     * @param providers the context providers in declaration order
     * @return one result per provider, in declaration order
     */
    public RunResult analyzeProviders(TimeSeries series, List<IContextProvider> providers) {
        checkNotNull(series, "series must not be null");
        checkNotNull(providers, "providers must not be null");
        return run(series, providers, System.nanoTime());
    }

    private RunResult run(TimeSeries series, List<IContextProvider> providers, long start) {
        log.debug("analyzing {} contexts over {} observations", providers.size(), series.size());
        RunResult result = aggregator.collect(executor.execute(series, providers), System.nanoTime() - start);
        log.info("analyzed {} contexts ({} failed), {} anomalies in {} ms", result.size(), result.getFailedCount(),
                result.getTotalAnomalyCount(), result.getTotalElapsedNanos() / 1_000_000);
        return result;
    }

    public static class Builder<T extends Builder<T>> {

        private int numberOfClusters = DEFAULT_NUMBER_OF_CLUSTERS;
        private double anomalyMargin = DEFAULT_ANOMALY_MARGIN;
        private BandingStrategy bandingStrategy = DEFAULT_BANDING_STRATEGY;
        private int hoursPerCycle = DEFAULT_HOURS_PER_CYCLE;
        private double stdEpsilon = DEFAULT_STD_EPSILON;
        private Optional<ExogenousFilter> exogenousFilter = Optional.empty();
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Optional<Integer> threadPoolSize = Optional.empty();

        public T numberOfClusters(int numberOfClusters) {
            this.numberOfClusters = numberOfClusters;
            return (T) this;
        }

        public T anomalyMargin(double anomalyMargin) {
            this.anomalyMargin = anomalyMargin;
            return (T) this;
        }

        public T bandingStrategy(BandingStrategy bandingStrategy) {
            this.bandingStrategy = bandingStrategy;
            return (T) this;
        }

        public T hoursPerCycle(int hoursPerCycle) {
            this.hoursPerCycle = hoursPerCycle;
            return (T) this;
        }

        public T stdEpsilon(double stdEpsilon) {
            this.stdEpsilon = stdEpsilon;
            return (T) this;
        }

        public T exogenousFilter(ExogenousFilter exogenousFilter) {
            this.exogenousFilter = Optional.ofNullable(exogenousFilter);
            return (T) this;
        }

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return (T) this;
        }

        public ContextualMatrixProfile build() {
            return new ContextualMatrixProfile(this);
        }
    }
}
