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

package com.energy.cmp.executor;

import static com.energy.cmp.CommonUtils.checkNotNull;

import lombok.extern.slf4j.Slf4j;

import com.energy.cmp.ConfigurationException;
import com.energy.cmp.DataException;
import com.energy.cmp.aggregation.ResultAggregator;
import com.energy.cmp.clustering.ClusteringResult;
import com.energy.cmp.clustering.DistanceBandClusterer;
import com.energy.cmp.context.Context;
import com.energy.cmp.context.IContextProvider;
import com.energy.cmp.profile.DistanceProfile;
import com.energy.cmp.profile.MatrixProfileEngine;
import com.energy.cmp.returntypes.ContextResult;
import com.energy.cmp.series.TimeSeries;

/**
 * Runs the stages of one context in order: derive, profile, cluster,
 * aggregate. Failures are scoped to the context and returned as a failed
 * result; this method does not throw for configuration or data problems.
 */
@Slf4j
public class ContextAnalyzer {

    private final MatrixProfileEngine engine;

    private final DistanceBandClusterer clusterer;

    private final ResultAggregator aggregator;

    public ContextAnalyzer(MatrixProfileEngine engine, DistanceBandClusterer clusterer,
            ResultAggregator aggregator) {
        this.engine = checkNotNull(engine, "engine must not be null");
        this.clusterer = checkNotNull(clusterer, "clusterer must not be null");
        this.aggregator = checkNotNull(aggregator, "aggregator must not be null");
    }

    public ContextResult analyze(int declaredIndex, IContextProvider provider, TimeSeries series) {
        long start = System.nanoTime();
        String label = provider.getLabel();
        String description = null;
        try {
            Context context = provider.provide(declaredIndex, series.size());
            label = context.getLabel();
            description = context.getDescription();
            log.debug("analyzing {} with {} subsequences", label, context.numberOfSubsequences());

            DistanceProfile profile = engine.compute(series, context);
            ClusteringResult clusteringResult = clusterer.cluster(profile, series);
            ContextResult result = aggregator.aggregate(context, profile, clusteringResult, System.nanoTime() - start);
            log.debug("finished {}: {} anomalies, coverage {}%", label, result.getAnomalyCount(),
                    result.getCoveragePercent());
            return result;
        } catch (ConfigurationException | DataException e) {
            log.warn("context {} failed: {}", label, e.getMessage());
            return aggregator.failed(declaredIndex, label, description, e, System.nanoTime() - start);
        } catch (RuntimeException e) {
            log.error("context {} failed unexpectedly", label, e);
            return aggregator.failed(declaredIndex, label, description, e, System.nanoTime() - start);
        }
    }
}
