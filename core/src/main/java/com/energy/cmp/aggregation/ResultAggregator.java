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

package com.energy.cmp.aggregation;

import static com.energy.cmp.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.energy.cmp.clustering.Cluster;
import com.energy.cmp.clustering.ClusteringResult;
import com.energy.cmp.context.Context;
import com.energy.cmp.profile.DistanceProfile;
import com.energy.cmp.returntypes.ClusterSummary;
import com.energy.cmp.returntypes.ContextResult;
import com.energy.cmp.returntypes.FailureKind;
import com.energy.cmp.returntypes.RunResult;

/**
 * Turns the output of the profile and clustering stages into report rows.
 */
public class ResultAggregator {

    public ContextResult aggregate(Context context, DistanceProfile profile, ClusteringResult clusteringResult,
            long elapsedNanos) {
        checkNotNull(context, "context must not be null");
        checkNotNull(profile, "profile must not be null");
        checkNotNull(clusteringResult, "clustering result must not be null");

        List<ClusterSummary> rows = new ArrayList<>(clusteringResult.getClusters().size());
        for (Cluster cluster : clusteringResult.getClusters()) {
            rows.add(new ClusterSummary(cluster.getRank(), cluster.size(), cluster.getElapsedNanos(),
                    cluster.isAnomaly() ? cluster.size() : 0, cluster.getRepresentativeDistance()));
        }
        int total = profile.size();
        double coverage = total == 0 ? 0 : 100.0 * clusteringResult.getClusteredCount() / total;
        return ContextResult.analyzed(context.getDeclaredIndex(), context.getLabel(), context.getDescription(),
                coverage, total, rows, clusteringResult.getAnomalyLabels(), profile, elapsedNanos);
    }

    public ContextResult failed(int declaredIndex, String label, String description, Throwable cause,
            long elapsedNanos) {
        checkNotNull(cause, "cause must not be null");
        return ContextResult.failed(declaredIndex, label, description, FailureKind.of(cause), cause.getMessage(),
                elapsedNanos);
    }

    /**
     * Orders results by declared index, whatever order they completed in.
     */
    public RunResult collect(List<ContextResult> results, long totalElapsedNanos) {
        checkNotNull(results, "results must not be null");
        List<ContextResult> ordered = new ArrayList<>(results);
        ordered.sort(Comparator.comparingInt(ContextResult::getDeclaredIndex));
        return new RunResult(ordered, totalElapsedNanos);
    }
}
