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

package com.energy.cmp.returntypes;

import static com.energy.cmp.CommonUtils.checkNotNull;
import static com.energy.cmp.CommonUtils.checkState;

import java.util.Collections;
import java.util.List;

import lombok.Getter;

import com.energy.cmp.clustering.AnomalyLabel;
import com.energy.cmp.profile.DistanceProfile;

/**
 * The outcome of analyzing one context. A context is either analyzed, in which
 * case it carries cluster rows and anomaly labels (possibly none), or failed, in
 * which case it carries the failure kind and reason and nothing else.
 */
@Getter
public class ContextResult {

    private final int declaredIndex;

    private final String label;

    private final String description;

    private final ContextStatus status;

    private final FailureKind failureKind;

    private final String failureReason;

    /**
     * percentage of the subsequences of the context that were assigned to a
     * cluster
     */
    private final double coveragePercent;

    private final int numberOfSubsequences;

    private final List<ClusterSummary> clusterSummaries;

    private final List<AnomalyLabel> anomalyLabels;

    private final DistanceProfile distanceProfile;

    private final long elapsedNanos;

    private ContextResult(int declaredIndex, String label, String description, ContextStatus status,
            FailureKind failureKind, String failureReason, double coveragePercent, int numberOfSubsequences,
            List<ClusterSummary> clusterSummaries, List<AnomalyLabel> anomalyLabels, DistanceProfile distanceProfile,
            long elapsedNanos) {
        this.declaredIndex = declaredIndex;
        this.label = checkNotNull(label, "label must not be null");
        this.description = description;
        this.status = status;
        this.failureKind = failureKind;
        this.failureReason = failureReason;
        this.coveragePercent = coveragePercent;
        this.numberOfSubsequences = numberOfSubsequences;
        this.clusterSummaries = Collections.unmodifiableList(clusterSummaries);
        this.anomalyLabels = Collections.unmodifiableList(anomalyLabels);
        this.distanceProfile = distanceProfile;
        this.elapsedNanos = elapsedNanos;
    }

    public static ContextResult analyzed(int declaredIndex, String label, String description,
            double coveragePercent, int numberOfSubsequences, List<ClusterSummary> clusterSummaries,
            List<AnomalyLabel> anomalyLabels, DistanceProfile distanceProfile, long elapsedNanos) {
        checkNotNull(clusterSummaries, "cluster summaries must not be null");
        checkNotNull(anomalyLabels, "anomaly labels must not be null");
        return new ContextResult(declaredIndex, label, description, ContextStatus.ANALYZED, null, null,
                coveragePercent, numberOfSubsequences, clusterSummaries, anomalyLabels, distanceProfile,
                elapsedNanos);
    }

    public static ContextResult failed(int declaredIndex, String label, String description, FailureKind kind,
            String reason, long elapsedNanos) {
        checkNotNull(kind, "failure kind must not be null");
        return new ContextResult(declaredIndex, label, description, ContextStatus.FAILED, kind, reason, Double.NaN,
                0, Collections.emptyList(), Collections.emptyList(), null, elapsedNanos);
    }

    public boolean isFailed() {
        return status == ContextStatus.FAILED;
    }

    /**
     * @return the number of anomalous subsequences
     * @throws IllegalStateException if the context failed
     */
    public int getAnomalyCount() {
        checkState(!isFailed(), String.format("context %s failed, it has no anomaly count", label));
        return anomalyLabels.size();
    }

    public double getElapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }
}
