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

package com.energy.cmp.serialize;

import static com.energy.cmp.CommonUtils.checkArgument;
import static com.energy.cmp.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import lombok.Setter;

import com.energy.cmp.clustering.AnomalyLabel;
import com.energy.cmp.profile.DistanceProfile;
import com.energy.cmp.returntypes.ClusterSummary;
import com.energy.cmp.returntypes.ContextResult;
import com.energy.cmp.returntypes.ContextStatus;
import com.energy.cmp.returntypes.FailureKind;
import com.energy.cmp.returntypes.RunResult;

/**
 * A utility class for creating a {@link RunResultState} instance from a
 * {@link RunResult} instance and vice versa. Non-finite doubles are mapped to
 * null. Distance profiles are written only on request and are never restored;
 * a restored context result has no distance profile.
 */
@Getter
@Setter
public class RunResultMapper implements IStateMapper<RunResult, RunResultState> {

    /**
     * A flag indicating whether the nearest neighbor distance and neighbor
     * start index of every subsequence should be included in the state object. Not saved by default.
     */
    private boolean saveDistanceProfileEnabled = false;

    @Override
    public RunResultState toState(RunResult model) {
        checkNotNull(model, "model must not be null");
        RunResultState state = new RunResultState();
        state.setTotalElapsedNanos(model.getTotalElapsedNanos());
        List<ContextResultState> contextResults = new ArrayList<>(model.size());
        for (ContextResult result : model.getContextResults()) {
            contextResults.add(toState(result));
        }
        state.setContextResults(contextResults);
        return state;
    }

    @Override
    public RunResult toModel(RunResultState state) {
        checkNotNull(state, "state must not be null");
        checkArgument(RunResultState.VERSION_1_0.equals(state.getVersion()),
                String.format("unsupported state version %s", state.getVersion()));
        List<ContextResult> results = new ArrayList<>();
        if (state.getContextResults() != null) {
            for (ContextResultState contextState : state.getContextResults()) {
                results.add(toModel(contextState));
            }
        }
        return new RunResult(results, state.getTotalElapsedNanos());
    }

    ContextResultState toState(ContextResult result) {
        ContextResultState state = new ContextResultState();
        state.setDeclaredIndex(result.getDeclaredIndex());
        state.setLabel(result.getLabel());
        state.setDescription(result.getDescription());
        state.setStatus(result.getStatus().name());
        state.setElapsedNanos(result.getElapsedNanos());
        if (result.isFailed()) {
            state.setFailureKind(result.getFailureKind().name());
            state.setFailureReason(result.getFailureReason());
            return state;
        }

        state.setCoveragePercent(finiteOrNull(result.getCoveragePercent()));
        state.setNumberOfSubsequences(result.getNumberOfSubsequences());
        List<ClusterSummaryState> rows = new ArrayList<>();
        for (ClusterSummary summary : result.getClusterSummaries()) {
            ClusterSummaryState row = new ClusterSummaryState();
            row.setRank(summary.getRank());
            row.setSize(summary.getSize());
            row.setElapsedNanos(summary.getElapsedNanos());
            row.setAnomalyCount(summary.getAnomalyCount());
            row.setRepresentativeDistance(finiteOrNull(summary.getRepresentativeDistance()));
            rows.add(row);
        }
        state.setClusterSummaries(rows);

        List<AnomalyLabelState> labels = new ArrayList<>();
        for (AnomalyLabel label : result.getAnomalyLabels()) {
            AnomalyLabelState labelState = new AnomalyLabelState();
            labelState.setSubsequenceIndex(label.getSubsequenceIndex());
            labelState.setStartIndex(label.getStartIndex());
            labelState.setWindowIndex(label.getWindowIndex());
            labelState.setClusterRank(label.getClusterRank());
            labelState.setDistance(finiteOrNull(label.getDistance()));
            labelState.setExogenousMean(finiteOrNull(label.getExogenousMean()));
            labels.add(labelState);
        }
        state.setAnomalyLabels(labels);

        DistanceProfile profile = result.getDistanceProfile();
        if (saveDistanceProfileEnabled && profile != null) {
            List<Double> distances = new ArrayList<>(profile.size());
            List<Integer> starts = new ArrayList<>(profile.size());
            List<Integer> neighbors = new ArrayList<>(profile.size());
            for (int i = 0; i < profile.size(); i++) {
                distances.add(finiteOrNull(profile.getDistance(i)));
                starts.add(profile.getStartIndex(i));
                neighbors.add(profile.getNeighborStartIndex(i));
            }
            state.setProfileDistances(distances);
            state.setProfileStartIndices(starts);
            state.setProfileNeighborStartIndices(neighbors);
        }
        return state;
    }

    ContextResult toModel(ContextResultState state) {
        ContextStatus status = ContextStatus.valueOf(state.getStatus());
        if (status == ContextStatus.FAILED) {
            return ContextResult.failed(state.getDeclaredIndex(), state.getLabel(), state.getDescription(),
                    FailureKind.valueOf(state.getFailureKind()), state.getFailureReason(), state.getElapsedNanos());
        }

        List<ClusterSummary> rows = new ArrayList<>();
        if (state.getClusterSummaries() != null) {
            for (ClusterSummaryState row : state.getClusterSummaries()) {
                rows.add(new ClusterSummary(row.getRank(), row.getSize(), row.getElapsedNanos(),
                        row.getAnomalyCount(), nullToNaN(row.getRepresentativeDistance())));
            }
        }
        List<AnomalyLabel> labels = new ArrayList<>();
        if (state.getAnomalyLabels() != null) {
            for (AnomalyLabelState label : state.getAnomalyLabels()) {
                labels.add(new AnomalyLabel(label.getSubsequenceIndex(), label.getStartIndex(),
                        label.getWindowIndex(), label.getClusterRank(), nullToNaN(label.getDistance()),
                        nullToNaN(label.getExogenousMean())));
            }
        }
        return ContextResult.analyzed(state.getDeclaredIndex(), state.getLabel(), state.getDescription(),
                nullToNaN(state.getCoveragePercent()), state.getNumberOfSubsequences(), rows, labels, null,
                state.getElapsedNanos());
    }

    static Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }

    static double nullToNaN(Double value) {
        return value == null ? Double.NaN : value;
    }
}
