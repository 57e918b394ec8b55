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

import java.util.List;

import lombok.Data;

/**
 * The data of one {@link com.energy.cmp.returntypes.ContextResult}. Doubles are
 * boxed so that undefined values can be written as JSON null.
 */
@Data
public class ContextResultState {

    private int declaredIndex;

    private String label;

    private String description;

    private String status;

    private String failureKind;

    private String failureReason;

    private Double coveragePercent;

    private int numberOfSubsequences;

    private long elapsedNanos;

    private List<ClusterSummaryState> clusterSummaries;

    private List<AnomalyLabelState> anomalyLabels;

    /**
     * nearest neighbor distance per subsequence, only present when the mapper
     * saves distance profiles
     */
    private List<Double> profileDistances;

    private List<Integer> profileStartIndices;

    /**
     * start index of each subsequence's nearest neighbor, -1 where undefined
     */
    private List<Integer> profileNeighborStartIndices;
}
