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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One row of the per-context report.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ClusterSummary {

    private final int rank;

    private final int size;

    private final long elapsedNanos;

    private final int anomalyCount;

    private final double representativeDistance;

    public ClusterSummary(int rank, int size, long elapsedNanos, int anomalyCount, double representativeDistance) {
        this.rank = rank;
        this.size = size;
        this.elapsedNanos = elapsedNanos;
        this.anomalyCount = anomalyCount;
        this.representativeDistance = representativeDistance;
    }

    public double getElapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }
}
