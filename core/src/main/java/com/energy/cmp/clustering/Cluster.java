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

package com.energy.cmp.clustering;

import java.util.Arrays;

import lombok.Getter;

/**
 * A band of nearest neighbor distances. Clusters are ranked by representative
 * distance; rank 0 holds the subsequences that best resemble their neighbors
 * and serves as the baseline.
 */
@Getter
public class Cluster {

    private final int rank;

    /**
     * ordinals of the member subsequences, in ranking order
     */
    private final int[] memberOrdinals;

    private final double representativeDistance;

    private final long elapsedNanos;

    private final boolean anomaly;

    public Cluster(int rank, int[] memberOrdinals, double representativeDistance, long elapsedNanos,
            boolean anomaly) {
        this.rank = rank;
        this.memberOrdinals = Arrays.copyOf(memberOrdinals, memberOrdinals.length);
        this.representativeDistance = representativeDistance;
        this.elapsedNanos = elapsedNanos;
        this.anomaly = anomaly;
    }

    public int size() {
        return memberOrdinals.length;
    }

    public boolean isEmpty() {
        return memberOrdinals.length == 0;
    }

    public int[] getMemberOrdinals() {
        return Arrays.copyOf(memberOrdinals, memberOrdinals.length);
    }
}
