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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Marks one subsequence as anomalous within its context.
 */
@Getter
@ToString
@EqualsAndHashCode
public class AnomalyLabel {

    /**
     * ordinal of the subsequence within its context
     */
    private final int subsequenceIndex;

    private final int startIndex;

    private final int windowIndex;

    private final int clusterRank;

    private final double distance;

    /**
     * mean of the exogenous channel over the subsequence, NaN when the series
     * has none
     */
    private final double exogenousMean;

    public AnomalyLabel(int subsequenceIndex, int startIndex, int windowIndex, int clusterRank, double distance,
            double exogenousMean) {
        this.subsequenceIndex = subsequenceIndex;
        this.startIndex = startIndex;
        this.windowIndex = windowIndex;
        this.clusterRank = clusterRank;
        this.distance = distance;
        this.exogenousMean = exogenousMean;
    }
}
