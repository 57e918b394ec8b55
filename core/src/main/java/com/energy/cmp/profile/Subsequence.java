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

package com.energy.cmp.profile;

import lombok.Getter;

import com.energy.cmp.series.TimeSeries;

/**
 * A view of {@code length} consecutive values of a series. Values are only
 * copied when requested.
 */
@Getter
public class Subsequence {

    /**
     * position of the subsequence in the context's ascending start order
     */
    private final int ordinal;

    /**
     * index of the context window containing the subsequence
     */
    private final int windowIndex;

    private final int startIndex;

    private final int length;

    public Subsequence(int ordinal, int windowIndex, int startIndex, int length) {
        this.ordinal = ordinal;
        this.windowIndex = windowIndex;
        this.startIndex = startIndex;
        this.length = length;
    }

    public double[] values(TimeSeries series) {
        return series.copyOfRange(startIndex, length);
    }

    /**
     * @param series  the series this view refers to
     * @param epsilon standard deviations below this value are degenerate
     * @return the values rescaled to zero mean and unit variance, or null if the
     *         subsequence has a missing value or is degenerate
     */
    public double[] zNormalizedValues(TimeSeries series, double epsilon) {
        return SubsequenceStatistics.zNormalize(values(series), epsilon);
    }
}
