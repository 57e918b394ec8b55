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

package com.energy.cmp.config;

import static com.energy.cmp.CommonUtils.checkArgument;

import lombok.Getter;

/**
 * Restricts a context to subsequences recorded under comparable exogenous
 * conditions, e.g. outdoor temperature between 15 and 25 degrees. A
 * subsequence whose mean exogenous value lies outside {@code [lower, upper]}
 * (or is missing) takes no part in the nearest neighbor search.
 */
@Getter
public class ExogenousFilter {

    private final double lower;

    private final double upper;

    public ExogenousFilter(double lower, double upper) {
        checkArgument(!Double.isNaN(lower) && !Double.isNaN(upper), "bounds must not be NaN");
        checkArgument(lower <= upper, "lower bound must not exceed upper bound");
        this.lower = lower;
        this.upper = upper;
    }

    public boolean accepts(double exogenousMean) {
        return !Double.isNaN(exogenousMean) && exogenousMean >= lower && exogenousMean <= upper;
    }
}
