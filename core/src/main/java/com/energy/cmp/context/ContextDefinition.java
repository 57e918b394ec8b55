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

package com.energy.cmp.context;

import static com.energy.cmp.CommonUtils.formatHours;

import lombok.Getter;

/**
 * A time of day bounded context as declared by the caller: subsequences of
 * length {@code subsequenceLength} that start in {@code [startHour, endHour)}
 * of every cycle. Only type checked; domain validation happens in
 * {@link StaticContextManager}.
 */
@Getter
public class ContextDefinition {

    private final double startHour;

    private final double endHour;

    private final int subsequenceLength;

    public ContextDefinition(double startHour, double endHour, int subsequenceLength) {
        this.startHour = startHour;
        this.endHour = endHour;
        this.subsequenceLength = subsequenceLength;
    }

    public double getWindowLengthHours() {
        return endHour - startHour;
    }

    /**
     * A compact name such as {@code ctx_from00_00_to06_00_m05_45}. The
     * subsequence length is expressed in hours when the number of observations
     * per hour is known, otherwise as a count of observations.
     *
     * @param observationsPerHour observations per hour, or a non positive value
     *                            if unknown
     * @return the label
     */
    public String getLabel(int observationsPerHour) {
        String length = observationsPerHour > 0 && subsequenceLength > 0
                ? formatHours((double) subsequenceLength / observationsPerHour).replace(":", "_")
                : Integer.toString(subsequenceLength);
        return String.format("ctx_from%s_to%s_m%s", safeHours(startHour), safeHours(endHour), length);
    }

    /**
     * @param observationsPerHour observations per hour
     * @return a readable description of the context
     */
    public String getDescription(int observationsPerHour) {
        String length = observationsPerHour > 0 && subsequenceLength > 0
                ? formatHours((double) subsequenceLength / observationsPerHour)
                : "?";
        return String.format("Subsequences of %s h (m = %d) that start in [%s,%s)", length, subsequenceLength,
                startHour >= 0 ? formatHours(startHour) : Double.toString(startHour),
                endHour >= 0 ? formatHours(endHour) : Double.toString(endHour));
    }

    private static String safeHours(double hours) {
        return hours >= 0 ? formatHours(hours).replace(":", "_") : Double.toString(hours);
    }

    @Override
    public String toString() {
        return startHour + ":" + endHour + ":" + subsequenceLength;
    }
}
