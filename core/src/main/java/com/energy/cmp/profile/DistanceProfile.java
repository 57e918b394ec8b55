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

import static com.energy.cmp.CommonUtils.checkArgument;

import java.util.Arrays;

import lombok.Getter;

/**
 * The nearest neighbor distance of every subsequence of a context, indexed by
 * subsequence ordinal (ascending start order). A NaN distance marks a
 * subsequence for which no defined distance exists, because it is missing,
 * filtered out or (nearly) constant, or because all its candidates are.
 */
public class DistanceProfile {

    @Getter
    private final int subsequenceLength;

    private final int[] startIndices;

    private final int[] windowIndices;

    private final double[] distances;

    private final int[] neighborStartIndices;

    @Getter
    private final ContextualDistanceMatrix contextualDistanceMatrix;

    /**
     * number of subsequences containing a missing value
     */
    @Getter
    private final int missingCount;

    /**
     * number of subsequences rejected by the exogenous filter
     */
    @Getter
    private final int filteredCount;

    /**
     * number of (nearly) constant subsequences
     */
    @Getter
    private final int degenerateCount;

    public DistanceProfile(int subsequenceLength, int[] startIndices, int[] windowIndices, double[] distances,
            int[] neighborStartIndices, ContextualDistanceMatrix contextualDistanceMatrix, int missingCount,
            int filteredCount, int degenerateCount) {
        checkArgument(startIndices.length == distances.length && windowIndices.length == distances.length
                && neighborStartIndices.length == distances.length, "profile arrays must have the same length");
        this.subsequenceLength = subsequenceLength;
        this.startIndices = Arrays.copyOf(startIndices, startIndices.length);
        this.windowIndices = Arrays.copyOf(windowIndices, windowIndices.length);
        this.distances = Arrays.copyOf(distances, distances.length);
        this.neighborStartIndices = Arrays.copyOf(neighborStartIndices, neighborStartIndices.length);
        this.contextualDistanceMatrix = contextualDistanceMatrix;
        this.missingCount = missingCount;
        this.filteredCount = filteredCount;
        this.degenerateCount = degenerateCount;
    }

    /**
     * @return the number of subsequences in the profile
     */
    public int size() {
        return distances.length;
    }

    public double getDistance(int ordinal) {
        return distances[ordinal];
    }

    public int getStartIndex(int ordinal) {
        return startIndices[ordinal];
    }

    public int getWindowIndex(int ordinal) {
        return windowIndices[ordinal];
    }

    /**
     * @param ordinal subsequence ordinal
     * @return start index of the nearest neighbor, -1 if there is none
     */
    public int getNeighborStartIndex(int ordinal) {
        return neighborStartIndices[ordinal];
    }

    public boolean isDefined(int ordinal) {
        return !Double.isNaN(distances[ordinal]);
    }

    /**
     * @return the number of entries with a defined distance
     */
    public int definedCount() {
        int count = 0;
        for (double distance : distances) {
            if (!Double.isNaN(distance)) {
                count++;
            }
        }
        return count;
    }

    public double[] getDistances() {
        return Arrays.copyOf(distances, distances.length);
    }

    public int[] getStartIndices() {
        return Arrays.copyOf(startIndices, startIndices.length);
    }

    public int[] getNeighborStartIndices() {
        return Arrays.copyOf(neighborStartIndices, neighborStartIndices.length);
    }
}
