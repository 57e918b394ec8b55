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

/**
 * The window by window view of a context: entry {@code (p, q)} holds the
 * smallest defined distance between a subsequence lying in window {@code p}
 * (the query) and a non trivial subsequence lying in window {@code q} (the
 * series), together with the start indices of that best match. With one window
 * per day this is a day by day similarity matrix.
 */
public class ContextualDistanceMatrix {

    private final int numberOfWindows;

    private final double[][] distances;

    private final int[][] matchQuery;

    private final int[][] matchSeries;

    public ContextualDistanceMatrix(int numberOfWindows) {
        checkArgument(numberOfWindows >= 0, "number of windows must be non-negative");
        this.numberOfWindows = numberOfWindows;
        distances = new double[numberOfWindows][numberOfWindows];
        matchQuery = new int[numberOfWindows][numberOfWindows];
        matchSeries = new int[numberOfWindows][numberOfWindows];
        for (int p = 0; p < numberOfWindows; p++) {
            Arrays.fill(distances[p], Double.NaN);
            Arrays.fill(matchQuery[p], -1);
            Arrays.fill(matchSeries[p], -1);
        }
    }

    /**
     * Offers a candidate match. Among equal distances the smaller query start,
     * then the smaller series start, is kept, so the result does not depend on
     * the order in which candidates are offered.
     */
    void offer(int queryWindow, int seriesWindow, double distance, int queryStart, int seriesStart) {
        if (Double.isNaN(distance)) {
            return;
        }
        double current = distances[queryWindow][seriesWindow];
        int currentQuery = matchQuery[queryWindow][seriesWindow];
        boolean better = currentQuery < 0 || distance < current
                || (distance == current && (queryStart < currentQuery
                        || (queryStart == currentQuery && seriesStart < matchSeries[queryWindow][seriesWindow])));
        if (better) {
            distances[queryWindow][seriesWindow] = distance;
            matchQuery[queryWindow][seriesWindow] = queryStart;
            matchSeries[queryWindow][seriesWindow] = seriesStart;
        }
    }

    public int getNumberOfWindows() {
        return numberOfWindows;
    }

    public double getDistance(int queryWindow, int seriesWindow) {
        return distances[queryWindow][seriesWindow];
    }

    public int getMatchQuery(int queryWindow, int seriesWindow) {
        return matchQuery[queryWindow][seriesWindow];
    }

    public int getMatchSeries(int queryWindow, int seriesWindow) {
        return matchSeries[queryWindow][seriesWindow];
    }

    /**
     * @return a deep copy of the distance matrix
     */
    public double[][] getDistances() {
        double[][] copy = new double[numberOfWindows][];
        for (int p = 0; p < numberOfWindows; p++) {
            copy[p] = Arrays.copyOf(distances[p], numberOfWindows);
        }
        return copy;
    }

    /**
     * Mean of the defined distances in one row; a high value means that the
     * window resembles no other window.
     *
     * @param queryWindow the row
     * @return the mean, NaN if the row has no defined entry
     */
    public double rowMean(int queryWindow) {
        double sum = 0;
        int count = 0;
        for (double distance : distances[queryWindow]) {
            if (!Double.isNaN(distance)) {
                sum += distance;
                count++;
            }
        }
        return count == 0 ? Double.NaN : sum / count;
    }
}
