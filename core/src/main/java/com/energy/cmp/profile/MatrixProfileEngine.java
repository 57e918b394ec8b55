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
import static com.energy.cmp.CommonUtils.checkData;
import static com.energy.cmp.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.List;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.energy.cmp.config.ExogenousFilter;
import com.energy.cmp.context.Context;
import com.energy.cmp.series.TimeSeries;

/**
 * Computes the self join nearest neighbor profile of the subsequences of one
 * context using the z-normalized Euclidean distance. Every pair of
 * subsequences of the context is compared directly, which keeps the result
 * exact and independent of evaluation order; contexts hold one window per
 * cycle, so the number of subsequences is small.
 *
 * Two subsequences whose start indices differ by less than {@code m} overlap
 * and are trivial matches of each other; they are never neighbors.
 */
@Slf4j
@Getter
public class MatrixProfileEngine {

    /**
     * Default threshold below which a standard deviation is considered zero.
     */
    public static final double DEFAULT_STD_EPSILON = 1e-8;

    private final double stdEpsilon;

    private final ExogenousFilter exogenousFilter;

    public MatrixProfileEngine(double stdEpsilon, ExogenousFilter exogenousFilter) {
        checkArgument(stdEpsilon > 0, "epsilon must be greater than 0");
        this.stdEpsilon = stdEpsilon;
        this.exogenousFilter = exogenousFilter;
    }

    public MatrixProfileEngine() {
        this(DEFAULT_STD_EPSILON, null);
    }

    /**
     * Computes the distance profile of a context.
     *
     * @param series  the series
     * @param context a context resolved against the series
     * @return the distance profile, in ascending start order
     * @throws com.energy.cmp.DataException if fewer than two usable subsequences
     *                                      exist
     */
    public DistanceProfile compute(TimeSeries series, Context context) {
        checkNotNull(series, "series must not be null");
        checkNotNull(context, "context must not be null");

        int m = context.getSubsequenceLength();
        List<Subsequence> subsequences = context.subsequences();
        int k = subsequences.size();
        checkData(k >= 2, String.format("context %s contains %d subsequences, at least 2 are needed",
                context.getLabel(), k));

        SubsequenceStatistics statistics = new SubsequenceStatistics(series, subsequences);
        boolean filterActive = exogenousFilter != null && series.hasExogenous();
        if (exogenousFilter != null && !series.hasExogenous()) {
            log.debug("series has no exogenous channel, filter ignored for {}", context.getLabel());
        }

        int[] starts = new int[k];
        int[] windows = new int[k];
        double[][] normalized = new double[k][];
        int missingCount = 0;
        int filteredCount = 0;
        int degenerateCount = 0;

        for (Subsequence subsequence : subsequences) {
            int i = subsequence.getOrdinal();
            starts[i] = subsequence.getStartIndex();
            windows[i] = subsequence.getWindowIndex();
            if (statistics.isMissing(i)) {
                missingCount++;
            } else if (filterActive && !exogenousFilter.accepts(series.exogenousMean(starts[i], m))) {
                filteredCount++;
            } else if (statistics.isDegenerate(i, stdEpsilon)) {
                degenerateCount++;
            } else {
                normalized[i] = SubsequenceStatistics.normalize(subsequence.values(series), statistics.getMean(i),
                        statistics.getStddev(i));
            }
        }

        int usable = k - missingCount - filteredCount;
        checkData(usable >= 2, String.format("context %s has %d usable subsequences (%d missing, %d filtered out)",
                context.getLabel(), usable, missingCount, filteredCount));

        double[] distances = new double[k];
        int[] neighbors = new int[k];
        Arrays.fill(distances, Double.NaN);
        Arrays.fill(neighbors, -1);
        ContextualDistanceMatrix matrix = new ContextualDistanceMatrix(context.getWindows().size());

        for (int i = 0; i < k; i++) {
            if (normalized[i] == null) {
                continue;
            }
            for (int j = i + 1; j < k; j++) {
                if (normalized[j] == null || Math.abs(starts[i] - starts[j]) < m) {
                    continue;
                }
                double distance = euclidean(normalized[i], normalized[j]);
                offer(distances, neighbors, i, distance, starts[j]);
                offer(distances, neighbors, j, distance, starts[i]);
                matrix.offer(windows[i], windows[j], distance, starts[i], starts[j]);
                matrix.offer(windows[j], windows[i], distance, starts[j], starts[i]);
            }
        }

        log.debug("profile of {}: {} subsequences, {} missing, {} filtered, {} degenerate", context.getLabel(), k,
                missingCount, filteredCount, degenerateCount);
        return new DistanceProfile(m, starts, windows, distances, neighbors, matrix, missingCount, filteredCount,
                degenerateCount);
    }

    /**
     * Keeps the smaller distance; on a tie the neighbor with the smaller start
     * index wins. An undefined distance is never a candidate.
     */
    static void offer(double[] distances, int[] neighbors, int ordinal, double distance, int neighborStart) {
        if (Double.isNaN(distance)) {
            return;
        }
        if (neighbors[ordinal] < 0 || distance < distances[ordinal]
                || (distance == distances[ordinal] && neighborStart < neighbors[ordinal])) {
            distances[ordinal] = distance;
            neighbors[ordinal] = neighborStart;
        }
    }

    /**
     * Euclidean distance between two vectors of equal length. Symmetric bit for
     * bit, since {@code (a - b)^2 == (b - a)^2} in floating point.
     */
    public static double euclidean(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double t = a[i] - b[i];
            sum += t * t;
        }
        return Math.sqrt(sum);
    }
}
