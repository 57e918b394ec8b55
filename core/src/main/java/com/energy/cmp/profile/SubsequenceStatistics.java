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

import java.util.List;

import com.energy.cmp.series.TimeSeries;

/**
 * Mean and (population) standard deviation of every subsequence of a context.
 * A two pass computation is used per subsequence so that constant segments
 * produce a standard deviation of exactly or very nearly zero, which a running
 * sum of squares does not guarantee.
 */
public class SubsequenceStatistics {

    private final double[] means;

    private final double[] stddevs;

    private final boolean[] missing;

    public SubsequenceStatistics(TimeSeries series, List<Subsequence> subsequences) {
        int size = subsequences.size();
        means = new double[size];
        stddevs = new double[size];
        missing = new boolean[size];
        for (Subsequence subsequence : subsequences) {
            int i = subsequence.getOrdinal();
            double[] values = subsequence.values(series);
            means[i] = mean(values);
            stddevs[i] = Double.isFinite(means[i]) ? stddev(values, means[i]) : Double.NaN;
            missing[i] = !Double.isFinite(stddevs[i]);
        }
    }

    public double getMean(int ordinal) {
        return means[ordinal];
    }

    public double getStddev(int ordinal) {
        return stddevs[ordinal];
    }

    /**
     * @param ordinal subsequence ordinal
     * @return true if the subsequence contains a missing or infinite value, or
     *         values so large that its moments overflow
     */
    public boolean isMissing(int ordinal) {
        return missing[ordinal];
    }

    /**
     * @param ordinal subsequence ordinal
     * @param epsilon threshold on the standard deviation
     * @return true if the subsequence is (nearly) constant
     */
    public boolean isDegenerate(int ordinal, double epsilon) {
        return !missing[ordinal] && stddevs[ordinal] < epsilon;
    }

    public static double mean(double[] values) {
        checkArgument(values.length > 0, "values must not be empty");
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    public static double stddev(double[] values, double mean) {
        double sum = 0;
        for (double value : values) {
            double t = value - mean;
            sum += t * t;
        }
        return Math.sqrt(sum / values.length);
    }

    /**
     * z-normalization: {@code (x - mean) / stddev}.
     *
     * @param values  raw values
     * @param epsilon standard deviations below this value are degenerate
     * @return a new normalized array, or null if a value is not finite or the values
     *         are degenerate
     */
    public static double[] zNormalize(double[] values, double epsilon) {
        double mean = mean(values);
        if (!Double.isFinite(mean)) {
            return null;
        }
        double stddev = stddev(values, mean);
        if (!Double.isFinite(stddev) || stddev < epsilon) {
            return null;
        }
        return normalize(values, mean, stddev);
    }

    static double[] normalize(double[] values, double mean, double stddev) {
        double inverse = 1.0 / stddev;
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = (values[i] - mean) * inverse;
        }
        return result;
    }
}
