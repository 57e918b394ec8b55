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

package com.energy.cmp.series;

import static com.energy.cmp.CommonUtils.checkArgument;
import static com.energy.cmp.CommonUtils.checkConfiguration;
import static com.energy.cmp.CommonUtils.checkNotNull;

import java.util.Arrays;

import lombok.Getter;

/**
 * An immutable, evenly sampled time series with an optional exogenous channel
 * (for example outdoor temperature) of the same length. Missing observations
 * are represented by {@code NaN}; the series is never resampled.
 */
public class TimeSeries {

    public static final long MILLIS_PER_HOUR = 3_600_000L;

    private final long[] timestamps;

    private final double[] values;

    private final double[] exogenous;

    /**
     * the fixed distance in milliseconds between consecutive observations
     */
    @Getter
    private final long samplingIntervalMillis;

    /**
     * Creates a series from parallel arrays. The arrays are copied.
     *
     * @param timestamps epoch milliseconds, strictly increasing and evenly spaced
     * @param values     the observed values
     * @param exogenous  an optional exogenous channel, may be null
     */
    public TimeSeries(long[] timestamps, double[] values, double[] exogenous) {
        checkNotNull(timestamps, "timestamps must not be null");
        checkNotNull(values, "values must not be null");
        checkArgument(values.length > 0, "series must not be empty");
        checkArgument(timestamps.length == values.length, "timestamps and values must have the same length");
        checkArgument(values.length > 1, "at least two observations are needed to define the sampling interval");
        checkArgument(exogenous == null || exogenous.length == values.length,
                "exogenous channel must have the same length as the values");

        long interval = timestamps[1] - timestamps[0];
        checkArgument(interval > 0, "timestamps must be strictly increasing");
        for (int i = 2; i < timestamps.length; i++) {
            long step = timestamps[i] - timestamps[i - 1];
            checkArgument(step > 0, String.format("timestamps must be strictly increasing at position %d", i));
            checkArgument(step == interval, String.format(
                    "timestamps must be evenly spaced: expected %d ms at position %d but found %d ms", interval, i,
                    step));
        }

        this.timestamps = Arrays.copyOf(timestamps, timestamps.length);
        this.values = Arrays.copyOf(values, values.length);
        this.exogenous = exogenous == null ? null : Arrays.copyOf(exogenous, exogenous.length);
        this.samplingIntervalMillis = interval;
    }

    public TimeSeries(long[] timestamps, double[] values) {
        this(timestamps, values, null);
    }

    /**
     * Creates a series for values that are already known to be evenly spaced.
     *
     * @param startMillis    timestamp of the first observation
     * @param intervalMillis sampling interval
     * @param values         the observed values
     * @param exogenous      an optional exogenous channel, may be null
     * @return a new series
     */
    public static TimeSeries regular(long startMillis, long intervalMillis, double[] values, double[] exogenous) {
        checkNotNull(values, "values must not be null");
        checkArgument(intervalMillis > 0, "interval must be positive");
        long[] timestamps = new long[values.length];
        for (int i = 0; i < values.length; i++) {
            timestamps[i] = startMillis + i * intervalMillis;
        }
        return new TimeSeries(timestamps, values, exogenous);
    }

    public static TimeSeries regular(long startMillis, long intervalMillis, double[] values) {
        return regular(startMillis, intervalMillis, values, null);
    }

    /**
     * @return the number of observations
     */
    public int size() {
        return values.length;
    }

    public double getValue(int index) {
        return values[index];
    }

    public long getTimestamp(int index) {
        return timestamps[index];
    }

    public boolean hasExogenous() {
        return exogenous != null;
    }

    public double getExogenous(int index) {
        checkArgument(exogenous != null, "series has no exogenous channel");
        return exogenous[index];
    }

    /**
     * @return a copy of the values
     */
    public double[] getValues() {
        return Arrays.copyOf(values, values.length);
    }

    /**
     * @return a copy of the timestamps
     */
    public long[] getTimestamps() {
        return Arrays.copyOf(timestamps, timestamps.length);
    }

    /**
     * Copies a contiguous range of values.
     *
     * @param from   first index, inclusive
     * @param length number of values
     * @return a new array
     */
    public double[] copyOfRange(int from, int length) {
        checkArgument(from >= 0 && from + length <= values.length, "range outside the series");
        return Arrays.copyOfRange(values, from, from + length);
    }

    /**
     * Mean of the exogenous channel over a range; NaN if any value in range is
     * missing or the series has no exogenous channel.
     *
     * @param from   first index, inclusive
     * @param length number of values
     * @return the mean
     */
    public double exogenousMean(int from, int length) {
        if (exogenous == null) {
            return Double.NaN;
        }
        checkArgument(from >= 0 && from + length <= exogenous.length, "range outside the series");
        double sum = 0;
        for (int i = from; i < from + length; i++) {
            sum += exogenous[i];
        }
        return sum / length;
    }

    /**
     * The number of observations in one recurrence cycle (typically a day).
     *
     * @param hoursPerCycle length of a cycle in hours
     * @return the number of observations in a cycle
     * @throws com.energy.cmp.ConfigurationException if the cycle is not a whole
     *                                                number of sampling intervals
     */
    public int observationsPerCycle(int hoursPerCycle) {
        checkConfiguration(hoursPerCycle > 0, "hours per cycle must be greater than 0");
        long cycleMillis = hoursPerCycle * MILLIS_PER_HOUR;
        checkConfiguration(cycleMillis % samplingIntervalMillis == 0, String.format(
                "a cycle of %d h is not a whole number of %d ms sampling intervals", hoursPerCycle,
                samplingIntervalMillis));
        return (int) (cycleMillis / samplingIntervalMillis);
    }
}
