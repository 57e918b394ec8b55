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

package com.energy.cmp.testutils;

import java.util.Arrays;
import java.util.Random;

/**
 * Generates the electrical load of a building with a recurring daily profile:
 * a load that falls through the night towards a trough at 06:00, a morning peak
 * at 08:00 and an evening plateau. On anomalous days a bump centered at 03:00
 * is added to the night load, and the evening peak is delayed by two hours.
 * Outdoor temperature follows a daily sine wave peaking at 15:00.
 */
public class EnergyLoadTestData {

    public static final long MILLIS_PER_DAY = 24 * 3_600_000L;

    /**
     * 2020-01-01T00:00:00Z
     */
    public static final long DEFAULT_START_MILLIS = 1_577_836_800_000L;

    private final int observationsPerDay;
    private final double baseLoad;
    private final double dailyAmplitude;
    private final double noiseSigma;
    private final double anomalyAmplitude;

    public EnergyLoadTestData(int observationsPerDay, double baseLoad, double dailyAmplitude, double noiseSigma,
            double anomalyAmplitude) {
        if (observationsPerDay <= 0 || MILLIS_PER_DAY % observationsPerDay != 0) {
            throw new IllegalArgumentException("observations per day must divide a day into whole milliseconds");
        }
        this.observationsPerDay = observationsPerDay;
        this.baseLoad = baseLoad;
        this.dailyAmplitude = dailyAmplitude;
        this.noiseSigma = noiseSigma;
        this.anomalyAmplitude = anomalyAmplitude;
    }

    /**
     * Quarter hourly data, the usual metering resolution.
     */
    public EnergyLoadTestData() {
        this(96, 50.0, 40.0, 0.5, 30.0);
    }

    public EnergyLoadDataWithKey generateTestDataWithKey(int numberOfDays, int[] anomalousDays, long seed) {
        int[] sortedAnomalies = Arrays.copyOf(anomalousDays, anomalousDays.length);
        Arrays.sort(sortedAnomalies);
        NormalDistribution dist = new NormalDistribution(new Random(seed));

        int size = numberOfDays * observationsPerDay;
        double[] load = new double[size];
        double[] temperature = new double[size];
        for (int day = 0; day < numberOfDays; day++) {
            boolean anomaly = Arrays.binarySearch(sortedAnomalies, day) >= 0;
            for (int j = 0; j < observationsPerDay; j++) {
                double hour = 24.0 * j / observationsPerDay;
                int i = day * observationsPerDay + j;
                load[i] = dailyLoad(hour, anomaly) + dist.nextDouble(0, noiseSigma);
                temperature[i] = 15.0 + 8.0 * Math.sin(2 * Math.PI * (hour - 9) / 24) + dist.nextDouble(0, 0.3);
            }
        }
        long intervalMillis = MILLIS_PER_DAY / observationsPerDay;
        return new EnergyLoadDataWithKey(DEFAULT_START_MILLIS, intervalMillis, observationsPerDay, load, temperature,
                sortedAnomalies);
    }

    public EnergyLoadDataWithKey generateTestDataWithKey(int numberOfDays, int[] anomalousDays) {
        return generateTestDataWithKey(numberOfDays, anomalousDays, 0L);
    }

    double dailyLoad(double hour, boolean anomaly) {
        double night = 0.5 + 0.5 * Math.cos(2 * Math.PI * (hour - 18) / 24);
        double eveningCenter = anomaly ? 21.0 : 19.0;
        double value = baseLoad + dailyAmplitude * night + dailyAmplitude * bump(hour, 8.0, 1.0)
                + 0.5 * dailyAmplitude * bump(hour, eveningCenter, 1.5);
        if (anomaly) {
            value += anomalyAmplitude * bump(hour, 3.0, 0.75);
        }
        return value;
    }

    private static double bump(double hour, double center, double width) {
        double z = (hour - center) / width;
        return Math.exp(-0.5 * z * z);
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // apply the Box-Muller transform to produce Normal variates
                double u = 1.0 - rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;

            return result;
        }

        double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}
