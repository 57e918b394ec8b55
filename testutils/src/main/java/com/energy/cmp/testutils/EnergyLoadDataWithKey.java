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

/**
 * A generated load series together with the days on which anomalies were
 * injected.
 */
public class EnergyLoadDataWithKey {

    public final long startMillis;
    public final long intervalMillis;
    public final int observationsPerDay;
    public final double[] load;
    public final double[] temperature;
    public final int[] anomalousDays;

    public EnergyLoadDataWithKey(long startMillis, long intervalMillis, int observationsPerDay, double[] load,
            double[] temperature, int[] anomalousDays) {
        this.startMillis = startMillis;
        this.intervalMillis = intervalMillis;
        this.observationsPerDay = observationsPerDay;
        this.load = load;
        this.temperature = temperature;
        this.anomalousDays = anomalousDays;
    }

    public int numberOfDays() {
        return load.length / observationsPerDay;
    }
}
