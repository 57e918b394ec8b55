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

package com.energy.cmp;

import java.util.Arrays;
import java.util.List;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.energy.cmp.context.ContextDefinition;
import com.energy.cmp.returntypes.RunResult;
import com.energy.cmp.series.TimeSeries;
import com.energy.cmp.testutils.EnergyLoadDataWithKey;
import com.energy.cmp.testutils.EnergyLoadTestData;

@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Benchmark)
public class ContextualMatrixProfileBenchmark {

    public static final List<ContextDefinition> CONTEXTS = Arrays.asList(new ContextDefinition(0, 6, 16),
            new ContextDefinition(6, 12, 16), new ContextDefinition(12, 18, 16), new ContextDefinition(18, 24, 16));

    @State(Scope.Thread)
    public static class BenchmarkState {
        @Param({ "90", "365" })
        int numberOfDays;

        @Param({ "false", "true" })
        boolean parallelExecutionEnabled;

        TimeSeries series;
        ContextualMatrixProfile cmp;

        @Setup(Level.Trial)
        public void setUp() {
            EnergyLoadDataWithKey data = new EnergyLoadTestData().generateTestDataWithKey(numberOfDays,
                    new int[] { 7, 30, 61 }, 42L);
            series = TimeSeries.regular(data.startMillis, data.intervalMillis, data.load, data.temperature);
            cmp = ContextualMatrixProfile.builder().parallelExecutionEnabled(parallelExecutionEnabled).build();
        }
    }

    @Benchmark
    public RunResult analyze(BenchmarkState state, Blackhole blackhole) {
        RunResult result = state.cmp.analyze(state.series, CONTEXTS);
        blackhole.consume(result.getTotalAnomalyCount());
        return result;
    }
}
