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

import static com.energy.cmp.TestUtils.EPSILON;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.energy.cmp.clustering.AnomalyLabel;
import com.energy.cmp.config.BandingStrategy;
import com.energy.cmp.config.ExogenousFilter;
import com.energy.cmp.context.ContextDefinition;
import com.energy.cmp.context.ExternalContextProvider;
import com.energy.cmp.context.IContextProvider;
import com.energy.cmp.context.IndexWindow;
import com.energy.cmp.returntypes.ClusterSummary;
import com.energy.cmp.returntypes.ContextResult;
import com.energy.cmp.returntypes.FailureKind;
import com.energy.cmp.returntypes.RunResult;
import com.energy.cmp.series.TimeSeries;
import com.energy.cmp.testutils.EnergyLoadDataWithKey;
import com.energy.cmp.testutils.EnergyLoadTestData;

public class ContextualMatrixProfileTest {

    @Test
    public void testDefaults() {
        ContextualMatrixProfile cmp = ContextualMatrixProfile.builder().build();
        assertEquals(5, cmp.getNumberOfClusters());
        assertEquals(0.5, cmp.getAnomalyMargin(), EPSILON);
        assertEquals(BandingStrategy.EQUAL_WIDTH, cmp.getBandingStrategy());
        assertEquals(24, cmp.getHoursPerCycle());
        assertFalse(cmp.isParallelExecutionEnabled());
        assertEquals(0, cmp.getThreadPoolSize());
    }

    @Test
    public void testInvalidBuilder() {
        assertThrows(IllegalArgumentException.class,
                () -> ContextualMatrixProfile.builder().numberOfClusters(0).build());
        assertThrows(IllegalArgumentException.class, () -> ContextualMatrixProfile.builder().anomalyMargin(-1).build());
        assertThrows(IllegalArgumentException.class,
                () -> ContextualMatrixProfile.builder().parallelExecutionEnabled(true).threadPoolSize(0).build());
    }

    @Test
    public void testTwoDayScenario() {
        TimeSeries series = TestUtils.quarterHourly(TestUtils.rampDays(2, -1, 3L));
        RunResult result = ContextualMatrixProfile.builder().build().analyze(series,
                Collections.singletonList(new ContextDefinition(0, 6, 23)));

        assertEquals(1, result.size());
        ContextResult context = result.get(0);
        assertFalse(context.isFailed());
        assertEquals("ctx_from00_00_to06_00_m05_45", context.getLabel());
        assertEquals(4, context.getNumberOfSubsequences());
        assertEquals(5, context.getClusterSummaries().size());
        assertEquals(100.0, context.getCoveragePercent(), EPSILON);

        // neighbors come from the other day
        int[] neighbors = context.getDistanceProfile().getNeighborStartIndices();
        assertTrue(neighbors[0] >= 96 && neighbors[1] >= 96);
        assertTrue(neighbors[2] < 24 && neighbors[3] < 24);
    }

    @Test
    public void testReversedDayIsAnomalous() {
        TimeSeries series = TestUtils.quarterHourly(TestUtils.rampDays(10, 3, 5L));
        RunResult result = ContextualMatrixProfile.builder().build().analyze(series,
                Collections.singletonList(new ContextDefinition(0, 6, 23)));

        ContextResult context = result.get(0);
        assertEquals(2, context.getAnomalyCount());
        assertThat(context.getAnomalyLabels().stream().map(AnomalyLabel::getWindowIndex).collect(Collectors.toList()),
                everyItem(is(3)));
        assertThat(context.getAnomalyLabels().stream().map(AnomalyLabel::getStartIndex).collect(Collectors.toList()),
                containsInAnyOrder(288, 289));
        assertEquals(18, context.getClusterSummaries().get(0).getSize());
        assertEquals(0, context.getClusterSummaries().get(0).getAnomalyCount());
        assertEquals(2, result.getTotalAnomalyCount());
    }

    @Test
    public void testFailedContextsDoNotStopOthers() {
        double[] values = TestUtils.rampDays(4, -1, 9L);
        Arrays.fill(values, 96 * 2 + 48, values.length, Double.NaN);
        Arrays.fill(values, 48, 96, Double.NaN);
        TimeSeries series = TestUtils.quarterHourly(values);

        List<ContextDefinition> definitions = Arrays.asList(new ContextDefinition(0, 6, 23),
                new ContextDefinition(0, 1, 5), new ContextDefinition(12, 18, 24), new ContextDefinition(6, 12, 8));
        RunResult result = ContextualMatrixProfile.builder().anomalyMargin(1e6).build().analyze(series,
                definitions);

        assertEquals(4, result.size());
        assertFalse(result.get(0).isFailed());
        assertEquals(2, result.get(0).getDistanceProfile().getMissingCount());
        assertEquals(0, result.get(0).getAnomalyCount());

        assertTrue(result.get(1).isFailed());
        assertEquals(FailureKind.CONFIGURATION, result.get(1).getFailureKind());
        assertThrows(IllegalStateException.class, () -> result.get(1).getAnomalyCount());

        // 12:00 to 18:00 is missing on days 0, 2 and 3, day 1 holds a single subsequence
        assertTrue(result.get(2).isFailed());
        assertEquals(FailureKind.DATA, result.get(2).getFailureKind());

        assertFalse(result.get(3).isFailed());
        assertEquals(2, result.getFailedCount());
        for (int i = 0; i < result.size(); i++) {
            assertEquals(i, result.get(i).getDeclaredIndex());
        }
    }

    @Test
    public void testCycleThatDoesNotFitTheSamplingInterval() {
        TimeSeries series = TimeSeries.regular(0L, 7 * 60_000L, new double[400]);
        RunResult result = ContextualMatrixProfile.builder().build().analyze(series,
                Arrays.asList(new ContextDefinition(0, 6, 10), new ContextDefinition(6, 12, 10)));
        assertEquals(2, result.size());
        for (ContextResult context : result.getContextResults()) {
            assertTrue(context.isFailed());
            assertEquals(FailureKind.CONFIGURATION, context.getFailureKind());
        }
    }

    @Test
    public void testDeterminismAndParallelExecution() {
        EnergyLoadDataWithKey data = new EnergyLoadTestData().generateTestDataWithKey(30, new int[] { 11 }, 17L);
        TimeSeries series = TimeSeries.regular(data.startMillis, data.intervalMillis, data.load, data.temperature);
        List<ContextDefinition> definitions = new ArrayList<>();
        for (int h = 0; h < 24; h += 4) {
            definitions.add(new ContextDefinition(h, h + 4, 12));
        }

        RunResult sequential = ContextualMatrixProfile.builder().build().analyze(series, definitions);
        RunResult again = ContextualMatrixProfile.builder().build().analyze(series, definitions);
        RunResult parallel = ContextualMatrixProfile.builder().parallelExecutionEnabled(true).threadPoolSize(3)
                .build().analyze(series, definitions);

        for (RunResult other : Arrays.asList(again, parallel)) {
            assertEquals(sequential.size(), other.size());
            for (int i = 0; i < sequential.size(); i++) {
                ContextResult expected = sequential.get(i);
                ContextResult actual = other.get(i);
                assertEquals(expected.getLabel(), actual.getLabel());
                assertEquals(expected.getAnomalyLabels(), actual.getAnomalyLabels());
                assertTrue(Arrays.equals(expected.getDistanceProfile().getDistances(),
                        actual.getDistanceProfile().getDistances()));
                for (int r = 0; r < expected.getClusterSummaries().size(); r++) {
                    ClusterSummary e = expected.getClusterSummaries().get(r);
                    ClusterSummary a = actual.getClusterSummaries().get(r);
                    assertEquals(e.getSize(), a.getSize());
                    assertEquals(e.getAnomalyCount(), a.getAnomalyCount());
                    assertEquals(e.getRepresentativeDistance(), a.getRepresentativeDistance(), 0.0);
                }
            }
        }
    }

    @Test
    public void testExogenousFilterAndExternalProvider() {
        EnergyLoadDataWithKey data = new EnergyLoadTestData().generateTestDataWithKey(6, new int[0], 23L);
        TimeSeries series = TimeSeries.regular(data.startMillis, data.intervalMillis, data.load, data.temperature);
        List<IContextProvider> providers = Collections.singletonList(new ExternalContextProvider("evenings", 8,
                Arrays.asList(new IndexWindow(72, 96), new IndexWindow(168, 192), new IndexWindow(264, 288))));

        RunResult unfiltered = ContextualMatrixProfile.builder().build().analyzeProviders(series, providers);
        assertEquals("evenings", unfiltered.get(0).getLabel());
        assertEquals(51, unfiltered.get(0).getNumberOfSubsequences());
        assertEquals(100.0, unfiltered.get(0).getCoveragePercent(), EPSILON);

        // the temperature between 18:00 and 24:00 stays far below 100 degrees
        RunResult filtered = ContextualMatrixProfile.builder().exogenousFilter(new ExogenousFilter(100, 200)).build()
                .analyzeProviders(series, providers);
        assertTrue(filtered.get(0).isFailed());
        assertEquals(FailureKind.DATA, filtered.get(0).getFailureKind());
    }
}
