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

package com.energy.cmp.serialize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.energy.cmp.ContextualMatrixProfile;
import com.energy.cmp.context.ContextDefinition;
import com.energy.cmp.returntypes.ContextResult;
import com.energy.cmp.returntypes.FailureKind;
import com.energy.cmp.returntypes.RunResult;
import com.energy.cmp.series.TimeSeries;
import com.energy.cmp.testutils.EnergyLoadDataWithKey;
import com.energy.cmp.testutils.EnergyLoadTestData;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class RunResultSerDeTests {

    private static RunResult runResult;

    @BeforeAll
    public static void oneTimeSetUp() {
        EnergyLoadDataWithKey data = new EnergyLoadTestData().generateTestDataWithKey(14, new int[] { 4 }, 5L);
        TimeSeries series = TimeSeries.regular(data.startMillis, data.intervalMillis, data.load, data.temperature);
        runResult = ContextualMatrixProfile.builder().build().analyze(series,
                Arrays.asList(new ContextDefinition(0, 6, 16), new ContextDefinition(0, 1, 5)));
    }

    private RunResultSerDe serDe;

    @BeforeEach
    public void setUp() {
        serDe = new RunResultSerDe();
    }

    @Test
    public void testRoundTrip() {
        String json = serDe.toJson(runResult);
        RunResult restored = serDe.fromJson(json);

        assertEquals(runResult.size(), restored.size());
        assertEquals(runResult.getTotalElapsedNanos(), restored.getTotalElapsedNanos());

        ContextResult analyzed = restored.get(0);
        ContextResult expected = runResult.get(0);
        assertFalse(analyzed.isFailed());
        assertEquals(expected.getLabel(), analyzed.getLabel());
        assertEquals(expected.getDescription(), analyzed.getDescription());
        assertEquals(expected.getAnomalyCount(), analyzed.getAnomalyCount());
        assertEquals(expected.getAnomalyLabels(), analyzed.getAnomalyLabels());
        assertEquals(expected.getClusterSummaries(), analyzed.getClusterSummaries());
        assertNull(analyzed.getDistanceProfile());

        ContextResult failed = restored.get(1);
        assertTrue(failed.isFailed());
        assertEquals(FailureKind.CONFIGURATION, failed.getFailureKind());
        assertEquals(runResult.get(1).getFailureReason(), failed.getFailureReason());
    }

    @Test
    public void testJsonLayout() throws Exception {
        serDe.getMapper().setSaveDistanceProfileEnabled(true);
        JsonNode root = new ObjectMapper().readTree(serDe.toJson(runResult));

        assertEquals(RunResultState.VERSION_1_0, root.get("version").asText());
        JsonNode contexts = root.get("contextResults");
        assertEquals(2, contexts.size());

        JsonNode analyzed = contexts.get(0);
        assertEquals("ANALYZED", analyzed.get("status").asText());
        assertEquals(5, analyzed.get("clusterSummaries").size());
        assertEquals(runResult.get(0).getNumberOfSubsequences(), analyzed.get("profileDistances").size());
        JsonNode neighbors = analyzed.get("profileNeighborStartIndices");
        for (int i = 0; i < neighbors.size(); i++) {
            assertEquals(runResult.get(0).getDistanceProfile().getNeighborStartIndex(i), neighbors.get(i).asInt());
        }
        assertEquals(analyzed.get("profileDistances").size(), neighbors.size());
        // no exogenous value is missing, so every label carries a temperature
        for (JsonNode label : analyzed.get("anomalyLabels")) {
            assertTrue(label.get("exogenousMean").isNumber());
        }

        JsonNode failed = contexts.get(1);
        assertEquals("FAILED", failed.get("status").asText());
        assertEquals("CONFIGURATION", failed.get("failureKind").asText());
        assertTrue(failed.get("coveragePercent").isNull());
        assertTrue(failed.get("profileDistances").isNull());
    }

    @Test
    public void testUnsupportedVersion() {
        String json = serDe.toJson(runResult).replace("\"version\":\"1.0\"", "\"version\":\"0.9\"");
        assertThrows(IllegalArgumentException.class, () -> serDe.fromJson(json));
    }
}
