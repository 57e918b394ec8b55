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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import com.energy.cmp.clustering.AnomalyLabel;
import com.energy.cmp.profile.ContextualDistanceMatrix;
import com.energy.cmp.profile.DistanceProfile;
import com.energy.cmp.returntypes.ClusterSummary;
import com.energy.cmp.returntypes.ContextResult;
import com.energy.cmp.returntypes.RunResult;

public class RunResultMapperTest {

    @Test
    public void testNonFiniteValuesBecomeNull() {
        ContextResult result = ContextResult.analyzed(0, "ctx", "a context", 0.0, 2,
                Arrays.asList(new ClusterSummary(0, 0, 10L, 0, Double.NaN), new ClusterSummary(1, 0, 10L, 0, 2.0)),
                Collections.singletonList(new AnomalyLabel(1, 5, 1, 1, 2.0, Double.NaN)), null, 20L);
        RunResultMapper mapper = new RunResultMapper();
        RunResultState state = mapper.toState(new RunResult(Collections.singletonList(result), 30L));

        ContextResultState contextState = state.getContextResults().get(0);
        assertNull(contextState.getClusterSummaries().get(0).getRepresentativeDistance());
        assertEquals(2.0, contextState.getClusterSummaries().get(1).getRepresentativeDistance());
        assertNull(contextState.getAnomalyLabels().get(0).getExogenousMean());
        assertNull(contextState.getProfileDistances());

        RunResult restored = mapper.toModel(state);
        assertTrue(Double.isNaN(restored.get(0).getClusterSummaries().get(0).getRepresentativeDistance()));
        assertTrue(Double.isNaN(restored.get(0).getAnomalyLabels().get(0).getExogenousMean()));
        assertEquals(1, restored.get(0).getAnomalyCount());
    }

    @Test
    public void testSaveDistanceProfile() {
        DistanceProfile profile = new DistanceProfile(3, new int[] { 0, 3, 6 }, new int[] { 0, 1, 2 },
                new double[] { 0.5, 0.5, Double.NaN }, new int[] { 3, 0, -1 }, new ContextualDistanceMatrix(3), 0, 0,
                1);
        ContextResult result = ContextResult.analyzed(0, "ctx", "a context", 66.7, 3, Collections.emptyList(),
                Collections.emptyList(), profile, 20L);
        RunResult runResult = new RunResult(Collections.singletonList(result), 30L);

        RunResultMapper mapper = new RunResultMapper();
        assertNull(mapper.toState(runResult).getContextResults().get(0).getProfileNeighborStartIndices());

        mapper.setSaveDistanceProfileEnabled(true);
        ContextResultState state = mapper.toState(runResult).getContextResults().get(0);
        assertEquals(Arrays.asList(0.5, 0.5, null), state.getProfileDistances());
        assertEquals(Arrays.asList(0, 3, 6), state.getProfileStartIndices());
        assertEquals(Arrays.asList(3, 0, -1), state.getProfileNeighborStartIndices());
        assertNull(mapper.toModel(mapper.toState(runResult)).get(0).getDistanceProfile());
    }
}
