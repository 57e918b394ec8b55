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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class DistanceProfileTest {

    @Test
    public void testConstructorCopiesArrays() {
        int[] starts = { 0, 4, 8 };
        int[] windows = { 0, 1, 2 };
        double[] distances = { 1.0, 2.0, Double.NaN };
        int[] neighbors = { 4, 0, -1 };
        DistanceProfile profile = new DistanceProfile(4, starts, windows, distances, neighbors,
                new ContextualDistanceMatrix(3), 0, 0, 1);

        starts[1] = 100;
        windows[1] = 100;
        distances[0] = 50.0;
        neighbors[0] = 8;

        assertEquals(4, profile.getStartIndex(1));
        assertEquals(1, profile.getWindowIndex(1));
        assertEquals(1.0, profile.getDistance(0), 0.0);
        assertEquals(4, profile.getNeighborStartIndex(0));
        assertEquals(2, profile.definedCount());
        assertFalse(profile.isDefined(2));
    }

    @Test
    public void testMismatchedLengths() {
        assertThrows(IllegalArgumentException.class, () -> new DistanceProfile(4, new int[] { 0, 4 },
                new int[] { 0 }, new double[] { 1, 1 }, new int[] { 4, 0 }, new ContextualDistanceMatrix(2), 0, 0, 0));
    }
}
