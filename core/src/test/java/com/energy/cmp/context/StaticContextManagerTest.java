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

package com.energy.cmp.context;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.energy.cmp.ConfigurationException;
import com.energy.cmp.profile.Subsequence;

public class StaticContextManagerTest {

    @Test
    public void testTwoDayNightContext() {
        Context context = StaticContextManager.derive(192, 96, 0, 6, 23);

        assertEquals(2, context.getWindows().size());
        assertEquals(0, context.getWindows().get(0).getStart());
        assertEquals(24, context.getWindows().get(0).getEnd());
        assertEquals(96, context.getWindows().get(1).getStart());
        assertEquals(120, context.getWindows().get(1).getEnd());
        assertEquals(4, context.numberOfSubsequences());

        List<Integer> starts = context.subsequences().stream().map(Subsequence::getStartIndex)
                .collect(Collectors.toList());
        assertThat(starts, contains(0, 1, 96, 97));
        assertThat(context.subsequences().stream().map(Subsequence::getWindowIndex).collect(Collectors.toList()),
                contains(0, 0, 1, 1));
    }

    @Test
    public void testLabelAndDescription() {
        Context context = StaticContextManager.derive(192, 96, 0, 6, 23);
        assertEquals("ctx_from00_00_to06_00_m05_45", context.getLabel());
        assertEquals("Subsequences of 05:45 h (m = 23) that start in [00:00,06:00)", context.getDescription());
    }

    @ParameterizedTest
    @CsvSource({ "960, 0, 6, 23, 20", "960, 0, 6, 4, 210", "960, 6, 12, 24, 10", "1000, 18, 24, 8, 170",
            "960, 23, 24, 1, 40" })
    public void testNumberOfSubsequences(int seriesLength, double startHour, double endHour, int m,
            int expectedCount) {
        Context context = StaticContextManager.derive(seriesLength, 96, startHour, endHour, m);
        int cycles = seriesLength / 96;
        int windowLength = (int) ((endHour - startHour) * 4);
        assertEquals(cycles * (windowLength - m + 1), context.numberOfSubsequences());
        assertEquals(expectedCount, context.numberOfSubsequences());
        assertEquals(context.numberOfSubsequences(), context.subsequences().size());
    }

    @Test
    public void testTrailingPartialCycleIsDropped() {
        Context context = StaticContextManager.derive(250, 96, 0, 6, 4);
        assertEquals(2, context.getWindows().size());
    }

    @Test
    public void testFractionalHours() {
        Context context = StaticContextManager.derive(192, 96, 5.25, 9, 8);
        assertEquals(21, context.getWindows().get(0).getStart());
        assertEquals(36, context.getWindows().get(0).getEnd());
        assertEquals("ctx_from05_15_to09_00_m02_00", context.getLabel());

        assertThrows(ConfigurationException.class, () -> StaticContextManager.derive(192, 96, 5.1, 9, 8));
    }

    @Test
    public void testInvalidConfiguration() {
        assertThrows(ConfigurationException.class, () -> StaticContextManager.derive(192, 96, 0, 6, 0));
        assertThrows(ConfigurationException.class, () -> StaticContextManager.derive(192, 96, 0, 6, -3));
        assertThrows(ConfigurationException.class, () -> StaticContextManager.derive(192, 96, 0, 24, 96));
        assertThrows(ConfigurationException.class, () -> StaticContextManager.derive(192, 96, 6, 6, 4));
        assertThrows(ConfigurationException.class, () -> StaticContextManager.derive(192, 96, 8, 6, 4));
        assertThrows(ConfigurationException.class, () -> StaticContextManager.derive(192, 96, -1, 6, 4));
        assertThrows(ConfigurationException.class, () -> StaticContextManager.derive(192, 96, 0, 25, 4));
        // one hour holds only 4 observations
        assertThrows(ConfigurationException.class, () -> StaticContextManager.derive(192, 96, 0, 1, 5));
        assertThrows(ConfigurationException.class,
                () -> StaticContextManager.derive(0, 192, 100, 24, 0, 6, 4));
    }

    @Test
    public void testProviderUsesDeclaredIndex() {
        StaticContextManager manager = new StaticContextManager(new ContextDefinition(0, 6, 23), 96);
        Context context = manager.provide(3, 192);
        assertEquals(3, context.getDeclaredIndex());
        assertEquals("ctx_from00_00_to06_00_m05_45", manager.getLabel());
    }

    @Test
    public void testShortSeriesHasNoWindows() {
        Context context = StaticContextManager.derive(50, 96, 0, 6, 4);
        assertEquals(0, context.numberOfSubsequences());
    }
}
