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

import static com.energy.cmp.CommonUtils.checkConfiguration;
import static com.energy.cmp.CommonUtils.checkNotNull;
import static com.energy.cmp.CommonUtils.isIntegral;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Derives the windows of a context from a time of day range. For every full
 * cycle {@code x} of the series the window
 * {@code [x * opc + startHour * oph, x * opc + endHour * oph)} is emitted,
 * where {@code opc} is the number of observations per cycle and {@code oph}
 * the number of observations per hour. A trailing partial cycle is dropped.
 */
@Getter
public class StaticContextManager implements IContextProvider {

    public static final int DEFAULT_HOURS_PER_CYCLE = 24;

    private final ContextDefinition definition;

    private final int observationsPerCycle;

    private final int hoursPerCycle;

    public StaticContextManager(ContextDefinition definition, int observationsPerCycle, int hoursPerCycle) {
        this.definition = checkNotNull(definition, "definition must not be null");
        this.observationsPerCycle = observationsPerCycle;
        this.hoursPerCycle = hoursPerCycle;
    }

    public StaticContextManager(ContextDefinition definition, int observationsPerCycle) {
        this(definition, observationsPerCycle, DEFAULT_HOURS_PER_CYCLE);
    }

    @Override
    public Context provide(int declaredIndex, int seriesLength) {
        return derive(declaredIndex, seriesLength, observationsPerCycle, hoursPerCycle, definition.getStartHour(),
                definition.getEndHour(), definition.getSubsequenceLength());
    }

    @Override
    public String getLabel() {
        int observationsPerHour = hoursPerCycle > 0 && observationsPerCycle % hoursPerCycle == 0
                ? observationsPerCycle / hoursPerCycle
                : 0;
        return definition.getLabel(observationsPerHour);
    }

    /**
     * Derives a context over a 24 hour cycle.
     *
     * @param seriesLength         number of observations in the series
     * @param observationsPerCycle observations per cycle
     * @param startHour            first hour (inclusive) in which subsequences may
     *                             lie
     * @param endHour              last hour (exclusive)
     * @param subsequenceLength    the subsequence length m
     * @return the context
     */
    public static Context derive(int seriesLength, int observationsPerCycle, double startHour, double endHour,
            int subsequenceLength) {
        return derive(0, seriesLength, observationsPerCycle, DEFAULT_HOURS_PER_CYCLE, startHour, endHour,
                subsequenceLength);
    }

    /**
     * Derives a context. Pure function of its inputs.
     *
     * @param declaredIndex        position of the context in declaration order
     * @param seriesLength         number of observations in the series
     * @param observationsPerCycle observations per cycle
     * @param hoursPerCycle        hours per cycle
     * @param startHour            first hour (inclusive) in which subsequences may
     *                             lie
     * @param endHour              last hour (exclusive)
     * @param subsequenceLength    the subsequence length m
     * @return the context
     * @throws com.energy.cmp.ConfigurationException if the bounds or the
     *                                                subsequence length are
     *                                                invalid
     */
    public static Context derive(int declaredIndex, int seriesLength, int observationsPerCycle, int hoursPerCycle,
            double startHour, double endHour, int subsequenceLength) {
        checkConfiguration(subsequenceLength > 0, "subsequence length m must be greater than 0");
        checkConfiguration(subsequenceLength < observationsPerCycle, String.format(
                "subsequence length m = %d must be smaller than the %d observations per cycle", subsequenceLength,
                observationsPerCycle));
        checkConfiguration(endHour > startHour,
                String.format("context end hour %s must be greater than start hour %s", endHour, startHour));
        checkConfiguration(startHour >= 0, "context start hour must be non-negative");
        checkConfiguration(endHour <= hoursPerCycle,
                String.format("context end hour %s exceeds the %d hour cycle", endHour, hoursPerCycle));
        checkConfiguration(hoursPerCycle > 0 && observationsPerCycle % hoursPerCycle == 0, String.format(
                "%d observations per cycle is not a whole number of observations per hour over %d hours",
                observationsPerCycle, hoursPerCycle));

        int observationsPerHour = observationsPerCycle / hoursPerCycle;
        double startOffset = startHour * observationsPerHour;
        double endOffset = endHour * observationsPerHour;
        checkConfiguration(isIntegral(startOffset) && isIntegral(endOffset), String.format(
                "context bounds [%s, %s) do not fall on whole observations at %d observations per hour", startHour,
                endHour, observationsPerHour));

        int from = (int) Math.rint(startOffset);
        int to = (int) Math.rint(endOffset);
        checkConfiguration(subsequenceLength <= to - from, String.format(
                "subsequence length m = %d exceeds the window length of %d observations", subsequenceLength, to - from));

        int cycles = seriesLength / observationsPerCycle;
        List<IndexWindow> windows = new ArrayList<>(cycles);
        for (int x = 0; x < cycles; x++) {
            windows.add(new IndexWindow(x * observationsPerCycle + from, x * observationsPerCycle + to));
        }

        ContextDefinition definition = new ContextDefinition(startHour, endHour, subsequenceLength);
        return new Context(declaredIndex, definition.getLabel(observationsPerHour),
                definition.getDescription(observationsPerHour), subsequenceLength, windows);
    }
}
