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

import java.util.Objects;

/** A collection of common utility functions. */
public class CommonUtils {

    /**
     * Tolerance used when checking that an hour offset maps onto a whole number of
     * observations.
     */
    public static final double INTEGRAL_TOLERANCE = 1e-9;

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link ConfigurationException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the exception.
     * @throws ConfigurationException if {@code condition} is false.
     */
    public static void checkConfiguration(boolean condition, String message) {
        if (!condition) {
            throw new ConfigurationException(message);
        }
    }

    /**
     * Throws a {@link DataException} with the specified message if the specified
     * input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the exception.
     * @throws DataException if {@code condition} is false.
     */
    public static void checkData(boolean condition, String message) {
        if (!condition) {
            throw new DataException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * @param value a real value
     * @return true if the value is within {@link #INTEGRAL_TOLERANCE} of a whole
     *         number
     */
    public static boolean isIntegral(double value) {
        return Math.abs(value - Math.rint(value)) < INTEGRAL_TOLERANCE;
    }

    /**
     * Formats a decimal number of hours as {@code HH:MM}, e.g. 5.75 becomes 05:45.
     *
     * @param decimalHours a non negative number of hours
     * @return the hours and minutes, zero padded
     */
    public static String formatHours(double decimalHours) {
        checkArgument(decimalHours >= 0, "hours must be non-negative");
        long totalMinutes = Math.round(decimalHours * 60);
        return String.format("%02d:%02d", totalMinutes / 60, totalMinutes % 60);
    }

    /**
     * @param values an array
     * @return true if any entry is NaN
     */
    public static boolean containsNaN(double[] values) {
        for (double value : values) {
            if (Double.isNaN(value)) {
                return true;
            }
        }
        return false;
    }
}
