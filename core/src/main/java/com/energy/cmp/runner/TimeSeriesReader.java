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

package com.energy.cmp.runner;

import static com.energy.cmp.CommonUtils.checkArgument;

import java.io.BufferedReader;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.energy.cmp.series.TimeSeries;

/**
 * Reads a series from delimited text, one observation per line:
 * {@code timestamp,value[,exogenous]}. Timestamps are ISO-8601 local date-times
 * (read as UTC) or epoch milliseconds. An empty value or {@code NA} is a
 * missing observation.
 */
public class TimeSeriesReader {

    private static final Pattern EPOCH_MILLIS = Pattern.compile("-?\\d+");

    private final String delimiter;
    private final boolean headerRow;
    private int lineNumber;

    public TimeSeriesReader(String delimiter, boolean headerRow) {
        checkArgument(delimiter != null && !delimiter.isEmpty(), "delimiter should not be empty");
        this.delimiter = delimiter;
        this.headerRow = headerRow;
    }

    /**
     * @param in the input
     * @return the series
     * @throws IOException              if the input cannot be read
     * @throws IllegalArgumentException if a line cannot be parsed or the
     *                                  timestamps are not evenly spaced
     */
    public TimeSeries read(BufferedReader in) throws IOException {
        List<Long> timestamps = new ArrayList<>();
        List<Double> values = new ArrayList<>();
        List<Double> exogenous = new ArrayList<>();
        int columns = -1;
        lineNumber = 0;

        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            if ((lineNumber == 1 && headerRow) || line.trim().isEmpty()) {
                continue;
            }
            String[] fields = line.split(Pattern.quote(delimiter), -1);
            if (columns < 0) {
                checkArgument(fields.length == 2 || fields.length == 3, String.format(
                        "Expected 2 or 3 values on line %d but found %d.", lineNumber, fields.length));
                columns = fields.length;
            } else if (fields.length != columns) {
                throw new IllegalArgumentException(String.format(
                        "Wrong number of values on line %d. Expected %d but found %d.", lineNumber, columns,
                        fields.length));
            }
            timestamps.add(parseTimestamp(fields[0].trim()));
            values.add(parseValue(fields[1].trim()));
            if (columns == 3) {
                exogenous.add(parseValue(fields[2].trim()));
            }
        }

        checkArgument(!timestamps.isEmpty(), "the input contains no observations");
        long[] t = new long[timestamps.size()];
        double[] v = new double[values.size()];
        for (int i = 0; i < t.length; i++) {
            t[i] = timestamps.get(i);
            v[i] = values.get(i);
        }
        if (columns == 3) {
            double[] e = new double[exogenous.size()];
            for (int i = 0; i < e.length; i++) {
                e[i] = exogenous.get(i);
            }
            return new TimeSeries(t, v, e);
        }
        return new TimeSeries(t, v);
    }

    long parseTimestamp(String field) {
        if (EPOCH_MILLIS.matcher(field).matches()) {
            return Long.parseLong(field);
        }
        try {
            return LocalDateTime.parse(field.replace(' ', 'T')).toInstant(ZoneOffset.UTC).toEpochMilli();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(
                    String.format("Cannot parse timestamp '%s' on line %d.", field, lineNumber), e);
        }
    }

    double parseValue(String field) {
        if (field.isEmpty() || "NA".equalsIgnoreCase(field) || "NaN".equalsIgnoreCase(field)) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(field);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    String.format("Cannot parse value '%s' on line %d.", field, lineNumber), e);
        }
    }
}
