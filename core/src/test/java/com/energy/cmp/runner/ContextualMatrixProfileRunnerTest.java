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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.energy.cmp.TestUtils;

public class ContextualMatrixProfileRunnerTest {

    private ContextualMatrixProfileRunner runner;

    private String input;

    @BeforeEach
    public void setUp() {
        runner = new ContextualMatrixProfileRunner();
        double[] values = TestUtils.rampDays(6, 2, 1L);
        StringBuilder builder = new StringBuilder("timestamp,load\n");
        for (int i = 0; i < values.length; i++) {
            builder.append(i * TestUtils.QUARTER_HOUR_MILLIS).append(',').append(values[i]).append('\n');
        }
        input = builder.toString();
    }

    private String[] run() throws IOException {
        StringWriter writer = new StringWriter();
        runner.run(new BufferedReader(new StringReader(input)), new PrintWriter(writer));
        return writer.toString().split("\\R");
    }

    @Test
    public void testRun() throws IOException {
        runner.parse("--header-row", "true", "--contexts", "0:6:23;0:1:5", "-k", "3");
        String[] lines = run();

        assertEquals("context,status,rank,size,elapsed_ms,anomaly_count,representative_distance,reason", lines[0]);
        // three cluster rows and one failed row
        assertEquals(5, lines.length);
        for (int i = 1; i <= 3; i++) {
            assertThat(lines[i], startsWith("ctx_from00_00_to06_00_m05_45,ANALYZED," + (i - 1) + ","));
        }
        assertThat(lines[4], startsWith("ctx_from00_00_to01_00_m01_15,FAILED,,,"));
        assertTrue(lines[4].contains("\"CONFIGURATION: "));

        String[] top = lines[3].split(",");
        assertEquals("2", top[3]);
        assertEquals("2", top[5]);
    }

    @Test
    public void testQuote() {
        assertEquals("\"a \"\"b\"\", c\"", ContextualMatrixProfileRunner.quote("a \"b\", c"));
    }
}
