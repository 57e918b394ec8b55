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

import static com.energy.cmp.CommonUtils.checkArgument;

import lombok.Getter;

/**
 * A half open range {@code [start, end)} of series indices. Subsequences of a
 * context must lie entirely inside one window.
 */
@Getter
public class IndexWindow {

    private final int start;

    private final int end;

    public IndexWindow(int start, int end) {
        checkArgument(start >= 0, "window start must be non-negative");
        checkArgument(end > start, "window end must be greater than window start");
        this.start = start;
        this.end = end;
    }

    public int length() {
        return end - start;
    }

    /**
     * @param subsequenceLength the length m of a subsequence
     * @return the number of offsets at which a subsequence of length m fits in
     *         this window
     */
    public int numberOfStarts(int subsequenceLength) {
        return Math.max(0, length() - subsequenceLength + 1);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
