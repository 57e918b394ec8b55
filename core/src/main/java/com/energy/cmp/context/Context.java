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
import static com.energy.cmp.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

import com.energy.cmp.profile.Subsequence;

/**
 * A resolved context: the ordered, disjoint windows in which subsequences of a
 * fixed length may lie, one window per recurrence cycle. Contexts are read only
 * and shared between the stages that process them.
 */
@Getter
public class Context {

    /**
     * position of the context in the caller's declaration order
     */
    private final int declaredIndex;

    private final String label;

    private final String description;

    private final int subsequenceLength;

    private final List<IndexWindow> windows;

    public Context(int declaredIndex, String label, String description, int subsequenceLength,
            List<IndexWindow> windows) {
        checkNotNull(label, "label must not be null");
        checkNotNull(windows, "windows must not be null");
        checkArgument(subsequenceLength > 0, "subsequence length must be greater than 0");
        for (int i = 1; i < windows.size(); i++) {
            checkArgument(windows.get(i).getStart() >= windows.get(i - 1).getEnd(),
                    "windows must be ordered and must not overlap");
        }
        this.declaredIndex = declaredIndex;
        this.label = label;
        this.description = description == null ? label : description;
        this.subsequenceLength = subsequenceLength;
        this.windows = Collections.unmodifiableList(new ArrayList<>(windows));
    }

    /**
     * @return the number of subsequences that fit in the windows of this context
     */
    public int numberOfSubsequences() {
        int count = 0;
        for (IndexWindow window : windows) {
            count += window.numberOfStarts(subsequenceLength);
        }
        return count;
    }

    /**
     * Enumerates all subsequences in ascending start order. The returned objects
     * are views; no values are copied.
     *
     * @return the subsequences of this context
     */
    public List<Subsequence> subsequences() {
        List<Subsequence> result = new ArrayList<>(numberOfSubsequences());
        int ordinal = 0;
        for (int w = 0; w < windows.size(); w++) {
            IndexWindow window = windows.get(w);
            int starts = window.numberOfStarts(subsequenceLength);
            for (int offset = 0; offset < starts; offset++) {
                result.add(new Subsequence(ordinal++, w, window.getStart() + offset, subsequenceLength));
            }
        }
        return result;
    }
}
