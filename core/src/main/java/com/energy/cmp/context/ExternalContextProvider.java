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

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * A context whose windows are supplied by the caller, for example the days of a
 * group of similar daily load profiles.
 */
@Getter
public class ExternalContextProvider implements IContextProvider {

    private final String label;

    private final int subsequenceLength;

    private final List<IndexWindow> windows;

    public ExternalContextProvider(String label, int subsequenceLength, List<IndexWindow> windows) {
        this.label = checkNotNull(label, "label must not be null");
        this.subsequenceLength = subsequenceLength;
        this.windows = new ArrayList<>(checkNotNull(windows, "windows must not be null"));
    }

    @Override
    public Context provide(int declaredIndex, int seriesLength) {
        checkConfiguration(subsequenceLength > 0, "subsequence length m must be greater than 0");
        checkConfiguration(!windows.isEmpty(), "at least one window is required");
        for (int i = 0; i < windows.size(); i++) {
            IndexWindow window = windows.get(i);
            checkConfiguration(window.getEnd() <= seriesLength,
                    String.format("window %s extends beyond the series of length %d", window, seriesLength));
            checkConfiguration(window.length() >= subsequenceLength, String.format(
                    "window %s is shorter than the subsequence length m = %d", window, subsequenceLength));
            checkConfiguration(i == 0 || window.getStart() >= windows.get(i - 1).getEnd(),
                    "windows must be ordered and must not overlap");
        }
        return new Context(declaredIndex, label, label, subsequenceLength, windows);
    }
}
