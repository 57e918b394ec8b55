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

package com.energy.cmp.returntypes;

import java.util.Collections;
import java.util.List;

import lombok.Getter;

/**
 * The results of all contexts of a run, in declaration order.
 */
@Getter
public class RunResult {

    private final List<ContextResult> contextResults;

    private final long totalElapsedNanos;

    public RunResult(List<ContextResult> contextResults, long totalElapsedNanos) {
        this.contextResults = Collections.unmodifiableList(contextResults);
        this.totalElapsedNanos = totalElapsedNanos;
    }

    public int size() {
        return contextResults.size();
    }

    public ContextResult get(int declaredIndex) {
        return contextResults.get(declaredIndex);
    }

    public int getFailedCount() {
        return (int) contextResults.stream().filter(ContextResult::isFailed).count();
    }

    /**
     * @return the number of anomalies over all analyzed contexts
     */
    public int getTotalAnomalyCount() {
        return contextResults.stream().filter(r -> !r.isFailed()).mapToInt(ContextResult::getAnomalyCount).sum();
    }
}
