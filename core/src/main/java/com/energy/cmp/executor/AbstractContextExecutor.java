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

package com.energy.cmp.executor;

import static com.energy.cmp.CommonUtils.checkNotNull;

import java.util.List;

import com.energy.cmp.context.IContextProvider;
import com.energy.cmp.returntypes.ContextResult;
import com.energy.cmp.series.TimeSeries;

/**
 * Runs the contexts of a run. Contexts are independent of each other; the
 * returned list holds one result per provider, in any order.
 */
public abstract class AbstractContextExecutor {

    protected final ContextAnalyzer analyzer;

    public AbstractContextExecutor(ContextAnalyzer analyzer) {
        this.analyzer = checkNotNull(analyzer, "analyzer must not be null");
    }

    /**
     * Analyzes every context. The declared index of the provider at position
     * {@code i} is {@code i}.
     *
     * @param series    the series, shared read only by all contexts
     * @param providers the context providers in declaration order
     * @return one result per provider
     */
    public abstract List<ContextResult> execute(TimeSeries series, List<IContextProvider> providers);
}
