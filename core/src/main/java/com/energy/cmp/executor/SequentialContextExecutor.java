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

import java.util.ArrayList;
import java.util.List;

import com.energy.cmp.context.IContextProvider;
import com.energy.cmp.returntypes.ContextResult;
import com.energy.cmp.series.TimeSeries;

/**
 * Analyzes contexts one after the other in the calling thread.
 */
public class SequentialContextExecutor extends AbstractContextExecutor {

    public SequentialContextExecutor(ContextAnalyzer analyzer) {
        super(analyzer);
    }

    @Override
    public List<ContextResult> execute(TimeSeries series, List<IContextProvider> providers) {
        List<ContextResult> results = new ArrayList<>(providers.size());
        for (int i = 0; i < providers.size(); i++) {
            results.add(analyzer.analyze(i, providers.get(i), series));
        }
        return results;
    }
}
