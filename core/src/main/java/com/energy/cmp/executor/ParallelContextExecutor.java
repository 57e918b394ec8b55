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

import static com.energy.cmp.CommonUtils.checkArgument;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.energy.cmp.context.IContextProvider;
import com.energy.cmp.returntypes.ContextResult;
import com.energy.cmp.series.TimeSeries;

/**
 * Analyzes contexts in parallel on a private thread pool. Results come back in
 * completion order; callers order them by declared index.
 */
public class ParallelContextExecutor extends AbstractContextExecutor {

    private ForkJoinPool forkJoinPool;
    private final int threadPoolSize;

    public ParallelContextExecutor(ContextAnalyzer analyzer, int threadPoolSize) {
        super(analyzer);
        checkArgument(threadPoolSize > 0, "thread pool size must be greater than 0");
        this.threadPoolSize = threadPoolSize;
        forkJoinPool = new ForkJoinPool(threadPoolSize);
    }

    @Override
    public List<ContextResult> execute(TimeSeries series, List<IContextProvider> providers) {
        return submitAndJoin(() -> IntStream.range(0, providers.size()).parallel()
                .mapToObj(i -> analyzer.analyze(i, providers.get(i), series)).collect(Collectors.toList()));
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        if (forkJoinPool == null) {
            forkJoinPool = new ForkJoinPool(threadPoolSize);
        }
        return forkJoinPool.submit(callable).join();
    }
}
