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

/**
 * A source of index windows for one context. Downstream stages only see the
 * resulting {@link Context} and do not depend on how the windows were chosen.
 */
public interface IContextProvider {

    /**
     * Resolves the windows of this context for a series of the given length.
     *
     * @param declaredIndex position of the context in declaration order
     * @param seriesLength  number of observations in the series
     * @return the resolved context
     * @throws com.energy.cmp.ConfigurationException if the context cannot be
     *                                                resolved
     */
    Context provide(int declaredIndex, int seriesLength);

    /**
     * @return a label identifying the context, available even if
     *         {@link #provide(int, int)} fails
     */
    String getLabel();
}
