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

import com.energy.cmp.ConfigurationException;
import com.energy.cmp.DataException;

/**
 * Why a context could not be analyzed.
 */
public enum FailureKind {
    /**
     * the context definition is invalid for the series
     */
    CONFIGURATION,
    /**
     * the data inside the context is insufficient
     */
    DATA,
    /**
     * an unexpected error
     */
    INTERNAL;

    public static FailureKind of(Throwable throwable) {
        if (throwable instanceof ConfigurationException) {
            return CONFIGURATION;
        } else if (throwable instanceof DataException) {
            return DATA;
        }
        return INTERNAL;
    }
}
