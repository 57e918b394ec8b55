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

package com.energy.cmp;

/**
 * Raised when the data inside a context cannot support a nearest neighbor
 * search, for example when fewer than two usable subsequences remain.
 */
public class DataException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public DataException(String message) {
        super(message);
    }
}
