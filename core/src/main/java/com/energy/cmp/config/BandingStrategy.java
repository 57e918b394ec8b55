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

package com.energy.cmp.config;

/**
 * How the range of nearest neighbor distances is cut into clusters.
 */
public enum BandingStrategy {
    /**
     * The range between the smallest and the largest defined distance is split
     * into bands of equal width. Bands may be empty.
     */
    EQUAL_WIDTH,
    /**
     * The ranked distances are split into contiguous slices whose sizes differ
     * by at most one.
     */
    EQUAL_COUNT
}
