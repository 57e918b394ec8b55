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

package com.energy.cmp.clustering;

import java.util.Collections;
import java.util.List;

import lombok.Getter;

@Getter
public class ClusteringResult {

    /**
     * clusters in rank order, always the configured number of them
     */
    private final List<Cluster> clusters;

    private final List<AnomalyLabel> anomalyLabels;

    public ClusteringResult(List<Cluster> clusters, List<AnomalyLabel> anomalyLabels) {
        this.clusters = Collections.unmodifiableList(clusters);
        this.anomalyLabels = Collections.unmodifiableList(anomalyLabels);
    }

    /**
     * @return the number of subsequences assigned to a cluster
     */
    public int getClusteredCount() {
        int count = 0;
        for (Cluster cluster : clusters) {
            count += cluster.size();
        }
        return count;
    }
}
