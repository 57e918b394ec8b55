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

import static com.energy.cmp.CommonUtils.checkArgument;
import static com.energy.cmp.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import lombok.Getter;

import com.energy.cmp.config.BandingStrategy;
import com.energy.cmp.profile.DistanceProfile;
import com.energy.cmp.series.TimeSeries;

/**
 * Groups the entries of a distance profile into a fixed number of ranked
 * distance bands and flags the bands whose representative distance exceeds
 * the baseline by more than the anomaly margin.
 *
 * Entries with an undefined (NaN) distance are not assigned to any cluster.
 * The rank 0 cluster is the baseline and is never anomalous. A non-empty
 * cluster of rank {@code r > 0} is anomalous when
 * {@code representative > baseline * (1 + anomalyMargin)}.
 */
@Getter
public class DistanceBandClusterer {

    public static final int DEFAULT_NUMBER_OF_CLUSTERS = 5;

    public static final double DEFAULT_ANOMALY_MARGIN = 0.5;

    public static final BandingStrategy DEFAULT_BANDING_STRATEGY = BandingStrategy.EQUAL_WIDTH;

    private final int numberOfClusters;

    private final double anomalyMargin;

    private final BandingStrategy bandingStrategy;

    public DistanceBandClusterer(int numberOfClusters, double anomalyMargin, BandingStrategy bandingStrategy) {
        checkArgument(numberOfClusters > 0, "number of clusters must be greater than 0");
        checkArgument(anomalyMargin >= 0, "anomaly margin must be non-negative");
        checkNotNull(bandingStrategy, "banding strategy must not be null");
        this.numberOfClusters = numberOfClusters;
        this.anomalyMargin = anomalyMargin;
        this.bandingStrategy = bandingStrategy;
    }

    public DistanceBandClusterer() {
        this(DEFAULT_NUMBER_OF_CLUSTERS, DEFAULT_ANOMALY_MARGIN, DEFAULT_BANDING_STRATEGY);
    }

    public ClusteringResult cluster(DistanceProfile profile) {
        return cluster(profile, null);
    }

    /**
     * Clusters a distance profile.
     *
     * @param profile the distance profile of one context
     * @param series  the series the profile was computed on, used to attach the
     *                exogenous mean to anomaly labels; may be null
     * @return the clusters in rank order and the anomaly labels in ranking order
     */
    public ClusteringResult cluster(DistanceProfile profile, TimeSeries series) {
        checkNotNull(profile, "profile must not be null");

        Integer[] ranking = rank(profile);
        int[] bandOf = new int[ranking.length];
        if (bandingStrategy == BandingStrategy.EQUAL_WIDTH) {
            assignEqualWidth(profile, ranking, bandOf);
        } else {
            assignEqualCount(ranking, bandOf);
        }

        double min = ranking.length == 0 ? Double.NaN : profile.getDistance(ranking[0]);
        double max = ranking.length == 0 ? Double.NaN : profile.getDistance(ranking[ranking.length - 1]);
        double width = (max - min) / numberOfClusters;

        List<Cluster> clusters = new ArrayList<>(numberOfClusters);
        double baseline = Double.NaN;
        double previous = Double.NaN;
        for (int band = 0; band < numberOfClusters; band++) {
            long start = System.nanoTime();
            int count = 0;
            for (int b : bandOf) {
                if (b == band) {
                    count++;
                }
            }
            int[] members = new int[count];
            double sum = 0;
            int next = 0;
            for (int r = 0; r < ranking.length; r++) {
                if (bandOf[r] == band) {
                    members[next++] = ranking[r];
                    sum += profile.getDistance(ranking[r]);
                }
            }

            double representative;
            if (count > 0) {
                representative = sum / count;
            } else if (ranking.length == 0) {
                representative = Double.NaN;
            } else if (bandingStrategy == BandingStrategy.EQUAL_WIDTH) {
                representative = min + (band + 0.5) * width;
            } else {
                representative = previous;
            }

            if (band == 0) {
                baseline = representative;
            }
            boolean anomaly = band > 0 && count > 0 && !Double.isNaN(baseline)
                    && representative > baseline * (1 + anomalyMargin);
            previous = representative;
            clusters.add(new Cluster(band, members, representative, System.nanoTime() - start, anomaly));
        }

        List<AnomalyLabel> labels = new ArrayList<>();
        for (int r = 0; r < ranking.length; r++) {
            Cluster cluster = clusters.get(bandOf[r]);
            if (cluster.isAnomaly()) {
                int ordinal = ranking[r];
                int startIndex = profile.getStartIndex(ordinal);
                double exogenousMean = series == null ? Double.NaN
                        : series.exogenousMean(startIndex, profile.getSubsequenceLength());
                labels.add(new AnomalyLabel(ordinal, startIndex, profile.getWindowIndex(ordinal), cluster.getRank(),
                        profile.getDistance(ordinal), exogenousMean));
            }
        }
        return new ClusteringResult(clusters, labels);
    }

    /**
     * @return the ordinals with a defined distance, sorted by distance and then
     *         by ordinal
     */
    static Integer[] rank(DistanceProfile profile) {
        Integer[] defined = new Integer[profile.definedCount()];
        int next = 0;
        for (int i = 0; i < profile.size(); i++) {
            if (profile.isDefined(i)) {
                defined[next++] = i;
            }
        }
        Arrays.sort(defined, Comparator.<Integer>comparingDouble(profile::getDistance)
                .thenComparingInt(Integer::intValue));
        return defined;
    }

    void assignEqualWidth(DistanceProfile profile, Integer[] ranking, int[] bandOf) {
        if (ranking.length == 0) {
            return;
        }
        double min = profile.getDistance(ranking[0]);
        double max = profile.getDistance(ranking[ranking.length - 1]);
        double width = (max - min) / numberOfClusters;
        for (int r = 0; r < ranking.length; r++) {
            if (width == 0) {
                bandOf[r] = 0;
            } else {
                int band = (int) Math.floor((profile.getDistance(ranking[r]) - min) / width);
                bandOf[r] = Math.min(numberOfClusters - 1, band);
            }
        }
    }

    void assignEqualCount(Integer[] ranking, int[] bandOf) {
        int base = ranking.length / numberOfClusters;
        int remainder = ranking.length % numberOfClusters;
        int r = 0;
        for (int band = 0; band < numberOfClusters; band++) {
            int size = base + (band < remainder ? 1 : 0);
            for (int i = 0; i < size; i++) {
                bandOf[r++] = band;
            }
        }
    }
}
