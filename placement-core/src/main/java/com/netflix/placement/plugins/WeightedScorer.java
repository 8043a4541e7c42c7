/*
 * Copyright 2015 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.placement.plugins;

import com.netflix.placement.Node;
import com.netflix.placement.PlacementException;
import com.netflix.placement.Pod;
import com.netflix.placement.ScorePlugin;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A scorer that calculates the weighted average of multiple scorers, rounded to the nearest integer.
 */
public class WeightedScorer implements ScorePlugin {
    public static final String NAME = "WeightedScorer";

    private static final double WEIGHT_SUM_TOLERANCE = 1e-9;
    private final List<Weighted> scorers;

    public WeightedScorer(List<Weighted> scorers) {
        if (scorers == null || scorers.isEmpty()) {
            throw new IllegalArgumentException("There must be at least 1 scorer");
        }
        double sum = scorers.stream()
                .mapToDouble(Weighted::getWeight)
                .sum();
        if (Math.abs(sum - 1.0) > WEIGHT_SUM_TOLERANCE) {
            throw new IllegalArgumentException("The sum of the weights must equal 1.0");
        }
        this.scorers = Collections.unmodifiableList(new ArrayList<>(scorers));
    }

    @Override
    public String getName() {
        return NAME;
    }

    public List<Weighted> getScorers() {
        return scorers;
    }

    @Override
    public long score(Pod pod, Node node) throws PlacementException {
        double total = 0.0;
        for (Weighted weighted : scorers) {
            total += weighted.getScorer().score(pod, node) * weighted.getWeight();
        }
        return Math.round(total);
    }

    @Override
    public String toString() {
        return "WeightedScorer: " + scorers;
    }

    public static class Weighted {
        private final ScorePlugin scorer;
        private final double weight;

        public Weighted(ScorePlugin scorer, double weight) {
            if (scorer == null) {
                throw new IllegalArgumentException("Scorer cannot be null");
            }
            if (weight < 0.0) {
                throw new IllegalArgumentException("Weight cannot be negative");
            }
            this.scorer = scorer;
            this.weight = weight;
        }

        public ScorePlugin getScorer() {
            return scorer;
        }

        public double getWeight() {
            return weight;
        }

        @Override
        public String toString() {
            return "{ scorer: " + scorer.getName() + ", weight: " + weight + " }";
        }
    }
}
