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

import com.netflix.placement.NodeScore;
import com.netflix.placement.PlacementException;
import com.netflix.placement.Pod;
import com.netflix.placement.ScoreNormalizer;
import com.netflix.placement.ScorePlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Linearly rescales raw scores so that the lowest becomes 0 and the highest becomes the maximum score:
 * {@code (score - lowest) * maxScore / (highest - lowest)}, with integer division.
 * <p>
 * When every score is the same there is no range to rescale; the lowest is then taken as one less than the
 * highest, which gives every node the maximum score. Scores whose range or rescaled value does not fit in a
 * {@code long} are rejected with a {@link PlacementException}.
 */
public class MinMaxScoreNormalizer implements ScoreNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(MinMaxScoreNormalizer.class);
    private final long maxScore;

    public MinMaxScoreNormalizer() {
        this(ScorePlugin.MAX_SCORE);
    }

    public MinMaxScoreNormalizer(long maxScore) {
        if (maxScore <= 0L)
            throw new IllegalArgumentException("Max score must be positive: " + maxScore);
        this.maxScore = maxScore;
    }

    public long getMaxScore() {
        return maxScore;
    }

    @Override
    public List<NodeScore> normalizeScores(Pod pod, List<NodeScore> scores) throws PlacementException {
        if (scores == null || scores.isEmpty())
            throw new PlacementException("No node scores to normalize for pod " + podName(pod));
        final Set<String> names = new HashSet<>();
        long lowest = scores.get(0).getScore();
        long highest = lowest;
        for (NodeScore nodeScore : scores) {
            if (!names.add(nodeScore.getName()))
                throw new PlacementException("Node " + nodeScore.getName() + " scored more than once for pod " + podName(pod));
            lowest = Math.min(lowest, nodeScore.getScore());
            highest = Math.max(highest, nodeScore.getScore());
        }
        final List<NodeScore> normalized = new ArrayList<>(scores.size());
        try {
            if (highest == lowest)
                lowest = Math.decrementExact(lowest);
            final long range = Math.subtractExact(highest, lowest);
            for (NodeScore nodeScore : scores) {
                normalized.add(new NodeScore(nodeScore.getName(),
                        Math.multiplyExact(nodeScore.getScore() - lowest, maxScore) / range));
            }
        } catch (ArithmeticException e) {
            throw new PlacementException("Scores for pod " + podName(pod) + " in [" + lowest + ", " + highest +
                    "] cannot be rescaled to [0, " + maxScore + "]", e);
        }
        if (logger.isDebugEnabled())
            logger.debug("Normalized scores for pod {}: {} -> {}", podName(pod), scores, normalized);
        return normalized;
    }

    private static String podName(Pod pod) {
        return pod == null ? "<none>" : pod.getNamespace() + "/" + pod.getName();
    }
}
