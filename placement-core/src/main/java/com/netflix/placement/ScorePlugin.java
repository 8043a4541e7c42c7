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

package com.netflix.placement;

/**
 * Interface representing a scorer. A pod may fit on multiple nodes; a scorer says how much a feasible node is
 * preferred for the pod, independently of every other node.
 */
public interface ScorePlugin extends Plugin {

    long MIN_SCORE = 0L;
    long MAX_SCORE = 100L;

    /**
     * Score a node for the pod. This does not have to check that the node has sufficient resources for the pod,
     * a {@link FilterPlugin} already did.
     *
     * @param pod  the pod to be placed
     * @param node a feasible node for the pod
     * @return a value between {@link #MIN_SCORE} and {@link #MAX_SCORE}, higher values preferred
     * @throws PlacementException if the score cannot be computed
     */
    long score(Pod pod, Node node) throws PlacementException;

    /**
     * Score a node with the given scorer and check the result is within {@link #MIN_SCORE} and {@link #MAX_SCORE}.
     *
     * @param scorer the scorer to call
     * @param pod    the pod to be placed
     * @param node   a feasible node for the pod
     * @return the score
     * @throws PlacementException if the scorer fails or its score is out of range
     */
    static long scoreInRange(ScorePlugin scorer, Pod pod, Node node) throws PlacementException {
        final long score = scorer.score(pod, node);
        if (score < MIN_SCORE || score > MAX_SCORE)
            throw new PlacementException("Scorer " + scorer.getName() + " gave node " + node.getName() +
                    " score " + score + " outside [" + MIN_SCORE + ", " + MAX_SCORE + "]");
        return score;
    }
}
