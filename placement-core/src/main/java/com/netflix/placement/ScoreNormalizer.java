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

import java.util.List;

/**
 * Rescales the raw scores of one scheduling attempt into a comparable range. It is called once per attempt,
 * after every score for the attempt has been collected.
 */
public interface ScoreNormalizer {
    /**
     * Normalize the raw scores.
     *
     * @param pod    the pod being placed
     * @param scores exactly one raw score per feasible node
     * @return the normalized scores, with the same nodes in the same order
     * @throws PlacementException if {@code scores} is empty or names a node more than once
     */
    List<NodeScore> normalizeScores(Pod pod, List<NodeScore> scores) throws PlacementException;
}
