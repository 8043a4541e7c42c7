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
import com.netflix.placement.ResourceKind;
import com.netflix.placement.ScorePlugin;

/**
 * A CPU spreading scorer. It prefers the node that has the most CPU left, relative to its capacity, once the
 * pod is placed on it: the score is {@code 100 * (available - requested) / capacity}, truncated and clamped to
 * the score range.
 */
public class CpuHeadroomScorer implements ScorePlugin {
    public static final String NAME = "CpuHeadroomScorer";

    private final ContainerAccounting accounting;

    public CpuHeadroomScorer() {
        this(ContainerAccounting.FirstContainer);
    }

    public CpuHeadroomScorer(ContainerAccounting accounting) {
        if (accounting == null)
            throw new IllegalArgumentException("Container accounting must be non-null");
        this.accounting = accounting;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public long score(Pod pod, Node node) throws PlacementException {
        final NodeResources resources = NodeResources.of(node, accounting);
        if (resources.getCpuCapacity() == 0L)
            return MIN_SCORE;
        final long requested = NodeResources.requestedMillis(pod, ResourceKind.CPU);
        final long headroom;
        try {
            headroom = Math.subtractExact(resources.getAvailableCpu(), requested);
        } catch (ArithmeticException e) {
            throw new PlacementException("CPU headroom of node " + node.getName() + " for pod " + pod.getName() +
                    " is out of range", e);
        }
        final long score = (long) Math.floor((double) MAX_SCORE * headroom / resources.getCpuCapacity());
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }
}
