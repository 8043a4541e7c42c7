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

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The result of one scheduling attempt, as returned by
 * {@link PlacementEvaluator#evaluate(Pod, List, SchedulingContext) evaluate()}.
 * <p>
 * Use the {@link #getSelectedNode() selected node} to bind the pod, or the {@link #getFailures() failures} to
 * find out why no node could take it.
 */
public class PlacementResult {
    private final Pod pod;
    private final Map<String, String> failures;
    private final List<NodeScore> rawScores;
    private final List<NodeScore> normalizedScores;
    private final String selectedNode;
    private final long runtime;

    PlacementResult(Pod pod, Map<String, String> failures, List<NodeScore> rawScores,
                    List<NodeScore> normalizedScores, String selectedNode, long runtime) {
        this.pod = pod;
        this.failures = Collections.unmodifiableMap(failures);
        this.rawScores = Collections.unmodifiableList(rawScores);
        this.normalizedScores = Collections.unmodifiableList(normalizedScores);
        this.selectedNode = selectedNode;
        this.runtime = runtime;
    }

    public Pod getPod() {
        return pod;
    }

    /**
     * Get the nodes that did not admit the pod. The map keys are node names in evaluation order, the values the
     * reasons given by the first filter that rejected the node.
     *
     * @return the rejected nodes and why
     */
    public Map<String, String> getFailures() {
        return failures;
    }

    /**
     * @return the raw score of every feasible node, in input order
     */
    public List<NodeScore> getRawScores() {
        return rawScores;
    }

    /**
     * @return the normalized score of every feasible node, in input order
     */
    public List<NodeScore> getNormalizedScores() {
        return normalizedScores;
    }

    /**
     * Get the node with the highest normalized score. On ties the node that came first in the input wins.
     *
     * @return the selected node name, or {@code null} if no node admits the pod
     */
    public String getSelectedNode() {
        return selectedNode;
    }

    public boolean isPlaced() {
        return selectedNode != null;
    }

    /**
     * @return the time taken by the attempt, in milliseconds
     */
    public long getRuntime() {
        return runtime;
    }

    @Override
    public String toString() {
        return "PlacementResult{" +
                "pod=" + pod.getNamespace() + "/" + pod.getName() +
                ", selectedNode=" + selectedNode +
                ", normalizedScores=" + normalizedScores +
                ", failures=" + failures +
                ", runtime=" + runtime +
                '}';
    }
}
