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
 * A filter decides whether a node is a feasible target for a pod. Filters are pure: they do not modify the pod
 * or the node, and may be called concurrently for different nodes.
 */
public interface FilterPlugin extends Plugin {
    /**
     * Decide whether the node can take the pod.
     *
     * @param pod  the pod to be placed
     * @param node a snapshot of the candidate node and the pods already bound to it
     * @return {@link Status#success()} if the node admits the pod, or an unschedulable status with the reason
     * @throws PlacementException if the pod or node is malformed, for example a pod without containers or an
     *         unparseable resource quantity
     */
    Status filter(Pod pod, Node node) throws PlacementException;
}
