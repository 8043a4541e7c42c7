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

import com.netflix.placement.FilterPlugin;
import com.netflix.placement.Node;
import com.netflix.placement.PlacementException;
import com.netflix.placement.Pod;
import com.netflix.placement.ResourceKind;
import com.netflix.placement.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A filter that admits a pod only on nodes whose available CPU strictly exceeds the CPU the pod requests across
 * all of its containers. Available CPU is the node capacity minus what the pods bound to it consume, summed
 * according to the configured {@link ContainerAccounting}.
 */
public class NodeResourcesFit implements FilterPlugin {
    public static final String NAME = "NodeResourcesFit";
    public static final String INSUFFICIENT_RESOURCES = "insufficient resources";

    private static final Logger logger = LoggerFactory.getLogger(NodeResourcesFit.class);
    private final ContainerAccounting accounting;

    public NodeResourcesFit() {
        this(ContainerAccounting.FirstContainer);
    }

    public NodeResourcesFit(ContainerAccounting accounting) {
        if (accounting == null)
            throw new IllegalArgumentException("Container accounting must be non-null");
        this.accounting = accounting;
    }

    @Override
    public String getName() {
        return NAME;
    }

    public ContainerAccounting getAccounting() {
        return accounting;
    }

    @Override
    public Status filter(Pod pod, Node node) throws PlacementException {
        final long podCpu = NodeResources.requestedMillis(pod, ResourceKind.CPU);
        final NodeResources resources = NodeResources.of(node, accounting);
        if (resources.getAvailableCpu() > podCpu)
            return Status.success();
        if (logger.isDebugEnabled())
            logger.debug("Pod {}/{} asks {}m cpu, node {} has {}m available", pod.getNamespace(), pod.getName(),
                    podCpu, node.getName(), resources.getAvailableCpu());
        return Status.unschedulable(INSUFFICIENT_RESOURCES);
    }
}
