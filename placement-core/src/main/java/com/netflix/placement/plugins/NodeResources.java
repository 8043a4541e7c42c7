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

import com.netflix.placement.Container;
import com.netflix.placement.Node;
import com.netflix.placement.PlacementException;
import com.netflix.placement.Pod;
import com.netflix.placement.ResourceKind;

import java.util.List;
import java.util.OptionalLong;

/**
 * Resource accounting of a node: what it has, what the pods bound to it consume, and what is left. All
 * amounts are in milli-units. Available memory is computed for completeness; admission only looks at CPU.
 * <p>
 * Amounts, and their sums, must fit in a {@code long} once expressed in milli-units. For memory that caps a
 * single quantity or a node's total at about 8 PiB ({@code 2^63 - 1} milli-bytes); anything larger is reported
 * as malformed input, even though memory does not gate admission.
 */
public class NodeResources {
    private final String nodeName;
    private final long cpuCapacity;
    private final long cpuConsumed;
    private final OptionalLong memoryCapacity;
    private final long memoryConsumed;

    private NodeResources(String nodeName, long cpuCapacity, long cpuConsumed, OptionalLong memoryCapacity,
                          long memoryConsumed) {
        this.nodeName = nodeName;
        this.cpuCapacity = cpuCapacity;
        this.cpuConsumed = cpuConsumed;
        this.memoryCapacity = memoryCapacity;
        this.memoryConsumed = memoryConsumed;
    }

    /**
     * Account for the resources of a node. Every call starts from zero consumption.
     *
     * @param node       the node snapshot
     * @param accounting which containers of a bound pod count towards consumption
     * @return the accounting of the node
     * @throws PlacementException if the node has no CPU capacity, a bound pod has no containers, a quantity
     *         is malformed, or the consumed amounts overflow
     */
    public static NodeResources of(Node node, ContainerAccounting accounting) throws PlacementException {
        final long cpuCapacity = node.getCapacityMillis(ResourceKind.CPU);
        final OptionalLong memoryCapacity = node.hasCapacity(ResourceKind.Memory) ?
                OptionalLong.of(node.getCapacityMillis(ResourceKind.Memory)) :
                OptionalLong.empty();
        long cpuConsumed = 0L;
        long memoryConsumed = 0L;
        for (Pod bound : node.getPods()) {
            final List<Container> containers = accountedContainers(bound, accounting);
            for (Container container : containers) {
                cpuConsumed = add(cpuConsumed, container.getRequestMillis(ResourceKind.CPU),
                        "cpu consumed on node " + node.getName());
                memoryConsumed = add(memoryConsumed, container.getRequestMillis(ResourceKind.Memory),
                        "memory consumed on node " + node.getName());
            }
        }
        return new NodeResources(node.getName(), cpuCapacity, cpuConsumed, memoryCapacity, memoryConsumed);
    }

    /**
     * Sum a resource over every container of a pod.
     *
     * @param pod  the pod
     * @param kind the resource kind
     * @return the total request in milli-units
     * @throws PlacementException if the pod has no containers, a quantity is malformed, or the total overflows
     */
    public static long requestedMillis(Pod pod, ResourceKind kind) throws PlacementException {
        long total = 0L;
        for (Container container : containersOf(pod)) {
            total = add(total, container.getRequestMillis(kind),
                    kind.getKey() + " requested by pod " + pod.getNamespace() + "/" + pod.getName());
        }
        return total;
    }

    private static long add(long total, long amount, String what) throws PlacementException {
        try {
            return Math.addExact(total, amount);
        } catch (ArithmeticException e) {
            throw new PlacementException("Total " + what + " is too large", e);
        }
    }

    private static List<Container> accountedContainers(Pod pod, ContainerAccounting accounting) throws PlacementException {
        final List<Container> containers = containersOf(pod);
        return accounting == ContainerAccounting.FirstContainer ? containers.subList(0, 1) : containers;
    }

    private static List<Container> containersOf(Pod pod) throws PlacementException {
        if (pod.getContainers().isEmpty())
            throw new PlacementException("Pod " + pod.getNamespace() + "/" + pod.getName() + " has no containers");
        return pod.getContainers();
    }

    public String getNodeName() {
        return nodeName;
    }

    public long getCpuCapacity() {
        return cpuCapacity;
    }

    public long getCpuConsumed() {
        return cpuConsumed;
    }

    public long getAvailableCpu() {
        return cpuCapacity - cpuConsumed;
    }

    /**
     * @return the memory capacity, or empty if the node does not declare one
     */
    public OptionalLong getMemoryCapacity() {
        return memoryCapacity;
    }

    public long getMemoryConsumed() {
        return memoryConsumed;
    }

    /**
     * @return the memory left on the node, or empty if the node does not declare a memory capacity
     */
    public OptionalLong getAvailableMemory() {
        return memoryCapacity.isPresent() ?
                OptionalLong.of(memoryCapacity.getAsLong() - memoryConsumed) :
                OptionalLong.empty();
    }

    @Override
    public String toString() {
        return "NodeResources{" +
                "node='" + nodeName + '\'' +
                ", cpuCapacity=" + cpuCapacity +
                ", cpuConsumed=" + cpuConsumed +
                ", memoryCapacity=" + memoryCapacity +
                ", memoryConsumed=" + memoryConsumed +
                '}';
    }
}
