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
import com.netflix.placement.ResourceKind;
import com.netflix.placement.ResourceQuantityException;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

import static com.netflix.placement.NodeProvider.getNode;
import static com.netflix.placement.PodProvider.getContainer;
import static com.netflix.placement.PodProvider.getPod;

public class NodeResourcesTest {

    @Test
    public void testAccountsCpuAndMemory() throws Exception {
        Node node = getNode("n1", "4", "8Gi",
                getPod("web", Arrays.asList(getContainer("1", "1Gi"), getContainer("500m", "512Mi"))),
                getPod("db", Arrays.asList(getContainer("250m", "2Gi"))));
        NodeResources first = NodeResources.of(node, ContainerAccounting.FirstContainer);
        Assert.assertEquals(4000L, first.getCpuCapacity());
        Assert.assertEquals(1250L, first.getCpuConsumed());
        Assert.assertEquals(2750L, first.getAvailableCpu());
        Assert.assertEquals(5L * 1024 * 1024 * 1024 * 1000, first.getAvailableMemory().getAsLong());

        NodeResources all = NodeResources.of(node, ContainerAccounting.AllContainers);
        Assert.assertEquals(1750L, all.getCpuConsumed());
        Assert.assertEquals(2250L, all.getAvailableCpu());
        Assert.assertEquals(3584L * 1024 * 1024 * 1000, all.getMemoryConsumed());
    }

    @Test
    public void testMemoryUnknownWithoutCapacity() throws Exception {
        Node node = getNode("n1", "4", getPod("web", Arrays.asList(getContainer("1", "1Gi"))));
        NodeResources resources = NodeResources.of(node, ContainerAccounting.FirstContainer);
        Assert.assertFalse(resources.getMemoryCapacity().isPresent());
        Assert.assertFalse(resources.getAvailableMemory().isPresent());
        Assert.assertEquals(1024L * 1024 * 1024 * 1000, resources.getMemoryConsumed());
    }

    @Test
    public void testRequestedSumsEveryContainer() throws Exception {
        Assert.assertEquals(3500L, NodeResources.requestedMillis(getPod("web", "1", "2", "500m"), ResourceKind.CPU));
    }

    @Test
    public void testRequestOverflowNamesPod() throws Exception {
        try {
            NodeResources.requestedMillis(getPod("web", "5e15", "5e15"), ResourceKind.CPU);
            Assert.fail("Expected overflowing request to fail");
        } catch (PlacementException e) {
            Assert.assertTrue(e.getMessage(), e.getMessage().contains("cpu requested by pod"));
            Assert.assertTrue(e.getCause() instanceof ArithmeticException);
        }
    }

    @Test
    public void testConsumedOverflowNamesNode() throws Exception {
        Node node = getNode("n1", "4", getPod("web", "5e15"), getPod("db", "5e15"));
        try {
            NodeResources.of(node, ContainerAccounting.FirstContainer);
            Assert.fail("Expected overflowing consumption to fail");
        } catch (PlacementException e) {
            Assert.assertTrue(e.getMessage(), e.getMessage().contains("cpu consumed on node n1"));
        }
    }

    @Test
    public void testMemoryLargestAccountedQuantity() throws Exception {
        Node node = getNode("n1", "4", "8Pi", getPod("web", Arrays.asList(getContainer("1", "8Pi"))));
        NodeResources resources = NodeResources.of(node, ContainerAccounting.FirstContainer);
        Assert.assertEquals(0L, resources.getAvailableMemory().getAsLong());
    }

    @Test(expected = ResourceQuantityException.class)
    public void testMemoryBeyondMilliRangeIsMalformed() throws Exception {
        NodeResources.of(getNode("n1", "4", "9Pi"), ContainerAccounting.FirstContainer);
    }
}
