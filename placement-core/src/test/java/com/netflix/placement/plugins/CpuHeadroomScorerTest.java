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

import org.junit.Assert;
import org.junit.Test;

import static com.netflix.placement.NodeProvider.getNode;
import static com.netflix.placement.PodProvider.getPod;

public class CpuHeadroomScorerTest {

    private final CpuHeadroomScorer scorer = new CpuHeadroomScorer();

    @Test
    public void testPrefersMoreHeadroom() throws Exception {
        Assert.assertEquals(75L, scorer.score(getPod("web", "1"), getNode("n1", "4")));
        Assert.assertEquals(50L, scorer.score(getPod("web", "1"), getNode("n2", "4", getPod("db", "1"))));
        Assert.assertEquals(87L, scorer.score(getPod("web", "1"), getNode("n3", "8")));
    }

    @Test
    public void testClampsToRange() throws Exception {
        Assert.assertEquals(0L, scorer.score(getPod("web", "8"), getNode("n1", "4")));
        Assert.assertEquals(100L, scorer.score(getPod("web", "0"), getNode("n1", "4")));
        Assert.assertEquals(0L, scorer.score(getPod("web", "1"), getNode("n1", "0")));
    }

    @Test
    public void testAccountingMode() throws Exception {
        CpuHeadroomScorer all = new CpuHeadroomScorer(ContainerAccounting.AllContainers);
        Assert.assertEquals(50L, scorer.score(getPod("web", "1"), getNode("n1", "4", getPod("db", "1", "1"))));
        Assert.assertEquals(25L, all.score(getPod("web", "1"), getNode("n1", "4", getPod("db", "1", "1"))));
    }
}
