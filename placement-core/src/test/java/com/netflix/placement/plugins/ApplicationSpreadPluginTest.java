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
import com.netflix.placement.NodeScore;
import com.netflix.placement.PlacementException;
import com.netflix.placement.Pod;
import com.netflix.placement.ScoreNormalizer;
import com.netflix.placement.ScorePlugin;
import com.netflix.placement.Status;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static com.netflix.placement.NodeProvider.getNode;
import static com.netflix.placement.PodProvider.getPod;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ApplicationSpreadPluginTest {

    private final ApplicationSpreadPlugin plugin = new ApplicationSpreadPlugin.Builder().build();

    @Test
    public void testName() {
        Assert.assertEquals("ApplicationSpread", plugin.getName());
    }

    // Enough CPU, but the node already runs the application.
    @Test
    public void testColocatedApplicationRejected() throws Exception {
        Node node = getNode("n1", "4", getPod("web", "1"));
        Status status = plugin.filter(getPod("web", "2"), node);
        Assert.assertFalse(status.isSuccess());
        Assert.assertEquals("application already present on node", status.getReason());
    }

    @Test
    public void testOtherApplicationAdmitted() throws Exception {
        Node node = getNode("n1", "4", getPod("web", "1"));
        Assert.assertTrue(plugin.filter(getPod("db", "2"), node).isSuccess());
    }

    @Test
    public void testInsufficientResourcesRejected() throws Exception {
        Node node = getNode("n1", "2", getPod("web", "1"));
        Status status = plugin.filter(getPod("db", "2"), node);
        Assert.assertFalse(status.isSuccess());
        Assert.assertEquals("insufficient resources", status.getReason());
    }

    // Resources are checked before co-location, so a crowded node reports the resource shortfall.
    @Test
    public void testResourcesCheckedFirst() throws Exception {
        Node node = getNode("n1", "2", getPod("web", "1"));
        Assert.assertEquals(NodeResourcesFit.INSUFFICIENT_RESOURCES, plugin.filter(getPod("web", "2"), node).getReason());
    }

    @Test
    public void testAllContainersAccounting() throws Exception {
        Node node = getNode("n1", "4", getPod("web", "1", "1"));
        Pod pod = getPod("db", "2");
        Assert.assertTrue(plugin.filter(pod, node).isSuccess());
        ApplicationSpreadPlugin strict = new ApplicationSpreadPlugin.Builder()
                .withContainerAccounting(ContainerAccounting.AllContainers)
                .build();
        Assert.assertFalse(strict.filter(pod, node).isSuccess());
    }

    @Test
    public void testDefaultScoreInRange() throws Exception {
        Node node = getNode("n1", "4");
        Pod pod = getPod("db", "1");
        for (int i = 0; i < 500; i++)
            assertThat(plugin.score(pod, node), allOf(greaterThanOrEqualTo(0L), lessThanOrEqualTo(100L)));
    }

    @Test
    public void testSeededScorer() throws Exception {
        ApplicationSpreadPlugin seeded = new ApplicationSpreadPlugin.Builder()
                .withScorer(new RandomScorer(() -> new Random(11L)))
                .build();
        Assert.assertEquals(new Random(11L).nextInt(101), seeded.score(getPod("db", "1"), getNode("n1", "4")));
    }

    @Test(expected = PlacementException.class)
    public void testScoreOutOfRange() throws Exception {
        ScorePlugin scorer = mock(ScorePlugin.class);
        when(scorer.score(any(), any())).thenReturn(101L);
        new ApplicationSpreadPlugin.Builder().withScorer(scorer).build()
                .score(getPod("db", "1"), getNode("n1", "4"));
    }

    @Test
    public void testNormalizesScores() throws Exception {
        List<NodeScore> normalized = plugin.normalizeScores(getPod("db", "1"),
                Arrays.asList(new NodeScore("A", 10), new NodeScore("B", 90), new NodeScore("C", 50)));
        Assert.assertEquals(Arrays.asList(new NodeScore("A", 0), new NodeScore("B", 100), new NodeScore("C", 50)), normalized);
    }

    @Test
    public void testCustomNormalizer() throws Exception {
        ScoreNormalizer normalizer = mock(ScoreNormalizer.class);
        Pod pod = getPod("db", "1");
        List<NodeScore> scores = Arrays.asList(new NodeScore("A", 1));
        new ApplicationSpreadPlugin.Builder().withScoreNormalizer(normalizer).build().normalizeScores(pod, scores);
        verify(normalizer).normalizeScores(pod, scores);
    }
}
