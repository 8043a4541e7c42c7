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
import com.netflix.placement.Pod;
import org.junit.Assert;
import org.junit.Test;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import java.util.function.Supplier;

import static com.netflix.placement.NodeProvider.getNode;
import static com.netflix.placement.PodProvider.getPod;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class RandomScorerTest {

    private final Pod pod = getPod("web", "1");
    private final Node node = getNode("n1", "4");

    @Test
    public void testCoversWholeRange() {
        RandomScorer scorer = new RandomScorer();
        Set<Long> seen = new HashSet<>();
        for (int i = 0; i < 20000; i++) {
            long score = scorer.score(pod, node);
            Assert.assertTrue("score " + score, score >= 0L && score <= 100L);
            seen.add(score);
        }
        Assert.assertEquals(101, seen.size());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testRandomSourceObtainedPerCall() {
        Supplier<Random> supplier = mock(Supplier.class);
        when(supplier.get()).thenAnswer(invocation -> new Random(3L));
        RandomScorer scorer = new RandomScorer(supplier);
        long first = scorer.score(pod, node);
        long second = scorer.score(pod, getNode("n2", "8"));
        long third = scorer.score(pod, getNode("n3", "8"));
        verify(supplier, times(3)).get();
        Assert.assertEquals(new Random(3L).nextInt(101), first);
        Assert.assertEquals(first, second);
        Assert.assertEquals(first, third);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullSupplier() {
        new RandomScorer(null);
    }
}
