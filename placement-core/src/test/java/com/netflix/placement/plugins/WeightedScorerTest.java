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
import com.netflix.placement.ScorePlugin;
import com.netflix.placement.plugins.WeightedScorer.Weighted;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class WeightedScorerTest {

    @Test(expected = IllegalArgumentException.class)
    public void testWeightsMustEqualOne() throws Exception {
        ScorePlugin scorer = mock(ScorePlugin.class);
        List<Weighted> weighted = Arrays.asList(
                new Weighted(scorer, 0.3),
                new Weighted(scorer, 0.75)
        );
        new WeightedScorer(weighted);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testAtLeastOneScorer() throws Exception {
        new WeightedScorer(Collections.<Weighted>emptyList());
    }

    @Test
    public void testWeightedAverage() throws Exception {
        ScorePlugin scorer1 = mock(ScorePlugin.class);
        when(scorer1.score(any(), any())).thenReturn(50L);

        ScorePlugin scorer2 = mock(ScorePlugin.class);
        when(scorer2.score(any(), any())).thenReturn(100L);

        WeightedScorer scorer = new WeightedScorer(Arrays.asList(
                new Weighted(scorer1, 0.5),
                new Weighted(scorer2, 0.5)
        ));
        Assert.assertEquals(75L, scorer.score(mock(Pod.class), mock(Node.class)));
    }

    @Test
    public void testRoundsToNearest() throws Exception {
        ScorePlugin scorer1 = mock(ScorePlugin.class);
        when(scorer1.score(any(), any())).thenReturn(0L);

        ScorePlugin scorer2 = mock(ScorePlugin.class);
        when(scorer2.score(any(), any())).thenReturn(99L);

        WeightedScorer scorer = new WeightedScorer(Arrays.asList(
                new Weighted(scorer1, 0.3),
                new Weighted(scorer2, 0.7)
        ));
        // 0.7 * 99 = 69.3
        Assert.assertEquals(69L, scorer.score(mock(Pod.class), mock(Node.class)));
    }
}
