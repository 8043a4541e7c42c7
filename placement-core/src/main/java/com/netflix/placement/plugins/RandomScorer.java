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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * A scorer that gives every node a uniformly random score between {@link #MIN_SCORE} and {@link #MAX_SCORE}.
 * <p>
 * The random source is obtained from the given supplier on every call, so concurrent calls never share a
 * generator. The default supplier returns the calling thread's {@link ThreadLocalRandom}.
 */
public class RandomScorer implements ScorePlugin {
    public static final String NAME = "RandomScorer";

    private static final Logger logger = LoggerFactory.getLogger(RandomScorer.class);
    private final Supplier<? extends Random> randomSupplier;

    public RandomScorer() {
        this(ThreadLocalRandom::current);
    }

    /**
     * @param randomSupplier gives the random source for one call
     */
    public RandomScorer(Supplier<? extends Random> randomSupplier) {
        if (randomSupplier == null)
            throw new IllegalArgumentException("Random supplier must be non-null");
        this.randomSupplier = randomSupplier;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public long score(Pod pod, Node node) {
        final Random random = randomSupplier.get();
        final long score = MIN_SCORE + random.nextInt((int) (MAX_SCORE - MIN_SCORE) + 1);
        if (logger.isDebugEnabled())
            logger.debug("Scored node {} for pod {}: {}", node.getName(), pod.getName(), score);
        return score;
    }
}
