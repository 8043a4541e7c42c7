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
import com.netflix.placement.NodeScore;
import com.netflix.placement.PlacementException;
import com.netflix.placement.Pod;
import com.netflix.placement.ScoreNormalizer;
import com.netflix.placement.ScorePlugin;
import com.netflix.placement.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The placement policy that spreads applications across nodes. It admits a pod on a node only if the node has
 * enough CPU left for it ({@link NodeResourcesFit}) and does not already run an instance of the same application
 * ({@link ApplicationColocationConstraint}), checked in that order. Feasible nodes are scored by the configured
 * {@link ScorePlugin} and the scores of an attempt rescaled by the configured {@link ScoreNormalizer}.
 * <p>
 * You create an {@code ApplicationSpreadPlugin} by means of its {@link Builder}. By default it scores randomly,
 * counts only the first container of bound pods, and normalizes into {@code [0, 100]}.
 */
public class ApplicationSpreadPlugin implements FilterPlugin, ScorePlugin, ScoreNormalizer {
    public static final String NAME = "ApplicationSpread";

    public final static class Builder {
        private ContainerAccounting accounting = ContainerAccounting.FirstContainer;
        private String applicationLabel = Pod.APPLICATION_NAME_LABEL;
        private ScorePlugin scorer = null;
        private ScoreNormalizer normalizer = null;

        /**
         * Choose which containers of bound pods count towards a node's consumed resources.
         *
         * @param accounting the accounting mode, {@link ContainerAccounting#FirstContainer} by default
         * @return this same {@code Builder}
         */
        public Builder withContainerAccounting(ContainerAccounting accounting) {
            this.accounting = accounting;
            return this;
        }

        /**
         * @param applicationLabel the pod label identifying an application, {@value Pod#APPLICATION_NAME_LABEL}
         *                         by default
         * @return this same {@code Builder}
         */
        public Builder withApplicationLabel(String applicationLabel) {
            this.applicationLabel = applicationLabel;
            return this;
        }

        /**
         * Use the given scorer for feasible nodes instead of random scores.
         *
         * @param scorer the scorer
         * @return this same {@code Builder}
         */
        public Builder withScorer(ScorePlugin scorer) {
            this.scorer = scorer;
            return this;
        }

        public Builder withScoreNormalizer(ScoreNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public ApplicationSpreadPlugin build() {
            if (accounting == null)
                throw new IllegalArgumentException("Container accounting must be non-null");
            if (scorer == null)
                scorer = new RandomScorer();
            if (normalizer == null)
                normalizer = new MinMaxScoreNormalizer(ScorePlugin.MAX_SCORE);
            return new ApplicationSpreadPlugin(this);
        }
    }

    private static final Logger logger = LoggerFactory.getLogger(ApplicationSpreadPlugin.class);
    private final NodeResourcesFit resourcesFit;
    private final ApplicationColocationConstraint colocationConstraint;
    private final ScorePlugin scorer;
    private final ScoreNormalizer normalizer;

    private ApplicationSpreadPlugin(Builder builder) {
        this.resourcesFit = new NodeResourcesFit(builder.accounting);
        this.colocationConstraint = new ApplicationColocationConstraint(builder.applicationLabel);
        this.scorer = builder.scorer;
        this.normalizer = builder.normalizer;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Status filter(Pod pod, Node node) throws PlacementException {
        if (logger.isDebugEnabled())
            logger.debug("Filtering node {} for pod {}/{}, application {}", node.getName(), pod.getNamespace(),
                    pod.getName(), pod.getApplicationName());
        final Status status = resourcesFit.filter(pod, node);
        if (!status.isSuccess())
            return status;
        return colocationConstraint.filter(pod, node);
    }

    @Override
    public long score(Pod pod, Node node) throws PlacementException {
        return ScorePlugin.scoreInRange(scorer, pod, node);
    }

    @Override
    public List<NodeScore> normalizeScores(Pod pod, List<NodeScore> scores) throws PlacementException {
        return normalizer.normalizeScores(pod, scores);
    }
}
