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

import com.netflix.placement.common.NamedThreadFactory;
import com.netflix.placement.plugins.MinMaxScoreNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Runs one scheduling attempt for a pod over a snapshot of nodes: every node is filtered, every feasible node
 * scored, and the scores normalized once all of them are in. Filter and score calls for different nodes run
 * concurrently on a worker pool; normalization waits for all of them.
 * <p>
 * The evaluator keeps no state between attempts and never modifies the pod or the nodes. It does not retry:
 * any {@link PlacementException} raised by a plugin ends the attempt and is passed on to the caller.
 * <p>
 * You create your {@code PlacementEvaluator} by means of the {@link PlacementEvaluator.Builder}. Call
 * {@link #shutdown()} when done to release the worker threads.
 */
public class PlacementEvaluator {

    private static final int PARALLEL_EVAL_MIN_BATCH_SIZE = 30;

    /**
     * The Builder is how you construct a {@link PlacementEvaluator}. Chain its methods and then call
     * {@link #build build()}.
     */
    public final static class Builder {
        private final List<FilterPlugin> filters = new ArrayList<>();
        private ScorePlugin scorer = null;
        private ScoreNormalizer normalizer = null;
        private int maxConcurrent = Runtime.getRuntime().availableProcessors();
        private int parallelEvalBatchSize = PARALLEL_EVAL_MIN_BATCH_SIZE;

        /**
         * Add a filter. Filters are applied in the order they are added; the first to reject a node decides the
         * reason reported for it.
         *
         * @param filter the filter to add
         * @return this same {@code Builder}
         */
        public Builder withFilter(FilterPlugin filter) {
            if (filter == null)
                throw new IllegalArgumentException("Filter must be non-null");
            filters.add(filter);
            return this;
        }

        /**
         * (Required) The scorer for feasible nodes.
         *
         * @param scorer the scorer
         * @return this same {@code Builder}
         */
        public Builder withScorer(ScorePlugin scorer) {
            this.scorer = scorer;
            return this;
        }

        /**
         * The normalizer applied to the scores of an attempt, a {@link MinMaxScoreNormalizer} by default.
         *
         * @param normalizer the normalizer
         * @return this same {@code Builder}
         */
        public Builder withScoreNormalizer(ScoreNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        /**
         * Use the given plugin for filtering, scoring and normalizing.
         *
         * @param plugin a plugin that filters, scores and normalizes
         * @param <P>    the plugin type
         * @return this same {@code Builder}
         */
        public <P extends FilterPlugin & ScorePlugin & ScoreNormalizer> Builder withPlugin(P plugin) {
            return withFilter(plugin)
                    .withScorer(plugin)
                    .withScoreNormalizer(plugin);
        }

        /**
         * Limit the number of threads evaluating nodes concurrently. The default is the number of available
         * processors.
         *
         * @param maxConcurrent maximum number of worker threads
         * @return this same {@code Builder}
         */
        public Builder withMaxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
            return this;
        }

        /**
         * Set how many nodes justify one more worker thread in an attempt. Fewer nodes than this are evaluated
         * by a single worker.
         *
         * @param parallelEvalBatchSize minimum number of nodes per worker
         * @return this same {@code Builder}
         */
        public Builder withParallelEvalBatchSize(int parallelEvalBatchSize) {
            this.parallelEvalBatchSize = parallelEvalBatchSize;
            return this;
        }

        public PlacementEvaluator build() {
            if (scorer == null)
                throw new IllegalArgumentException("Scorer must be non-null");
            if (maxConcurrent < 1)
                throw new IllegalArgumentException("Max concurrent must be at least 1: " + maxConcurrent);
            if (parallelEvalBatchSize < 1)
                throw new IllegalArgumentException("Parallel eval batch size must be at least 1: " + parallelEvalBatchSize);
            if (normalizer == null)
                normalizer = new MinMaxScoreNormalizer(ScorePlugin.MAX_SCORE);
            return new PlacementEvaluator(this);
        }
    }

    private interface NodeEvaluation<T> {
        T evaluate(Node node) throws PlacementException;
    }

    private static final Logger logger = LoggerFactory.getLogger(PlacementEvaluator.class);
    private final List<FilterPlugin> filters;
    private final ScorePlugin scorer;
    private final ScoreNormalizer normalizer;
    private final int maxConcurrent;
    private final int parallelEvalBatchSize;
    private final ExecutorService executorService;
    private final AtomicBoolean isShutdown = new AtomicBoolean();

    private PlacementEvaluator(Builder builder) {
        this.filters = new ArrayList<>(builder.filters);
        this.scorer = builder.scorer;
        this.normalizer = builder.normalizer;
        this.maxConcurrent = builder.maxConcurrent;
        this.parallelEvalBatchSize = builder.parallelEvalBatchSize;
        this.executorService = Executors.newFixedThreadPool(maxConcurrent,
                new NamedThreadFactory("placement-worker-%d", true));
    }

    void checkIfShutdown() throws IllegalStateException {
        if (isShutdown.get())
            throw new IllegalStateException("PlacementEvaluator already shutdown");
    }

    /**
     * Evaluate the nodes for the pod.
     *
     * @param pod     the pod to place
     * @param nodes   the candidate nodes, each a snapshot with its bound pods
     * @param context the attempt, through which the caller may cancel it
     * @return the feasibility failures, raw and normalized scores, and the selected node
     * @throws PlacementCancelledException if the attempt was cancelled before it completed
     * @throws PlacementException if a plugin reports malformed input or fails
     * @throws IllegalStateException if this evaluator was shut down
     */
    public PlacementResult evaluate(Pod pod, List<Node> nodes, SchedulingContext context) throws PlacementException {
        checkIfShutdown();
        final long start = System.currentTimeMillis();
        checkIfCancelled(context);

        final List<Status> statuses = evaluateNodes(nodes, context, node -> filterNode(pod, node));
        final Map<String, String> failures = new LinkedHashMap<>();
        final List<Node> feasible = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            final Status status = statuses.get(i);
            if (status.isSuccess())
                feasible.add(nodes.get(i));
            else
                failures.put(nodes.get(i).getName(), status.getReason());
        }
        if (logger.isDebugEnabled())
            logger.debug("Attempt {}: {} of {} nodes feasible for pod {}", context.getAttemptId(), feasible.size(),
                    nodes.size(), pod.getName());
        if (feasible.isEmpty()) {
            return new PlacementResult(pod, failures, new ArrayList<>(), new ArrayList<>(), null,
                    System.currentTimeMillis() - start);
        }

        final List<Long> scores = evaluateNodes(feasible, context, node -> ScorePlugin.scoreInRange(scorer, pod, node));
        final List<NodeScore> rawScores = new ArrayList<>(feasible.size());
        for (int i = 0; i < feasible.size(); i++)
            rawScores.add(new NodeScore(feasible.get(i).getName(), scores.get(i)));

        final List<NodeScore> normalized = normalizer.normalizeScores(pod, rawScores);
        final String selected = selectNode(normalized);
        if (logger.isDebugEnabled())
            logger.debug("Attempt {}: selected node {} for pod {}", context.getAttemptId(), selected, pod.getName());
        return new PlacementResult(pod, failures, rawScores, normalized, selected, System.currentTimeMillis() - start);
    }

    private Status filterNode(Pod pod, Node node) throws PlacementException {
        for (FilterPlugin filter : filters) {
            final Status status = filter.filter(pod, node);
            if (!status.isSuccess())
                return status;
        }
        return Status.success();
    }

    private static String selectNode(List<NodeScore> normalized) {
        NodeScore best = null;
        for (NodeScore nodeScore : normalized) {
            if (best == null || nodeScore.getScore() > best.getScore())
                best = nodeScore;
        }
        return best == null ? null : best.getName();
    }

    // Nodes are drained from a shared queue by as many workers as the batch size calls for. Each worker checks
    // for cancellation before taking the next node, and stops once any worker has failed.
    private <T> List<T> evaluateNodes(List<Node> nodes, SchedulingContext context, NodeEvaluation<T> evaluation)
            throws PlacementException {
        final int size = nodes.size();
        final List<Integer> indices = new ArrayList<>(size);
        for (int i = 0; i < size; i++)
            indices.add(i);
        final BlockingQueue<Integer> pending = new ArrayBlockingQueue<>(Math.max(1, size), false, indices);
        final AtomicReferenceArray<T> results = new AtomicReferenceArray<>(size);
        final AtomicBoolean failed = new AtomicBoolean();
        final int nThreads = (int) Math.min(maxConcurrent, Math.ceil((double) size / parallelEvalBatchSize));
        final List<Future<Void>> futures = new ArrayList<>();
        for (int b = 0; b < nThreads; b++) {
            futures.add(executorService.submit(new Callable<Void>() {
                @Override
                public Void call() throws Exception {
                    Integer index;
                    while (!context.isCancelled() && !failed.get() && (index = pending.poll()) != null) {
                        try {
                            results.set(index, evaluation.evaluate(nodes.get(index)));
                        } catch (Exception e) {
                            failed.set(true);
                            throw e;
                        }
                    }
                    return null;
                }
            }));
        }
        PlacementException failure = null;
        for (Future<Void> f : futures) {
            try {
                f.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                context.cancel();
                if (failure == null)
                    failure = new PlacementCancelledException("Interrupted while evaluating attempt " + context.getAttemptId());
            } catch (ExecutionException e) {
                if (failure == null)
                    failure = asPlacementException(e.getCause());
                else
                    logger.warn("Additional failure in attempt {}: {}", context.getAttemptId(), e.getCause().getMessage());
            }
        }
        if (failure != null)
            throw failure;
        checkIfCancelled(context);
        final List<T> ordered = new ArrayList<>(size);
        for (int i = 0; i < size; i++)
            ordered.add(results.get(i));
        return ordered;
    }

    private static PlacementException asPlacementException(Throwable cause) {
        if (cause instanceof PlacementException)
            return (PlacementException) cause;
        logger.error("Unexpected error during node evaluation - " + cause.getMessage(), cause);
        return new PlacementException("Node evaluation failed: " + cause.getMessage(), cause);
    }

    private static void checkIfCancelled(SchedulingContext context) throws PlacementCancelledException {
        if (context.isCancelled())
            throw new PlacementCancelledException("Attempt " + context.getAttemptId() + " was cancelled");
    }

    /**
     * Mark the evaluator as shutdown and shut down its worker threads.
     */
    public void shutdown() {
        if (isShutdown.compareAndSet(false, true)) {
            executorService.shutdown();
        }
    }
}
