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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of one scheduling attempt shared between the orchestrator and the {@link PlacementEvaluator}. The
 * orchestrator may {@link #cancel()} the attempt at any time; the evaluator checks between per-node calls and
 * abandons the attempt without a result.
 */
public class SchedulingContext {
    private final String attemptId;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public SchedulingContext(String attemptId) {
        this.attemptId = attemptId;
    }

    public String getAttemptId() {
        return attemptId;
    }

    /**
     * Cancel the attempt.
     *
     * @return {@code true} if this call cancelled the attempt, {@code false} if it was already cancelled
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public String toString() {
        return "SchedulingContext{" +
                "attemptId='" + attemptId + '\'' +
                ", cancelled=" + cancelled.get() +
                '}';
    }
}
