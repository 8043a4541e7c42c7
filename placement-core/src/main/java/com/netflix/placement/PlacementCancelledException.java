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

/**
 * Thrown when a scheduling attempt was cancelled through its {@link SchedulingContext} before all per-node
 * evaluations completed. No partial result is produced.
 */
public class PlacementCancelledException extends PlacementException {

    public PlacementCancelledException(String message) {
        super(message);
    }
}
