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
 * Raised when a placement decision cannot be made because the inputs are malformed or a policy failed while
 * evaluating them. An infeasible node is not an error and is reported through {@link Status} instead.
 */
public class PlacementException extends Exception {

    public PlacementException(String message) {
        super(message);
    }

    public PlacementException(String message, Throwable throwable) {
        super(message, throwable);
    }
}
