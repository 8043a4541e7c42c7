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
 * The resource kinds the placement policies account for. The {@link #getKey() key} is the name used in
 * capacity and request maps.
 */
public enum ResourceKind {
    CPU("cpu"),
    Memory("memory");

    private final String key;

    ResourceKind(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
