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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A container of a {@link Pod} and the resources it requests. Requests are kept in quantity notation, keyed by
 * {@link ResourceKind#getKey()}, and parsed when read.
 */
@JsonIgnoreProperties(ignoreUnknown=true)
public class Container {
    private final String name;
    private final Map<String, String> requests;

    @JsonCreator
    public Container(@JsonProperty("name") String name,
                     @JsonProperty("requests") Map<String, String> requests) {
        this.name = name;
        this.requests = requests == null ?
                Collections.<String, String>emptyMap() :
                Collections.unmodifiableMap(new HashMap<>(requests));
    }

    public String getName() {
        return name;
    }

    public Map<String, String> getRequests() {
        return requests;
    }

    /**
     * Get the requested amount of the given resource. A resource the container does not request counts as zero.
     *
     * @param kind the resource kind
     * @return the requested amount in milli-units
     * @throws ResourceQuantityException if the request is not a valid quantity
     */
    public long getRequestMillis(ResourceKind kind) throws ResourceQuantityException {
        final String quantity = requests.get(kind.getKey());
        return quantity == null ? 0L : ResourceQuantity.parseMillis(quantity);
    }

    @Override
    public String toString() {
        return "Container{" +
                "name='" + name + '\'' +
                ", requests=" + requests +
                '}';
    }
}
