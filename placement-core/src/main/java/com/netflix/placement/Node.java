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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of a cluster node for the duration of one scheduling attempt: its resource capacity and the pods
 * already bound to it. The pod being placed is never among the bound pods.
 */
@JsonIgnoreProperties(ignoreUnknown=true)
public class Node {
    private final String name;
    private final Map<String, String> capacity;
    private final List<Pod> pods;

    @JsonCreator
    public Node(@JsonProperty("name") String name,
                @JsonProperty("capacity") Map<String, String> capacity,
                @JsonProperty("pods") List<Pod> pods) {
        this.name = name;
        this.capacity = capacity == null ?
                Collections.<String, String>emptyMap() :
                Collections.unmodifiableMap(new HashMap<>(capacity));
        this.pods = pods == null ?
                Collections.<Pod>emptyList() :
                Collections.unmodifiableList(new ArrayList<>(pods));
    }

    public String getName() {
        return name;
    }

    public Map<String, String> getCapacity() {
        return capacity;
    }

    /**
     * Get the pods currently bound to this node.
     *
     * @return an unmodifiable list of bound pods
     */
    public List<Pod> getPods() {
        return pods;
    }

    public boolean hasCapacity(ResourceKind kind) {
        return capacity.containsKey(kind.getKey());
    }

    /**
     * Get the capacity of this node for the given resource.
     *
     * @param kind the resource kind
     * @return the capacity in milli-units
     * @throws PlacementException if the node does not declare a capacity for the resource, or declares an
     *         invalid one
     */
    public long getCapacityMillis(ResourceKind kind) throws PlacementException {
        final String quantity = capacity.get(kind.getKey());
        if (quantity == null)
            throw new PlacementException("Node " + name + " has no " + kind.getKey() + " capacity");
        return ResourceQuantity.parseMillis(quantity);
    }

    @Override
    public String toString() {
        return "Node{" +
                "name='" + name + '\'' +
                ", capacity=" + capacity +
                ", pods=" + pods.size() +
                '}';
    }
}
