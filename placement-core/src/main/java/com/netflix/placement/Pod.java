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
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A workload unit, either one waiting to be placed or one already bound to a {@link Node}. Pods are immutable
 * snapshots supplied by the orchestrator.
 */
@JsonIgnoreProperties(ignoreUnknown=true)
public class Pod {
    /**
     * Label identifying the logical application a pod belongs to.
     */
    public static final String APPLICATION_NAME_LABEL = "applicationName";

    private final String name;
    private final String namespace;
    private final Map<String, String> labels;
    private final List<Container> containers;

    @JsonCreator
    public Pod(@JsonProperty("name") String name,
               @JsonProperty("namespace") String namespace,
               @JsonProperty("labels") Map<String, String> labels,
               @JsonProperty("containers") List<Container> containers) {
        this.name = name;
        this.namespace = namespace == null ? "default" : namespace;
        this.labels = labels == null ?
                Collections.<String, String>emptyMap() :
                Collections.unmodifiableMap(new HashMap<>(labels));
        this.containers = containers == null ?
                Collections.<Container>emptyList() :
                Collections.unmodifiableList(new ArrayList<>(containers));
    }

    public String getName() {
        return name;
    }

    public String getNamespace() {
        return namespace;
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    public List<Container> getContainers() {
        return containers;
    }

    /**
     * Get the value of the {@value #APPLICATION_NAME_LABEL} label.
     *
     * @return the application name, or {@code null} if the pod is not labeled with one
     */
    @JsonIgnore
    public String getApplicationName() {
        return labels.get(APPLICATION_NAME_LABEL);
    }

    @Override
    public String toString() {
        return "Pod{" +
                "name='" + namespace + "/" + name + '\'' +
                ", labels=" + labels +
                ", containers=" + containers +
                '}';
    }
}
