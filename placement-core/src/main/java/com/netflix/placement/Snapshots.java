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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads pod and node snapshots from JSON, in the shape of the {@link Pod}, {@link Node} and {@link Container}
 * properties, with resource quantities as strings:
 * <pre>
 * {"name": "node-1", "capacity": {"cpu": "4", "memory": "8Gi"},
 *  "pods": [{"name": "web-1", "labels": {"applicationName": "web"},
 *            "containers": [{"name": "main", "requests": {"cpu": "500m"}}]}]}
 * </pre>
 */
public final class Snapshots {
    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private Snapshots() {
    }

    public static Pod readPod(InputStream in) throws PlacementException {
        return read(in, new TypeReference<Pod>() {});
    }

    public static Node readNode(InputStream in) throws PlacementException {
        return read(in, new TypeReference<Node>() {});
    }

    public static List<Node> readNodes(InputStream in) throws PlacementException {
        return read(in, new TypeReference<List<Node>>() {});
    }

    private static <T> T read(InputStream in, TypeReference<T> type) throws PlacementException {
        if (in == null)
            throw new PlacementException("No snapshot to read");
        try {
            final T value = objectMapper.readValue(in, type);
            if (value == null)
                throw new PlacementException("Empty snapshot");
            return value;
        } catch (IOException e) {
            throw new PlacementException("Unable to read snapshot: " + e.getMessage(), e);
        }
    }
}
