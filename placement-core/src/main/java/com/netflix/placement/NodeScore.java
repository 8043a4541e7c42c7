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

import java.util.Objects;

/**
 * A score for a node, raw as produced by a {@link ScorePlugin} or normalized by a {@link ScoreNormalizer}.
 */
@JsonIgnoreProperties(ignoreUnknown=true)
public class NodeScore {
    private final String name;
    private final long score;

    @JsonCreator
    public NodeScore(@JsonProperty("name") String name, @JsonProperty("score") long score) {
        this.name = name;
        this.score = score;
    }

    /**
     * @return the name of the scored node
     */
    public String getName() {
        return name;
    }

    public long getScore() {
        return score;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeScore nodeScore = (NodeScore) o;
        return score == nodeScore.score && Objects.equals(name, nodeScore.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, score);
    }

    @Override
    public String toString() {
        return name + "=" + score;
    }
}
