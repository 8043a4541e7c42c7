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

/**
 * The outcome of a {@link FilterPlugin}: either the node admits the pod, or it does not, together with the
 * reason why. A node that does not admit the pod is a normal decision and tells the orchestrator to try another
 * node.
 */
@JsonIgnoreProperties(ignoreUnknown=true)
public class Status {

    public enum Code {Success, Unschedulable}

    private static final Status SUCCESS = new Status(Code.Success, "");

    private final Code code;
    private final String reason;

    @JsonCreator
    public Status(@JsonProperty("code") Code code, @JsonProperty("reason") String reason) {
        this.code = code;
        this.reason = code == Code.Success ? "" : reason;
    }

    public static Status success() {
        return SUCCESS;
    }

    public static Status unschedulable(String reason) {
        return new Status(Code.Unschedulable, reason);
    }

    public Code getCode() {
        return code;
    }

    /**
     * Indicates whether the node admits the pod.
     *
     * @return {@code true} if the node admits the pod, {@code false} otherwise
     */
    @JsonIgnore
    public boolean isSuccess() {
        return code == Code.Success;
    }

    /**
     * Returns the reason why the node does not admit the pod.
     *
     * @return the reason, or an empty string if the node admits the pod
     */
    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "Status{" +
                "code=" + code +
                ", reason='" + reason + '\'' +
                '}';
    }
}
