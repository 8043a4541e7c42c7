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

package com.netflix.placement.plugins;

import com.netflix.placement.FilterPlugin;
import com.netflix.placement.Node;
import com.netflix.placement.Pod;
import com.netflix.placement.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A filter that keeps at most one instance of a logical application on a node. A node is rejected when any pod
 * already bound to it carries the same application label value as the pod being placed.
 * <p>
 * If you construct this filter without passing in a label name, it uses {@link Pod#APPLICATION_NAME_LABEL}.
 * A pod that does not carry the label is not an instance of any application and is never rejected by this
 * filter; neither is a node whose bound pods lack the label.
 */
public class ApplicationColocationConstraint implements FilterPlugin {
    public static final String NAME = "ApplicationColocation";
    public static final String APPLICATION_PRESENT = "application already present on node";

    private static final Logger logger = LoggerFactory.getLogger(ApplicationColocationConstraint.class);
    private final String labelName;

    public ApplicationColocationConstraint() {
        this(Pod.APPLICATION_NAME_LABEL);
    }

    /**
     * @param labelName the pod label whose value identifies the application
     */
    public ApplicationColocationConstraint(String labelName) {
        if (labelName == null || labelName.isEmpty())
            throw new IllegalArgumentException("Label name must be non-empty");
        this.labelName = labelName;
    }

    @Override
    public String getName() {
        return NAME;
    }

    public String getLabelName() {
        return labelName;
    }

    @Override
    public Status filter(Pod pod, Node node) {
        final String application = pod.getLabels().get(labelName);
        if (application == null)
            return Status.success();
        for (Pod bound : node.getPods()) {
            if (application.equals(bound.getLabels().get(labelName))) {
                if (logger.isDebugEnabled())
                    logger.debug("Application {} already runs on node {} as pod {}", application, node.getName(),
                            bound.getName());
                return Status.unschedulable(APPLICATION_PRESENT);
            }
        }
        return Status.success();
    }
}
