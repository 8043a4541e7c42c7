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

/**
 * How the resources consumed on a node are summed from the pods bound to it.
 * <p>
 * {@link #FirstContainer} counts only the first container of every bound pod. It is what placement decisions
 * made so far were based on, and remains the default so that the same inputs keep giving the same answers.
 * {@link #AllContainers} counts every container, the same way a candidate pod's own request is always summed.
 */
public enum ContainerAccounting {FirstContainer, AllContainers}
