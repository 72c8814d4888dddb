/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.kit.operator.api.lifecycle;

import lombok.Getter;

/** Observed state of an infrastructure resource, derived again on every reconcile pass. */
public enum ResourceState {
    WAITING("Waiting for a dependency or for the provider to settle", false),
    CREATED("The external resource exists and matches the desired state", true),
    TERMINATED("The external resource has been removed", true),
    ERROR("Reconciliation needs operator intervention", false);

    @Getter private final String description;

    @Getter private final boolean terminal;

    ResourceState(String description, boolean terminal) {
        this.description = description;
        this.terminal = terminal;
    }
}
