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

package io.kit.operator.api.status;

import io.kit.operator.api.lifecycle.ResourceState;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.fabric8.crd.generator.annotation.PrinterColumn;
import io.fabric8.kubernetes.api.model.Condition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/** Last observed status of an infrastructure resource. */
@Data
@AllArgsConstructor
@NoArgsConstructor
@SuperBuilder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class InfrastructureStatus {

    /** State reached by the last reconcile pass. */
    @PrinterColumn(name = "State")
    private ResourceState state;

    /** Short explanation of the state, e.g. the dependency being waited on. */
    private String reason;

    /** Error information about the last failed pass. */
    private String error;

    /** Generation of the resource that was last reconciled. */
    private Long observedGeneration;

    /** Identifier of the external resource (ARN or id). */
    @PrinterColumn(name = "External Id")
    private String externalId;

    /** Timestamp of the last change of state, reason or error. */
    private String lastUpdateTime;

    /** Number of consecutive failed passes. */
    private int failures;

    /** Conditions of the resource. */
    @Builder.Default private List<Condition> conditions = new ArrayList<>();
}
