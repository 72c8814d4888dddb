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

package io.kit.operator.reconciler;

import io.kit.operator.api.ResourceKind;
import io.kit.operator.config.KitOperatorConfiguration;
import io.kit.operator.controller.CancellationSignal;
import io.kit.operator.controller.ReconcileDispatcher;
import io.kit.operator.utils.EventRecorder;
import io.kit.operator.utils.StatusRecorder;

import lombok.RequiredArgsConstructor;

/** Creates the JOSDK reconciler serving a resource kind. */
@RequiredArgsConstructor
public class ReconcilerFactory {

    private final ReconcileDispatcher dispatcher;
    private final KitOperatorConfiguration configuration;
    private final StatusRecorder statusRecorder;
    private final EventRecorder eventRecorder;
    private final CancellationSignal cancellationSignal;

    public InfrastructureReconciler<?> create(ResourceKind kind) {
        switch (kind) {
            case CONTROL_PLANE:
                return new ControlPlaneReconciler(
                        dispatcher,
                        configuration,
                        statusRecorder,
                        eventRecorder,
                        cancellationSignal);
            case AUTO_SCALING_GROUP:
                return new AutoScalingGroupReconciler(
                        dispatcher,
                        configuration,
                        statusRecorder,
                        eventRecorder,
                        cancellationSignal);
            case TARGET_GROUP:
                return new TargetGroupReconciler(
                        dispatcher,
                        configuration,
                        statusRecorder,
                        eventRecorder,
                        cancellationSignal);
            case NAT_GATEWAY:
                return new NatGatewayReconciler(
                        dispatcher,
                        configuration,
                        statusRecorder,
                        eventRecorder,
                        cancellationSignal);
            default:
                throw new UnsupportedOperationException("Unsupported resource kind " + kind);
        }
    }
}
