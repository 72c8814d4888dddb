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

import io.kit.operator.api.NatGateway;
import io.kit.operator.config.KitOperatorConfiguration;
import io.kit.operator.controller.CancellationSignal;
import io.kit.operator.controller.ReconcileDispatcher;
import io.kit.operator.utils.EventRecorder;
import io.kit.operator.utils.StatusRecorder;

import io.javaoperatorsdk.operator.api.reconciler.ControllerConfiguration;

/** JOSDK entry point for NAT gateways. */
@ControllerConfiguration()
public class NatGatewayReconciler extends InfrastructureReconciler<NatGateway> {

    public NatGatewayReconciler(
            ReconcileDispatcher dispatcher,
            KitOperatorConfiguration configuration,
            StatusRecorder statusRecorder,
            EventRecorder eventRecorder,
            CancellationSignal cancellationSignal) {
        super(dispatcher, configuration, statusRecorder, eventRecorder, cancellationSignal);
    }
}
