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

package io.kit.operator.controller;

import io.kit.operator.config.KitOperatorConfiguration;
import io.kit.operator.exception.ReconciliationCancelledException;

import io.fabric8.kubernetes.client.KubernetesClient;
import lombok.Getter;

import java.util.UUID;

/** Per-pass context handed to a {@link ResourceController}. */
public class ReconcileContext {

    @Getter private final KitOperatorConfiguration operatorConfiguration;
    @Getter private final KubernetesClient kubernetesClient;
    @Getter private final String reconcileId;
    private final CancellationSignal cancellationSignal;

    public ReconcileContext(
            KitOperatorConfiguration operatorConfiguration,
            KubernetesClient kubernetesClient,
            CancellationSignal cancellationSignal) {
        this.operatorConfiguration = operatorConfiguration;
        this.kubernetesClient = kubernetesClient;
        this.cancellationSignal = cancellationSignal;
        this.reconcileId = UUID.randomUUID().toString().substring(0, 8);
    }

    public boolean isCancelled() {
        return cancellationSignal.isCancelled();
    }

    /**
     * Called between provider calls so a shutting down operator stops a pass promptly.
     *
     * @throws ReconciliationCancelledException if the operator is stopping
     */
    public void checkNotCancelled() {
        if (cancellationSignal.isCancelled()) {
            throw new ReconciliationCancelledException(
                    "Operator is shutting down, abandoning pass " + reconcileId);
        }
    }
}
