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

package io.kit.operator.api.listener;

import io.kit.operator.api.AbstractInfrastructureResource;
import io.kit.operator.api.status.InfrastructureStatus;

import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.time.Instant;

/**
 * Listener interface for infrastructure resource events and status changes. Implementations are
 * discovered with {@link java.util.ServiceLoader}.
 */
public interface InfrastructureResourceListener {

    void onStatusUpdate(StatusUpdateContext ctx);

    void onEvent(ResourceEventContext ctx);

    /** Base for Resource Event and StatusUpdate contexts. */
    interface ResourceContext {
        KubernetesClient getKubernetesClient();

        AbstractInfrastructureResource<?, ?> getResource();

        Instant getTimestamp();
    }

    /** Context for resource Event listener methods. */
    interface ResourceEventContext extends ResourceContext {
        Event getEvent();

        @Override
        default Instant getTimestamp() {
            return Instant.parse(getEvent().getLastTimestamp());
        }
    }

    /** Context for resource Status listener methods. */
    interface StatusUpdateContext extends ResourceContext {

        default InfrastructureStatus getNewStatus() {
            return getResource().getStatus();
        }

        InfrastructureStatus getPreviousStatus();
    }
}
