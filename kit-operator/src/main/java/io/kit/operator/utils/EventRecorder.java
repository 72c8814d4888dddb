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

package io.kit.operator.utils;

import io.kit.operator.api.AbstractInfrastructureResource;
import io.kit.operator.api.listener.InfrastructureResourceListener;
import io.kit.operator.listener.AuditUtils;

import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.client.KubernetesClient;

import javax.annotation.Nullable;

import java.time.Duration;
import java.util.Collection;
import java.util.function.BiConsumer;

/** Helper class for creating Kubernetes events for infrastructure resources. */
public class EventRecorder {

    private final BiConsumer<AbstractInfrastructureResource<?, ?>, Event> eventListener;

    public EventRecorder(BiConsumer<AbstractInfrastructureResource<?, ?>, Event> eventListener) {
        this.eventListener = eventListener;
    }

    public boolean triggerEvent(
            AbstractInfrastructureResource<?, ?> resource,
            Type type,
            Reason reason,
            Component component,
            String message,
            KubernetesClient client) {
        return triggerEventWithInterval(
                resource, type, reason, component, message, null, client, null);
    }

    /**
     * @param messageKey Key used for dedupe instead of the message. Null means the message.
     * @param interval Interval for dedupe. Null means no dedupe.
     * @return true if a new event was created
     */
    public boolean triggerEventWithInterval(
            AbstractInfrastructureResource<?, ?> resource,
            Type type,
            Reason reason,
            Component component,
            String message,
            @Nullable String messageKey,
            KubernetesClient client,
            @Nullable Duration interval) {
        return EventUtils.emitEvent(
                client,
                resource,
                type,
                reason.toString(),
                message,
                component,
                e -> eventListener.accept(resource, e),
                messageKey,
                interval);
    }

    public static EventRecorder create(
            KubernetesClient client, Collection<InfrastructureResourceListener> listeners) {
        BiConsumer<AbstractInfrastructureResource<?, ?>, Event> biConsumer =
                (resource, event) -> {
                    var ctx =
                            new InfrastructureResourceListener.ResourceEventContext() {
                                @Override
                                public Event getEvent() {
                                    return event;
                                }

                                @Override
                                public AbstractInfrastructureResource<?, ?> getResource() {
                                    return resource;
                                }

                                @Override
                                public KubernetesClient getKubernetesClient() {
                                    return client;
                                }
                            };
                    listeners.forEach(listener -> listener.onEvent(ctx));
                    AuditUtils.logContext(ctx);
                };
        return new EventRecorder(biConsumer);
    }

    /** The type of the events. */
    public enum Type {
        Normal,
        Warning
    }

    /** The component of events. */
    public enum Component {
        Operator,
        Cloud
    }

    /** The reason codes of events. */
    public enum Reason {
        Waiting,
        Created,
        Terminated,
        Error,
        Cleanup,
        ValidationError,
        ChildProjected
    }
}
