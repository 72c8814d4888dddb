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

import org.apache.flink.annotation.VisibleForTesting;

import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.EventBuilder;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectReferenceBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.NonDeletingOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.net.HttpURLConnection;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Writes Kubernetes events for infrastructure resources. Events are keyed by resource, type,
 * reason and message key, so a repeated condition bumps the count of one event instead of
 * creating a new one each pass.
 */
public class EventUtils {
    private static final Logger LOG = LoggerFactory.getLogger(EventUtils.class);

    private EventUtils() {}

    /**
     * Event name of the form {@code <kind>.<resource name>.<hash>}. The hash covers the uid so a
     * recreated resource does not inherit the events of its predecessor.
     */
    @VisibleForTesting
    static String eventName(
            HasMetadata target,
            EventRecorder.Type type,
            String reason,
            String messageKey,
            EventRecorder.Component component) {
        int hash =
                Objects.hash(
                        component.name(),
                        type.name(),
                        reason,
                        messageKey,
                        target.getMetadata().getUid());
        return String.format(
                "%s.%s.%08x",
                target.getKind().toLowerCase(Locale.ROOT),
                target.getMetadata().getName(),
                hash);
    }

    /**
     * Emits an event for the target. An identical event seen within the interval is left alone.
     *
     * @param messageKey Key identifying the event instead of the message, null means the message
     * @param interval Interval within which a repeated event is suppressed, null means never
     * @return true if a new event was created
     */
    public static boolean emitEvent(
            KubernetesClient client,
            HasMetadata target,
            EventRecorder.Type type,
            String reason,
            String message,
            EventRecorder.Component component,
            Consumer<Event> eventListener,
            @Nullable String messageKey,
            @Nullable Duration interval) {
        var name =
                eventName(
                        target, type, reason, messageKey == null ? message : messageKey, component);
        var existing =
                client.v1()
                        .events()
                        .inNamespace(target.getMetadata().getNamespace())
                        .withName(name)
                        .get();

        if (existing == null) {
            var now = Instant.now().toString();
            var event =
                    new EventBuilder()
                            .withNewMetadata()
                            .withName(name)
                            .withNamespace(target.getMetadata().getNamespace())
                            .endMetadata()
                            .withInvolvedObject(
                                    new ObjectReferenceBuilder()
                                            .withApiVersion(target.getApiVersion())
                                            .withKind(target.getKind())
                                            .withName(target.getMetadata().getName())
                                            .withNamespace(target.getMetadata().getNamespace())
                                            .withUid(target.getMetadata().getUid())
                                            .build())
                            .withType(type.name())
                            .withReason(reason)
                            .withMessage(message)
                            .withNewSource()
                            .withComponent(component.name())
                            .endSource()
                            .withCount(1)
                            .withFirstTimestamp(now)
                            .withLastTimestamp(now)
                            .build();
            write(client, event).ifPresent(eventListener);
            return true;
        }

        if (seenWithin(existing, interval)) {
            LOG.debug("Suppressing repeated event {}", name);
            return false;
        }
        existing.setCount(existing.getCount() == null ? 1 : existing.getCount() + 1);
        existing.setMessage(message);
        existing.setLastTimestamp(Instant.now().toString());
        write(client, existing).ifPresent(eventListener);
        return false;
    }

    private static boolean seenWithin(Event existing, @Nullable Duration interval) {
        if (interval == null || existing.getLastTimestamp() == null) {
            return false;
        }
        var lastSeen = Instant.parse(existing.getLastTimestamp());
        return Instant.now().isBefore(lastSeen.plus(interval));
    }

    private static Optional<Event> write(KubernetesClient client, Event event) {
        try {
            return Optional.of(client.resource(event).createOr(NonDeletingOperation::update));
        } catch (KubernetesClientException e) {
            if (e.getCode() != HttpURLConnection.HTTP_FORBIDDEN) {
                throw e;
            }
            // Missing RBAC for events or a terminating namespace, the pass itself must not fail
            LOG.warn("Cannot write event {}, proceeding.", event.getMetadata().getName(), e);
            return Optional.empty();
        }
    }
}
