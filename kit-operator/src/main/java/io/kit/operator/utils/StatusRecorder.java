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
import io.kit.operator.api.lifecycle.ResourceState;
import io.kit.operator.api.listener.InfrastructureResourceListener;
import io.kit.operator.api.status.InfrastructureStatus;
import io.kit.operator.api.utils.ConditionUtils;
import io.kit.operator.controller.ReconcileResult;
import io.kit.operator.listener.AuditUtils;

import org.apache.flink.annotation.VisibleForTesting;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.javaoperatorsdk.operator.processing.event.ResourceID;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.HttpURLConnection;
import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;

/** Helper class for status management and updates. */
public class StatusRecorder {

    private static final Logger LOG = LoggerFactory.getLogger(StatusRecorder.class);

    private static final int MAX_CONFLICT_RETRIES = 3;

    protected final ObjectMapper objectMapper = new ObjectMapper();

    protected final ConcurrentHashMap<ResourceID, ObjectNode> statusCache =
            new ConcurrentHashMap<>();

    private final BiConsumer<AbstractInfrastructureResource<?, ?>, InfrastructureStatus>
            statusUpdateListener;

    public StatusRecorder(
            BiConsumer<AbstractInfrastructureResource<?, ?>, InfrastructureStatus>
                    statusUpdateListener) {
        this.statusUpdateListener = statusUpdateListener;
    }

    /**
     * Applies the outcome of a pass to the in-memory status of the resource.
     *
     * @param resource Reconciled resource.
     * @param result Outcome of the pass.
     */
    public void recordResult(
            AbstractInfrastructureResource<?, InfrastructureStatus> resource,
            ReconcileResult result) {
        var status = resource.getStatus();
        String error = result.isFatal() ? result.getReason() : null;
        boolean changed =
                status.getState() != result.getState()
                        || !StringUtils.equals(status.getReason(), result.getReason())
                        || !StringUtils.equals(status.getError(), error);

        status.setState(result.getState());
        status.setReason(result.getReason());
        status.setError(error);
        status.setFailures(0);
        if (result.getExternalId() != null) {
            status.setExternalId(result.getExternalId());
        }
        if (result.isTerminated()) {
            status.setExternalId(null);
        }
        updateCommonFields(resource, status, changed);
    }

    /**
     * Records a failed pass. The state only moves to {@link ResourceState#ERROR} once retries are
     * exhausted, before that the previous state is kept.
     *
     * @param resource Reconciled resource.
     * @param error Error of the pass.
     * @param retriesExhausted Whether no further retry will follow.
     */
    public void recordFailure(
            AbstractInfrastructureResource<?, InfrastructureStatus> resource,
            Throwable error,
            boolean retriesExhausted) {
        var status = resource.getStatus();
        var message = ExceptionUtils.getRootCauseMessage(error);
        boolean changed = !StringUtils.equals(status.getError(), message) || retriesExhausted;

        status.setError(message);
        status.setFailures(status.getFailures() + 1);
        if (retriesExhausted) {
            status.setState(ResourceState.ERROR);
        }
        updateCommonFields(resource, status, changed);
    }

    private void updateCommonFields(
            AbstractInfrastructureResource<?, InfrastructureStatus> resource,
            InfrastructureStatus status,
            boolean changed) {
        status.setObservedGeneration(resource.getMetadata().getGeneration());
        if (changed || status.getLastUpdateTime() == null) {
            status.setLastUpdateTime(Instant.now().toString());
        }
        status.setConditions(ConditionUtils.createConditionFromStatus(status));
    }

    /**
     * Update the status of the provided kubernetes resource on the k8s cluster. Nothing is sent if
     * the status did not change since the last update.
     *
     * @param resource Resource for which status update should be performed
     * @param client Kubernetes client to use for the update
     */
    public void patchAndCacheStatus(
            AbstractInfrastructureResource<?, InfrastructureStatus> resource,
            KubernetesClient client) {
        ObjectNode newStatusNode =
                objectMapper.convertValue(resource.getStatus(), ObjectNode.class);
        var resourceId = ResourceID.fromResource(resource);
        ObjectNode previousStatusNode = statusCache.get(resourceId);

        if (newStatusNode.equals(previousStatusNode)) {
            LOG.debug("No status change.");
            return;
        }

        var prevStatus = convertStatus(previousStatusNode);
        replaceStatus(resource, client);

        statusCache.put(resourceId, newStatusNode);
        statusUpdateListener.accept(resource, prevStatus);
    }

    private void replaceStatus(
            AbstractInfrastructureResource<?, InfrastructureStatus> resource,
            KubernetesClient client) {
        int retries = 0;
        while (true) {
            try {
                var updated = client.resource(resource).lockResourceVersion().updateStatus();

                // Keep the resource version so a later update in the same pass locks correctly
                resource.getMetadata()
                        .setResourceVersion(updated.getMetadata().getResourceVersion());
                return;
            } catch (KubernetesClientException kce) {
                if (kce.getCode() != HttpURLConnection.HTTP_CONFLICT
                        || retries >= MAX_CONFLICT_RETRIES) {
                    throw kce;
                }
                handleLockingError(resource, client, kce);
                ++retries;
            }
        }
    }

    @VisibleForTesting
    void handleLockingError(
            AbstractInfrastructureResource<?, InfrastructureStatus> resource,
            KubernetesClient client,
            KubernetesClientException kce) {
        var currentVersion = resource.getMetadata().getResourceVersion();
        var latest = client.resource(resource).get();
        if (latest == null || latest.getMetadata() == null) {
            throw new KubernetesClientException(
                    String.format(
                            "Failed to retrieve latest %s",
                            latest == null ? "resource" : "metadata"),
                    kce);
        }
        var latestVersion = latest.getMetadata().getResourceVersion();
        if (Objects.equals(currentVersion, latestVersion)) {
            LOG.error("Unable to fetch latest resource version");
            throw kce;
        }
        // The operator is the only writer of the status, the spec may have changed meanwhile
        LOG.debug("Retrying status update for latest version {}", latestVersion);
        resource.getMetadata().setResourceVersion(latestVersion);
    }

    /**
     * Update the custom resource status based on the in-memory cache so status updates made in
     * earlier passes are visible even if the informer has not caught up yet.
     *
     * <p>If the cache doesn't have a status stored, it is initialized from the current status.
     *
     * @param resource Resource for which the status should be updated from the cache
     */
    public void updateStatusFromCache(
            AbstractInfrastructureResource<?, InfrastructureStatus> resource) {
        var key = ResourceID.fromResource(resource);
        var cachedStatus = statusCache.get(key);
        if (cachedStatus != null) {
            resource.setStatus(convertStatus(cachedStatus));
        } else {
            statusCache.put(key, objectMapper.convertValue(resource.getStatus(), ObjectNode.class));
        }
    }

    /**
     * Clean up resource after deletion and send a last status update.
     *
     * @param resource Deleted resource.
     */
    public void cleanupForDeletion(
            AbstractInfrastructureResource<?, InfrastructureStatus> resource) {
        var prevJson = statusCache.remove(ResourceID.fromResource(resource));
        statusUpdateListener.accept(resource, convertStatus(prevJson));
    }

    private InfrastructureStatus convertStatus(ObjectNode statusNode) {
        if (statusNode == null) {
            return null;
        }
        return objectMapper.convertValue(statusNode, InfrastructureStatus.class);
    }

    public static StatusRecorder create(
            KubernetesClient kubernetesClient,
            Collection<InfrastructureResourceListener> listeners) {
        BiConsumer<AbstractInfrastructureResource<?, ?>, InfrastructureStatus> consumer =
                (resource, previousStatus) -> {
                    var now = Instant.now();
                    var ctx =
                            new InfrastructureResourceListener.StatusUpdateContext() {
                                @Override
                                public InfrastructureStatus getPreviousStatus() {
                                    return previousStatus;
                                }

                                @Override
                                public AbstractInfrastructureResource<?, ?> getResource() {
                                    return resource;
                                }

                                @Override
                                public KubernetesClient getKubernetesClient() {
                                    return kubernetesClient;
                                }

                                @Override
                                public Instant getTimestamp() {
                                    return now;
                                }
                            };

                    listeners.forEach(listener -> listener.onStatusUpdate(ctx));
                    AuditUtils.logContext(ctx);
                };

        return new StatusRecorder(consumer);
    }
}
