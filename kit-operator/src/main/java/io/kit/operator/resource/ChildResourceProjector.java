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

package io.kit.operator.resource;

import io.kit.operator.api.AbstractInfrastructureResource;
import io.kit.operator.api.ControlPlane;
import io.kit.operator.api.CrdConstants;
import io.kit.operator.api.status.InfrastructureStatus;
import io.kit.operator.config.KitOperatorConfiguration;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Projects one declarative child object out of a {@link ControlPlane}. The child is reconciled
 * against the cloud by its own controller; the projector only makes sure it exists.
 *
 * @param <CHILD> Child resource type.
 */
public abstract class ChildResourceProjector<
        CHILD extends AbstractInfrastructureResource<?, InfrastructureStatus>> {

    private static final Logger LOG = LoggerFactory.getLogger(ChildResourceProjector.class);

    /** What a projection pass did to the child object. */
    public enum Projection {
        CREATED,
        UPDATED,
        UNCHANGED
    }

    protected abstract Class<CHILD> childClass();

    public String childKind() {
        return HasMetadata.getKind(childClass());
    }

    /** Value of the component label set on the child. */
    protected abstract String component();

    protected abstract String childName(String clusterName);

    /** Builds the child with its default spec, metadata is filled in by the caller. */
    protected abstract CHILD buildChild(
            ControlPlane controlPlane, String clusterName, KitOperatorConfiguration conf);

    /**
     * Brings an existing child in line with the control plane.
     *
     * @return true if the child was modified and has to be written back
     */
    protected abstract boolean correctDrift(ControlPlane controlPlane, CHILD existing);

    public Projection project(
            KubernetesClient client, ControlPlane controlPlane, KitOperatorConfiguration conf) {
        var clusterName = controlPlane.getMetadata().getName();
        var namespace = controlPlane.getMetadata().getNamespace();
        var name = childName(clusterName);

        var existing = getChild(client, namespace, name);
        if (existing.isEmpty()) {
            var child = buildChild(controlPlane, clusterName, conf);
            child.setMetadata(createChildObjectMeta(namespace, name, clusterName));
            child.addOwnerReference(controlPlane);
            LOG.info("Creating {} {}/{}", child.getKind(), namespace, name);
            client.resource(child).create();
            return Projection.CREATED;
        }

        var child = existing.get();
        if (correctDrift(controlPlane, child)) {
            LOG.info("Updating drifted {} {}/{}", child.getKind(), namespace, name);
            client.resource(child).update();
            return Projection.UPDATED;
        }
        return Projection.UNCHANGED;
    }

    /**
     * Deletes the child if it still exists.
     *
     * @return true if the child was still present
     */
    public boolean delete(KubernetesClient client, ControlPlane controlPlane) {
        var namespace = controlPlane.getMetadata().getNamespace();
        var name = childName(controlPlane.getMetadata().getName());
        var existing = getChild(client, namespace, name);
        if (existing.isEmpty()) {
            return false;
        }
        if (!existing.get().isMarkedForDeletion()) {
            LOG.info("Deleting {} {}/{}", existing.get().getKind(), namespace, name);
            client.resource(existing.get()).delete();
        }
        return true;
    }

    private Optional<CHILD> getChild(KubernetesClient client, String namespace, String name) {
        return Optional.ofNullable(
                client.resources(childClass()).inNamespace(namespace).withName(name).get());
    }

    private ObjectMeta createChildObjectMeta(String namespace, String name, String clusterName) {
        var objectMeta = new ObjectMeta();
        objectMeta.setName(name);
        objectMeta.setNamespace(namespace);
        objectMeta.setLabels(
                Map.of(
                        CrdConstants.LABEL_CLUSTER_NAME,
                        clusterName,
                        CrdConstants.LABEL_COMPONENT,
                        component()));
        return objectMeta;
    }
}
