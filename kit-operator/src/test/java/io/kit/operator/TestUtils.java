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

package io.kit.operator;

import io.kit.operator.api.AutoScalingGroup;
import io.kit.operator.api.ControlPlane;
import io.kit.operator.api.NatGateway;
import io.kit.operator.api.TargetGroup;
import io.kit.operator.api.spec.AutoScalingGroupSpec;
import io.kit.operator.api.spec.ControlPlaneSpec;
import io.kit.operator.api.spec.NatGatewaySpec;
import io.kit.operator.api.spec.TargetGroupSpec;
import io.kit.operator.config.KitOperatorConfiguration;
import io.kit.operator.controller.CancellationSignal;
import io.kit.operator.controller.ReconcileContext;

import org.apache.flink.configuration.Configuration;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.time.Instant;
import java.util.UUID;

/** Testing utilities. */
public class TestUtils {

    public static final String TEST_NAMESPACE = "kit-test";
    public static final String CLUSTER_NAME = "cluster-x";

    public static ControlPlane buildControlPlane() {
        return buildControlPlane(CLUSTER_NAME);
    }

    public static ControlPlane buildControlPlane(String name) {
        var controlPlane = new ControlPlane();
        controlPlane.setMetadata(buildMeta(name));
        var spec = new ControlPlaneSpec();
        spec.setInstanceCount(3);
        controlPlane.setSpec(spec);
        return controlPlane;
    }

    public static AutoScalingGroup buildAutoScalingGroup(
            String name, String clusterName, int instanceCount, String targetGroupName) {
        var autoScalingGroup = new AutoScalingGroup();
        autoScalingGroup.setMetadata(buildMeta(name));
        autoScalingGroup.setSpec(
                AutoScalingGroupSpec.builder()
                        .clusterName(clusterName)
                        .instanceCount(instanceCount)
                        .targetGroupName(targetGroupName)
                        .build());
        return autoScalingGroup;
    }

    public static TargetGroup buildTargetGroup(
            String name, String clusterName, int port, String protocol) {
        var targetGroup = new TargetGroup();
        targetGroup.setMetadata(buildMeta(name));
        targetGroup.setSpec(
                TargetGroupSpec.builder()
                        .clusterName(clusterName)
                        .port(port)
                        .protocol(protocol)
                        .build());
        return targetGroup;
    }

    public static NatGateway buildNatGateway(String name, String clusterName) {
        var natGateway = new NatGateway();
        natGateway.setMetadata(buildMeta(name));
        natGateway.setSpec(NatGatewaySpec.builder().clusterName(clusterName).build());
        return natGateway;
    }

    public static void markForDeletion(HasMetadata resource) {
        resource.getMetadata().setDeletionTimestamp(Instant.now().toString());
    }

    public static KitOperatorConfiguration operatorConfiguration() {
        return KitOperatorConfiguration.fromConfiguration(new Configuration());
    }

    public static ReconcileContext reconcileContext(KubernetesClient client) {
        return reconcileContext(client, new CancellationSignal());
    }

    public static ReconcileContext reconcileContext(
            KubernetesClient client, CancellationSignal cancellationSignal) {
        return new ReconcileContext(operatorConfiguration(), client, cancellationSignal);
    }

    private static ObjectMeta buildMeta(String name) {
        var meta = new ObjectMeta();
        meta.setName(name);
        meta.setNamespace(TEST_NAMESPACE);
        meta.setGeneration(1L);
        meta.setUid(UUID.randomUUID().toString());
        return meta;
    }
}
