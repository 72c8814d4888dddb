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

import io.kit.operator.TestUtils;
import io.kit.operator.api.AutoScalingGroup;
import io.kit.operator.api.ControlPlane;
import io.kit.operator.api.CrdConstants;
import io.kit.operator.api.NatGateway;
import io.kit.operator.api.TargetGroup;
import io.kit.operator.utils.EventRecorder;

import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.kit.operator.TestUtils.CLUSTER_NAME;
import static io.kit.operator.TestUtils.TEST_NAMESPACE;
import static org.assertj.core.api.Assertions.assertThat;

/** Test for {@link ControlPlaneController}. */
@EnableKubernetesMockClient(crud = true)
public class ControlPlaneControllerTest {

    private KubernetesClient kubernetesClient;

    private final List<Event> events = new ArrayList<>();
    private ControlPlaneController controller;
    private ReconcileContext ctx;

    @BeforeEach
    public void setup() {
        controller = new ControlPlaneController(new EventRecorder((r, e) -> events.add(e)));
        ctx = TestUtils.reconcileContext(kubernetesClient);
    }

    @Test
    public void testProjectsChildren() {
        var controlPlane = TestUtils.buildControlPlane();

        assertThat(controller.reconcile(ctx, controlPlane).isCreated()).isTrue();

        var natGateway = getChild(NatGateway.class, CLUSTER_NAME);
        assertThat(natGateway.getSpec().getClusterName()).isEqualTo(CLUSTER_NAME);
        assertOwnedBy(natGateway, controlPlane);

        var targetGroup = getChild(TargetGroup.class, CLUSTER_NAME + "-tg");
        assertThat(targetGroup.getSpec().getPort()).isEqualTo(443);
        assertThat(targetGroup.getSpec().getProtocol()).isEqualTo("TCP");
        assertOwnedBy(targetGroup, controlPlane);

        var autoScalingGroup = getChild(AutoScalingGroup.class, CLUSTER_NAME + "-asg");
        assertThat(autoScalingGroup.getSpec().getInstanceCount()).isEqualTo(3);
        assertThat(autoScalingGroup.getSpec().getTargetGroupName())
                .isEqualTo(CLUSTER_NAME + "-tg");
        assertThat(autoScalingGroup.getSpec().getLaunchTemplateName()).isEqualTo(CLUSTER_NAME);
        assertThat(autoScalingGroup.getMetadata().getLabels())
                .containsEntry(CrdConstants.LABEL_CLUSTER_NAME, CLUSTER_NAME)
                .containsEntry(CrdConstants.LABEL_COMPONENT, "autoscaling-group");
        assertOwnedBy(autoScalingGroup, controlPlane);

        assertThat(events).hasSize(3);
        assertThat(events)
                .allMatch(e -> EventRecorder.Reason.ChildProjected.name().equals(e.getReason()));
    }

    @Test
    public void testReconcileIsIdempotent() {
        var controlPlane = TestUtils.buildControlPlane();
        controller.reconcile(ctx, controlPlane);
        events.clear();

        assertThat(controller.reconcile(ctx, controlPlane).isCreated()).isTrue();

        assertThat(events).isEmpty();
        assertThat(
                        kubernetesClient
                                .resources(NatGateway.class)
                                .inNamespace(TEST_NAMESPACE)
                                .list()
                                .getItems())
                .hasSize(1);
    }

    @Test
    public void testExistingNatGatewayIsLeftUntouched() {
        var controlPlane = TestUtils.buildControlPlane();
        controller.reconcile(ctx, controlPlane);

        var natGateway = getChild(NatGateway.class, CLUSTER_NAME);
        natGateway.getSpec().setClusterName("edited-by-hand");
        kubernetesClient.resource(natGateway).update();

        controller.reconcile(ctx, controlPlane);

        assertThat(getChild(NatGateway.class, CLUSTER_NAME).getSpec().getClusterName())
                .isEqualTo("edited-by-hand");
    }

    @Test
    public void testInstanceCountDriftIsCorrected() {
        var controlPlane = TestUtils.buildControlPlane();
        controller.reconcile(ctx, controlPlane);

        controlPlane.getSpec().setInstanceCount(5);
        controller.reconcile(ctx, controlPlane);

        assertThat(
                        getChild(AutoScalingGroup.class, CLUSTER_NAME + "-asg")
                                .getSpec()
                                .getInstanceCount())
                .isEqualTo(5);
    }

    @Test
    public void testFinalizeWaitsForChildren() {
        var controlPlane = TestUtils.buildControlPlane();
        controller.reconcile(ctx, controlPlane);
        TestUtils.markForDeletion(controlPlane);

        var first = controller.finalize(ctx, controlPlane);
        assertThat(first.isWaiting()).isTrue();
        assertThat(first.getReason()).isEqualTo(ControlPlaneController.WAITING_FOR_CHILDREN);

        var second = controller.finalize(ctx, controlPlane);
        assertThat(second.isTerminated()).isTrue();
        assertThat(
                        kubernetesClient
                                .resources(AutoScalingGroup.class)
                                .inNamespace(TEST_NAMESPACE)
                                .withName(CLUSTER_NAME + "-asg")
                                .get())
                .isNull();
    }

    private <T extends HasMetadata> T getChild(
            Class<T> type, String name) {
        var child =
                kubernetesClient.resources(type).inNamespace(TEST_NAMESPACE).withName(name).get();
        assertThat(child).isNotNull();
        return child;
    }

    private static void assertOwnedBy(
            HasMetadata child, ControlPlane owner) {
        assertThat(child.getMetadata().getOwnerReferences()).hasSize(1);
        var ownerReference = child.getMetadata().getOwnerReferences().get(0);
        assertThat(ownerReference.getKind()).isEqualTo(owner.getKind());
        assertThat(ownerReference.getName()).isEqualTo(owner.getMetadata().getName());
        assertThat(ownerReference.getUid()).isEqualTo(owner.getMetadata().getUid());
    }
}
