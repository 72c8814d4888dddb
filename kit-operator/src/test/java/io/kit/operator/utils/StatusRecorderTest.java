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

import io.kit.operator.TestUtils;
import io.kit.operator.api.lifecycle.ResourceState;
import io.kit.operator.api.status.InfrastructureStatus;
import io.kit.operator.controller.ReconcileResult;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.fabric8.kubernetes.client.server.mock.KubernetesMockServer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Test for {@link StatusRecorder}. */
@EnableKubernetesMockClient(crud = true)
public class StatusRecorderTest {

    private KubernetesClient kubernetesClient;
    private KubernetesMockServer mockServer;

    @Test
    public void testPatchOnlyWhenChanged() throws InterruptedException {
        List<InfrastructureStatus> previousStatuses = new ArrayList<>();
        var helper = new StatusRecorder((r, s) -> previousStatuses.add(s));
        var targetGroup =
                kubernetesClient
                        .resource(
                                TestUtils.buildTargetGroup(
                                        "cluster-x-tg", TestUtils.CLUSTER_NAME, 443, "TCP"))
                        .create();
        var lastRequest = mockServer.getLastRequest();

        helper.recordResult(targetGroup, ReconcileResult.waiting("waiting for vpc"));
        helper.patchAndCacheStatus(targetGroup, kubernetesClient);
        assertThat(lastRequest).isNotSameAs(mockServer.getLastRequest());
        lastRequest = mockServer.getLastRequest();

        helper.recordResult(targetGroup, ReconcileResult.created("arn:tg"));
        helper.patchAndCacheStatus(targetGroup, kubernetesClient);

        // We intentionally compare references
        assertThat(lastRequest).isNotSameAs(mockServer.getLastRequest());
        lastRequest = mockServer.getLastRequest();

        // No update
        helper.recordResult(targetGroup, ReconcileResult.created("arn:tg"));
        helper.patchAndCacheStatus(targetGroup, kubernetesClient);
        assertThat(lastRequest).isSameAs(mockServer.getLastRequest());

        assertThat(previousStatuses).hasSize(2);
        assertThat(previousStatuses.get(1).getState()).isEqualTo(ResourceState.WAITING);
        var stored = kubernetesClient.resource(targetGroup).get().getStatus();
        assertThat(stored.getState()).isEqualTo(ResourceState.CREATED);
        assertThat(stored.getExternalId()).isEqualTo("arn:tg");
    }

    @Test
    public void testRecordFailure() {
        var helper = new StatusRecorder((r, s) -> {});
        var natGateway = TestUtils.buildNatGateway("nat", TestUtils.CLUSTER_NAME);
        helper.recordResult(natGateway, ReconcileResult.waiting("nat gateway pending", "nat-1"));

        helper.recordFailure(
                natGateway, new RuntimeException(new IllegalStateException("throttled")), false);
        var status = natGateway.getStatus();
        assertThat(status.getState()).isEqualTo(ResourceState.WAITING);
        assertThat(status.getFailures()).isEqualTo(1);
        assertThat(status.getError()).isEqualTo("IllegalStateException: throttled");

        helper.recordFailure(natGateway, new IllegalStateException("throttled"), true);
        assertThat(status.getState()).isEqualTo(ResourceState.ERROR);
        assertThat(status.getFailures()).isEqualTo(2);
        assertThat(status.getExternalId()).isEqualTo("nat-1");

        // A successful pass resets the failure count
        helper.recordResult(natGateway, ReconcileResult.created("nat-1"));
        assertThat(status.getFailures()).isZero();
        assertThat(status.getError()).isNull();
    }

    @Test
    public void testTerminatedClearsExternalId() {
        var helper = new StatusRecorder((r, s) -> {});
        var natGateway = TestUtils.buildNatGateway("nat", TestUtils.CLUSTER_NAME);
        helper.recordResult(natGateway, ReconcileResult.created("nat-1"));
        helper.recordResult(natGateway, ReconcileResult.terminated());
        assertThat(natGateway.getStatus().getExternalId()).isNull();
        assertThat(natGateway.getStatus().getState()).isEqualTo(ResourceState.TERMINATED);
    }

    @Test
    public void testStatusCacheSurvivesStaleResource() {
        var helper = new StatusRecorder((r, s) -> {});
        var natGateway =
                kubernetesClient
                        .resource(TestUtils.buildNatGateway("nat", TestUtils.CLUSTER_NAME))
                        .create();
        helper.updateStatusFromCache(natGateway);
        helper.recordResult(natGateway, ReconcileResult.waiting("nat gateway pending"));
        helper.patchAndCacheStatus(natGateway, kubernetesClient);

        // An informer copy that has not seen the status update yet
        var stale = TestUtils.buildNatGateway("nat", TestUtils.CLUSTER_NAME);
        helper.updateStatusFromCache(stale);
        assertThat(stale.getStatus().getState()).isEqualTo(ResourceState.WAITING);
        assertThat(stale.getStatus().getReason()).isEqualTo("nat gateway pending");
    }

    @Test
    public void testNullLatestResource() {
        var statusRecorder = new StatusRecorder((r, s) -> {});

        var resource = TestUtils.buildNatGateway("nat", TestUtils.CLUSTER_NAME);
        var cause = new KubernetesClientException("dummy");
        assertThatThrownBy(
                        () -> statusRecorder.handleLockingError(resource, kubernetesClient, cause))
                .isInstanceOf(KubernetesClientException.class)
                .hasMessage("Failed to retrieve latest resource")
                .hasCause(cause);
    }
}
