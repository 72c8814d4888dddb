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

import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.fabric8.kubernetes.client.server.mock.KubernetesMockServer;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.HttpURLConnection;
import java.time.Duration;
import java.util.function.Consumer;

/** Test for {@link EventUtils}. */
@EnableKubernetesMockClient(crud = true)
public class EventUtilsTest {

    private KubernetesMockServer mockServer;
    private KubernetesClient kubernetesClient;
    private Event eventConsumed = null;

    private final Consumer<Event> consumer = event -> eventConsumed = event;

    @Test
    public void testCreateOrReplaceEvent() {
        var autoScalingGroup =
                TestUtils.buildAutoScalingGroup("asg", TestUtils.CLUSTER_NAME, 2, null);
        var reason = "Waiting";
        var message = "waiting for private subnets";
        var eventName =
                EventUtils.eventName(
                        autoScalingGroup,
                        EventRecorder.Type.Normal,
                        reason,
                        message,
                        EventRecorder.Component.Cloud);
        Assertions.assertTrue(createOrUpdate(autoScalingGroup, reason, message, null, null));
        var event = getEvent(eventName);
        Assertions.assertNotNull(event);
        Assertions.assertEquals(eventConsumed, event);
        Assertions.assertEquals(1, event.getCount());
        Assertions.assertEquals(reason, event.getReason());
        Assertions.assertEquals("AutoScalingGroup", event.getInvolvedObject().getKind());
        Assertions.assertEquals("Cloud", event.getSource().getComponent());

        eventConsumed = null;
        Assertions.assertFalse(createOrUpdate(autoScalingGroup, reason, message, null, null));
        event = getEvent(eventName);
        Assertions.assertEquals(eventConsumed, event);
        Assertions.assertEquals(2, event.getCount());

        // A different message is a different event
        Assertions.assertTrue(
                createOrUpdate(autoScalingGroup, reason, "waiting for target group", null, null));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "0", "1800"})
    public void testCreateWithInterval(String intervalString) {
        Duration interval =
                intervalString.isBlank() ? null : Duration.ofSeconds(Long.valueOf(intervalString));
        var natGateway = TestUtils.buildNatGateway("nat", TestUtils.CLUSTER_NAME);
        var reason = "Waiting";
        var messageKey = "nat gateway pending";
        var eventName =
                EventUtils.eventName(
                        natGateway,
                        EventRecorder.Type.Normal,
                        reason,
                        messageKey,
                        EventRecorder.Component.Cloud);

        Assertions.assertTrue(
                createOrUpdate(natGateway, reason, "nat gateway pending", messageKey, interval));
        Assertions.assertEquals(1, getEvent(eventName).getCount());

        eventConsumed = null;
        Assertions.assertFalse(
                createOrUpdate(
                        natGateway, reason, "nat gateway pending (2)", messageKey, interval));
        var event = getEvent(eventName);
        if (interval != null && interval.toMillis() > 0) {
            // Deduplicated within the interval
            Assertions.assertNull(eventConsumed);
            Assertions.assertEquals(1, event.getCount());
            Assertions.assertEquals("nat gateway pending", event.getMessage());
        } else {
            Assertions.assertEquals(eventConsumed, event);
            Assertions.assertEquals(2, event.getCount());
            Assertions.assertEquals("nat gateway pending (2)", event.getMessage());
        }
    }

    @Test
    public void testForbiddenEventsAreIgnored() {
        var natGateway = TestUtils.buildNatGateway("nat", TestUtils.CLUSTER_NAME);
        mockServer
                .expect()
                .post()
                .withPath("/api/v1/namespaces/" + TestUtils.TEST_NAMESPACE + "/events")
                .andReturn(HttpURLConnection.HTTP_FORBIDDEN, null)
                .always();

        eventConsumed = null;
        Assertions.assertTrue(createOrUpdate(natGateway, "Waiting", "boom", null, null));
        Assertions.assertNull(eventConsumed);
        Assertions.assertTrue(
                kubernetesClient
                        .v1()
                        .events()
                        .inNamespace(TestUtils.TEST_NAMESPACE)
                        .list()
                        .getItems()
                        .isEmpty());
    }

    private boolean createOrUpdate(
            HasMetadata target,
            String reason,
            String message,
            String messageKey,
            Duration interval) {
        return EventUtils.emitEvent(
                kubernetesClient,
                target,
                EventRecorder.Type.Normal,
                reason,
                message,
                EventRecorder.Component.Cloud,
                consumer,
                messageKey,
                interval);
    }

    private Event getEvent(String eventName) {
        return kubernetesClient
                .v1()
                .events()
                .inNamespace(TestUtils.TEST_NAMESPACE)
                .withName(eventName)
                .get();
    }
}
