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

package io.kit.operator.api.utils;

import io.kit.operator.api.lifecycle.ResourceState;
import io.kit.operator.api.status.InfrastructureStatus;

import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.ConditionBuilder;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Test for {@link ConditionUtils}. */
class ConditionUtilsTest {

    private Condition getReady(List<Condition> conditions) {
        return conditions.stream()
                .filter(c -> ConditionUtils.CONDITION_TYPE_READY.equals(c.getType()))
                .findFirst()
                .orElse(null);
    }

    @Test
    void testNoStateYieldsNoCondition() {
        var status = new InfrastructureStatus();
        assertTrue(ConditionUtils.createConditionFromStatus(status).isEmpty());
    }

    @Test
    void testCreatedIsReady() {
        var status = new InfrastructureStatus();
        status.setState(ResourceState.CREATED);
        status.setObservedGeneration(3L);

        var condition = getReady(ConditionUtils.createConditionFromStatus(status));
        assertNotNull(condition);
        assertEquals("True", condition.getStatus());
        assertEquals("Created", condition.getReason());
        assertEquals(3L, condition.getObservedGeneration());
        assertNotNull(condition.getLastTransitionTime());
    }

    @Test
    void testWaitingCarriesReason() {
        var status = new InfrastructureStatus();
        status.setState(ResourceState.WAITING);
        status.setReason("waiting for target group");

        var condition = getReady(ConditionUtils.createConditionFromStatus(status));
        assertEquals("False", condition.getStatus());
        assertEquals("Waiting", condition.getReason());
        assertEquals("waiting for target group", condition.getMessage());
    }

    @Test
    void testErrorMessageWinsOverReason() {
        var status = new InfrastructureStatus();
        status.setState(ResourceState.ERROR);
        status.setReason("reason");
        status.setError("boom");

        var condition = getReady(ConditionUtils.createConditionFromStatus(status));
        assertEquals("boom", condition.getMessage());
    }

    @Test
    void testTransitionTimeKeptWhileStatusUnchanged() {
        var status = new InfrastructureStatus();
        status.setState(ResourceState.WAITING);
        status.setConditions(
                new ArrayList<>(
                        List.of(
                                new ConditionBuilder()
                                        .withType(ConditionUtils.CONDITION_TYPE_READY)
                                        .withStatus("False")
                                        .withLastTransitionTime("2020-01-01T00:00:00Z")
                                        .build(),
                                new ConditionBuilder()
                                        .withType("Other")
                                        .withStatus("True")
                                        .build())));

        var conditions = ConditionUtils.createConditionFromStatus(status);
        assertEquals(2, conditions.size());
        assertEquals("2020-01-01T00:00:00Z", getReady(conditions).getLastTransitionTime());

        status.setConditions(conditions);
        status.setState(ResourceState.CREATED);
        var updated = getReady(ConditionUtils.createConditionFromStatus(status));
        assertEquals("True", updated.getStatus());
        assertTrue(!"2020-01-01T00:00:00Z".equals(updated.getLastTransitionTime()));
    }
}
