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
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/** Creates the Ready condition object from the state, reason and error of a status. */
public class ConditionUtils {
    public static final String CONDITION_TYPE_READY = "Ready";

    /**
     * Computes the Ready condition for the given status. The last transition time of the existing
     * condition is kept unless the condition status flips.
     *
     * @param status the status holding the state of the last reconcile pass
     * @return the conditions to store on the status
     */
    public static List<Condition> createConditionFromStatus(InfrastructureStatus status) {
        if (status.getState() == null) {
            return status.getConditions() == null ? List.of() : status.getConditions();
        }
        var condition = getReadyCondition(status);
        var existing = findReadyCondition(status.getConditions());
        condition.setLastTransitionTime(getLastTransitionTimeStamp(existing, condition));

        var conditions = new ArrayList<Condition>();
        if (status.getConditions() != null) {
            status.getConditions().stream()
                    .filter(c -> !CONDITION_TYPE_READY.equals(c.getType()))
                    .forEach(conditions::add);
        }
        conditions.add(condition);
        return conditions;
    }

    private static Condition getReadyCondition(InfrastructureStatus status) {
        var state = status.getState();
        String message =
                StringUtils.firstNonBlank(
                        status.getError(), status.getReason(), state.getDescription());
        return new ConditionBuilder()
                .withType(CONDITION_TYPE_READY)
                .withStatus(state == ResourceState.CREATED ? "True" : "False")
                .withReason(toCamelCase(state.name()))
                .withMessage(message)
                .withObservedGeneration(status.getObservedGeneration())
                .build();
    }

    private static Condition findReadyCondition(List<Condition> conditions) {
        if (conditions == null) {
            return null;
        }
        return conditions.stream()
                .filter(c -> CONDITION_TYPE_READY.equals(c.getType()))
                .findFirst()
                .orElse(null);
    }

    /** Reason in the condition object should be a CamelCase string. */
    private static String toCamelCase(String reason) {
        reason = reason.toLowerCase();
        return reason.substring(0, 1).toUpperCase() + reason.substring(1);
    }

    private static String getLastTransitionTimeStamp(
            Condition existingCondition, Condition condition) {
        if (existingCondition == null
                || !existingCondition.getStatus().equals(condition.getStatus())) {
            return Instant.now().truncatedTo(ChronoUnit.SECONDS).toString();
        }
        return existingCondition.getLastTransitionTime();
    }
}
