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

package io.kit.operator.listener;

import io.kit.operator.api.listener.InfrastructureResourceListener;
import io.kit.operator.api.status.InfrastructureStatus;

import org.apache.flink.annotation.VisibleForTesting;

import io.fabric8.kubernetes.api.model.Event;
import lombok.NonNull;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Responsible for logging resource event/status updates. */
public class AuditUtils {
    private static final Logger LOG = LoggerFactory.getLogger(AuditUtils.class);

    public static void logContext(InfrastructureResourceListener.StatusUpdateContext ctx) {
        var previous = ctx.getPreviousStatus();
        var current = ctx.getNewStatus();
        if (previous != null
                && previous.getState() == current.getState()
                && StringUtils.equals(previous.getReason(), current.getReason())
                && StringUtils.equals(previous.getError(), current.getError())) {
            // Unchanged state, nothing to log
            return;
        }
        LOG.info(format(current, ctx.getResource().getKind()));
    }

    public static void logContext(InfrastructureResourceListener.ResourceEventContext ctx) {
        LOG.info(format(ctx.getEvent(), ctx.getResource().getKind()));
    }

    @VisibleForTesting
    static String format(@NonNull InfrastructureStatus status, String kind) {
        var state = status.getState();
        String message;
        if (StringUtils.isNotEmpty(status.getError())) {
            message = status.getError();
        } else if (StringUtils.isNotEmpty(status.getReason())) {
            message = status.getReason();
        } else {
            message = state == null ? "" : state.getDescription();
        }
        return String.format(
                ">>> %-16s | %-7s | %-15s | %s ",
                String.format("Status[%s]", kind),
                StringUtils.isEmpty(status.getError()) ? "Info" : "Error",
                state,
                message);
    }

    @VisibleForTesting
    public static String format(@NonNull Event event, String kind) {
        var componentMessage = String.format("Event[%s]", kind);
        return String.format(
                ">>> %-16s | %-7s | %-15s | %s",
                componentMessage,
                event.getType().equals("Normal") ? "Info" : event.getType(),
                event.getReason().toUpperCase(),
                event.getMessage());
    }
}
