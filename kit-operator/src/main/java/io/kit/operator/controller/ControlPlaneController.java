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

import io.kit.operator.api.ControlPlane;
import io.kit.operator.api.ResourceKind;
import io.kit.operator.resource.AutoScalingGroupProjector;
import io.kit.operator.resource.ChildResourceProjector;
import io.kit.operator.resource.NatGatewayProjector;
import io.kit.operator.resource.TargetGroupProjector;
import io.kit.operator.utils.EventRecorder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Fans a {@link ControlPlane} out into its child declarative objects. Each child is reconciled
 * against the cloud by the controller registered for its own kind.
 */
public class ControlPlaneController implements ResourceController<ControlPlane> {

    private static final Logger LOG = LoggerFactory.getLogger(ControlPlaneController.class);

    static final String WAITING_FOR_CHILDREN = "waiting for child resources to be removed";

    private final EventRecorder eventRecorder;
    private final List<ChildResourceProjector<?>> projectors;

    public ControlPlaneController(EventRecorder eventRecorder) {
        this(
                eventRecorder,
                List.of(
                        new NatGatewayProjector(),
                        new TargetGroupProjector(),
                        new AutoScalingGroupProjector()));
    }

    public ControlPlaneController(
            EventRecorder eventRecorder, List<ChildResourceProjector<?>> projectors) {
        this.eventRecorder = eventRecorder;
        this.projectors = projectors;
    }

    @Override
    public String name() {
        return "controlplane";
    }

    @Override
    public ResourceKind forKind() {
        return ResourceKind.CONTROL_PLANE;
    }

    @Override
    public ReconcileResult reconcile(ReconcileContext ctx, ControlPlane resource) {
        for (var projector : projectors) {
            ctx.checkNotCancelled();
            var projection =
                    projector.project(
                            ctx.getKubernetesClient(), resource, ctx.getOperatorConfiguration());
            LOG.debug("{} child {}", projector.childKind(), projection);
            if (projection != ChildResourceProjector.Projection.UNCHANGED) {
                eventRecorder.triggerEvent(
                        resource,
                        EventRecorder.Type.Normal,
                        EventRecorder.Reason.ChildProjected,
                        EventRecorder.Component.Operator,
                        String.format(
                                "Child %s %s",
                                projector.childKind(), projection.name().toLowerCase()),
                        ctx.getKubernetesClient());
            }
        }
        return ReconcileResult.created();
    }

    @Override
    public ReconcileResult finalize(ReconcileContext ctx, ControlPlane resource) {
        boolean remaining = false;
        // Reverse order so dependents go first.
        for (int i = projectors.size() - 1; i >= 0; i--) {
            ctx.checkNotCancelled();
            remaining |= projectors.get(i).delete(ctx.getKubernetesClient(), resource);
        }
        if (remaining) {
            return ReconcileResult.waiting(WAITING_FOR_CHILDREN);
        }
        return ReconcileResult.terminated();
    }
}
