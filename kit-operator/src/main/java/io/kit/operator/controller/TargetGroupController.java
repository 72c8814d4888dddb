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

import io.kit.operator.api.ResourceKind;
import io.kit.operator.api.TargetGroup;
import io.kit.operator.api.utils.ResourceNames;
import io.kit.operator.aws.AwsTags;
import io.kit.operator.aws.LoadBalancingService;
import io.kit.operator.aws.NetworkService;
import io.kit.operator.aws.TargetGroupDefinition;
import io.kit.operator.aws.TargetGroupDescription;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DuplicateTargetGroupNameException;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.ResourceInUseException;

import java.util.Objects;

/** Converges a load balancer target group named after the {@link TargetGroup} object. */
public class TargetGroupController implements ResourceController<TargetGroup> {

    private static final Logger LOG = LoggerFactory.getLogger(TargetGroupController.class);

    static final String WAITING_FOR_VPC = "waiting for vpc";
    static final String WAITING_FOR_TARGET_GROUP = "waiting for target group to become visible";
    static final String TARGET_GROUP_IN_USE = "target group still in use";

    private final LoadBalancingService loadBalancing;
    private final NetworkService network;

    public TargetGroupController(LoadBalancingService loadBalancing, NetworkService network) {
        this.loadBalancing = loadBalancing;
        this.network = network;
    }

    @Override
    public String name() {
        return "targetgroup";
    }

    @Override
    public ResourceKind forKind() {
        return ResourceKind.TARGET_GROUP;
    }

    @Override
    public ReconcileResult reconcile(ReconcileContext ctx, TargetGroup resource) {
        var name = resource.getMetadata().getName();
        var config = ctx.getOperatorConfiguration();
        int port =
                resource.getSpec().getPort() > 0
                        ? resource.getSpec().getPort()
                        : config.getTargetGroupDefaultPort();
        var protocol =
                StringUtils.defaultIfBlank(
                        resource.getSpec().getProtocol(), config.getTargetGroupDefaultProtocol());

        var existing = loadBalancing.describeTargetGroup(name);
        if (existing.isPresent()) {
            return verify(existing.get(), port, protocol);
        }

        var clusterName = ResourceNames.clusterNameOf(resource);
        ctx.checkNotCancelled();
        var vpcId = network.getVpcId(clusterName);
        if (vpcId.isEmpty()) {
            LOG.info("No vpc found for cluster {}", clusterName);
            return ReconcileResult.waiting(WAITING_FOR_VPC);
        }

        var definition =
                TargetGroupDefinition.builder()
                        .name(name)
                        .port(port)
                        .protocol(protocol)
                        .vpcId(vpcId.get())
                        .tags(AwsTags.forResource(name, clusterName))
                        .build();
        ctx.checkNotCancelled();
        try {
            LOG.info("Creating target group {} on {}:{}", name, protocol, port);
            var created = loadBalancing.createTargetGroup(definition);
            return ReconcileResult.created(created.getArn());
        } catch (DuplicateTargetGroupNameException e) {
            LOG.info("Target group {} was created concurrently", name);
            return loadBalancing
                    .describeTargetGroup(name)
                    .map(tg -> verify(tg, port, protocol))
                    .orElseGet(() -> ReconcileResult.waiting(WAITING_FOR_TARGET_GROUP));
        }
    }

    private static ReconcileResult verify(
            TargetGroupDescription targetGroup, int port, String protocol) {
        if (!Objects.equals(targetGroup.getPort(), port)
                || !protocol.equalsIgnoreCase(targetGroup.getProtocol())) {
            return ReconcileResult.fatal(
                    String.format(
                            "Target group %s listens on %s:%s but %s:%s is desired, "
                                    + "port and protocol cannot be changed in place, "
                                    + "delete the object to replace the target group",
                            targetGroup.getName(),
                            targetGroup.getProtocol(),
                            targetGroup.getPort(),
                            protocol,
                            port));
        }
        return ReconcileResult.created(targetGroup.getArn());
    }

    @Override
    public ReconcileResult finalize(ReconcileContext ctx, TargetGroup resource) {
        var name = resource.getMetadata().getName();
        var existing = loadBalancing.describeTargetGroup(name);
        if (existing.isEmpty()) {
            return ReconcileResult.terminated();
        }
        ctx.checkNotCancelled();
        try {
            LOG.info("Deleting target group {}", name);
            loadBalancing.deleteTargetGroup(existing.get().getArn());
        } catch (ResourceInUseException e) {
            LOG.info("Target group {} is still in use: {}", name, e.getMessage());
            return ReconcileResult.waiting(TARGET_GROUP_IN_USE);
        }
        return ReconcileResult.terminated();
    }
}
