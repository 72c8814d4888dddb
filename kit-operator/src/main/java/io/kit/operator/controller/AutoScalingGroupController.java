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

import io.kit.operator.api.AutoScalingGroup;
import io.kit.operator.api.ResourceKind;
import io.kit.operator.api.utils.ResourceNames;
import io.kit.operator.aws.AutoScalingGroupDefinition;
import io.kit.operator.aws.AutoScalingGroupDescription;
import io.kit.operator.aws.AutoScalingService;
import io.kit.operator.aws.AwsTags;
import io.kit.operator.aws.LoadBalancingService;
import io.kit.operator.aws.NetworkService;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.autoscaling.model.AlreadyExistsException;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Converges an autoscaling group named after the {@link AutoScalingGroup} object. Every pass is
 * derived from what the provider reports, nothing is carried over between passes.
 */
public class AutoScalingGroupController implements ResourceController<AutoScalingGroup> {

    private static final Logger LOG = LoggerFactory.getLogger(AutoScalingGroupController.class);

    static final String WAITING_FOR_SUBNETS = "waiting for private subnets";
    static final String WAITING_FOR_TARGET_GROUP = "waiting for target group";
    static final String DETACHED_STALE_TARGET_GROUP = "detached stale target group";
    static final String WAITING_FOR_DELETION = "waiting for previous autoscaling group deletion";

    private final AutoScalingService autoScaling;
    private final LoadBalancingService loadBalancing;
    private final NetworkService network;

    public AutoScalingGroupController(
            AutoScalingService autoScaling,
            LoadBalancingService loadBalancing,
            NetworkService network) {
        this.autoScaling = autoScaling;
        this.loadBalancing = loadBalancing;
        this.network = network;
    }

    @Override
    public String name() {
        return "autoscalinggroup";
    }

    @Override
    public ResourceKind forKind() {
        return ResourceKind.AUTO_SCALING_GROUP;
    }

    @Override
    public ReconcileResult reconcile(ReconcileContext ctx, AutoScalingGroup resource) {
        var name = resource.getMetadata().getName();
        var spec = resource.getSpec();
        var clusterName = ResourceNames.clusterNameOf(resource);

        var matches = autoScaling.describeAutoScalingGroups(name);
        if (matches.size() > 1) {
            return ReconcileResult.fatal(
                    String.format(
                            "Found %d autoscaling groups named %s, expected at most one",
                            matches.size(), name));
        }

        Optional<AutoScalingGroupDescription> existing = matches.stream().findFirst();
        if (existing.isPresent() && existing.get().isDeleteInProgress()) {
            LOG.info("Autoscaling group {} is being deleted, waiting before recreating it", name);
            return ReconcileResult.waiting(WAITING_FOR_DELETION);
        }
        if (existing.isEmpty()) {
            ctx.checkNotCancelled();
            var subnetIds = network.getSubnetIds(clusterName, AwsTags.SubnetType.PRIVATE);
            if (subnetIds.isEmpty()) {
                LOG.info("No private subnets found for cluster {}", clusterName);
                return ReconcileResult.waiting(WAITING_FOR_SUBNETS);
            }
            ctx.checkNotCancelled();
            create(ctx, resource, clusterName, subnetIds);
        } else if (existing.get().getDesiredCapacity() != spec.getInstanceCount()) {
            LOG.info(
                    "Desired capacity is {}, expected {}, correcting",
                    existing.get().getDesiredCapacity(),
                    spec.getInstanceCount());
            ctx.checkNotCancelled();
            autoScaling.setDesiredCapacity(name, spec.getInstanceCount());
        }

        ctx.checkNotCancelled();
        var attached = autoScaling.describeAttachedTargetGroups(name);
        var expectedName =
                StringUtils.defaultIfBlank(
                        spec.getTargetGroupName(), ResourceNames.targetGroupName(clusterName));
        ctx.checkNotCancelled();
        var expected = loadBalancing.describeTargetGroup(expectedName);
        if (expected.isEmpty()) {
            LOG.info("Target group {} does not exist yet", expectedName);
            return ReconcileResult.waiting(WAITING_FOR_TARGET_GROUP);
        }

        var expectedArn = expected.get().getArn();
        List<String> stale =
                attached.stream()
                        .filter(arn -> !arn.equals(expectedArn))
                        .collect(Collectors.toList());
        if (!stale.isEmpty()) {
            LOG.info("Detaching stale target groups {}", stale);
            ctx.checkNotCancelled();
            autoScaling.detachTargetGroups(name, stale);
            return ReconcileResult.waiting(DETACHED_STALE_TARGET_GROUP);
        }

        if (attached.isEmpty()) {
            LOG.info("Attaching target group {}", expectedArn);
            ctx.checkNotCancelled();
            autoScaling.attachTargetGroups(name, List.of(expectedArn));
        }

        return ReconcileResult.created(
                existing.map(AutoScalingGroupDescription::getArn).orElse(null));
    }

    private void create(
            ReconcileContext ctx,
            AutoScalingGroup resource,
            String clusterName,
            List<String> subnetIds) {
        var config = ctx.getOperatorConfiguration();
        var name = resource.getMetadata().getName();
        var definition =
                AutoScalingGroupDefinition.builder()
                        .name(name)
                        .desiredCapacity(resource.getSpec().getInstanceCount())
                        .minSize(config.getAutoScalingGroupMinSize())
                        .maxSize(config.getAutoScalingGroupMaxSize())
                        .launchTemplateName(
                                StringUtils.defaultIfBlank(
                                        resource.getSpec().getLaunchTemplateName(),
                                        ResourceNames.launchTemplateName(clusterName)))
                        .subnetIds(subnetIds)
                        .tags(AwsTags.forResource(name, clusterName))
                        .build();
        try {
            LOG.info("Creating autoscaling group {} in subnets {}", name, subnetIds);
            autoScaling.createAutoScalingGroup(definition);
        } catch (AlreadyExistsException e) {
            LOG.info("Autoscaling group {} was created concurrently", name);
        }
    }

    @Override
    public ReconcileResult finalize(ReconcileContext ctx, AutoScalingGroup resource) {
        var name = resource.getMetadata().getName();
        var existing = autoScaling.describeAutoScalingGroups(name);
        for (var group : existing) {
            if (group.isDeleteInProgress()) {
                LOG.info("Autoscaling group {} is already being deleted", name);
                continue;
            }
            ctx.checkNotCancelled();
            LOG.info("Force deleting autoscaling group {}", name);
            autoScaling.deleteAutoScalingGroup(name, true);
        }
        return ReconcileResult.terminated();
    }
}
