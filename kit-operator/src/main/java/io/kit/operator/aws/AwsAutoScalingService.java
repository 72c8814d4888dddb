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

package io.kit.operator.aws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.autoscaling.AutoScalingClient;
import software.amazon.awssdk.services.autoscaling.model.AttachLoadBalancerTargetGroupsRequest;
import software.amazon.awssdk.services.autoscaling.model.AutoScalingGroup;
import software.amazon.awssdk.services.autoscaling.model.CreateAutoScalingGroupRequest;
import software.amazon.awssdk.services.autoscaling.model.DeleteAutoScalingGroupRequest;
import software.amazon.awssdk.services.autoscaling.model.DescribeAutoScalingGroupsRequest;
import software.amazon.awssdk.services.autoscaling.model.DescribeLoadBalancerTargetGroupsRequest;
import software.amazon.awssdk.services.autoscaling.model.DetachLoadBalancerTargetGroupsRequest;
import software.amazon.awssdk.services.autoscaling.model.LaunchTemplateSpecification;
import software.amazon.awssdk.services.autoscaling.model.LoadBalancerTargetGroupState;
import software.amazon.awssdk.services.autoscaling.model.SetDesiredCapacityRequest;
import software.amazon.awssdk.services.autoscaling.model.Tag;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/** {@link AutoScalingService} backed by the AWS SDK autoscaling client. */
public class AwsAutoScalingService implements AutoScalingService {

    private static final Logger LOG = LoggerFactory.getLogger(AwsAutoScalingService.class);

    private static final String LATEST_LAUNCH_TEMPLATE_VERSION = "$Latest";
    private static final String RESOURCE_TYPE = "auto-scaling-group";

    private final AutoScalingClient client;

    public AwsAutoScalingService(AutoScalingClient client) {
        this.client = client;
    }

    @Override
    public List<AutoScalingGroupDescription> describeAutoScalingGroups(String name) {
        var response =
                client.describeAutoScalingGroups(
                        DescribeAutoScalingGroupsRequest.builder()
                                .autoScalingGroupNames(name)
                                .build());
        return response.autoScalingGroups().stream()
                .map(AwsAutoScalingService::toDescription)
                .collect(Collectors.toList());
    }

    @Override
    public void createAutoScalingGroup(AutoScalingGroupDefinition definition) {
        var tags =
                definition.getTags().entrySet().stream()
                        .map(
                                e ->
                                        Tag.builder()
                                                .resourceId(definition.getName())
                                                .resourceType(RESOURCE_TYPE)
                                                .key(e.getKey())
                                                .value(e.getValue())
                                                .propagateAtLaunch(true)
                                                .build())
                        .collect(Collectors.toList());

        client.createAutoScalingGroup(
                CreateAutoScalingGroupRequest.builder()
                        .autoScalingGroupName(definition.getName())
                        .desiredCapacity(definition.getDesiredCapacity())
                        .minSize(definition.getMinSize())
                        .maxSize(definition.getMaxSize())
                        .launchTemplate(
                                LaunchTemplateSpecification.builder()
                                        .launchTemplateName(definition.getLaunchTemplateName())
                                        .version(LATEST_LAUNCH_TEMPLATE_VERSION)
                                        .build())
                        .vpcZoneIdentifier(String.join(",", definition.getSubnetIds()))
                        .tags(tags)
                        .build());
        LOG.debug("Create request accepted for autoscaling group {}", definition.getName());
    }

    @Override
    public void deleteAutoScalingGroup(String name, boolean forceDelete) {
        client.deleteAutoScalingGroup(
                DeleteAutoScalingGroupRequest.builder()
                        .autoScalingGroupName(name)
                        .forceDelete(forceDelete)
                        .build());
    }

    @Override
    public void setDesiredCapacity(String name, int desiredCapacity) {
        client.setDesiredCapacity(
                SetDesiredCapacityRequest.builder()
                        .autoScalingGroupName(name)
                        .desiredCapacity(desiredCapacity)
                        .build());
    }

    @Override
    public List<String> describeAttachedTargetGroups(String name) {
        var response =
                client.describeLoadBalancerTargetGroups(
                        DescribeLoadBalancerTargetGroupsRequest.builder()
                                .autoScalingGroupName(name)
                                .build());
        return response.loadBalancerTargetGroups().stream()
                .map(LoadBalancerTargetGroupState::loadBalancerTargetGroupARN)
                .collect(Collectors.toList());
    }

    @Override
    public void attachTargetGroups(String name, Collection<String> targetGroupArns) {
        client.attachLoadBalancerTargetGroups(
                AttachLoadBalancerTargetGroupsRequest.builder()
                        .autoScalingGroupName(name)
                        .targetGroupARNs(targetGroupArns)
                        .build());
    }

    @Override
    public void detachTargetGroups(String name, Collection<String> targetGroupArns) {
        client.detachLoadBalancerTargetGroups(
                DetachLoadBalancerTargetGroupsRequest.builder()
                        .autoScalingGroupName(name)
                        .targetGroupARNs(targetGroupArns)
                        .build());
    }

    private static AutoScalingGroupDescription toDescription(AutoScalingGroup group) {
        return AutoScalingGroupDescription.builder()
                .name(group.autoScalingGroupName())
                .arn(group.autoScalingGroupARN())
                .status(group.status())
                .desiredCapacity(group.desiredCapacity() == null ? 0 : group.desiredCapacity())
                .targetGroupArns(group.targetGroupARNs())
                .build();
    }
}
