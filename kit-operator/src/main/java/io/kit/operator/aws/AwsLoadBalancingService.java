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
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.CreateTargetGroupRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DeleteTargetGroupRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeTargetGroupsRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.Tag;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.TargetGroupNotFoundException;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.TargetTypeEnum;

import java.util.Optional;
import java.util.stream.Collectors;

/** {@link LoadBalancingService} backed by the AWS SDK elbv2 client. */
public class AwsLoadBalancingService implements LoadBalancingService {

    private static final Logger LOG = LoggerFactory.getLogger(AwsLoadBalancingService.class);

    private final ElasticLoadBalancingV2Client client;

    public AwsLoadBalancingService(ElasticLoadBalancingV2Client client) {
        this.client = client;
    }

    @Override
    public Optional<TargetGroupDescription> describeTargetGroup(String name) {
        try {
            var response =
                    client.describeTargetGroups(
                            DescribeTargetGroupsRequest.builder().names(name).build());
            return response.targetGroups().stream()
                    .findFirst()
                    .map(AwsLoadBalancingService::toDescription);
        } catch (TargetGroupNotFoundException e) {
            LOG.debug("Target group {} not found", name);
            return Optional.empty();
        }
    }

    @Override
    public TargetGroupDescription createTargetGroup(TargetGroupDefinition definition) {
        var tags =
                definition.getTags().entrySet().stream()
                        .map(e -> Tag.builder().key(e.getKey()).value(e.getValue()).build())
                        .collect(Collectors.toList());
        var response =
                client.createTargetGroup(
                        CreateTargetGroupRequest.builder()
                                .name(definition.getName())
                                .port(definition.getPort())
                                .protocol(definition.getProtocol())
                                .vpcId(definition.getVpcId())
                                .targetType(TargetTypeEnum.INSTANCE)
                                .tags(tags)
                                .build());
        return toDescription(response.targetGroups().get(0));
    }

    @Override
    public void deleteTargetGroup(String arn) {
        client.deleteTargetGroup(DeleteTargetGroupRequest.builder().targetGroupArn(arn).build());
    }

    private static TargetGroupDescription toDescription(
            software.amazon.awssdk.services.elasticloadbalancingv2.model.TargetGroup targetGroup) {
        return TargetGroupDescription.builder()
                .name(targetGroup.targetGroupName())
                .arn(targetGroup.targetGroupArn())
                .port(targetGroup.port())
                .protocol(targetGroup.protocolAsString())
                .build();
    }
}
