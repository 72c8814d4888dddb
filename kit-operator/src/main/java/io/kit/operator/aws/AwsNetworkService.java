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
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.Address;
import software.amazon.awssdk.services.ec2.model.AllocateAddressRequest;
import software.amazon.awssdk.services.ec2.model.CreateNatGatewayRequest;
import software.amazon.awssdk.services.ec2.model.DeleteNatGatewayRequest;
import software.amazon.awssdk.services.ec2.model.DescribeAddressesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeNatGatewaysRequest;
import software.amazon.awssdk.services.ec2.model.DescribeSubnetsRequest;
import software.amazon.awssdk.services.ec2.model.DescribeVpcsRequest;
import software.amazon.awssdk.services.ec2.model.DomainType;
import software.amazon.awssdk.services.ec2.model.Ec2Exception;
import software.amazon.awssdk.services.ec2.model.Filter;
import software.amazon.awssdk.services.ec2.model.NatGateway;
import software.amazon.awssdk.services.ec2.model.NatGatewayAddress;
import software.amazon.awssdk.services.ec2.model.NatGatewayState;
import software.amazon.awssdk.services.ec2.model.ReleaseAddressRequest;
import software.amazon.awssdk.services.ec2.model.ResourceType;
import software.amazon.awssdk.services.ec2.model.Subnet;
import software.amazon.awssdk.services.ec2.model.Tag;
import software.amazon.awssdk.services.ec2.model.TagSpecification;
import software.amazon.awssdk.services.ec2.model.Vpc;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/** {@link NetworkService} backed by the AWS SDK EC2 client. */
public class AwsNetworkService implements NetworkService {

    private static final Logger LOG = LoggerFactory.getLogger(AwsNetworkService.class);

    static final String ALLOCATION_NOT_FOUND = "InvalidAllocationID.NotFound";
    static final String NAT_GATEWAY_NOT_FOUND = "NatGatewayNotFound";

    private final Ec2Client client;

    public AwsNetworkService(Ec2Client client) {
        this.client = client;
    }

    @Override
    public List<String> getSubnetIds(String clusterName, AwsTags.SubnetType type) {
        var response =
                client.describeSubnets(
                        DescribeSubnetsRequest.builder()
                                .filters(
                                        tagFilter(AwsTags.CLUSTER_NAME, clusterName),
                                        tagFilter(AwsTags.SUBNET_TYPE, type.tagValue()))
                                .build());
        return response.subnets().stream()
                .map(Subnet::subnetId)
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    public Optional<String> getVpcId(String clusterName) {
        var response =
                client.describeVpcs(
                        DescribeVpcsRequest.builder()
                                .filters(tagFilter(AwsTags.CLUSTER_NAME, clusterName))
                                .build());
        return response.vpcs().stream().map(Vpc::vpcId).findFirst();
    }

    @Override
    public List<NatGatewayDescription> describeNatGateways(
            String name, Collection<NatGatewayState> states) {
        var response =
                client.describeNatGateways(
                        DescribeNatGatewaysRequest.builder()
                                .filter(
                                        tagFilter(AwsTags.NAME, name),
                                        Filter.builder()
                                                .name("state")
                                                .values(
                                                        states.stream()
                                                                .map(NatGatewayState::toString)
                                                                .collect(Collectors.toList()))
                                                .build())
                                .build());
        return response.natGateways().stream()
                .map(AwsNetworkService::toDescription)
                .collect(Collectors.toList());
    }

    @Override
    public NatGatewayDescription createNatGateway(
            String name,
            String clusterName,
            String subnetId,
            String allocationId,
            String clientToken) {
        var response =
                client.createNatGateway(
                        CreateNatGatewayRequest.builder()
                                .subnetId(subnetId)
                                .allocationId(allocationId)
                                .clientToken(clientToken)
                                .tagSpecifications(
                                        tagSpecification(
                                                ResourceType.NATGATEWAY, name, clusterName))
                                .build());
        return toDescription(response.natGateway());
    }

    @Override
    public void deleteNatGateway(String natGatewayId) {
        try {
            client.deleteNatGateway(
                    DeleteNatGatewayRequest.builder().natGatewayId(natGatewayId).build());
        } catch (Ec2Exception e) {
            if (!hasErrorCode(e, NAT_GATEWAY_NOT_FOUND)) {
                throw e;
            }
            LOG.debug("NAT gateway {} already gone", natGatewayId);
        }
    }

    @Override
    public List<ElasticIpDescription> describeElasticIps(String name) {
        var response =
                client.describeAddresses(
                        DescribeAddressesRequest.builder()
                                .filters(tagFilter(AwsTags.NAME, name))
                                .build());
        return response.addresses().stream()
                .map(AwsNetworkService::toDescription)
                .collect(Collectors.toList());
    }

    @Override
    public String allocateElasticIp(String name, String clusterName) {
        return client.allocateAddress(
                        AllocateAddressRequest.builder()
                                .domain(DomainType.VPC)
                                .tagSpecifications(
                                        tagSpecification(
                                                ResourceType.ELASTIC_IP, name, clusterName))
                                .build())
                .allocationId();
    }

    @Override
    public void releaseElasticIp(String allocationId) {
        try {
            client.releaseAddress(
                    ReleaseAddressRequest.builder().allocationId(allocationId).build());
        } catch (Ec2Exception e) {
            if (!hasErrorCode(e, ALLOCATION_NOT_FOUND)) {
                throw e;
            }
            LOG.debug("Elastic IP {} already released", allocationId);
        }
    }

    static boolean hasErrorCode(Ec2Exception e, String errorCode) {
        return e.awsErrorDetails() != null && errorCode.equals(e.awsErrorDetails().errorCode());
    }

    private static Filter tagFilter(String key, String value) {
        return Filter.builder().name(AwsTags.tagFilter(key)).values(value).build();
    }

    private static TagSpecification tagSpecification(
            ResourceType resourceType, String name, String clusterName) {
        return TagSpecification.builder()
                .resourceType(resourceType)
                .tags(
                        AwsTags.forResource(name, clusterName).entrySet().stream()
                                .map(e -> Tag.builder().key(e.getKey()).value(e.getValue()).build())
                                .collect(Collectors.toList()))
                .build();
    }

    private static NatGatewayDescription toDescription(NatGateway natGateway) {
        return NatGatewayDescription.builder()
                .id(natGateway.natGatewayId())
                .state(natGateway.state())
                .subnetId(natGateway.subnetId())
                .allocationId(
                        natGateway.natGatewayAddresses().stream()
                                .map(NatGatewayAddress::allocationId)
                                .findFirst()
                                .orElse(null))
                .build();
    }

    private static ElasticIpDescription toDescription(Address address) {
        return ElasticIpDescription.builder()
                .allocationId(address.allocationId())
                .publicIp(address.publicIp())
                .associationId(address.associationId())
                .build();
    }
}
