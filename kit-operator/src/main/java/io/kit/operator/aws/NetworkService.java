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

import software.amazon.awssdk.services.ec2.model.NatGatewayState;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/** Typed access to the EC2 networking calls: subnets, VPCs, NAT gateways and elastic IPs. */
public interface NetworkService {

    /** Returns the ids of the cluster's subnets of the given type. */
    List<String> getSubnetIds(String clusterName, AwsTags.SubnetType type);

    /** Returns the id of the VPC tagged with the cluster name. */
    Optional<String> getVpcId(String clusterName);

    /**
     * Describes NAT gateways by Name tag.
     *
     * @param name Value of the Name tag.
     * @param states States to include.
     * @return Matching gateways.
     */
    List<NatGatewayDescription> describeNatGateways(
            String name, Collection<NatGatewayState> states);

    /**
     * Creates a NAT gateway. Repeated calls with the same client token return the gateway created
     * by the first call, whatever state it is in now.
     *
     * @param clientToken Idempotency token, at most 64 characters.
     */
    NatGatewayDescription createNatGateway(
            String name,
            String clusterName,
            String subnetId,
            String allocationId,
            String clientToken);

    void deleteNatGateway(String natGatewayId);

    /** Looks up every elastic IP carrying the given Name tag. */
    List<ElasticIpDescription> describeElasticIps(String name);

    /** Allocates a VPC elastic IP tagged with the name and cluster, returns the allocation id. */
    String allocateElasticIp(String name, String clusterName);

    void releaseElasticIp(String allocationId);
}
