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

import io.kit.operator.api.NatGateway;
import io.kit.operator.api.ResourceKind;
import io.kit.operator.api.utils.ResourceNames;
import io.kit.operator.aws.AwsTags;
import io.kit.operator.aws.ElasticIpDescription;
import io.kit.operator.aws.NatGatewayDescription;
import io.kit.operator.aws.NetworkService;

import org.apache.commons.lang3.StringUtils;
import org.apache.flink.annotation.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.ec2.model.NatGatewayState;

import java.util.EnumSet;
import java.util.Set;

/**
 * Converges a NAT gateway in a public subnet of the cluster together with the elastic IP it is
 * bound to. Both carry the {@code Name} tag of the {@link NatGateway} object.
 */
public class NatGatewayController implements ResourceController<NatGateway> {

    private static final Logger LOG = LoggerFactory.getLogger(NatGatewayController.class);

    static final String WAITING_FOR_PUBLIC_SUBNET = "waiting for public subnet";
    static final String NAT_GATEWAY_PENDING = "nat gateway pending";
    static final String NAT_GATEWAY_DELETING = "nat gateway deleting";

    static final int MAX_CLIENT_TOKEN_LENGTH = 64;

    private static final Set<NatGatewayState> LIVE_STATES =
            EnumSet.of(NatGatewayState.PENDING, NatGatewayState.AVAILABLE);

    private final NetworkService network;

    public NatGatewayController(NetworkService network) {
        this.network = network;
    }

    @Override
    public String name() {
        return "natgateway";
    }

    @Override
    public ResourceKind forKind() {
        return ResourceKind.NAT_GATEWAY;
    }

    @Override
    public ReconcileResult reconcile(ReconcileContext ctx, NatGateway resource) {
        var name = resource.getMetadata().getName();
        var gateways = network.describeNatGateways(name, LIVE_STATES);
        if (gateways.size() > 1) {
            return ReconcileResult.fatal(
                    String.format(
                            "Found %d live nat gateways named %s, expected at most one",
                            gateways.size(), name));
        }
        if (gateways.size() == 1) {
            var gateway = gateways.get(0);
            if (gateway.getState() == NatGatewayState.AVAILABLE) {
                return ReconcileResult.created(gateway.getId());
            }
            return ReconcileResult.waiting(NAT_GATEWAY_PENDING, gateway.getId());
        }

        var clusterName = ResourceNames.clusterNameOf(resource);
        ctx.checkNotCancelled();
        var subnetIds = network.getSubnetIds(clusterName, AwsTags.SubnetType.PUBLIC);
        if (subnetIds.isEmpty()) {
            LOG.info("No public subnets found for cluster {}", clusterName);
            return ReconcileResult.waiting(WAITING_FOR_PUBLIC_SUBNET);
        }

        ctx.checkNotCancelled();
        var allocationId =
                network.describeElasticIps(name).stream()
                        .findFirst()
                        .map(ElasticIpDescription::getAllocationId)
                        .orElseGet(
                                () -> {
                                    LOG.info("Allocating elastic ip {}", name);
                                    return network.allocateElasticIp(name, clusterName);
                                });

        ctx.checkNotCancelled();
        var clientToken = clientToken(resource);
        LOG.info(
                "Creating nat gateway {} in subnet {} with client token {}",
                name,
                subnetIds.get(0),
                clientToken);
        NatGatewayDescription created =
                network.createNatGateway(
                        name, clusterName, subnetIds.get(0), allocationId, clientToken);
        if (!LIVE_STATES.contains(created.getState())) {
            return ReconcileResult.fatal(
                    String.format(
                            "Nat gateway %s created for token %s is %s",
                            created.getId(), clientToken, created.getState()));
        }
        return ReconcileResult.waiting(NAT_GATEWAY_PENDING, created.getId());
    }

    @Override
    public ReconcileResult finalize(ReconcileContext ctx, NatGateway resource) {
        var name = resource.getMetadata().getName();
        var live = network.describeNatGateways(name, LIVE_STATES);
        if (!live.isEmpty()) {
            for (var gateway : live) {
                ctx.checkNotCancelled();
                LOG.info("Deleting nat gateway {}", gateway.getId());
                network.deleteNatGateway(gateway.getId());
            }
            return ReconcileResult.waiting(NAT_GATEWAY_DELETING);
        }

        ctx.checkNotCancelled();
        if (!network.describeNatGateways(name, EnumSet.of(NatGatewayState.DELETING)).isEmpty()) {
            return ReconcileResult.waiting(NAT_GATEWAY_DELETING);
        }

        ctx.checkNotCancelled();
        for (var elasticIp : network.describeElasticIps(name)) {
            ctx.checkNotCancelled();
            LOG.info("Releasing elastic ip {}", elasticIp.getAllocationId());
            network.releaseElasticIp(elasticIp.getAllocationId());
        }
        return ReconcileResult.terminated();
    }

    /**
     * Idempotency token scoped to one incarnation of the object, so a deleted and recreated object
     * with the same name gets a new gateway instead of the deleted one.
     */
    @VisibleForTesting
    static String clientToken(NatGateway resource) {
        var meta = resource.getMetadata();
        return StringUtils.left(meta.getName() + "-" + meta.getUid(), MAX_CLIENT_TOKEN_LENGTH);
    }
}
