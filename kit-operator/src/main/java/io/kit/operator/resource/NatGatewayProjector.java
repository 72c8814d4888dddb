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

package io.kit.operator.resource;

import io.kit.operator.api.ControlPlane;
import io.kit.operator.api.NatGateway;
import io.kit.operator.api.spec.NatGatewaySpec;
import io.kit.operator.api.utils.ResourceNames;
import io.kit.operator.config.KitOperatorConfiguration;

/** Projects the NAT gateway of a control plane. An existing child is left untouched. */
public class NatGatewayProjector extends ChildResourceProjector<NatGateway> {

    @Override
    protected Class<NatGateway> childClass() {
        return NatGateway.class;
    }

    @Override
    protected String component() {
        return "nat-gateway";
    }

    @Override
    protected String childName(String clusterName) {
        return ResourceNames.natGatewayName(clusterName);
    }

    @Override
    protected NatGateway buildChild(
            ControlPlane controlPlane, String clusterName, KitOperatorConfiguration conf) {
        var natGateway = new NatGateway();
        natGateway.setSpec(NatGatewaySpec.builder().clusterName(clusterName).build());
        return natGateway;
    }

    @Override
    protected boolean correctDrift(ControlPlane controlPlane, NatGateway existing) {
        return false;
    }
}
