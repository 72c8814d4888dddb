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

package io.kit.operator.api.utils;

import io.kit.operator.api.AutoScalingGroup;
import io.kit.operator.api.ControlPlane;
import io.kit.operator.api.NatGateway;
import io.kit.operator.api.ResourceKind;
import io.kit.operator.api.spec.AutoScalingGroupSpec;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/** Test for {@link ResourceNames}. */
class ResourceNamesTest {

    @Test
    void testDerivedNames() {
        assertThat(ResourceNames.autoScalingGroupName("x")).isEqualTo("x-asg");
        assertThat(ResourceNames.targetGroupName("x")).isEqualTo("x-tg");
        assertThat(ResourceNames.natGatewayName("x")).isEqualTo("x");
        assertThat(ResourceNames.launchTemplateName("x")).isEqualTo("x");
    }

    @Test
    void testClusterNameOf() {
        var cp = new ControlPlane();
        cp.setMetadata(new ObjectMetaBuilder().withName("cluster-x").build());
        assertThat(ResourceNames.clusterNameOf(cp)).isEqualTo("cluster-x");

        var asg = new AutoScalingGroup();
        asg.setSpec(AutoScalingGroupSpec.builder().clusterName("cluster-y").build());
        assertThat(ResourceNames.clusterNameOf(asg)).isEqualTo("cluster-y");

        var nat = new NatGateway();
        nat.getSpec().setClusterName("  ");
        assertThat(ResourceNames.clusterNameOf(nat)).isNull();
    }

    @Test
    void testKindOf() {
        assertThat(ResourceKind.of(new NatGateway())).isEqualTo(ResourceKind.NAT_GATEWAY);
        assertThat(ResourceKind.AUTO_SCALING_GROUP.getKindName()).isEqualTo("AutoScalingGroup");
    }
}
