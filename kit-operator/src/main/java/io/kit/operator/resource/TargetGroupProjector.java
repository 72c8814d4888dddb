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
import io.kit.operator.api.TargetGroup;
import io.kit.operator.api.spec.TargetGroupSpec;
import io.kit.operator.api.utils.ResourceNames;
import io.kit.operator.config.KitOperatorConfiguration;

/**
 * Projects the target group the API servers register in. Port and protocol are immutable on the
 * provider side, so an existing child is never rewritten.
 */
public class TargetGroupProjector extends ChildResourceProjector<TargetGroup> {

    @Override
    protected Class<TargetGroup> childClass() {
        return TargetGroup.class;
    }

    @Override
    protected String component() {
        return "target-group";
    }

    @Override
    protected String childName(String clusterName) {
        return ResourceNames.targetGroupName(clusterName);
    }

    @Override
    protected TargetGroup buildChild(
            ControlPlane controlPlane, String clusterName, KitOperatorConfiguration conf) {
        var port = controlPlane.getSpec().getTargetGroupPort();
        var targetGroup = new TargetGroup();
        targetGroup.setSpec(
                TargetGroupSpec.builder()
                        .clusterName(clusterName)
                        .port(port != null ? port : conf.getTargetGroupDefaultPort())
                        .protocol(conf.getTargetGroupDefaultProtocol())
                        .build());
        return targetGroup;
    }

    @Override
    protected boolean correctDrift(ControlPlane controlPlane, TargetGroup existing) {
        return false;
    }
}
