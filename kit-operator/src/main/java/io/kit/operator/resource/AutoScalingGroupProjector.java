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

import io.kit.operator.api.AutoScalingGroup;
import io.kit.operator.api.ControlPlane;
import io.kit.operator.api.spec.AutoScalingGroupSpec;
import io.kit.operator.api.utils.ResourceNames;
import io.kit.operator.config.KitOperatorConfiguration;

import org.apache.commons.lang3.StringUtils;

/** Projects the autoscaling group running the control plane instances. */
public class AutoScalingGroupProjector extends ChildResourceProjector<AutoScalingGroup> {

    @Override
    protected Class<AutoScalingGroup> childClass() {
        return AutoScalingGroup.class;
    }

    @Override
    protected String component() {
        return "autoscaling-group";
    }

    @Override
    protected String childName(String clusterName) {
        return ResourceNames.autoScalingGroupName(clusterName);
    }

    @Override
    protected AutoScalingGroup buildChild(
            ControlPlane controlPlane, String clusterName, KitOperatorConfiguration conf) {
        var autoScalingGroup = new AutoScalingGroup();
        autoScalingGroup.setSpec(
                AutoScalingGroupSpec.builder()
                        .clusterName(clusterName)
                        .instanceCount(controlPlane.getSpec().getInstanceCount())
                        .launchTemplateName(
                                StringUtils.defaultIfBlank(
                                        controlPlane.getSpec().getLaunchTemplateName(),
                                        ResourceNames.launchTemplateName(clusterName)))
                        .targetGroupName(ResourceNames.targetGroupName(clusterName))
                        .build());
        return autoScalingGroup;
    }

    @Override
    protected boolean correctDrift(ControlPlane controlPlane, AutoScalingGroup existing) {
        int desired = controlPlane.getSpec().getInstanceCount();
        if (existing.getSpec().getInstanceCount() == desired) {
            return false;
        }
        existing.getSpec().setInstanceCount(desired);
        return true;
    }
}
