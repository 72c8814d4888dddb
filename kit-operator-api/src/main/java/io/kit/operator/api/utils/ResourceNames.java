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

import io.kit.operator.api.AbstractInfrastructureResource;
import io.kit.operator.api.ControlPlane;
import io.kit.operator.api.spec.ClusterScopedSpec;

import org.apache.commons.lang3.StringUtils;

/**
 * Deterministic naming of the resources that make up a cluster. Every name is derived from the
 * cluster name so a repeated projection always targets the same objects.
 */
public class ResourceNames {

    public static final String AUTO_SCALING_GROUP_SUFFIX = "-asg";
    public static final String TARGET_GROUP_SUFFIX = "-tg";

    public static String autoScalingGroupName(String clusterName) {
        return clusterName + AUTO_SCALING_GROUP_SUFFIX;
    }

    public static String targetGroupName(String clusterName) {
        return clusterName + TARGET_GROUP_SUFFIX;
    }

    /** The NAT gateway shares the control plane's name. */
    public static String natGatewayName(String clusterName) {
        return clusterName;
    }

    public static String launchTemplateName(String clusterName) {
        return clusterName;
    }

    /**
     * Returns the name of the cluster a resource belongs to.
     *
     * @param resource Control plane or cluster scoped child resource.
     * @return The cluster name, or null if the child spec does not name one.
     */
    public static String clusterNameOf(AbstractInfrastructureResource<?, ?> resource) {
        if (resource instanceof ControlPlane) {
            return resource.getMetadata().getName();
        }
        var spec = resource.getSpec();
        if (spec instanceof ClusterScopedSpec) {
            return StringUtils.trimToNull(((ClusterScopedSpec) spec).getClusterName());
        }
        return null;
    }
}
