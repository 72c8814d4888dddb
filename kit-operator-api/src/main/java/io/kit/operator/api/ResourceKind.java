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

package io.kit.operator.api;

import io.fabric8.kubernetes.api.model.HasMetadata;
import lombok.Getter;

/** The closed set of resource kinds handled by the operator. */
public enum ResourceKind {
    CONTROL_PLANE(ControlPlane.class),
    AUTO_SCALING_GROUP(AutoScalingGroup.class),
    TARGET_GROUP(TargetGroup.class),
    NAT_GATEWAY(NatGateway.class);

    @Getter private final Class<? extends AbstractInfrastructureResource<?, ?>> resourceClass;

    ResourceKind(Class<? extends AbstractInfrastructureResource<?, ?>> resourceClass) {
        this.resourceClass = resourceClass;
    }

    public static ResourceKind of(AbstractInfrastructureResource<?, ?> resource) {
        for (ResourceKind kind : values()) {
            if (kind.resourceClass.isInstance(resource)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown resource class " + resource.getClass());
    }

    public String getKindName() {
        return HasMetadata.getKind(resourceClass);
    }
}
