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

package io.kit.operator.validation;

import io.kit.operator.api.AbstractInfrastructureResource;
import io.kit.operator.api.AutoScalingGroup;
import io.kit.operator.api.ControlPlane;
import io.kit.operator.api.NatGateway;
import io.kit.operator.api.ResourceKind;
import io.kit.operator.api.TargetGroup;

import java.util.Optional;

/** Validator for the infrastructure resources. */
public interface ResourceValidator {

    /**
     * Validate and return optional error.
     *
     * @param controlPlane The control plane to be validated.
     * @return Optional error string, should be present iff validation resulted in an error
     */
    Optional<String> validateControlPlane(ControlPlane controlPlane);

    Optional<String> validateAutoScalingGroup(AutoScalingGroup autoScalingGroup);

    Optional<String> validateTargetGroup(TargetGroup targetGroup);

    Optional<String> validateNatGateway(NatGateway natGateway);

    /** Validates a resource of any kind. */
    default Optional<String> validate(AbstractInfrastructureResource<?, ?> resource) {
        switch (ResourceKind.of(resource)) {
            case CONTROL_PLANE:
                return validateControlPlane((ControlPlane) resource);
            case AUTO_SCALING_GROUP:
                return validateAutoScalingGroup((AutoScalingGroup) resource);
            case TARGET_GROUP:
                return validateTargetGroup((TargetGroup) resource);
            case NAT_GATEWAY:
                return validateNatGateway((NatGateway) resource);
            default:
                return Optional.of("Unsupported resource " + resource.getKind());
        }
    }
}
