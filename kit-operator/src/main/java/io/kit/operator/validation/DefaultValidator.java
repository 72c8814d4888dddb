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

import io.kit.operator.api.AutoScalingGroup;
import io.kit.operator.api.ControlPlane;
import io.kit.operator.api.NatGateway;
import io.kit.operator.api.TargetGroup;
import io.kit.operator.api.utils.ResourceNames;
import io.kit.operator.config.KitOperatorConfiguration;

import org.apache.commons.lang3.StringUtils;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/** Default validator implementation for the infrastructure resources. */
public class DefaultValidator implements ResourceValidator {

    /** Keeps {@code <cluster>-tg} within the 32 character target group name limit. */
    private static final Pattern CLUSTER_NAME_PATTERN =
            Pattern.compile("[a-z]([-a-z\\d]{0,27}[a-z\\d])?");

    private static final Pattern TARGET_GROUP_NAME_PATTERN =
            Pattern.compile("[a-zA-Z\\d]([-a-zA-Z\\d]{0,30}[a-zA-Z\\d])?");

    private static final Set<String> TARGET_GROUP_PROTOCOLS =
            Set.of("TCP", "TLS", "UDP", "TCP_UDP", "HTTP", "HTTPS");

    private final KitOperatorConfiguration operatorConfiguration;

    public DefaultValidator(KitOperatorConfiguration operatorConfiguration) {
        this.operatorConfiguration = operatorConfiguration;
    }

    @Override
    public Optional<String> validateControlPlane(ControlPlane controlPlane) {
        var spec = controlPlane.getSpec();
        return firstPresent(
                validateClusterName(controlPlane.getMetadata().getName()),
                validateInstanceCount(spec.getInstanceCount()),
                spec.getTargetGroupPort() == null
                        ? Optional.empty()
                        : validatePort(spec.getTargetGroupPort()));
    }

    @Override
    public Optional<String> validateAutoScalingGroup(AutoScalingGroup autoScalingGroup) {
        var spec = autoScalingGroup.getSpec();
        return firstPresent(
                validateClusterName(ResourceNames.clusterNameOf(autoScalingGroup)),
                validateInstanceCount(spec.getInstanceCount()),
                spec.getTargetGroupName() == null
                        ? Optional.empty()
                        : validateTargetGroupName(spec.getTargetGroupName()));
    }

    @Override
    public Optional<String> validateTargetGroup(TargetGroup targetGroup) {
        var spec = targetGroup.getSpec();
        return firstPresent(
                validateClusterName(ResourceNames.clusterNameOf(targetGroup)),
                validateTargetGroupName(targetGroup.getMetadata().getName()),
                spec.getPort() == 0 ? Optional.empty() : validatePort(spec.getPort()),
                validateProtocol(spec.getProtocol()));
    }

    @Override
    public Optional<String> validateNatGateway(NatGateway natGateway) {
        return validateClusterName(ResourceNames.clusterNameOf(natGateway));
    }

    @SafeVarargs
    private static Optional<String> firstPresent(Optional<String>... errOpts) {
        for (Optional<String> opt : errOpts) {
            if (opt.isPresent()) {
                return opt;
            }
        }
        return Optional.empty();
    }

    private Optional<String> validateClusterName(String clusterName) {
        if (StringUtils.isBlank(clusterName)) {
            return Optional.of("The cluster name must be set");
        }
        if (!CLUSTER_NAME_PATTERN.matcher(clusterName).matches()) {
            return Optional.of(
                    String.format(
                            "The cluster name: %s is invalid, must consist of lower case alphanumeric characters or '-', start with an alphabetic character, end with an alphanumeric character, and be no more than 29 characters long.",
                            clusterName));
        }
        return Optional.empty();
    }

    private Optional<String> validateInstanceCount(int instanceCount) {
        int min = operatorConfiguration.getAutoScalingGroupMinSize();
        int max = operatorConfiguration.getAutoScalingGroupMaxSize();
        if (instanceCount < min || instanceCount > max) {
            return Optional.of(
                    String.format(
                            "The instance count %d must be between %d and %d",
                            instanceCount, min, max));
        }
        return Optional.empty();
    }

    private Optional<String> validateTargetGroupName(String name) {
        if (!TARGET_GROUP_NAME_PATTERN.matcher(name).matches()) {
            return Optional.of(
                    String.format(
                            "The target group name: %s is invalid, must consist of alphanumeric characters or '-', must not start or end with '-', and be no more than 32 characters long.",
                            name));
        }
        return Optional.empty();
    }

    private Optional<String> validatePort(int port) {
        if (port < 1 || port > 65535) {
            return Optional.of("The port " + port + " is out of range");
        }
        return Optional.empty();
    }

    private Optional<String> validateProtocol(String protocol) {
        if (protocol != null && !TARGET_GROUP_PROTOCOLS.contains(protocol)) {
            return Optional.of("Unsupported target group protocol " + protocol);
        }
        return Optional.empty();
    }
}
