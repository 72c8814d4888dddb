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

import lombok.Setter;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DuplicateTargetGroupNameException;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.ResourceInUseException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** In-memory {@link LoadBalancingService} recording every call. */
public class TestingLoadBalancingService implements LoadBalancingService {

    public final List<String> calls = new ArrayList<>();
    public final List<TargetGroupDefinition> createdTargetGroups = new ArrayList<>();

    private final Map<String, TargetGroupDescription> targetGroups = new LinkedHashMap<>();

    /** Another writer creates the target group between our describe and create calls. */
    @Setter private boolean raceOnCreate;

    /** Delete fails because a load balancer still forwards to the group. */
    @Setter private boolean inUse;

    public static String arnOf(String name) {
        return "arn:aws:elasticloadbalancing:us-west-2:000000000000:targetgroup/" + name;
    }

    public String addTargetGroup(String name, int port, String protocol) {
        targetGroups.put(
                name,
                TargetGroupDescription.builder()
                        .name(name)
                        .arn(arnOf(name))
                        .port(port)
                        .protocol(protocol)
                        .build());
        return arnOf(name);
    }

    public void removeTargetGroup(String name) {
        targetGroups.remove(name);
    }

    public boolean exists(String name) {
        return targetGroups.containsKey(name);
    }

    @Override
    public Optional<TargetGroupDescription> describeTargetGroup(String name) {
        calls.add("describe:" + name);
        return Optional.ofNullable(targetGroups.get(name));
    }

    @Override
    public TargetGroupDescription createTargetGroup(TargetGroupDefinition definition) {
        calls.add("create:" + definition.getName());
        if (raceOnCreate) {
            addTargetGroup(definition.getName(), definition.getPort(), definition.getProtocol());
            throw DuplicateTargetGroupNameException.builder()
                    .message("A target group with the same name exists")
                    .build();
        }
        createdTargetGroups.add(definition);
        addTargetGroup(definition.getName(), definition.getPort(), definition.getProtocol());
        return targetGroups.get(definition.getName());
    }

    @Override
    public void deleteTargetGroup(String arn) {
        calls.add("delete:" + arn);
        if (inUse) {
            throw ResourceInUseException.builder()
                    .message("Target group is currently in use by a listener")
                    .build();
        }
        targetGroups.values().removeIf(tg -> tg.getArn().equals(arn));
    }
}
