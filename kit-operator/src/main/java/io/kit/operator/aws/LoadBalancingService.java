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

import java.util.Optional;

/** Typed access to the elastic load balancing v2 API. */
public interface LoadBalancingService {

    /**
     * Looks up a target group by name.
     *
     * @param name Target group name.
     * @return The target group, empty when the provider reports it as not found.
     */
    Optional<TargetGroupDescription> describeTargetGroup(String name);

    /**
     * Creates a target group.
     *
     * @throws software.amazon.awssdk.services.elasticloadbalancingv2.model.DuplicateTargetGroupNameException
     *     if a target group with the same name but different settings exists
     */
    TargetGroupDescription createTargetGroup(TargetGroupDefinition definition);

    /**
     * Deletes a target group.
     *
     * @throws software.amazon.awssdk.services.elasticloadbalancingv2.model.ResourceInUseException
     *     while a load balancer or autoscaling group still uses it
     */
    void deleteTargetGroup(String arn);
}
