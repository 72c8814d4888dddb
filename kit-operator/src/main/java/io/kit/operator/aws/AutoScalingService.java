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

import java.util.Collection;
import java.util.List;

/**
 * Typed access to the AWS autoscaling API. Every call is a single request/response, retries are
 * left to the SDK transport and to the caller's backoff.
 */
public interface AutoScalingService {

    /**
     * Describes the autoscaling groups with the given name.
     *
     * @param name Group name.
     * @return Zero or more matching groups, more than one match is an inconsistency the caller
     *     must handle.
     */
    List<AutoScalingGroupDescription> describeAutoScalingGroups(String name);

    /**
     * Creates an autoscaling group.
     *
     * @throws software.amazon.awssdk.services.autoscaling.model.AlreadyExistsException if a group
     *     with the same name exists
     */
    void createAutoScalingGroup(AutoScalingGroupDefinition definition);

    /** Deletes an autoscaling group, terminating its instances when force is set. */
    void deleteAutoScalingGroup(String name, boolean forceDelete);

    /** Updates the desired capacity of an existing group. */
    void setDesiredCapacity(String name, int desiredCapacity);

    /** Returns the ARNs of the target groups attached to the group. */
    List<String> describeAttachedTargetGroups(String name);

    void attachTargetGroups(String name, Collection<String> targetGroupArns);

    void detachTargetGroups(String name, Collection<String> targetGroupArns);
}
