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

import lombok.Builder;
import lombok.Value;

import java.util.List;

/** Observed attributes of an autoscaling group. */
@Value
@Builder
public class AutoScalingGroupDescription {

    /** Lifecycle status the provider reports while a group is being deleted. */
    public static final String STATUS_DELETE_IN_PROGRESS = "Delete in progress";

    String name;
    String arn;
    String status;
    int desiredCapacity;
    List<String> targetGroupArns;

    public boolean isDeleteInProgress() {
        return STATUS_DELETE_IN_PROGRESS.equals(status);
    }
}
