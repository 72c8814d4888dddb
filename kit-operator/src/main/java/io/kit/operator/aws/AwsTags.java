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

import io.kit.operator.api.CrdConstants;

import java.util.LinkedHashMap;
import java.util.Map;

/** Tags the operator puts on and looks up AWS resources by. */
public class AwsTags {

    public static final String NAME = "Name";
    public static final String CLUSTER_NAME = CrdConstants.LABEL_CLUSTER_NAME;
    public static final String SUBNET_TYPE = CrdConstants.API_GROUP + "/subnet-type";

    /** Type of a cluster subnet, stored in the {@link #SUBNET_TYPE} tag. */
    public enum SubnetType {
        PRIVATE,
        PUBLIC;

        public String tagValue() {
            return name().toLowerCase();
        }
    }

    /**
     * Tags of a resource owned by a cluster.
     *
     * @param name Value of the Name tag.
     * @param clusterName Owning cluster.
     * @return Ordered tag map.
     */
    public static Map<String, String> forResource(String name, String clusterName) {
        var tags = new LinkedHashMap<String, String>();
        tags.put(NAME, name);
        tags.put(CLUSTER_NAME, clusterName);
        return tags;
    }

    public static String tagFilter(String key) {
        return "tag:" + key;
    }
}
