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

/** Constants used by the CRD. */
public class CrdConstants {
    public static final String API_GROUP = "kit.k8s.sh";
    public static final String API_VERSION = "v1alpha1";

    public static final String LABEL_CLUSTER_NAME = API_GROUP + "/cluster-name";
    public static final String LABEL_COMPONENT = API_GROUP + "/component";

    public static final String FINALIZER = "finalizer." + API_GROUP;
}
