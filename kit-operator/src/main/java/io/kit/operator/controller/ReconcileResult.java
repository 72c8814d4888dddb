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

package io.kit.operator.controller;

import io.kit.operator.api.lifecycle.ResourceState;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/** Outcome of a single reconcile or finalize pass. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ReconcileResult {

    ResourceState state;
    String reason;
    String externalId;

    /** Set when the desired-state object itself was rejected by validation. */
    boolean rejected;

    public static ReconcileResult created() {
        return new ReconcileResult(ResourceState.CREATED, null, null, false);
    }

    public static ReconcileResult created(String externalId) {
        return new ReconcileResult(ResourceState.CREATED, null, externalId, false);
    }

    public static ReconcileResult terminated() {
        return new ReconcileResult(ResourceState.TERMINATED, null, null, false);
    }

    /** A dependency or the provider is not ready yet, the pass is repeated after a short delay. */
    public static ReconcileResult waiting(String reason) {
        return new ReconcileResult(ResourceState.WAITING, reason, null, false);
    }

    public static ReconcileResult waiting(String reason, String externalId) {
        return new ReconcileResult(ResourceState.WAITING, reason, externalId, false);
    }

    /** The provider reports something a retry cannot resolve. */
    public static ReconcileResult fatal(String reason) {
        return new ReconcileResult(ResourceState.ERROR, reason, null, false);
    }

    /** The desired-state object is invalid, nothing was sent to the provider. */
    public static ReconcileResult rejected(String reason) {
        return new ReconcileResult(ResourceState.ERROR, reason, null, true);
    }

    public boolean isWaiting() {
        return state == ResourceState.WAITING;
    }

    public boolean isFatal() {
        return state == ResourceState.ERROR;
    }

    public boolean isTerminated() {
        return state == ResourceState.TERMINATED;
    }

    public boolean isCreated() {
        return state == ResourceState.CREATED;
    }
}
