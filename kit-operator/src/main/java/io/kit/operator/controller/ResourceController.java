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

import io.kit.operator.api.AbstractInfrastructureResource;
import io.kit.operator.api.ResourceKind;
import io.kit.operator.api.status.InfrastructureStatus;

/**
 * Drives one kind of external resource toward the state described by its desired-state object.
 *
 * <p>Both operations are invoked repeatedly and must be idempotent: every pass starts from what
 * the provider reports, never from state kept between passes. Dependencies that are not ready yet
 * are reported as {@link ReconcileResult#waiting(String)}, inconsistencies that a retry cannot fix
 * as {@link ReconcileResult#fatal(String)}. Transient provider errors are thrown.
 *
 * @param <CR> The desired-state resource type.
 */
public interface ResourceController<
        CR extends AbstractInfrastructureResource<?, InfrastructureStatus>> {

    /** Stable identifier used in logs. */
    String name();

    /** The kind this controller handles, at most one controller per kind can be registered. */
    ResourceKind forKind();

    /**
     * Converges the external resource toward the desired state.
     *
     * @param ctx Context of the current pass.
     * @param resource Desired-state object, not marked for deletion.
     * @return Outcome of the pass.
     * @throws Exception Transient error, retried with backoff.
     */
    ReconcileResult reconcile(ReconcileContext ctx, CR resource) throws Exception;

    /**
     * Tears the external resource down. An absent external resource is a success.
     *
     * @param ctx Context of the current pass.
     * @param resource Desired-state object marked for deletion.
     * @return {@link ReconcileResult#terminated()} once the finalizer may be removed.
     * @throws Exception Transient error, retried with backoff.
     */
    ReconcileResult finalize(ReconcileContext ctx, CR resource) throws Exception;
}
