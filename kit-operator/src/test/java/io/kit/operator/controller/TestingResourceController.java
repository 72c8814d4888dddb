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

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** {@link ResourceController} returning preset results and recording its invocations. */
public class TestingResourceController<
                CR extends AbstractInfrastructureResource<?, InfrastructureStatus>>
        implements ResourceController<CR> {

    private final String name;
    private final ResourceKind kind;

    public final List<String> invocations = new ArrayList<>();
    public final List<Map<String, String>> mdcContexts = new ArrayList<>();
    public ReconcileResult reconcileResult = ReconcileResult.created();
    public ReconcileResult finalizeResult = ReconcileResult.terminated();
    public Exception error;

    public TestingResourceController(String name, ResourceKind kind) {
        this.name = name;
        this.kind = kind;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ResourceKind forKind() {
        return kind;
    }

    @Override
    public ReconcileResult reconcile(ReconcileContext ctx, CR resource) throws Exception {
        return record("reconcile", reconcileResult);
    }

    @Override
    public ReconcileResult finalize(ReconcileContext ctx, CR resource) throws Exception {
        return record("finalize", finalizeResult);
    }

    private ReconcileResult record(String operation, ReconcileResult result) throws Exception {
        invocations.add(operation);
        mdcContexts.add(MDC.getCopyOfContextMap());
        if (error != null) {
            throw error;
        }
        return result;
    }
}
