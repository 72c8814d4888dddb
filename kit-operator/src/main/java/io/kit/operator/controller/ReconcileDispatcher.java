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
import io.kit.operator.utils.ValidatorUtils;
import io.kit.operator.validation.ResourceValidator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Collection;

/**
 * Routes a desired-state object to the controller registered for its kind. Objects carrying a
 * deletion timestamp go to {@link ResourceController#finalize}, every other object is validated
 * and then handed to {@link ResourceController#reconcile}.
 */
public class ReconcileDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(ReconcileDispatcher.class);

    public static final String MDC_KIND = "kit.kind";
    public static final String MDC_RESOURCE = "kit.resource";
    public static final String MDC_CONTROLLER = "kit.controller";
    public static final String MDC_RECONCILE_ID = "kit.reconcile.id";

    private final ControllerRegistry registry;
    private final Collection<ResourceValidator> validators;

    public ReconcileDispatcher(
            ControllerRegistry registry, Collection<ResourceValidator> validators) {
        this.registry = registry;
        this.validators = validators;
    }

    @SuppressWarnings("unchecked")
    public <CR extends AbstractInfrastructureResource<?, InfrastructureStatus>>
            ReconcileResult dispatch(ReconcileContext ctx, CR resource) throws Exception {
        var kind = ResourceKind.of(resource);
        var controller =
                (ResourceController<CR>)
                        registry.get(kind)
                                .orElseThrow(
                                        () ->
                                                new IllegalStateException(
                                                        "No controller registered for " + kind));

        MDC.put(MDC_KIND, kind.getKindName());
        MDC.put(
                MDC_RESOURCE,
                resource.getMetadata().getNamespace() + "/" + resource.getMetadata().getName());
        MDC.put(MDC_CONTROLLER, controller.name());
        MDC.put(MDC_RECONCILE_ID, ctx.getReconcileId());
        try {
            if (resource.isMarkedForDeletion()) {
                LOG.info("Finalizing");
                var result = controller.finalize(ctx, resource);
                LOG.info("Finalize finished with {}", result);
                return result;
            }

            var validationError = ValidatorUtils.validate(validators, resource);
            if (validationError.isPresent()) {
                LOG.error("Validation failed: {}", validationError.get());
                return ReconcileResult.rejected(validationError.get());
            }

            LOG.debug("Starting reconciliation");
            var result = controller.reconcile(ctx, resource);
            LOG.info("Reconcile finished with {}", result);
            return result;
        } finally {
            MDC.remove(MDC_KIND);
            MDC.remove(MDC_RESOURCE);
            MDC.remove(MDC_CONTROLLER);
            MDC.remove(MDC_RECONCILE_ID);
        }
    }
}
