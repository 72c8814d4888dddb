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

package io.kit.operator.reconciler;

import io.kit.operator.api.AbstractInfrastructureResource;
import io.kit.operator.api.status.InfrastructureStatus;
import io.kit.operator.config.KitOperatorConfiguration;
import io.kit.operator.controller.CancellationSignal;
import io.kit.operator.controller.ReconcileContext;
import io.kit.operator.controller.ReconcileDispatcher;
import io.kit.operator.controller.ReconcileResult;
import io.kit.operator.exception.ReconciliationCancelledException;
import io.kit.operator.exception.ReconciliationException;
import io.kit.operator.utils.EventRecorder;
import io.kit.operator.utils.StatusRecorder;

import org.apache.flink.annotation.VisibleForTesting;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.javaoperatorsdk.operator.api.reconciler.Cleaner;
import io.javaoperatorsdk.operator.api.reconciler.Context;
import io.javaoperatorsdk.operator.api.reconciler.DeleteControl;
import io.javaoperatorsdk.operator.api.reconciler.ErrorStatusHandler;
import io.javaoperatorsdk.operator.api.reconciler.ErrorStatusUpdateControl;
import io.javaoperatorsdk.operator.api.reconciler.Reconciler;
import io.javaoperatorsdk.operator.api.reconciler.RetryInfo;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Bridges JOSDK callbacks to the {@link ReconcileDispatcher}. One concrete subclass exists per
 * resource kind so JOSDK can resolve the custom resource class.
 *
 * @param <CR> Custom resource type.
 */
public abstract class InfrastructureReconciler<
                CR extends AbstractInfrastructureResource<?, InfrastructureStatus>>
        implements Reconciler<CR>, Cleaner<CR>, ErrorStatusHandler<CR> {

    private static final Logger LOG = LoggerFactory.getLogger(InfrastructureReconciler.class);

    private final ReconcileDispatcher dispatcher;
    private final KitOperatorConfiguration configuration;
    private final StatusRecorder statusRecorder;
    private final EventRecorder eventRecorder;
    private final CancellationSignal cancellationSignal;

    protected InfrastructureReconciler(
            ReconcileDispatcher dispatcher,
            KitOperatorConfiguration configuration,
            StatusRecorder statusRecorder,
            EventRecorder eventRecorder,
            CancellationSignal cancellationSignal) {
        this.dispatcher = dispatcher;
        this.configuration = configuration;
        this.statusRecorder = statusRecorder;
        this.eventRecorder = eventRecorder;
        this.cancellationSignal = cancellationSignal;
    }

    @Override
    public UpdateControl<CR> reconcile(CR resource, Context<CR> josdkContext) {
        return reconcile(resource, josdkContext.getClient());
    }

    @VisibleForTesting
    UpdateControl<CR> reconcile(CR resource, KubernetesClient client) {
        statusRecorder.updateStatusFromCache(resource);
        var previousState = resource.getStatus().getState();

        var result = dispatch(resource, client);
        statusRecorder.recordResult(resource, result);
        statusRecorder.patchAndCacheStatus(resource, client);

        if (result.isCreated() && previousState != result.getState()) {
            eventRecorder.triggerEvent(
                    resource,
                    EventRecorder.Type.Normal,
                    EventRecorder.Reason.Created,
                    EventRecorder.Component.Cloud,
                    "External resource is in the desired state",
                    client);
        } else if (result.isWaiting()) {
            triggerWaitingEvent(resource, result, client);
        } else if (result.isFatal()) {
            triggerFatalEvent(resource, result, client);
        }
        return ReconciliationUtils.toUpdateControl(configuration, result);
    }

    @Override
    public DeleteControl cleanup(CR resource, Context<CR> josdkContext) {
        return cleanup(resource, josdkContext.getClient());
    }

    @VisibleForTesting
    DeleteControl cleanup(CR resource, KubernetesClient client) {
        eventRecorder.triggerEvent(
                resource,
                EventRecorder.Type.Normal,
                EventRecorder.Reason.Cleanup,
                EventRecorder.Component.Operator,
                "Cleaning up " + resource.getKind(),
                client);
        statusRecorder.updateStatusFromCache(resource);

        ReconcileResult result;
        try {
            result = dispatch(resource, client);
        } catch (ReconciliationException e) {
            statusRecorder.recordFailure(resource, e, false);
            statusRecorder.patchAndCacheStatus(resource, client);
            throw e;
        }

        statusRecorder.recordResult(resource, result);
        if (result.isTerminated()) {
            statusRecorder.cleanupForDeletion(resource);
            eventRecorder.triggerEvent(
                    resource,
                    EventRecorder.Type.Normal,
                    EventRecorder.Reason.Terminated,
                    EventRecorder.Component.Cloud,
                    "External resource removed",
                    client);
        } else {
            statusRecorder.patchAndCacheStatus(resource, client);
            if (result.isWaiting()) {
                triggerWaitingEvent(resource, result, client);
            } else if (result.isFatal()) {
                triggerFatalEvent(resource, result, client);
            }
        }
        return ReconciliationUtils.toDeleteControl(configuration, result);
    }

    @Override
    public ErrorStatusUpdateControl<CR> updateErrorStatus(
            CR resource, Context<CR> josdkContext, Exception e) {
        return updateErrorStatus(
                resource, josdkContext.getClient(), josdkContext.getRetryInfo(), e);
    }

    @VisibleForTesting
    ErrorStatusUpdateControl<CR> updateErrorStatus(
            CR resource,
            KubernetesClient client,
            Optional<RetryInfo> retryInfo,
            Exception e) {
        if (ExceptionUtils.indexOfThrowable(e, ReconciliationCancelledException.class) >= 0) {
            LOG.info("Reconciliation cancelled, operator is stopping");
            return ErrorStatusUpdateControl.<CR>noStatusUpdate().withNoRetry();
        }

        retryInfo.ifPresent(
                r ->
                        LOG.warn(
                                "Attempt count: {}, last attempt: {}",
                                r.getAttemptCount(),
                                r.isLastAttempt()));
        boolean lastAttempt = retryInfo.map(RetryInfo::isLastAttempt).orElse(false);

        statusRecorder.updateStatusFromCache(resource);
        statusRecorder.recordFailure(resource, e, lastAttempt);
        statusRecorder.patchAndCacheStatus(resource, client);

        if (lastAttempt) {
            return ErrorStatusUpdateControl.<CR>noStatusUpdate()
                    .rescheduleAfter(configuration.getReconcileInterval());
        }
        // Status was updated already, no need to return anything
        return ErrorStatusUpdateControl.noStatusUpdate();
    }

    private ReconcileResult dispatch(CR resource, KubernetesClient client) {
        var ctx = new ReconcileContext(configuration, client, cancellationSignal);
        try {
            return dispatcher.dispatch(ctx, resource);
        } catch (ReconciliationCancelledException e) {
            throw e;
        } catch (Exception e) {
            LOG.warn("Pass {} failed", ctx.getReconcileId(), e);
            eventRecorder.triggerEvent(
                    resource,
                    EventRecorder.Type.Warning,
                    EventRecorder.Reason.Error,
                    EventRecorder.Component.Cloud,
                    ExceptionUtils.getRootCauseMessage(e),
                    client);
            throw new ReconciliationException(e);
        }
    }

    private void triggerWaitingEvent(CR resource, ReconcileResult result, KubernetesClient client) {
        eventRecorder.triggerEventWithInterval(
                resource,
                EventRecorder.Type.Normal,
                EventRecorder.Reason.Waiting,
                EventRecorder.Component.Cloud,
                result.getReason(),
                result.getReason(),
                client,
                configuration.getReconcileInterval());
    }

    private void triggerFatalEvent(CR resource, ReconcileResult result, KubernetesClient client) {
        eventRecorder.triggerEvent(
                resource,
                EventRecorder.Type.Warning,
                result.isRejected()
                        ? EventRecorder.Reason.ValidationError
                        : EventRecorder.Reason.Error,
                EventRecorder.Component.Operator,
                result.getReason(),
                client);
    }
}
