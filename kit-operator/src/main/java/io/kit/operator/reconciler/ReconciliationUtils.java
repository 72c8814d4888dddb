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

import io.kit.operator.config.KitOperatorConfiguration;
import io.kit.operator.controller.ReconcileResult;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.javaoperatorsdk.operator.api.reconciler.DeleteControl;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;

/** Translates controller outcomes into JOSDK controls. */
public class ReconciliationUtils {

    private ReconciliationUtils() {}

    /**
     * Waiting passes come back after the short waiting interval, converged resources are resynced
     * at the reconcile interval and fatal outcomes are not rescheduled at all.
     */
    public static <CR extends HasMetadata> UpdateControl<CR> toUpdateControl(
            KitOperatorConfiguration conf, ReconcileResult result) {
        UpdateControl<CR> updateControl = UpdateControl.noUpdate();
        if (result.isWaiting()) {
            return updateControl.rescheduleAfter(conf.getWaitingInterval());
        }
        if (result.isCreated()) {
            return updateControl.rescheduleAfter(conf.getReconcileInterval());
        }
        return updateControl;
    }

    /** The finalizer is only released once the external resource is confirmed gone. */
    public static DeleteControl toDeleteControl(
            KitOperatorConfiguration conf, ReconcileResult result) {
        if (result.isTerminated()) {
            return DeleteControl.defaultDelete();
        }
        if (result.isWaiting()) {
            return DeleteControl.noFinalizerRemoval().rescheduleAfter(conf.getWaitingInterval());
        }
        return DeleteControl.noFinalizerRemoval();
    }
}
