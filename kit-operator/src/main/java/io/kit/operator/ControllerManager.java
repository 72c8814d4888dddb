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

package io.kit.operator;

import io.kit.operator.api.listener.InfrastructureResourceListener;
import io.kit.operator.config.KitConfigManager;
import io.kit.operator.controller.CancellationSignal;
import io.kit.operator.controller.ControllerRegistry;
import io.kit.operator.controller.ReconcileDispatcher;
import io.kit.operator.controller.ResourceController;
import io.kit.operator.listener.ListenerUtils;
import io.kit.operator.reconciler.ReconcilerFactory;
import io.kit.operator.utils.EventRecorder;
import io.kit.operator.utils.StatusRecorder;
import io.kit.operator.utils.ValidatorUtils;
import io.kit.operator.validation.ResourceValidator;

import org.apache.flink.annotation.VisibleForTesting;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.javaoperatorsdk.operator.Operator;
import io.javaoperatorsdk.operator.api.config.ConfigurationServiceOverrider;
import io.javaoperatorsdk.operator.api.config.ControllerConfigurationOverrider;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Set;

/** Registers resource controllers with JOSDK and hands out the runnable that drives them. */
public class ControllerManager {

    private static final Logger LOG = LoggerFactory.getLogger(ControllerManager.class);

    private final KitConfigManager configManager;
    private final KubernetesClient client;
    private final Set<ResourceValidator> validators;
    private final Collection<InfrastructureResourceListener> listeners;
    @Getter private final EventRecorder eventRecorder;
    @VisibleForTesting final CancellationSignal cancellationSignal = new CancellationSignal();
    @VisibleForTesting final ControllerRegistry registry = new ControllerRegistry();

    public ControllerManager(KitConfigManager configManager, KubernetesClient client) {
        this(configManager, client, ListenerUtils.discoverListeners());
    }

    @VisibleForTesting
    ControllerManager(
            KitConfigManager configManager,
            KubernetesClient client,
            Collection<InfrastructureResourceListener> listeners) {
        this.configManager = configManager;
        this.client = client;
        this.listeners = listeners;
        this.validators = ValidatorUtils.discoverValidators(configManager);
        this.eventRecorder = EventRecorder.create(client, listeners);
    }

    /**
     * Registers the given controllers, at most one per resource kind.
     *
     * @throws IllegalArgumentException if two controllers handle the same kind
     */
    public ManagerRunnable registerControllers(ResourceController<?>... controllers) {
        for (var controller : controllers) {
            registry.register(controller);
        }

        var operatorConf = configManager.getOperatorConfiguration();
        var dispatcher = new ReconcileDispatcher(registry, validators);
        var reconcilerFactory =
                new ReconcilerFactory(
                        dispatcher,
                        operatorConf,
                        StatusRecorder.create(client, listeners),
                        eventRecorder,
                        cancellationSignal);

        var operator = createOperator();
        for (var controller : registry.getControllers()) {
            LOG.info("Registering controller {} for {}", controller.name(), controller.forKind());
            operator.register(
                    reconcilerFactory.create(controller.forKind()),
                    this::overrideControllerConfigs);
        }
        return new ManagerRunnable(operator, cancellationSignal);
    }

    @VisibleForTesting
    protected Operator createOperator() {
        return new Operator(this::overrideOperatorConfigs);
    }

    private void overrideOperatorConfigs(ConfigurationServiceOverrider overrider) {
        overrider.withKubernetesClient(client);
        var operatorConf = configManager.getOperatorConfiguration();

        int parallelism = operatorConf.getReconcilerMaxParallelism();
        LOG.info("Configuring operator with {} reconciliation threads.", parallelism);
        overrider.withConcurrentReconciliationThreads(parallelism);

        overrider.withTerminationTimeoutSeconds(
                (int) operatorConf.getTerminationTimeout().toSeconds());

        var leaderElectionConf = operatorConf.getLeaderElectionConfiguration();
        if (leaderElectionConf != null) {
            overrider.withLeaderElectionConfiguration(leaderElectionConf);
            LOG.info("Operator leader election is enabled.");
        } else {
            LOG.info("Operator leader election is disabled.");
        }
    }

    private void overrideControllerConfigs(ControllerConfigurationOverrider<?> overrider) {
        var operatorConf = configManager.getOperatorConfiguration();
        var watchNamespaces = operatorConf.getWatchedNamespaces();
        LOG.info("Configuring operator to watch the following namespaces: {}.", watchNamespaces);
        overrider.settingNamespaces(watchNamespaces);

        overrider.withRetry(operatorConf.getRetryConfiguration());

        var labelSelector = operatorConf.getLabelSelector();
        LOG.info(
                "Configuring operator to select custom resources with the {} labels.",
                labelSelector);
        overrider.withLabelSelector(labelSelector);
    }
}
