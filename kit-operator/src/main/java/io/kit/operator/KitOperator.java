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

import io.kit.operator.aws.AwsServiceFactory;
import io.kit.operator.config.KitConfigManager;
import io.kit.operator.controller.AutoScalingGroupController;
import io.kit.operator.controller.ControlPlaneController;
import io.kit.operator.controller.NatGatewayController;
import io.kit.operator.controller.TargetGroupController;
import io.kit.operator.utils.EnvUtils;

import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/** Main Class for the KIT infrastructure operator. */
public class KitOperator {

    private static final Logger LOG = LoggerFactory.getLogger(KitOperator.class);

    public static void main(String... args) {
        EnvUtils.logEnvironmentInfo(LOG, "KIT Operator", args);

        var configManager = new KitConfigManager();
        var operatorConf = configManager.getOperatorConfiguration();
        var stopSignal = new CompletableFuture<Void>();

        try (var client = new KubernetesClientBuilder().build();
                var aws = new AwsServiceFactory(operatorConf.getAwsConfiguration())) {
            var manager = new ControllerManager(configManager, client);
            var runnable =
                    manager.registerControllers(
                            new ControlPlaneController(manager.getEventRecorder()),
                            new AutoScalingGroupController(
                                    aws.getAutoScalingService(),
                                    aws.getLoadBalancingService(),
                                    aws.getNetworkService()),
                            new TargetGroupController(
                                    aws.getLoadBalancingService(), aws.getNetworkService()),
                            new NatGatewayController(aws.getNetworkService()));

            Runtime.getRuntime()
                    .addShutdownHook(
                            new Thread(
                                    () -> {
                                        stopSignal.complete(null);
                                        try {
                                            if (!runnable.awaitStopped(
                                                    operatorConf.getTerminationTimeout())) {
                                                LOG.warn("Controllers did not stop in time");
                                            }
                                        } catch (InterruptedException e) {
                                            Thread.currentThread().interrupt();
                                        }
                                    },
                                    "kit-operator-shutdown"));

            runnable.start(stopSignal);
        }
    }
}
