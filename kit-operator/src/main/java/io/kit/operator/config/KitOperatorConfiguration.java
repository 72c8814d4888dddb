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

package io.kit.operator.config;

import io.kit.operator.utils.EnvUtils;

import org.apache.flink.configuration.Configuration;
import org.apache.flink.configuration.IllegalConfigurationException;

import io.javaoperatorsdk.operator.api.config.LeaderElectionConfiguration;
import io.javaoperatorsdk.operator.processing.retry.GenericRetry;
import lombok.Value;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static io.kit.operator.utils.EnvUtils.ENV_WATCH_NAMESPACES;

/** Configuration class for operator. */
@Value
public class KitOperatorConfiguration {

    private static final String NAMESPACES_SPLITTER_KEY = ",";

    Duration reconcileInterval;
    Duration waitingInterval;
    int reconcilerMaxParallelism;
    GenericRetry retryConfiguration;
    Set<String> watchedNamespaces;
    String labelSelector;
    Duration terminationTimeout;
    LeaderElectionConfiguration leaderElectionConfiguration;
    AwsConfiguration awsConfiguration;
    int autoScalingGroupMinSize;
    int autoScalingGroupMaxSize;
    int targetGroupDefaultPort;
    String targetGroupDefaultProtocol;

    /** Settings of the AWS clients. */
    @Value
    public static class AwsConfiguration {
        String region;
        Duration apiCallTimeout;
        Duration apiCallAttemptTimeout;
    }

    public static KitOperatorConfiguration fromConfiguration(Configuration operatorConfig) {
        Duration reconcileInterval =
                operatorConfig.get(KitOperatorConfigOptions.OPERATOR_RECONCILE_INTERVAL);
        Duration waitingInterval =
                operatorConfig.get(KitOperatorConfigOptions.OPERATOR_WAITING_INTERVAL);
        int reconcilerMaxParallelism =
                operatorConfig.get(KitOperatorConfigOptions.OPERATOR_RECONCILE_PARALLELISM);

        String namespaces =
                EnvUtils.get(ENV_WATCH_NAMESPACES)
                        .orElse(
                                operatorConfig.get(
                                        KitOperatorConfigOptions.OPERATOR_WATCHED_NAMESPACES));
        Set<String> watchedNamespaces =
                Arrays.stream(namespaces.split(NAMESPACES_SPLITTER_KEY))
                        .map(String::trim)
                        .filter(ns -> !ns.isEmpty())
                        .collect(Collectors.toSet());

        int minSize = operatorConfig.get(KitOperatorConfigOptions.AUTO_SCALING_GROUP_MIN_SIZE);
        int maxSize = operatorConfig.get(KitOperatorConfigOptions.AUTO_SCALING_GROUP_MAX_SIZE);
        if (minSize < 0 || maxSize < minSize) {
            throw new IllegalConfigurationException(
                    String.format(
                            "Invalid autoscaling group bounds min=%d max=%d", minSize, maxSize));
        }

        var awsConfiguration =
                new AwsConfiguration(
                        operatorConfig.get(KitOperatorConfigOptions.AWS_REGION),
                        operatorConfig.get(KitOperatorConfigOptions.AWS_API_CALL_TIMEOUT),
                        operatorConfig.get(KitOperatorConfigOptions.AWS_API_CALL_ATTEMPT_TIMEOUT));

        return new KitOperatorConfiguration(
                reconcileInterval,
                waitingInterval,
                reconcilerMaxParallelism,
                getRetryConfig(operatorConfig),
                watchedNamespaces,
                operatorConfig.get(KitOperatorConfigOptions.OPERATOR_LABEL_SELECTOR),
                operatorConfig.get(KitOperatorConfigOptions.OPERATOR_TERMINATION_TIMEOUT),
                getLeaderElectionConfig(operatorConfig),
                awsConfiguration,
                minSize,
                maxSize,
                operatorConfig.get(KitOperatorConfigOptions.TARGET_GROUP_DEFAULT_PORT),
                operatorConfig.get(KitOperatorConfigOptions.TARGET_GROUP_DEFAULT_PROTOCOL));
    }

    private static GenericRetry getRetryConfig(Configuration conf) {
        return new GenericRetry()
                .setMaxAttempts(conf.get(KitOperatorConfigOptions.OPERATOR_RETRY_MAX_ATTEMPTS))
                .setInitialInterval(
                        conf.get(KitOperatorConfigOptions.OPERATOR_RETRY_INITIAL_INTERVAL)
                                .toMillis())
                .setIntervalMultiplier(
                        conf.get(KitOperatorConfigOptions.OPERATOR_RETRY_INTERVAL_MULTIPLIER))
                .setMaxInterval(
                        conf.get(KitOperatorConfigOptions.OPERATOR_RETRY_MAX_INTERVAL).toMillis());
    }

    private static LeaderElectionConfiguration getLeaderElectionConfig(Configuration conf) {
        if (!conf.get(KitOperatorConfigOptions.OPERATOR_LEADER_ELECTION_ENABLED)) {
            return null;
        }

        return new LeaderElectionConfiguration(
                conf.getOptional(KitOperatorConfigOptions.OPERATOR_LEADER_ELECTION_LEASE_NAME)
                        .orElseThrow(
                                () ->
                                        new IllegalConfigurationException(
                                                KitOperatorConfigOptions
                                                                .OPERATOR_LEADER_ELECTION_LEASE_NAME
                                                                .key()
                                                        + " must be defined when operator leader election is enabled.")),
                conf.getOptional(KitOperatorConfigOptions.OPERATOR_LEADER_ELECTION_LEASE_NAMESPACE)
                        .or(() -> EnvUtils.get(EnvUtils.ENV_OPERATOR_NAMESPACE))
                        .orElse(null),
                conf.get(KitOperatorConfigOptions.OPERATOR_LEADER_ELECTION_LEASE_DURATION),
                conf.get(KitOperatorConfigOptions.OPERATOR_LEADER_ELECTION_RENEW_DEADLINE),
                conf.get(KitOperatorConfigOptions.OPERATOR_LEADER_ELECTION_RETRY_PERIOD));
    }

    public Optional<String> getLabelSelectorOptional() {
        return Optional.ofNullable(labelSelector);
    }
}
