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

import org.apache.flink.annotation.docs.Documentation;
import org.apache.flink.configuration.ConfigOption;
import org.apache.flink.configuration.ConfigOptions;

import io.javaoperatorsdk.operator.api.config.LeaderElectionConfiguration;
import io.javaoperatorsdk.operator.api.reconciler.Constants;

import java.time.Duration;

/** This class holds configuration constants used by the kit operator. */
public class KitOperatorConfigOptions {

    public static final String KIT_OP_CONF_PREFIX = "kit.operator.";
    public static final String SECTION_SYSTEM = "system";
    public static final String SECTION_ADVANCED = "system_advanced";
    public static final String SECTION_AWS = "aws";

    public static ConfigOptions.OptionBuilder operatorConfig(String key) {
        return ConfigOptions.key(KIT_OP_CONF_PREFIX + key);
    }

    @Documentation.Section(SECTION_SYSTEM)
    public static final ConfigOption<Duration> OPERATOR_RECONCILE_INTERVAL =
            operatorConfig("reconcile.interval")
                    .durationType()
                    .defaultValue(Duration.ofMinutes(5))
                    .withDescription(
                            "The interval for the controller to re-verify resources that have converged.");

    @Documentation.Section(SECTION_SYSTEM)
    public static final ConfigOption<Duration> OPERATOR_WAITING_INTERVAL =
            operatorConfig("reconcile.waiting-interval")
                    .durationType()
                    .defaultValue(Duration.ofSeconds(5))
                    .withDescription(
                            "Fixed requeue delay for resources waiting on a dependency.");

    @Documentation.Section(SECTION_SYSTEM)
    public static final ConfigOption<Integer> OPERATOR_RECONCILE_PARALLELISM =
            operatorConfig("reconcile.parallelism")
                    .intType()
                    .defaultValue(10)
                    .withDescription(
                            "The maximum number of threads running the reconciliation loop. Use -1 for infinite.");

    @Documentation.Section(SECTION_SYSTEM)
    public static final ConfigOption<Duration> OPERATOR_RETRY_INITIAL_INTERVAL =
            operatorConfig("retry.initial.interval")
                    .durationType()
                    .defaultValue(Duration.ofSeconds(5))
                    .withDescription("Initial interval of retries on transient errors.");

    @Documentation.Section(SECTION_SYSTEM)
    public static final ConfigOption<Duration> OPERATOR_RETRY_MAX_INTERVAL =
            operatorConfig("retry.max.interval")
                    .durationType()
                    .defaultValue(Duration.ofMinutes(5))
                    .withDescription("Max interval of retries on transient errors.");

    @Documentation.Section(SECTION_SYSTEM)
    public static final ConfigOption<Double> OPERATOR_RETRY_INTERVAL_MULTIPLIER =
            operatorConfig("retry.interval.multiplier")
                    .doubleType()
                    .defaultValue(1.5)
                    .withDescription("Interval multiplier of retries on transient errors.");

    @Documentation.Section(SECTION_SYSTEM)
    public static final ConfigOption<Integer> OPERATOR_RETRY_MAX_ATTEMPTS =
            operatorConfig("retry.max.attempts")
                    .intType()
                    .defaultValue(15)
                    .withDescription("Max attempts of retries on transient errors.");

    @Documentation.Section(SECTION_SYSTEM)
    public static final ConfigOption<String> OPERATOR_WATCHED_NAMESPACES =
            operatorConfig("watched.namespaces")
                    .stringType()
                    .defaultValue(Constants.WATCH_ALL_NAMESPACES)
                    .withDescription(
                            "Comma separated list of namespaces the operator monitors for custom resources.");

    @Documentation.Section(SECTION_ADVANCED)
    public static final ConfigOption<String> OPERATOR_LABEL_SELECTOR =
            operatorConfig("label.selector")
                    .stringType()
                    .noDefaultValue()
                    .withDescription("Label selector of the custom resources to be watched.");

    @Documentation.Section(SECTION_ADVANCED)
    public static final ConfigOption<Duration> OPERATOR_TERMINATION_TIMEOUT =
            operatorConfig("termination.timeout")
                    .durationType()
                    .defaultValue(Duration.ofSeconds(10))
                    .withDescription(
                            "Operator shutdown timeout before reconciliation threads are killed.");

    @Documentation.Section(SECTION_SYSTEM)
    public static final ConfigOption<Boolean> OPERATOR_LEADER_ELECTION_ENABLED =
            operatorConfig("leader-election.enabled")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription(
                            "Enable leader election for the operator to allow running standby instances.");

    @Documentation.Section(SECTION_SYSTEM)
    public static final ConfigOption<String> OPERATOR_LEADER_ELECTION_LEASE_NAME =
            operatorConfig("leader-election.lease-name")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "Leader election lease name, must be unique for leases in the same namespace.");

    @Documentation.Section(SECTION_SYSTEM)
    public static final ConfigOption<String> OPERATOR_LEADER_ELECTION_LEASE_NAMESPACE =
            operatorConfig("leader-election.lease-namespace")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "Namespace of the leader election lease, defaults to the operator namespace.");

    @Documentation.Section(SECTION_SYSTEM)
    public static final ConfigOption<Duration> OPERATOR_LEADER_ELECTION_LEASE_DURATION =
            operatorConfig("leader-election.lease-duration")
                    .durationType()
                    .defaultValue(LeaderElectionConfiguration.LEASE_DURATION_DEFAULT_VALUE)
                    .withDescription("Leader election lease duration.");

    @Documentation.Section(SECTION_SYSTEM)
    public static final ConfigOption<Duration> OPERATOR_LEADER_ELECTION_RENEW_DEADLINE =
            operatorConfig("leader-election.renew-deadline")
                    .durationType()
                    .defaultValue(LeaderElectionConfiguration.RENEW_DEADLINE_DEFAULT_VALUE)
                    .withDescription("Leader election renew deadline.");

    @Documentation.Section(SECTION_SYSTEM)
    public static final ConfigOption<Duration> OPERATOR_LEADER_ELECTION_RETRY_PERIOD =
            operatorConfig("leader-election.retry-period")
                    .durationType()
                    .defaultValue(LeaderElectionConfiguration.RETRY_PERIOD_DEFAULT_VALUE)
                    .withDescription("Leader election retry period.");

    @Documentation.Section(SECTION_AWS)
    public static final ConfigOption<String> AWS_REGION =
            operatorConfig("aws.region")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "AWS region of the managed infrastructure. The SDK default region chain is used when unset.");

    @Documentation.Section(SECTION_AWS)
    public static final ConfigOption<Duration> AWS_API_CALL_TIMEOUT =
            operatorConfig("aws.api-call.timeout")
                    .durationType()
                    .defaultValue(Duration.ofSeconds(30))
                    .withDescription("Total timeout of a single AWS API call including retries.");

    @Documentation.Section(SECTION_AWS)
    public static final ConfigOption<Duration> AWS_API_CALL_ATTEMPT_TIMEOUT =
            operatorConfig("aws.api-call-attempt.timeout")
                    .durationType()
                    .defaultValue(Duration.ofSeconds(10))
                    .withDescription("Timeout of a single HTTP attempt of an AWS API call.");

    @Documentation.Section(SECTION_AWS)
    public static final ConfigOption<Integer> AUTO_SCALING_GROUP_MIN_SIZE =
            operatorConfig("autoscaling-group.min-size")
                    .intType()
                    .defaultValue(1)
                    .withDescription("Minimum size of created autoscaling groups.");

    @Documentation.Section(SECTION_AWS)
    public static final ConfigOption<Integer> AUTO_SCALING_GROUP_MAX_SIZE =
            operatorConfig("autoscaling-group.max-size")
                    .intType()
                    .defaultValue(4)
                    .withDescription("Maximum size of created autoscaling groups.");

    @Documentation.Section(SECTION_AWS)
    public static final ConfigOption<Integer> TARGET_GROUP_DEFAULT_PORT =
            operatorConfig("target-group.default-port")
                    .intType()
                    .defaultValue(443)
                    .withDescription("Port of projected target groups when the control plane does not set one.");

    @Documentation.Section(SECTION_AWS)
    public static final ConfigOption<String> TARGET_GROUP_DEFAULT_PROTOCOL =
            operatorConfig("target-group.default-protocol")
                    .stringType()
                    .defaultValue("TCP")
                    .withDescription("Protocol of projected target groups.");
}
