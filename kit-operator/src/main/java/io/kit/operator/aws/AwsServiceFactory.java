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

package io.kit.operator.aws;

import io.kit.operator.config.KitOperatorConfiguration;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.autoscaling.AutoScalingClient;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;

/** Builds the AWS SDK clients and the services wrapping them. */
public class AwsServiceFactory implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AwsServiceFactory.class);

    private final AutoScalingClient autoScalingClient;
    private final ElasticLoadBalancingV2Client loadBalancingClient;
    private final Ec2Client ec2Client;

    @Getter private final AutoScalingService autoScalingService;
    @Getter private final LoadBalancingService loadBalancingService;
    @Getter private final NetworkService networkService;

    public AwsServiceFactory(KitOperatorConfiguration.AwsConfiguration conf) {
        this.autoScalingClient = buildClient(AutoScalingClient.builder(), conf);
        this.loadBalancingClient = buildClient(ElasticLoadBalancingV2Client.builder(), conf);
        this.ec2Client = buildClient(Ec2Client.builder(), conf);
        this.autoScalingService = new AwsAutoScalingService(autoScalingClient);
        this.loadBalancingService = new AwsLoadBalancingService(loadBalancingClient);
        this.networkService = new AwsNetworkService(ec2Client);
        LOG.info(
                "Created AWS clients for region {}",
                conf.getRegion() == null ? "<default chain>" : conf.getRegion());
    }

    private static <B extends AwsClientBuilder<B, C>, C> C buildClient(
            B builder, KitOperatorConfiguration.AwsConfiguration conf) {
        builder.credentialsProvider(DefaultCredentialsProvider.create())
                .overrideConfiguration(
                        ClientOverrideConfiguration.builder()
                                .apiCallTimeout(conf.getApiCallTimeout())
                                .apiCallAttemptTimeout(conf.getApiCallAttemptTimeout())
                                .build());
        if (conf.getRegion() != null) {
            builder.region(Region.of(conf.getRegion()));
        }
        return builder.build();
    }

    @Override
    public void close() {
        autoScalingClient.close();
        loadBalancingClient.close();
        ec2Client.close();
    }
}
