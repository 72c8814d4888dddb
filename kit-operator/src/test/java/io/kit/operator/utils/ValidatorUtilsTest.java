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

package io.kit.operator.utils;

import io.kit.operator.TestUtils;
import io.kit.operator.api.AutoScalingGroup;
import io.kit.operator.api.ControlPlane;
import io.kit.operator.api.NatGateway;
import io.kit.operator.api.TargetGroup;
import io.kit.operator.config.KitConfigManager;
import io.kit.operator.validation.DefaultValidator;
import io.kit.operator.validation.ResourceValidator;

import org.apache.flink.configuration.Configuration;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/** Test for {@link ValidatorUtils}. */
public class ValidatorUtilsTest {

    @Test
    public void testDefaultValidatorIsDiscovered() {
        var validators =
                ValidatorUtils.discoverValidators(new KitConfigManager(new Configuration()));
        assertThat(validators).first().isInstanceOf(DefaultValidator.class);
    }

    @Test
    public void testFirstErrorWins() {
        var natGateway = TestUtils.buildNatGateway("nat", TestUtils.CLUSTER_NAME);
        var defaultValidator = new DefaultValidator(TestUtils.operatorConfiguration());

        assertThat(ValidatorUtils.validate(List.of(defaultValidator), natGateway)).isEmpty();
        assertThat(
                        ValidatorUtils.validate(
                                List.of(
                                        defaultValidator,
                                        new RejectingValidator("first"),
                                        new RejectingValidator("second")),
                                natGateway))
                .contains("first");

        natGateway.getSpec().setClusterName(null);
        assertThat(
                        ValidatorUtils.validate(
                                List.of(defaultValidator, new RejectingValidator("custom")),
                                natGateway))
                .contains("The cluster name must be set");
    }

    /** Validator rejecting every NAT gateway. */
    private static class RejectingValidator implements ResourceValidator {

        private final String error;

        RejectingValidator(String error) {
            this.error = error;
        }

        @Override
        public Optional<String> validateControlPlane(ControlPlane controlPlane) {
            return Optional.empty();
        }

        @Override
        public Optional<String> validateAutoScalingGroup(AutoScalingGroup autoScalingGroup) {
            return Optional.empty();
        }

        @Override
        public Optional<String> validateTargetGroup(TargetGroup targetGroup) {
            return Optional.empty();
        }

        @Override
        public Optional<String> validateNatGateway(NatGateway natGateway) {
            return Optional.of(error);
        }
    }
}
