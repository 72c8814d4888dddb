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

import io.kit.operator.api.AbstractInfrastructureResource;
import io.kit.operator.config.KitConfigManager;
import io.kit.operator.validation.DefaultValidator;
import io.kit.operator.validation.ResourceValidator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/** Validator utilities. */
public final class ValidatorUtils {

    private static final Logger LOG = LoggerFactory.getLogger(ValidatorUtils.class);

    private ValidatorUtils() {}

    /** The default validator followed by the validators registered with {@link ServiceLoader}. */
    public static Set<ResourceValidator> discoverValidators(KitConfigManager configManager) {
        Set<ResourceValidator> resourceValidators = new LinkedHashSet<>();
        resourceValidators.add(new DefaultValidator(configManager.getOperatorConfiguration()));
        ServiceLoader.load(ResourceValidator.class)
                .forEach(
                        validator -> {
                            LOG.info(
                                    "Discovered resource validator: {}",
                                    validator.getClass().getName());
                            resourceValidators.add(validator);
                        });
        return resourceValidators;
    }

    /** Returns the error of the first validator rejecting the resource. */
    public static Optional<String> validate(
            Collection<ResourceValidator> validators,
            AbstractInfrastructureResource<?, ?> resource) {
        for (ResourceValidator validator : validators) {
            var error = validator.validate(resource);
            if (error.isPresent()) {
                return error;
            }
        }
        return Optional.empty();
    }
}
