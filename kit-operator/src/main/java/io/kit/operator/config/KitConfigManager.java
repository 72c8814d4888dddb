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

import org.apache.flink.annotation.VisibleForTesting;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.configuration.GlobalConfiguration;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/** Loads the operator configuration and keeps the parsed snapshot of it. */
public class KitConfigManager {

    private static final Logger LOG = LoggerFactory.getLogger(KitConfigManager.class);

    @Getter private final Configuration defaultConfig;

    @Getter private final KitOperatorConfiguration operatorConfiguration;

    public KitConfigManager() {
        this(loadGlobalConfiguration(EnvUtils.get(EnvUtils.ENV_CONF_DIR)));
    }

    public KitConfigManager(Configuration defaultConfig) {
        this.defaultConfig = defaultConfig;
        this.operatorConfiguration = KitOperatorConfiguration.fromConfiguration(defaultConfig);
    }

    @VisibleForTesting
    protected static Configuration loadGlobalConfiguration(Optional<String> confDir) {
        if (confDir.isPresent()) {
            LOG.info("Loading operator configuration from {}", confDir.get());
            return GlobalConfiguration.loadConfiguration(confDir.get());
        }
        LOG.info("No configuration directory set, using default configuration");
        return new Configuration();
    }
}
