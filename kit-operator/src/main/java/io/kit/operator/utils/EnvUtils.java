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

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

import java.util.Optional;

/** Util to get value from environments. */
public class EnvUtils {

    public static final String ENV_CONF_DIR = "KIT_CONF_DIR";
    public static final String ENV_OPERATOR_NAMESPACE = "OPERATOR_NAMESPACE";
    public static final String ENV_WATCH_NAMESPACES = "WATCH_NAMESPACES";

    private static final String BANNER =
            "--------------------------------------------------------------------------------";

    /**
     * Get the value provided by environments.
     *
     * @param key the target key
     * @return the value value provided by environments.
     */
    public static Optional<String> get(String key) {
        return Optional.ofNullable(StringUtils.getIfBlank(System.getenv().get(key), () -> null));
    }

    /**
     * Get the value or default value provided by environments.
     *
     * @param key the target key
     * @param defaultValue the default value if key not exists.
     * @return the value or default value provided by environments.
     */
    public static String getOrDefault(String key, String defaultValue) {
        return get(key).orElse(defaultValue);
    }

    /**
     * Logs information about the environment, like code revision, current user, Java version,
     * and JVM parameters.
     *
     * @param log The logger to log the information to.
     * @param componentName The component name to mention in the log.
     * @param commandLineArgs The arguments accompanying the starting the component.
     */
    public static void logEnvironmentInfo(
            Logger log, String componentName, String[] commandLineArgs) {
        if (!log.isInfoEnabled()) {
            return;
        }
        log.info(BANNER);
        log.info(" Starting {}", componentName);
        log.info(" OS current user: {}", System.getProperty("user.name"));
        log.info(
                " JVM: {} - {}",
                System.getProperty("java.vm.name"),
                System.getProperty("java.runtime.version"));
        log.info(" Arch: {}", System.getProperty("os.arch"));
        log.info(" Maximum heap size: {} MiBytes", Runtime.getRuntime().maxMemory() >>> 20);
        log.info(" JAVA_HOME: {}", getOrDefault("JAVA_HOME", "(not set)"));
        if (commandLineArgs == null || commandLineArgs.length == 0) {
            log.info(" No Program Arguments");
        } else {
            log.info(" Program Arguments:");
            for (String s : commandLineArgs) {
                log.info("    {}", s);
            }
        }
        log.info(BANNER);
    }
}
