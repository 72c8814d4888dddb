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

package io.kit.operator.listener;

import io.kit.operator.api.listener.InfrastructureResourceListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.ServiceLoader;

/** Listener utilities. */
public class ListenerUtils {

    private static final Logger LOG = LoggerFactory.getLogger(ListenerUtils.class);

    /**
     * Load {@link InfrastructureResourceListener} implementations registered with {@link
     * ServiceLoader}.
     *
     * @return Discovered listeners.
     */
    public static Collection<InfrastructureResourceListener> discoverListeners() {
        Collection<InfrastructureResourceListener> listeners = new ArrayList<>();
        ServiceLoader.load(InfrastructureResourceListener.class)
                .forEach(
                        listener -> {
                            LOG.info(
                                    "Discovered resource listener: {}",
                                    listener.getClass().getName());
                            listeners.add(listener);
                        });
        return listeners;
    }
}
