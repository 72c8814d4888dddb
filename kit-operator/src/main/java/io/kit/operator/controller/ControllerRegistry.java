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

package io.kit.operator.controller;

import io.kit.operator.api.ResourceKind;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/** Maps every resource kind to the one controller handling it. */
public class ControllerRegistry {

    private final Map<ResourceKind, ResourceController<?>> controllers =
            new EnumMap<>(ResourceKind.class);

    /**
     * Registers a controller.
     *
     * @throws IllegalArgumentException if a controller for the same kind is already registered
     */
    public synchronized void register(ResourceController<?> controller) {
        var kind = controller.forKind();
        var existing = controllers.putIfAbsent(kind, controller);
        if (existing != null) {
            throw new IllegalArgumentException(
                    String.format(
                            "Controller %s cannot handle %s, it is already handled by %s",
                            controller.name(), kind, existing.name()));
        }
    }

    public synchronized Optional<ResourceController<?>> get(ResourceKind kind) {
        return Optional.ofNullable(controllers.get(kind));
    }

    public synchronized Collection<ResourceController<?>> getControllers() {
        return Collections.unmodifiableCollection(controllers.values());
    }
}
