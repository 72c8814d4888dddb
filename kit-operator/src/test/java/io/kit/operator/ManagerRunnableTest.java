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

import io.kit.operator.config.KitConfigManager;
import io.kit.operator.controller.CancellationSignal;

import org.apache.flink.configuration.Configuration;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.javaoperatorsdk.operator.Operator;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Test for {@link ManagerRunnable}. */
@EnableKubernetesMockClient(crud = true)
public class ManagerRunnableTest {

    private KubernetesClient kubernetesClient;

    @Test
    public void testRunsUntilStopSignalCompletes() throws Exception {
        var operator = new RecordingOperator(kubernetesClient);
        var manager =
                new ControllerManager(
                        new KitConfigManager(new Configuration()), kubernetesClient, List.of()) {
                    @Override
                    protected Operator createOperator() {
                        return operator;
                    }
                };
        var runnable = manager.registerControllers();
        operator.signal = manager.cancellationSignal;

        var stopSignal = new CompletableFuture<Void>();
        var running = CompletableFuture.runAsync(() -> runnable.start(stopSignal));

        assertThat(operator.started.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(runnable.awaitStopped(Duration.ofMillis(200))).isFalse();
        assertThat(operator.stopCalls).hasValue(0);
        assertThat(manager.cancellationSignal.isCancelled()).isFalse();

        stopSignal.complete(null);

        assertThat(runnable.awaitStopped(Duration.ofSeconds(10))).isTrue();
        running.get(10, TimeUnit.SECONDS);
        assertThat(operator.stopCalls).hasValue(1);
        assertThat(operator.cancelledAtStop).isTrue();
    }

    @Test
    public void testExceptionalStopSignalStopsOperator() throws Exception {
        var operator = new RecordingOperator(kubernetesClient);
        var signal = new CancellationSignal();
        operator.signal = signal;
        var runnable = new ManagerRunnable(operator, signal);

        var stopSignal = new CompletableFuture<Void>();
        stopSignal.completeExceptionally(new RuntimeException("lost leadership"));
        runnable.start(stopSignal);

        assertThat(runnable.awaitStopped(Duration.ZERO)).isTrue();
        assertThat(operator.stopCalls).hasValue(1);
        assertThat(operator.cancelledAtStop).isTrue();
    }

    @Test
    public void testCancelledStopSignalStopsOperator() throws Exception {
        var operator = new RecordingOperator(kubernetesClient);
        var runnable = new ManagerRunnable(operator, new CancellationSignal());

        var stopSignal = new CompletableFuture<Void>();
        stopSignal.cancel(true);
        runnable.start(stopSignal);

        assertThat(runnable.awaitStopped(Duration.ZERO)).isTrue();
        assertThat(operator.stopCalls).hasValue(1);
    }

    @Test
    public void testStartFailureStillStopsOperator() throws Exception {
        var operator = new RecordingOperator(kubernetesClient);
        operator.startError = new IllegalStateException("missing CRD");
        var signal = new CancellationSignal();
        var runnable = new ManagerRunnable(operator, signal);

        assertThatThrownBy(() -> runnable.start(new CompletableFuture<>()))
                .isSameAs(operator.startError);

        assertThat(runnable.awaitStopped(Duration.ZERO)).isTrue();
        assertThat(signal.isCancelled()).isTrue();
        assertThat(operator.stopCalls).hasValue(1);
    }

    /** Operator that records start and stop instead of talking to the cluster. */
    private static class RecordingOperator extends Operator {
        private final CountDownLatch started = new CountDownLatch(1);
        private final AtomicInteger stopCalls = new AtomicInteger();
        private volatile CancellationSignal signal;
        private volatile boolean cancelledAtStop;
        private RuntimeException startError;

        private RecordingOperator(KubernetesClient client) {
            super(overrider -> overrider.withKubernetesClient(client));
        }

        @Override
        public void start() {
            started.countDown();
            if (startError != null) {
                throw startError;
            }
        }

        @Override
        public void stop() {
            cancelledAtStop = signal != null && signal.isCancelled();
            stopCalls.incrementAndGet();
        }
    }
}
