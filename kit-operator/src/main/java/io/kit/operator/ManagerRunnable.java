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

import io.kit.operator.controller.CancellationSignal;

import io.javaoperatorsdk.operator.Operator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/** Runs the registered controllers until a stop signal completes. */
public class ManagerRunnable {

    private static final Logger LOG = LoggerFactory.getLogger(ManagerRunnable.class);

    private final Operator operator;
    private final CancellationSignal cancellationSignal;
    private final CountDownLatch stopped = new CountDownLatch(1);

    ManagerRunnable(Operator operator, CancellationSignal cancellationSignal) {
        this.operator = operator;
        this.cancellationSignal = cancellationSignal;
    }

    /**
     * Starts the operator and blocks until {@code stopSignal} completes. In flight passes observe
     * the cancellation before the operator is stopped.
     *
     * @param stopSignal Completed, normally or exceptionally, to stop the controllers.
     */
    public void start(CompletableFuture<?> stopSignal) {
        try {
            operator.start();
            LOG.info("Controllers started, waiting for stop signal");
            stopSignal.join();
        } catch (CompletionException | CancellationException e) {
            LOG.warn("Stop signal completed exceptionally", e);
        } finally {
            LOG.info("Stopping controllers");
            cancellationSignal.cancel();
            try {
                operator.stop();
            } finally {
                stopped.countDown();
            }
        }
    }

    /**
     * Waits for {@link #start} to return.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
