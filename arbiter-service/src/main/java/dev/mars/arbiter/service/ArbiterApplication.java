package dev.mars.arbiter.service;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.arbiter.config.ArbiterConfig;
import dev.mars.arbiter.service.error.ErrorResponse;
import dev.mars.arbiter.service.error.ErrorTranslator;
import dev.mars.arbiter.service.lifecycle.ProcessLifecycle;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;

/**
 * Main entry point for the Arbiter process.
 *
 * <p>Loads configuration, initializes the service and blocks until the process is
 * asked to stop. Startup failures are reported through the {@link ErrorTranslator}
 * and end the process with a non-zero status.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 */
public final class ArbiterApplication {

    private static final Logger logger = LoggerFactory.getLogger(ArbiterApplication.class);

    private ArbiterApplication() {
    }

    public static void main(String[] args) {
        ArbiterConfig config = ArbiterConfig.load();
        config.logConfiguration();

        Vertx vertx = Vertx.vertx();
        ServiceOrchestrator orchestrator = new ServiceOrchestrator(vertx, config);
        ErrorTranslator errors = ErrorTranslator.forConfig(config);
        CountDownLatch stopped = new CountDownLatch(1);

        ProcessLifecycle lifecycle = new ProcessLifecycle(
                () -> stop(orchestrator, vertx).onComplete(ar -> stopped.countDown()),
                config.getShutdownHookTimeoutMs() * 4);
        lifecycle.install();

        try {
            ArbiterService service = orchestrator.getService()
                    .toCompletionStage()
                    .toCompletableFuture()
                    .get();
            logger.info("Arbiter started with {} trigger subscription(s)", service.getSubscriptions().size());
        } catch (ExecutionException e) {
            ErrorResponse error = errors.translate(e.getCause());
            logger.error("Arbiter failed to start [{}]: {} (requestId={})",
                    error.code(), error.message(), error.requestId());
            lifecycle.fail(e.getCause());
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }

        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static Future<Void> stop(ServiceOrchestrator orchestrator, Vertx vertx) {
        return orchestrator.shutdown().transform(ar -> vertx.close());
    }
}
