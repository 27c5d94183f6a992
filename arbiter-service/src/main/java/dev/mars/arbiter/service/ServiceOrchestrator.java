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
import dev.mars.arbiter.core.exceptions.ServiceInitializationException;
import dev.mars.arbiter.service.health.HealthMonitor;
import dev.mars.arbiter.service.lifecycle.ShutdownSequence;
import dev.mars.arbiter.service.lifecycle.ShutdownSequence.Phase;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the single {@link ArbiterService} of the process.
 *
 * <p>{@link #getService()} initializes the service on first use. Initialization is
 * single flight: the first caller installs its future in an atomic slot and runs
 * the {@link ServiceFactory}; every concurrent caller receives that same future.
 * A failed attempt clears the slot before its waiters are notified, so the next
 * call starts a fresh attempt.
 *
 * <p>{@link #shutdown()} stops health monitoring, shuts the service down and clears
 * the slot so a later {@link #getService()} initializes again. Concurrent calls
 * share one shutdown.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public class ServiceOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(ServiceOrchestrator.class);

    private final Vertx vertx;
    private final ArbiterConfig config;
    private final ServiceFactory factory;
    private final Instant createdAt = Instant.now();

    private final AtomicReference<Future<ArbiterService>> serviceSlot = new AtomicReference<>();
    private final AtomicReference<Future<Void>> shutdownSlot = new AtomicReference<>();
    private volatile HealthMonitor healthMonitor;

    public ServiceOrchestrator(Vertx vertx, ArbiterConfig config, ServiceFactory factory) {
        this.vertx = Objects.requireNonNull(vertx, "vertx must not be null");
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.factory = Objects.requireNonNull(factory, "Service factory cannot be null");
    }

    public ServiceOrchestrator(Vertx vertx, ArbiterConfig config) {
        this(vertx, config, new DefaultServiceFactory());
    }

    // ==================== Initialization ====================

    /**
     * Returns the service, initializing it if needed.
     *
     * @return fails with {@link ServiceInitializationException} when initialization fails
     */
    public Future<ArbiterService> getService() {
        while (true) {
            Future<ArbiterService> current = serviceSlot.get();
            if (current != null) {
                return current;
            }
            Promise<ArbiterService> attempt = Promise.promise();
            if (serviceSlot.compareAndSet(null, attempt.future())) {
                initialize(attempt);
                return attempt.future();
            }
        }
    }

    private void initialize(Promise<ArbiterService> attempt) {
        logger.info("Initializing Arbiter service");
        Future<ArbiterService> created;
        try {
            created = factory.create(vertx, config);
        } catch (RuntimeException e) {
            created = Future.failedFuture(e);
        }
        created.onComplete(ar -> {
            if (ar.succeeded()) {
                startHealthMonitoring(ar.result());
                logger.info("Arbiter service ready");
                attempt.complete(ar.result());
            } else {
                serviceSlot.compareAndSet(attempt.future(), null);
                Throwable cause = ar.cause();
                logger.error("Arbiter service initialization failed: {}", cause.getMessage());
                attempt.fail(cause instanceof ServiceInitializationException
                        ? cause
                        : new ServiceInitializationException(cause.getMessage(), cause));
            }
        });
    }

    private void startHealthMonitoring(ArbiterService service) {
        if (!config.isHealthMonitoringEnabled()) {
            logger.debug("Health monitoring disabled");
            return;
        }
        HealthMonitor monitor = new HealthMonitor(vertx, config.getHealthIntervalMs(), service::getStatus);
        monitor.start();
        healthMonitor = monitor;
    }

    // ==================== Shutdown ====================

    /**
     * Shuts down the service if one was initialized. Idempotent and safe to call
     * before {@link #getService()}.
     *
     * @return completes once shutdown has finished; never fails
     */
    public Future<Void> shutdown() {
        Promise<Void> done = Promise.promise();
        if (!shutdownSlot.compareAndSet(null, done.future())) {
            return shutdownSlot.get();
        }
        Future<ArbiterService> current = serviceSlot.get();
        if (current == null) {
            logger.debug("Shutdown requested but the service was never initialized");
            shutdownSlot.set(null);
            done.complete();
            return done.future();
        }

        logger.info("Shutting down Arbiter");
        current.transform(ar -> {
            ShutdownSequence sequence = new ShutdownSequence(vertx, config.getShutdownHookTimeoutMs());
            HealthMonitor monitor = healthMonitor;
            if (monitor != null) {
                sequence.on(Phase.STOP_MONITORING, "health-monitor", () -> {
                    monitor.stop();
                    return Future.succeededFuture();
                });
            }
            if (ar.failed()) {
                return sequence.run();
            }
            return ar.result().shutdown(sequence);
        }).onComplete(ar -> {
            healthMonitor = null;
            serviceSlot.compareAndSet(current, null);
            shutdownSlot.set(null);
            logger.info("Arbiter shut down");
            done.complete();
        });
        return done.future();
    }

    // ==================== Status ====================

    public OrchestratorStatus getStatus() {
        Future<ArbiterService> current = serviceSlot.get();
        boolean initialized = current != null && current.succeeded();
        boolean initializing = current != null && !current.isComplete();
        boolean available = initialized && shutdownSlot.get() == null && current.result().isInitialized();
        HealthMonitor monitor = healthMonitor;
        return new OrchestratorStatus(
                initialized,
                initializing,
                available,
                monitor != null && monitor.isRunning(),
                config.getEnvironment(),
                Duration.between(createdAt, Instant.now()));
    }

    /**
     * Checks the service without initializing it.
     *
     * @return {@code true} when a service is initialized and reports its status
     */
    public Future<Boolean> validateHealth() {
        Future<ArbiterService> current = serviceSlot.get();
        if (current == null || !current.succeeded()) {
            return Future.succeededFuture(false);
        }
        return current.result().getStatus()
                .map(status -> true)
                .otherwise(err -> {
                    logger.warn("Health validation failed: {}", err.getMessage());
                    return false;
                });
    }

    public ArbiterConfig getConfig() {
        return config;
    }
}
