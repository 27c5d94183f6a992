package dev.mars.arbiter.service.health;

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

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Periodically runs a health check on a Vert.x timer.
 *
 * <p>The check's outcome is only logged: a failing or throwing check never
 * propagates. A check still running when the next tick arrives is not overlapped.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 */
public class HealthMonitor {

    private static final Logger logger = LoggerFactory.getLogger(HealthMonitor.class);

    private final Vertx vertx;
    private final long intervalMs;
    private final Supplier<Future<?>> healthCheck;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicInteger checks = new AtomicInteger();
    private volatile Long timerId;
    private volatile boolean probing;
    private volatile boolean healthy = true;
    private volatile Instant lastCheck;

    public HealthMonitor(Vertx vertx, long intervalMs, Supplier<Future<?>> healthCheck) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("Health check interval must be positive: " + intervalMs);
        }
        this.vertx = Objects.requireNonNull(vertx, "vertx must not be null");
        this.intervalMs = intervalMs;
        this.healthCheck = Objects.requireNonNull(healthCheck, "Health check cannot be null");
    }

    public synchronized void start() {
        if (timerId != null) {
            return;
        }
        timerId = vertx.setPeriodic(intervalMs, id -> check());
        logger.info("Health monitoring started (interval={}ms)", intervalMs);
    }

    public synchronized void stop() {
        if (timerId == null) {
            return;
        }
        vertx.cancelTimer(timerId);
        timerId = null;
        logger.info("Health monitoring stopped after {} check(s)", checks.get());
    }

    public boolean isRunning() {
        return timerId != null;
    }

    public boolean isHealthy() {
        return healthy;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public int getCheckCount() {
        return checks.get();
    }

    public Instant getLastCheck() {
        return lastCheck;
    }

    void check() {
        if (probing) {
            logger.debug("Previous health check still running, skipping this tick");
            return;
        }
        probing = true;
        Future<?> result;
        try {
            result = healthCheck.get();
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }
        result.onComplete(ar -> {
            probing = false;
            checks.incrementAndGet();
            lastCheck = Instant.now();
            if (ar.succeeded()) {
                if (!healthy) {
                    logger.info("Health check recovered after {} failure(s)", consecutiveFailures.get());
                }
                healthy = true;
                consecutiveFailures.set(0);
                logger.debug("Health check passed: {}", ar.result());
            } else {
                healthy = false;
                int failures = consecutiveFailures.incrementAndGet();
                logger.warn("Health check failed ({} in a row): {}", failures, ar.cause().getMessage());
            }
        });
    }
}
