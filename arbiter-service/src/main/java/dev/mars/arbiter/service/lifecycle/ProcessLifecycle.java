package dev.mars.arbiter.service.lifecycle;

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntConsumer;
import java.util.function.Supplier;

/**
 * Connects the process to the orchestrator's shutdown.
 *
 * <p>A JVM shutdown hook covers SIGINT and SIGTERM; the default uncaught-exception
 * handler covers faults nobody caught. Both run the shutdown action exactly once,
 * whichever fires first. The fault path exits with status 1 once cleanup is done.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 */
public class ProcessLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(ProcessLifecycle.class);

    public static final int FAULT_EXIT_STATUS = 1;

    private final Supplier<Future<Void>> shutdownAction;
    private final long shutdownTimeoutMs;
    private final IntConsumer exit;
    private final AtomicBoolean shutdownInvoked = new AtomicBoolean(false);
    private final AtomicBoolean installed = new AtomicBoolean(false);

    public ProcessLifecycle(Supplier<Future<Void>> shutdownAction, long shutdownTimeoutMs) {
        this(shutdownAction, shutdownTimeoutMs, System::exit);
    }

    ProcessLifecycle(Supplier<Future<Void>> shutdownAction, long shutdownTimeoutMs, IntConsumer exit) {
        this.shutdownAction = Objects.requireNonNull(shutdownAction, "Shutdown action cannot be null");
        this.shutdownTimeoutMs = shutdownTimeoutMs;
        this.exit = Objects.requireNonNull(exit, "Exit cannot be null");
    }

    /**
     * Installs the shutdown hook and the default uncaught-exception handler. Idempotent.
     */
    public void install() {
        if (!installed.compareAndSet(false, true)) {
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(this::onShutdownSignal, "arbiter-shutdown"));
        Thread.setDefaultUncaughtExceptionHandler(this::onUncaughtException);
        logger.debug("Process shutdown hook and uncaught-exception handler installed");
    }

    void onShutdownSignal() {
        if (shutdownOnce("shutdown signal")) {
            logger.info("Arbiter stopped");
        }
    }

    void onUncaughtException(Thread thread, Throwable error) {
        logger.error("Uncaught exception in thread {}, shutting down", thread.getName(), error);
        fail(error);
    }

    /**
     * Shuts down after an unrecoverable fault and exits with {@value #FAULT_EXIT_STATUS}.
     */
    public void fail(Throwable error) {
        shutdownOnce("fault: " + error.getMessage());
        exit.accept(FAULT_EXIT_STATUS);
    }

    public boolean isShutdownInvoked() {
        return shutdownInvoked.get();
    }

    /**
     * Runs the shutdown action unless it already ran, waiting for it on the calling thread.
     *
     * @return {@code true} when this call ran the action
     */
    boolean shutdownOnce(String reason) {
        if (!shutdownInvoked.compareAndSet(false, true)) {
            logger.debug("Shutdown already invoked, ignoring {}", reason);
            return false;
        }
        logger.info("Shutting down Arbiter ({})", reason);
        try {
            shutdownAction.get()
                    .toCompletionStage()
                    .toCompletableFuture()
                    .get(shutdownTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for shutdown to finish");
        } catch (ExecutionException e) {
            logger.warn("Shutdown finished with errors: {}", e.getCause().getMessage());
        } catch (TimeoutException e) {
            logger.warn("Shutdown did not finish within {}ms", shutdownTimeoutMs);
        } catch (RuntimeException e) {
            logger.error("Shutdown action failed", e);
        }
        return true;
    }
}
