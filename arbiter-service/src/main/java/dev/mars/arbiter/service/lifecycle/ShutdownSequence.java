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
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs the shutdown of Arbiter's components as an ordered series of phases.
 *
 * <p>Shutdown sequence:
 * <ol>
 *   <li>Stop health monitoring</li>
 *   <li>Stop triggers - no new events are produced</li>
 *   <li>Drain executions still in flight</li>
 *   <li>Close storage</li>
 * </ol>
 *
 * <p>Hooks within a phase run one after another. Every hook is bounded by the hook
 * timeout; a hook that fails or times out is logged and the sequence moves on.
 * The sequence runs at most once: later calls to {@link #run()} share the first
 * run's result.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 */
public class ShutdownSequence {

    private static final Logger logger = LoggerFactory.getLogger(ShutdownSequence.class);

    /**
     * Shutdown phases executed in order.
     */
    public enum Phase {
        /** Stop the periodic health check */
        STOP_MONITORING,
        /** Release every trigger registration */
        STOP_TRIGGERS,
        /** Wait for running executions */
        DRAIN_EXECUTIONS,
        /** Close the workflow store */
        CLOSE_STORAGE
    }

    public enum State {
        PENDING,
        RUNNING,
        STOPPED
    }

    private final Vertx vertx;
    private final long hookTimeoutMs;
    private final Map<Phase, List<ShutdownHook>> hooks = new EnumMap<>(Phase.class);
    private final AtomicReference<State> state = new AtomicReference<>(State.PENDING);
    private final Promise<Void> completion = Promise.promise();

    /**
     * @param hookTimeoutMs upper bound for a single hook; 0 disables the bound
     */
    public ShutdownSequence(Vertx vertx, long hookTimeoutMs) {
        this.vertx = Objects.requireNonNull(vertx, "vertx must not be null");
        if (hookTimeoutMs < 0) {
            throw new IllegalArgumentException("Hook timeout cannot be negative: " + hookTimeoutMs);
        }
        this.hookTimeoutMs = hookTimeoutMs;
    }

    public State getState() {
        return state.get();
    }

    /**
     * Registers a hook for the given phase.
     *
     * @throws IllegalStateException when the sequence has already started
     */
    public synchronized ShutdownSequence on(Phase phase, String name, Supplier<Future<Void>> hook) {
        if (state.get() != State.PENDING) {
            throw new IllegalStateException("Shutdown already started, cannot add hook " + name);
        }
        hooks.computeIfAbsent(phase, p -> new ArrayList<>()).add(new ShutdownHook(name, hook));
        return this;
    }

    /**
     * Runs every phase in order. Idempotent.
     *
     * @return completes once all hooks have finished, failed or timed out; never fails
     */
    public Future<Void> run() {
        if (!state.compareAndSet(State.PENDING, State.RUNNING)) {
            logger.debug("Shutdown sequence already {}, sharing its completion", state.get());
            return completion.future();
        }
        Map<Phase, List<ShutdownHook>> plan;
        synchronized (this) {
            plan = new EnumMap<>(Phase.class);
            hooks.forEach((phase, list) -> plan.put(phase, List.copyOf(list)));
        }

        logger.info("Initiating shutdown (hook timeout={}ms)", hookTimeoutMs);
        Phase[] phases = Phase.values();
        Future<Void> chain = Future.succeededFuture();
        for (Phase phase : phases) {
            List<ShutdownHook> phaseHooks = plan.getOrDefault(phase, List.of());
            chain = chain.compose(v -> executePhase(phase, phases.length, phaseHooks));
        }
        chain.onComplete(ar -> {
            state.set(State.STOPPED);
            logger.info("Shutdown completed");
            completion.complete();
        });
        return completion.future();
    }

    private Future<Void> executePhase(Phase phase, int total, List<ShutdownHook> phaseHooks) {
        logger.info("Phase {}/{}: {} ({} hook(s))", phase.ordinal() + 1, total, phase, phaseHooks.size());
        Future<Void> chain = Future.succeededFuture();
        for (ShutdownHook hook : phaseHooks) {
            chain = chain.compose(v -> executeHookWithTimeout(phase, hook));
        }
        return chain;
    }

    private Future<Void> executeHookWithTimeout(Phase phase, ShutdownHook hook) {
        logger.debug("Executing shutdown hook: {}", hook.name());
        Future<Void> result;
        try {
            result = hook.hook().get();
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }
        if (result == null) {
            result = Future.succeededFuture();
        }
        if (hookTimeoutMs > 0) {
            result = bounded(hook.name(), result);
        }
        return result
                .onSuccess(v -> logger.debug("Hook completed: {}", hook.name()))
                .recover(err -> {
                    logger.warn("Hook failed in phase {}: {} - {}", phase, hook.name(), err.getMessage());
                    return Future.succeededFuture();
                });
    }

    private Future<Void> bounded(String name, Future<Void> result) {
        Promise<Void> promise = Promise.promise();
        long timerId = vertx.setTimer(hookTimeoutMs, id -> promise.tryFail(
                new TimeoutException("Hook " + name + " did not finish within " + hookTimeoutMs + "ms")));
        result.onComplete(ar -> {
            vertx.cancelTimer(timerId);
            if (ar.succeeded()) {
                promise.tryComplete();
            } else {
                promise.tryFail(ar.cause());
            }
        });
        return promise.future();
    }

    private record ShutdownHook(String name, Supplier<Future<Void>> hook) {
    }
}
