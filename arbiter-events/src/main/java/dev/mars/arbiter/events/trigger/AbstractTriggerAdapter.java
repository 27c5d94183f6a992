package dev.mars.arbiter.events.trigger;

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

import dev.mars.arbiter.core.Event;
import dev.mars.arbiter.core.EventTrigger;
import dev.mars.arbiter.core.exceptions.TriggerConfigurationException;
import dev.mars.arbiter.events.EventHandler;
import dev.mars.arbiter.events.EventProcessingResult;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registration bookkeeping and event dispatch shared by the adapters.
 *
 * @param <R> the adapter's registration type
 */
public abstract class AbstractTriggerAdapter<R extends Registration> implements TriggerAdapter {

    protected final Logger logger = LoggerFactory.getLogger(getClass());
    protected final RegistrationTable<R> registrations = new RegistrationTable<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * Validates the trigger and creates its registration, arming any timers or watches.
     * Must not leave side effects behind when it throws.
     */
    protected abstract R createRegistration(String registrationId, EventTrigger trigger, EventHandler handler)
            throws TriggerConfigurationException;

    protected abstract String idPrefix();

    @Override
    public final String register(EventTrigger trigger, EventHandler handler) throws TriggerConfigurationException {
        Objects.requireNonNull(trigger, "Trigger cannot be null");
        Objects.requireNonNull(handler, "Handler cannot be null");
        if (!kinds().contains(trigger.kind())) {
            throw new TriggerConfigurationException(trigger.kind(),
                    getClass().getSimpleName() + " does not serve this trigger kind");
        }
        R registration = createRegistration(idPrefix() + "_" + UUID.randomUUID(), trigger, handler);
        registrations.add(registration);
        logger.info("Registered {} trigger {} for workflow {} ({})",
                trigger.kind().wireName(), registration.id(), trigger.workflowId(), trigger.registrationKey());
        return registration.id();
    }

    @Override
    public final boolean unregister(EventTrigger trigger) {
        Optional<R> removed = registrations.removeMatching(trigger);
        if (removed.isEmpty()) {
            logger.warn("No {} trigger registered for workflow {} ({}), nothing to unregister",
                    trigger.kind().wireName(), trigger.workflowId(), trigger.registrationKey());
            return false;
        }
        release(removed.get());
        logger.info("Unregistered {} trigger {} for workflow {}",
                trigger.kind().wireName(), removed.get().id(), trigger.workflowId());
        return true;
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            logger.info("{} started", getClass().getSimpleName());
        }
    }

    @Override
    public void stop() {
        running.set(false);
        int released = 0;
        for (R registration : registrations.removeAll()) {
            release(registration);
            released++;
        }
        logger.info("{} stopped, released {} registration(s)", getClass().getSimpleName(), released);
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int activeCount() {
        return registrations.size();
    }

    /**
     * Hands the event to the registration's handler, turning a thrown exception
     * into a failed future.
     */
    protected Future<EventProcessingResult> dispatch(R registration, Event event) {
        try {
            Future<EventProcessingResult> result = registration.handler().handle(event);
            return result != null ? result : Future.failedFuture("Handler returned no result");
        } catch (Exception e) {
            return Future.failedFuture(e);
        }
    }

    /**
     * Dispatches an automatically fired event; failures are logged and never propagate.
     */
    protected void fire(R registration, Event event) {
        logger.debug("Firing event {} from {} for workflow {}",
                event.id(), registration.id(), registration.trigger().workflowId());
        dispatch(registration, event).onFailure(err ->
                logger.error("Handler failed for event {} from {} (workflow {}): {}",
                        event.id(), registration.id(), registration.trigger().workflowId(), err.getMessage(), err));
    }

    private void release(R registration) {
        try {
            registration.release();
        } catch (RuntimeException e) {
            logger.warn("Failed to release registration {} for workflow {}: {}",
                    registration.id(), registration.trigger().workflowId(), e.getMessage());
        }
    }

    protected static void requireWorkflow(EventTrigger trigger) throws TriggerConfigurationException {
        if (trigger.workflowId() == null || trigger.workflowId().isBlank()) {
            throw new TriggerConfigurationException(trigger.kind(), "trigger is not bound to a workflow");
        }
    }
}
