package dev.mars.arbiter.events;

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
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A workflow's live subscription to its trigger.
 *
 * <p>Counts the events delivered through it and can be disabled without
 * unregistering; a disabled subscription answers every event with a skipped result.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public final class EventSubscription implements EventHandler {

    private static final Logger logger = LoggerFactory.getLogger(EventSubscription.class);

    private final String id;
    private final EventTrigger trigger;
    private final EventHandler delegate;
    private final Instant createdAt = Instant.now();
    private final AtomicLong triggerCount = new AtomicLong();
    private volatile boolean enabled = true;
    private volatile Instant lastTriggered;
    private volatile String registrationId;

    EventSubscription(EventTrigger trigger, EventHandler delegate) {
        this.id = "sub_" + UUID.randomUUID();
        this.trigger = Objects.requireNonNull(trigger, "Trigger cannot be null");
        this.delegate = Objects.requireNonNull(delegate, "Handler cannot be null");
    }

    @Override
    public Future<EventProcessingResult> handle(Event event) {
        if (!enabled) {
            logger.debug("Subscription {} for workflow {} is disabled, skipping event {}",
                    id, trigger.workflowId(), event.id());
            return Future.succeededFuture(EventProcessingResult.skipped("Subscription disabled"));
        }
        triggerCount.incrementAndGet();
        lastTriggered = Instant.now();
        return delegate.handle(event);
    }

    public String getId() {
        return id;
    }

    public String getWorkflowId() {
        return trigger.workflowId();
    }

    public EventTrigger getTrigger() {
        return trigger;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isEnabled() {
        return enabled;
    }

    void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getTriggerCount() {
        return triggerCount.get();
    }

    public Instant getLastTriggered() {
        return lastTriggered;
    }

    public String getRegistrationId() {
        return registrationId;
    }

    void setRegistrationId(String registrationId) {
        this.registrationId = registrationId;
    }
}
