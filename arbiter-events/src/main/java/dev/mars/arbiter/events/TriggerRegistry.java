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

import dev.mars.arbiter.core.EventTrigger;
import dev.mars.arbiter.core.TriggerKind;
import dev.mars.arbiter.core.exceptions.TriggerConfigurationException;
import dev.mars.arbiter.events.cron.VertxCronScheduler;
import dev.mars.arbiter.events.trigger.CronTriggerAdapter;
import dev.mars.arbiter.events.trigger.FileWatchTriggerAdapter;
import dev.mars.arbiter.events.trigger.ManualTriggerAdapter;
import dev.mars.arbiter.events.trigger.TriggerAdapter;
import dev.mars.arbiter.events.trigger.WebhookRequest;
import dev.mars.arbiter.events.trigger.WebhookResult;
import dev.mars.arbiter.events.trigger.WebhookTriggerAdapter;
import dev.mars.arbiter.events.watch.NioFileWatchService;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Routes workflow triggers to the adapter serving their kind.
 *
 * <p>A workflow has at most one active trigger: registering a new one replaces the
 * previous registration. If the replacement is rejected, the previous trigger is
 * restored. Every registration is wrapped in an {@link EventSubscription} that
 * counts deliveries and can be disabled.
 *
 * <p>Subscription changes are serialized by a lock. The lock is never held while an
 * event is being handled.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class TriggerRegistry {

    private static final Logger logger = LoggerFactory.getLogger(TriggerRegistry.class);

    private final Map<TriggerKind, TriggerAdapter> adapters = new EnumMap<>(TriggerKind.class);
    private final Map<String, EventSubscription> subscriptions = new LinkedHashMap<>();
    private final Object lock = new Object();
    private volatile boolean running;

    public TriggerRegistry(Collection<? extends TriggerAdapter> adapters) {
        for (TriggerAdapter adapter : adapters) {
            for (TriggerKind kind : adapter.kinds()) {
                TriggerAdapter previous = this.adapters.put(kind, adapter);
                if (previous != null) {
                    throw new IllegalArgumentException("More than one adapter serves " + kind.wireName());
                }
            }
        }
    }

    /**
     * Creates a registry with the standard adapter for every trigger kind.
     */
    public static TriggerRegistry createDefault(Vertx vertx, long fileWatchDebounceMs) {
        return new TriggerRegistry(List.of(
                new ManualTriggerAdapter(),
                new CronTriggerAdapter(new VertxCronScheduler(vertx)),
                new FileWatchTriggerAdapter(vertx, new NioFileWatchService(), fileWatchDebounceMs),
                new WebhookTriggerAdapter()));
    }

    // ==================== Lifecycle ====================

    public void start() {
        synchronized (lock) {
            if (running) {
                return;
            }
            distinctAdapters().forEach(TriggerAdapter::start);
            running = true;
        }
        logger.info("Trigger registry started with adapters for {}", adapters.keySet());
    }

    /**
     * Reverses every live registration. Idempotent.
     */
    public void stop() {
        int released;
        synchronized (lock) {
            released = subscriptions.size();
            distinctAdapters().forEach(adapter -> {
                try {
                    adapter.stop();
                } catch (RuntimeException e) {
                    logger.warn("Adapter {} failed to stop: {}", adapter.getClass().getSimpleName(), e.getMessage());
                }
            });
            subscriptions.clear();
            running = false;
        }
        logger.info("Trigger registry stopped, {} subscription(s) released", released);
    }

    public boolean isRunning() {
        return running;
    }

    // ==================== Registration ====================

    /**
     * Subscribes the trigger's workflow to the trigger, replacing any trigger the
     * workflow already had.
     *
     * @throws TriggerConfigurationException when the trigger is rejected; the previous
     *                                       registration is left in place
     */
    public EventSubscription register(EventTrigger trigger, EventHandler handler)
            throws TriggerConfigurationException {
        Objects.requireNonNull(trigger, "Trigger cannot be null");
        Objects.requireNonNull(handler, "Handler cannot be null");
        String workflowId = trigger.workflowId();
        if (workflowId == null || workflowId.isBlank()) {
            throw new TriggerConfigurationException(trigger.kind(), "trigger is not bound to a workflow");
        }
        TriggerAdapter adapter = adapterFor(trigger.kind());

        synchronized (lock) {
            EventSubscription previous = subscriptions.remove(workflowId);
            if (previous != null) {
                adapterFor(previous.getTrigger().kind()).unregister(previous.getTrigger());
            }
            EventSubscription subscription = new EventSubscription(trigger, handler);
            try {
                subscription.setRegistrationId(adapter.register(trigger, subscription));
            } catch (TriggerConfigurationException e) {
                if (previous != null) {
                    restore(previous);
                }
                throw e;
            }
            subscriptions.put(workflowId, subscription);
            logger.info("Workflow {} subscribed to {} trigger ({})",
                    workflowId, trigger.kind().wireName(), subscription.getRegistrationId());
            return subscription;
        }
    }

    /**
     * Removes the registration matching the trigger. Unknown triggers are a no-op.
     *
     * @return {@code true} when a registration was removed
     */
    public boolean unregister(EventTrigger trigger) {
        Objects.requireNonNull(trigger, "Trigger cannot be null");
        synchronized (lock) {
            boolean removed = adapterFor(trigger.kind()).unregister(trigger);
            EventSubscription current = trigger.workflowId() != null ? subscriptions.get(trigger.workflowId()) : null;
            if (current != null && sameRegistration(current.getTrigger(), trigger)) {
                subscriptions.remove(trigger.workflowId());
            }
            return removed;
        }
    }

    /**
     * Removes whatever trigger the workflow is subscribed to.
     */
    public boolean unregisterWorkflow(String workflowId) {
        synchronized (lock) {
            EventSubscription current = subscriptions.remove(workflowId);
            if (current == null) {
                logger.debug("Workflow {} has no trigger to unregister", workflowId);
                return false;
            }
            return adapterFor(current.getTrigger().kind()).unregister(current.getTrigger());
        }
    }

    // ==================== Firing ====================

    public Future<EventProcessingResult> triggerManual(String workflowId, Object data) {
        return adapter(TriggerKind.MANUAL, ManualTriggerAdapter.class).trigger(workflowId, data);
    }

    public Future<WebhookResult> handleWebhook(WebhookRequest request) {
        return adapter(TriggerKind.WEBHOOK, WebhookTriggerAdapter.class).handleRequest(request);
    }

    // ==================== Subscriptions ====================

    public Optional<EventSubscription> getSubscription(String workflowId) {
        synchronized (lock) {
            return Optional.ofNullable(subscriptions.get(workflowId));
        }
    }

    public List<EventSubscription> getSubscriptions() {
        synchronized (lock) {
            return List.copyOf(subscriptions.values());
        }
    }

    public boolean enable(String workflowId) {
        return setEnabled(workflowId, true);
    }

    public boolean disable(String workflowId) {
        return setEnabled(workflowId, false);
    }

    public int activeCount() {
        return distinctAdapters().stream().mapToInt(TriggerAdapter::activeCount).sum();
    }

    public EventStats getEventStats() {
        List<EventSubscription> current = getSubscriptions();
        int enabled = (int) current.stream().filter(EventSubscription::isEnabled).count();
        long triggers = current.stream().mapToLong(EventSubscription::getTriggerCount).sum();
        return new EventStats(current.size(), enabled, triggers, activeCount());
    }

    /**
     * Returns the adapter serving the kind, cast to the expected type.
     */
    public <A extends TriggerAdapter> A adapter(TriggerKind kind, Class<A> type) {
        return type.cast(adapterFor(kind));
    }

    // ==================== Helpers ====================

    private boolean setEnabled(String workflowId, boolean enabled) {
        synchronized (lock) {
            EventSubscription subscription = subscriptions.get(workflowId);
            if (subscription == null) {
                return false;
            }
            subscription.setEnabled(enabled);
        }
        logger.info("Trigger for workflow {} {}", workflowId, enabled ? "enabled" : "disabled");
        return true;
    }

    private void restore(EventSubscription previous) {
        try {
            previous.setRegistrationId(adapterFor(previous.getTrigger().kind())
                    .register(previous.getTrigger(), previous));
            subscriptions.put(previous.getWorkflowId(), previous);
        } catch (TriggerConfigurationException e) {
            logger.error("Could not restore previous trigger for workflow {}: {}",
                    previous.getWorkflowId(), e.getMessage());
        }
    }

    private TriggerAdapter adapterFor(TriggerKind kind) {
        TriggerAdapter adapter = adapters.get(kind);
        if (adapter == null) {
            throw new IllegalStateException("No adapter registered for trigger kind " + kind.wireName());
        }
        return adapter;
    }

    private List<TriggerAdapter> distinctAdapters() {
        Set<TriggerAdapter> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<TriggerAdapter> distinct = new ArrayList<>();
        for (TriggerAdapter adapter : adapters.values()) {
            if (seen.add(adapter)) {
                distinct.add(adapter);
            }
        }
        return distinct;
    }

    private static boolean sameRegistration(EventTrigger a, EventTrigger b) {
        return a.kind() == b.kind()
                && Objects.equals(a.workflowId(), b.workflowId())
                && Objects.equals(a.registrationKey(), b.registrationKey());
    }
}
