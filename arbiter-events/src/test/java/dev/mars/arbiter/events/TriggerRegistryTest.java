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
import dev.mars.arbiter.core.ExecutionStatus;
import dev.mars.arbiter.core.TriggerKind;
import dev.mars.arbiter.core.exceptions.TriggerConfigurationException;
import dev.mars.arbiter.events.cron.CronScheduler;
import dev.mars.arbiter.events.cron.ScheduledJob;
import dev.mars.arbiter.events.trigger.CronTriggerAdapter;
import dev.mars.arbiter.events.trigger.ManualTriggerAdapter;
import dev.mars.arbiter.events.trigger.WebhookRequest;
import dev.mars.arbiter.events.trigger.WebhookResult;
import dev.mars.arbiter.events.trigger.WebhookTriggerAdapter;
import io.vertx.core.Future;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(VertxExtension.class)
@DisplayName("TriggerRegistry Tests")
class TriggerRegistryTest {

    private CronScheduler cronScheduler;
    private TriggerRegistry registry;
    private final AtomicInteger handled = new AtomicInteger();

    private final EventHandler handler = event -> {
        handled.incrementAndGet();
        return Future.succeededFuture(EventProcessingResult.executed("exec-" + handled.get(),
                ExecutionStatus.COMPLETED, null));
    };

    @BeforeEach
    void setUp() {
        cronScheduler = mock(CronScheduler.class);
        when(cronScheduler.schedule(anyString(), any(ZoneId.class), any(Runnable.class)))
                .thenAnswer(inv -> mock(ScheduledJob.class));
        registry = new TriggerRegistry(List.of(
                new ManualTriggerAdapter(),
                new CronTriggerAdapter(cronScheduler),
                new WebhookTriggerAdapter()));
        registry.start();
    }

    @Test
    @DisplayName("Should refuse two adapters for the same kind")
    void refusesDuplicateAdapters() {
        assertThrows(IllegalArgumentException.class,
                () -> new TriggerRegistry(List.of(new ManualTriggerAdapter(), new ManualTriggerAdapter())));
    }

    @Nested
    @DisplayName("Registration")
    class RegistrationTests {

        @Test
        @DisplayName("Unregistering an unknown trigger should be a no-op")
        void unregisterUnknownIsNoOp() throws Exception {
            registry.register(new EventTrigger.Manual("wf-1"), handler);

            assertFalse(registry.unregister(new EventTrigger.Cron("wf-9", "0 * * * *", null)));
            assertFalse(registry.unregister(new EventTrigger.Manual("wf-2")));

            assertEquals(1, registry.activeCount());
            assertTrue(registry.getSubscription("wf-1").isPresent());
        }

        @Test
        @DisplayName("A new trigger should replace the workflow's previous one")
        void replacesPreviousTrigger() throws Exception {
            registry.register(new EventTrigger.Manual("wf-1"), handler);
            registry.register(new EventTrigger.Cron("wf-1", "*/10 * * * *", null), handler);

            assertEquals(1, registry.activeCount());
            assertEquals(TriggerKind.CRON, registry.getSubscription("wf-1").orElseThrow().getTrigger().kind());
            assertEquals(0, registry.adapter(TriggerKind.MANUAL, ManualTriggerAdapter.class).activeCount());
        }

        @Test
        @DisplayName("A rejected replacement should keep the previous trigger")
        void rejectedReplacementRestoresPrevious(VertxTestContext ctx) throws Exception {
            doThrow(new IllegalArgumentException("bad field")).when(cronScheduler).validate(eq("nope"));
            registry.register(new EventTrigger.Manual("wf-1"), handler);

            assertThrows(TriggerConfigurationException.class,
                    () -> registry.register(new EventTrigger.Cron("wf-1", "nope", null), handler));

            assertEquals(TriggerKind.MANUAL, registry.getSubscription("wf-1").orElseThrow().getTrigger().kind());
            registry.triggerManual("wf-1", Map.of())
                    .onComplete(ctx.succeeding(result -> ctx.verify(() -> {
                        assertTrue(result.success());
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("Unregistering by workflow should remove whatever trigger it has")
        void unregisterWorkflow() throws Exception {
            registry.register(new EventTrigger.Api("wf-api", "/api/go", null), handler);

            assertTrue(registry.unregisterWorkflow("wf-api"));
            assertFalse(registry.unregisterWorkflow("wf-api"));
            assertEquals(0, registry.activeCount());
        }
    }

    @Nested
    @DisplayName("Delivery")
    class DeliveryTests {

        @Test
        @DisplayName("Disabled subscription should skip events without calling the handler")
        void disabledSkips(VertxTestContext ctx) throws Exception {
            registry.register(new EventTrigger.Manual("wf-1"), handler);
            assertTrue(registry.disable("wf-1"));

            registry.triggerManual("wf-1", null)
                    .compose(skipped -> {
                        ctx.verify(() -> {
                            assertTrue(skipped.skipped());
                            assertEquals(0, handled.get());
                        });
                        registry.enable("wf-1");
                        return registry.triggerManual("wf-1", null);
                    })
                    .onComplete(ctx.succeeding(result -> ctx.verify(() -> {
                        assertFalse(result.skipped());
                        assertEquals(1, handled.get());
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("Webhook requests should be routed through the registry")
        void routesWebhooks(VertxTestContext ctx) throws Exception {
            registry.register(new EventTrigger.Webhook("wf-hook", "/hooks/a", null, null, null), handler);

            registry.handleWebhook(new WebhookRequest("/hooks/a", "POST", null, Map.of("k", "v")))
                    .onComplete(ctx.succeeding(result -> ctx.verify(() -> {
                        assertEquals(WebhookResult.Status.ACCEPTED, result.status());
                        assertEquals(1, registry.getSubscription("wf-hook").orElseThrow().getTriggerCount());
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("Stats should count handlers, enabled handlers and deliveries")
        void stats(VertxTestContext ctx) throws Exception {
            registry.register(new EventTrigger.Manual("wf-1"), handler);
            registry.register(new EventTrigger.Manual("wf-2"), handler);
            registry.register(new EventTrigger.Cron("wf-3", "0 0 * * *", "UTC"), handler);
            registry.disable("wf-2");

            registry.triggerManual("wf-1", null)
                    .compose(r -> registry.triggerManual("wf-1", null))
                    .onComplete(ctx.succeeding(r -> ctx.verify(() -> {
                        EventStats stats = registry.getEventStats();
                        assertEquals(3, stats.totalHandlers());
                        assertEquals(2, stats.enabledHandlers());
                        assertEquals(2, stats.totalTriggers());
                        assertEquals(3, stats.activeRegistrations());
                        ctx.completeNow();
                    })));
        }
    }

    @Test
    @DisplayName("Stop should release all registrations and be idempotent")
    void stopIsIdempotent() throws Exception {
        registry.register(new EventTrigger.Manual("wf-1"), handler);
        registry.register(new EventTrigger.Cron("wf-2", "0 * * * *", null), handler);

        registry.stop();
        registry.stop();

        assertFalse(registry.isRunning());
        assertEquals(0, registry.activeCount());
        assertTrue(registry.getSubscriptions().isEmpty());
    }
}
