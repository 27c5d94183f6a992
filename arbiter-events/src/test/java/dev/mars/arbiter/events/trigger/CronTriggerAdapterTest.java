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
import dev.mars.arbiter.core.TriggerKind;
import dev.mars.arbiter.core.exceptions.TriggerConfigurationException;
import dev.mars.arbiter.events.EventProcessingResult;
import dev.mars.arbiter.events.cron.CronScheduler;
import dev.mars.arbiter.events.cron.ScheduledJob;
import dev.mars.arbiter.events.cron.VertxCronScheduler;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;

import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(VertxExtension.class)
@DisplayName("CronTriggerAdapter Tests")
class CronTriggerAdapterTest {

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Invalid expression should fail synchronously without scheduling")
        void invalidExpressionFails(Vertx vertx) {
            CronTriggerAdapter adapter = new CronTriggerAdapter(new VertxCronScheduler(vertx));

            TriggerConfigurationException ex = assertThrows(TriggerConfigurationException.class,
                    () -> adapter.register(new EventTrigger.Cron("wf-1", "* * * invalid", null),
                            e -> Future.succeededFuture()));

            assertEquals(TriggerKind.CRON, ex.getKind());
            assertEquals(0, adapter.activeCount());
        }

        @Test
        @DisplayName("Invalid timezone should be rejected before scheduling")
        void invalidTimezoneFails() {
            CronScheduler scheduler = mock(CronScheduler.class);
            CronTriggerAdapter adapter = new CronTriggerAdapter(scheduler);

            assertThrows(TriggerConfigurationException.class,
                    () -> adapter.register(new EventTrigger.Cron("wf-1", "0 * * * *", "Mars/Olympus"),
                            e -> Future.succeededFuture()));

            verify(scheduler, never()).schedule(anyString(), any(), any());
            assertEquals(0, adapter.activeCount());
        }
    }

    @Nested
    @DisplayName("Firing")
    class FiringTests {

        @Test
        @DisplayName("Each tick should produce a cron event with schedule and timezone")
        void tickProducesEvent() throws Exception {
            CronScheduler scheduler = mock(CronScheduler.class);
            ScheduledJob job = mock(ScheduledJob.class);
            ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
            when(scheduler.schedule(eq("*/5 * * * *"), eq(ZoneId.of("UTC")), task.capture())).thenReturn(job);
            List<Event> received = new CopyOnWriteArrayList<>();

            CronTriggerAdapter adapter = new CronTriggerAdapter(scheduler);
            String jobId = adapter.register(new EventTrigger.Cron("wf-1", "*/5 * * * *", null), event -> {
                received.add(event);
                return Future.succeededFuture(EventProcessingResult.skipped("test"));
            });
            task.getValue().run();

            assertEquals(1, received.size());
            Event event = received.get(0);
            assertEquals("cron:*/5 * * * *", event.source());
            assertEquals(Map.of("schedule", "*/5 * * * *", "timezone", "UTC"), event.data());
            assertEquals(jobId, event.metadata().get("jobId"));
            assertEquals("wf-1", event.metadata().get("workflowId"));
        }

        @Test
        @DisplayName("Handler failure should be swallowed and keep the job armed")
        void handlerFailureIsSwallowed() throws Exception {
            CronScheduler scheduler = mock(CronScheduler.class);
            ScheduledJob job = mock(ScheduledJob.class);
            ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
            when(scheduler.schedule(anyString(), any(), task.capture())).thenReturn(job);

            CronTriggerAdapter adapter = new CronTriggerAdapter(scheduler);
            adapter.register(new EventTrigger.Cron("wf-1", "0 * * * *", "Europe/London"), event -> {
                throw new IllegalStateException("boom");
            });

            assertDoesNotThrow(() -> task.getValue().run());
            assertEquals(1, adapter.activeCount());
            verify(job, never()).cancel();
        }

        @Test
        @DisplayName("Unregister should cancel the job; stop should cancel the rest")
        void unregisterCancelsJob() throws Exception {
            CronScheduler scheduler = mock(CronScheduler.class);
            ScheduledJob first = mock(ScheduledJob.class);
            ScheduledJob second = mock(ScheduledJob.class);
            when(scheduler.schedule(anyString(), any(), any())).thenReturn(first, second);

            CronTriggerAdapter adapter = new CronTriggerAdapter(scheduler);
            adapter.register(new EventTrigger.Cron("wf-1", "0 * * * *", null), e -> Future.succeededFuture());
            adapter.register(new EventTrigger.Cron("wf-2", "0 * * * *", null), e -> Future.succeededFuture());

            assertTrue(adapter.unregister(new EventTrigger.Cron("wf-1", "0 * * * *", null)));
            verify(first).cancel();
            verify(second, never()).cancel();

            adapter.stop();
            adapter.stop();
            verify(second, times(1)).cancel();
            assertEquals(0, adapter.activeCount());
        }
    }
}
