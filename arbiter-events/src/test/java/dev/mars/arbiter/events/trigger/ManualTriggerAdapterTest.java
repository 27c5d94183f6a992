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
import dev.mars.arbiter.core.ExecutionStatus;
import dev.mars.arbiter.core.TriggerKind;
import dev.mars.arbiter.core.exceptions.TriggerConfigurationException;
import dev.mars.arbiter.core.exceptions.TriggerNotFoundException;
import dev.mars.arbiter.events.EventProcessingResult;
import io.vertx.core.Future;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
@DisplayName("ManualTriggerAdapter Tests")
class ManualTriggerAdapterTest {

    private ManualTriggerAdapter adapter;
    private final List<Event> received = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        adapter = new ManualTriggerAdapter();
        adapter.start();
    }

    @Test
    @DisplayName("Should fire an event carrying the payload and workflow id")
    void shouldFireEvent(VertxTestContext ctx) throws Exception {
        adapter.register(new EventTrigger.Manual("wf-1"), event -> {
            received.add(event);
            return Future.succeededFuture(EventProcessingResult.executed("exec-1", ExecutionStatus.COMPLETED, null));
        });

        adapter.trigger("wf-1", Map.of("x", 1))
                .onComplete(ctx.succeeding(result -> ctx.verify(() -> {
                    assertEquals("exec-1", result.executionId());
                    assertEquals(1, received.size());
                    Event event = received.get(0);
                    assertEquals(TriggerKind.MANUAL, event.type());
                    assertEquals("manual-trigger", event.source());
                    assertTrue(event.id().startsWith("manual_"));
                    assertEquals(Map.of("x", 1), event.data());
                    assertEquals("manual", event.metadata().get("triggeredBy"));
                    assertEquals("wf-1", event.workflowId().orElseThrow());
                    ctx.completeNow();
                })));
    }

    @Test
    @DisplayName("Handler failure should propagate to the invoker")
    void handlerFailurePropagates(VertxTestContext ctx) throws Exception {
        adapter.register(new EventTrigger.Manual("wf-1"), event -> {
            throw new IllegalStateException("agent offline");
        });

        adapter.trigger("wf-1", null)
                .onComplete(ctx.failing(err -> ctx.verify(() -> {
                    assertEquals("agent offline", err.getMessage());
                    assertEquals(1, adapter.activeCount());
                    ctx.completeNow();
                })));
    }

    @Test
    @DisplayName("Triggering an unregistered workflow should fail with not-found")
    void unknownWorkflowFails(VertxTestContext ctx) {
        adapter.trigger("nope", null)
                .onComplete(ctx.failing(err -> ctx.verify(() -> {
                    assertInstanceOf(TriggerNotFoundException.class, err);
                    ctx.completeNow();
                })));
    }

    @Test
    @DisplayName("Should reject a trigger without workflow binding")
    void shouldRejectUnboundTrigger() {
        assertThrows(TriggerConfigurationException.class,
                () -> adapter.register(new EventTrigger.Manual(" "), e -> Future.succeededFuture()));
        assertEquals(0, adapter.activeCount());
    }

    @Test
    @DisplayName("Unregistering a trigger that was never registered is a no-op")
    void unregisterUnknownIsNoOp() throws Exception {
        adapter.register(new EventTrigger.Manual("wf-1"), e -> Future.succeededFuture());

        assertFalse(adapter.unregister(new EventTrigger.Manual("wf-2")));
        assertEquals(1, adapter.activeCount());

        assertTrue(adapter.unregister(new EventTrigger.Manual("wf-1")));
        assertEquals(0, adapter.activeCount());
    }
}
