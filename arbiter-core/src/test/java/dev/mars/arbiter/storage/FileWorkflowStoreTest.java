package dev.mars.arbiter.storage;

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
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FileWorkflowStore Tests")
class FileWorkflowStoreTest extends AbstractWorkflowStoreTest {

    @TempDir
    Path tempDir;

    @Override
    protected WorkflowStore createStore(Vertx vertx) {
        return new FileWorkflowStore(vertx, tempDir.resolve("store"));
    }

    @Test
    @DisplayName("Workflows should be readable by a fresh store instance")
    void shouldPersistAcrossInstances(Vertx vertx, VertxTestContext ctx) {
        FileWorkflowStore reopened = new FileWorkflowStore(vertx, tempDir.resolve("store"));

        store.createWorkflow(workflow("wf/with:odd chars").toBuilder()
                        .trigger(new EventTrigger.Cron(null, "*/5 * * * *", "Europe/London"))
                        .build())
                .compose(v -> reopened.open())
                .compose(v -> reopened.listWorkflows())
                .onComplete(ctx.succeeding(all -> ctx.verify(() -> {
                    assertEquals(1, all.size());
                    assertEquals("wf/with:odd chars", all.get(0).getId());
                    assertEquals(TriggerKind.CRON, all.get(0).getTrigger().kind());
                    assertEquals("wf/with:odd chars", all.get(0).getTrigger().workflowId());
                    ctx.completeNow();
                })));
    }

    @Test
    @DisplayName("Malformed run lines should be skipped")
    void shouldSkipMalformedRunLines(VertxTestContext ctx) throws Exception {
        Path runs = tempDir.resolve("store").resolve("runs");
        Files.createDirectories(runs);
        Files.writeString(runs.resolve("wf-1.jsonl"), "{not json\n");

        store.recordRun(run("wf-1", ExecutionStatus.COMPLETED, Instant.now(), 1))
                .compose(v -> store.getRuns("wf-1", 10))
                .onComplete(ctx.succeeding(all -> ctx.verify(() -> {
                    assertEquals(1, all.size());
                    ctx.completeNow();
                })));
    }
}
