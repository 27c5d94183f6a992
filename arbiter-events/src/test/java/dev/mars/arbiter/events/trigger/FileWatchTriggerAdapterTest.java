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
import dev.mars.arbiter.core.FileEventKind;
import dev.mars.arbiter.core.exceptions.TriggerConfigurationException;
import dev.mars.arbiter.events.EventProcessingResult;
import dev.mars.arbiter.events.watch.FileChange;
import dev.mars.arbiter.events.watch.FileWatch;
import dev.mars.arbiter.events.watch.FileWatchService;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
@DisplayName("FileWatchTriggerAdapter Tests")
class FileWatchTriggerAdapterTest {

    private static final long DEBOUNCE_MS = 50;

    @TempDir
    Path root;

    private FakeWatchService watchService;
    private FileWatchTriggerAdapter adapter;
    private final List<Event> received = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp(Vertx vertx) {
        root = root.toAbsolutePath().normalize();
        watchService = new FakeWatchService();
        adapter = new FileWatchTriggerAdapter(vertx, watchService, DEBOUNCE_MS);
    }

    private void register(String pattern, Set<FileEventKind> events) throws TriggerConfigurationException {
        adapter.register(new EventTrigger.FileWatch("wf-files", root.toString(), pattern, events), event -> {
            received.add(event);
            return Future.succeededFuture(EventProcessingResult.skipped("test"));
        });
    }

    private void assertNothingFiredFor(Duration quietPeriod) {
        await().during(quietPeriod).atMost(quietPeriod.plusSeconds(2)).until(received::isEmpty);
    }

    @Nested
    @DisplayName("Event filtering")
    class FilteringTests {

        @Test
        @DisplayName("Subscription to modified should ignore creations and fire once per modification")
        void modifiedOnly() throws Exception {
            register(null, EnumSet.of(FileEventKind.MODIFIED));
            Path file = root.resolve("report.csv");

            watchService.emit(FileEventKind.CREATED, file);
            assertNothingFiredFor(Duration.ofMillis(DEBOUNCE_MS * 4));

            watchService.emit(FileEventKind.MODIFIED, file);
            await().atMost(Duration.ofSeconds(2)).until(() -> received.size() == 1);
            assertNothingFiredFor(Duration.ofMillis(DEBOUNCE_MS * 4));

            Event event = received.get(0);
            assertEquals("modified", event.metadata().get("eventType"));
            @SuppressWarnings("unchecked")
            Map<String, Object> data = (Map<String, Object>) event.data();
            assertEquals("modified", data.get("eventType"));
            assertEquals(file.toString(), data.get("filePath"));
            assertEquals("report.csv", data.get("fileName"));
            assertEquals(".csv", data.get("fileExtension"));
            assertEquals("file-watch:" + root, event.source());
            assertEquals("wf-files", event.workflowId().orElseThrow());
        }

        @Test
        @DisplayName("Hidden files and directories should be ignored")
        void hiddenEntriesIgnored() throws Exception {
            register(null, null);

            watchService.emit(FileEventKind.CREATED, root.resolve(".swap"));
            watchService.emit(FileEventKind.CREATED, root.resolve(".git").resolve("index"));
            assertNothingFiredFor(Duration.ofMillis(DEBOUNCE_MS * 4));
        }

        @Test
        @DisplayName("Glob pattern should be applied to the file name")
        void patternApplied() throws Exception {
            register("*.json", null);

            watchService.emit(FileEventKind.CREATED, root.resolve("notes.txt"));
            watchService.emit(FileEventKind.CREATED, root.resolve("nested").resolve("order.json"));

            await().atMost(Duration.ofSeconds(2)).until(() -> received.size() == 1);
            assertEquals(root.resolve("nested").resolve("order.json").toString(),
                    received.get(0).metadata().get("filePath"));
        }
    }

    @Nested
    @DisplayName("Debouncing")
    class DebounceTests {

        @Test
        @DisplayName("A burst of modifications should be coalesced into one event")
        void burstCoalesced() throws Exception {
            register(null, null);
            Path file = root.resolve("data.txt");

            for (int i = 0; i < 5; i++) {
                watchService.emit(FileEventKind.MODIFIED, file);
            }

            await().atMost(Duration.ofSeconds(2)).until(() -> received.size() == 1);
            assertNothingFiredFor(Duration.ofMillis(DEBOUNCE_MS * 4));
        }

        @Test
        @DisplayName("A modification right after creation should be reported as the creation")
        void createThenModifyIsCreate() throws Exception {
            register(null, null);
            Path file = root.resolve("fresh.txt");

            watchService.emit(FileEventKind.CREATED, file);
            watchService.emit(FileEventKind.MODIFIED, file);

            await().atMost(Duration.ofSeconds(2)).until(() -> received.size() == 1);
            assertEquals("created", received.get(0).metadata().get("eventType"));
        }

        @Test
        @DisplayName("Changes to different files should not be coalesced")
        void differentFilesSeparate() throws Exception {
            register(null, null);

            watchService.emit(FileEventKind.CREATED, root.resolve("a.txt"));
            watchService.emit(FileEventKind.CREATED, root.resolve("b.txt"));

            await().atMost(Duration.ofSeconds(2)).until(() -> received.size() == 2);
        }
    }

    @Nested
    @DisplayName("Registration")
    class RegistrationTests {

        @Test
        @DisplayName("Missing path should be rejected without opening a watch")
        void missingPathRejected() {
            assertThrows(TriggerConfigurationException.class, () -> adapter.register(
                    new EventTrigger.FileWatch("wf-files", root.resolve("absent").toString(), null, null),
                    e -> Future.succeededFuture()));

            assertNull(watchService.listener);
            assertEquals(0, adapter.activeCount());
        }

        @Test
        @DisplayName("Unregister should close the watch and drop pending changes")
        void unregisterClosesWatch() throws Exception {
            register(null, null);
            watchService.emit(FileEventKind.CREATED, root.resolve("late.txt"));

            assertTrue(adapter.unregister(new EventTrigger.FileWatch("wf-files", root.toString(), null, null)));

            assertTrue(watchService.closed);
            assertNothingFiredFor(Duration.ofMillis(DEBOUNCE_MS * 4));
        }
    }

    private static final class FakeWatchService implements FileWatchService {
        volatile Consumer<FileChange> listener;
        volatile boolean closed;

        @Override
        public FileWatch watch(Path root, Consumer<FileChange> listener) {
            this.listener = listener;
            return () -> closed = true;
        }

        void emit(FileEventKind kind, Path path) {
            listener.accept(new FileChange(kind, path));
        }
    }
}
